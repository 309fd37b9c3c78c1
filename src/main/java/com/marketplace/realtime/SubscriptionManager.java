package com.marketplace.realtime;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

/**
 * Owns the realtime subscriptions of one user session.
 *
 * <p>Opens one {@link SubscriptionHandle} per {@link StreamBinding}, routes incoming change
 * events to the binding's listener, and recovers from transport failures using the
 * {@link ReconnectionPolicy}. The aggregate {@link ConnectivityState} is CONNECTED only while
 * every handle is connected.
 *
 * <p>Lifecycle:
 * <ul>
 *   <li>{@link #start()} -- idempotent while connecting or connected; no-op without a user</li>
 *   <li>{@link #stop()} -- cancels timers and subscriptions; safe to repeat</li>
 *   <li>{@link #reconnect()} -- clears the retry budget, then starts again</li>
 * </ul>
 *
 * <p>Failure handling distinguishes intentional from accidental loss: an error or a connect
 * timeout (no CONNECTED within {@code connectTimeout}) schedules a reconnect, while a
 * transport-initiated close does not.
 *
 * <p>Thread safety: every state transition happens under one lock. Source callbacks and
 * timer tasks capture the session epoch (bumped by start/stop) and the handle attempt they
 * belong to; anything stale is dropped before it can touch state. Retry timers additionally
 * carry a ticket that is invalidated whenever the pending retry is cancelled, so a timer that
 * already fired cannot undo a connection that completed in the meantime. Stream listeners run
 * outside the lock and commit their results through a {@link DeliveryGuard}, which re-checks
 * the epoch and attempt under the lock.
 */
public class SubscriptionManager {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionManager.class);

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final Object lock = new Object();

    private final ChangeEventSource changeEventSource;
    private final IdentityProvider identityProvider;
    private final ReconnectionPolicy reconnectionPolicy;
    private final TaskScheduler taskScheduler;
    private final List<StreamBinding> bindings;
    private final Duration connectTimeout;

    private final List<ConnectivityListener> connectivityListeners = new CopyOnWriteArrayList<>();
    private final ReconnectionState reconnectionState = new ReconnectionState();
    private final List<SubscriptionHandle> handles = new ArrayList<>();

    private ConnectivityState connectivity = ConnectivityState.IDLE;
    private boolean opening;
    private long epoch;
    private String userId;

    private ScheduledFuture<?> pendingRetry;
    private long retryTicket;

    public SubscriptionManager(
            ChangeEventSource changeEventSource,
            IdentityProvider identityProvider,
            ReconnectionPolicy reconnectionPolicy,
            TaskScheduler taskScheduler,
            List<StreamBinding> bindings,
            Duration connectTimeout) {
        if (bindings.isEmpty()) {
            throw new IllegalArgumentException("At least one stream binding is required");
        }
        this.changeEventSource = changeEventSource;
        this.identityProvider = identityProvider;
        this.reconnectionPolicy = reconnectionPolicy;
        this.taskScheduler = taskScheduler;
        this.bindings = List.copyOf(bindings);
        this.connectTimeout = connectTimeout;
    }

    /**
     * Opens every declared stream for the current user.
     *
     * <p>Does nothing while a connection is being established or already established, and
     * nothing when the identity provider reports no user.
     */
    public void start() {
        synchronized (lock) {
            if (isConnecting() || connectivity == ConnectivityState.CONNECTED) {
                log.debug("Realtime start ignored: already {} (retry pending={})", connectivity, pendingRetry != null);
                return;
            }
            openAll();
        }
    }

    // Lock held. Replaces any leftover handles with fresh ones and opens them all.
    private void openAll() {
        if (connectivity == ConnectivityState.CONNECTED) {
            return;
        }

        String currentUser = identityProvider.currentUserId();
        if (currentUser == null || currentUser.isBlank()) {
            log.info("No signed-in user, realtime subscriptions not started");
            return;
        }

        // Leftovers from an OFFLINE session are replaced, never reused
        cancelPendingRetry();
        teardownHandles();

        epoch++;
        userId = currentUser;
        for (StreamBinding binding : bindings) {
            handles.add(new SubscriptionHandle(binding, binding.declaration().filterFor(currentUser)));
        }

        log.info("Starting {} realtime subscriptions for user {} (epoch {})", handles.size(), userId, epoch);
        updateConnectivity(ConnectivityState.CONNECTING);

        long sessionEpoch = epoch;
        opening = true;
        try {
            for (SubscriptionHandle handle : List.copyOf(handles)) {
                if (sessionEpoch != epoch) {
                    // A synchronous callback stopped or restarted the session mid-loop
                    return;
                }
                openHandle(handle, sessionEpoch);
            }
        } finally {
            opening = false;
        }
    }

    /**
     * Tears down all subscriptions and pending timers. Callbacks that fire afterwards are
     * ignored. Safe to call repeatedly and before {@link #start()}.
     */
    public void stop() {
        synchronized (lock) {
            epoch++;
            cancelPendingRetry();
            int closed = teardownHandles();
            reconnectionState.reset();
            if (closed > 0) {
                log.info("Stopped realtime subscriptions for user {} ({} handles closed)", userId, closed);
            }
            userId = null;
            updateConnectivity(ConnectivityState.IDLE);
        }
    }

    /**
     * Manual recovery: resets the retry budget and starts again. This is the only way out
     * of OFFLINE short of stop/start.
     */
    public void reconnect() {
        synchronized (lock) {
            log.info("Manual reconnect requested (state={}, retries spent={})",
                    connectivity, reconnectionState.getRetryCount());
            cancelPendingRetry();
            reconnectionState.reset();
            openAll();
        }
    }

    /**
     * Registers a connectivity listener.
     *
     * @return removes the listener; safe to call more than once
     */
    public Runnable addConnectivityListener(ConnectivityListener listener) {
        connectivityListeners.add(listener);
        return () -> connectivityListeners.remove(listener);
    }

    public ConnectivityState getConnectivity() {
        synchronized (lock) {
            return connectivity;
        }
    }

    public boolean isConnected() {
        return getConnectivity() == ConnectivityState.CONNECTED;
    }

    public int getRetryCount() {
        synchronized (lock) {
            return reconnectionState.getRetryCount();
        }
    }

    public long getEpoch() {
        synchronized (lock) {
            return epoch;
        }
    }

    public boolean isRetryPending() {
        synchronized (lock) {
            return pendingRetry != null;
        }
    }

    public String getUserId() {
        synchronized (lock) {
            return userId;
        }
    }

    public List<HandleSnapshot> getHandles() {
        synchronized (lock) {
            return handles.stream().map(HandleSnapshot::of).toList();
        }
    }

    // ---- Handle lifecycle (lock held) ----

    private void openHandle(SubscriptionHandle handle, long sessionEpoch) {
        int attempt = handle.beginAttempt();
        handle.armConnectTimeout(taskScheduler.schedule(
                () -> onConnectTimeout(handle, sessionEpoch, attempt), instantAfter(connectTimeout.toMillis())));

        SourceSubscription subscription;
        try {
            subscription = changeEventSource.subscribe(
                    handle.getId(),
                    handle.getDeclaration(),
                    handle.getFilter(),
                    new HandleCallbacks(handle, sessionEpoch, attempt));
        } catch (RuntimeException e) {
            log.warn("Could not open subscription {} ({}): {}", handle.getId(), handle.getFilter(), e.getMessage());
            onHandleFailure(handle, e);
            return;
        }

        boolean live = !isStale(handle, sessionEpoch, attempt)
                && (handle.getStatus() == SubscriptionStatus.CONNECTING
                        || handle.getStatus() == SubscriptionStatus.CONNECTED);
        if (live) {
            handle.attach(subscription);
        } else if (subscription != null) {
            // Failed, closed or superseded while subscribe() was still on the stack
            cancelQuietly(handle, subscription);
        }
    }

    private void onHandleConnected(SubscriptionHandle handle) {
        if (handle.isConnected()) {
            return;
        }
        handle.markConnected();
        log.info("Subscribed to {} ({})", handle.getId(), handle.getFilter());

        if (allHandlesConnected()) {
            cancelPendingRetry();
            reconnectionState.reset();
            updateConnectivity(ConnectivityState.CONNECTED);
        }
    }

    private void onHandleFailure(SubscriptionHandle handle, Throwable cause) {
        SubscriptionStatus status = handle.getStatus();
        if (status == SubscriptionStatus.FAILED || status == SubscriptionStatus.CLOSED) {
            return;
        }
        handle.markFailed();
        handle.release();
        log.warn("Subscription {} ({}) failed: {} - will attempt reconnection",
                handle.getId(), handle.getFilter(), describe(cause));

        if (connectivity != ConnectivityState.OFFLINE) {
            updateConnectivity(ConnectivityState.DISCONNECTED);
        }
        scheduleReconnect();
    }

    private void onHandleClosed(SubscriptionHandle handle) {
        if (handle.getStatus() == SubscriptionStatus.CLOSED) {
            return;
        }
        handle.markClosed();
        handle.release();
        log.info("Subscription {} ({}) closed by transport, not reconnecting", handle.getId(), handle.getFilter());

        if (connectivity == ConnectivityState.CONNECTED || connectivity == ConnectivityState.CONNECTING) {
            updateConnectivity(ConnectivityState.DISCONNECTED);
        }
    }

    private void onConnectTimeout(SubscriptionHandle handle, long sessionEpoch, int attempt) {
        synchronized (lock) {
            if (isStale(handle, sessionEpoch, attempt) || handle.getStatus() != SubscriptionStatus.CONNECTING) {
                return;
            }
            onHandleFailure(
                    handle,
                    new TimeoutException("Subscription not confirmed within " + connectTimeout.toMillis() + "ms"));
        }
    }

    // Lock NOT held: listeners may block on I/O.
    private void dispatch(SubscriptionHandle handle, RawChangeEvent event, DeliveryGuard guard) {
        StreamDeclaration declaration = handle.getDeclaration();
        if (event.getEntity() != declaration.getEntity() || !declaration.accepts(event.getOperation())) {
            log.debug("Ignoring {} {} on stream {}", event.getEntity(), event.getOperation(), handle.getId());
            return;
        }
        try {
            handle.getListener().onChangeEvent(declaration, event, guard);
        } catch (RuntimeException e) {
            // One bad event must not take the subscription down
            log.error("Listener for stream {} failed on {} {}: {}",
                    handle.getId(), event.getEntity(), event.getOperation(), e.getMessage(), e);
        }
    }

    // ---- Reconnection (lock held) ----

    private void scheduleReconnect() {
        if (pendingRetry != null) {
            log.debug("Reconnect already scheduled, coalescing failure signal");
            return;
        }

        long now = taskScheduler.getClock().millis();
        RetryDecision decision = reconnectionPolicy.decide(reconnectionState, now);

        switch (decision.action()) {
            case STOP -> {
                log.warn("Maximum retry attempts ({}) reached for user {}. Stopping reconnection attempts.",
                        reconnectionPolicy.getMaxRetries(), userId);
                updateConnectivity(ConnectivityState.OFFLINE);
            }
            case WAIT -> {
                log.debug("Retry attempt too soon, re-evaluating in {}ms", decision.delayMs());
                schedulePending(decision.delayMs(), false);
            }
            case RETRY -> {
                reconnectionState.recordAttempt(now);
                log.info("Retrying connection (attempt {}/{}) in {}ms",
                        reconnectionState.getRetryCount(), reconnectionPolicy.getMaxRetries(), decision.delayMs());
                schedulePending(decision.delayMs(), true);
            }
        }
    }

    private void schedulePending(long delayMs, boolean reopen) {
        long ticket = ++retryTicket;
        long sessionEpoch = epoch;
        pendingRetry = taskScheduler.schedule(
                () -> onRetryTimer(sessionEpoch, ticket, reopen), instantAfter(delayMs));
    }

    private void onRetryTimer(long sessionEpoch, long ticket, boolean reopen) {
        synchronized (lock) {
            if (sessionEpoch != epoch || ticket != retryTicket || pendingRetry == null) {
                log.debug("Discarding stale retry timer (epoch {}, ticket {})", sessionEpoch, ticket);
                return;
            }
            pendingRetry = null;

            if (!reopen) {
                scheduleReconnect();
                return;
            }

            List<SubscriptionHandle> toReopen =
                    handles.stream().filter(h -> !h.isConnected()).toList();
            if (toReopen.isEmpty()) {
                return;
            }

            updateConnectivity(ConnectivityState.CONNECTING);
            for (SubscriptionHandle handle : toReopen) {
                if (sessionEpoch != epoch) {
                    return;
                }
                handle.release();
                openHandle(handle, sessionEpoch);
            }
        }
    }

    private void cancelPendingRetry() {
        if (pendingRetry != null) {
            pendingRetry.cancel(false);
            pendingRetry = null;
        }
        retryTicket++;
    }

    // ---- Helpers (lock held) ----

    private int teardownHandles() {
        int count = handles.size();
        for (SubscriptionHandle handle : handles) {
            handle.release();
            handle.markClosed();
        }
        handles.clear();
        return count;
    }

    private boolean isStale(SubscriptionHandle handle, long sessionEpoch, int attempt) {
        return sessionEpoch != epoch || !handle.isCurrentAttempt(attempt);
    }

    private boolean isDeliverable(SubscriptionHandle handle, long sessionEpoch, int attempt) {
        SubscriptionStatus status = handle.getStatus();
        return !isStale(handle, sessionEpoch, attempt)
                && (status == SubscriptionStatus.CONNECTING || status == SubscriptionStatus.CONNECTED);
    }

    private boolean allHandlesConnected() {
        return !handles.isEmpty() && handles.stream().allMatch(SubscriptionHandle::isConnected);
    }

    /** Derived from live state: a start in progress, a handle awaiting confirmation, or a pending retry. */
    private boolean isConnecting() {
        return opening
                || pendingRetry != null
                || handles.stream().anyMatch(h -> h.getStatus() == SubscriptionStatus.CONNECTING);
    }

    private void updateConnectivity(ConnectivityState next) {
        if (connectivity == next) {
            return;
        }
        ConnectivityState previous = connectivity;
        connectivity = next;
        log.info("Realtime connectivity for user {}: {} -> {}", userId, previous, next);

        for (ConnectivityListener listener : connectivityListeners) {
            try {
                listener.onConnectivityChanged(previous, next);
            } catch (RuntimeException e) {
                log.error("Connectivity listener failed: {}", e.getMessage(), e);
            }
        }
    }

    private Instant instantAfter(long delayMs) {
        Clock clock = taskScheduler.getClock();
        return clock.instant().plusMillis(delayMs);
    }

    private void cancelQuietly(SubscriptionHandle handle, SourceSubscription subscription) {
        try {
            subscription.cancel();
        } catch (RuntimeException e) {
            log.warn("Error cancelling subscription {}: {}", handle.getId(), e.getMessage());
        }
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    /**
     * Source callbacks bound to one attempt of one handle.
     */
    private final class HandleCallbacks implements ChangeEventCallbacks {

        private final SubscriptionHandle handle;
        private final long sessionEpoch;
        private final int attempt;

        private HandleCallbacks(SubscriptionHandle handle, long sessionEpoch, int attempt) {
            this.handle = handle;
            this.sessionEpoch = sessionEpoch;
            this.attempt = attempt;
        }

        @Override
        public void onConnected() {
            synchronized (lock) {
                if (!isStale(handle, sessionEpoch, attempt)) {
                    onHandleConnected(handle);
                }
            }
        }

        @Override
        public void onEvent(RawChangeEvent event) {
            synchronized (lock) {
                if (!isDeliverable(handle, sessionEpoch, attempt)) {
                    return;
                }
            }
            dispatch(handle, event, this::runIfCurrent);
        }

        private boolean runIfCurrent(Runnable action) {
            synchronized (lock) {
                if (!isDeliverable(handle, sessionEpoch, attempt)) {
                    log.debug("Subscription {} superseded while its event was processed, dropping result", handle.getId());
                    return false;
                }
                action.run();
                return true;
            }
        }

        @Override
        public void onError(Throwable cause) {
            synchronized (lock) {
                if (!isStale(handle, sessionEpoch, attempt)) {
                    onHandleFailure(handle, cause);
                }
            }
        }

        @Override
        public void onClosed() {
            synchronized (lock) {
                if (!isStale(handle, sessionEpoch, attempt)) {
                    onHandleClosed(handle);
                }
            }
        }
    }
}
