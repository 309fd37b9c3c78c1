package com.marketplace.realtime;

import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One logical subscription (one filtered stream) owned by a {@link SubscriptionManager}.
 *
 * <p>Each call to {@link #beginAttempt()} starts a new connection attempt and bumps the
 * attempt number. Callbacks registered with the source carry the attempt number they were
 * created for, so a late callback from a previous attempt is recognised and ignored.
 *
 * <p>Not thread-safe on its own: every method is called with the manager's lock held.
 */
public class SubscriptionHandle {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionHandle.class);

    private final StreamBinding binding;
    private final SubscriptionFilter filter;

    private SubscriptionStatus status = SubscriptionStatus.IDLE;
    private int attempt;
    private SourceSubscription sourceSubscription;
    private ScheduledFuture<?> connectTimeout;

    SubscriptionHandle(StreamBinding binding, SubscriptionFilter filter) {
        this.binding = binding;
        this.filter = filter;
    }

    public String getId() {
        return binding.declaration().getId();
    }

    public StreamDeclaration getDeclaration() {
        return binding.declaration();
    }

    ChangeEventListener getListener() {
        return binding.listener();
    }

    public SubscriptionFilter getFilter() {
        return filter;
    }

    public SubscriptionStatus getStatus() {
        return status;
    }

    public int getAttempt() {
        return attempt;
    }

    public boolean isConnected() {
        return status == SubscriptionStatus.CONNECTED;
    }

    boolean isCurrentAttempt(int candidate) {
        return attempt == candidate;
    }

    int beginAttempt() {
        attempt++;
        transitionTo(SubscriptionStatus.CONNECTING);
        return attempt;
    }

    void attach(SourceSubscription subscription) {
        this.sourceSubscription = subscription;
    }

    void armConnectTimeout(ScheduledFuture<?> timeout) {
        cancelConnectTimeout();
        this.connectTimeout = timeout;
    }

    void cancelConnectTimeout() {
        if (connectTimeout != null) {
            connectTimeout.cancel(false);
            connectTimeout = null;
        }
    }

    void markConnected() {
        cancelConnectTimeout();
        transitionTo(SubscriptionStatus.CONNECTED);
    }

    void markFailed() {
        cancelConnectTimeout();
        transitionTo(SubscriptionStatus.FAILED);
    }

    void markClosed() {
        cancelConnectTimeout();
        transitionTo(SubscriptionStatus.CLOSED);
    }

    /**
     * Cancels the source subscription, if any. The handle keeps its status; callers
     * decide whether the release is a teardown or a prelude to another attempt.
     */
    void release() {
        cancelConnectTimeout();
        SourceSubscription subscription = this.sourceSubscription;
        this.sourceSubscription = null;
        if (subscription != null) {
            try {
                subscription.cancel();
            } catch (RuntimeException e) {
                log.warn("Error cancelling subscription {} ({}): {}", getId(), filter, e.getMessage());
            }
        }
    }

    private void transitionTo(SubscriptionStatus next) {
        if (status != next) {
            log.debug("Subscription {} ({}): {} -> {}", getId(), filter, status, next);
            status = next;
        }
    }

    @Override
    public String toString() {
        return "SubscriptionHandle{" + getId() + ", " + filter + ", " + status + ", attempt=" + attempt + "}";
    }
}
