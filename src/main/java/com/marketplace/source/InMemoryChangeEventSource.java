package com.marketplace.source;

import com.marketplace.exception.ChangeEventSourceException;
import com.marketplace.realtime.ChangeEventCallbacks;
import com.marketplace.realtime.ChangeEventSource;
import com.marketplace.realtime.RawChangeEvent;
import com.marketplace.realtime.SourceSubscription;
import com.marketplace.realtime.StreamDeclaration;
import com.marketplace.realtime.SubscriptionFilter;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-process change stream. Events are injected with {@link #publish(RawChangeEvent)} and
 * delivered synchronously, on the publishing thread, to every live subscription whose
 * entity, operations and filter match.
 *
 * <p>Failure injection for operators and tests:
 * <ul>
 *   <li>{@link #failStream} -- reports onError and drops the matching subscriptions</li>
 *   <li>{@link #closeStream} -- reports onClosed and drops the matching subscriptions</li>
 *   <li>{@link #setConnectMode} -- confirm, hang or reject new subscriptions</li>
 * </ul>
 *
 * <p>Cancelled subscriptions are skipped by every later publish. A delivery already in
 * progress on another thread when {@code cancel()} is called can still reach its callbacks;
 * the subscriber is expected to drop events for attempts it has abandoned.
 */
@Component
public class InMemoryChangeEventSource implements ChangeEventSource {

    private static final Logger log = LoggerFactory.getLogger(InMemoryChangeEventSource.class);

    private final AtomicLong sequence = new AtomicLong();
    private final List<Registration> registrations = new CopyOnWriteArrayList<>();

    private volatile ConnectMode connectMode = ConnectMode.CONFIRM;

    @Override
    public SourceSubscription subscribe(
            String streamId, StreamDeclaration declaration, SubscriptionFilter filter, ChangeEventCallbacks callbacks) {
        ConnectMode mode = connectMode;
        if (mode == ConnectMode.REJECT) {
            throw new ChangeEventSourceException("Change stream unavailable, subscription " + streamId + " refused");
        }

        Registration registration =
                new Registration(sequence.incrementAndGet(), streamId, declaration, filter, callbacks);
        registrations.add(registration);
        log.debug("Subscription #{} opened: {} ({})", registration.id, streamId, filter);

        if (mode == ConnectMode.CONFIRM) {
            registration.confirmed = true;
            callbacks.onConnected();
        }
        return registration;
    }

    /**
     * Delivers the event to every matching subscription.
     *
     * @return number of subscriptions the event was delivered to
     */
    public int publish(RawChangeEvent event) {
        int delivered = 0;
        for (Registration registration : registrations) {
            if (registration.matches(event)) {
                registration.callbacks.onEvent(event);
                delivered++;
            }
        }
        log.debug("Published {} {} to {} subscriptions", event.getEntity(), event.getOperation(), delivered);
        return delivered;
    }

    /**
     * Simulates a transport error on the matching subscriptions.
     *
     * @param streamId    stream to fail
     * @param filterValue only subscriptions scoped to this value, or null for all
     * @return number of subscriptions failed
     */
    public int failStream(String streamId, String filterValue) {
        return terminate(streamId, filterValue, registration -> registration.callbacks.onError(
                new ChangeEventSourceException("Injected failure on stream " + streamId)));
    }

    /**
     * Simulates a server-initiated close on the matching subscriptions.
     */
    public int closeStream(String streamId, String filterValue) {
        return terminate(streamId, filterValue, registration -> registration.callbacks.onClosed());
    }

    /**
     * Confirms subscriptions left pending by {@link ConnectMode#HANG}.
     */
    public int confirmPending() {
        int confirmed = 0;
        for (Registration registration : registrations) {
            if (!registration.confirmed && !registration.cancelled) {
                registration.confirmed = true;
                registration.callbacks.onConnected();
                confirmed++;
            }
        }
        return confirmed;
    }

    public void setConnectMode(ConnectMode connectMode) {
        log.info("Change stream connect mode: {} -> {}", this.connectMode, connectMode);
        this.connectMode = connectMode;
    }

    public ConnectMode getConnectMode() {
        return connectMode;
    }

    public List<ActiveSubscription> activeSubscriptions() {
        return registrations.stream()
                .filter(r -> !r.cancelled)
                .map(r -> new ActiveSubscription(r.id, r.streamId, r.filter, r.confirmed))
                .toList();
    }

    private int terminate(String streamId, String filterValue, Consumer<Registration> signal) {
        Predicate<Registration> selected = r -> !r.cancelled
                && r.streamId.equals(streamId)
                && (filterValue == null || filterValue.equals(r.filter.value()));
        List<Registration> targets = registrations.stream().filter(selected).toList();
        for (Registration registration : targets) {
            registration.cancelled = true;
            registrations.remove(registration);
            signal.accept(registration);
        }
        log.info("Terminated {} subscriptions on stream {} (filter value {})", targets.size(), streamId, filterValue);
        return targets.size();
    }

    private final class Registration implements SourceSubscription {

        private final long id;
        private final String streamId;
        private final StreamDeclaration declaration;
        private final SubscriptionFilter filter;
        private final ChangeEventCallbacks callbacks;

        private volatile boolean confirmed;
        private volatile boolean cancelled;

        private Registration(
                long id,
                String streamId,
                StreamDeclaration declaration,
                SubscriptionFilter filter,
                ChangeEventCallbacks callbacks) {
            this.id = id;
            this.streamId = streamId;
            this.declaration = declaration;
            this.filter = filter;
            this.callbacks = callbacks;
        }

        private boolean matches(RawChangeEvent event) {
            return !cancelled
                    && event.getEntity() == declaration.getEntity()
                    && declaration.accepts(event.getOperation())
                    && filter.matches(event.currentRow());
        }

        @Override
        public void cancel() {
            if (!cancelled) {
                cancelled = true;
                registrations.remove(this);
                log.debug("Subscription #{} cancelled: {} ({})", id, streamId, filter);
            }
        }
    }
}
