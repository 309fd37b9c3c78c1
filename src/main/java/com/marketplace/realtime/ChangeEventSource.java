package com.marketplace.realtime;

/**
 * Server-pushed stream of typed change events, filtered by subscriber identity.
 *
 * <p>Contract for implementations:
 * <ul>
 *   <li>{@link ChangeEventCallbacks#onEvent} is never invoked after the returned
 *       {@link SourceSubscription#cancel()} has returned.</li>
 *   <li>At most one of {@code onConnected} / {@code onError} is invoked per call to
 *       {@link #subscribe}.</li>
 *   <li>Events of one subscription are delivered in transport order, one at a time.</li>
 * </ul>
 *
 * <p>Implementations may invoke callbacks synchronously from within {@code subscribe}.
 */
public interface ChangeEventSource {

    /**
     * Opens a filtered subscription.
     *
     * @throws com.marketplace.exception.ChangeEventSourceException when the subscription
     *         cannot even be requested (the caller treats it as a failed attempt)
     */
    SourceSubscription subscribe(
            String streamId, StreamDeclaration declaration, SubscriptionFilter filter, ChangeEventCallbacks callbacks);
}
