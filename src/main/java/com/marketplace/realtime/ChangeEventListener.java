package com.marketplace.realtime;

@FunctionalInterface
public interface ChangeEventListener {

    void onChangeEvent(StreamDeclaration stream, RawChangeEvent event);

    /**
     * Called by {@link SubscriptionManager} outside its lock. Listeners with side effects that
     * must not survive a stop commit them through {@code guard}.
     */
    default void onChangeEvent(StreamDeclaration stream, RawChangeEvent event, DeliveryGuard guard) {
        onChangeEvent(stream, event);
    }
}
