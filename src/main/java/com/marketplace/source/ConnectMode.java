package com.marketplace.source;

/**
 * How {@link InMemoryChangeEventSource} answers new subscriptions.
 */
public enum ConnectMode {
    /** Confirm immediately with onConnected. */
    CONFIRM,
    /** Never answer; the subscriber's connect timeout decides. */
    HANG,
    /** Refuse the subscription by throwing from subscribe(). */
    REJECT
}
