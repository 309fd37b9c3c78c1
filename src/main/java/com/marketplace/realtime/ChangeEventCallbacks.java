package com.marketplace.realtime;

/** Lifecycle and data callbacks for one subscription attempt. */
public interface ChangeEventCallbacks {

    void onConnected();

    void onEvent(RawChangeEvent event);

    void onError(Throwable cause);

    /** The transport closed the subscription on purpose. */
    void onClosed();
}
