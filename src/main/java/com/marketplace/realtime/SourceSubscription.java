package com.marketplace.realtime;

@FunctionalInterface
public interface SourceSubscription {

    /** Idempotent. No event is delivered once this returns. */
    void cancel();
}
