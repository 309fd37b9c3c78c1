package com.marketplace.realtime;

public enum SubscriptionStatus {
    IDLE,
    CONNECTING,
    CONNECTED,
    FAILED,
    CLOSED
}
