package com.marketplace.realtime;

/** Read-only view of a handle for status endpoints. */
public record HandleSnapshot(String streamId, String filter, SubscriptionStatus status, int attempt) {

    static HandleSnapshot of(SubscriptionHandle handle) {
        return new HandleSnapshot(
                handle.getId(), handle.getFilter().toString(), handle.getStatus(), handle.getAttempt());
    }
}
