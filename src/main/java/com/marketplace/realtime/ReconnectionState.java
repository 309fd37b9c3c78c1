package com.marketplace.realtime;

/**
 * Session-wide retry bookkeeping. One instance per {@link SubscriptionManager}, never
 * per handle: reconnection is throttled for the whole session.
 *
 * <p>{@code retryCount} only grows between successful connections; {@link #reset()} is
 * called on a fully connected session, on {@code stop()} and on a manual reconnect.
 * Not thread-safe; the owning manager serializes access.
 */
public class ReconnectionState {

    static final long NEVER = -1L;

    private int retryCount;
    private long lastAttemptAtMillis = NEVER;

    public int getRetryCount() {
        return retryCount;
    }

    /** Monotonic millis of the last scheduled attempt, or -1 when none was made. */
    public long getLastAttemptAtMillis() {
        return lastAttemptAtMillis;
    }

    public boolean hasAttempted() {
        return lastAttemptAtMillis != NEVER;
    }

    public void recordAttempt(long nowMillis) {
        retryCount++;
        lastAttemptAtMillis = nowMillis;
    }

    public void reset() {
        retryCount = 0;
        lastAttemptAtMillis = NEVER;
    }
}
