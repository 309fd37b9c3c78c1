package com.marketplace.realtime;

/**
 * Outcome of a {@link ReconnectionPolicy} evaluation.
 *
 * @param action  what the manager should do
 * @param delayMs for RETRY the backoff before re-opening; for WAIT the time left until
 *                another attempt is allowed; 0 for STOP
 */
public record RetryDecision(Action action, long delayMs) {

    public enum Action {
        RETRY,
        WAIT,
        STOP
    }

    public static RetryDecision retryAfter(long delayMs) {
        return new RetryDecision(Action.RETRY, delayMs);
    }

    public static RetryDecision waitFor(long remainingMs) {
        return new RetryDecision(Action.WAIT, remainingMs);
    }

    public static RetryDecision stop() {
        return new RetryDecision(Action.STOP, 0);
    }

    public boolean isRetry() {
        return action == Action.RETRY;
    }

    public boolean isWait() {
        return action == Action.WAIT;
    }

    public boolean isStop() {
        return action == Action.STOP;
    }
}
