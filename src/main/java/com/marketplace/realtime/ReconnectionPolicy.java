package com.marketplace.realtime;

import java.time.Duration;

/**
 * Decides whether and when a session may attempt to reconnect.
 *
 * <p>Backoff for attempt {@code n} (1-based): {@code min(baseDelay * 2^(n-1), maxDelay)},
 * i.e. 1s, 2s, 4s, ... capped at 30s with the default settings. Once {@code maxRetries}
 * attempts have been spent the answer is STOP until the state is reset.
 *
 * <p>Attempts are at least {@code minRetryInterval} apart. A failure reported sooner gets
 * WAIT with the remaining time, so several handles failing together cannot trigger a
 * burst of reconnects.
 *
 * <p>Side-effect free: the caller applies the decision to its {@link ReconnectionState}.
 */
public class ReconnectionPolicy {

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);
    public static final Duration DEFAULT_MIN_RETRY_INTERVAL = Duration.ofSeconds(5);

    private final int maxRetries;
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final long minRetryIntervalMs;

    public ReconnectionPolicy(int maxRetries, Duration baseDelay, Duration maxDelay, Duration minRetryInterval) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (baseDelay.isNegative() || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("delays must satisfy 0 <= baseDelay <= maxDelay");
        }
        this.maxRetries = maxRetries;
        this.baseDelayMs = baseDelay.toMillis();
        this.maxDelayMs = maxDelay.toMillis();
        this.minRetryIntervalMs = minRetryInterval.toMillis();
    }

    public static ReconnectionPolicy defaults() {
        return new ReconnectionPolicy(
                DEFAULT_MAX_RETRIES, DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY, DEFAULT_MIN_RETRY_INTERVAL);
    }

    /**
     * Evaluates the next step for the given state.
     *
     * @param state     current session retry state (not modified)
     * @param nowMillis monotonic time in milliseconds
     */
    public RetryDecision decide(ReconnectionState state, long nowMillis) {
        if (state.getRetryCount() >= maxRetries) {
            return RetryDecision.stop();
        }

        if (state.hasAttempted()) {
            long sinceLast = nowMillis - state.getLastAttemptAtMillis();
            if (sinceLast < minRetryIntervalMs) {
                return RetryDecision.waitFor(minRetryIntervalMs - sinceLast);
            }
        }

        return RetryDecision.retryAfter(computeDelay(state.getRetryCount() + 1));
    }

    /**
     * Backoff for the given 1-based attempt number.
     */
    public long computeDelay(int attempt) {
        if (attempt <= 1) {
            return Math.min(baseDelayMs, maxDelayMs);
        }
        // Past 2^31 the cap has long been reached; avoids shifting into the sign bit.
        int exponent = Math.min(attempt - 1, 31);
        long delay = baseDelayMs * (1L << exponent);
        if (delay < 0 || delay > maxDelayMs) {
            return maxDelayMs;
        }
        return delay;
    }

    public int getMaxRetries() {
        return maxRetries;
    }
}
