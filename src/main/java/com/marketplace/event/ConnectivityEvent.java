package com.marketplace.event;

import com.marketplace.realtime.ConnectivityState;
import java.time.Instant;
import org.springframework.context.ApplicationEvent;

/**
 * Published when the aggregate connectivity of a user session changes.
 *
 * <p>OFFLINE means retries are exhausted; the frontend shows the muted indicator and offers
 * a manual reconnect.
 */
public class ConnectivityEvent extends ApplicationEvent {

    private final String userId;
    private final ConnectivityState previousState;
    private final ConnectivityState newState;
    private final int retryCount;
    private final Instant occurredAt;

    public ConnectivityEvent(
            Object source,
            String userId,
            ConnectivityState previousState,
            ConnectivityState newState,
            int retryCount) {
        super(source);
        this.userId = userId;
        this.previousState = previousState;
        this.newState = newState;
        this.retryCount = retryCount;
        this.occurredAt = Instant.now();
    }

    public String getUserId() {
        return userId;
    }

    public ConnectivityState getPreviousState() {
        return previousState;
    }

    public ConnectivityState getNewState() {
        return newState;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }
}
