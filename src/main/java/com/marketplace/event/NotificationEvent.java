package com.marketplace.event;

import com.marketplace.notification.Notification;
import java.time.Instant;
import org.springframework.context.ApplicationEvent;

/**
 * Published for every outcome of the notification pipeline of a user session.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>RealtimeUpdatesHandler -- pushes DELIVERED notifications to the user's STOMP topic</li>
 *   <li>NotificationPersistenceService -- writes DELIVERED notifications server-side</li>
 *   <li>RealtimeMetricsService -- counts every type</li>
 * </ul>
 *
 * <p>{@code notification} is null for TRANSLATION_FAILED.
 */
public class NotificationEvent extends ApplicationEvent {

    private final NotificationEventType eventType;
    private final String userId;
    private final Notification notification;
    private final String message;
    private final Instant occurredAt;

    public NotificationEvent(
            Object source, NotificationEventType eventType, String userId, Notification notification, String message) {
        super(source);
        this.eventType = eventType;
        this.userId = userId;
        this.notification = notification;
        this.message = message;
        this.occurredAt = Instant.now();
    }

    public NotificationEventType getEventType() {
        return eventType;
    }

    public String getUserId() {
        return userId;
    }

    public Notification getNotification() {
        return notification;
    }

    public String getMessage() {
        return message;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }
}
