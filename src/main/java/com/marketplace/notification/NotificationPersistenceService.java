package com.marketplace.notification;

import com.marketplace.config.RealtimeConfig;
import com.marketplace.event.EventPublisherHelper;
import com.marketplace.event.NotificationEvent;
import com.marketplace.event.NotificationEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Best-effort server-side copy of delivered notifications.
 *
 * <p>Only DELIVERED events are written, so duplicates suppressed by the store are never
 * re-sent. Runs on the event executor; a failed write is logged and reported, and never
 * touches the in-memory store. Disabled unless
 * {@code marketplace.realtime.persistence.enabled=true}.
 */
@Service
public class NotificationPersistenceService {

    private static final Logger log = LoggerFactory.getLogger(NotificationPersistenceService.class);

    private final NotificationCreator notificationCreator;
    private final EventPublisherHelper eventPublisherHelper;
    private final boolean enabled;

    public NotificationPersistenceService(
            NotificationCreator notificationCreator,
            EventPublisherHelper eventPublisherHelper,
            RealtimeConfig realtimeConfig) {
        this.notificationCreator = notificationCreator;
        this.eventPublisherHelper = eventPublisherHelper;
        this.enabled = realtimeConfig.getPersistence().isEnabled();
    }

    @Async("eventExecutor")
    @EventListener
    public void onNotificationEvent(NotificationEvent event) {
        if (!enabled || event.getEventType() != NotificationEventType.DELIVERED) {
            return;
        }
        Notification notification = event.getNotification();
        try {
            notificationCreator.persist(notification);
        } catch (RuntimeException e) {
            log.warn("Server-side copy of notification {} for {} not written: {}",
                    notification.getId(), event.getUserId(), e.getMessage());
            eventPublisherHelper.publishPersistenceFailed(this, event.getUserId(), notification, e.getMessage());
        }
    }

    public boolean isEnabled() {
        return enabled;
    }
}
