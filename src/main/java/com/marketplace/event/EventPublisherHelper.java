package com.marketplace.event;

import com.marketplace.notification.Notification;
import com.marketplace.notification.NotificationKind;
import com.marketplace.realtime.ChangeOperation;
import com.marketplace.realtime.ConnectivityState;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher} for the realtime
 * events.
 *
 * <p>All methods are non-blocking. Delivery depends on the listener: synchronous
 * {@code @EventListener} or {@code @Async @EventListener}.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Notifications ----

    public void publishNotificationDelivered(Object source, String userId, Notification notification) {
        applicationEventPublisher.publishEvent(
                new NotificationEvent(source, NotificationEventType.DELIVERED, userId, notification, null));
    }

    public void publishNotificationDuplicate(Object source, String userId, Notification notification) {
        applicationEventPublisher.publishEvent(
                new NotificationEvent(source, NotificationEventType.DUPLICATE, userId, notification, null));
    }

    public void publishTranslationFailed(Object source, String userId, String message) {
        applicationEventPublisher.publishEvent(
                new NotificationEvent(source, NotificationEventType.TRANSLATION_FAILED, userId, null, message));
    }

    public void publishPersistenceFailed(Object source, String userId, Notification notification, String message) {
        applicationEventPublisher.publishEvent(new NotificationEvent(
                source, NotificationEventType.PERSISTENCE_FAILED, userId, notification, message));
    }

    // ---- Toasts ----

    public void publishToast(Object source, String userId, NotificationKind kind, String title, String body) {
        applicationEventPublisher.publishEvent(new ToastEvent(source, userId, kind, title, body));
    }

    // ---- Connectivity ----

    public void publishConnectivity(
            Object source, String userId, ConnectivityState previous, ConnectivityState current, int retryCount) {
        applicationEventPublisher.publishEvent(new ConnectivityEvent(source, userId, previous, current, retryCount));
    }

    // ---- Analytics ----

    public void publishAnalyticsChanged(Object source, String sellerId, String productId, ChangeOperation operation) {
        applicationEventPublisher.publishEvent(new AnalyticsChangedEvent(source, sellerId, productId, operation));
    }
}
