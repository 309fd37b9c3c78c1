package com.marketplace.session;

import com.marketplace.event.EventPublisherHelper;
import com.marketplace.notification.NotificationStore;
import com.marketplace.realtime.SubscriptionManager;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;

/**
 * One signed-in user's realtime state: the subscription manager and the notification store.
 * Nothing here is shared with other sessions.
 *
 * <p>Store inserts and connectivity changes are republished as Spring events, which is how
 * the STOMP push, the metrics and the server-side persistence see them.
 */
@Getter
public class RealtimeSession {

    private final String userId;
    private final SubscriptionManager subscriptionManager;
    private final NotificationStore notificationStore;
    private final Instant openedAt;

    private final List<Runnable> unsubscribers = new ArrayList<>();

    RealtimeSession(
            String userId,
            SubscriptionManager subscriptionManager,
            NotificationStore notificationStore,
            EventPublisherHelper eventPublisherHelper) {
        this.userId = userId;
        this.subscriptionManager = subscriptionManager;
        this.notificationStore = notificationStore;
        this.openedAt = Instant.now();

        unsubscribers.add(notificationStore.subscribe(
                notification -> eventPublisherHelper.publishNotificationDelivered(this, userId, notification)));
        unsubscribers.add(subscriptionManager.addConnectivityListener((previous, current) ->
                eventPublisherHelper.publishConnectivity(
                        this, userId, previous, current, subscriptionManager.getRetryCount())));
    }

    void start() {
        subscriptionManager.start();
    }

    void reconnect() {
        subscriptionManager.reconnect();
    }

    /**
     * Stops the subscriptions, then detaches the event bridges so nothing is published
     * for this session afterwards.
     */
    void close() {
        subscriptionManager.stop();
        unsubscribers.forEach(Runnable::run);
        unsubscribers.clear();
    }
}
