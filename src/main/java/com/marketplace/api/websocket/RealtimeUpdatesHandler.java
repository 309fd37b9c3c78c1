package com.marketplace.api.websocket;

import com.marketplace.api.dto.response.NotificationResponse;
import com.marketplace.event.AnalyticsChangedEvent;
import com.marketplace.event.ConnectivityEvent;
import com.marketplace.event.NotificationEvent;
import com.marketplace.event.NotificationEventType;
import com.marketplace.event.ToastEvent;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Pushes realtime session output to the user's STOMP topics:
 * <ul>
 *   <li>{@code /topic/realtime/{userId}/notifications} -- "NOTIFICATION", each delivered notification</li>
 *   <li>{@code /topic/realtime/{userId}/toasts} -- "TOAST", transient toast with style and duration</li>
 *   <li>{@code /topic/realtime/{userId}/connectivity} -- "CONNECTIVITY", aggregate state changes</li>
 *   <li>{@code /topic/realtime/{userId}/analytics} -- "ANALYTICS", refetch hint for the seller dashboard</li>
 * </ul>
 *
 * <p>All handlers run async on the eventExecutor so a slow broker never holds up a
 * session's subscription manager.
 */
@Component
public class RealtimeUpdatesHandler {

    private static final Logger log = LoggerFactory.getLogger(RealtimeUpdatesHandler.class);

    static final String TOPIC_PREFIX = "/topic/realtime/";

    private final SimpMessagingTemplate simpMessagingTemplate;

    public RealtimeUpdatesHandler(SimpMessagingTemplate simpMessagingTemplate) {
        this.simpMessagingTemplate = simpMessagingTemplate;
    }

    @Async("eventExecutor")
    @EventListener
    public void onNotificationEvent(NotificationEvent event) {
        if (event.getEventType() != NotificationEventType.DELIVERED) {
            return;
        }
        send(event.getUserId(), "notifications", "NOTIFICATION", NotificationResponse.from(event.getNotification()));
    }

    @Async("eventExecutor")
    @EventListener
    public void onToastEvent(ToastEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("kind", event.getKind().name());
        payload.put("level", event.getKind().getToastLevel().name());
        payload.put("title", event.getTitle());
        payload.put("description", event.getBody());
        payload.put("durationMs", event.getKind().getToastDuration().toMillis());

        send(event.getUserId(), "toasts", "TOAST", payload);
    }

    @Async("eventExecutor")
    @EventListener
    public void onConnectivityEvent(ConnectivityEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("previousState", event.getPreviousState().name());
        payload.put("state", event.getNewState().name());
        payload.put("retryCount", event.getRetryCount());
        payload.put("occurredAt", event.getOccurredAt().toString());

        send(event.getUserId(), "connectivity", "CONNECTIVITY", payload);
    }

    @Async("eventExecutor")
    @EventListener
    public void onAnalyticsChanged(AnalyticsChangedEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sellerId", event.getSellerId());
        payload.put("productId", event.getProductId());
        payload.put("operation", event.getOperation().name());

        send(event.getSellerId(), "analytics", "ANALYTICS", payload);
    }

    private void send(String userId, String channel, String type, Object data) {
        String destination = TOPIC_PREFIX + userId + "/" + channel;
        try {
            simpMessagingTemplate.convertAndSend(destination, WebSocketMessage.of(type, userId, data));
            log.debug("Pushed {} to {}", type, destination);
        } catch (Exception e) {
            log.error("Failed to push {} to {}: {}", type, destination, e.getMessage());
        }
    }
}
