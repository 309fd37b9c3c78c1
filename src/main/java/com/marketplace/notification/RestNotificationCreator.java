package com.marketplace.notification;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketplace.exception.NotificationPersistenceException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Writes notifications through {@code POST /api/notifications} of the marketplace API.
 *
 * <p>Each call is decorated with Resilience4j:
 * <ul>
 *   <li><b>Circuit breaker</b> ({@code notificationApi}): stops calling a failing API for a while</li>
 *   <li><b>Retry</b> ({@code notificationApi}): a few attempts with backoff for transient errors</li>
 * </ul>
 *
 * <p>The notification id is sent as {@code client_reference}; it is deterministic per logical
 * event, so a retried or re-delivered write can be recognised by the server.
 */
@Service
public class RestNotificationCreator implements NotificationCreator {

    private static final Logger log = LoggerFactory.getLogger(RestNotificationCreator.class);

    static final String ORDER_COMPLETED_TYPE = "order_completed";
    static final String DELIVERED_STATUS = "delivered";

    private final RestClient restClient;

    public RestNotificationCreator(@Qualifier("marketplaceApiRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    @CircuitBreaker(name = "notificationApi")
    @Retry(name = "notificationApi")
    public String persist(Notification notification) {
        CreateNotificationRequest request = toRequest(notification);
        try {
            CreateNotificationResponse response = restClient
                    .post()
                    .uri("/api/notifications")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(CreateNotificationResponse.class);
            String serverId = response != null ? response.notificationId() : null;
            log.info("Notification {} persisted for {} (server id {})",
                    notification.getId(), notification.getRecipientId(), serverId);
            return serverId;
        } catch (RestClientException e) {
            log.error("Notification write failed for {}: {}", notification.getId(), e.getMessage());
            throw new NotificationPersistenceException(
                    "Notification write failed for " + notification.getId() + ": " + e.getMessage(), e);
        }
    }

    static CreateNotificationRequest toRequest(Notification notification) {
        NotificationPayload payload = notification.getPayload();
        return new CreateNotificationRequest(
                notification.getRecipientId(),
                serverType(notification),
                notification.getTitle(),
                notification.getBody(),
                payload != null ? payload.orderId() : null,
                payload != null ? payload.senderId() : null,
                notification.getId());
    }

    /**
     * The API distinguishes a completed order from other order updates.
     */
    static String serverType(Notification notification) {
        NotificationPayload payload = notification.getPayload();
        if (notification.getKind() == NotificationKind.ORDER_STATUS_CHANGED
                && payload != null
                && DELIVERED_STATUS.equals(payload.orderStatus())) {
            return ORDER_COMPLETED_TYPE;
        }
        return notification.getKind().getServerType();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record CreateNotificationRequest(
            @JsonProperty("recipient_id") String recipientId,
            @JsonProperty("type") String type,
            @JsonProperty("title") String title,
            @JsonProperty("message") String message,
            @JsonProperty("order_id") String orderId,
            @JsonProperty("sender_id") String senderId,
            @JsonProperty("client_reference") String clientReference) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CreateNotificationResponse(@JsonProperty("notification_id") String notificationId) {}
}
