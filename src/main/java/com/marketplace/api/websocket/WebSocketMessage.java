package com.marketplace.api.websocket;

import java.time.Instant;
import lombok.Value;

/**
 * Frame body of every STOMP message under {@code /topic/realtime/{userId}/...}:
 * {@code { type, userId, sentAt, data }}, with {@code type} one of
 * "NOTIFICATION", "TOAST", "CONNECTIVITY" or "ANALYTICS".
 */
@Value
public class WebSocketMessage {

    String type;
    String userId;
    Instant sentAt;
    Object data;

    public static WebSocketMessage of(String type, String userId, Object data) {
        return new WebSocketMessage(type, userId, Instant.now(), data);
    }
}
