package com.marketplace.api.dto.response;

import com.marketplace.notification.Notification;
import com.marketplace.notification.NotificationKind;
import com.marketplace.notification.NotificationPayload;
import java.time.Instant;

public record NotificationResponse(
        String id,
        NotificationKind kind,
        String title,
        String body,
        NotificationPayload payload,
        Instant createdAt,
        boolean read) {

    public static NotificationResponse from(Notification notification) {
        return new NotificationResponse(
                notification.getId(),
                notification.getKind(),
                notification.getTitle(),
                notification.getBody(),
                notification.getPayload(),
                notification.getCreatedAt(),
                notification.isRead());
    }
}
