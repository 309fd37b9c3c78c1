package com.marketplace.notification;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.marketplace.translation.OrderRole;

/**
 * References to the entities behind a notification, for drill-down in the UI.
 * Fields that do not apply to the notification's kind are null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NotificationPayload(
        String orderId,
        String productId,
        String productTitle,
        String orderStatus,
        OrderRole role,
        String messageId,
        String conversationId,
        String senderId) {

    public static NotificationPayload forOrder(
            String orderId, String productId, String productTitle, String orderStatus, OrderRole role) {
        return new NotificationPayload(orderId, productId, productTitle, orderStatus, role, null, null, null);
    }

    public static NotificationPayload forMessage(
            String messageId, String conversationId, String senderId, String productTitle) {
        return new NotificationPayload(null, null, productTitle, null, null, messageId, conversationId, senderId);
    }
}
