package com.marketplace.notification;

import java.time.Duration;
import lombok.Getter;

/**
 * Closed set of user-facing notification types produced by the translator.
 *
 * <p>Each kind carries its toast style and the notification type understood by the
 * marketplace notifications API.
 */
@Getter
public enum NotificationKind {
    ORDER_CREATED("order_update", ToastLevel.SUCCESS, Duration.ofMillis(5000)),
    ORDER_STATUS_CHANGED("order_update", ToastLevel.INFO, Duration.ofMillis(4000)),
    PAYMENT_COMPLETED("payment_received", ToastLevel.SUCCESS, Duration.ofMillis(5000)),
    MESSAGE_RECEIVED("new_message", ToastLevel.DEFAULT, Duration.ofMillis(4000));

    private final String serverType;
    private final ToastLevel toastLevel;
    private final Duration toastDuration;

    NotificationKind(String serverType, ToastLevel toastLevel, Duration toastDuration) {
        this.serverType = serverType;
        this.toastLevel = toastLevel;
        this.toastDuration = toastDuration;
    }
}
