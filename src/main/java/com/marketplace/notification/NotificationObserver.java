package com.marketplace.notification;

/**
 * Receives every notification inserted into a {@link NotificationStore} after it registered.
 */
@FunctionalInterface
public interface NotificationObserver {

    void onNotification(Notification notification);
}
