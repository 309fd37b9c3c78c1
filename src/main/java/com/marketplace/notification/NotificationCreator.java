package com.marketplace.notification;

/**
 * Durably records a notification outside this process, for delivery on other devices.
 * Best-effort: callers catch and log failures.
 */
public interface NotificationCreator {

    /**
     * @return the server-assigned id of the stored notification
     * @throws com.marketplace.exception.NotificationPersistenceException if the write failed
     */
    String persist(Notification notification);
}
