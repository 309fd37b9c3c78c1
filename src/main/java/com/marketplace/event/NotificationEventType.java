package com.marketplace.event;

public enum NotificationEventType {
    /** Inserted into a session's store and fanned out. */
    DELIVERED,
    /** Same id already present in the store; nothing delivered. */
    DUPLICATE,
    /** Raw event could not be translated and was dropped. */
    TRANSLATION_FAILED,
    /** Best-effort server-side write failed. */
    PERSISTENCE_FAILED
}
