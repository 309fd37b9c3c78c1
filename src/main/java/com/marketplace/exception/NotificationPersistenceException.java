package com.marketplace.exception;

public class NotificationPersistenceException extends BaseException {

    public NotificationPersistenceException(String message) {
        super(ErrorCode.UPSTREAM_ERROR, message);
    }

    public NotificationPersistenceException(String message, Throwable cause) {
        super(ErrorCode.UPSTREAM_ERROR, message, cause);
    }
}
