package com.marketplace.exception;

public class ChangeEventSourceException extends BaseException {

    public ChangeEventSourceException(String message) {
        super(ErrorCode.TRANSPORT_ERROR, message);
    }

    public ChangeEventSourceException(String message, Throwable cause) {
        super(ErrorCode.TRANSPORT_ERROR, message, cause);
    }
}
