package com.marketplace.exception;

import org.springframework.http.HttpStatus;

/**
 * Machine-readable error codes returned under {@code error.code} by the realtime REST API.
 */
public enum ErrorCode {

    // request shape
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    BAD_REQUEST(HttpStatus.BAD_REQUEST),
    UNSUPPORTED_ENTITY(HttpStatus.BAD_REQUEST),

    // caller identity and sessions
    MISSING_USER(HttpStatus.UNAUTHORIZED),
    SESSION_NOT_FOUND(HttpStatus.NOT_FOUND),
    NOT_FOUND(HttpStatus.NOT_FOUND),

    // change stream and marketplace API
    MALFORMED_EVENT(HttpStatus.UNPROCESSABLE_ENTITY),
    TRANSPORT_ERROR(HttpStatus.BAD_GATEWAY),
    UPSTREAM_ERROR(HttpStatus.BAD_GATEWAY),

    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public String getCode() {
        return name();
    }

    public HttpStatus getStatus() {
        return status;
    }

    public boolean isServerSide() {
        return status.is5xxServerError();
    }
}
