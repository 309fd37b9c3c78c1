package com.marketplace.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.marketplace.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;

/**
 * Failure envelope: {@code { success: false, error: { code, message, details?, timestamp, path } }}.
 */
public record ApiErrorResponse(boolean success, Error error) {

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return new ApiErrorResponse(false, new Error(errorCode.getCode(), message, details, Instant.now(), path));
    }

    public record Error(
            String code,
            String message,
            @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, Object> details,
            Instant timestamp,
            String path) {}
}
