package com.marketplace.api.dto.response;

import java.time.Instant;

/**
 * Success envelope of the realtime REST API: {@code { success: true, data, timestamp }}.
 * Applied by {@link com.marketplace.config.ApiResponseAdvice}; controllers return bare bodies.
 */
public record ApiResponse<T>(boolean success, T data, Instant timestamp) {

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(true, data, Instant.now());
    }
}
