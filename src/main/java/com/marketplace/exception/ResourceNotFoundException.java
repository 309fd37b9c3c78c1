package com.marketplace.exception;

import java.util.Map;

public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }

    /** No realtime session is open for the user. */
    public static ResourceNotFoundException session(String userId) {
        return new ResourceNotFoundException(
                ErrorCode.SESSION_NOT_FOUND, "No realtime session open for user " + userId, Map.of("userId", userId));
    }
}
