package com.marketplace.exception;

import java.util.Map;

/**
 * The caller did not identify which marketplace user the request is for.
 */
public class UnauthorizedException extends BaseException {

    private UnauthorizedException(String message, Map<String, Object> details) {
        super(ErrorCode.MISSING_USER, message, details);
    }

    public static UnauthorizedException missingHeader(String header) {
        return new UnauthorizedException("Missing " + header + " header", Map.of("header", header));
    }
}
