package com.marketplace.exception;

import java.util.Map;

/**
 * Raised when a raw change event does not have the shape its entity requires
 * (missing snapshot, missing id). Never crosses the realtime boundary: the
 * notification pipeline catches it, drops the event and keeps the stream alive.
 */
public class TranslationException extends BaseException {

    public TranslationException(String message) {
        super(ErrorCode.MALFORMED_EVENT, message);
    }

    public TranslationException(String message, Map<String, Object> details) {
        super(ErrorCode.MALFORMED_EVENT, message, details);
    }
}
