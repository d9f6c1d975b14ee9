package com.swaptrader.exception;

import java.util.Map;

/** Input that can never be acted on: a malformed symbol, a non-positive size, a bad config value. */
public class ValidationException extends BaseException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public ValidationException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }
}
