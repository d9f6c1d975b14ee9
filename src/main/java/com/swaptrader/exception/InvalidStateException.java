package com.swaptrader.exception;

import java.util.Map;

/**
 * Thrown when an operation targets an entity whose current state does not allow it,
 * e.g. closing a CLOSED position or moving an order out of a terminal status.
 */
public class InvalidStateException extends BaseException {

    public InvalidStateException(String message) {
        super(ErrorCode.INVALID_STATE, message);
    }

    public InvalidStateException(String message, Map<String, Object> details) {
        super(ErrorCode.INVALID_STATE, message, details);
    }
}
