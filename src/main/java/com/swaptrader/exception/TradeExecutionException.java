package com.swaptrader.exception;

import java.util.Map;

/**
 * A quote or swap call against the execution venue failed. The triggering order has
 * already been marked FAILED by the time a caller sees this.
 */
public class TradeExecutionException extends BaseException {

    public TradeExecutionException(String message) {
        super(ErrorCode.EXECUTION_ERROR, message);
    }

    public TradeExecutionException(String message, Throwable cause) {
        super(ErrorCode.EXECUTION_ERROR, message, cause);
    }

    public TradeExecutionException(String message, Map<String, Object> details, Throwable cause) {
        super(ErrorCode.EXECUTION_ERROR, message, details, cause);
    }
}
