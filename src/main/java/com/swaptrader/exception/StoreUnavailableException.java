package com.swaptrader.exception;

/** The backing key-value store could not be reached. Fatal for the operation in progress. */
public class StoreUnavailableException extends BaseException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(ErrorCode.STORE_UNAVAILABLE, message, cause);
    }
}
