package com.swaptrader.exception;

import java.util.Map;

/** A stored record exists but cannot be read back into a domain object. */
public class CorruptRecordException extends BaseException {

    public CorruptRecordException(String key, String message, Throwable cause) {
        super(ErrorCode.INTERNAL_ERROR, "Unreadable record at " + key + ": " + message, Map.of("key", key), cause);
    }
}
