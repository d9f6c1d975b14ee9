package com.swaptrader.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR"),
    NOT_FOUND("NOT_FOUND"),
    INVALID_STATE("INVALID_STATE"),
    EXECUTION_ERROR("EXECUTION_ERROR"),
    STORE_UNAVAILABLE("STORE_UNAVAILABLE"),
    INTERNAL_ERROR("INTERNAL_ERROR");

    private final String code;
}
