package com.swaptrader.exception;

import java.util.Map;

public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String resourceType, String identifier) {
        super(
                ErrorCode.NOT_FOUND,
                String.format("%s not found with identifier: %s", resourceType, identifier),
                Map.of("resourceType", resourceType, "id", String.valueOf(identifier)));
    }
}
