package com.optionscalper.exception;

import java.util.Map;

/** A position or working order the caller named is not in the store. */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String resourceType, String identifier) {
        super(
                ErrorCode.NOT_FOUND,
                resourceType + " " + identifier + " not found",
                Map.<String, Object>of("resource", resourceType, "id", identifier));
    }
}
