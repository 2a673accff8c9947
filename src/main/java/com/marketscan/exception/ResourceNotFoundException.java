package com.marketscan.exception;

import java.util.Locale;
import java.util.Map;

/** A user or symbol the engine has no record of. */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String resourceType, String identifier) {
        super(
                ErrorCode.NOT_FOUND,
                String.format("Unknown %s: %s", resourceType.toLowerCase(Locale.ROOT), identifier),
                Map.of("resource", resourceType, "identifier", identifier));
    }
}
