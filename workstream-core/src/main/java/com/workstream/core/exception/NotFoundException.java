package com.workstream.core.exception;

/**
 * Thrown when a run or another entity is not found.
 */
public class NotFoundException extends WorkstreamException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
