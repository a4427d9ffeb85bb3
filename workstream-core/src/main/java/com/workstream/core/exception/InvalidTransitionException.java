package com.workstream.core.exception;

/**
 * Thrown when a lifecycle transition is not permitted, for contracts as well as runs.
 */
public class InvalidTransitionException extends WorkstreamException {

    public static final String ERROR_CODE = "INVALID_TRANSITION";

    public InvalidTransitionException(String message) {
        super(ERROR_CODE, message);
    }

    public InvalidTransitionException(String entityType, String entityId, Enum<?> from, Enum<?> to) {
        super(ERROR_CODE, String.format(
            "Invalid %s transition for %s: %s -> %s",
            entityType, entityId, from, to
        ));
    }
}
