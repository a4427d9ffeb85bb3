package com.workstream.core.exception;

/**
 * Thrown when a contract evolution's declared breaking flag disagrees with
 * the structural diff or with the version bump.
 */
public class BreakingChangeMismatchException extends WorkstreamException {

    public static final String ERROR_CODE = "BREAKING_CHANGE_MISMATCH";

    public BreakingChangeMismatchException(String contractName, String version, String reason) {
        super(ERROR_CODE, String.format(
            "Evolution of contract %s to %s rejected: %s",
            contractName, version, reason
        ));
    }
}
