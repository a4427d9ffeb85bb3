package com.workstream.core.exception;

/**
 * Base exception for all workstream errors.
 */
public class WorkstreamException extends RuntimeException {

    private final String errorCode;

    public WorkstreamException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public WorkstreamException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
