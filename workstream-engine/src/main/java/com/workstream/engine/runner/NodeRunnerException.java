package com.workstream.engine.runner;

/**
 * Exception thrown by node runners.
 * Contains information about whether the failure is retryable.
 */
public class NodeRunnerException extends Exception {

    private final String errorCode;
    private final boolean retryable;

    public NodeRunnerException(String errorCode, String message, boolean retryable) {
        super(message);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public NodeRunnerException(String errorCode, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Failure that will not go away on retry (bad input, business rule violation).
     */
    public static NodeRunnerException permanent(String errorCode, String message) {
        return new NodeRunnerException(errorCode, message, false);
    }

    /**
     * Failure that may succeed on retry (timeout, unavailable dependency).
     */
    public static NodeRunnerException transientFailure(String errorCode, String message) {
        return new NodeRunnerException(errorCode, message, true);
    }
}
