package com.workstream.core.exception;

/**
 * Thrown when a run checkpoint cannot be persisted or read back.
 * The in-memory context stays valid; only resumability is affected.
 */
public class CheckpointException extends WorkstreamException {

    public static final String ERROR_CODE = "CHECKPOINT_FAILED";

    private final String runId;

    public CheckpointException(String runId, String message, Throwable cause) {
        super(ERROR_CODE, String.format("Checkpoint for run %s failed: %s", runId, message), cause);
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }
}
