package com.workstream.core.exception;

/**
 * Thrown when a node's output slot is written a second time within the same run.
 */
public class DuplicateWriteException extends WorkstreamException {

    public static final String ERROR_CODE = "DUPLICATE_WRITE";

    private final String runId;
    private final String nodeId;

    public DuplicateWriteException(String runId, String nodeId) {
        super(ERROR_CODE, String.format(
            "Output for node %s was already recorded in run %s",
            nodeId, runId
        ));
        this.runId = runId;
        this.nodeId = nodeId;
    }

    public String getRunId() {
        return runId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
