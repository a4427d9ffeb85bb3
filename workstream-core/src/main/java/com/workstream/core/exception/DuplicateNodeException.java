package com.workstream.core.exception;

/**
 * Thrown when a node id is added to a graph twice.
 */
public class DuplicateNodeException extends WorkstreamException {

    public static final String ERROR_CODE = "DUPLICATE_NODE";

    public DuplicateNodeException(String graphId, String nodeId) {
        super(ERROR_CODE, String.format("Node %s already exists in graph %s", nodeId, graphId));
    }
}
