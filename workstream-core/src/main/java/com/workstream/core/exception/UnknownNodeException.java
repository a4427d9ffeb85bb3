package com.workstream.core.exception;

/**
 * Thrown when an edge or query references a node id that is not in the graph.
 */
public class UnknownNodeException extends GraphStructureException {

    public static final String ERROR_CODE = "UNKNOWN_NODE";

    private final String nodeId;

    public UnknownNodeException(String graphId, String nodeId) {
        super(ERROR_CODE, String.format("Node %s not found in graph %s", nodeId, graphId));
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
