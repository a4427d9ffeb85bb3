package com.workstream.core.graph;

/**
 * One structural problem found by {@link WorkflowGraph#validate()}.
 *
 * @param nodeId  the node the problem is attached to
 * @param type    category of the problem
 * @param message human readable description
 */
public record GraphValidationError(String nodeId, Type type, String message) {

    public enum Type {
        UNKNOWN_DEPENDENCY,
        SELF_DEPENDENCY,
        CYCLE
    }
}
