package com.workstream.core.model;

/**
 * Whether a node may run alongside other ready nodes.
 */
public enum ExecutionMode {
    /**
     * Dispatched alone, one at a time, in graph order.
     */
    SEQUENTIAL,

    /**
     * May be dispatched concurrently with other parallel-eligible ready nodes.
     */
    PARALLEL
}
