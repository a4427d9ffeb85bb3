package com.workstream.core.model;

/**
 * Lifecycle states for a node within a single run.
 */
public enum NodeStatus {
    /**
     * Waiting for dependencies.
     * Transitions: -> READY, SKIPPED
     */
    PENDING,

    /**
     * All dependencies completed, waiting for dispatch (or for backoff to elapse).
     * Transitions: -> RUNNING, SKIPPED
     */
    READY,

    /**
     * Runner invoked, result pending.
     * Transitions: -> COMPLETED, FAILED, READY (retry or resume)
     */
    RUNNING,

    /**
     * Output recorded. Terminal state.
     */
    COMPLETED,

    /**
     * Retry budget exhausted or error not retryable.
     * Transitions: -> READY (explicit retry reset only)
     */
    FAILED,

    /**
     * An ancestor failed, or the run was cancelled before dispatch. Terminal state.
     */
    SKIPPED;

    /**
     * Check if this status is terminal for the current run.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED;
    }

    /**
     * Check if this node can still be dispatched in the current run.
     */
    public boolean isOutstanding() {
        return this == PENDING || this == READY || this == RUNNING;
    }

    /**
     * Check if this status can transition to the target status.
     */
    public boolean canTransitionTo(NodeStatus target) {
        return switch (this) {
            case PENDING -> target == READY || target == SKIPPED;
            case READY -> target == RUNNING || target == SKIPPED;
            case RUNNING -> target == COMPLETED || target == FAILED || target == READY;
            case FAILED -> target == READY;
            case COMPLETED, SKIPPED -> false;
        };
    }
}
