package com.workstream.core.model;

/**
 * Lifecycle states for a run of a workflow graph.
 */
public enum RunStatus {
    /**
     * Context created, no node dispatched yet.
     * Transitions: -> RUNNING
     */
    NOT_STARTED,

    /**
     * Nodes are being dispatched.
     * Transitions: -> PAUSED, COMPLETED, FAILED, CANCELLED
     */
    RUNNING,

    /**
     * Stopped between waves on request; the checkpoint can be resumed.
     * Transitions: -> RUNNING
     */
    PAUSED,

    /**
     * Every node Completed or Skipped and no required node Failed. Terminal state.
     */
    COMPLETED,

    /**
     * At least one required node Failed. Terminal state.
     */
    FAILED,

    /**
     * Stopped by an external cancellation request. Terminal state.
     */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(RunStatus target) {
        return switch (this) {
            case NOT_STARTED -> target == RUNNING;
            case RUNNING -> target == PAUSED || target == COMPLETED || target == FAILED || target == CANCELLED;
            case PAUSED -> target == RUNNING;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}
