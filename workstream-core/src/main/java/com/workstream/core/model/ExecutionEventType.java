package com.workstream.core.model;

/**
 * Types of events emitted while a run progresses.
 */
public enum ExecutionEventType {
    // Run lifecycle
    RUN_STARTED,
    RUN_RESUMED,
    RUN_PAUSED,
    RUN_COMPLETED,
    RUN_FAILED,
    RUN_CANCELLED,

    // Node lifecycle
    NODE_READY,
    NODE_STARTED,
    NODE_COMPLETED,
    NODE_COMPLETED_WITH_WARNING,
    NODE_FAILED,
    NODE_RETRY_SCHEDULED,
    NODE_SKIPPED,

    // Persistence
    CHECKPOINT_SAVED,
    CHECKPOINT_FAILED
}
