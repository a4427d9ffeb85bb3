package com.workstream.engine.coordinator;

import com.workstream.core.model.ExecutionEvent;

/**
 * Receives execution events from a {@link DagExecutor}, on the run's coordinating thread.
 */
@FunctionalInterface
public interface ExecutionEventListener {

    void onEvent(ExecutionEvent event);
}
