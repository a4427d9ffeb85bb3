package com.workstream.core.repository;

import com.workstream.core.model.ExecutionEvent;
import com.workstream.core.model.ExecutionEventType;

import java.util.List;
import java.util.Map;

/**
 * Append-only store of execution events.
 */
public interface ExecutionEventRepository {

    /**
     * Append an event to the log of its run.
     *
     * @param event The event to append
     */
    void append(ExecutionEvent event);

    /**
     * Get all events of a run in sequence order.
     *
     * @param runId The run ID
     * @return Events ordered by sequence number
     */
    List<ExecutionEvent> findByRunId(String runId);

    /**
     * Get the events of one node within a run, in sequence order.
     */
    List<ExecutionEvent> findByRunIdAndNodeId(String runId, String nodeId);

    /**
     * Count events by type for a run.
     */
    Map<ExecutionEventType, Long> countByType(String runId);
}
