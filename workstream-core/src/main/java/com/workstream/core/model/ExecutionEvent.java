package com.workstream.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable record of something that happened during a run.
 *
 * Invariants:
 * - sequenceNumber is strictly increasing within a run
 * - nodeId is null for run-level and checkpoint events
 */
public record ExecutionEvent(
    UUID eventId,
    String runId,
    long sequenceNumber,
    ExecutionEventType type,
    String nodeId,
    int attempt,
    String errorCode,
    String detail,
    Instant timestamp
) {
    public static ExecutionEvent runEvent(String runId, long sequenceNumber,
                                          ExecutionEventType type, String detail) {
        return new ExecutionEvent(UUID.randomUUID(), runId, sequenceNumber, type,
            null, 0, null, detail, Instant.now());
    }

    public static ExecutionEvent nodeEvent(String runId, long sequenceNumber, ExecutionEventType type,
                                           String nodeId, int attempt, String errorCode, String detail) {
        return new ExecutionEvent(UUID.randomUUID(), runId, sequenceNumber, type,
            nodeId, attempt, errorCode, detail, Instant.now());
    }

    public boolean isRunEvent() {
        return type.name().startsWith("RUN_");
    }

    public boolean isNodeEvent() {
        return type.name().startsWith("NODE_");
    }
}
