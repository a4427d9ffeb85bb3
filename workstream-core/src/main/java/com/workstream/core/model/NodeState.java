package com.workstream.core.model;

import java.time.Instant;

/**
 * Per-node, per-run execution record.
 * Every transition returns a new instance; the executor is the only writer.
 *
 * attempts counts dispatches, so retries used = attempts - 1 once a node has run.
 */
public record NodeState(
    String nodeId,
    NodeStatus status,
    int attempts,
    Instant nextAttemptAt,
    Instant readyAt,
    Instant startedAt,
    Instant completedAt,
    String errorCode,
    String errorMessage,
    String warning,
    String causeNodeId
) {
    /**
     * Initial state for a node at run start.
     */
    public static NodeState pending(String nodeId) {
        return new NodeState(nodeId, NodeStatus.PENDING, 0,
            null, null, null, null, null, null, null, null);
    }

    public NodeState withReady(Instant now) {
        return new NodeState(nodeId, NodeStatus.READY, attempts,
            null, now, null, null, errorCode, errorMessage, null, null);
    }

    public NodeState withRunning(Instant now) {
        return new NodeState(nodeId, NodeStatus.RUNNING, attempts + 1,
            null, readyAt, now, null, null, null, null, null);
    }

    public NodeState withCompleted(Instant now) {
        return new NodeState(nodeId, NodeStatus.COMPLETED, attempts,
            null, readyAt, startedAt, now, null, null, null, null);
    }

    /**
     * Completed despite a failure; used by warning-only validation nodes.
     */
    public NodeState withCompletedWithWarning(Instant now, String code, String message) {
        return new NodeState(nodeId, NodeStatus.COMPLETED, attempts,
            null, readyAt, startedAt, now, code, message, message, null);
    }

    public NodeState withFailed(Instant now, String code, String message) {
        return new NodeState(nodeId, NodeStatus.FAILED, attempts,
            null, readyAt, startedAt, now, code, message, null, null);
    }

    /**
     * Failed attempt with retry budget left: back to READY, gated until nextAttemptAt.
     */
    public NodeState withRetryScheduled(Instant now, Instant nextAttemptAt, String code, String message) {
        return new NodeState(nodeId, NodeStatus.READY, attempts,
            nextAttemptAt, now, startedAt, null, code, message, null, null);
    }

    public NodeState withSkipped(Instant now, String causeNodeId, String reason) {
        return new NodeState(nodeId, NodeStatus.SKIPPED, attempts,
            null, readyAt, startedAt, now, null, reason, null, causeNodeId);
    }

    /**
     * Interrupted while RUNNING; the attempt is given back so it runs again.
     */
    public NodeState withResumed(Instant now) {
        return new NodeState(nodeId, NodeStatus.READY, Math.max(0, attempts - 1),
            null, now, null, null, null, null, null, null);
    }

    public boolean isDue(Instant now) {
        return status == NodeStatus.READY && (nextAttemptAt == null || !nextAttemptAt.isAfter(now));
    }

    public int retriesUsed() {
        return Math.max(0, attempts - 1);
    }

    public boolean hasWarning() {
        return warning != null;
    }
}
