package com.workstream.engine.coordinator;

import com.workstream.core.model.NodeKind;
import com.workstream.core.model.NodeState;
import com.workstream.core.model.NodeStatus;

/**
 * Final status of one node in a run.
 * For FAILED nodes errorCode/errorMessage hold the failure; for SKIPPED nodes
 * causeNodeId names the failed ancestor and errorMessage carries its error.
 */
public record NodeReport(
    String nodeId,
    NodeKind kind,
    boolean required,
    NodeStatus status,
    int attempts,
    String errorCode,
    String errorMessage,
    String warning,
    String causeNodeId
) {
    static NodeReport of(NodeState state, NodeKind kind, boolean required) {
        return new NodeReport(
            state.nodeId(),
            kind,
            required,
            state.status(),
            state.attempts(),
            state.errorCode(),
            state.errorMessage(),
            state.warning(),
            state.causeNodeId()
        );
    }
}
