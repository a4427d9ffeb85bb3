package com.workstream.engine.coordinator;

import com.fasterxml.jackson.databind.JsonNode;
import com.workstream.core.exception.CheckpointException;
import com.workstream.core.model.ContractRef;
import com.workstream.core.model.NodeStatus;
import com.workstream.core.model.RunStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Terminal report of a run. Enumerates every node's final status; partial success
 * is always visible through the per-node reports.
 */
public record RunReport(
    String runId,
    String graphId,
    RunStatus status,
    Map<String, NodeReport> nodes,
    Map<String, JsonNode> outputs,
    Map<String, List<String>> artifacts,
    List<ContractRef> contractsTouched,
    List<CheckpointException> checkpointFailures,
    String cancelReason,
    Instant startedAt,
    Instant finishedAt
) {
    public NodeReport node(String nodeId) {
        NodeReport report = nodes.get(nodeId);
        if (report == null) {
            throw new IllegalArgumentException("No node " + nodeId + " in run " + runId);
        }
        return report;
    }

    public NodeStatus statusOf(String nodeId) {
        return node(nodeId).status();
    }

    public List<String> nodesWithStatus(NodeStatus status) {
        return nodes.values().stream()
            .filter(n -> n.status() == status)
            .map(NodeReport::nodeId)
            .collect(Collectors.toList());
    }

    public List<String> nodesWithWarnings() {
        return nodes.values().stream()
            .filter(n -> n.warning() != null)
            .map(NodeReport::nodeId)
            .collect(Collectors.toList());
    }

    public boolean isSuccessful() {
        return status == RunStatus.COMPLETED;
    }

    public boolean hasCheckpointFailures() {
        return !checkpointFailures.isEmpty();
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }
}
