package com.workstream.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Durable snapshot of a run, sufficient to resume it given the same graph.
 * Holds state only; the graph structure is supplied again by the caller.
 *
 * Primary Key: runId
 *
 * Invariants:
 * - nodeStates has one entry per id in nodeIds
 * - outputs only contains ids whose state is COMPLETED
 * - sequenceNumber increases with every save of the same run
 */
public record RunCheckpoint(
    String runId,
    String graphId,
    RunStatus runStatus,
    List<String> nodeIds,
    Map<String, NodeState> nodeStates,
    Map<String, JsonNode> outputs,
    Map<String, List<String>> artifacts,
    Map<String, List<ContractRef>> contractsTouched,
    JsonNode globalInput,
    List<ContractSnapshot> contracts,
    long sequenceNumber,
    Instant checkpointedAt
) {
}
