package com.workstream.engine.context;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.workstream.core.exception.DuplicateWriteException;
import com.workstream.core.exception.InvalidTransitionException;
import com.workstream.core.exception.UnknownNodeException;
import com.workstream.core.graph.WorkflowGraph;
import com.workstream.core.model.ContractRef;
import com.workstream.core.model.ContractSnapshot;
import com.workstream.core.model.NodeDefinition;
import com.workstream.core.model.NodeState;
import com.workstream.core.model.NodeStatus;
import com.workstream.core.model.RunCheckpoint;
import com.workstream.core.model.RunStatus;
import com.workstream.engine.contract.ContractRegistry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Mutable state of one run: global input, per-node outputs, artifacts, contracts
 * touched and node states.
 *
 * Output, artifact and contract slots are written once per node (append-only);
 * reads of completed slots need no locking. Node states are replaced wholesale by
 * the executor, which is the only writer.
 *
 * Invariants:
 * - globalInput never changes after the context is created
 * - a node's output slot is written at most once unless explicitly reset
 * - node state changes follow {@link NodeStatus#canTransitionTo}
 */
public class ExecutionContext {

    private final String runId;
    private final String graphId;
    private final JsonNode globalInput;
    private final List<String> nodeIds;
    private final List<ContractSnapshot> contractSnapshot;

    private final ConcurrentHashMap<String, JsonNode> outputs = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, List<String>> artifacts = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, List<ContractRef>> contractsTouched = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, NodeState> states = new ConcurrentHashMap<>();

    private final AtomicLong checkpointSequence;
    private volatile RunStatus runStatus;

    private ExecutionContext(String runId, String graphId, JsonNode globalInput,
                             List<String> nodeIds, RunStatus runStatus, long checkpointSequence,
                             List<ContractSnapshot> contractSnapshot) {
        this.runId = Objects.requireNonNull(runId, "runId");
        this.graphId = graphId;
        this.globalInput = globalInput == null ? JsonNodeFactory.instance.objectNode() : globalInput.deepCopy();
        this.nodeIds = List.copyOf(nodeIds);
        this.runStatus = runStatus;
        this.checkpointSequence = new AtomicLong(checkpointSequence);
        this.contractSnapshot = contractSnapshot == null ? List.of() : List.copyOf(contractSnapshot);
    }

    /**
     * Create a fresh context for a run of the given graph; every node starts PENDING.
     */
    public static ExecutionContext start(String runId, WorkflowGraph graph, JsonNode globalInput) {
        ExecutionContext context = new ExecutionContext(
            runId, graph.graphId(), globalInput, graph.nodeIds(), RunStatus.NOT_STARTED, 0, List.of());
        for (String nodeId : context.nodeIds) {
            context.states.put(nodeId, NodeState.pending(nodeId));
        }
        return context;
    }

    /**
     * Rebuild a context from a checkpoint. Nodes that were RUNNING when the checkpoint
     * was taken go back to READY, so they run again rather than being lost.
     * The checkpoint's contract table is kept as {@link #contractSnapshot()}.
     */
    public static ExecutionContext fromCheckpoint(RunCheckpoint checkpoint) {
        ExecutionContext context = new ExecutionContext(
            checkpoint.runId(), checkpoint.graphId(), checkpoint.globalInput(),
            checkpoint.nodeIds(), checkpoint.runStatus(), checkpoint.sequenceNumber(),
            checkpoint.contracts());
        Instant now = Instant.now();

        for (String nodeId : context.nodeIds) {
            NodeState state = checkpoint.nodeStates().get(nodeId);
            if (state == null) {
                state = NodeState.pending(nodeId);
            } else if (state.status() == NodeStatus.RUNNING) {
                state = state.withResumed(now);
            }
            context.states.put(nodeId, state);
        }
        checkpoint.outputs().forEach((id, out) -> context.outputs.put(id, out == null ? NullNode.getInstance() : out));
        checkpoint.artifacts().forEach((id, refs) -> context.artifacts.put(id, List.copyOf(refs)));
        checkpoint.contractsTouched().forEach((id, refs) -> context.contractsTouched.put(id, List.copyOf(refs)));
        return context;
    }

    // ========== Slots ==========

    /**
     * Commit the result of a node. Allowed once per node per run.
     *
     * @throws DuplicateWriteException if the node's output was already recorded;
     *                                 the context is left untouched
     */
    public void recordOutput(String nodeId, JsonNode output, List<String> nodeArtifacts,
                             List<ContractRef> nodeContracts) {
        requireNode(nodeId);
        JsonNode value = output == null ? NullNode.getInstance() : output.deepCopy();
        if (outputs.putIfAbsent(nodeId, value) != null) {
            throw new DuplicateWriteException(runId, nodeId);
        }
        artifacts.put(nodeId, nodeArtifacts == null ? List.of() : List.copyOf(nodeArtifacts));
        contractsTouched.put(nodeId, nodeContracts == null ? List.of() : List.copyOf(nodeContracts));
    }

    /**
     * Explicit retry reset: clears the node's slots and puts it back to PENDING,
     * allowing a new {@link #recordOutput} for it.
     */
    public void resetForRetry(String nodeId) {
        requireNode(nodeId);
        outputs.remove(nodeId);
        artifacts.remove(nodeId);
        contractsTouched.remove(nodeId);
        states.put(nodeId, NodeState.pending(nodeId));
    }

    /**
     * Assemble the input for a node: outputs and artifacts of all transitive ancestors,
     * the global input, and the contracts currently active in the registry.
     *
     * @param registry may be null when the run uses no contracts
     */
    public NodeInput buildNodeInput(String nodeId, WorkflowGraph graph, ContractRegistry registry) {
        NodeDefinition node = graph.node(nodeId);
        Set<String> ancestors = graph.ancestors(nodeId);

        Map<String, JsonNode> ancestorOutputs = new LinkedHashMap<>();
        Map<String, List<String>> ancestorArtifacts = new LinkedHashMap<>();
        for (String ancestor : graph.topologicalOrder()) {
            if (!ancestors.contains(ancestor)) {
                continue;
            }
            JsonNode out = outputs.get(ancestor);
            if (out != null) {
                ancestorOutputs.put(ancestor, out.deepCopy());
            }
            List<String> refs = artifacts.get(ancestor);
            if (refs != null) {
                ancestorArtifacts.put(ancestor, refs);
            }
        }

        Map<String, JsonNode> dependencyOutputs = new LinkedHashMap<>();
        for (String dep : graph.dependencies(nodeId)) {
            JsonNode out = ancestorOutputs.get(dep);
            if (out != null) {
                dependencyOutputs.put(dep, out);
            }
        }

        return new NodeInput(
            nodeId,
            node.displayName(),
            node.kind(),
            node.config(),
            Collections.unmodifiableMap(dependencyOutputs),
            Collections.unmodifiableMap(ancestorOutputs),
            Collections.unmodifiableMap(ancestorArtifacts),
            globalInput.deepCopy(),
            registry == null ? List.of() : registry.activeContracts()
        );
    }

    // ========== Node States ==========

    public NodeState state(String nodeId) {
        NodeState state = states.get(nodeId);
        if (state == null) {
            throw new UnknownNodeException(graphId, nodeId);
        }
        return state;
    }

    /**
     * Replace a node's state.
     *
     * @throws InvalidTransitionException if the status change is not allowed
     */
    public void updateState(NodeState next) {
        NodeState current = state(next.nodeId());
        if (current.status() != next.status() && !current.status().canTransitionTo(next.status())) {
            throw new InvalidTransitionException("node", next.nodeId(), current.status(), next.status());
        }
        states.put(next.nodeId(), next);
    }

    public Map<String, NodeStatus> statuses() {
        Map<String, NodeStatus> result = new LinkedHashMap<>();
        for (String nodeId : nodeIds) {
            result.put(nodeId, states.get(nodeId).status());
        }
        return result;
    }

    public Map<String, NodeState> states() {
        Map<String, NodeState> result = new LinkedHashMap<>();
        for (String nodeId : nodeIds) {
            result.put(nodeId, states.get(nodeId));
        }
        return Collections.unmodifiableMap(result);
    }

    public List<String> nodesWithStatus(NodeStatus status) {
        List<String> result = new ArrayList<>();
        for (String nodeId : nodeIds) {
            if (states.get(nodeId).status() == status) {
                result.add(nodeId);
            }
        }
        return result;
    }

    // ========== Run Status ==========

    public RunStatus runStatus() {
        return runStatus;
    }

    public synchronized void transitionRun(RunStatus target) {
        if (runStatus == target) {
            return;
        }
        if (!runStatus.canTransitionTo(target)) {
            throw new InvalidTransitionException("run", runId, runStatus, target);
        }
        runStatus = target;
    }

    // ========== Checkpointing ==========

    /**
     * Snapshot this context together with the given contract table.
     * Each call takes the next sequence number.
     */
    public RunCheckpoint toCheckpoint(List<ContractSnapshot> contracts) {
        Map<String, JsonNode> outputCopy = new LinkedHashMap<>();
        Map<String, List<String>> artifactCopy = new LinkedHashMap<>();
        Map<String, List<ContractRef>> contractCopy = new LinkedHashMap<>();
        for (String nodeId : nodeIds) {
            JsonNode out = outputs.get(nodeId);
            if (out != null) {
                outputCopy.put(nodeId, out.deepCopy());
            }
            List<String> refs = artifacts.get(nodeId);
            if (refs != null) {
                artifactCopy.put(nodeId, refs);
            }
            List<ContractRef> touched = contractsTouched.get(nodeId);
            if (touched != null) {
                contractCopy.put(nodeId, touched);
            }
        }
        return new RunCheckpoint(
            runId,
            graphId,
            runStatus,
            nodeIds,
            states(),
            outputCopy,
            artifactCopy,
            contractCopy,
            globalInput.deepCopy(),
            contracts == null ? List.of() : List.copyOf(contracts),
            checkpointSequence.incrementAndGet(),
            Instant.now()
        );
    }

    // ========== Accessors ==========

    public String runId() {
        return runId;
    }

    public String graphId() {
        return graphId;
    }

    public List<String> nodeIds() {
        return nodeIds;
    }

    /**
     * Copy of the global input; the original is never exposed.
     */
    public JsonNode globalInput() {
        return globalInput.deepCopy();
    }

    public Optional<JsonNode> output(String nodeId) {
        JsonNode out = outputs.get(nodeId);
        return out == null ? Optional.empty() : Optional.of(out.deepCopy());
    }

    public Map<String, JsonNode> outputs() {
        Map<String, JsonNode> result = new LinkedHashMap<>();
        for (String nodeId : nodeIds) {
            JsonNode out = outputs.get(nodeId);
            if (out != null) {
                result.put(nodeId, out.deepCopy());
            }
        }
        return result;
    }

    public List<String> artifacts(String nodeId) {
        return artifacts.getOrDefault(nodeId, List.of());
    }

    public Map<String, List<String>> artifacts() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(artifacts));
    }

    /**
     * Contracts introduced or touched during the run, in node order, without duplicates.
     */
    public List<ContractRef> contractsTouched() {
        Set<ContractRef> refs = new LinkedHashSet<>();
        for (String nodeId : nodeIds) {
            refs.addAll(contractsTouched.getOrDefault(nodeId, List.of()));
        }
        return List.copyOf(refs);
    }

    public long checkpointSequence() {
        return checkpointSequence.get();
    }

    /**
     * Contract table of the checkpoint this context was restored from; empty for a fresh run.
     */
    public List<ContractSnapshot> contractSnapshot() {
        return contractSnapshot;
    }

    // ========== Internal Methods ==========

    private void requireNode(String nodeId) {
        if (!states.containsKey(nodeId)) {
            throw new UnknownNodeException(graphId, nodeId);
        }
    }
}
