package com.workstream.engine.runner;

import com.workstream.core.model.NodeDefinition;
import com.workstream.core.model.NodeKind;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves the runner for a node: a runner registered for the node id wins,
 * otherwise the runner registered for the node's kind.
 */
public class NodeRunnerRegistry {

    private final Map<NodeKind, NodeRunner> byKind = new EnumMap<>(NodeKind.class);
    private final Map<String, NodeRunner> byNodeId = new ConcurrentHashMap<>();

    public synchronized NodeRunnerRegistry register(NodeKind kind, NodeRunner runner) {
        byKind.put(kind, runner);
        return this;
    }

    public NodeRunnerRegistry register(String nodeId, NodeRunner runner) {
        byNodeId.put(nodeId, runner);
        return this;
    }

    public synchronized Optional<NodeRunner> resolve(NodeDefinition node) {
        NodeRunner specific = byNodeId.get(node.nodeId());
        if (specific != null) {
            return Optional.of(specific);
        }
        return Optional.ofNullable(byKind.get(node.kind()));
    }
}
