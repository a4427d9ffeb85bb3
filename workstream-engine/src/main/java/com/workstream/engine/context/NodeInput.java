package com.workstream.engine.context;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.workstream.core.model.Contract;
import com.workstream.core.model.NodeKind;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Dependency-scoped view of a run handed to a node's runner.
 *
 * ancestorOutputs covers every transitive ancestor, not only direct parents;
 * dependencyOutputs is the direct-parent subset of it. All values are copies.
 */
public record NodeInput(
    String nodeId,
    String displayName,
    NodeKind kind,
    JsonNode config,
    Map<String, JsonNode> dependencyOutputs,
    Map<String, JsonNode> ancestorOutputs,
    Map<String, List<String>> ancestorArtifacts,
    JsonNode globalInput,
    List<Contract> activeContracts
) {
    /**
     * Output of an ancestor, or a missing node if it produced none.
     */
    public JsonNode ancestorOutput(String ancestorId) {
        JsonNode output = ancestorOutputs.get(ancestorId);
        return output == null ? MissingNode.getInstance() : output;
    }

    public Optional<Contract> activeContract(String name) {
        return activeContracts.stream()
            .filter(c -> c.name().equals(name))
            .findFirst();
    }
}
