package com.workstream.engine.runner;

import com.fasterxml.jackson.databind.JsonNode;
import com.workstream.core.model.NodeDefinition;
import com.workstream.engine.context.NodeInput;
import com.workstream.engine.contract.ContractRegistry;

/**
 * Everything a runner receives for one attempt of a node.
 *
 * @param runId    the run this attempt belongs to
 * @param node     the node definition
 * @param input    outputs and artifacts of ancestors, global input and active contracts
 * @param attempt  1-indexed attempt number
 * @param contracts registry for interface nodes that publish or evolve contracts
 */
public record NodeInvocation(
    String runId,
    NodeDefinition node,
    NodeInput input,
    int attempt,
    ContractRegistry contracts
) {
    public String nodeId() {
        return node.nodeId();
    }

    /**
     * This attempt's copy of the node configuration.
     */
    public JsonNode config() {
        return input.config();
    }
}
