package com.workstream.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Guard evaluated just before a node is dispatched. When it returns false the node
 * is skipped instead of run, and so are its dependents.
 */
@FunctionalInterface
public interface NodeCondition {

    /**
     * @param globalInput     copy of the run's global input
     * @param ancestorOutputs outputs of every completed transitive ancestor, keyed by node id
     */
    boolean shouldRun(JsonNode globalInput, Map<String, JsonNode> ancestorOutputs);
}
