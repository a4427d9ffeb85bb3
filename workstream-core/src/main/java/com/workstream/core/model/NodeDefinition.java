package com.workstream.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Definition of a single node in a workflow graph.
 * Immutable once added to a graph.
 *
 * Invariants:
 * - nodeId is non-blank and unique within its graph
 * - dependencies never contain nodeId itself
 * - timeout, if set, is positive
 * - condition, if set, is evaluated once per run when the node is about to be dispatched
 */
public record NodeDefinition(
    String nodeId,
    String displayName,
    NodeKind kind,
    ExecutionMode executionMode,
    Set<String> dependencies,
    JsonNode config,
    RetryPolicy retryPolicy,
    boolean required,
    Duration timeout,
    Boolean failOnValidationError,
    String description,
    NodeCondition condition
) {
    public NodeDefinition {
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("nodeId must not be blank");
        }
        displayName = displayName == null ? nodeId : displayName;
        kind = kind == null ? NodeKind.PHASE : kind;
        executionMode = executionMode == null ? ExecutionMode.PARALLEL : executionMode;
        dependencies = dependencies == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
        config = config == null ? JsonNodeFactory.instance.objectNode() : config.deepCopy();
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    /**
     * Copy of the runner configuration. Graphs are shared between runs, so
     * callers never receive the stored tree.
     */
    @Override
    public JsonNode config() {
        return config.deepCopy();
    }

    /**
     * Get the effective retry policy (node-specific or fallback).
     */
    public RetryPolicy effectiveRetryPolicy(RetryPolicy fallback) {
        return retryPolicy != null ? retryPolicy : fallback;
    }

    /**
     * Resolve whether a failure of this node fails the graph branch.
     * Only VALIDATION nodes may be configured as warning-only.
     *
     * @param executorDefault the executor-wide setting
     */
    public boolean effectiveFailOnValidationError(boolean executorDefault) {
        if (kind != NodeKind.VALIDATION) {
            return true;
        }
        return failOnValidationError != null ? failOnValidationError : executorDefault;
    }

    public boolean isConditional() {
        return condition != null;
    }

    public boolean isParallelEligible() {
        return executionMode == ExecutionMode.PARALLEL;
    }

    /**
     * Copy of this definition with an extra dependency.
     */
    public NodeDefinition withDependency(String dependencyId) {
        Set<String> deps = new LinkedHashSet<>(dependencies);
        deps.add(dependencyId);
        return toBuilder().dependencies(deps).build();
    }

    public static Builder builder(String nodeId) {
        return new Builder().nodeId(nodeId);
    }

    public Builder toBuilder() {
        return new Builder()
            .nodeId(nodeId)
            .displayName(displayName)
            .kind(kind)
            .executionMode(executionMode)
            .dependencies(dependencies)
            .config(config)
            .retryPolicy(retryPolicy)
            .required(required)
            .timeout(timeout)
            .failOnValidationError(failOnValidationError)
            .description(description)
            .condition(condition);
    }

    public static class Builder {
        private String nodeId;
        private String displayName;
        private NodeKind kind = NodeKind.PHASE;
        private ExecutionMode executionMode = ExecutionMode.PARALLEL;
        private Set<String> dependencies = new LinkedHashSet<>();
        private JsonNode config;
        private RetryPolicy retryPolicy;
        private boolean required = true;
        private Duration timeout;
        private Boolean failOnValidationError;
        private String description;
        private NodeCondition condition;

        public Builder nodeId(String nodeId) {
            this.nodeId = nodeId;
            return this;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder kind(NodeKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder executionMode(ExecutionMode executionMode) {
            this.executionMode = executionMode;
            return this;
        }

        public Builder sequential() {
            this.executionMode = ExecutionMode.SEQUENTIAL;
            return this;
        }

        public Builder dependencies(Set<String> dependencies) {
            this.dependencies = new LinkedHashSet<>(dependencies);
            return this;
        }

        public Builder dependsOn(String... nodeIds) {
            Collections.addAll(this.dependencies, nodeIds);
            return this;
        }

        public Builder config(JsonNode config) {
            this.config = config;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder required(boolean required) {
            this.required = required;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder failOnValidationError(Boolean failOnValidationError) {
            this.failOnValidationError = failOnValidationError;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        /**
         * Run the node only when the condition holds; otherwise it is skipped.
         */
        public Builder condition(NodeCondition condition) {
            this.condition = condition;
            return this;
        }

        public NodeDefinition build() {
            return new NodeDefinition(
                nodeId, displayName, kind, executionMode, dependencies, config,
                retryPolicy, required, timeout, failOnValidationError, description, condition
            );
        }
    }
}
