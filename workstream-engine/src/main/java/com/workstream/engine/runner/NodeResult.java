package com.workstream.engine.runner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.workstream.core.model.ContractRef;

import java.util.List;

/**
 * Outcome returned by a {@link NodeRunner}.
 *
 * A failure result is equivalent to throwing a {@link NodeRunnerException}
 * with the same code and retryable flag.
 */
public record NodeResult(
    boolean success,
    JsonNode output,
    List<String> artifacts,
    List<ContractRef> contractsProduced,
    String errorCode,
    String errorMessage,
    boolean retryable
) {
    public NodeResult {
        output = output == null ? NullNode.getInstance() : output;
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
        contractsProduced = contractsProduced == null ? List.of() : List.copyOf(contractsProduced);
    }

    public static NodeResult success(JsonNode output) {
        return new NodeResult(true, output, List.of(), List.of(), null, null, false);
    }

    public static NodeResult success(JsonNode output, List<String> artifacts) {
        return new NodeResult(true, output, artifacts, List.of(), null, null, false);
    }

    public static NodeResult success(JsonNode output, List<String> artifacts, List<ContractRef> contractsProduced) {
        return new NodeResult(true, output, artifacts, contractsProduced, null, null, false);
    }

    public static NodeResult failure(String errorCode, String errorMessage, boolean retryable) {
        return new NodeResult(false, null, List.of(), List.of(), errorCode, errorMessage, retryable);
    }
}
