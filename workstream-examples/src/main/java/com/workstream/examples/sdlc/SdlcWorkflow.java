package com.workstream.examples.sdlc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.workstream.core.graph.WorkflowGraph;
import com.workstream.core.model.NodeDefinition;
import com.workstream.core.model.NodeKind;
import com.workstream.core.model.RetryPolicy;
import com.workstream.engine.runner.NodeRunnerRegistry;

import java.time.Duration;
import java.util.Set;

/**
 * Software delivery workflow where backend and frontend streams meet through a shared API contract.
 *
 * Workflow:
 * <pre>
 *                requirements
 *                 /        \
 *         api_contract    release_notes (optional)
 *           /      \
 *      backend    frontend      (parallel)
 *           \      /
 *      integration_tests        (validation)
 *              |
 *          deployment           (sequential)
 * </pre>
 *
 * Every node carries a {@code stream} config field so the audit gateway can
 * report failures per stream of work.
 */
public final class SdlcWorkflow {

    private static final ObjectMapper mapper = new ObjectMapper();

    public static final String GRAPH_ID = "sdlc-delivery";
    public static final String API_CONTRACT = "user-api";
    public static final String API_VERSION = "1.0.0";

    // Node IDs
    public static final String REQUIREMENTS = "requirements";
    public static final String API_CONTRACT_NODE = "api_contract";
    public static final String BACKEND = "backend";
    public static final String FRONTEND = "frontend";
    public static final String INTEGRATION_TESTS = "integration_tests";
    public static final String DEPLOYMENT = "deployment";
    public static final String RELEASE_NOTES = "release_notes";

    // Error codes
    public static final String CONTRACT_MISSING = "CONTRACT_MISSING";
    public static final String CONTRACT_MISMATCH = "CONTRACT_MISMATCH";
    public static final String BUILD_FLAKE = "BUILD_FLAKE";
    public static final String DOCS_UNAVAILABLE = "DOCS_UNAVAILABLE";

    private SdlcWorkflow() {
    }

    public static WorkflowGraph createGraph() {
        return WorkflowGraph.builder(GRAPH_ID)
            .node(node(REQUIREMENTS, "product")
                .displayName("Gather requirements")
                .build())
            .node(node(API_CONTRACT_NODE, "backend")
                .displayName("Publish API contract")
                .kind(NodeKind.INTERFACE)
                .dependsOn(REQUIREMENTS)
                .build())
            .node(node(BACKEND, "backend")
                .displayName("Implement backend")
                .dependsOn(API_CONTRACT_NODE)
                .build())
            .node(node(FRONTEND, "frontend")
                .displayName("Implement frontend")
                .dependsOn(API_CONTRACT_NODE)
                .retryPolicy(RetryPolicy.builder()
                    .maxRetries(2)
                    .backoffStrategy(RetryPolicy.BackoffStrategy.FIXED)
                    .initialBackoff(Duration.ofMillis(50))
                    .maxBackoff(Duration.ofMillis(50))
                    .jitterFactor(0.0)
                    .nonRetryableErrors(Set.of(CONTRACT_MISSING))
                    .build())
                .build())
            .node(node(INTEGRATION_TESTS, "quality")
                .displayName("Run integration tests")
                .kind(NodeKind.VALIDATION)
                .dependsOn(BACKEND, FRONTEND)
                .retryPolicy(RetryPolicy.noRetry())
                .build())
            .node(node(DEPLOYMENT, "release")
                .displayName("Deploy")
                .dependsOn(INTEGRATION_TESTS)
                .sequential()
                .timeout(Duration.ofSeconds(30))
                .build())
            .node(node(RELEASE_NOTES, "docs")
                .displayName("Write release notes")
                .dependsOn(REQUIREMENTS)
                .required(false)
                .retryPolicy(RetryPolicy.noRetry())
                .build())
            .buildValidated();
    }

    /**
     * Registers one runner per node of {@link #createGraph()}.
     */
    public static NodeRunnerRegistry createRunners() {
        SdlcNodeRunners runners = new SdlcNodeRunners();
        return new NodeRunnerRegistry()
            .register(REQUIREMENTS, runners::gatherRequirements)
            .register(API_CONTRACT_NODE, runners::publishApiContract)
            .register(BACKEND, runners::implementBackend)
            .register(FRONTEND, runners::implementFrontend)
            .register(INTEGRATION_TESTS, runners::runIntegrationTests)
            .register(DEPLOYMENT, runners::deploy)
            .register(RELEASE_NOTES, runners::writeReleaseNotes);
    }

    /**
     * Global input for a run.
     *
     * @param frontendFailures transient frontend build failures before success
     * @param frontendDrift    whether the frontend calls an endpoint outside the contract
     * @param docsFailure      whether release notes fail permanently
     */
    public static JsonNode createInput(String project, int frontendFailures, boolean frontendDrift,
                                       boolean docsFailure) {
        ObjectNode input = mapper.createObjectNode();
        input.put("project", project);
        input.put("environment", "staging");
        ArrayNode features = input.putArray("features");
        features.add("users");
        features.add("sessions");
        features.add("profiles");

        ObjectNode simulate = input.putObject("simulate");
        simulate.put("frontendFailures", frontendFailures);
        simulate.put("frontendDrift", frontendDrift);
        simulate.put("docsFailure", docsFailure);
        return input;
    }

    public static JsonNode createInput(String project) {
        return createInput(project, 0, false, false);
    }

    private static NodeDefinition.Builder node(String nodeId, String stream) {
        ObjectNode config = mapper.createObjectNode();
        config.put("stream", stream);
        return NodeDefinition.builder(nodeId).config(config);
    }
}
