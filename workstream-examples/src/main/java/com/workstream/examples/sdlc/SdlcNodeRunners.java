package com.workstream.examples.sdlc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.workstream.core.model.Contract;
import com.workstream.core.model.ContractStatus;
import com.workstream.engine.contract.ContractRegistry;
import com.workstream.engine.runner.NodeInvocation;
import com.workstream.engine.runner.NodeResult;
import com.workstream.engine.runner.NodeRunnerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static com.workstream.examples.sdlc.SdlcWorkflow.*;

/**
 * Simulated runners for the SDLC delivery workflow.
 *
 * Runners are idempotent: re-running a node after a retry or a resume produces
 * the same output and reuses the contract published by an earlier attempt.
 * Failures are driven by the {@code simulate} block of the run's global input.
 */
public class SdlcNodeRunners {

    private static final Logger log = LoggerFactory.getLogger(SdlcNodeRunners.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    public NodeResult gatherRequirements(NodeInvocation invocation) {
        JsonNode global = invocation.input().globalInput();
        ObjectNode output = mapper.createObjectNode();
        output.put("project", global.path("project").asText("unnamed"));
        ArrayNode features = output.putArray("features");
        global.path("features").forEach(features::add);

        log.info("Gathered {} feature(s) for {}", features.size(), output.get("project").asText());
        return NodeResult.success(output, List.of("docs/requirements.md"));
    }

    /**
     * Publishes the API contract derived from the requirements and activates it.
     */
    public NodeResult publishApiContract(NodeInvocation invocation) {
        JsonNode requirements = invocation.input().ancestorOutput(REQUIREMENTS);
        ObjectNode specification = mapper.createObjectNode();
        ObjectNode resources = specification.putObject("resources");
        for (JsonNode feature : requirements.path("features")) {
            ObjectNode resource = resources.putObject(feature.asText());
            resource.put("path", "/api/" + feature.asText());
            resource.put("method", "GET");
        }

        ContractRegistry registry = invocation.contracts();
        Contract contract = registry.get(API_CONTRACT, API_VERSION)
            .orElseGet(() -> registry.createContract(API_CONTRACT, API_VERSION, specification,
                API_CONTRACT_NODE, List.of(BACKEND, FRONTEND)));
        if (contract.status() == ContractStatus.DRAFT) {
            contract = registry.activateContract(API_CONTRACT, API_VERSION);
        }

        ObjectNode output = mapper.createObjectNode();
        output.put("contract", contract.name());
        output.put("version", contract.version().toString());
        output.put("status", contract.status().name());
        return NodeResult.success(output, List.of("api/openapi.json"), List.of(contract.ref()));
    }

    public NodeResult implementBackend(NodeInvocation invocation) throws NodeRunnerException {
        List<String> paths = contractPaths(invocation);
        ObjectNode output = mapper.createObjectNode();
        ArrayNode implemented = output.putArray("implemented");
        List<String> artifacts = new ArrayList<>();
        for (String path : paths) {
            implemented.add(path);
            artifacts.add("backend/src" + path + ".java");
        }
        return NodeResult.success(output, artifacts);
    }

    public NodeResult implementFrontend(NodeInvocation invocation) throws NodeRunnerException {
        JsonNode simulate = invocation.input().globalInput().path("simulate");
        int failures = simulate.path("frontendFailures").asInt(0);
        if (invocation.attempt() <= failures) {
            log.warn("Simulated frontend build failure (attempt {})", invocation.attempt());
            throw NodeRunnerException.transientFailure(BUILD_FLAKE,
                "Frontend build agent unavailable on attempt " + invocation.attempt());
        }

        List<String> paths = new ArrayList<>(contractPaths(invocation));
        if (simulate.path("frontendDrift").asBoolean(false)) {
            paths.add("/api/legacy");
        }
        ObjectNode output = mapper.createObjectNode();
        ArrayNode consumed = output.putArray("consumed");
        paths.forEach(consumed::add);
        return NodeResult.success(output, List.of("frontend/dist/bundle.js"));
    }

    /**
     * Checks that every endpoint the frontend calls is implemented by the backend.
     */
    public NodeResult runIntegrationTests(NodeInvocation invocation) {
        Set<String> implemented = new HashSet<>();
        invocation.input().ancestorOutput(BACKEND).path("implemented")
            .forEach(p -> implemented.add(p.asText()));

        List<String> missing = new ArrayList<>();
        int checked = 0;
        for (JsonNode path : invocation.input().ancestorOutput(FRONTEND).path("consumed")) {
            checked++;
            if (!implemented.contains(path.asText())) {
                missing.add(path.asText());
            }
        }

        if (!missing.isEmpty()) {
            return NodeResult.failure(CONTRACT_MISMATCH,
                "Frontend calls endpoints missing from the backend: " + missing, false);
        }
        ObjectNode output = mapper.createObjectNode();
        output.put("checked", checked);
        output.put("passed", checked);
        return NodeResult.success(output, List.of("reports/integration.xml"));
    }

    public NodeResult deploy(NodeInvocation invocation) {
        ObjectNode output = mapper.createObjectNode();
        output.put("environment", invocation.input().globalInput().path("environment").asText("staging"));
        output.put("deployed", true);
        log.info("Deployed {} to {}", invocation.input().ancestorOutput(REQUIREMENTS).path("project").asText(),
            output.get("environment").asText());
        return NodeResult.success(output);
    }

    public NodeResult writeReleaseNotes(NodeInvocation invocation) throws NodeRunnerException {
        if (invocation.input().globalInput().path("simulate").path("docsFailure").asBoolean(false)) {
            throw NodeRunnerException.permanent(DOCS_UNAVAILABLE, "Documentation site is read-only");
        }
        ObjectNode output = mapper.createObjectNode();
        output.put("features", invocation.input().ancestorOutput(REQUIREMENTS).path("features").size());
        return NodeResult.success(output, List.of("docs/RELEASE_NOTES.md"));
    }

    private List<String> contractPaths(NodeInvocation invocation) throws NodeRunnerException {
        Contract contract = invocation.input().activeContract(API_CONTRACT)
            .orElseThrow(() -> NodeRunnerException.permanent(CONTRACT_MISSING,
                "No active version of contract " + API_CONTRACT));
        List<String> paths = new ArrayList<>();
        contract.specification().path("resources")
            .forEach(resource -> paths.add(resource.path("path").asText()));
        return paths;
    }
}
