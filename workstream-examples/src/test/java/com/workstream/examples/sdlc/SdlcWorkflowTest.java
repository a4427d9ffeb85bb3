package com.workstream.examples.sdlc;

import com.workstream.audit.AuditVerdict;
import com.workstream.audit.StreamStatusAuditGateway;
import com.workstream.audit.Verdict;
import com.workstream.core.graph.WorkflowGraph;
import com.workstream.core.model.ContractRef;
import com.workstream.core.model.ContractStatus;
import com.workstream.core.model.NodeStatus;
import com.workstream.core.model.RunStatus;
import com.workstream.engine.context.ContextStore;
import com.workstream.engine.contract.ContractRegistry;
import com.workstream.engine.coordinator.DagExecutor;
import com.workstream.engine.coordinator.ExecutorSettings;
import com.workstream.engine.coordinator.RunReport;
import com.workstream.engine.persistence.InMemoryCheckpointRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.workstream.examples.sdlc.SdlcWorkflow.*;
import static org.assertj.core.api.Assertions.*;

class SdlcWorkflowTest {

    private final WorkflowGraph graph = SdlcWorkflow.createGraph();
    private ContractRegistry registry;
    private DagExecutor executor;

    @BeforeEach
    void setUp() {
        registry = new ContractRegistry();
        executor = executor(true);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    @DisplayName("Delivery run completes and publishes the API contract")
    void normalRun() {
        RunReport report = executor.execute(graph, registry, SdlcWorkflow.createInput("storefront"));

        assertThat(report.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(report.nodesWithStatus(NodeStatus.COMPLETED)).hasSize(graph.size());
        assertThat(report.contractsTouched()).containsExactly(new ContractRef(API_CONTRACT, API_VERSION));
        assertThat(registry.get(API_CONTRACT, API_VERSION))
            .hasValueSatisfying(c -> assertThat(c.status()).isEqualTo(ContractStatus.ACTIVE));
        assertThat(report.outputs().get(BACKEND).path("implemented")).hasSize(3);
        assertThat(report.outputs().get(INTEGRATION_TESTS).path("passed").asInt()).isEqualTo(3);
        assertThat(report.artifacts().get(FRONTEND)).containsExactly("frontend/dist/bundle.js");

        AuditVerdict verdict = new StreamStatusAuditGateway(graph).evaluate(report);
        assertThat(verdict.verdict()).isEqualTo(Verdict.ALL_PASS);
        assertThat(verdict.deploymentAllowed()).isTrue();
    }

    @Test
    @DisplayName("Flaky frontend build succeeds on the third attempt")
    void frontendRetries() {
        RunReport report = executor.execute(graph, registry, SdlcWorkflow.createInput("storefront", 2, false, false));

        assertThat(report.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(report.node(FRONTEND).attempts()).isEqualTo(3);
        assertThat(report.node(BACKEND).attempts()).isEqualTo(1);
    }

    @Test
    @DisplayName("Contract drift fails integration tests and skips deployment")
    void driftBlocksDeployment() {
        RunReport report = executor.execute(graph, registry, SdlcWorkflow.createInput("storefront", 0, true, false));

        assertThat(report.status()).isEqualTo(RunStatus.FAILED);
        assertThat(report.node(INTEGRATION_TESTS).status()).isEqualTo(NodeStatus.FAILED);
        assertThat(report.node(INTEGRATION_TESTS).errorCode()).isEqualTo(CONTRACT_MISMATCH);
        assertThat(report.node(DEPLOYMENT).status()).isEqualTo(NodeStatus.SKIPPED);
        assertThat(report.node(DEPLOYMENT).causeNodeId()).isEqualTo(INTEGRATION_TESTS);
        assertThat(report.node(RELEASE_NOTES).status()).isEqualTo(NodeStatus.COMPLETED);

        AuditVerdict verdict = new StreamStatusAuditGateway(graph).evaluate(report);
        assertThat(verdict.verdict()).isEqualTo(Verdict.MULTIPLE_STREAMS_FAILED);
        assertThat(verdict.failedStreams()).containsExactly("quality", "release");
    }

    @Test
    @DisplayName("Warning mode lets deployment proceed past contract drift")
    void driftInWarningMode() {
        executor.shutdown();
        executor = executor(false);

        RunReport report = executor.execute(graph, registry, SdlcWorkflow.createInput("storefront", 0, true, false));

        assertThat(report.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(report.node(INTEGRATION_TESTS).warning()).contains("/api/legacy");
        assertThat(report.node(DEPLOYMENT).status()).isEqualTo(NodeStatus.COMPLETED);
        assertThat(new StreamStatusAuditGateway(graph).evaluate(report).verdict()).isEqualTo(Verdict.ALL_PASS);
    }

    @Test
    @DisplayName("Failed release notes do not fail the run")
    void optionalDocsFailure() {
        RunReport report = executor.execute(graph, registry, SdlcWorkflow.createInput("storefront", 0, false, true));

        assertThat(report.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(report.node(RELEASE_NOTES).status()).isEqualTo(NodeStatus.FAILED);
        assertThat(report.node(RELEASE_NOTES).errorCode()).isEqualTo(DOCS_UNAVAILABLE);
        assertThat(new StreamStatusAuditGateway(graph).evaluate(report).verdict()).isEqualTo(Verdict.ALL_PASS);
    }

    @Test
    @DisplayName("A second run against the same registry reuses the published contract")
    void secondRunReusesContract() {
        executor.execute(graph, registry, SdlcWorkflow.createInput("storefront"));
        RunReport second = executor.execute(graph, registry, SdlcWorkflow.createInput("storefront"));

        assertThat(second.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(registry.versions(API_CONTRACT)).hasSize(1);
    }

    @Test
    @DisplayName("Demo scenarios produce the expected audit verdicts")
    void demoScenarios() {
        SdlcWorkflowDemo demo = new SdlcWorkflowDemo();

        assertThat(demo.run("normal", SdlcWorkflow.createInput("demo"), true).verdict())
            .isEqualTo(Verdict.ALL_PASS);
        assertThat(demo.run("drift", SdlcWorkflow.createInput("demo", 0, true, false), true).deploymentAllowed())
            .isFalse();
    }

    private static DagExecutor executor(boolean failOnValidationError) {
        return new DagExecutor(
            SdlcWorkflow.createRunners(),
            new ContextStore(new InMemoryCheckpointRepository()),
            ExecutorSettings.builder()
                .maxParallelism(4)
                .failOnValidationError(failOnValidationError)
                .build());
    }
}
