package com.workstream.engine.context;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.workstream.core.exception.DuplicateWriteException;
import com.workstream.core.exception.InvalidTransitionException;
import com.workstream.core.exception.UnknownNodeException;
import com.workstream.core.graph.WorkflowGraph;
import com.workstream.core.model.*;
import com.workstream.engine.contract.ContractRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ExecutionContextTest {

    private WorkflowGraph graph;
    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        // requirements -> api -> frontend -> qa, plus a side branch docs
        graph = WorkflowGraph.builder("sdlc")
            .node(NodeDefinition.builder("requirements").build())
            .node(NodeDefinition.builder("api").kind(NodeKind.INTERFACE).dependsOn("requirements").build())
            .node(NodeDefinition.builder("frontend").dependsOn("api").build())
            .node(NodeDefinition.builder("docs").dependsOn("requirements").build())
            .node(NodeDefinition.builder("qa").kind(NodeKind.VALIDATION).dependsOn("frontend").build())
            .buildValidated();
        context = ExecutionContext.start("run-1", graph, input("ticket", "WS-42"));
    }

    @Test
    @DisplayName("New context has every node PENDING and the run NOT_STARTED")
    void startsPending() {
        assertThat(context.runStatus()).isEqualTo(RunStatus.NOT_STARTED);
        assertThat(context.statuses().values()).containsOnly(NodeStatus.PENDING);
        assertThat(context.nodeIds()).containsExactly("requirements", "api", "frontend", "docs", "qa");
    }

    @Test
    @DisplayName("Node input carries outputs of all transitive ancestors, not only parents")
    void nodeInputCoversAncestors() {
        context.recordOutput("requirements", input("stories", "12"), List.of("req.md"), List.of());
        context.recordOutput("api", input("openapi", "v1"), List.of("openapi.yaml"),
            List.of(new ContractRef("UserAPI", "1.0.0")));
        context.recordOutput("docs", input("pages", "3"), List.of(), List.of());
        context.recordOutput("frontend", input("bundle", "app.js"), List.of(), List.of());

        NodeInput qa = context.buildNodeInput("qa", graph, null);

        assertThat(qa.ancestorOutputs()).containsOnlyKeys("requirements", "api", "frontend");
        assertThat(qa.dependencyOutputs()).containsOnlyKeys("frontend");
        assertThat(qa.ancestorArtifacts()).containsEntry("api", List.of("openapi.yaml"));
        assertThat(qa.ancestorOutput("docs").isMissingNode()).isTrue();
        assertThat(qa.globalInput().get("ticket").asText()).isEqualTo("WS-42");
        assertThat(qa.activeContracts()).isEmpty();
    }

    @Test
    @DisplayName("Node input lists the contracts active in the registry")
    void nodeInputCarriesActiveContracts() {
        ContractRegistry registry = new ContractRegistry();
        registry.createContract("UserAPI", "1.0.0", input("endpoint", "/users"), "api", List.of("frontend"));
        registry.activateContract("UserAPI", "1.0.0");
        registry.createContract("Draft", "0.1.0", input("endpoint", "/draft"), "api", List.of());

        NodeInput frontend = context.buildNodeInput("frontend", graph, registry);

        assertThat(frontend.activeContracts()).extracting(Contract::name).containsExactly("UserAPI");
        assertThat(frontend.activeContract("UserAPI")).isPresent();
        assertThat(frontend.activeContract("Draft")).isEmpty();
    }

    @Test
    @DisplayName("Second write to a node slot fails and leaves the context unchanged")
    void recordOutputIsWriteOnce() {
        context.recordOutput("requirements", input("stories", "12"), List.of("req.md"), List.of());
        RunCheckpoint before = context.toCheckpoint(List.of());

        assertThatThrownBy(() ->
            context.recordOutput("requirements", input("stories", "99"), List.of("other.md"), List.of()))
            .isInstanceOf(DuplicateWriteException.class);

        RunCheckpoint after = context.toCheckpoint(List.of());
        assertThat(after.outputs()).isEqualTo(before.outputs());
        assertThat(after.artifacts()).isEqualTo(before.artifacts());
        assertThat(after.nodeStates()).isEqualTo(before.nodeStates());
    }

    @Test
    @DisplayName("Explicit retry reset allows the slot to be written again")
    void resetForRetryClearsSlot() {
        context.recordOutput("requirements", input("stories", "12"), List.of(), List.of());

        context.resetForRetry("requirements");
        context.recordOutput("requirements", input("stories", "13"), List.of(), List.of());

        assertThat(context.output("requirements")).get()
            .extracting(out -> out.get("stories").asText())
            .isEqualTo("13");
        assertThat(context.state("requirements").status()).isEqualTo(NodeStatus.PENDING);
    }

    @Test
    @DisplayName("Writes for nodes outside the graph are rejected")
    void unknownNodeIsRejected() {
        assertThatThrownBy(() -> context.recordOutput("ghost", input("x", "y"), List.of(), List.of()))
            .isInstanceOf(UnknownNodeException.class);
    }

    @Test
    @DisplayName("Illegal node status changes are rejected")
    void illegalStateChangeIsRejected() {
        NodeState pending = context.state("requirements");

        assertThatThrownBy(() -> context.updateState(pending.withCompleted(Instant.now())))
            .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    @DisplayName("Global input is isolated from caller and runner mutation")
    void globalInputIsImmutable() {
        ObjectNode original = input("ticket", "WS-42");
        ExecutionContext isolated = ExecutionContext.start("run-2", graph, original);

        original.put("ticket", "changed");
        ((ObjectNode) isolated.globalInput()).put("ticket", "mutated");

        assertThat(isolated.globalInput().get("ticket").asText()).isEqualTo("WS-42");
    }

    @Test
    @DisplayName("Restoring a checkpoint brings RUNNING nodes back to READY")
    void restoreRequeuesRunningNodes() {
        Instant now = Instant.now();
        context.transitionRun(RunStatus.RUNNING);
        context.updateState(context.state("requirements").withReady(now));
        context.updateState(context.state("requirements").withRunning(now));
        context.recordOutput("requirements", input("stories", "12"), List.of("req.md"), List.of());
        context.updateState(context.state("requirements").withCompleted(now));
        context.updateState(context.state("api").withReady(now));
        context.updateState(context.state("api").withRunning(now));

        ExecutionContext restored = ExecutionContext.fromCheckpoint(context.toCheckpoint(List.of()));

        assertThat(restored.runStatus()).isEqualTo(RunStatus.RUNNING);
        assertThat(restored.state("requirements").status()).isEqualTo(NodeStatus.COMPLETED);
        assertThat(restored.state("api").status()).isEqualTo(NodeStatus.READY);
        assertThat(restored.state("api").attempts()).isZero();
        assertThat(restored.output("requirements")).isEqualTo(context.output("requirements"));
        assertThat(restored.artifacts("requirements")).containsExactly("req.md");
        assertThat(restored.checkpointSequence()).isEqualTo(context.checkpointSequence());
    }

    @Test
    @DisplayName("Contracts touched are reported once each in node order")
    void contractsTouchedAreDeduplicated() {
        ContractRef user = new ContractRef("UserAPI", "1.0.0");
        context.recordOutput("api", input("openapi", "v1"), List.of(), List.of(user));
        context.recordOutput("frontend", input("bundle", "app.js"), List.of(),
            List.of(user, new ContractRef("Theme", "2.0.0")));

        assertThat(context.contractsTouched())
            .containsExactly(user, new ContractRef("Theme", "2.0.0"));
    }

    private static ObjectNode input(String key, String value) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(key, value);
        return node;
    }
}
