package com.workstream.audit;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.workstream.core.graph.WorkflowGraph;
import com.workstream.core.model.NodeDefinition;
import com.workstream.core.model.NodeKind;
import com.workstream.core.model.NodeStatus;
import com.workstream.core.model.RunStatus;
import com.workstream.engine.coordinator.NodeReport;
import com.workstream.engine.coordinator.RunReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class StreamStatusAuditGatewayTest {

    private WorkflowGraph graph;
    private StreamStatusAuditGateway gateway;

    @BeforeEach
    void setUp() {
        graph = WorkflowGraph.builder("release")
            .node(node("api", "backend").build())
            .node(node("api_tests", "backend").kind(NodeKind.VALIDATION).dependsOn("api").build())
            .node(node("ui", "frontend").build())
            .node(NodeDefinition.builder("docs").required(false).build())
            .buildValidated();
        gateway = new StreamStatusAuditGateway(graph);
    }

    @Test
    @DisplayName("All streams passing allows deployment")
    void allStreamsPass() {
        RunReport report = report(
            completed("api"), warned("api_tests"), completed("ui"), completed("docs"));

        AuditVerdict verdict = gateway.evaluate(report);

        assertThat(verdict.verdict()).isEqualTo(Verdict.ALL_PASS);
        assertThat(verdict.deploymentAllowed()).isTrue();
        assertThat(verdict.failedStreams()).isEmpty();
        assertThat(verdict.summary()).contains("3 stream(s)").contains("1 warning");
    }

    @Test
    @DisplayName("A skipped required node fails its whole stream")
    void skippedNodeFailsStream() {
        RunReport report = report(
            failed("api", "COMPILE_ERROR"), skipped("api_tests", "api"), completed("ui"), completed("docs"));

        AuditVerdict verdict = gateway.evaluate(report);

        assertThat(verdict.verdict()).isEqualTo(Verdict.STREAM_FAILED);
        assertThat(verdict.failedStreams()).containsExactly("backend");
        assertThat(verdict.deploymentAllowed()).isFalse();
        assertThat(verdict.summary()).contains("COMPILE_ERROR");
    }

    @Test
    @DisplayName("Failures in several streams are reported together")
    void multipleStreamsFail() {
        RunReport report = report(
            completed("api"), failed("api_tests", "CONTRACT_MISMATCH"), failed("ui", "BUILD"), completed("docs"));

        AuditVerdict verdict = gateway.evaluate(report);

        assertThat(verdict.verdict()).isEqualTo(Verdict.MULTIPLE_STREAMS_FAILED);
        assertThat(verdict.failedStreams()).containsExactly("backend", "frontend");
    }

    @Test
    @DisplayName("Failure of a non-required node does not fail its stream")
    void optionalNodeDoesNotFailStream() {
        RunReport report = report(
            completed("api"), completed("api_tests"), completed("ui"), failed("docs", "LINK_CHECK"));

        assertThat(gateway.evaluate(report).verdict()).isEqualTo(Verdict.ALL_PASS);
    }

    @Test
    @DisplayName("Reports of another graph are rejected")
    void foreignReportIsRejected() {
        RunReport foreign = new RunReport("run-9", "other", RunStatus.COMPLETED, Map.of(), Map.of(), Map.of(),
            List.of(), List.of(), null, Instant.now(), Instant.now());

        assertThatThrownBy(() -> gateway.evaluate(foreign))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static NodeDefinition.Builder node(String nodeId, String stream) {
        ObjectNode config = JsonNodeFactory.instance.objectNode();
        config.put(StreamStatusAuditGateway.STREAM_FIELD, stream);
        return NodeDefinition.builder(nodeId).config(config);
    }

    private RunReport report(NodeReport... nodes) {
        Map<String, NodeReport> byId = new LinkedHashMap<>();
        boolean anyRequiredFailed = false;
        for (NodeReport node : nodes) {
            boolean required = graph.node(node.nodeId()).required();
            NodeReport withRequired = new NodeReport(node.nodeId(), node.kind(), required, node.status(),
                node.attempts(), node.errorCode(), node.errorMessage(), node.warning(), node.causeNodeId());
            byId.put(node.nodeId(), withRequired);
            anyRequiredFailed |= required && node.status() == NodeStatus.FAILED;
        }
        Instant now = Instant.now();
        return new RunReport("run-1", "release", anyRequiredFailed ? RunStatus.FAILED : RunStatus.COMPLETED,
            byId, Map.of(), Map.of(), List.of(), List.of(), null, now, now);
    }

    private static NodeReport completed(String nodeId) {
        return new NodeReport(nodeId, NodeKind.PHASE, true, NodeStatus.COMPLETED, 1, null, null, null, null);
    }

    private static NodeReport warned(String nodeId) {
        return new NodeReport(nodeId, NodeKind.VALIDATION, true, NodeStatus.COMPLETED, 1,
            null, null, "coverage below 80%", null);
    }

    private static NodeReport failed(String nodeId, String errorCode) {
        return new NodeReport(nodeId, NodeKind.PHASE, true, NodeStatus.FAILED, 1,
            errorCode, "failed: " + errorCode, null, null);
    }

    private static NodeReport skipped(String nodeId, String cause) {
        return new NodeReport(nodeId, NodeKind.PHASE, true, NodeStatus.SKIPPED, 0,
            null, "ancestor " + cause + " failed", null, cause);
    }
}
