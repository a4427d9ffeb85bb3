package com.workstream.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.workstream.core.graph.WorkflowGraph;
import com.workstream.core.model.NodeStatus;
import com.workstream.engine.coordinator.NodeReport;
import com.workstream.engine.coordinator.RunReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Audit gateway that judges streams of work by the final status of their nodes.
 *
 * A node belongs to the stream named by the {@code stream} field of its config,
 * or to a stream of its own when the field is absent. A stream fails when any of
 * its required nodes ended FAILED or SKIPPED. Nodes that completed with a warning
 * do not fail their stream.
 */
public class StreamStatusAuditGateway implements AuditGateway {

    private static final Logger log = LoggerFactory.getLogger(StreamStatusAuditGateway.class);

    public static final String STREAM_FIELD = "stream";

    private final WorkflowGraph graph;

    public StreamStatusAuditGateway(WorkflowGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    @Override
    public AuditVerdict evaluate(RunReport report) {
        if (!graph.graphId().equals(report.graphId())) {
            throw new IllegalArgumentException(String.format(
                "Run %s belongs to graph %s, this gateway audits graph %s",
                report.runId(), report.graphId(), graph.graphId()));
        }

        Map<String, List<NodeReport>> streams = new TreeMap<>();
        for (NodeReport node : report.nodes().values()) {
            streams.computeIfAbsent(streamOf(node.nodeId()), s -> new ArrayList<>()).add(node);
        }

        List<String> failed = new ArrayList<>();
        List<String> reasons = new ArrayList<>();
        for (Map.Entry<String, List<NodeReport>> stream : streams.entrySet()) {
            for (NodeReport node : stream.getValue()) {
                if (node.required() && (node.status() == NodeStatus.FAILED || node.status() == NodeStatus.SKIPPED)) {
                    failed.add(stream.getKey());
                    reasons.add(String.format("%s: %s %s%s", stream.getKey(), node.nodeId(), node.status(),
                        node.errorCode() == null ? "" : " (" + node.errorCode() + ")"));
                    break;
                }
            }
        }

        int warnings = report.nodesWithWarnings().size();
        String summary = failed.isEmpty()
            ? String.format("All %d stream(s) passed for run %s (%d warning(s))", streams.size(), report.runId(), warnings)
            : String.format("%d of %d stream(s) failed for run %s: %s",
                failed.size(), streams.size(), report.runId(), String.join("; ", reasons));

        AuditVerdict verdict = AuditVerdict.of(failed, summary);
        if (verdict.deploymentAllowed()) {
            log.info("Audit of run {}: {}", report.runId(), summary);
        } else {
            log.warn("Audit of run {} blocked deployment: {}", report.runId(), summary);
        }
        return verdict;
    }

    private String streamOf(String nodeId) {
        if (!graph.contains(nodeId)) {
            return nodeId;
        }
        JsonNode stream = graph.node(nodeId).config().get(STREAM_FIELD);
        return stream == null || !stream.isTextual() || stream.asText().isBlank() ? nodeId : stream.asText();
    }
}
