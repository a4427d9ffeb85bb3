package com.workstream.engine.metrics;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for the workstream engine.
 *
 * Metrics exposed:
 * - Runs started and finished by outcome, run duration
 * - Node completions, failures, retries and skips by kind
 * - Node execution duration
 * - Checkpoint failures
 * - Contract change events by type
 * - Gauges for active runs and running nodes
 *
 * Recording is a no-op until {@link #bindTo(MeterRegistry)} is called.
 */
@Component
public class WorkflowMetrics implements MeterBinder {

    // Metric names
    public static final String RUNS_ACTIVE = "workstream.runs.active";
    public static final String RUNS_STARTED = "workstream.runs.started";
    public static final String RUNS_FINISHED = "workstream.runs.finished";
    public static final String RUN_DURATION = "workstream.run.duration";

    public static final String NODES_RUNNING = "workstream.nodes.running";
    public static final String NODE_DURATION = "workstream.node.duration";
    public static final String NODE_OUTCOMES = "workstream.node.outcomes";
    public static final String NODE_RETRIES = "workstream.node.retries";
    public static final String NODE_SKIPS = "workstream.node.skips";

    public static final String CHECKPOINT_FAILURES = "workstream.checkpoint.failures";
    public static final String CONTRACT_EVENTS = "workstream.contract.events";

    private volatile MeterRegistry registry;

    private final AtomicInteger activeRuns = new AtomicInteger(0);
    private final AtomicInteger runningNodes = new AtomicInteger(0);
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        Gauge.builder(RUNS_ACTIVE, activeRuns, AtomicInteger::get)
            .description("Number of runs currently executing")
            .register(registry);

        Gauge.builder(NODES_RUNNING, runningNodes, AtomicInteger::get)
            .description("Number of node attempts currently executing")
            .register(registry);
    }

    // ========== Run Metrics ==========

    public void runStarted(String graphId, boolean resumed) {
        if (registry == null) {
            return;
        }
        counter(RUNS_STARTED, "Total runs started or resumed",
            "graph", graphId, "resumed", String.valueOf(resumed)).increment();
        activeRuns.incrementAndGet();
    }

    public void runFinished(String graphId, String status, Duration duration) {
        if (registry == null) {
            return;
        }
        counter(RUNS_FINISHED, "Total runs finished",
            "graph", graphId, "status", status).increment();

        Timer.builder(RUN_DURATION)
            .tag("graph", graphId)
            .tag("status", status)
            .description("Run execution duration")
            .register(registry)
            .record(duration);

        activeRuns.updateAndGet(v -> Math.max(0, v - 1));
    }

    // ========== Node Metrics ==========

    public void nodeStarted() {
        if (registry == null) {
            return;
        }
        runningNodes.incrementAndGet();
    }

    /**
     * Record the end of a node attempt.
     *
     * @param outcome one of completed, warning, retry, failed, abandoned
     */
    public void nodeFinished(String graphId, String kind, String outcome, long durationMs) {
        if (registry == null) {
            return;
        }
        counter(NODE_OUTCOMES, "Node attempt outcomes",
            "graph", graphId, "kind", kind, "outcome", outcome).increment();

        Timer.builder(NODE_DURATION)
            .tag("graph", graphId)
            .tag("kind", kind)
            .tag("outcome", outcome)
            .description("Node attempt duration")
            .register(registry)
            .record(Duration.ofMillis(durationMs));

        runningNodes.updateAndGet(v -> Math.max(0, v - 1));
    }

    public void nodeRetried(String graphId, String kind, String errorCode) {
        if (registry == null) {
            return;
        }
        counter(NODE_RETRIES, "Node retries scheduled",
            "graph", graphId, "kind", kind, "error_code", sanitize(errorCode)).increment();
    }

    public void nodeSkipped(String graphId, String kind) {
        if (registry == null) {
            return;
        }
        counter(NODE_SKIPS, "Nodes skipped",
            "graph", graphId, "kind", kind).increment();
    }

    // ========== Persistence and Contract Metrics ==========

    public void checkpointFailed(String graphId) {
        if (registry == null) {
            return;
        }
        counter(CHECKPOINT_FAILURES, "Checkpoint writes that failed",
            "graph", graphId).increment();
    }

    public void contractChanged(String eventType) {
        if (registry == null) {
            return;
        }
        counter(CONTRACT_EVENTS, "Contract change events",
            "type", eventType).increment();
    }

    // ========== Helper Methods ==========

    public int activeRunCount() {
        return activeRuns.get();
    }

    private Counter counter(String name, String description, String... tags) {
        String key = name + String.join("|", tags);
        return counters.computeIfAbsent(key, k -> Counter.builder(name)
            .tags(tags)
            .description(description)
            .register(registry));
    }

    /**
     * Normalize an error code for use as a metric tag.
     */
    private String sanitize(String errorCode) {
        if (errorCode == null || errorCode.isBlank()) {
            return "unspecified";
        }
        String sanitized = errorCode.toLowerCase()
            .replaceAll("[^a-z0-9_]", "_")
            .replaceAll("_+", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
