package com.workstream.engine.logging;

import org.slf4j.MDC;

import java.util.Map;
import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures all logs include the run, node and contract they concern.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forNode(runId, nodeId, attempt)) {
 *     log.info("Dispatching node"); // Automatically includes runId, nodeId, attempt
 * }
 * </pre>
 *
 * Log output with MDC:
 * 2024-01-15 10:30:45.123 [workstream-node-1] INFO  c.w.e.c.DagExecutor - Node completed
 *   runId=run-42 nodeId=backend_api attempt=1 traceId=9f2c01ab
 */
public final class LoggingContext implements AutoCloseable {

    public static final String RUN_ID = "runId";
    public static final String GRAPH_ID = "graphId";
    public static final String NODE_ID = "nodeId";
    public static final String ATTEMPT = "attempt";
    public static final String CONTRACT = "contract";
    public static final String CONTRACT_VERSION = "contractVersion";
    public static final String TRACE_ID = "traceId";

    private final Map<String, String> previous;

    private LoggingContext() {
        // Private constructor - use static factory methods
        this.previous = MDC.getCopyOfContextMap();
    }

    /**
     * Create a logging context for run-level operations.
     */
    public static LoggingContext forRun(String runId, String graphId) {
        LoggingContext ctx = new LoggingContext();
        if (runId != null) {
            MDC.put(RUN_ID, runId);
        }
        if (graphId != null) {
            MDC.put(GRAPH_ID, graphId);
        }
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for node-level operations.
     */
    public static LoggingContext forNode(String runId, String nodeId, int attempt) {
        LoggingContext ctx = new LoggingContext();
        if (runId != null) {
            MDC.put(RUN_ID, runId);
        }
        if (nodeId != null) {
            MDC.put(NODE_ID, nodeId);
        }
        MDC.put(ATTEMPT, String.valueOf(attempt));
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for contract registry operations.
     */
    public static LoggingContext forContract(String name, String version) {
        LoggingContext ctx = new LoggingContext();
        if (name != null) {
            MDC.put(CONTRACT, name);
        }
        if (version != null) {
            MDC.put(CONTRACT_VERSION, version);
        }
        return ctx;
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    /**
     * Restore the MDC exactly as it was when this context was opened, so nested
     * scopes leave the enclosing one intact and pooled threads carry nothing over.
     */
    @Override
    public void close() {
        if (previous == null) {
            MDC.clear();
        } else {
            MDC.setContextMap(previous);
        }
    }
}
