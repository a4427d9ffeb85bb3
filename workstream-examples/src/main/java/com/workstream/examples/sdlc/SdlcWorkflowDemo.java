package com.workstream.examples.sdlc;

import com.fasterxml.jackson.databind.JsonNode;
import com.workstream.audit.AuditVerdict;
import com.workstream.audit.StreamStatusAuditGateway;
import com.workstream.core.graph.WorkflowGraph;
import com.workstream.core.model.ExecutionEventType;
import com.workstream.engine.context.ContextStore;
import com.workstream.engine.contract.ContractRegistry;
import com.workstream.engine.coordinator.DagExecutor;
import com.workstream.engine.coordinator.ExecutorSettings;
import com.workstream.engine.coordinator.NodeReport;
import com.workstream.engine.coordinator.RunReport;
import com.workstream.engine.persistence.InMemoryCheckpointRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Demonstration runner for the SDLC delivery workflow.
 *
 * Shows:
 * 1. Normal execution with backend and frontend in parallel
 * 2. Automatic retry of a flaky frontend build
 * 3. Contract drift caught by a validation node, blocking deployment
 * 4. The same drift in warning mode
 */
public class SdlcWorkflowDemo {

    private static final Logger log = LoggerFactory.getLogger(SdlcWorkflowDemo.class);

    private final WorkflowGraph graph = SdlcWorkflow.createGraph();
    private final StreamStatusAuditGateway gateway = new StreamStatusAuditGateway(graph);

    public static void main(String[] args) {
        SdlcWorkflowDemo demo = new SdlcWorkflowDemo();

        log.info("========== SDLC DELIVERY WORKFLOW DEMONSTRATION ==========");
        demo.run("Normal execution", SdlcWorkflow.createInput("storefront"), true);
        demo.run("Retry on flaky frontend build", SdlcWorkflow.createInput("storefront", 2, false, false), true);
        demo.run("Contract drift blocks deployment", SdlcWorkflow.createInput("storefront", 0, true, false), true);
        demo.run("Contract drift in warning mode", SdlcWorkflow.createInput("storefront", 0, true, false), false);
        log.info("========== ALL DEMONSTRATIONS COMPLETE ==========");
    }

    /**
     * Runs the workflow once on a fresh executor and contract registry, then audits it.
     */
    public AuditVerdict run(String title, JsonNode input, boolean failOnValidationError) {
        log.info("---------- {} ----------", title);

        DagExecutor executor = new DagExecutor(
            SdlcWorkflow.createRunners(),
            new ContextStore(new InMemoryCheckpointRepository()),
            ExecutorSettings.builder()
                .maxParallelism(4)
                .failOnValidationError(failOnValidationError)
                .build());
        executor.addListener(event -> {
            if (event.type() == ExecutionEventType.NODE_RETRY_SCHEDULED) {
                log.info("Retry scheduled for {} after {}: {}", event.nodeId(), event.errorCode(), event.detail());
            }
        });

        try {
            RunReport report = executor.execute(graph, new ContractRegistry(), input);
            for (NodeReport node : report.nodes().values()) {
                log.info("  {} -> {} (attempts={}{})", node.nodeId(), node.status(), node.attempts(),
                    node.errorCode() == null ? "" : ", error=" + node.errorCode());
            }
            log.info("Run {} finished {} in {} ms, contracts touched: {}",
                report.runId(), report.status(), report.duration().toMillis(), report.contractsTouched());

            AuditVerdict verdict = gateway.evaluate(report);
            log.info("Audit verdict: {} (deployment allowed: {})", verdict.verdict(), verdict.deploymentAllowed());
            return verdict;
        } finally {
            executor.shutdown();
        }
    }
}
