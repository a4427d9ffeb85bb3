package com.workstream.audit;

import com.workstream.engine.coordinator.RunReport;

/**
 * Decides from a terminal run report whether the produced work may be deployed.
 * Called by whoever ran the graph; the executor never calls it.
 */
@FunctionalInterface
public interface AuditGateway {

    AuditVerdict evaluate(RunReport report);
}
