package com.workstream.recovery;

import com.workstream.core.graph.WorkflowGraph;

import java.util.Optional;

/**
 * Supplies the graph a checkpointed run was started with.
 * Checkpoints hold run state only, never graph structure.
 */
@FunctionalInterface
public interface GraphResolver {

    /**
     * @return the validated graph, or empty if this process does not know the graph
     */
    Optional<WorkflowGraph> resolve(String graphId);
}
