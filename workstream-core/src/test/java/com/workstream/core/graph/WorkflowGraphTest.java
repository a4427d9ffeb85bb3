package com.workstream.core.graph;

import com.workstream.core.exception.DuplicateNodeException;
import com.workstream.core.exception.GraphStructureException;
import com.workstream.core.exception.UnknownNodeException;
import com.workstream.core.model.NodeDefinition;
import com.workstream.core.model.NodeStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class WorkflowGraphTest {

    private static NodeDefinition node(String id, String... deps) {
        return NodeDefinition.builder(id).dependsOn(deps).build();
    }

    // ========== Construction ==========

    @Test
    @DisplayName("Adding a node id twice is rejected")
    void addNode_duplicateId_shouldFail() {
        WorkflowGraph graph = new WorkflowGraph("g");
        graph.addNode(node("a"));

        assertThatThrownBy(() -> graph.addNode(node("a")))
            .isInstanceOf(DuplicateNodeException.class)
            .hasMessageContaining("a");
    }

    @Test
    @DisplayName("Edges between unknown nodes are rejected")
    void addEdge_unknownNode_shouldFail() {
        WorkflowGraph graph = new WorkflowGraph("g");
        graph.addNode(node("a"));

        assertThatThrownBy(() -> graph.addEdge("a", "missing"))
            .isInstanceOf(UnknownNodeException.class)
            .isInstanceOf(GraphStructureException.class);
        assertThatThrownBy(() -> graph.addEdge("missing", "a"))
            .isInstanceOf(UnknownNodeException.class);
    }

    @Test
    @DisplayName("addEdge records the dependency on the target node definition")
    void addEdge_shouldUpdateAdjacency() {
        WorkflowGraph graph = new WorkflowGraph("g");
        graph.addNode(node("a"));
        graph.addNode(node("b"));
        graph.addEdge("a", "b");

        assertThat(graph.validate()).isEmpty();
        assertThat(graph.dependencies("b")).containsExactly("a");
        assertThat(graph.dependents("a")).containsExactly("b");
        assertThat(graph.node("b").dependencies()).containsExactly("a");
    }

    // ========== Validation ==========

    @Test
    @DisplayName("A valid diamond graph produces no errors and is sealed")
    void validate_validGraph_shouldSeal() {
        WorkflowGraph graph = WorkflowGraph.builder("diamond")
            .node(node("a"))
            .node(node("b", "a"))
            .node(node("c", "a"))
            .node(node("d", "b", "c"))
            .build();

        assertThat(graph.validate()).isEmpty();
        assertThat(graph.isValidated()).isTrue();
        assertThatThrownBy(() -> graph.addNode(node("e")))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("A cycle is reported for each node on it and not for nodes merely downstream")
    void validate_cycle_shouldIdentifyNodesOnCycle() {
        WorkflowGraph graph = WorkflowGraph.builder("cyclic")
            .node(node("root"))
            .node(node("a", "root", "c"))
            .node(node("b", "a"))
            .node(node("c", "b"))
            .node(node("tail", "c"))
            .build();

        List<GraphValidationError> errors = graph.validate();

        assertThat(errors).extracting(GraphValidationError::type)
            .containsOnly(GraphValidationError.Type.CYCLE);
        assertThat(errors).extracting(GraphValidationError::nodeId)
            .containsExactlyInAnyOrder("a", "b", "c");
        assertThat(graph.isValidated()).isFalse();
    }

    @Test
    @DisplayName("Self dependency and unknown dependency are both reported")
    void validate_referentialErrors_shouldBeReported() {
        WorkflowGraph graph = WorkflowGraph.builder("broken")
            .node(node("self", "self"))
            .node(node("orphan", "ghost"))
            .build();

        List<GraphValidationError> errors = graph.validate();

        assertThat(errors).extracting(GraphValidationError::type)
            .containsExactly(GraphValidationError.Type.SELF_DEPENDENCY,
                GraphValidationError.Type.UNKNOWN_DEPENDENCY);
    }

    @Test
    @DisplayName("buildValidated throws with the collected errors")
    void buildValidated_invalidGraph_shouldThrow() {
        WorkflowGraph.Builder builder = WorkflowGraph.builder("loop")
            .node(node("x", "y"))
            .node(node("y", "x"));

        assertThatThrownBy(builder::buildValidated)
            .isInstanceOfSatisfying(GraphStructureException.class,
                e -> assertThat(e.getErrors()).hasSize(2));
    }

    // ========== Queries ==========

    @Test
    @DisplayName("readySuccessors only returns dependents whose whole dependency set completed")
    void readySuccessors_shouldRequireAllDependencies() {
        WorkflowGraph graph = WorkflowGraph.builder("diamond")
            .node(node("a"))
            .node(node("b", "a"))
            .node(node("c", "a"))
            .node(node("d", "b", "c"))
            .buildValidated();

        Map<String, NodeStatus> statuses = new HashMap<>();
        statuses.put("a", NodeStatus.COMPLETED);
        assertThat(graph.readySuccessors("a", statuses)).containsExactly("b", "c");

        statuses.put("b", NodeStatus.COMPLETED);
        statuses.put("c", NodeStatus.RUNNING);
        assertThat(graph.readySuccessors("b", statuses)).isEmpty();

        statuses.put("c", NodeStatus.COMPLETED);
        assertThat(graph.readySuccessors("c", statuses)).containsExactly("d");
    }

    @Test
    @DisplayName("Depth is the longest path from a root")
    void depth_shouldUseLongestPath() {
        WorkflowGraph graph = WorkflowGraph.builder("g")
            .node(node("a"))
            .node(node("b", "a"))
            .node(node("c", "b"))
            .node(node("d", "a", "c"))
            .buildValidated();

        assertThat(graph.depth("a")).isZero();
        assertThat(graph.depth("c")).isEqualTo(2);
        assertThat(graph.depth("d")).isEqualTo(3);
        assertThat(graph.executionLevels()).containsExactly(
            List.of("a"), List.of("b"), List.of("c"), List.of("d"));
    }

    @Test
    @DisplayName("Ancestors and descendants are transitive")
    void ancestorsAndDescendants_shouldBeTransitive() {
        WorkflowGraph graph = WorkflowGraph.builder("chain")
            .node(node("a"))
            .node(node("b", "a"))
            .node(node("c", "b"))
            .node(node("side"))
            .buildValidated();

        assertThat(graph.ancestors("c")).containsExactlyInAnyOrder("a", "b");
        assertThat(graph.descendants("a")).containsExactlyInAnyOrder("b", "c");
        assertThat(graph.ancestors("side")).isEmpty();
        assertThat(graph.roots()).containsExactly("a", "side");
    }

    @Test
    @DisplayName("Topological order respects every edge")
    void topologicalOrder_shouldRespectEdges() {
        WorkflowGraph graph = WorkflowGraph.builder("g")
            .node(node("d", "b", "c"))
            .node(node("c", "a"))
            .node(node("b", "a"))
            .node(node("a"))
            .buildValidated();

        List<String> order = graph.topologicalOrder();

        assertThat(order.indexOf("a")).isLessThan(order.indexOf("b"));
        assertThat(order.indexOf("a")).isLessThan(order.indexOf("c"));
        assertThat(order.indexOf("b")).isLessThan(order.indexOf("d"));
        assertThat(order.indexOf("c")).isLessThan(order.indexOf("d"));
        assertThat(graph.graphIndex("d")).isZero();
    }

    @Test
    @DisplayName("Structural queries require a validated graph")
    void depth_beforeValidation_shouldFail() {
        WorkflowGraph graph = new WorkflowGraph("g");
        graph.addNode(node("a"));

        assertThatThrownBy(() -> graph.depth("a")).isInstanceOf(IllegalStateException.class);
    }
}
