package com.workstream.core.graph;

import com.workstream.core.exception.DuplicateNodeException;
import com.workstream.core.exception.GraphStructureException;
import com.workstream.core.exception.UnknownNodeException;
import com.workstream.core.model.NodeDefinition;
import com.workstream.core.model.NodeStatus;

import java.util.*;
import java.util.function.Function;

/**
 * Directed acyclic graph of nodes, stored as an arena indexed by node id
 * with two adjacency maps (dependencies and dependents).
 *
 * A graph is mutable until {@link #validate()} returns no errors; from then on
 * it is sealed and may be shared by any number of concurrent runs.
 *
 * Invariants once sealed:
 * - every dependency references a node of this graph
 * - no node depends on itself, directly or transitively
 */
public final class WorkflowGraph {

    private final String graphId;
    private final Map<String, NodeDefinition> nodes = new LinkedHashMap<>();
    private final Map<String, Set<String>> dependencies = new LinkedHashMap<>();
    private final Map<String, Set<String>> dependents = new LinkedHashMap<>();

    // Derived on seal
    private volatile boolean sealed;
    private Map<String, Integer> depths = Map.of();
    private Map<String, Integer> indexes = Map.of();
    private List<String> topologicalOrder = List.of();

    public WorkflowGraph(String graphId) {
        if (graphId == null || graphId.isBlank()) {
            throw new IllegalArgumentException("graphId must not be blank");
        }
        this.graphId = graphId;
    }

    /**
     * Start building a graph whose edges come from each node's declared dependencies.
     */
    public static Builder builder(String graphId) {
        return new Builder(graphId);
    }

    public String graphId() {
        return graphId;
    }

    // ========== Mutation ==========

    /**
     * Add a node. Declared dependencies are recorded as edges; they may reference
     * nodes added later and are checked by {@link #validate()}.
     *
     * @throws DuplicateNodeException if the id already exists
     */
    public synchronized void addNode(NodeDefinition node) {
        ensureMutable();
        if (nodes.containsKey(node.nodeId())) {
            throw new DuplicateNodeException(graphId, node.nodeId());
        }
        nodes.put(node.nodeId(), node);
        dependencies.computeIfAbsent(node.nodeId(), k -> new LinkedHashSet<>())
            .addAll(node.dependencies());
        dependents.computeIfAbsent(node.nodeId(), k -> new LinkedHashSet<>());
        for (String dep : node.dependencies()) {
            dependents.computeIfAbsent(dep, k -> new LinkedHashSet<>()).add(node.nodeId());
        }
    }

    /**
     * Record that toId depends on fromId.
     *
     * @throws UnknownNodeException if either id is absent
     */
    public synchronized void addEdge(String fromId, String toId) {
        ensureMutable();
        requireNode(fromId);
        NodeDefinition target = requireNode(toId);
        dependencies.get(toId).add(fromId);
        dependents.get(fromId).add(toId);
        if (!target.dependencies().contains(fromId)) {
            nodes.put(toId, target.withDependency(fromId));
        }
    }

    /**
     * Check referential integrity and acyclicity.
     * An empty result seals the graph.
     *
     * @return validation errors in a stable order, empty when the graph is valid
     */
    public synchronized List<GraphValidationError> validate() {
        if (sealed) {
            return List.of();
        }
        List<GraphValidationError> errors = new ArrayList<>();

        for (Map.Entry<String, Set<String>> entry : dependencies.entrySet()) {
            String nodeId = entry.getKey();
            if (!nodes.containsKey(nodeId)) {
                continue;
            }
            for (String dep : entry.getValue()) {
                if (dep.equals(nodeId)) {
                    errors.add(new GraphValidationError(nodeId, GraphValidationError.Type.SELF_DEPENDENCY,
                        String.format("Node %s depends on itself", nodeId)));
                } else if (!nodes.containsKey(dep)) {
                    errors.add(new GraphValidationError(nodeId, GraphValidationError.Type.UNKNOWN_DEPENDENCY,
                        String.format("Node %s depends on unknown node %s", nodeId, dep)));
                }
            }
        }

        List<String> order = kahnOrder();
        if (order.size() < nodes.size()) {
            for (String nodeId : nodesOnCycles(order)) {
                errors.add(new GraphValidationError(nodeId, GraphValidationError.Type.CYCLE,
                    String.format("Node %s is part of a dependency cycle", nodeId)));
            }
        }

        if (errors.isEmpty()) {
            seal(order);
        }
        return Collections.unmodifiableList(errors);
    }

    public boolean isValidated() {
        return sealed;
    }

    // ========== Scheduling Queries ==========

    /**
     * Dependents of nodeId whose entire dependency set is COMPLETED.
     *
     * @param nodeId   a node that just changed state
     * @param statuses current status per node id; missing ids count as not completed
     */
    public List<String> readySuccessors(String nodeId, Map<String, NodeStatus> statuses) {
        requireNode(nodeId);
        List<String> ready = new ArrayList<>();
        for (String dependent : dependents.get(nodeId)) {
            boolean allDone = dependencies.get(dependent).stream()
                .allMatch(dep -> statuses.get(dep) == NodeStatus.COMPLETED);
            if (allDone) {
                ready.add(dependent);
            }
        }
        return ready;
    }

    /**
     * Nodes without dependencies, in insertion order.
     */
    public List<String> roots() {
        List<String> roots = new ArrayList<>();
        for (String nodeId : nodes.keySet()) {
            if (dependencies.get(nodeId).isEmpty()) {
                roots.add(nodeId);
            }
        }
        return roots;
    }

    /**
     * All transitive ancestors of a node, nearest first.
     */
    public Set<String> ancestors(String nodeId) {
        requireNode(nodeId);
        return traverse(nodeId, dependencies::get);
    }

    /**
     * All transitive dependents of a node, nearest first.
     */
    public Set<String> descendants(String nodeId) {
        requireNode(nodeId);
        return traverse(nodeId, dependents::get);
    }

    /**
     * Longest path from any root to the node. Roots have depth 0.
     */
    public int depth(String nodeId) {
        requireSealed();
        requireNode(nodeId);
        return depths.get(nodeId);
    }

    /**
     * Position of the node in insertion order, used as "graph order".
     */
    public int graphIndex(String nodeId) {
        requireSealed();
        requireNode(nodeId);
        return indexes.get(nodeId);
    }

    public List<String> topologicalOrder() {
        requireSealed();
        return topologicalOrder;
    }

    /**
     * Nodes grouped by depth. Nodes of one level have no edges between them.
     */
    public List<List<String>> executionLevels() {
        requireSealed();
        SortedMap<Integer, List<String>> levels = new TreeMap<>();
        for (String nodeId : topologicalOrder) {
            levels.computeIfAbsent(depths.get(nodeId), k -> new ArrayList<>()).add(nodeId);
        }
        List<List<String>> result = new ArrayList<>();
        for (List<String> level : levels.values()) {
            result.add(Collections.unmodifiableList(level));
        }
        return Collections.unmodifiableList(result);
    }

    // ========== Accessors ==========

    public NodeDefinition node(String nodeId) {
        return requireNode(nodeId);
    }

    public boolean contains(String nodeId) {
        return nodes.containsKey(nodeId);
    }

    public List<String> nodeIds() {
        return List.copyOf(nodes.keySet());
    }

    public Collection<NodeDefinition> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public Set<String> dependencies(String nodeId) {
        requireNode(nodeId);
        return Collections.unmodifiableSet(dependencies.get(nodeId));
    }

    public Set<String> dependents(String nodeId) {
        requireNode(nodeId);
        return Collections.unmodifiableSet(dependents.get(nodeId));
    }

    public int size() {
        return nodes.size();
    }

    // ========== Internal Methods ==========

    private List<String> kahnOrder() {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (String nodeId : nodes.keySet()) {
            int known = (int) dependencies.get(nodeId).stream().filter(nodes::containsKey).count();
            inDegree.put(nodeId, known);
        }

        Deque<String> queue = new ArrayDeque<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) {
                queue.add(id);
            }
        });

        List<String> order = new ArrayList<>();
        while (!queue.isEmpty()) {
            String current = queue.poll();
            order.add(current);
            for (String dependent : dependents.getOrDefault(current, Set.of())) {
                if (!nodes.containsKey(dependent)) {
                    continue;
                }
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    queue.add(dependent);
                }
            }
        }
        return order;
    }

    /**
     * Nodes left over by Kahn's algorithm, minus those that are merely downstream
     * of a cycle. Self-loops are reported separately and excluded here.
     */
    private List<String> nodesOnCycles(List<String> resolvedOrder) {
        Set<String> remaining = new LinkedHashSet<>(nodes.keySet());
        remaining.removeAll(resolvedOrder);

        Map<String, Integer> outDegree = new HashMap<>();
        for (String nodeId : remaining) {
            int count = 0;
            for (String dependent : dependents.get(nodeId)) {
                if (remaining.contains(dependent) && !dependent.equals(nodeId)) {
                    count++;
                }
            }
            outDegree.put(nodeId, count);
        }
        Deque<String> queue = new ArrayDeque<>();
        outDegree.forEach((id, degree) -> {
            if (degree == 0) {
                queue.add(id);
            }
        });
        Set<String> trimmed = new HashSet<>();
        while (!queue.isEmpty()) {
            String current = queue.poll();
            trimmed.add(current);
            for (String dep : dependencies.get(current)) {
                if (remaining.contains(dep) && !dep.equals(current) && !trimmed.contains(dep)) {
                    if (outDegree.merge(dep, -1, Integer::sum) == 0) {
                        queue.add(dep);
                    }
                }
            }
        }

        List<String> onCycle = new ArrayList<>();
        for (String nodeId : remaining) {
            if (!trimmed.contains(nodeId)) {
                onCycle.add(nodeId);
            }
        }
        return onCycle;
    }

    private void seal(List<String> order) {
        Map<String, Integer> depthMap = new HashMap<>();
        for (String nodeId : order) {
            int depth = 0;
            for (String dep : dependencies.get(nodeId)) {
                depth = Math.max(depth, depthMap.get(dep) + 1);
            }
            depthMap.put(nodeId, depth);
        }
        Map<String, Integer> indexMap = new HashMap<>();
        int i = 0;
        for (String nodeId : nodes.keySet()) {
            indexMap.put(nodeId, i++);
        }
        this.depths = Collections.unmodifiableMap(depthMap);
        this.indexes = Collections.unmodifiableMap(indexMap);
        this.topologicalOrder = List.copyOf(order);
        this.sealed = true;
    }

    private Set<String> traverse(String start, Function<String, Set<String>> next) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>(next.apply(start));
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (nodes.containsKey(current) && visited.add(current)) {
                queue.addAll(next.apply(current));
            }
        }
        visited.remove(start);
        return visited;
    }

    private NodeDefinition requireNode(String nodeId) {
        NodeDefinition node = nodes.get(nodeId);
        if (node == null) {
            throw new UnknownNodeException(graphId, nodeId);
        }
        return node;
    }

    private void ensureMutable() {
        if (sealed) {
            throw new IllegalStateException("Graph " + graphId + " is validated and read-only");
        }
    }

    private void requireSealed() {
        if (!sealed) {
            throw new IllegalStateException("Graph " + graphId + " has not been validated");
        }
    }

    /**
     * Collects node definitions and wires their declared dependencies.
     */
    public static final class Builder {
        private final WorkflowGraph graph;

        private Builder(String graphId) {
            this.graph = new WorkflowGraph(graphId);
        }

        public Builder node(NodeDefinition node) {
            graph.addNode(node);
            return this;
        }

        public Builder edge(String fromId, String toId) {
            graph.addEdge(fromId, toId);
            return this;
        }

        /**
         * Graph as built, without validation.
         */
        public WorkflowGraph build() {
            return graph;
        }

        /**
         * Validate and return the sealed graph.
         *
         * @throws GraphStructureException if validation fails
         */
        public WorkflowGraph buildValidated() {
            List<GraphValidationError> errors = graph.validate();
            if (!errors.isEmpty()) {
                throw new GraphStructureException(errors);
            }
            return graph;
        }
    }
}
