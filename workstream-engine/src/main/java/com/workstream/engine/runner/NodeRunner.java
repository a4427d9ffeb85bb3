package com.workstream.engine.runner;

/**
 * Execution strategy for a node, implemented by callers.
 *
 * Runners are invoked on executor pool threads and may block. They must be
 * thread-safe if the same instance serves several nodes or runs.
 *
 * Example:
 * <pre>
 * NodeRunner runner = invocation -> {
 *     String module = invocation.config().path("module").asText();
 *     JsonNode requirements = invocation.input().ancestorOutputs().get("requirements");
 *     return NodeResult.success(generate(module, requirements));
 * };
 * </pre>
 */
@FunctionalInterface
public interface NodeRunner {

    /**
     * Execute one attempt of a node.
     *
     * @param invocation node definition, assembled input and run services
     * @return success with output, or failure
     * @throws NodeRunnerException for failures that carry a code and retry hint
     */
    NodeResult run(NodeInvocation invocation) throws NodeRunnerException;
}
