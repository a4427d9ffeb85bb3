package com.workstream.engine.coordinator;

import com.fasterxml.jackson.databind.JsonNode;
import com.workstream.core.exception.CheckpointException;
import com.workstream.core.exception.ContractDriftException;
import com.workstream.core.exception.GraphStructureException;
import com.workstream.core.exception.InvalidTransitionException;
import com.workstream.core.graph.WorkflowGraph;
import com.workstream.core.model.Contract;
import com.workstream.core.model.ContractSnapshot;
import com.workstream.core.model.ExecutionEvent;
import com.workstream.core.model.ExecutionEventType;
import com.workstream.core.model.NodeDefinition;
import com.workstream.core.model.NodeState;
import com.workstream.core.model.NodeStatus;
import com.workstream.core.model.RetryPolicy;
import com.workstream.core.model.RunCheckpoint;
import com.workstream.core.model.RunStatus;
import com.workstream.core.repository.ExecutionEventRepository;
import com.workstream.engine.context.ContextStore;
import com.workstream.engine.context.ExecutionContext;
import com.workstream.engine.context.NodeInput;
import com.workstream.engine.contract.ContractRegistry;
import com.workstream.engine.logging.LoggingContext;
import com.workstream.engine.metrics.WorkflowMetrics;
import com.workstream.engine.runner.NodeInvocation;
import com.workstream.engine.runner.NodeResult;
import com.workstream.engine.runner.NodeRunner;
import com.workstream.engine.runner.NodeRunnerException;
import com.workstream.engine.runner.NodeRunnerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Scheduler that walks a validated {@link WorkflowGraph} and runs its nodes.
 *
 * Execution proceeds in waves. Each wave picks the READY nodes that are due
 * (backoff elapsed), dispatches them, and waits for all of them before the ready
 * set is recomputed:
 * <ul>
 *   <li>parallel-eligible nodes are dispatched together, ordered by (depth, node id)
 *       and capped at maxParallelism</li>
 *   <li>if no parallel-eligible node is ready, one sequential node runs alone,
 *       lowest graph index first</li>
 * </ul>
 *
 * Results are committed on the coordinating thread: on success the output is
 * recorded, the node completes, a checkpoint is written and newly ready successors
 * are promoted. On failure the node is retried with backoff while its budget lasts;
 * after that it fails and every transitive dependent is skipped. A node whose
 * {@link com.workstream.core.model.NodeCondition} does not hold is skipped together
 * with its dependents instead of being dispatched.
 *
 * A node timeout counts from the moment its runner starts on a pool thread; time
 * spent queued behind other runs does not count. A timed-out or abandoned runner
 * is interrupted.
 *
 * Run lifecycle: NOT_STARTED -> RUNNING -> {COMPLETED, FAILED, CANCELLED}, with
 * RUNNING -> PAUSED -> RUNNING when a run is paused between waves and resumed.
 *
 * Several runs may execute concurrently, including runs of the same graph; they
 * share the node thread pool.
 */
public class DagExecutor {

    private static final Logger log = LoggerFactory.getLogger(DagExecutor.class);

    public static final String NO_RUNNER = "NO_RUNNER";
    public static final String RUNNER_ERROR = "RUNNER_ERROR";
    public static final String TIMED_OUT = "TIMED_OUT";
    public static final String CANCELLED = "CANCELLED";
    public static final String NOT_REACHED = "NOT_REACHED";
    public static final String CONDITION_NOT_MET = "CONDITION_NOT_MET";

    private final NodeRunnerRegistry runners;
    private final ContextStore contextStore;
    private final ExecutorSettings settings;
    private final WorkflowMetrics metrics;
    private final ExecutionEventRepository eventRepository;

    private final ExecutorService nodePool;
    private final ExecutorService runPool;
    private final ScheduledExecutorService timeoutTimer;
    private final Map<String, RunHandle> activeRuns = new ConcurrentHashMap<>();
    private final List<ExecutionEventListener> listeners = new CopyOnWriteArrayList<>();
    private volatile boolean shuttingDown = false;

    public DagExecutor(NodeRunnerRegistry runners, ContextStore contextStore, ExecutorSettings settings) {
        this(runners, contextStore, settings, new WorkflowMetrics(), null);
    }

    public DagExecutor(
            NodeRunnerRegistry runners,
            ContextStore contextStore,
            ExecutorSettings settings,
            WorkflowMetrics metrics,
            ExecutionEventRepository eventRepository) {
        this.runners = runners;
        this.contextStore = contextStore;
        this.settings = settings;
        this.metrics = metrics != null ? metrics : new WorkflowMetrics();
        this.eventRepository = eventRepository;
        this.nodePool = Executors.newFixedThreadPool(settings.maxParallelism(), namedThreads("workstream-node-"));
        this.runPool = Executors.newCachedThreadPool(namedThreads("workstream-run-"));
        this.timeoutTimer = Executors.newSingleThreadScheduledExecutor(namedThreads("workstream-timeout-"));
    }

    public void addListener(ExecutionEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    // ========== Run Control ==========

    /**
     * Execute a graph to completion under a generated run id.
     *
     * @throws GraphStructureException if the graph has not passed validation
     */
    public RunReport execute(WorkflowGraph graph, ContractRegistry registry, JsonNode globalInput) {
        return execute(UUID.randomUUID().toString(), graph, registry, globalInput);
    }

    /**
     * Execute a graph to completion under a caller-chosen run id. Blocks the caller.
     *
     * @throws GraphStructureException if the graph has not passed validation
     * @throws InvalidTransitionException if a run with this id is already active
     */
    public RunReport execute(String runId, WorkflowGraph graph, ContractRegistry registry, JsonNode globalInput) {
        requireValidated(graph);
        RunHandle handle = register(runId, graph.graphId());
        try {
            ExecutionContext context = ExecutionContext.start(runId, graph, globalInput);
            return drive(new RunState(handle, context, graph, registry), false);
        } finally {
            activeRuns.remove(runId);
        }
    }

    /**
     * Start a run on a background thread. The run is registered before this
     * method returns, so it can be cancelled immediately.
     */
    public CompletableFuture<RunReport> executeAsync(String runId, WorkflowGraph graph,
                                                     ContractRegistry registry, JsonNode globalInput) {
        requireValidated(graph);
        RunHandle handle = register(runId, graph.graphId());
        try {
            return CompletableFuture.supplyAsync(() -> {
                try {
                    ExecutionContext context = ExecutionContext.start(runId, graph, globalInput);
                    return drive(new RunState(handle, context, graph, registry), false);
                } finally {
                    activeRuns.remove(runId);
                }
            }, runPool);
        } catch (RejectedExecutionException e) {
            activeRuns.remove(runId);
            throw e;
        }
    }

    /**
     * Continue a run from its last checkpoint, including a PAUSED one. Completed nodes
     * are not re-run; nodes that were running at the time of the checkpoint run again.
     *
     * @param graph    the same graph the run was started with
     * @param registry must still hold every ACTIVE or LOCKED contract version recorded
     *                 in the checkpoint, with the same specification
     * @throws com.workstream.core.exception.NotFoundException if the run has no checkpoint
     * @throws GraphStructureException if the graph does not match the checkpoint
     * @throws InvalidTransitionException if the run already reached a terminal status
     * @throws ContractDriftException if a live contract version of the checkpoint is
     *                                missing from the registry or was changed
     */
    public RunReport resume(String runId, WorkflowGraph graph, ContractRegistry registry) {
        requireValidated(graph);
        ExecutionContext context = contextStore.restore(runId);
        if (!graph.graphId().equals(context.graphId())
                || !new HashSet<>(graph.nodeIds()).equals(new HashSet<>(context.nodeIds()))) {
            throw new GraphStructureException(String.format(
                "Checkpoint of run %s was taken for graph %s with nodes %s, not for graph %s",
                runId, context.graphId(), context.nodeIds(), graph.graphId()));
        }
        if (context.runStatus().isTerminal()) {
            throw new InvalidTransitionException(String.format(
                "Run %s already finished with status %s", runId, context.runStatus()));
        }
        verifyContracts(context, registry);
        RunHandle handle = register(runId, graph.graphId());
        try {
            return drive(new RunState(handle, context, graph, registry), true);
        } finally {
            activeRuns.remove(runId);
        }
    }

    /**
     * Request cooperative cancellation. No new node is dispatched after this call;
     * running nodes get the configured grace period before they are abandoned.
     *
     * @return false if no active run has this id
     */
    public boolean cancel(String runId, String reason) {
        RunHandle handle = activeRuns.get(runId);
        if (handle == null) {
            return false;
        }
        handle.requestCancel(reason);
        log.info("Cancellation requested for run {}: {}", runId, reason);
        return true;
    }

    /**
     * Ask a run to stop after its current wave. Unlike cancellation no node is skipped:
     * the run ends PAUSED with a checkpoint that {@link #resume} continues from.
     *
     * @return false if no active run has this id
     */
    public boolean pause(String runId) {
        RunHandle handle = activeRuns.get(runId);
        if (handle == null) {
            return false;
        }
        handle.requestPause();
        log.info("Pause requested for run {}", runId);
        return true;
    }

    public Set<String> activeRunIds() {
        return Set.copyOf(activeRuns.keySet());
    }

    public boolean isShuttingDown() {
        return shuttingDown;
    }

    /**
     * Cancel all active runs and stop the thread pools.
     */
    public void shutdown() {
        shuttingDown = true;
        for (String runId : activeRunIds()) {
            cancel(runId, "executor shutdown");
        }
        long waitMs = settings.cancellationGracePeriod().toMillis() + 1000;
        runPool.shutdown();
        nodePool.shutdown();
        try {
            if (!runPool.awaitTermination(waitMs, TimeUnit.MILLISECONDS)) {
                runPool.shutdownNow();
            }
            if (!nodePool.awaitTermination(1, TimeUnit.SECONDS)) {
                nodePool.shutdownNow();
            }
        } catch (InterruptedException e) {
            runPool.shutdownNow();
            nodePool.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            timeoutTimer.shutdownNow();
        }
        log.info("DAG executor stopped");
    }

    // ========== Scheduling Loop ==========

    private RunReport drive(RunState run, boolean resumed) {
        ExecutionContext context = run.context;
        try (var ctx = LoggingContext.forRun(context.runId(), run.graph.graphId())) {
            context.transitionRun(RunStatus.RUNNING);
            if (resumed && eventRepository != null) {
                run.handle.eventSequence.set(eventRepository.findByRunId(context.runId()).size());
            }
            emitRun(run, resumed ? ExecutionEventType.RUN_RESUMED : ExecutionEventType.RUN_STARTED,
                resumed ? "resumed from checkpoint " + context.checkpointSequence() : null);
            metrics.runStarted(run.graph.graphId(), resumed);
            log.info("{} run {} of graph {} ({} nodes)",
                resumed ? "Resuming" : "Starting", context.runId(), run.graph.graphId(), run.graph.size());

            for (String failed : context.nodesWithStatus(NodeStatus.FAILED)) {
                NodeState state = context.state(failed);
                skipDescendants(run, failed, state.errorCode(),
                    failedAncestorReason(failed, state.errorCode(), state.errorMessage()));
            }
            promoteInitial(run);
            checkpoint(run);

            while (!run.handle.isStopRequested()) {
                List<String> wave = selectWave(run, Instant.now());
                if (wave.isEmpty()) {
                    Optional<Instant> nextDue = nextBackoffDeadline(context);
                    if (nextDue.isEmpty()) {
                        break;
                    }
                    long waitMs = Math.max(1, Duration.between(Instant.now(), nextDue.get()).toMillis());
                    run.handle.awaitStop(Math.min(waitMs, settings.pollInterval().toMillis()));
                    continue;
                }
                runWave(run, wave);
            }

            return finish(run);
        }
    }

    /**
     * Due READY nodes to dispatch next: all parallel-eligible ones ordered by
     * (depth, id) up to maxParallelism, otherwise a single sequential node.
     */
    private List<String> selectWave(RunState run, Instant now) {
        List<String> parallel = new ArrayList<>();
        List<String> sequential = new ArrayList<>();
        for (String nodeId : run.context.nodesWithStatus(NodeStatus.READY)) {
            if (!run.context.state(nodeId).isDue(now)) {
                continue;
            }
            if (run.graph.node(nodeId).isParallelEligible()) {
                parallel.add(nodeId);
            } else {
                sequential.add(nodeId);
            }
        }

        if (!parallel.isEmpty()) {
            parallel.sort(Comparator
                .comparingInt((String id) -> run.graph.depth(id))
                .thenComparing(id -> id));
            return parallel.size() > settings.maxParallelism()
                ? List.copyOf(parallel.subList(0, settings.maxParallelism()))
                : parallel;
        }
        if (!sequential.isEmpty()) {
            sequential.sort(Comparator.comparingInt(id -> run.graph.graphIndex(id)));
            return List.of(sequential.get(0));
        }
        return List.of();
    }

    private void runWave(RunState run, List<String> wave) {
        ExecutionContext context = run.context;
        Map<String, NodeTask> inFlight = new LinkedHashMap<>();

        List<String> dispatched = new ArrayList<>();
        for (String nodeId : wave) {
            if (conditionHolds(run, nodeId)) {
                dispatched.add(nodeId);
            } else {
                skipOnCondition(run, nodeId);
            }
        }
        if (dispatched.isEmpty()) {
            checkpoint(run);
            return;
        }

        for (String nodeId : dispatched) {
            NodeState running = context.state(nodeId).withRunning(Instant.now());
            context.updateState(running);
            metrics.nodeStarted();
            emitNode(run, ExecutionEventType.NODE_STARTED, nodeId, running.attempts(), null, null);
        }
        checkpoint(run);

        for (String nodeId : dispatched) {
            inFlight.put(nodeId, dispatch(run, nodeId));
        }
        log.debug("Dispatched wave of {} node(s): {}", dispatched.size(), dispatched);

        awaitBarrier(run, inFlight.values().stream().map(NodeTask::result).collect(Collectors.toList()));

        for (Map.Entry<String, NodeTask> entry : inFlight.entrySet()) {
            String nodeId = entry.getKey();
            NodeTask task = entry.getValue();
            if (task.result().isDone()) {
                handleAttempt(run, nodeId, task.result().join());
            } else {
                task.interrupt();
                abandon(run, nodeId);
            }
        }
    }

    /**
     * Evaluate a node's condition before its first attempt. A condition that throws
     * lets the node run.
     */
    private boolean conditionHolds(RunState run, String nodeId) {
        NodeDefinition node = run.graph.node(nodeId);
        if (!node.isConditional() || run.context.state(nodeId).attempts() > 0) {
            return true;
        }
        NodeInput input = run.context.buildNodeInput(nodeId, run.graph, run.registry);
        try {
            return node.condition().shouldRun(input.globalInput(), input.ancestorOutputs());
        } catch (RuntimeException e) {
            log.error("Condition of node {} could not be evaluated, running the node anyway", nodeId, e);
            return true;
        }
    }

    private NodeTask dispatch(RunState run, String nodeId) {
        NodeDefinition node = run.graph.node(nodeId);
        int attempt = run.context.state(nodeId).attempts();
        Optional<NodeRunner> runner = runners.resolve(node);
        if (runner.isEmpty()) {
            return NodeTask.finished(new Attempt(
                NodeResult.failure(NO_RUNNER, "No runner registered for node " + nodeId
                    + " of kind " + node.kind(), false), 0));
        }

        NodeInput input = run.context.buildNodeInput(nodeId, run.graph, run.registry);
        NodeInvocation invocation = new NodeInvocation(run.context.runId(), node, input, attempt, run.registry);

        NodeTask task = new NodeTask();
        try {
            task.started(nodePool.submit(() -> runAttempt(runner.get(), invocation, node.timeout(), task)));
        } catch (RejectedExecutionException e) {
            log.warn("Node pool rejected node {}: {}", nodeId, e.getMessage());
            task.result().complete(new Attempt(
                NodeResult.failure(RUNNER_ERROR, "Node pool rejected node " + nodeId, true), 0));
        }
        return task;
    }

    /**
     * Runs on a node pool thread. The timeout clock starts here, so queueing time
     * behind other nodes is not charged to this attempt.
     */
    private void runAttempt(NodeRunner runner, NodeInvocation invocation, Duration timeout, NodeTask task) {
        ScheduledFuture<?> deadline = null;
        if (timeout != null) {
            Attempt timedOut = new Attempt(NodeResult.failure(TIMED_OUT,
                "Node " + invocation.nodeId() + " exceeded timeout of " + timeout, true), timeout.toMillis());
            deadline = timeoutTimer.schedule(() -> task.expire(timedOut), timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        try {
            task.result().complete(invoke(runner, invocation));
        } catch (Error e) {
            task.result().complete(new Attempt(NodeResult.failure(RUNNER_ERROR,
                e.getClass().getSimpleName() + ": " + e.getMessage(), false), 0));
            throw e;
        } finally {
            if (deadline != null) {
                deadline.cancel(false);
            }
        }
    }

    /**
     * Never throws a RuntimeException; every runner failure becomes a result.
     */
    private Attempt invoke(NodeRunner runner, NodeInvocation invocation) {
        long start = System.nanoTime();
        try (var ctx = LoggingContext.forNode(invocation.runId(), invocation.nodeId(), invocation.attempt())) {
            NodeResult result;
            try {
                result = runner.run(invocation);
                if (result == null) {
                    result = NodeResult.failure(RUNNER_ERROR, "Runner returned no result", false);
                }
            } catch (NodeRunnerException e) {
                log.warn("Node {} attempt {} failed: {} - {}",
                    invocation.nodeId(), invocation.attempt(), e.getErrorCode(), e.getMessage());
                result = NodeResult.failure(e.getErrorCode(), e.getMessage(), e.isRetryable());
            } catch (RuntimeException e) {
                log.error("Runner for node {} crashed on attempt {}", invocation.nodeId(), invocation.attempt(), e);
                result = NodeResult.failure(RUNNER_ERROR, e.getClass().getSimpleName() + ": " + e.getMessage(), true);
            }
            return new Attempt(result, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        }
    }

    /**
     * Wait for every future of the wave, polling so a cancellation request is noticed.
     * After cancellation, running nodes get the grace period and are then left behind.
     */
    private void awaitBarrier(RunState run, Collection<CompletableFuture<Attempt>> futures) {
        CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
        long pollMs = settings.pollInterval().toMillis();

        while (true) {
            try {
                all.get(pollMs, TimeUnit.MILLISECONDS);
                return;
            } catch (TimeoutException e) {
                if (run.handle.isCancelRequested()) {
                    Instant abandonAt = run.handle.cancelledAt().plus(settings.cancellationGracePeriod());
                    if (!Instant.now().isBefore(abandonAt)) {
                        log.warn("Grace period of {} elapsed, abandoning running nodes",
                            settings.cancellationGracePeriod());
                        return;
                    }
                }
            } catch (ExecutionException e) {
                throw new IllegalStateException("Node attempt future failed unexpectedly", e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                run.handle.requestCancel("coordinator interrupted");
                return;
            }
        }
    }

    // ========== Result Handling ==========

    private void handleAttempt(RunState run, String nodeId, Attempt attempt) {
        NodeDefinition node = run.graph.node(nodeId);
        NodeResult result = attempt.result();
        NodeState state = run.context.state(nodeId);
        String kind = node.kind().name();
        Instant now = Instant.now();

        try (var ctx = LoggingContext.forNode(run.context.runId(), nodeId, state.attempts())) {
            if (result.success()) {
                run.context.recordOutput(nodeId, result.output(), result.artifacts(), result.contractsProduced());
                run.context.updateState(state.withCompleted(now));
                metrics.nodeFinished(run.graph.graphId(), kind, "completed", attempt.durationMs());
                emitNode(run, ExecutionEventType.NODE_COMPLETED, nodeId, state.attempts(), null, null);
                log.info("Node {} completed in {} ms", nodeId, attempt.durationMs());
                checkpoint(run);
                promoteSuccessors(run, nodeId);
                return;
            }

            RetryPolicy policy = node.effectiveRetryPolicy(settings.defaultRetryPolicy());
            boolean retry = result.retryable()
                && policy.shouldRetry(result.errorCode())
                && policy.hasRetriesLeft(state.retriesUsed())
                && !run.handle.isCancelRequested();

            if (retry) {
                Duration backoff = policy.computeBackoff(state.retriesUsed() + 1);
                run.context.updateState(state.withRetryScheduled(
                    now, now.plus(backoff), result.errorCode(), result.errorMessage()));
                metrics.nodeFinished(run.graph.graphId(), kind, "retry", attempt.durationMs());
                metrics.nodeRetried(run.graph.graphId(), kind, result.errorCode());
                emitNode(run, ExecutionEventType.NODE_RETRY_SCHEDULED, nodeId, state.attempts(),
                    result.errorCode(), "retry in " + backoff.toMillis() + " ms: " + result.errorMessage());
                log.warn("Node {} attempt {} failed ({}), retry {}/{} in {} ms",
                    nodeId, state.attempts(), result.errorCode(),
                    state.retriesUsed() + 1, policy.maxRetries(), backoff.toMillis());
                checkpoint(run);
                return;
            }

            if (!node.effectiveFailOnValidationError(settings.failOnValidationError())) {
                run.context.recordOutput(nodeId, result.output(), result.artifacts(), result.contractsProduced());
                run.context.updateState(state.withCompletedWithWarning(
                    now, result.errorCode(), result.errorMessage()));
                metrics.nodeFinished(run.graph.graphId(), kind, "warning", attempt.durationMs());
                emitNode(run, ExecutionEventType.NODE_COMPLETED_WITH_WARNING, nodeId, state.attempts(),
                    result.errorCode(), result.errorMessage());
                log.warn("Validation node {} failed ({}: {}), continuing as warning",
                    nodeId, result.errorCode(), result.errorMessage());
                checkpoint(run);
                promoteSuccessors(run, nodeId);
                return;
            }

            run.context.updateState(state.withFailed(now, result.errorCode(), result.errorMessage()));
            metrics.nodeFinished(run.graph.graphId(), kind, "failed", attempt.durationMs());
            emitNode(run, ExecutionEventType.NODE_FAILED, nodeId, state.attempts(),
                result.errorCode(), result.errorMessage());
            log.warn("Node {} failed after {} attempt(s): {} - {}",
                nodeId, state.attempts(), result.errorCode(), result.errorMessage());
            skipDescendants(run, nodeId, result.errorCode(),
                failedAncestorReason(nodeId, result.errorCode(), result.errorMessage()));
            checkpoint(run);
        }
    }

    private void abandon(RunState run, String nodeId) {
        NodeState state = run.context.state(nodeId);
        String message = "Abandoned after cancellation: " + run.handle.cancelReason();
        run.context.updateState(state.withFailed(Instant.now(), CANCELLED, message));
        metrics.nodeFinished(run.graph.graphId(), run.graph.node(nodeId).kind().name(), "abandoned", 0);
        emitNode(run, ExecutionEventType.NODE_FAILED, nodeId, state.attempts(), CANCELLED, message);
        log.warn("Node {} abandoned: {}", nodeId, message);
    }

    private void promoteInitial(RunState run) {
        Map<String, NodeStatus> statuses = run.context.statuses();
        for (String nodeId : run.graph.nodeIds()) {
            if (statuses.get(nodeId) != NodeStatus.PENDING) {
                continue;
            }
            boolean depsDone = run.graph.dependencies(nodeId).stream()
                .allMatch(dep -> statuses.get(dep) == NodeStatus.COMPLETED);
            if (depsDone) {
                markReady(run, nodeId);
            }
        }
    }

    private void promoteSuccessors(RunState run, String nodeId) {
        for (String successor : run.graph.readySuccessors(nodeId, run.context.statuses())) {
            if (run.context.state(successor).status() == NodeStatus.PENDING) {
                markReady(run, successor);
            }
        }
    }

    private void markReady(RunState run, String nodeId) {
        run.context.updateState(run.context.state(nodeId).withReady(Instant.now()));
        emitNode(run, ExecutionEventType.NODE_READY, nodeId, 0, null, null);
    }

    private void skipOnCondition(RunState run, String nodeId) {
        NodeState state = run.context.state(nodeId);
        String reason = "Condition not met";
        run.context.updateState(state.withSkipped(Instant.now(), null, reason));
        metrics.nodeSkipped(run.graph.graphId(), run.graph.node(nodeId).kind().name());
        emitNode(run, ExecutionEventType.NODE_SKIPPED, nodeId, state.attempts(), CONDITION_NOT_MET, reason);
        log.info("Node {} skipped, its condition is not met", nodeId);
        skipDescendants(run, nodeId, CONDITION_NOT_MET,
            String.format("Skipped: ancestor %s did not meet its condition", nodeId));
    }

    /**
     * Skip every not-yet-run transitive dependent of a node that will not complete.
     * Propagation is forward only; ancestors and siblings are untouched.
     */
    private void skipDescendants(RunState run, String causeNodeId, String errorCode, String reason) {
        for (String descendant : run.graph.descendants(causeNodeId)) {
            NodeState state = run.context.state(descendant);
            if (state.status() == NodeStatus.PENDING || state.status() == NodeStatus.READY) {
                run.context.updateState(state.withSkipped(Instant.now(), causeNodeId, reason));
                metrics.nodeSkipped(run.graph.graphId(), run.graph.node(descendant).kind().name());
                emitNode(run, ExecutionEventType.NODE_SKIPPED, descendant, state.attempts(), errorCode, reason);
            }
        }
    }

    private static String failedAncestorReason(String nodeId, String errorCode, String errorMessage) {
        return String.format("Skipped: ancestor %s failed (%s: %s)", nodeId, errorCode, errorMessage);
    }

    private Optional<Instant> nextBackoffDeadline(ExecutionContext context) {
        return context.nodesWithStatus(NodeStatus.READY).stream()
            .map(id -> context.state(id).nextAttemptAt())
            .filter(Objects::nonNull)
            .min(Comparator.naturalOrder());
    }

    private RunReport finish(RunState run) {
        ExecutionContext context = run.context;
        boolean cancelled = run.handle.isCancelRequested();
        if (!cancelled && run.handle.isPauseRequested() && hasOutstandingNodes(context)) {
            return pauseRun(run);
        }
        String leftoverReason = cancelled
            ? "Run cancelled: " + run.handle.cancelReason()
            : "Not reached";

        for (String nodeId : run.graph.nodeIds()) {
            NodeState state = context.state(nodeId);
            if (state.status() == NodeStatus.PENDING || state.status() == NodeStatus.READY) {
                context.updateState(state.withSkipped(Instant.now(), null, leftoverReason));
                emitNode(run, ExecutionEventType.NODE_SKIPPED, nodeId, state.attempts(),
                    cancelled ? CANCELLED : NOT_REACHED, leftoverReason);
            }
        }

        RunStatus terminal;
        if (cancelled) {
            terminal = RunStatus.CANCELLED;
        } else {
            boolean requiredFailed = context.nodesWithStatus(NodeStatus.FAILED).stream()
                .anyMatch(id -> run.graph.node(id).required());
            terminal = requiredFailed ? RunStatus.FAILED : RunStatus.COMPLETED;
        }
        context.transitionRun(terminal);

        ExecutionEventType eventType = switch (terminal) {
            case COMPLETED -> ExecutionEventType.RUN_COMPLETED;
            case CANCELLED -> ExecutionEventType.RUN_CANCELLED;
            default -> ExecutionEventType.RUN_FAILED;
        };
        emitRun(run, eventType, cancelled ? run.handle.cancelReason() : null);
        checkpoint(run);

        Instant finishedAt = Instant.now();
        metrics.runFinished(run.graph.graphId(), terminal.name(), Duration.between(run.handle.startedAt, finishedAt));
        log.info("Run {} finished {}: completed={} failed={} skipped={}",
            context.runId(), terminal,
            context.nodesWithStatus(NodeStatus.COMPLETED).size(),
            context.nodesWithStatus(NodeStatus.FAILED).size(),
            context.nodesWithStatus(NodeStatus.SKIPPED).size());

        if (settings.archiveOnCompletion() && run.handle.checkpointFailures.isEmpty()) {
            contextStore.archive(context.runId());
        }
        return buildReport(run, terminal, finishedAt);
    }

    /**
     * End the drive loop without touching node states; the checkpoint written here
     * is where {@link #resume} picks up.
     */
    private RunReport pauseRun(RunState run) {
        ExecutionContext context = run.context;
        context.transitionRun(RunStatus.PAUSED);
        emitRun(run, ExecutionEventType.RUN_PAUSED, null);
        checkpoint(run);

        Instant pausedAt = Instant.now();
        metrics.runFinished(run.graph.graphId(), RunStatus.PAUSED.name(), Duration.between(run.handle.startedAt, pausedAt));
        log.info("Run {} paused: completed={} outstanding={}",
            context.runId(),
            context.nodesWithStatus(NodeStatus.COMPLETED).size(),
            context.nodesWithStatus(NodeStatus.PENDING).size() + context.nodesWithStatus(NodeStatus.READY).size());
        return buildReport(run, RunStatus.PAUSED, pausedAt);
    }

    private static boolean hasOutstandingNodes(ExecutionContext context) {
        return !context.nodesWithStatus(NodeStatus.PENDING).isEmpty()
            || !context.nodesWithStatus(NodeStatus.READY).isEmpty();
    }

    private RunReport buildReport(RunState run, RunStatus terminal, Instant finishedAt) {
        Map<String, NodeReport> nodes = new LinkedHashMap<>();
        for (Map.Entry<String, NodeState> entry : run.context.states().entrySet()) {
            NodeDefinition node = run.graph.node(entry.getKey());
            nodes.put(entry.getKey(), NodeReport.of(entry.getValue(), node.kind(), node.required()));
        }
        return new RunReport(
            run.context.runId(),
            run.graph.graphId(),
            terminal,
            Collections.unmodifiableMap(nodes),
            run.context.outputs(),
            run.context.artifacts(),
            run.context.contractsTouched(),
            List.copyOf(run.handle.checkpointFailures),
            run.handle.cancelReason(),
            run.handle.startedAt,
            finishedAt
        );
    }

    // ========== Internal Methods ==========

    /**
     * Compare the live rows of a restored contract table with the registry the run
     * is resumed against.
     */
    private static void verifyContracts(ExecutionContext context, ContractRegistry registry) {
        List<String> differences = new ArrayList<>();
        for (ContractSnapshot row : context.contractSnapshot()) {
            if (!row.status().isLive()) {
                continue;
            }
            Optional<Contract> current = registry == null
                ? Optional.empty()
                : registry.get(row.name(), row.version());
            if (current.isEmpty()) {
                differences.add(String.format("%s %s is no longer registered", row.name(), row.version()));
            } else if (!Objects.equals(current.get().specHash(), row.specHash())) {
                differences.add(String.format("%s %s has a different specification", row.name(), row.version()));
            }
        }
        if (!differences.isEmpty()) {
            throw new ContractDriftException(context.runId(), differences);
        }
    }

    private void checkpoint(RunState run) {
        try {
            RunCheckpoint saved = contextStore.checkpoint(run.context, run.registry);
            emitRun(run, ExecutionEventType.CHECKPOINT_SAVED, "sequence " + saved.sequenceNumber());
        } catch (CheckpointException e) {
            run.handle.checkpointFailures.add(e);
            metrics.checkpointFailed(run.graph.graphId());
            emitRun(run, ExecutionEventType.CHECKPOINT_FAILED, e.getMessage());
            log.warn("Checkpoint failed for run {}, continuing without durable state: {}",
                run.context.runId(), e.getMessage());
        }
    }

    private void emitRun(RunState run, ExecutionEventType type, String detail) {
        publish(ExecutionEvent.runEvent(run.context.runId(), run.handle.eventSequence.incrementAndGet(), type, detail));
    }

    private void emitNode(RunState run, ExecutionEventType type, String nodeId, int attempt,
                          String errorCode, String detail) {
        publish(ExecutionEvent.nodeEvent(run.context.runId(), run.handle.eventSequence.incrementAndGet(),
            type, nodeId, attempt, errorCode, detail));
    }

    private void publish(ExecutionEvent event) {
        if (eventRepository != null) {
            eventRepository.append(event);
        }
        for (ExecutionEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Execution event listener failed on {}: {}", event.type(), e.getMessage(), e);
            }
        }
    }

    private RunHandle register(String runId, String graphId) {
        if (shuttingDown) {
            throw new IllegalStateException("Executor is shutting down");
        }
        RunHandle handle = new RunHandle(runId);
        if (activeRuns.putIfAbsent(runId, handle) != null) {
            throw new InvalidTransitionException(String.format(
                "Run %s of graph %s is already active", runId, graphId));
        }
        return handle;
    }

    private static void requireValidated(WorkflowGraph graph) {
        if (!graph.isValidated()) {
            throw new GraphStructureException(String.format(
                "Graph %s must pass validate() before it is executed", graph.graphId()));
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Result of one node attempt together with its wall-clock duration.
     */
    private record Attempt(NodeResult result, long durationMs) {
    }

    /**
     * One dispatched attempt: the result the barrier waits on and the pool task
     * producing it. Whichever of the runner and the timeout timer completes the
     * result first wins.
     */
    private static final class NodeTask {
        private final CompletableFuture<Attempt> result = new CompletableFuture<>();
        private volatile Future<?> work;
        private volatile boolean expired;

        private static NodeTask finished(Attempt attempt) {
            NodeTask task = new NodeTask();
            task.result.complete(attempt);
            return task;
        }

        private CompletableFuture<Attempt> result() {
            return result;
        }

        private void started(Future<?> work) {
            this.work = work;
            // the deadline may have fired before the handle was stored
            if (expired) {
                work.cancel(true);
            }
        }

        private void expire(Attempt timedOut) {
            if (result.complete(timedOut)) {
                expired = true;
                interrupt();
            }
        }

        private void interrupt() {
            Future<?> current = work;
            if (current != null) {
                current.cancel(true);
            }
        }
    }

    /**
     * Everything the scheduling loop of one run works on.
     */
    private static final class RunState {
        private final RunHandle handle;
        private final ExecutionContext context;
        private final WorkflowGraph graph;
        private final ContractRegistry registry;

        private RunState(RunHandle handle, ExecutionContext context, WorkflowGraph graph, ContractRegistry registry) {
            this.handle = handle;
            this.context = context;
            this.graph = graph;
            this.registry = registry;
        }
    }

    /**
     * Externally visible control block of an active run.
     */
    private static final class RunHandle {
        private final String runId;
        private final Instant startedAt = Instant.now();
        private final AtomicLong eventSequence = new AtomicLong(0);
        private final List<CheckpointException> checkpointFailures = new CopyOnWriteArrayList<>();
        private final CountDownLatch stopLatch = new CountDownLatch(1);
        private volatile String cancelReason;
        private volatile Instant cancelledAt;
        private volatile boolean pauseRequested;

        private RunHandle(String runId) {
            this.runId = runId;
        }

        private synchronized void requestCancel(String reason) {
            if (cancelledAt == null) {
                cancelReason = reason;
                cancelledAt = Instant.now();
                stopLatch.countDown();
            }
        }

        private void requestPause() {
            pauseRequested = true;
            stopLatch.countDown();
        }

        private boolean isCancelRequested() {
            return cancelledAt != null;
        }

        private boolean isPauseRequested() {
            return pauseRequested;
        }

        private boolean isStopRequested() {
            return isCancelRequested() || pauseRequested;
        }

        private Instant cancelledAt() {
            return cancelledAt;
        }

        private String cancelReason() {
            return cancelReason;
        }

        /**
         * Sleep until the timeout elapses or the run is cancelled or paused, whichever is first.
         */
        private void awaitStop(long timeoutMs) {
            try {
                if (stopLatch.await(timeoutMs, TimeUnit.MILLISECONDS)) {
                    log.debug("Run {} woke up to stop", runId);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                requestCancel("coordinator interrupted");
            }
        }
    }
}
