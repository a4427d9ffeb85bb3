package com.workstream.recovery;

import com.workstream.core.graph.WorkflowGraph;
import com.workstream.core.model.RunCheckpoint;
import com.workstream.core.model.RunStatus;
import com.workstream.engine.context.ContextStore;
import com.workstream.engine.contract.ContractRegistry;
import com.workstream.engine.coordinator.DagExecutor;
import com.workstream.engine.coordinator.RunReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Recovery Engine responsible for resuming orphaned runs.
 *
 * A run is orphaned when its latest checkpoint still says RUNNING, no local
 * executor is driving it, and the checkpoint is older than the staleness threshold
 * (the process that owned it crashed or was killed). Such runs are resumed from
 * the checkpoint: completed nodes keep their outputs, nodes that were running are
 * dispatched again.
 */
public class RecoveryEngine {

    private static final Logger log = LoggerFactory.getLogger(RecoveryEngine.class);

    private static final Duration DEFAULT_SCAN_INTERVAL = Duration.ofSeconds(30);
    private static final Duration DEFAULT_STALE_AFTER = Duration.ofMinutes(1);
    private static final int BATCH_SIZE = 100;

    private final DagExecutor executor;
    private final ContextStore contextStore;
    private final GraphResolver graphResolver;
    private final Supplier<ContractRegistry> registrySupplier;
    private final Duration scanInterval;
    private final Duration staleAfter;

    private final ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public RecoveryEngine(
            DagExecutor executor,
            ContextStore contextStore,
            GraphResolver graphResolver,
            Supplier<ContractRegistry> registrySupplier) {
        this(executor, contextStore, graphResolver, registrySupplier, DEFAULT_SCAN_INTERVAL, DEFAULT_STALE_AFTER);
    }

    public RecoveryEngine(
            DagExecutor executor,
            ContextStore contextStore,
            GraphResolver graphResolver,
            Supplier<ContractRegistry> registrySupplier,
            Duration scanInterval,
            Duration staleAfter) {
        this.executor = executor;
        this.contextStore = contextStore;
        this.graphResolver = graphResolver;
        this.registrySupplier = registrySupplier;
        this.scanInterval = scanInterval;
        this.staleAfter = staleAfter;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "workstream-recovery");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Start periodic recovery scans.
     */
    public void start() {
        if (running) {
            log.warn("Recovery engine already running");
            return;
        }

        running = true;
        log.info("Starting recovery engine (scan every {}, stale after {})", scanInterval, staleAfter);

        scheduler.scheduleWithFixedDelay(
            this::scan,
            scanInterval.toMillis(),
            scanInterval.toMillis(),
            TimeUnit.MILLISECONDS
        );
    }

    /**
     * Stop the recovery engine.
     */
    public void stop() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Recovery engine stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Run one recovery pass on the calling thread. Each orphaned run is resumed to
     * completion before the next one is picked up.
     *
     * @return ids of the runs that were resumed
     */
    public List<String> recoverNow() {
        Instant cutoff = Instant.now().minus(staleAfter);
        Set<String> active = executor.activeRunIds();
        List<String> recovered = new ArrayList<>();

        List<RunCheckpoint> candidates = contextStore.repository().findByStatus(RunStatus.RUNNING, BATCH_SIZE);
        for (RunCheckpoint checkpoint : candidates) {
            if (active.contains(checkpoint.runId()) || checkpoint.checkpointedAt().isAfter(cutoff)) {
                continue;
            }
            try {
                if (recover(checkpoint)) {
                    recovered.add(checkpoint.runId());
                }
            } catch (RuntimeException e) {
                log.error("Failed to recover run {} of graph {}", checkpoint.runId(), checkpoint.graphId(), e);
            }
        }

        if (!recovered.isEmpty()) {
            log.info("Recovered {} orphaned run(s): {}", recovered.size(), recovered);
        }
        return recovered;
    }

    // ========== Internal Methods ==========

    private void scan() {
        if (!running) return;

        try {
            recoverNow();
        } catch (RuntimeException e) {
            log.error("Error in recovery scan", e);
        }
    }

    private boolean recover(RunCheckpoint checkpoint) {
        Optional<WorkflowGraph> graph = graphResolver.resolve(checkpoint.graphId());
        if (graph.isEmpty()) {
            log.warn("Run {} is orphaned but graph {} is unknown here, leaving it for another instance",
                checkpoint.runId(), checkpoint.graphId());
            return false;
        }

        log.info("Resuming orphaned run {} of graph {} from checkpoint {} ({})",
            checkpoint.runId(), checkpoint.graphId(), checkpoint.sequenceNumber(), checkpoint.checkpointedAt());
        RunReport report = executor.resume(checkpoint.runId(), graph.get(), registrySupplier.get());
        log.info("Recovered run {} finished {}", report.runId(), report.status());
        return true;
    }
}
