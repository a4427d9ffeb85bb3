package com.workstream.engine.lifecycle;

import com.workstream.engine.coordinator.DagExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stops the executor when the application context closes.
 *
 * On shutdown:
 * 1. Cancels every active run, so no new node is dispatched
 * 2. Gives running nodes the cancellation grace period
 * 3. Stops the node and run thread pools
 */
@Component
public class ExecutorShutdownHandler {

    private static final Logger log = LoggerFactory.getLogger(ExecutorShutdownHandler.class);

    private final DagExecutor executor;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public ExecutorShutdownHandler(DagExecutor executor) {
        this.executor = executor;
    }

    public boolean isStopped() {
        return stopped.get();
    }

    @EventListener(ContextClosedEvent.class)
    @Order(0)
    public void onShutdown(ContextClosedEvent event) {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        Set<String> active = executor.activeRunIds();
        if (active.isEmpty()) {
            log.info("No active runs, stopping executor");
        } else {
            log.info("Cancelling {} active run(s) before shutdown: {}", active.size(), active);
        }
        executor.shutdown();
        log.info("Executor shutdown complete");
    }
}
