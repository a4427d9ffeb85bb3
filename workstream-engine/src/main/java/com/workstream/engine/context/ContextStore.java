package com.workstream.engine.context;

import com.workstream.core.exception.CheckpointException;
import com.workstream.core.exception.NotFoundException;
import com.workstream.core.model.ContractSnapshot;
import com.workstream.core.model.RunCheckpoint;
import com.workstream.core.repository.CheckpointRepository;
import com.workstream.engine.contract.ContractRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Persistence boundary for execution contexts.
 * Checkpoints are keyed by run id; only state is stored, never graph structure.
 */
public class ContextStore {

    private static final Logger log = LoggerFactory.getLogger(ContextStore.class);

    private final CheckpointRepository repository;

    public ContextStore(CheckpointRepository repository) {
        this.repository = repository;
    }

    /**
     * Persist the full context plus the registry's contract table.
     *
     * @param registry may be null when the run uses no contracts
     * @return the checkpoint that was written
     * @throws CheckpointException if the store rejects the write; the context stays valid
     */
    public RunCheckpoint checkpoint(ExecutionContext context, ContractRegistry registry) {
        List<ContractSnapshot> contracts = registry == null ? List.of() : registry.snapshot();
        RunCheckpoint checkpoint = context.toCheckpoint(contracts);
        try {
            repository.save(checkpoint);
        } catch (RuntimeException e) {
            throw new CheckpointException(context.runId(), e.getMessage(), e);
        }
        log.debug("Checkpoint {} saved for run {} ({})",
            checkpoint.sequenceNumber(), checkpoint.runId(), checkpoint.runStatus());
        return checkpoint;
    }

    /**
     * Rebuild the context of a run from its latest checkpoint.
     *
     * @throws NotFoundException if the run has no checkpoint
     * @throws CheckpointException if the checkpoint cannot be read
     */
    public ExecutionContext restore(String runId) {
        RunCheckpoint checkpoint = load(runId);
        ExecutionContext context = ExecutionContext.fromCheckpoint(checkpoint);
        log.info("Restored run {} from checkpoint {} ({} nodes)",
            runId, checkpoint.sequenceNumber(), checkpoint.nodeIds().size());
        return context;
    }

    /**
     * Latest checkpoint of a run, as stored.
     *
     * @throws NotFoundException if the run has no checkpoint
     */
    public RunCheckpoint load(String runId) {
        try {
            return repository.findByRunId(runId)
                .orElseThrow(() -> new NotFoundException("Run checkpoint", runId));
        } catch (NotFoundException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CheckpointException(runId, "checkpoint could not be read", e);
        }
    }

    /**
     * Remove the checkpoint of a run regardless of its status.
     *
     * @return false if the run had no checkpoint
     */
    public boolean delete(String runId) {
        try {
            return repository.delete(runId);
        } catch (RuntimeException e) {
            throw new CheckpointException(runId, "checkpoint could not be deleted", e);
        }
    }

    /**
     * Drop the checkpoint of a finished run.
     */
    public boolean archive(String runId) {
        boolean removed = delete(runId);
        if (removed) {
            log.debug("Archived checkpoint of run {}", runId);
        }
        return removed;
    }

    public List<String> listRunIds() {
        return repository.listRunIds();
    }

    public CheckpointRepository repository() {
        return repository;
    }
}
