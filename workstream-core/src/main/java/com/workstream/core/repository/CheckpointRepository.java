package com.workstream.core.repository;

import com.workstream.core.model.RunCheckpoint;
import com.workstream.core.model.RunStatus;

import java.util.List;
import java.util.Optional;

/**
 * Durable store for run checkpoints, keyed by run id.
 * Only the latest checkpoint of each run is retained.
 */
public interface CheckpointRepository {

    /**
     * Save a checkpoint, replacing any older checkpoint of the same run.
     * A checkpoint whose sequence number is not greater than the stored one is ignored.
     *
     * @param checkpoint The checkpoint to persist
     * @throws RuntimeException if the underlying store fails
     */
    void save(RunCheckpoint checkpoint);

    /**
     * Find the latest checkpoint of a run.
     *
     * @param runId The run ID
     * @return The checkpoint if one was saved
     */
    Optional<RunCheckpoint> findByRunId(String runId);

    /**
     * Find checkpoints whose recorded run status matches.
     * Used by recovery to locate runs interrupted mid-flight.
     *
     * @param status Run status to match
     * @param limit Maximum results
     * @return Matching checkpoints, oldest first
     */
    List<RunCheckpoint> findByStatus(RunStatus status, int limit);

    /**
     * Delete the checkpoint of a run.
     *
     * @param runId The run ID
     * @return true if a checkpoint was removed
     */
    boolean delete(String runId);

    /**
     * List the ids of all runs with a checkpoint.
     */
    List<String> listRunIds();
}
