package com.workstream.engine.persistence;

import com.workstream.core.model.RunCheckpoint;
import com.workstream.core.model.RunStatus;
import com.workstream.core.repository.CheckpointRepository;
import org.springframework.stereotype.Repository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of CheckpointRepository.
 * Stores encoded JSON so a restored context never shares objects with the live one.
 */
@Repository
public class InMemoryCheckpointRepository implements CheckpointRepository {

    private final Map<String, Stored> checkpoints = new ConcurrentHashMap<>();
    private final CheckpointCodec codec;

    public InMemoryCheckpointRepository() {
        this(new CheckpointCodec());
    }

    public InMemoryCheckpointRepository(CheckpointCodec codec) {
        this.codec = codec;
    }

    @Override
    public void save(RunCheckpoint checkpoint) {
        Stored incoming = new Stored(checkpoint.sequenceNumber(), checkpoint.runStatus(),
            checkpoint.checkpointedAt().toEpochMilli(), codec.encode(checkpoint));
        checkpoints.merge(checkpoint.runId(), incoming,
            (existing, next) -> next.sequenceNumber() > existing.sequenceNumber() ? next : existing);
    }

    @Override
    public Optional<RunCheckpoint> findByRunId(String runId) {
        Stored stored = checkpoints.get(runId);
        return stored == null ? Optional.empty() : Optional.of(codec.decode(stored.json()));
    }

    @Override
    public List<RunCheckpoint> findByStatus(RunStatus status, int limit) {
        return checkpoints.values().stream()
            .filter(s -> s.runStatus() == status)
            .sorted(Comparator.comparingLong(Stored::savedAtMillis))
            .limit(limit)
            .map(s -> codec.decode(s.json()))
            .collect(Collectors.toList());
    }

    @Override
    public boolean delete(String runId) {
        return checkpoints.remove(runId) != null;
    }

    @Override
    public List<String> listRunIds() {
        return checkpoints.keySet().stream().sorted().collect(Collectors.toList());
    }

    private record Stored(long sequenceNumber, RunStatus runStatus, long savedAtMillis, String json) {
    }
}
