package com.workstream.engine.persistence.jdbc;

import com.workstream.core.model.RunCheckpoint;
import com.workstream.core.model.RunStatus;
import com.workstream.core.repository.CheckpointRepository;
import com.workstream.engine.persistence.CheckpointCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed implementation of CheckpointRepository.
 * One row per run; the checkpoint body is stored as jsonb and only replaced
 * by a checkpoint with a higher sequence number.
 *
 * Schema: classpath:db/workstream-schema.sql
 */
@Repository("jdbcCheckpointRepository")
public class JdbcCheckpointRepository implements CheckpointRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcCheckpointRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final CheckpointCodec codec;
    private final CheckpointRowMapper rowMapper;

    public JdbcCheckpointRepository(JdbcTemplate jdbcTemplate, CheckpointCodec codec) {
        this.jdbcTemplate = jdbcTemplate;
        this.codec = codec;
        this.rowMapper = new CheckpointRowMapper();
    }

    @Override
    @Transactional
    public void save(RunCheckpoint checkpoint) {
        String sql = """
            INSERT INTO run_checkpoints (
                run_id, graph_id, run_status, sequence_number, checkpoint_json, checkpointed_at
            ) VALUES (?, ?, ?, ?, ?::jsonb, ?)
            ON CONFLICT (run_id) DO UPDATE SET
                graph_id = EXCLUDED.graph_id,
                run_status = EXCLUDED.run_status,
                sequence_number = EXCLUDED.sequence_number,
                checkpoint_json = EXCLUDED.checkpoint_json,
                checkpointed_at = EXCLUDED.checkpointed_at
            WHERE run_checkpoints.sequence_number < EXCLUDED.sequence_number
            """;

        int rows = jdbcTemplate.update(sql,
            checkpoint.runId(),
            checkpoint.graphId(),
            checkpoint.runStatus().name(),
            checkpoint.sequenceNumber(),
            codec.encode(checkpoint),
            Timestamp.from(checkpoint.checkpointedAt())
        );

        if (rows == 0) {
            log.debug("Stale checkpoint {} ignored for run {}", checkpoint.sequenceNumber(), checkpoint.runId());
        }
    }

    @Override
    public Optional<RunCheckpoint> findByRunId(String runId) {
        String sql = "SELECT checkpoint_json FROM run_checkpoints WHERE run_id = ?";
        List<RunCheckpoint> results = jdbcTemplate.query(sql, rowMapper, runId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<RunCheckpoint> findByStatus(RunStatus status, int limit) {
        String sql = """
            SELECT checkpoint_json FROM run_checkpoints
            WHERE run_status = ?
            ORDER BY checkpointed_at ASC
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, rowMapper, status.name(), limit);
    }

    @Override
    @Transactional
    public boolean delete(String runId) {
        return jdbcTemplate.update("DELETE FROM run_checkpoints WHERE run_id = ?", runId) > 0;
    }

    @Override
    public List<String> listRunIds() {
        return jdbcTemplate.queryForList("SELECT run_id FROM run_checkpoints ORDER BY run_id", String.class);
    }

    private class CheckpointRowMapper implements RowMapper<RunCheckpoint> {
        @Override
        public RunCheckpoint mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                return codec.decode(rs.getString("checkpoint_json"));
            } catch (IllegalStateException e) {
                throw new SQLException("Failed to map run checkpoint row", e);
            }
        }
    }
}
