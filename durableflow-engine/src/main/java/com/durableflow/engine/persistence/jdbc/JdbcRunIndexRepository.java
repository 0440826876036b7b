package com.durableflow.engine.persistence.jdbc;

import com.durableflow.core.model.RunRecord;
import com.durableflow.core.model.WorkflowStatus;
import com.durableflow.core.repository.RunIndexRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed implementation of RunIndexRepository.
 *
 * Registration takes a transaction-scoped advisory lock on the workflow id, so the
 * "no open run" check and the insert cannot interleave with another start of the same id.
 */
public class JdbcRunIndexRepository implements RunIndexRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcRunIndexRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final RunRecordRowMapper rowMapper = new RunRecordRowMapper();

    public JdbcRunIndexRepository(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public Optional<RunRecord> register(RunRecord record, boolean rejectIfOpen) {
        return transactionTemplate.execute(status -> {
            jdbcTemplate.query("SELECT pg_advisory_xact_lock(hashtext(?))",
                (ResultSetExtractor<Object>) rs -> null, record.workflowId());

            if (rejectIfOpen) {
                List<RunRecord> open = jdbcTemplate.query("""
                    SELECT * FROM workflow_runs
                    WHERE workflow_id = ? AND closed_at IS NULL
                    ORDER BY registration_seq DESC
                    LIMIT 1
                    """, rowMapper, record.workflowId());
                if (!open.isEmpty()) {
                    return Optional.of(open.get(0));
                }
            }

            jdbcTemplate.update("""
                INSERT INTO workflow_runs (
                    run_id, workflow_id, workflow_type, task_queue, created_at
                ) VALUES (?, ?, ?, ?, ?)
                """,
                record.runId(),
                record.workflowId(),
                record.workflowType(),
                record.taskQueue(),
                JsonColumns.timestamp(record.createdAt())
            );
            log.debug("Registered run {} for workflow {}", record.runId(), record.workflowId());
            return Optional.<RunRecord>empty();
        });
    }

    @Override
    public void markClosed(String runId, WorkflowStatus status, Instant closedAt) {
        jdbcTemplate.update("""
            UPDATE workflow_runs SET closed_at = ?, close_status = ?
            WHERE run_id = ? AND closed_at IS NULL
            """, JsonColumns.timestamp(closedAt), status.name(), runId);
    }

    @Override
    public Optional<RunRecord> findByRunId(String runId) {
        return jdbcTemplate.query("SELECT * FROM workflow_runs WHERE run_id = ?", rowMapper, runId)
            .stream().findFirst();
    }

    @Override
    public Optional<RunRecord> findCurrent(String workflowId) {
        return jdbcTemplate.query("""
            SELECT * FROM workflow_runs
            WHERE workflow_id = ?
            ORDER BY registration_seq DESC
            LIMIT 1
            """, rowMapper, workflowId).stream().findFirst();
    }

    @Override
    public List<RunRecord> findByWorkflowId(String workflowId) {
        return jdbcTemplate.query("""
            SELECT * FROM workflow_runs
            WHERE workflow_id = ?
            ORDER BY registration_seq DESC
            """, rowMapper, workflowId);
    }

    @Override
    public List<RunRecord> findOpen(int limit) {
        return jdbcTemplate.query("""
            SELECT * FROM workflow_runs
            WHERE closed_at IS NULL
            ORDER BY created_at ASC
            LIMIT ?
            """, rowMapper, limit);
    }

    @Override
    public int countOpen() {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM workflow_runs WHERE closed_at IS NULL", Integer.class);
        return count != null ? count : 0;
    }

    private static class RunRecordRowMapper implements RowMapper<RunRecord> {
        @Override
        public RunRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            String closeStatus = rs.getString("close_status");
            return new RunRecord(
                rs.getString("workflow_id"),
                rs.getString("run_id"),
                rs.getString("workflow_type"),
                rs.getString("task_queue"),
                JsonColumns.instant(rs.getTimestamp("created_at")),
                JsonColumns.instant(rs.getTimestamp("closed_at")),
                closeStatus != null ? WorkflowStatus.valueOf(closeStatus) : null
            );
        }
    }
}
