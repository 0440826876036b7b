package com.durableflow.engine.persistence.jdbc;

import com.durableflow.core.exception.WorkerLeaseExpiredException;
import com.durableflow.core.model.Task;
import com.durableflow.core.model.TaskHandle;
import com.durableflow.core.model.TaskKind;
import com.durableflow.core.repository.TaskQueue;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed implementation of TaskQueue.
 *
 * Dequeue leases the oldest visible row with {@code FOR UPDATE SKIP LOCKED}, so competing
 * consumers never block on each other or lease the same task. The lease token acts as a
 * fence: ack, nack and heartbeat only touch the row while the caller's token is current.
 */
public class JdbcTaskQueue implements TaskQueue {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskQueue.class);

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final TaskRowMapper rowMapper = new TaskRowMapper();

    public JdbcTaskQueue(
            JdbcTemplate jdbcTemplate,
            TransactionTemplate transactionTemplate,
            ObjectMapper objectMapper,
            Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public void enqueue(Task task) {
        // A pending duplicate is left alone; a leased decision is re-armed
        String sql = """
            INSERT INTO task_queue (
                queue_name, task_id, kind, run_id, workflow_id, activity_id,
                attempt, payload, created_at, visible_at, delivery_count
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, 0)
            ON CONFLICT (queue_name, task_id) DO UPDATE SET rearm = TRUE
            WHERE task_queue.kind = 'DECISION' AND task_queue.lease_token IS NOT NULL
            """;

        int rows = jdbcTemplate.update(sql,
            task.queueName(),
            task.taskId(),
            task.kind().name(),
            task.runId(),
            task.workflowId(),
            task.activityId(),
            task.attempt(),
            JsonColumns.write(objectMapper, task.payload()),
            JsonColumns.timestamp(task.createdAt()),
            JsonColumns.timestamp(task.visibleAt())
        );
        log.debug("Enqueue {} on {} ({} rows)", task.taskId(), task.queueName(), rows);
    }

    @Override
    public Optional<Task> dequeue(String queueName, Duration visibilityTimeout, String workerId) {
        Instant now = clock.instant();
        String sql = """
            UPDATE task_queue SET
                lease_owner = ?,
                lease_token = ?,
                lease_expires_at = ?,
                delivery_count = delivery_count + 1,
                rearm = FALSE
            WHERE (queue_name, task_id) = (
                SELECT queue_name, task_id FROM task_queue
                WHERE queue_name = ?
                  AND ((lease_token IS NULL AND visible_at <= ?)
                    OR (lease_token IS NOT NULL AND lease_expires_at <= ?))
                ORDER BY visible_at, created_at
                LIMIT 1
                FOR UPDATE SKIP LOCKED
            )
            RETURNING *
            """;

        List<Task> leased = jdbcTemplate.query(sql, rowMapper,
            workerId,
            UUID.randomUUID().toString(),
            JsonColumns.timestamp(now.plus(visibilityTimeout)),
            queueName,
            JsonColumns.timestamp(now),
            JsonColumns.timestamp(now)
        );
        return leased.stream().findFirst();
    }

    @Override
    public void ack(TaskHandle handle) {
        transactionTemplate.executeWithoutResult(status -> {
            int deleted = jdbcTemplate.update("""
                DELETE FROM task_queue
                WHERE queue_name = ? AND task_id = ? AND lease_token = ? AND rearm = FALSE
                """, handle.queueName(), handle.taskId(), handle.leaseToken());
            if (deleted > 0) {
                return;
            }
            int rearmed = jdbcTemplate.update("""
                UPDATE task_queue SET
                    lease_owner = NULL, lease_token = NULL, lease_expires_at = NULL,
                    rearm = FALSE, visible_at = ?
                WHERE queue_name = ? AND task_id = ? AND lease_token = ? AND rearm = TRUE
                """, JsonColumns.timestamp(clock.instant()), handle.queueName(), handle.taskId(), handle.leaseToken());
            if (rearmed == 0) {
                throw new WorkerLeaseExpiredException(handle.queueName(), handle.taskId());
            }
        });
    }

    @Override
    public void nack(TaskHandle handle, Duration redeliveryDelay) {
        int rows = jdbcTemplate.update("""
            UPDATE task_queue SET
                lease_owner = NULL, lease_token = NULL, lease_expires_at = NULL,
                rearm = FALSE, visible_at = ?
            WHERE queue_name = ? AND task_id = ? AND lease_token = ?
            """, JsonColumns.timestamp(clock.instant().plus(redeliveryDelay)),
            handle.queueName(), handle.taskId(), handle.leaseToken());
        if (rows == 0) {
            throw new WorkerLeaseExpiredException(handle.queueName(), handle.taskId());
        }
    }

    @Override
    public Instant extendLease(TaskHandle handle, Duration visibilityTimeout) {
        Instant expiresAt = clock.instant().plus(visibilityTimeout);
        int rows = jdbcTemplate.update("""
            UPDATE task_queue SET lease_expires_at = ?
            WHERE queue_name = ? AND task_id = ? AND lease_token = ?
            """, JsonColumns.timestamp(expiresAt), handle.queueName(), handle.taskId(), handle.leaseToken());
        if (rows == 0) {
            throw new WorkerLeaseExpiredException(handle.queueName(), handle.taskId());
        }
        return expiresAt;
    }

    @Override
    public List<Task> reclaimExpired(Instant now, int limit) {
        return transactionTemplate.execute(status -> {
            List<Task> expired = jdbcTemplate.query("""
                SELECT * FROM task_queue
                WHERE lease_token IS NOT NULL AND lease_expires_at <= ?
                ORDER BY lease_expires_at
                LIMIT ?
                FOR UPDATE SKIP LOCKED
                """, rowMapper, JsonColumns.timestamp(now), limit);
            for (Task task : expired) {
                jdbcTemplate.update("""
                    UPDATE task_queue SET
                        lease_owner = NULL, lease_token = NULL, lease_expires_at = NULL,
                        rearm = FALSE, visible_at = ?
                    WHERE queue_name = ? AND task_id = ? AND lease_token = ?
                    """, JsonColumns.timestamp(now), task.queueName(), task.taskId(), task.leaseToken());
            }
            return expired;
        });
    }

    @Override
    public Optional<Task> find(String queueName, String taskId) {
        List<Task> results = jdbcTemplate.query(
            "SELECT * FROM task_queue WHERE queue_name = ? AND task_id = ?", rowMapper, queueName, taskId);
        return results.stream().findFirst();
    }

    @Override
    public int depth(String queueName) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM task_queue WHERE queue_name = ?", Integer.class, queueName);
        return count != null ? count : 0;
    }

    private class TaskRowMapper implements RowMapper<Task> {
        @Override
        public Task mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new Task(
                rs.getString("task_id"),
                rs.getString("queue_name"),
                TaskKind.valueOf(rs.getString("kind")),
                rs.getString("run_id"),
                rs.getString("workflow_id"),
                rs.getString("activity_id"),
                rs.getInt("attempt"),
                JsonColumns.read(objectMapper, rs.getString("payload")),
                JsonColumns.instant(rs.getTimestamp("created_at")),
                JsonColumns.instant(rs.getTimestamp("visible_at")),
                rs.getInt("delivery_count"),
                rs.getString("lease_owner"),
                rs.getString("lease_token"),
                JsonColumns.instant(rs.getTimestamp("lease_expires_at"))
            );
        }
    }
}
