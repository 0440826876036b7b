package com.durableflow.engine.persistence.jdbc;

import com.durableflow.core.model.DurableTimer;
import com.durableflow.core.repository.TimerRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;

/**
 * PostgreSQL-backed implementation of TimerRepository.
 */
public class JdbcTimerRepository implements TimerRepository {

    private final JdbcTemplate jdbcTemplate;
    private final RowMapper<DurableTimer> rowMapper = new TimerRowMapper();

    public JdbcTimerRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void save(DurableTimer timer) {
        jdbcTemplate.update("""
            INSERT INTO durable_timers (run_id, timer_id, fire_at, created_at, fired_at)
            VALUES (?, ?, ?, ?, ?)
            ON CONFLICT (run_id, timer_id) DO NOTHING
            """,
            timer.runId(),
            timer.timerId(),
            JsonColumns.timestamp(timer.fireAt()),
            JsonColumns.timestamp(timer.createdAt()),
            JsonColumns.timestamp(timer.firedAt())
        );
    }

    @Override
    public List<DurableTimer> findDue(Instant now, int limit) {
        return jdbcTemplate.query("""
            SELECT * FROM durable_timers
            WHERE fired_at IS NULL AND fire_at <= ?
            ORDER BY fire_at ASC
            LIMIT ?
            """, rowMapper, JsonColumns.timestamp(now), limit);
    }

    @Override
    public void markFired(String runId, String timerId, Instant firedAt) {
        jdbcTemplate.update("""
            UPDATE durable_timers SET fired_at = ?
            WHERE run_id = ? AND timer_id = ? AND fired_at IS NULL
            """, JsonColumns.timestamp(firedAt), runId, timerId);
    }

    @Override
    public void deleteByRun(String runId) {
        jdbcTemplate.update("DELETE FROM durable_timers WHERE run_id = ?", runId);
    }

    @Override
    public int countPending() {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM durable_timers WHERE fired_at IS NULL", Integer.class);
        return count != null ? count : 0;
    }

    private static class TimerRowMapper implements RowMapper<DurableTimer> {
        @Override
        public DurableTimer mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new DurableTimer(
                rs.getString("run_id"),
                rs.getString("timer_id"),
                JsonColumns.instant(rs.getTimestamp("fire_at")),
                JsonColumns.instant(rs.getTimestamp("created_at")),
                JsonColumns.instant(rs.getTimestamp("fired_at"))
            );
        }
    }
}
