package com.durableflow.engine.persistence.jdbc;

import com.durableflow.core.exception.ConcurrencyConflictException;
import com.durableflow.core.model.Event;
import com.durableflow.core.model.EventType;
import com.durableflow.core.repository.EventLog;
import com.durableflow.core.repository.EventSequence;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;

/**
 * PostgreSQL-backed implementation of EventLog.
 * Provides append-only event sourcing with contiguous per-run sequence numbers.
 *
 * Appends check the expected version and insert inside one transaction; the
 * (run_id, sequence_number) primary key rejects the loser of two racing appends
 * that both passed the version check.
 */
public class JdbcEventLog implements EventLog {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventLog.class);

    static final int PAGE_SIZE = 500;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final EventRowMapper rowMapper = new EventRowMapper();

    public JdbcEventLog(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public long append(String runId, long expectedVersion, List<Event> events) {
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("Cannot append an empty batch to run " + runId);
        }
        String sql = """
            INSERT INTO workflow_events (
                run_id, sequence_number, event_id, event_type,
                event_timestamp, payload, actor_type, actor_id
            ) VALUES (?, ?, ?, ?, ?, ?::jsonb, ?, ?)
            """;

        try {
            Long version = transactionTemplate.execute(status -> {
                long current = currentVersion(runId);
                if (current != expectedVersion) {
                    throw new ConcurrencyConflictException(runId, expectedVersion, current);
                }
                jdbcTemplate.batchUpdate(sql, new BatchPreparedStatementSetter() {
                    @Override
                    public void setValues(PreparedStatement ps, int i) throws SQLException {
                        Event event = events.get(i);
                        ps.setString(1, runId);
                        ps.setLong(2, expectedVersion + i + 1);
                        ps.setObject(3, event.eventId());
                        ps.setString(4, event.type().name());
                        ps.setTimestamp(5, JsonColumns.timestamp(event.timestamp()));
                        ps.setString(6, JsonColumns.write(objectMapper, event.payload()));
                        ps.setString(7, event.actorType());
                        ps.setString(8, event.actorId());
                    }

                    @Override
                    public int getBatchSize() {
                        return events.size();
                    }
                });
                return expectedVersion + events.size();
            });
            log.debug("Appended {} events to run {} (version {})", events.size(), runId, version);
            return version;
        } catch (DuplicateKeyException e) {
            throw new ConcurrencyConflictException(runId, expectedVersion, currentVersion(runId));
        }
    }

    @Override
    public EventSequence read(String runId, long fromVersion) {
        String sql = """
            SELECT * FROM workflow_events
            WHERE run_id = ? AND sequence_number > ?
            ORDER BY sequence_number ASC
            LIMIT ?
            """;
        return new EventSequence(fromVersion, after -> jdbcTemplate.query(sql, rowMapper, runId, after, PAGE_SIZE));
    }

    @Override
    public long currentVersion(String runId) {
        Long version = jdbcTemplate.queryForObject(
            "SELECT COALESCE(MAX(sequence_number), 0) FROM workflow_events WHERE run_id = ?",
            Long.class, runId);
        return version != null ? version : 0L;
    }

    private class EventRowMapper implements RowMapper<Event> {
        @Override
        public Event mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new Event(
                UUID.fromString(rs.getString("event_id")),
                rs.getString("run_id"),
                rs.getLong("sequence_number"),
                EventType.valueOf(rs.getString("event_type")),
                rs.getTimestamp("event_timestamp").toInstant(),
                JsonColumns.read(objectMapper, rs.getString("payload")),
                rs.getString("actor_type"),
                rs.getString("actor_id")
            );
        }
    }
}
