package com.durableflow.engine.history;

import com.durableflow.core.exception.NotFoundException;
import com.durableflow.core.model.Event;
import com.durableflow.core.model.EventPayloads;
import com.durableflow.core.model.EventType;
import com.durableflow.core.model.WorkflowRunState;
import com.durableflow.core.model.WorkflowStatus;
import com.durableflow.core.replay.RunStateProjector;
import com.durableflow.core.repository.EventLog;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Service for run execution history and point-in-time replay.
 *
 * Provides:
 * - Full event history retrieval
 * - Per-activity attempt history
 * - State reconstruction at a sequence number or timestamp
 * - Execution statistics
 */
public class ExecutionHistoryService {

    private static final Logger log = LoggerFactory.getLogger(ExecutionHistoryService.class);

    private static final int SUMMARY_LENGTH = 200;

    private final EventLog eventLog;
    private final Clock clock;

    public ExecutionHistoryService(EventLog eventLog, Clock clock) {
        this.eventLog = eventLog;
        this.clock = clock;
    }

    /**
     * Get full execution history for a run.
     */
    public RunHistory getHistory(String runId) {
        List<Event> events = events(runId);
        WorkflowRunState state = RunStateProjector.project(events);
        return new RunHistory(
            state.workflowId(),
            runId,
            state.workflowType(),
            state.status(),
            events,
            buildActivityHistory(events),
            calculateStatistics(events, state)
        );
    }

    /**
     * Get events in a sequence range, both ends inclusive.
     */
    public List<Event> getEventRange(String runId, long fromSeq, long toSeq) {
        List<Event> range = new ArrayList<>();
        for (Event event : eventLog.read(runId, Math.max(0, fromSeq - 1))) {
            if (event.sequenceNumber() > toSeq) {
                break;
            }
            range.add(event);
        }
        return range;
    }

    /**
     * Reconstruct run state as it was right after the given event.
     */
    public WorkflowRunState replayToSequence(String runId, long targetSequence) {
        log.info("Replaying run {} to sequence {}", runId, targetSequence);
        List<Event> prefix = events(runId).stream()
            .filter(e -> e.sequenceNumber() <= targetSequence)
            .toList();
        if (prefix.isEmpty()) {
            throw new IllegalArgumentException("Sequence must be at least 1, was " + targetSequence);
        }
        return RunStateProjector.project(prefix);
    }

    /**
     * Reconstruct run state as it was at a point in time.
     */
    public WorkflowRunState replayToTimestamp(String runId, Instant targetTime) {
        log.info("Replaying run {} to timestamp {}", runId, targetTime);
        List<Event> prefix = new ArrayList<>();
        for (Event event : events(runId)) {
            if (event.timestamp().isAfter(targetTime)) {
                break;
            }
            prefix.add(event);
        }
        if (prefix.isEmpty()) {
            throw new IllegalArgumentException("Run " + runId + " had not started at " + targetTime);
        }
        return RunStateProjector.project(prefix);
    }

    private List<Event> events(String runId) {
        List<Event> events = eventLog.read(runId, 0).toList();
        if (events.isEmpty()) {
            throw new NotFoundException("WorkflowRun", runId);
        }
        return events;
    }

    /**
     * Group activity events by activity id, in scheduling order.
     */
    private Map<String, ActivityHistory> buildActivityHistory(List<Event> events) {
        Map<String, List<ActivityHistoryEntry>> byActivity = new LinkedHashMap<>();
        Map<String, String> types = new LinkedHashMap<>();

        for (Event event : events) {
            if (!event.isActivityEvent()) {
                continue;
            }
            String activityId = EventPayloads.text(event.payload(), "activityId");
            if (event.type() == EventType.ACTIVITY_SCHEDULED) {
                types.putIfAbsent(activityId, EventPayloads.text(event.payload(), "activityType"));
            }
            byActivity.computeIfAbsent(activityId, k -> new ArrayList<>())
                .add(new ActivityHistoryEntry(
                    event.sequenceNumber(),
                    event.timestamp(),
                    event.type().name(),
                    EventPayloads.integer(event.payload(), "attempt"),
                    summarize(event.payload())
                ));
        }

        Map<String, ActivityHistory> history = new LinkedHashMap<>();
        byActivity.forEach((activityId, entries) -> history.put(activityId, new ActivityHistory(
            activityId,
            types.get(activityId),
            entries.stream().mapToInt(ActivityHistoryEntry::attempt).max().orElse(0),
            entries,
            calculateDuration(entries)
        )));
        return history;
    }

    private ExecutionStatistics calculateStatistics(List<Event> events, WorkflowRunState state) {
        long retries = events.stream()
            .filter(e -> e.type() == EventType.ACTIVITY_SCHEDULED)
            .filter(e -> EventPayloads.integer(e.payload(), "attempt") > 1)
            .count();
        long completed = events.stream().filter(e -> e.type() == EventType.ACTIVITY_COMPLETED).count();
        long failed = events.stream().filter(e -> e.type() == EventType.ACTIVITY_FAILED).count();
        Instant end = state.closedAt() != null ? state.closedAt() : clock.instant();
        Duration duration = state.startedAt() != null ? Duration.between(state.startedAt(), end) : Duration.ZERO;

        return new ExecutionStatistics(events.size(), state.invocations().size(), completed, retries, failed, duration);
    }

    private static Duration calculateDuration(List<ActivityHistoryEntry> entries) {
        Instant first = entries.get(0).timestamp();
        Instant last = entries.get(entries.size() - 1).timestamp();
        return Duration.between(first, last);
    }

    private static String summarize(JsonNode payload) {
        if (payload == null) {
            return null;
        }
        String text = payload.toString();
        return text.length() > SUMMARY_LENGTH ? text.substring(0, SUMMARY_LENGTH) + "..." : text;
    }

    // ========== DTOs ==========

    public record RunHistory(
        String workflowId,
        String runId,
        String workflowType,
        WorkflowStatus status,
        List<Event> events,
        Map<String, ActivityHistory> activities,
        ExecutionStatistics statistics
    ) {}

    public record ActivityHistory(
        String activityId,
        String activityType,
        int attempts,
        List<ActivityHistoryEntry> entries,
        Duration duration
    ) {}

    public record ActivityHistoryEntry(
        long sequenceNumber,
        Instant timestamp,
        String eventType,
        int attempt,
        String summary
    ) {}

    public record ExecutionStatistics(
        long totalEvents,
        long activities,
        long completedAttempts,
        long retries,
        long failedActivities,
        Duration totalDuration
    ) {}
}
