package com.durableflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable record of something that happened to a workflow run.
 *
 * Primary Key: (runId, sequenceNumber)
 *
 * Invariants:
 * - sequenceNumber is contiguous and 1-based within a run
 * - Events are never deleted, modified or reordered
 * - Events built with {@link #create} carry sequence number 0 until the event log assigns one
 */
public record Event(
    UUID eventId,
    String runId,

    // Ordering
    long sequenceNumber,

    // Event data
    EventType type,
    Instant timestamp,
    JsonNode payload,

    // Actor (who/what caused this event)
    String actorType,
    String actorId
) {
    public static final String ACTOR_SYSTEM = "SYSTEM";
    public static final String ACTOR_WORKER = "WORKER";
    public static final String ACTOR_SCHEDULER = "SCHEDULER";
    public static final String ACTOR_RECOVERY = "RECOVERY";
    public static final String ACTOR_USER = "USER";

    /**
     * Create an event that has not been appended yet.
     */
    public static Event create(
            String runId,
            EventType type,
            Instant timestamp,
            JsonNode payload,
            String actorType,
            String actorId) {
        return new Event(
            UUID.randomUUID(),
            runId,
            0L,
            type,
            timestamp,
            payload,
            actorType,
            actorId
        );
    }

    public Event withSequenceNumber(long sequenceNumber) {
        return new Event(eventId, runId, sequenceNumber, type, timestamp, payload, actorType, actorId);
    }

    public boolean isWorkflowEvent() {
        return type.name().startsWith("WORKFLOW_");
    }

    public boolean isActivityEvent() {
        return type.name().startsWith("ACTIVITY_");
    }
}
