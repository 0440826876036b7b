package com.durableflow.core.model;

import java.time.Instant;

/**
 * A timer started by workflow code. Fired timers are kept until their run closes.
 *
 * Primary Key: (runId, timerId)
 */
public record DurableTimer(
    String runId,
    String timerId,
    Instant fireAt,
    Instant createdAt,
    Instant firedAt
) {
    public static DurableTimer create(String runId, String timerId, Instant fireAt, Instant now) {
        return new DurableTimer(runId, timerId, fireAt, now, null);
    }

    public boolean isFired() {
        return firedAt != null;
    }

    public boolean isDue(Instant now) {
        return !isFired() && !fireAt.isAfter(now);
    }
}
