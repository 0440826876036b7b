package com.durableflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

/**
 * One activity invocation of a run, folded from its ACTIVITY_* events.
 * Every retry is a new ACTIVITY_SCHEDULED event sharing the same activityId; only
 * the latest attempt can receive an outcome.
 */
public record ActivityInvocation(
    String activityId,
    String activityType,
    JsonNode input,
    int attempt,
    ActivityOptions options,

    // Timestamps
    Instant firstScheduledAt,
    Instant scheduledAt,
    Instant notBefore,
    Instant closedAt,

    // Outcome
    InvocationStatus status,
    JsonNode result,
    FailureDetail failure,
    FailureDetail lastAttemptFailure
) {
    public boolean isOutstanding() {
        return status == InvocationStatus.SCHEDULED;
    }

    /**
     * Instant after which no attempt may run, or null when schedule-to-close is unbounded.
     */
    public Instant scheduleToCloseDeadline() {
        return options.scheduleToCloseTimeout() == null
            ? null
            : firstScheduledAt.plus(options.scheduleToCloseTimeout());
    }

    public boolean isPastScheduleToClose(Instant now) {
        Instant deadline = scheduleToCloseDeadline();
        return deadline != null && !now.isBefore(deadline);
    }

    public String idempotencyKey(String runId) {
        return runId + ":" + activityId + ":" + attempt;
    }

    public ActivityInvocation withNextAttempt(int attempt, Instant scheduledAt, Instant notBefore, FailureDetail previousFailure) {
        return new ActivityInvocation(activityId, activityType, input, attempt, options,
            firstScheduledAt, scheduledAt, notBefore, null,
            InvocationStatus.SCHEDULED, null, null, previousFailure);
    }

    public ActivityInvocation withCompleted(JsonNode result, Instant at) {
        return new ActivityInvocation(activityId, activityType, input, attempt, options,
            firstScheduledAt, scheduledAt, notBefore, at,
            InvocationStatus.COMPLETED, result, null, lastAttemptFailure);
    }

    public ActivityInvocation withFailed(FailureDetail failure, Instant at) {
        return new ActivityInvocation(activityId, activityType, input, attempt, options,
            firstScheduledAt, scheduledAt, notBefore, at,
            InvocationStatus.FAILED, null, failure, lastAttemptFailure);
    }
}
