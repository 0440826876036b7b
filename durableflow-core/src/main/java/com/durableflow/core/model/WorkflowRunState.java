package com.durableflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Read model of a workflow run, derived by folding its history.
 * Never persisted; rebuilt from the event log whenever it is needed.
 */
public record WorkflowRunState(
    // Identity
    String workflowId,
    String runId,
    String workflowType,
    JsonNode input,
    String taskQueue,
    Duration executionTimeout,

    // Progress
    WorkflowStatus status,
    long version,
    Map<String, ActivityInvocation> invocations,
    Map<String, TimerState> timers,
    boolean cancelRequested,
    String cancelReason,

    // Outcome
    JsonNode output,
    FailureDetail failure,

    // Timestamps
    Instant startedAt,
    Instant lastUpdatedAt,
    Instant closedAt
) {
    /**
     * A durable timer as seen from history.
     */
    public record TimerState(String timerId, Duration delay, Instant fireAt, boolean fired) {
    }

    public boolean isClosed() {
        return status.isTerminal();
    }

    public ActivityInvocation invocation(String activityId) {
        return invocations.get(activityId);
    }

    public List<ActivityInvocation> outstandingInvocations() {
        return invocations.values().stream()
            .filter(ActivityInvocation::isOutstanding)
            .toList();
    }

    public List<TimerState> pendingTimers() {
        return timers.values().stream()
            .filter(t -> !t.fired())
            .toList();
    }

    /**
     * Instant after which the run times out, or null when unbounded.
     */
    public Instant executionDeadline() {
        return executionTimeout == null || startedAt == null ? null : startedAt.plus(executionTimeout);
    }
}
