package com.durableflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

/**
 * A queue entry referencing a workflow run (decision task) or one attempt of an
 * activity invocation (activity task).
 *
 * Primary Key: (queueName, taskId)
 * Index: leaseExpiresAt (visibility-timeout scanning)
 *
 * Invariants:
 * - At most one lease is active at a time
 * - A dequeued task is leased, not removed; only ack removes it
 * - taskId is derived from the run, so enqueueing the same work twice is a no-op
 */
public record Task(
    String taskId,
    String queueName,
    TaskKind kind,

    // Reference
    String runId,
    String workflowId,
    String activityId,
    int attempt,
    JsonNode payload,

    // Visibility
    Instant createdAt,
    Instant visibleAt,
    int deliveryCount,

    // Lease
    String leaseOwner,
    String leaseToken,
    Instant leaseExpiresAt
) {
    /**
     * Create a decision task for a run. Only one can be pending per run.
     */
    public static Task decision(String queueName, String runId, String workflowId, Instant now) {
        return new Task(
            decisionTaskId(runId),
            queueName,
            TaskKind.DECISION,
            runId,
            workflowId,
            null,
            0,
            null,
            now,
            now,
            0,
            null,
            null,
            null
        );
    }

    /**
     * Create an activity task for one attempt of an invocation.
     */
    public static Task activity(
            String queueName,
            String runId,
            String workflowId,
            String activityId,
            int attempt,
            JsonNode payload,
            Instant now,
            Instant visibleAt) {
        return new Task(
            activityTaskId(runId, activityId, attempt),
            queueName,
            TaskKind.ACTIVITY,
            runId,
            workflowId,
            activityId,
            attempt,
            payload,
            now,
            visibleAt,
            0,
            null,
            null,
            null
        );
    }

    public static String decisionTaskId(String runId) {
        return runId + "/decision";
    }

    public static String activityTaskId(String runId, String activityId, int attempt) {
        return runId + "/activity/" + activityId + "/" + attempt;
    }

    public boolean isLeased() {
        return leaseToken != null;
    }

    public boolean isLeaseExpired(Instant now) {
        return leaseExpiresAt != null && !leaseExpiresAt.isAfter(now);
    }

    public TaskHandle handle() {
        return new TaskHandle(queueName, taskId, leaseToken);
    }

    public Task withLease(String owner, String token, Instant expiresAt) {
        return new Task(taskId, queueName, kind, runId, workflowId, activityId, attempt, payload,
            createdAt, visibleAt, deliveryCount + 1, owner, token, expiresAt);
    }

    public Task withLeaseExpiresAt(Instant expiresAt) {
        return new Task(taskId, queueName, kind, runId, workflowId, activityId, attempt, payload,
            createdAt, visibleAt, deliveryCount, leaseOwner, leaseToken, expiresAt);
    }

    public Task withoutLease(Instant visibleAt) {
        return new Task(taskId, queueName, kind, runId, workflowId, activityId, attempt, payload,
            createdAt, visibleAt, deliveryCount, null, null, null);
    }
}
