package com.durableflow.core.model;

import java.time.Instant;

/**
 * Index entry mapping a workflow id to its runs.
 * The event log stays the source of truth for a run's status; this record only
 * answers "which runs exist for this id" and "which runs are still open".
 */
public record RunRecord(
    String workflowId,
    String runId,
    String workflowType,
    String taskQueue,
    Instant createdAt,
    Instant closedAt,
    WorkflowStatus closeStatus
) {
    public static RunRecord open(String workflowId, String runId, String workflowType, String taskQueue, Instant now) {
        return new RunRecord(workflowId, runId, workflowType, taskQueue, now, null, null);
    }

    public boolean isOpen() {
        return closedAt == null;
    }

    public RunRecord withClosed(WorkflowStatus status, Instant closedAt) {
        return new RunRecord(workflowId, runId, workflowType, taskQueue, createdAt, closedAt, status);
    }
}
