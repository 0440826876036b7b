package com.durableflow.core.model;

/**
 * Kinds of events recorded in a run's history.
 */
public enum EventType {
    // Run lifecycle
    WORKFLOW_STARTED,
    WORKFLOW_CANCEL_REQUESTED,
    WORKFLOW_COMPLETED,
    WORKFLOW_FAILED,
    WORKFLOW_TERMINATED,
    WORKFLOW_TIMED_OUT,

    // Activity invocations
    ACTIVITY_SCHEDULED,
    ACTIVITY_COMPLETED,
    ACTIVITY_FAILED,

    // Durable timers
    TIMER_STARTED,
    TIMER_FIRED;

    /**
     * Check if this event closes the run.
     */
    public boolean isTerminal() {
        return this == WORKFLOW_COMPLETED || this == WORKFLOW_FAILED
            || this == WORKFLOW_TERMINATED || this == WORKFLOW_TIMED_OUT;
    }

    /**
     * Status a run ends in when this event is appended, or null for non-closing events.
     */
    public WorkflowStatus closingStatus() {
        return switch (this) {
            case WORKFLOW_COMPLETED -> WorkflowStatus.COMPLETED;
            case WORKFLOW_FAILED -> WorkflowStatus.FAILED;
            case WORKFLOW_TERMINATED -> WorkflowStatus.TERMINATED;
            case WORKFLOW_TIMED_OUT -> WorkflowStatus.TIMED_OUT;
            default -> null;
        };
    }
}
