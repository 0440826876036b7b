package com.durableflow.core.model;

/**
 * Lifecycle states of a workflow run.
 * A run's status is never stored; it is derived from the run's history.
 */
public enum WorkflowStatus {
    /**
     * Run reserved but its start event is not yet in the log.
     * Transitions: -> RUNNING
     */
    CREATED,

    /**
     * Run is making progress through decision cycles.
     * Transitions: -> RUNNING, COMPLETED, FAILED, TERMINATED, TIMED_OUT
     */
    RUNNING,

    /**
     * Workflow code returned a result. Terminal state.
     */
    COMPLETED,

    /**
     * Workflow code failed, was cancelled, or diverged from its history. Terminal state.
     */
    FAILED,

    /**
     * Run was stopped by an operator. Terminal state.
     */
    TERMINATED,

    /**
     * Run exceeded its execution timeout. Terminal state.
     */
    TIMED_OUT;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == TERMINATED || this == TIMED_OUT;
    }

    public boolean canTransitionTo(WorkflowStatus target) {
        return switch (this) {
            case CREATED -> target == RUNNING;
            case RUNNING -> target == RUNNING || target.isTerminal();
            case COMPLETED, FAILED, TERMINATED, TIMED_OUT -> false;
        };
    }
}
