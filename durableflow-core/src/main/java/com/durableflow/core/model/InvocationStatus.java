package com.durableflow.core.model;

/**
 * State of an activity invocation as recorded in history.
 */
public enum InvocationStatus {
    /** An attempt is scheduled and has no outcome yet. */
    SCHEDULED,
    /** The invocation completed; its result is final. */
    COMPLETED,
    /** The invocation failed terminally. */
    FAILED;

    public boolean isClosed() {
        return this != SCHEDULED;
    }
}
