package com.durableflow.core.model;

/**
 * Categorised failure recorded in history for an activity attempt or a run.
 */
public record FailureDetail(String category, String message) {

    // Engine-assigned categories
    public static final String CANCELLED = "CANCELLED";
    public static final String NONDETERMINISM = "NONDETERMINISM";
    public static final String WORKFLOW_ERROR = "WORKFLOW_ERROR";
    public static final String UNHANDLED_ERROR = "UNHANDLED_ERROR";
    public static final String START_TO_CLOSE_TIMEOUT = "START_TO_CLOSE_TIMEOUT";
    public static final String SCHEDULE_TO_CLOSE_TIMEOUT = "SCHEDULE_TO_CLOSE_TIMEOUT";
    public static final String ACTIVITY_NOT_REGISTERED = "ACTIVITY_NOT_REGISTERED";
    public static final String WORKFLOW_NOT_REGISTERED = "WORKFLOW_NOT_REGISTERED";
    public static final String TERMINATED = "TERMINATED";
    public static final String TIMED_OUT = "TIMED_OUT";

    public FailureDetail {
        if (category == null || category.isBlank()) {
            category = UNHANDLED_ERROR;
        }
        if (message == null) {
            message = "";
        }
    }

    public static FailureDetail of(String category, String message) {
        return new FailureDetail(category, message);
    }
}
