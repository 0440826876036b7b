package com.durableflow.core.workflow;

import com.durableflow.core.model.FailureDetail;

/**
 * Raised inside workflow code when an activity invocation failed terminally.
 * Uncaught, it fails the run with the activity's failure detail.
 */
public class ActivityFailedException extends RuntimeException {

    private final String activityId;
    private final String activityType;
    private final FailureDetail failure;

    public ActivityFailedException(String activityId, String activityType, FailureDetail failure) {
        super(String.format("Activity %s (%s) failed: [%s] %s",
            activityId, activityType, failure.category(), failure.message()));
        this.activityId = activityId;
        this.activityType = activityType;
        this.failure = failure;
    }

    public String getActivityId() {
        return activityId;
    }

    public String getActivityType() {
        return activityType;
    }

    public FailureDetail getFailure() {
        return failure;
    }
}
