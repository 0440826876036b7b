package com.durableflow.core.workflow;

import com.durableflow.core.model.ActivityOptions;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;
import java.util.Random;

/**
 * Deterministic environment handed to workflow code.
 */
public interface WorkflowContext {

    String workflowId();

    String runId();

    /**
     * Schedule an activity and wait for its result.
     *
     * @throws ActivityFailedException if the invocation failed terminally
     */
    default JsonNode executeActivity(String activityType, JsonNode input) {
        return scheduleActivity(activityType, input).get();
    }

    /**
     * Schedule an activity and wait for its result, overriding the registered options.
     */
    default JsonNode executeActivity(String activityType, JsonNode input, ActivityOptions options) {
        return scheduleActivity(activityType, input, options).get();
    }

    /**
     * Schedule an activity with its registered options without waiting for it.
     */
    default ActivityHandle scheduleActivity(String activityType, JsonNode input) {
        return scheduleActivity(activityType, input, null);
    }

    /**
     * Schedule an activity without waiting for it.
     *
     * @param options Options for this invocation, or null to use the registered defaults
     */
    ActivityHandle scheduleActivity(String activityType, JsonNode input, ActivityOptions options);

    /**
     * Wait on a durable timer.
     */
    void sleep(Duration duration);

    /**
     * Logical time: the run's start time, advanced by every timer the code has waited on.
     */
    Instant currentTime();

    /**
     * Whether cancellation of this run has been requested.
     * Code that sees true may return or fail to close the run on its own terms. Results of
     * activities already in flight are still delivered; scheduling anything new, or waiting
     * only on a timer, fails the run as CANCELLED.
     */
    boolean isCancelRequested();

    /**
     * A random generator seeded from the run, yielding the same values on every replay.
     */
    Random newRandom();
}
