package com.durableflow.core.replay;

import com.durableflow.core.model.ActivityOptions;
import com.durableflow.core.model.FailureDetail;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;

/**
 * Decision produced by replaying a run. The dispatcher turns each command into events.
 */
public sealed interface Command {

    /**
     * Schedule the first attempt of a new activity invocation.
     *
     * @param options explicit options from workflow code, or null for the registered defaults
     */
    record ScheduleActivity(
        String activityId,
        String activityType,
        JsonNode input,
        ActivityOptions options
    ) implements Command {
    }

    record StartTimer(String timerId, Duration delay) implements Command {
    }

    record CompleteWorkflow(JsonNode output) implements Command {
    }

    record FailWorkflow(FailureDetail failure) implements Command {
    }

    default boolean closesRun() {
        return this instanceof CompleteWorkflow || this instanceof FailWorkflow;
    }
}
