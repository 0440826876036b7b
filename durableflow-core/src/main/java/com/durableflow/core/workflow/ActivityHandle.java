package com.durableflow.core.workflow;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A scheduled activity invocation as seen by workflow code.
 */
public interface ActivityHandle {

    String activityId();

    /**
     * True once the invocation's outcome is in history.
     */
    boolean isDone();

    /**
     * The invocation's result. Suspends the workflow until the outcome is recorded.
     *
     * @throws ActivityFailedException if the invocation failed terminally
     */
    JsonNode get();
}
