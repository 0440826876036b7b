package com.durableflow.worker;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Implementation of one activity type.
 *
 * Delivery is at-least-once: a handler may run more than once for the same attempt (a worker
 * crashed after the side effect but before recording it). Handlers must be idempotent, keyed
 * by {@link ActivityContext#getIdempotencyKey()}.
 */
@FunctionalInterface
public interface ActivityHandler {

    /**
     * Execute the activity.
     *
     * @param context Execution context providing input and utilities
     * @return The activity output
     * @throws ActivityException if the activity fails
     */
    JsonNode execute(ActivityContext context) throws ActivityException;
}
