package com.durableflow.worker;

import com.durableflow.engine.coordinator.ActivityCoordinator.ActivityAttempt;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;

/**
 * Context provided to activity handlers during execution.
 */
public class ActivityContext {

    private final ActivityAttempt attempt;
    private final ObjectMapper objectMapper;
    private final HeartbeatCallback heartbeatCallback;

    public ActivityContext(
            ActivityAttempt attempt,
            ObjectMapper objectMapper,
            HeartbeatCallback heartbeatCallback) {
        this.attempt = attempt;
        this.objectMapper = objectMapper;
        this.heartbeatCallback = heartbeatCallback;
    }

    /**
     * Get the activity input.
     */
    public JsonNode getInput() {
        return attempt.input();
    }

    /**
     * Get the activity input as a specific type.
     */
    public <T> T getInput(Class<T> type) {
        return objectMapper.convertValue(attempt.input(), type);
    }

    public String getWorkflowId() {
        return attempt.workflowId();
    }

    public String getRunId() {
        return attempt.runId();
    }

    public String getActivityId() {
        return attempt.activityId();
    }

    public String getActivityType() {
        return attempt.activityType();
    }

    /**
     * Get the attempt number (1-based).
     */
    public int getAttemptNumber() {
        return attempt.attempt();
    }

    /**
     * Instant after which this attempt is abandoned.
     */
    public Instant getDeadline() {
        return attempt.deadline();
    }

    /**
     * Get the idempotency key for this execution.
     * Pass it to external systems so a repeated attempt does not repeat the side effect.
     */
    public String getIdempotencyKey() {
        return attempt.idempotencyKey();
    }

    /**
     * Send a heartbeat to renew the lease.
     * The worker heartbeats automatically; call this to report progress from long loops.
     *
     * @return true if heartbeat succeeded, false if lease was lost
     */
    public boolean heartbeat() {
        return heartbeatCallback.sendHeartbeat();
    }

    /**
     * Convert a result object to JsonNode.
     */
    public JsonNode toJsonNode(Object result) {
        return objectMapper.valueToTree(result);
    }

    /**
     * Callback for heartbeat/lease renewal.
     */
    @FunctionalInterface
    public interface HeartbeatCallback {
        boolean sendHeartbeat();
    }
}
