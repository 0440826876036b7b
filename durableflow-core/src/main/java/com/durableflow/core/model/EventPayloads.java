package com.durableflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Builds and reads the kind-specific payloads of history events.
 *
 * Durations are stored as milliseconds, instants as ISO-8601 strings, so the
 * payloads stay readable in the database and in history dumps.
 */
public final class EventPayloads {

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    private EventPayloads() {
    }

    // ========== Builders ==========

    public static ObjectNode workflowStarted(
            String workflowId,
            String workflowType,
            JsonNode input,
            String taskQueue,
            Duration executionTimeout) {
        ObjectNode node = JSON.objectNode();
        node.put("workflowId", workflowId);
        node.put("workflowType", workflowType);
        node.set("input", nullSafe(input));
        node.put("taskQueue", taskQueue);
        putDuration(node, "executionTimeoutMs", executionTimeout);
        return node;
    }

    public static ObjectNode activityScheduled(
            String activityId,
            String activityType,
            JsonNode input,
            int attempt,
            ActivityOptions options,
            Instant firstScheduledAt,
            Instant notBefore,
            FailureDetail previousFailure) {
        ObjectNode node = JSON.objectNode();
        node.put("activityId", activityId);
        node.put("activityType", activityType);
        node.set("input", nullSafe(input));
        node.put("attempt", attempt);
        node.set("options", activityOptions(options));
        node.put("firstScheduledAt", firstScheduledAt.toString());
        node.put("notBefore", notBefore.toString());
        if (previousFailure != null) {
            node.set("previousFailure", failure(previousFailure));
        }
        return node;
    }

    public static ObjectNode activityCompleted(String activityId, int attempt, JsonNode result) {
        ObjectNode node = JSON.objectNode();
        node.put("activityId", activityId);
        node.put("attempt", attempt);
        node.set("result", nullSafe(result));
        return node;
    }

    public static ObjectNode activityFailed(String activityId, int attempt, FailureDetail failure) {
        ObjectNode node = JSON.objectNode();
        node.put("activityId", activityId);
        node.put("attempt", attempt);
        node.set("failure", failure(failure));
        return node;
    }

    public static ObjectNode timerStarted(String timerId, Duration delay, Instant fireAt) {
        ObjectNode node = JSON.objectNode();
        node.put("timerId", timerId);
        putDuration(node, "delayMs", delay);
        node.put("fireAt", fireAt.toString());
        return node;
    }

    public static ObjectNode timerFired(String timerId) {
        ObjectNode node = JSON.objectNode();
        node.put("timerId", timerId);
        return node;
    }

    public static ObjectNode cancelRequested(String reason) {
        ObjectNode node = JSON.objectNode();
        node.put("reason", reason);
        return node;
    }

    public static ObjectNode workflowCompleted(JsonNode output) {
        ObjectNode node = JSON.objectNode();
        node.set("output", nullSafe(output));
        return node;
    }

    public static ObjectNode workflowFailed(FailureDetail failure) {
        ObjectNode node = JSON.objectNode();
        node.set("failure", failure(failure));
        return node;
    }

    public static ObjectNode workflowTerminated(String reason) {
        ObjectNode node = JSON.objectNode();
        node.put("reason", reason);
        return node;
    }

    public static ObjectNode workflowTimedOut(Duration executionTimeout) {
        ObjectNode node = JSON.objectNode();
        putDuration(node, "executionTimeoutMs", executionTimeout);
        return node;
    }

    public static ObjectNode failure(FailureDetail failure) {
        ObjectNode node = JSON.objectNode();
        node.put("category", failure.category());
        node.put("message", failure.message());
        return node;
    }

    public static ObjectNode activityOptions(ActivityOptions options) {
        ObjectNode node = JSON.objectNode();
        node.set("retryPolicy", retryPolicy(options.retryPolicy()));
        putDuration(node, "startToCloseMs", options.startToCloseTimeout());
        putDuration(node, "scheduleToCloseMs", options.scheduleToCloseTimeout());
        putDuration(node, "heartbeatTimeoutMs", options.heartbeatTimeout());
        if (options.taskQueue() != null) {
            node.put("taskQueue", options.taskQueue());
        }
        return node;
    }

    public static ObjectNode retryPolicy(RetryPolicy policy) {
        ObjectNode node = JSON.objectNode();
        node.put("initialBackoffMs", policy.initialBackoff().toMillis());
        node.put("backoffMultiplier", policy.backoffMultiplier());
        node.put("maxBackoffMs", policy.maxBackoff().toMillis());
        node.put("maxAttempts", policy.maxAttempts());
        ArrayNode categories = node.putArray("nonRetryableCategories");
        policy.nonRetryableCategories().stream().sorted().forEach(categories::add);
        return node;
    }

    // ========== Readers ==========

    public static String text(JsonNode payload, String field) {
        JsonNode value = payload == null ? null : payload.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    public static int integer(JsonNode payload, String field) {
        JsonNode value = payload == null ? null : payload.get(field);
        return value == null || value.isNull() ? 0 : value.asInt();
    }

    public static JsonNode node(JsonNode payload, String field) {
        JsonNode value = payload == null ? null : payload.get(field);
        return value == null || value.isNull() ? null : value;
    }

    public static Instant instant(JsonNode payload, String field) {
        String value = text(payload, field);
        return value == null ? null : Instant.parse(value);
    }

    public static Duration duration(JsonNode payload, String field) {
        JsonNode value = payload == null ? null : payload.get(field);
        return value == null || value.isNull() ? null : Duration.ofMillis(value.asLong());
    }

    public static FailureDetail readFailure(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        return new FailureDetail(text(node, "category"), text(node, "message"));
    }

    public static ActivityOptions readActivityOptions(JsonNode node) {
        if (node == null || node.isNull()) {
            return ActivityOptions.defaults();
        }
        return new ActivityOptions(
            readRetryPolicy(node.get("retryPolicy")),
            duration(node, "startToCloseMs"),
            duration(node, "scheduleToCloseMs"),
            duration(node, "heartbeatTimeoutMs"),
            text(node, "taskQueue")
        );
    }

    public static RetryPolicy readRetryPolicy(JsonNode node) {
        if (node == null || node.isNull()) {
            return RetryPolicy.defaultPolicy();
        }
        Set<String> categories = new LinkedHashSet<>();
        JsonNode array = node.get("nonRetryableCategories");
        if (array != null) {
            array.forEach(c -> categories.add(c.asText()));
        }
        return new RetryPolicy(
            duration(node, "initialBackoffMs"),
            node.path("backoffMultiplier").asDouble(2.0),
            duration(node, "maxBackoffMs"),
            node.path("maxAttempts").asInt(0),
            categories
        );
    }

    // ========== Helpers ==========

    private static JsonNode nullSafe(JsonNode node) {
        return node == null ? NullNode.getInstance() : node;
    }

    private static void putDuration(ObjectNode node, String field, Duration duration) {
        if (duration != null) {
            node.put(field, duration.toMillis());
        }
    }
}
