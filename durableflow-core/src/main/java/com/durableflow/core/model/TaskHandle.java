package com.durableflow.core.model;

/**
 * Proof of a lease on a dequeued task. Operations carrying a stale lease token are rejected.
 */
public record TaskHandle(String queueName, String taskId, String leaseToken) {
}
