package com.durableflow.core.model;

import java.time.Duration;

/**
 * Settings a workflow type is registered with.
 *
 * @param taskQueue queue decision tasks (and by default activity tasks) are routed to
 * @param executionTimeout bound on the whole run; null = unbounded
 */
public record WorkflowOptions(String taskQueue, Duration executionTimeout) {

    public static final String DEFAULT_TASK_QUEUE = "workflow-task-queue";

    public WorkflowOptions {
        if (taskQueue == null || taskQueue.isBlank()) {
            taskQueue = DEFAULT_TASK_QUEUE;
        }
    }

    public static WorkflowOptions defaults() {
        return new WorkflowOptions(DEFAULT_TASK_QUEUE, null);
    }
}
