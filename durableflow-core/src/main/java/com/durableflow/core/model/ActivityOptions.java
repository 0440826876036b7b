package com.durableflow.core.model;

import java.time.Duration;

/**
 * Per-invocation execution settings for an activity.
 *
 * @param retryPolicy retry behaviour across attempts
 * @param startToCloseTimeout bound on a single attempt
 * @param scheduleToCloseTimeout bound on all attempts, measured from the first schedule; null = unbounded
 * @param heartbeatTimeout lease extension granted by each heartbeat; null = worker default
 * @param taskQueue queue the activity tasks go to; null = the workflow's queue
 */
public record ActivityOptions(
    RetryPolicy retryPolicy,
    Duration startToCloseTimeout,
    Duration scheduleToCloseTimeout,
    Duration heartbeatTimeout,
    String taskQueue
) {
    public static final Duration DEFAULT_START_TO_CLOSE = Duration.ofMinutes(5);

    public ActivityOptions {
        if (retryPolicy == null) {
            retryPolicy = RetryPolicy.defaultPolicy();
        }
        if (startToCloseTimeout == null) {
            startToCloseTimeout = DEFAULT_START_TO_CLOSE;
        }
        if (startToCloseTimeout.isNegative() || startToCloseTimeout.isZero()) {
            throw new IllegalArgumentException("startToCloseTimeout must be positive");
        }
        if (scheduleToCloseTimeout != null && (scheduleToCloseTimeout.isNegative() || scheduleToCloseTimeout.isZero())) {
            throw new IllegalArgumentException("scheduleToCloseTimeout must be positive");
        }
    }

    public static ActivityOptions defaults() {
        return builder().build();
    }

    public ActivityOptions withTaskQueue(String taskQueue) {
        return new ActivityOptions(retryPolicy, startToCloseTimeout, scheduleToCloseTimeout, heartbeatTimeout, taskQueue);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private RetryPolicy retryPolicy = RetryPolicy.defaultPolicy();
        private Duration startToCloseTimeout = DEFAULT_START_TO_CLOSE;
        private Duration scheduleToCloseTimeout;
        private Duration heartbeatTimeout;
        private String taskQueue;

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder startToCloseTimeout(Duration startToCloseTimeout) {
            this.startToCloseTimeout = startToCloseTimeout;
            return this;
        }

        public Builder scheduleToCloseTimeout(Duration scheduleToCloseTimeout) {
            this.scheduleToCloseTimeout = scheduleToCloseTimeout;
            return this;
        }

        public Builder heartbeatTimeout(Duration heartbeatTimeout) {
            this.heartbeatTimeout = heartbeatTimeout;
            return this;
        }

        public Builder taskQueue(String taskQueue) {
            this.taskQueue = taskQueue;
            return this;
        }

        public ActivityOptions build() {
            return new ActivityOptions(retryPolicy, startToCloseTimeout, scheduleToCloseTimeout, heartbeatTimeout, taskQueue);
        }
    }
}
