package com.durableflow.worker;

import com.durableflow.core.model.WorkflowOptions;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Settings of one worker process.
 *
 * @param leaseTimeout visibility timeout taken on every dequeued task; also the grace period
 *                     after which a silent worker's activity is redelivered
 * @param heartbeatInterval how often running activities extend their lease; must be shorter
 *                          than the lease timeout
 * @param conflictRedeliveryDelay delay before a decision that lost an append race is retried
 */
public record WorkerOptions(
    String workerId,
    List<String> taskQueues,
    int maxConcurrentTasks,
    Duration pollInterval,
    Duration leaseTimeout,
    Duration heartbeatInterval,
    Duration conflictRedeliveryDelay,
    Duration shutdownTimeout
) {
    public WorkerOptions {
        if (taskQueues == null || taskQueues.isEmpty()) {
            throw new IllegalArgumentException("At least one task queue is required");
        }
        if (maxConcurrentTasks < 1) {
            throw new IllegalArgumentException("maxConcurrentTasks must be >= 1");
        }
        if (heartbeatInterval.compareTo(leaseTimeout) >= 0) {
            throw new IllegalArgumentException("heartbeatInterval must be shorter than leaseTimeout");
        }
        taskQueues = List.copyOf(taskQueues);
    }

    public static WorkerOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String workerId = "worker-" + UUID.randomUUID().toString().substring(0, 8);
        private List<String> taskQueues = List.of(WorkflowOptions.DEFAULT_TASK_QUEUE);
        private int maxConcurrentTasks = 10;
        private Duration pollInterval = Duration.ofMillis(200);
        private Duration leaseTimeout = Duration.ofSeconds(30);
        private Duration heartbeatInterval = Duration.ofSeconds(10);
        private Duration conflictRedeliveryDelay = Duration.ofMillis(100);
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        public Builder workerId(String workerId) {
            this.workerId = workerId;
            return this;
        }

        public Builder taskQueues(List<String> taskQueues) {
            this.taskQueues = taskQueues;
            return this;
        }

        public Builder taskQueues(String... taskQueues) {
            this.taskQueues = List.of(taskQueues);
            return this;
        }

        public Builder maxConcurrentTasks(int maxConcurrentTasks) {
            this.maxConcurrentTasks = maxConcurrentTasks;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder leaseTimeout(Duration leaseTimeout) {
            this.leaseTimeout = leaseTimeout;
            return this;
        }

        public Builder heartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
            return this;
        }

        public Builder conflictRedeliveryDelay(Duration conflictRedeliveryDelay) {
            this.conflictRedeliveryDelay = conflictRedeliveryDelay;
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public WorkerOptions build() {
            return new WorkerOptions(workerId, taskQueues, maxConcurrentTasks, pollInterval,
                leaseTimeout, heartbeatInterval, conflictRedeliveryDelay, shutdownTimeout);
        }
    }
}
