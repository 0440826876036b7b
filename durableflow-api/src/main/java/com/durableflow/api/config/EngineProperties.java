package com.durableflow.api.config;

import com.durableflow.core.model.WorkflowIdReusePolicy;
import com.durableflow.core.model.WorkflowOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

/**
 * Engine settings bound from the {@code durableflow} prefix.
 *
 * @param persistence {@code memory} (default) or {@code jdbc}
 * @param taskQueues queues the embedded worker polls and the health check reports on
 * @param defaultReusePolicy reuse policy applied when a start request names none
 * @param maxResultWait upper bound on how long a result request may block
 */
@ConfigurationProperties("durableflow")
public record EngineProperties(
    @DefaultValue("memory") String persistence,
    @DefaultValue(WorkflowOptions.DEFAULT_TASK_QUEUE) List<String> taskQueues,
    @DefaultValue("ALLOW_DUPLICATE") WorkflowIdReusePolicy defaultReusePolicy,
    @DefaultValue("50ms") Duration resultPollInterval,
    @DefaultValue("60s") Duration maxResultWait,
    @DefaultValue Worker worker,
    @DefaultValue Timers timers,
    @DefaultValue Recovery recovery
) {

    /**
     * Embedded worker.
     *
     * @param leaseTimeout visibility timeout of dequeued tasks
     */
    public record Worker(
        @DefaultValue("true") boolean enabled,
        String workerId,
        @DefaultValue("10") int maxConcurrentTasks,
        @DefaultValue("200ms") Duration pollInterval,
        @DefaultValue("30s") Duration leaseTimeout,
        @DefaultValue("10s") Duration heartbeatInterval,
        @DefaultValue("100ms") Duration conflictRedeliveryDelay,
        @DefaultValue("30s") Duration shutdownTimeout
    ) {
    }

    public record Timers(
        @DefaultValue("true") boolean enabled,
        @DefaultValue("1s") Duration pollInterval,
        @DefaultValue("100") int batchSize
    ) {
    }

    public record Recovery(
        @DefaultValue("true") boolean enabled,
        @DefaultValue("5s") Duration leaseCheckInterval,
        @DefaultValue("10s") Duration runSweepInterval,
        @DefaultValue("5m") Duration stallThreshold,
        @DefaultValue("100") int batchSize
    ) {
    }
}
