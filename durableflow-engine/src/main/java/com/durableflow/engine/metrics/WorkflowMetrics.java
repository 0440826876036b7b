package com.durableflow.engine.metrics;

import com.durableflow.core.model.WorkflowStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Micrometer metrics for the workflow engine.
 * Exposes key operational metrics for monitoring and alerting.
 *
 * Metrics exposed:
 * - Runs started and closed, by workflow type and close status
 * - Activity attempt outcomes, retries and timeouts
 * - Decision outcomes, including optimistic-concurrency conflicts and nondeterminism
 * - Lease expirations and recovery actions
 * - Queue depth and open-run gauges
 *
 * Until the binder is bound to the application registry it records into a private
 * {@link SimpleMeterRegistry}, so engine components can be used without Spring.
 */
public class WorkflowMetrics implements MeterBinder {

    // Metric names
    public static final String WORKFLOW_STARTED = "durableflow.workflows.started";
    public static final String WORKFLOW_CLOSED = "durableflow.workflows.closed";
    public static final String WORKFLOW_DURATION = "durableflow.workflow.duration";
    public static final String OPEN_RUNS = "durableflow.workflows.open";

    public static final String ACTIVITY_COMPLETED = "durableflow.activity.completed";
    public static final String ACTIVITY_FAILED = "durableflow.activity.failed";
    public static final String ACTIVITY_RETRIES = "durableflow.activity.retries";
    public static final String ACTIVITY_DURATION = "durableflow.activity.duration";

    public static final String DECISIONS = "durableflow.decisions";
    public static final String NONDETERMINISM = "durableflow.decisions.nondeterminism";

    public static final String LEASE_EXPIRATIONS = "durableflow.lease.expirations";
    public static final String QUEUE_DEPTH = "durableflow.queue.depth";
    public static final String TIMERS_FIRED = "durableflow.timers.fired";
    public static final String RECOVERY_ACTIONS = "durableflow.recovery.actions";

    private final List<Consumer<MeterRegistry>> gauges = new CopyOnWriteArrayList<>();
    private volatile MeterRegistry registry = new SimpleMeterRegistry();

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;
        gauges.forEach(gauge -> gauge.accept(registry));
    }

    public MeterRegistry registry() {
        return registry;
    }

    // ========== Workflow Metrics ==========

    public void workflowStarted(String workflowType) {
        Counter.builder(WORKFLOW_STARTED)
            .tag("workflow", workflowType)
            .description("Total workflow runs started")
            .register(registry)
            .increment();
    }

    public void workflowClosed(String workflowType, WorkflowStatus status, Duration duration) {
        Counter.builder(WORKFLOW_CLOSED)
            .tag("workflow", workflowType)
            .tag("status", status.name())
            .description("Total workflow runs closed, by close status")
            .register(registry)
            .increment();

        if (duration != null) {
            Timer.builder(WORKFLOW_DURATION)
                .tag("workflow", workflowType)
                .tag("status", status.name())
                .description("Workflow run duration from start to close")
                .register(registry)
                .record(duration);
        }
    }

    // ========== Activity Metrics ==========

    public void activityCompleted(String activityType, Duration duration) {
        Counter.builder(ACTIVITY_COMPLETED)
            .tag("activity", activityType)
            .description("Activity attempts completed successfully")
            .register(registry)
            .increment();

        Timer.builder(ACTIVITY_DURATION)
            .tag("activity", activityType)
            .tag("outcome", "success")
            .description("Activity attempt duration")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(registry)
            .record(duration);
    }

    public void activityFailed(String activityType, String category) {
        Counter.builder(ACTIVITY_FAILED)
            .tag("activity", activityType)
            .tag("category", category)
            .description("Activity invocations failed terminally")
            .register(registry)
            .increment();
    }

    public void activityRetried(String activityType, int nextAttempt) {
        Counter.builder(ACTIVITY_RETRIES)
            .tag("activity", activityType)
            .tag("attempt", String.valueOf(Math.min(nextAttempt, 10)))
            .description("Activity retries scheduled")
            .register(registry)
            .increment();
    }

    // ========== Decision Metrics ==========

    public void decisionProcessed(String outcome) {
        Counter.builder(DECISIONS)
            .tag("outcome", outcome)
            .description("Decision tasks processed, by outcome")
            .register(registry)
            .increment();
    }

    public void nondeterminismDetected(String workflowType) {
        Counter.builder(NONDETERMINISM)
            .tag("workflow", workflowType)
            .description("Runs failed because workflow code contradicted history")
            .register(registry)
            .increment();
    }

    // ========== Queue and Lease Metrics ==========

    public void leaseExpired(String queueName, String kind) {
        Counter.builder(LEASE_EXPIRATIONS)
            .tag("queue", queueName)
            .tag("kind", kind)
            .description("Task leases that lapsed without ack")
            .register(registry)
            .increment();
    }

    /**
     * Register a gauge reporting the depth of a queue.
     */
    public void monitorQueueDepth(String queueName, Supplier<Number> depth) {
        registerGauge(r -> Gauge.builder(QUEUE_DEPTH, depth, s -> s.get().doubleValue())
            .tag("queue", queueName)
            .description("Tasks pending or leased in the queue")
            .register(r));
    }

    /**
     * Register a gauge reporting the number of open runs.
     */
    public void monitorOpenRuns(Supplier<Number> openRuns) {
        registerGauge(r -> Gauge.builder(OPEN_RUNS, openRuns, s -> s.get().doubleValue())
            .description("Workflow runs not yet closed")
            .register(r));
    }

    // ========== Timer and Recovery Metrics ==========

    public void timerFired() {
        Counter.builder(TIMERS_FIRED)
            .description("Durable timers fired")
            .register(registry)
            .increment();
    }

    public void recoveryAction(String action) {
        Counter.builder(RECOVERY_ACTIONS)
            .tag("action", action)
            .description("Corrective actions taken by recovery sweeps")
            .register(registry)
            .increment();
    }

    // ========== Helper Methods ==========

    private void registerGauge(Consumer<MeterRegistry> gauge) {
        gauges.add(gauge);
        gauge.accept(registry);
    }

    /**
     * Sum of the counters with this name matching the given tag key/value pairs, 0 if none
     * was incremented yet.
     */
    public double count(String name, String... tags) {
        return registry.find(name).tags(tags).counters().stream()
            .mapToDouble(Counter::count)
            .sum();
    }
}
