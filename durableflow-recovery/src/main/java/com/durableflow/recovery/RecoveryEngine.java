package com.durableflow.recovery;

import com.durableflow.core.model.ActivityInvocation;
import com.durableflow.core.model.FailureDetail;
import com.durableflow.core.model.RunRecord;
import com.durableflow.core.model.Task;
import com.durableflow.core.model.WorkflowRunState;
import com.durableflow.core.model.WorkflowStatus;
import com.durableflow.core.repository.RunIndexRepository;
import com.durableflow.core.repository.TaskQueue;
import com.durableflow.engine.WorkflowEngine;
import com.durableflow.engine.coordinator.ActivityCoordinator;
import com.durableflow.engine.coordinator.RunStore;
import com.durableflow.engine.coordinator.WorkDispatcher;
import com.durableflow.engine.coordinator.WorkflowCoordinator;
import com.durableflow.engine.logging.LoggingContext;
import com.durableflow.engine.metrics.WorkflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Recovery Engine responsible for detecting and recovering from failures.
 *
 * Responsibilities:
 * - Return tasks whose lease lapsed (crashed or stuck workers) to their queue
 * - Fail activity invocations past their schedule-to-close timeout
 * - Time out runs past their execution timeout
 * - Give stalled runs a fresh decision task and re-dispatch their outstanding work
 * - Close run index entries that lag behind the event log
 *
 * Every action goes through the same coordinators as normal processing, so a sweep racing a
 * worker is resolved by the event log's version check.
 */
public class RecoveryEngine {

    private static final Logger log = LoggerFactory.getLogger(RecoveryEngine.class);

    private final TaskQueue taskQueue;
    private final RunIndexRepository runIndex;
    private final RunStore runStore;
    private final WorkDispatcher dispatcher;
    private final ActivityCoordinator activityCoordinator;
    private final WorkflowCoordinator workflowCoordinator;
    private final WorkflowMetrics metrics;
    private final Clock clock;
    private final RecoveryOptions options;

    private final ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public RecoveryEngine(
            TaskQueue taskQueue,
            RunIndexRepository runIndex,
            RunStore runStore,
            WorkDispatcher dispatcher,
            ActivityCoordinator activityCoordinator,
            WorkflowCoordinator workflowCoordinator,
            WorkflowMetrics metrics,
            Clock clock,
            RecoveryOptions options) {
        this.taskQueue = taskQueue;
        this.runIndex = runIndex;
        this.runStore = runStore;
        this.dispatcher = dispatcher;
        this.activityCoordinator = activityCoordinator;
        this.workflowCoordinator = workflowCoordinator;
        this.metrics = metrics;
        this.clock = clock;
        this.options = options;
        this.scheduler = Executors.newScheduledThreadPool(2, runnable -> {
            Thread thread = new Thread(runnable, "recovery-engine");
            thread.setDaemon(true);
            return thread;
        });
    }

    public static RecoveryEngine forEngine(WorkflowEngine engine, RecoveryOptions options) {
        return new RecoveryEngine(
            engine.taskQueue(),
            engine.runIndex(),
            engine.runStore(),
            engine.dispatcher(),
            engine.activityCoordinator(),
            engine.workflowCoordinator(),
            engine.metrics(),
            engine.clock(),
            options
        );
    }

    /**
     * Outcome of one sweep over open runs.
     */
    public record SweepReport(
        int runsChecked,
        int runsTimedOut,
        int activitiesTimedOut,
        int stalledRunsRepaired,
        int indexEntriesClosed
    ) {
        public int actions() {
            return runsTimedOut + activitiesTimedOut + stalledRunsRepaired + indexEntriesClosed;
        }
    }

    /**
     * Start the recovery engine.
     */
    public void start() {
        if (running) {
            log.warn("Recovery engine already running");
            return;
        }

        running = true;
        log.info("Starting recovery engine (lease check every {}, run sweep every {}, stall threshold {})",
            options.leaseCheckInterval(), options.runSweepInterval(), options.stallThreshold());

        scheduler.scheduleWithFixedDelay(
            this::safeRecoverExpiredLeases,
            options.leaseCheckInterval().toMillis(),
            options.leaseCheckInterval().toMillis(),
            TimeUnit.MILLISECONDS
        );

        scheduler.scheduleWithFixedDelay(
            this::safeSweepOpenRuns,
            options.runSweepInterval().toMillis(),
            options.runSweepInterval().toMillis(),
            TimeUnit.MILLISECONDS
        );

        log.info("Recovery engine started");
    }

    /**
     * Stop the recovery engine.
     */
    public void stop() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Recovery engine stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Run both sweeps once, in order.
     */
    public SweepReport runOnce() {
        recoverExpiredLeases();
        return sweepOpenRuns();
    }

    // ========== Lease Recovery ==========

    /**
     * Return tasks with expired leases to their queues.
     * Workers may have crashed without acking.
     *
     * @return Number of reclaimed tasks
     */
    public int recoverExpiredLeases() {
        List<Task> expired = taskQueue.reclaimExpired(clock.instant(), options.batchSize());
        for (Task task : expired) {
            log.warn("WorkerLeaseExpired: task {} on {} held by {} lapsed at {} (delivery {}), returned to queue",
                task.taskId(), task.queueName(), task.leaseOwner(), task.leaseExpiresAt(), task.deliveryCount());
            metrics.leaseExpired(task.queueName(), task.kind().name());
        }
        if (!expired.isEmpty()) {
            log.info("Reclaimed {} tasks with expired leases", expired.size());
        }
        return expired.size();
    }

    // ========== Run Sweep ==========

    /**
     * Check open runs for timeouts, stalls and stale index entries.
     */
    public SweepReport sweepOpenRuns() {
        Instant now = clock.instant();
        List<RunRecord> open = runIndex.findOpen(options.batchSize());
        int runsTimedOut = 0;
        int activitiesTimedOut = 0;
        int stalled = 0;
        int indexClosed = 0;

        for (RunRecord record : open) {
            try (var ctx = LoggingContext.forRun(record.workflowId(), record.runId())) {
                Optional<WorkflowRunState> found = runStore.find(record.runId());
                if (found.isEmpty()) {
                    if (closeOrphanReservation(record, now)) {
                        indexClosed++;
                    }
                    continue;
                }
                WorkflowRunState run = found.get();

                if (run.isClosed()) {
                    runIndex.markClosed(run.runId(), run.status(), run.closedAt());
                    metrics.recoveryAction("index_closed");
                    log.info("Closed lagging index entry of run {} ({})", run.runId(), run.status());
                    indexClosed++;
                    continue;
                }

                if (run.executionDeadline() != null && !now.isBefore(run.executionDeadline())) {
                    if (workflowCoordinator.timeOutRun(run.runId())) {
                        metrics.recoveryAction("run_timed_out");
                        log.warn("Run {} exceeded its execution timeout of {}", run.runId(), run.executionTimeout());
                        runsTimedOut++;
                    }
                    continue;
                }

                activitiesTimedOut += enforceScheduleToClose(run, now);

                if (isStalled(run, now)) {
                    dispatcher.enqueueDecision(run);
                    dispatcher.ensureOutstandingWork(run);
                    metrics.recoveryAction("stalled_run_repaired");
                    log.info("Run {} had no progress since {}, re-dispatched its work", run.runId(), run.lastUpdatedAt());
                    stalled++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to recover run {}", record.runId(), e);
            }
        }

        SweepReport report = new SweepReport(open.size(), runsTimedOut, activitiesTimedOut, stalled, indexClosed);
        if (report.actions() > 0) {
            log.info("Recovery sweep: {}", report);
        }
        return report;
    }

    private int enforceScheduleToClose(WorkflowRunState run, Instant now) {
        int timedOut = 0;
        for (ActivityInvocation invocation : run.outstandingInvocations()) {
            if (!invocation.isPastScheduleToClose(now)) {
                continue;
            }
            boolean recorded = activityCoordinator.timeOut(run.runId(), invocation.activityId(), invocation.attempt(),
                FailureDetail.of(FailureDetail.SCHEDULE_TO_CLOSE_TIMEOUT,
                    "Schedule-to-close timeout of " + invocation.options().scheduleToCloseTimeout() + " exceeded"));
            if (recorded) {
                metrics.recoveryAction("activity_timed_out");
                log.warn("Activity {} ({}) of run {} exceeded schedule-to-close",
                    invocation.activityId(), invocation.activityType(), run.runId());
                timedOut++;
            }
        }
        return timedOut;
    }

    private boolean isStalled(WorkflowRunState run, Instant now) {
        Instant lastProgress = run.lastUpdatedAt() != null ? run.lastUpdatedAt() : run.startedAt();
        return lastProgress != null && lastProgress.plus(options.stallThreshold()).isBefore(now);
    }

    /**
     * A run registered in the index whose start event was never written (the starter crashed
     * in between). Closed once it is older than the stall threshold.
     */
    private boolean closeOrphanReservation(RunRecord record, Instant now) {
        if (record.createdAt().plus(options.stallThreshold()).isAfter(now)) {
            return false;
        }
        runIndex.markClosed(record.runId(), WorkflowStatus.TERMINATED, now);
        metrics.recoveryAction("orphan_reservation_closed");
        log.warn("Closed run {} of workflow {}: reserved at {} but never started",
            record.runId(), record.workflowId(), record.createdAt());
        return true;
    }

    private void safeRecoverExpiredLeases() {
        if (!running) return;
        try {
            recoverExpiredLeases();
        } catch (Exception e) {
            log.error("Error in lease recovery", e);
        }
    }

    private void safeSweepOpenRuns() {
        if (!running) return;
        try {
            sweepOpenRuns();
        } catch (Exception e) {
            log.error("Error in run sweep", e);
        }
    }
}
