package com.durableflow.worker;

import com.durableflow.core.exception.WorkerLeaseExpiredException;
import com.durableflow.core.model.ActivityOptions;
import com.durableflow.core.model.FailureDetail;
import com.durableflow.core.model.Task;
import com.durableflow.core.model.TaskKind;
import com.durableflow.core.repository.TaskQueue;
import com.durableflow.engine.WorkflowEngine;
import com.durableflow.engine.coordinator.ActivityCoordinator;
import com.durableflow.engine.coordinator.ActivityCoordinator.ActivityAttempt;
import com.durableflow.engine.coordinator.DecisionCoordinator;
import com.durableflow.engine.coordinator.DecisionCoordinator.DecisionOutcome;
import com.durableflow.engine.logging.LoggingContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker that polls task queues and executes decision and activity tasks.
 *
 * Usage:
 * <pre>
 * ActivityRegistry activities = new ActivityRegistry();
 * activities.register("send-email", context -> {
 *     // Handle send-email activity
 *     return context.toJsonNode(Map.of("sent", true));
 * });
 * WorkerRuntime worker = WorkerRuntime.forEngine(engine, activities, WorkerOptions.defaults());
 * worker.start();
 * </pre>
 *
 * Every dequeued task holds a lease for {@link WorkerOptions#leaseTimeout()}. A task is acked only
 * after its outcome is in history; a worker that dies before that leaves the lease to lapse and
 * the task is redelivered.
 */
public class WorkerRuntime {

    private static final Logger log = LoggerFactory.getLogger(WorkerRuntime.class);

    private final TaskQueue taskQueue;
    private final DecisionCoordinator decisionCoordinator;
    private final ActivityCoordinator activityCoordinator;
    private final ActivityRegistry activityRegistry;
    private final WorkerOptions options;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Semaphore permits;
    private final ExecutorService pollers;
    private final ExecutorService taskPool;
    private final ExecutorService handlerPool;
    private final ScheduledExecutorService heartbeatScheduler;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile boolean halted;

    public WorkerRuntime(
            TaskQueue taskQueue,
            DecisionCoordinator decisionCoordinator,
            ActivityCoordinator activityCoordinator,
            ActivityRegistry activityRegistry,
            WorkerOptions options,
            ObjectMapper objectMapper,
            Clock clock) {
        this.taskQueue = taskQueue;
        this.decisionCoordinator = decisionCoordinator;
        this.activityCoordinator = activityCoordinator;
        this.activityRegistry = activityRegistry;
        this.options = options;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.permits = new Semaphore(options.maxConcurrentTasks());
        this.pollers = Executors.newFixedThreadPool(options.taskQueues().size(), named(options.workerId() + "-poll"));
        this.taskPool = Executors.newFixedThreadPool(options.maxConcurrentTasks(), named(options.workerId() + "-task"));
        this.handlerPool = Executors.newCachedThreadPool(named(options.workerId() + "-activity"));
        this.heartbeatScheduler = Executors.newScheduledThreadPool(2, named(options.workerId() + "-heartbeat"));
    }

    /**
     * Worker over an engine's queue and coordinators.
     */
    public static WorkerRuntime forEngine(WorkflowEngine engine, ActivityRegistry activityRegistry, WorkerOptions options) {
        return new WorkerRuntime(
            engine.taskQueue(),
            engine.decisionCoordinator(),
            engine.activityCoordinator(),
            activityRegistry,
            options,
            new ObjectMapper(),
            engine.clock()
        );
    }

    /**
     * Start one poller per task queue.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            log.info("Starting worker {} on queues {} with activity types {}",
                options.workerId(), options.taskQueues(), activityRegistry.activityTypes());
            for (String queueName : options.taskQueues()) {
                pollers.submit(() -> pollLoop(queueName));
            }
        }
    }

    /**
     * Stop the worker gracefully: stop polling, let in-flight tasks finish and report.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Stopping worker {}", options.workerId());
            pollers.shutdownNow();
            taskPool.shutdown();
            awaitTermination(taskPool);
            handlerPool.shutdown();
            awaitTermination(handlerPool);
            heartbeatScheduler.shutdownNow();
        }
    }

    /**
     * Abandon in-flight work without reporting or acking, as a crashed process would.
     * Leases are left to lapse so the tasks are redelivered to another worker.
     */
    public void halt() {
        halted = true;
        running.set(false);
        log.warn("Halting worker {}, in-flight tasks are abandoned", options.workerId());
        heartbeatScheduler.shutdownNow();
        pollers.shutdownNow();
        handlerPool.shutdownNow();
        taskPool.shutdownNow();
    }

    public boolean isRunning() {
        return running.get();
    }

    public String workerId() {
        return options.workerId();
    }

    /**
     * Number of tasks currently executing.
     */
    public int activeTasks() {
        return options.maxConcurrentTasks() - permits.availablePermits();
    }

    // ========== Polling ==========

    private void pollLoop(String queueName) {
        try (var ctx = LoggingContext.forWorker(options.workerId())) {
            log.debug("Polling queue {}", queueName);
            while (running.get()) {
                try {
                    permits.acquire();
                    if (!pollOnce(queueName)) {
                        permits.release();
                        Thread.sleep(options.pollInterval().toMillis());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (Exception e) {
                    permits.release();
                    log.error("Error in poll loop for {}", queueName, e);
                    try {
                        Thread.sleep(options.pollInterval().toMillis() * 2);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                }
            }
        }
    }

    /**
     * Lease one task and hand it to the task pool, which then owns the permit.
     *
     * @return false if the queue had nothing visible
     */
    private boolean pollOnce(String queueName) {
        Optional<Task> leased = taskQueue.dequeue(queueName, options.leaseTimeout(), options.workerId());
        if (leased.isEmpty()) {
            return false;
        }
        Task task = leased.get();
        try {
            taskPool.execute(() -> {
                try {
                    execute(task);
                } finally {
                    permits.release();
                }
            });
        } catch (RejectedExecutionException e) {
            // Shutting down: the lease lapses and the task is redelivered
            log.info("Worker {} shutting down, leaving task {} to be redelivered", options.workerId(), task.taskId());
            permits.release();
        }
        return true;
    }

    private void execute(Task task) {
        try (var ctx = LoggingContext.forWorker(options.workerId())) {
            if (task.kind() == TaskKind.DECISION) {
                executeDecision(task);
            } else {
                executeActivity(task);
            }
        } catch (WorkerLeaseExpiredException e) {
            log.warn("WorkerLeaseExpired: lost lease on task {}, it has been or will be redelivered", task.taskId());
        } catch (RuntimeException e) {
            log.error("Task {} failed inside the worker, returning it to the queue", task.taskId(), e);
            release(task, options.pollInterval());
        }
    }

    // ========== Decision tasks ==========

    private void executeDecision(Task task) {
        DecisionOutcome outcome = decisionCoordinator.processDecisionTask(task);
        if (halted) {
            return;
        }
        if (outcome == DecisionOutcome.CONFLICT) {
            taskQueue.nack(task.handle(), options.conflictRedeliveryDelay());
        } else {
            taskQueue.ack(task.handle());
        }
    }

    // ========== Activity tasks ==========

    private void executeActivity(Task task) {
        Optional<ActivityAttempt> begun = activityCoordinator.beginAttempt(task);
        if (begun.isEmpty()) {
            taskQueue.ack(task.handle());
            return;
        }
        ActivityAttempt attempt = begun.get();

        try (var ctx = LoggingContext.forActivity(attempt.workflowId(), attempt.runId(), attempt.activityId(), attempt.attempt())) {
            Optional<ActivityRegistry.Registration> registration = activityRegistry.find(attempt.activityType());
            if (registration.isEmpty()) {
                log.error("No handler registered for activity type: {}", attempt.activityType());
                activityCoordinator.failAttempt(attempt, FailureDetail.of(FailureDetail.ACTIVITY_NOT_REGISTERED,
                    "No handler registered for activity type " + attempt.activityType()), false);
                taskQueue.ack(task.handle());
                return;
            }

            log.info("Executing activity {} ({}) attempt {}", attempt.activityId(), attempt.activityType(), attempt.attempt());
            long cadence = heartbeatCadence(attempt).toMillis();
            ScheduledFuture<?> heartbeats = heartbeatScheduler.scheduleAtFixedRate(
                () -> sendHeartbeat(attempt),
                cadence,
                cadence,
                TimeUnit.MILLISECONDS
            );
            AttemptOutcome outcome;
            try {
                outcome = runHandler(registration.get().handler(), attempt);
            } finally {
                heartbeats.cancel(false);
            }

            if (halted) {
                return;
            }
            if (outcome.failure() == null) {
                activityCoordinator.completeAttempt(attempt, outcome.result());
                log.info("Activity {} completed", attempt.activityId());
            } else {
                activityCoordinator.failAttempt(attempt, outcome.failure(), outcome.retryable());
            }
            taskQueue.ack(task.handle());
        }
    }

    private record AttemptOutcome(JsonNode result, FailureDetail failure, boolean retryable) {

        static AttemptOutcome success(JsonNode result) {
            return new AttemptOutcome(result, null, false);
        }

        static AttemptOutcome failure(FailureDetail failure, boolean retryable) {
            return new AttemptOutcome(null, failure, retryable);
        }
    }

    /**
     * Run the handler on the activity pool, bounded by the attempt deadline.
     */
    private AttemptOutcome runHandler(ActivityHandler handler, ActivityAttempt attempt) {
        ActivityContext context = new ActivityContext(attempt, objectMapper, () -> sendHeartbeat(attempt));
        Future<JsonNode> future;
        try {
            future = handlerPool.submit(() -> handler.execute(context));
        } catch (RejectedExecutionException e) {
            return AttemptOutcome.failure(FailureDetail.of(FailureDetail.UNHANDLED_ERROR, "Worker shutting down"), true);
        }

        Duration remaining = Duration.between(clock.instant(), attempt.deadline());
        try {
            return AttemptOutcome.success(future.get(Math.max(0, remaining.toMillis()), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            FailureDetail timeout = timeoutFailure(attempt);
            log.warn("Activity {} attempt {} timed out: {}", attempt.activityId(), attempt.attempt(), timeout.message());
            return AttemptOutcome.failure(timeout, false);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ActivityException ae) {
                log.warn("Activity {} failed: {} - {}", attempt.activityId(), ae.getErrorCode(), ae.getMessage());
                return AttemptOutcome.failure(FailureDetail.of(ae.getErrorCode(), ae.getMessage()), ae.isRetryable());
            }
            log.error("Activity {} failed with unexpected error", attempt.activityId(), cause);
            return AttemptOutcome.failure(FailureDetail.of(FailureDetail.UNHANDLED_ERROR, describe(cause)), true);
        } catch (CancellationException e) {
            return AttemptOutcome.failure(FailureDetail.of(FailureDetail.UNHANDLED_ERROR, "Activity cancelled"), true);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return AttemptOutcome.failure(FailureDetail.of(FailureDetail.UNHANDLED_ERROR, "Worker interrupted"), true);
        }
    }

    private static FailureDetail timeoutFailure(ActivityAttempt attempt) {
        ActivityOptions activityOptions = attempt.options();
        Instant startToClose = attempt.startedAt().plus(activityOptions.startToCloseTimeout());
        if (attempt.deadline().isBefore(startToClose)) {
            return FailureDetail.of(FailureDetail.SCHEDULE_TO_CLOSE_TIMEOUT,
                "Schedule-to-close timeout of " + activityOptions.scheduleToCloseTimeout() + " exceeded");
        }
        return FailureDetail.of(FailureDetail.START_TO_CLOSE_TIMEOUT,
            "Start-to-close timeout of " + activityOptions.startToCloseTimeout() + " exceeded");
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "";
        }
        return cause.getMessage() != null
            ? cause.getClass().getSimpleName() + ": " + cause.getMessage()
            : cause.getClass().getSimpleName();
    }

    /**
     * How far each heartbeat pushes the lease out.
     */
    private Duration leaseExtension(ActivityAttempt attempt) {
        return attempt.options().heartbeatTimeout() != null
            ? attempt.options().heartbeatTimeout()
            : options.leaseTimeout();
    }

    /**
     * Beat at the worker's interval, but at least twice per lease extension so the lease of a
     * live attempt never lapses between beats.
     */
    private Duration heartbeatCadence(ActivityAttempt attempt) {
        Duration halfExtension = leaseExtension(attempt).dividedBy(2);
        Duration cadence = options.heartbeatInterval().compareTo(halfExtension) <= 0
            ? options.heartbeatInterval()
            : halfExtension;
        return cadence.toMillis() < 1 ? Duration.ofMillis(1) : cadence;
    }

    private boolean sendHeartbeat(ActivityAttempt attempt) {
        if (halted) {
            return false;
        }
        Duration extension = leaseExtension(attempt);
        try {
            activityCoordinator.heartbeat(attempt.handle(), extension);
            return true;
        } catch (WorkerLeaseExpiredException e) {
            log.warn("Heartbeat rejected for activity {} attempt {}: lease lost", attempt.activityId(), attempt.attempt());
            return false;
        } catch (RuntimeException e) {
            log.warn("Heartbeat failed for activity {} attempt {}", attempt.activityId(), attempt.attempt(), e);
            return false;
        }
    }

    private void release(Task task, Duration delay) {
        if (halted) {
            return;
        }
        try {
            taskQueue.nack(task.handle(), delay);
        } catch (WorkerLeaseExpiredException e) {
            log.warn("WorkerLeaseExpired: task {} already redelivered", task.taskId());
        } catch (RuntimeException e) {
            log.error("Could not return task {} to the queue, its lease will lapse", task.taskId(), e);
        }
    }

    private void awaitTermination(ExecutorService executor) {
        try {
            if (!executor.awaitTermination(options.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
