package com.durableflow.engine.coordinator;

import com.durableflow.core.model.ActivityInvocation;
import com.durableflow.core.model.ActivityOptions;
import com.durableflow.core.model.Event;
import com.durableflow.core.model.EventPayloads;
import com.durableflow.core.model.EventType;
import com.durableflow.core.model.FailureDetail;
import com.durableflow.core.model.RetryPolicy;
import com.durableflow.core.model.Task;
import com.durableflow.core.model.TaskHandle;
import com.durableflow.core.model.WorkflowRunState;
import com.durableflow.core.repository.TaskQueue;
import com.durableflow.engine.metrics.WorkflowMetrics;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Coordinator for activity attempt lifecycle.
 * Validates deliveries, records outcomes, and applies the retry policy.
 *
 * Outcomes are recorded with read-check-append: an attempt only receives an outcome while
 * it is still the outstanding attempt of its invocation, so duplicate deliveries and late
 * reports from timed-out workers never add a second outcome.
 */
public class ActivityCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ActivityCoordinator.class);

    private final RunStore runStore;
    private final WorkDispatcher dispatcher;
    private final TaskQueue taskQueue;
    private final WorkflowMetrics metrics;
    private final Clock clock;

    public ActivityCoordinator(
            RunStore runStore,
            WorkDispatcher dispatcher,
            TaskQueue taskQueue,
            WorkflowMetrics metrics,
            Clock clock) {
        this.runStore = runStore;
        this.dispatcher = dispatcher;
        this.taskQueue = taskQueue;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * An attempt a worker is cleared to run.
     *
     * @param deadline start-to-close deadline of this attempt
     */
    public record ActivityAttempt(
        String workflowId,
        String runId,
        String activityId,
        String activityType,
        JsonNode input,
        int attempt,
        ActivityOptions options,
        Instant startedAt,
        Instant deadline,
        TaskHandle handle
    ) {
        public String idempotencyKey() {
            return runId + ":" + activityId + ":" + attempt;
        }
    }

    /**
     * Validate a delivered activity task.
     *
     * @return The attempt to run, or empty when the delivery is stale (run closed, attempt
     *         already decided, or schedule-to-close exceeded); the caller acks and drops it
     */
    public Optional<ActivityAttempt> beginAttempt(Task task) {
        Optional<WorkflowRunState> run = runStore.find(task.runId());
        if (run.isEmpty() || run.get().isClosed()) {
            log.debug("Dropping activity task {}: run closed or unknown", task.taskId());
            return Optional.empty();
        }
        ActivityInvocation invocation = run.get().invocation(task.activityId());
        if (invocation == null || !invocation.isOutstanding() || invocation.attempt() != task.attempt()) {
            log.debug("Dropping duplicate delivery of {}", task.taskId());
            return Optional.empty();
        }

        Instant now = clock.instant();
        if (invocation.isPastScheduleToClose(now)) {
            timeOut(task.runId(), task.activityId(), task.attempt(), FailureDetail.of(
                FailureDetail.SCHEDULE_TO_CLOSE_TIMEOUT,
                "Schedule-to-close timeout of " + invocation.options().scheduleToCloseTimeout() + " exceeded"));
            return Optional.empty();
        }

        Instant deadline = now.plus(invocation.options().startToCloseTimeout());
        Instant scheduleToClose = invocation.scheduleToCloseDeadline();
        if (scheduleToClose != null && scheduleToClose.isBefore(deadline)) {
            deadline = scheduleToClose;
        }
        return Optional.of(new ActivityAttempt(
            task.workflowId(),
            task.runId(),
            invocation.activityId(),
            invocation.activityType(),
            invocation.input() == null ? null : invocation.input().deepCopy(),
            invocation.attempt(),
            invocation.options(),
            now,
            deadline,
            task.handle()
        ));
    }

    /**
     * Record a successful attempt and wake the workflow up.
     *
     * @return true if the outcome was recorded, false if the attempt was no longer outstanding
     */
    public boolean completeAttempt(ActivityAttempt attempt, JsonNode result) {
        RunStore.Update update = runStore.update(attempt.runId(), state -> {
            if (!isCurrent(state, attempt.activityId(), attempt.attempt())) {
                return List.of();
            }
            return List.of(event(state, EventType.ACTIVITY_COMPLETED,
                EventPayloads.activityCompleted(attempt.activityId(), attempt.attempt(), result)));
        });
        if (update.isNoop()) {
            log.info("Completion of {} attempt {} ignored: no longer outstanding",
                attempt.activityId(), attempt.attempt());
            return false;
        }
        metrics.activityCompleted(attempt.activityType(), Duration.between(attempt.startedAt(), clock.instant()));
        dispatcher.enqueueDecision(update.after());
        return true;
    }

    /**
     * Record a failed attempt. Schedules the next attempt when the failure is retryable, the
     * run has no pending cancellation, and the policy and schedule-to-close allow it; else fails
     * the invocation terminally.
     *
     * @return true if the outcome was recorded, false if the attempt was no longer outstanding
     */
    public boolean failAttempt(ActivityAttempt attempt, FailureDetail failure, boolean retryable) {
        return recordFailure(attempt.runId(), attempt.activityId(), attempt.attempt(), failure, retryable);
    }

    /**
     * Fail an attempt terminally for a timeout detected outside the worker (recovery sweeps,
     * stale deliveries).
     */
    public boolean timeOut(String runId, String activityId, int attempt, FailureDetail failure) {
        return recordFailure(runId, activityId, attempt, failure, false);
    }

    /**
     * Extend the lease of a running attempt.
     *
     * @throws com.durableflow.core.exception.WorkerLeaseExpiredException if the lease was lost
     */
    public Instant heartbeat(TaskHandle handle, Duration visibilityTimeout) {
        return taskQueue.extendLease(handle, visibilityTimeout);
    }

    private boolean recordFailure(String runId, String activityId, int attempt, FailureDetail failure, boolean retryable) {
        Instant now = clock.instant();
        RunStore.Update update = runStore.update(runId, state -> {
            if (!isCurrent(state, activityId, attempt)) {
                return List.of();
            }
            ActivityInvocation invocation = state.invocation(activityId);
            RetryPolicy policy = invocation.options().retryPolicy();

            // A cancelled run waits on this activity; no further attempts.
            if (retryable && !state.cancelRequested() && policy.shouldRetry(attempt, failure.category())) {
                Instant notBefore = now.plus(policy.nextBackoff(attempt));
                Instant deadline = invocation.scheduleToCloseDeadline();
                if (deadline == null || notBefore.isBefore(deadline)) {
                    return List.of(event(state, EventType.ACTIVITY_SCHEDULED, EventPayloads.activityScheduled(
                        activityId, invocation.activityType(), invocation.input(), attempt + 1,
                        invocation.options(), invocation.firstScheduledAt(), notBefore, failure)));
                }
                FailureDetail timeout = FailureDetail.of(FailureDetail.SCHEDULE_TO_CLOSE_TIMEOUT,
                    "Next attempt would start after the schedule-to-close deadline; last failure "
                        + failure.category() + ": " + failure.message());
                return List.of(event(state, EventType.ACTIVITY_FAILED,
                    EventPayloads.activityFailed(activityId, attempt, timeout)));
            }
            return List.of(event(state, EventType.ACTIVITY_FAILED,
                EventPayloads.activityFailed(activityId, attempt, failure)));
        });

        if (update.isNoop()) {
            log.info("Failure of {} attempt {} ignored: no longer outstanding", activityId, attempt);
            return false;
        }

        ActivityInvocation after = update.after().invocation(activityId);
        if (after.isOutstanding()) {
            log.warn("Activity {} ({}) attempt {} failed with {}, retrying as attempt {} at {}",
                activityId, after.activityType(), attempt, failure.category(), after.attempt(), after.notBefore());
            metrics.activityRetried(after.activityType(), after.attempt());
            dispatcher.enqueueActivity(update.after(), after);
        } else {
            log.warn("Activity {} ({}) failed terminally on attempt {}: {}",
                activityId, after.activityType(), attempt, after.failure().category());
            metrics.activityFailed(after.activityType(), after.failure().category());
            dispatcher.enqueueDecision(update.after());
        }
        return true;
    }

    private static boolean isCurrent(WorkflowRunState state, String activityId, int attempt) {
        if (state.isClosed()) {
            return false;
        }
        ActivityInvocation invocation = state.invocation(activityId);
        return invocation != null && invocation.isOutstanding() && invocation.attempt() == attempt;
    }

    private Event event(WorkflowRunState state, EventType type, JsonNode payload) {
        return Event.create(state.runId(), type, clock.instant(), payload, Event.ACTOR_WORKER, "activity-coordinator");
    }
}
