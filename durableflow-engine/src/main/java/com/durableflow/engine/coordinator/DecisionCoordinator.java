package com.durableflow.engine.coordinator;

import com.durableflow.core.exception.ConcurrencyConflictException;
import com.durableflow.core.exception.NonDeterminismException;
import com.durableflow.core.exception.NotFoundException;
import com.durableflow.core.model.ActivityOptions;
import com.durableflow.core.model.Event;
import com.durableflow.core.model.EventPayloads;
import com.durableflow.core.model.EventType;
import com.durableflow.core.model.FailureDetail;
import com.durableflow.core.model.Task;
import com.durableflow.core.model.WorkflowRunState;
import com.durableflow.core.replay.Command;
import com.durableflow.core.replay.ReplayResult;
import com.durableflow.core.replay.RunStateProjector;
import com.durableflow.core.replay.WorkflowReplayer;
import com.durableflow.core.workflow.ActivityCatalog;
import com.durableflow.engine.logging.LoggingContext;
import com.durableflow.engine.metrics.WorkflowMetrics;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Processes decision tasks: replays a run's workflow code against its history and
 * records the resulting commands as events.
 *
 * Stateless between tasks. Two decisions for the same run racing on different workers
 * are arbitrated by the event log: the later append conflicts and its decision is
 * discarded, to be redone from the newer history.
 */
public class DecisionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(DecisionCoordinator.class);

    /**
     * What became of a decision task.
     */
    public enum DecisionOutcome {
        /** New events were appended. */
        APPLIED,
        /** Workflow code is waiting; nothing to record. */
        NO_OP,
        /** History moved underneath the decision; it must be redelivered. */
        CONFLICT,
        /** The run was already closed. */
        CLOSED
    }

    private final RunStore runStore;
    private final WorkDispatcher dispatcher;
    private final WorkflowReplayer replayer;
    private final ActivityCatalog activityCatalog;
    private final WorkflowMetrics metrics;
    private final Clock clock;

    public DecisionCoordinator(
            RunStore runStore,
            WorkDispatcher dispatcher,
            WorkflowReplayer replayer,
            ActivityCatalog activityCatalog,
            WorkflowMetrics metrics,
            Clock clock) {
        this.runStore = runStore;
        this.dispatcher = dispatcher;
        this.replayer = replayer;
        this.activityCatalog = activityCatalog;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Run one decision for the task's run.
     * The caller acks the task for every outcome except {@link DecisionOutcome#CONFLICT}.
     */
    public DecisionOutcome processDecisionTask(Task task) {
        try (var ctx = LoggingContext.forTask(task.taskId(), task.workflowId(), task.runId())) {
            DecisionOutcome outcome = decide(task);
            metrics.decisionProcessed(outcome.name());
            return outcome;
        }
    }

    private DecisionOutcome decide(Task task) {
        List<Event> history = runStore.history(task.runId());
        if (history.isEmpty()) {
            log.warn("Decision task {} refers to a run without history", task.taskId());
            return DecisionOutcome.NO_OP;
        }

        WorkflowRunState state;
        List<Event> events;
        try {
            ReplayResult result = replayer.replay(history);
            state = result.state();
            if (state.isClosed()) {
                log.debug("Run {} already closed as {}", state.runId(), state.status());
                return DecisionOutcome.CLOSED;
            }
            events = timedOut(state)
                ? List.of(event(state, EventType.WORKFLOW_TIMED_OUT,
                    EventPayloads.workflowTimedOut(state.executionTimeout()), task))
                : translate(state, result.commands(), task);
        } catch (NonDeterminismException e) {
            state = RunStateProjector.project(history);
            if (state.isClosed()) {
                return DecisionOutcome.CLOSED;
            }
            log.error("Nondeterminism in run {} of workflow type {}: {}",
                state.runId(), state.workflowType(), e.getMessage());
            metrics.nondeterminismDetected(state.workflowType());
            events = List.of(event(state, EventType.WORKFLOW_FAILED, EventPayloads.workflowFailed(
                FailureDetail.of(FailureDetail.NONDETERMINISM, e.getMessage())), task));
        } catch (NotFoundException e) {
            // Workflow type unknown to this process; redelivery cannot help.
            state = RunStateProjector.project(history);
            if (state.isClosed()) {
                return DecisionOutcome.CLOSED;
            }
            log.error("Run {} failed: workflow type {} is not registered", state.runId(), state.workflowType());
            events = List.of(event(state, EventType.WORKFLOW_FAILED, EventPayloads.workflowFailed(
                FailureDetail.of(FailureDetail.WORKFLOW_NOT_REGISTERED, e.getMessage())), task));
        }

        if (events.isEmpty()) {
            dispatcher.ensureOutstandingWork(state);
            return DecisionOutcome.NO_OP;
        }

        List<Event> appended;
        try {
            appended = runStore.append(state.runId(), state.version(), events);
        } catch (ConcurrencyConflictException e) {
            log.info("Decision for run {} lost a race at version {} (now {}), will be retried",
                state.runId(), e.getExpectedVersion(), e.getActualVersion());
            return DecisionOutcome.CONFLICT;
        }

        List<Event> full = new ArrayList<>(history);
        full.addAll(appended);
        WorkflowRunState after = RunStateProjector.project(full);
        runStore.afterAppend(state, after);
        dispatcher.ensureOutstandingWork(after);

        log.debug("Decision for run {} appended {} events (version {} -> {})",
            state.runId(), appended.size(), state.version(), after.version());
        return DecisionOutcome.APPLIED;
    }

    private boolean timedOut(WorkflowRunState state) {
        Instant deadline = state.executionDeadline();
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    private List<Event> translate(WorkflowRunState state, List<Command> commands, Task task) {
        Instant now = clock.instant();
        List<Event> events = new ArrayList<>(commands.size());
        for (Command command : commands) {
            if (command instanceof Command.ScheduleActivity schedule) {
                ActivityOptions options = resolveOptions(state, schedule);
                events.add(event(state, EventType.ACTIVITY_SCHEDULED, EventPayloads.activityScheduled(
                    schedule.activityId(), schedule.activityType(), schedule.input(),
                    1, options, now, now, null), task));
            } else if (command instanceof Command.StartTimer timer) {
                events.add(event(state, EventType.TIMER_STARTED, EventPayloads.timerStarted(
                    timer.timerId(), timer.delay(), now.plus(timer.delay())), task));
            } else if (command instanceof Command.CompleteWorkflow complete) {
                events.add(event(state, EventType.WORKFLOW_COMPLETED,
                    EventPayloads.workflowCompleted(complete.output()), task));
            } else if (command instanceof Command.FailWorkflow fail) {
                events.add(event(state, EventType.WORKFLOW_FAILED,
                    EventPayloads.workflowFailed(fail.failure()), task));
            }
        }
        return events;
    }

    /**
     * Options are fixed at schedule time: the workflow's explicit options, else the
     * activity's registered defaults, else engine defaults. The queue falls back to the run's.
     */
    private ActivityOptions resolveOptions(WorkflowRunState state, Command.ScheduleActivity schedule) {
        ActivityOptions options = schedule.options() != null
            ? schedule.options()
            : activityCatalog.defaultOptions(schedule.activityType()).orElseGet(ActivityOptions::defaults);
        return options.taskQueue() == null ? options.withTaskQueue(state.taskQueue()) : options;
    }

    private Event event(WorkflowRunState state, EventType type, JsonNode payload, Task task) {
        String actorId = task.leaseOwner() != null ? task.leaseOwner() : "dispatcher";
        return Event.create(state.runId(), type, clock.instant(), payload, Event.ACTOR_WORKER, actorId);
    }
}
