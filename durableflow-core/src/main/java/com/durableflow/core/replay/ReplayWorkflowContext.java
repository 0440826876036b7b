package com.durableflow.core.replay;

import com.durableflow.core.exception.NonDeterminismException;
import com.durableflow.core.model.ActivityInvocation;
import com.durableflow.core.model.ActivityOptions;
import com.durableflow.core.model.WorkflowRunState;
import com.durableflow.core.model.WorkflowRunState.TimerState;
import com.durableflow.core.workflow.ActivityFailedException;
import com.durableflow.core.workflow.ActivityHandle;
import com.durableflow.core.workflow.WorkflowContext;
import com.durableflow.core.workflow.WorkflowRegistry;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Serves workflow code from recorded history and collects the commands it issues
 * beyond that history.
 *
 * Activity ids are assigned in call order ("1", "2", ...), timer ids likewise
 * ("timer-1", ...), so identical code over identical history yields identical ids.
 */
final class ReplayWorkflowContext implements WorkflowContext {

    private final WorkflowRunState state;
    private final List<Command> commands = new ArrayList<>();
    private final Set<String> consumedActivities = new HashSet<>();
    private final Set<String> consumedTimers = new HashSet<>();

    private int activitySequence;
    private int timerSequence;
    private int randomSequence;
    private Instant logicalTime;

    ReplayWorkflowContext(WorkflowRunState state) {
        this.state = state;
        this.logicalTime = state.startedAt();
    }

    @Override
    public String workflowId() {
        return state.workflowId();
    }

    @Override
    public String runId() {
        return state.runId();
    }

    @Override
    public ActivityHandle scheduleActivity(String activityType, JsonNode input, ActivityOptions options) {
        WorkflowRegistry.validateTypeName("Activity", activityType);
        String activityId = String.valueOf(++activitySequence);

        ActivityInvocation recorded = state.invocation(activityId);
        if (recorded != null) {
            if (!recorded.activityType().equals(activityType)) {
                throw new NonDeterminismException(state.runId(), String.format(
                    "activity %s was recorded as %s but the workflow now schedules %s",
                    activityId, recorded.activityType(), activityType));
            }
            consumedActivities.add(activityId);
        } else {
            commands.add(new Command.ScheduleActivity(
                activityId, activityType, input == null ? null : input.deepCopy(), options));
        }
        return new ReplayActivityHandle(activityId, activityType);
    }

    @Override
    public void sleep(Duration duration) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            return;
        }
        String timerId = "timer-" + (++timerSequence);
        TimerState recorded = state.timers().get(timerId);
        if (recorded == null) {
            commands.add(new Command.StartTimer(timerId, duration));
            throw DecisionSuspended.INSTANCE;
        }
        if (recorded.delay() != null && recorded.delay().toMillis() != duration.toMillis()) {
            throw new NonDeterminismException(state.runId(), String.format(
                "timer %s was recorded with delay %s but the workflow now sleeps %s",
                timerId, recorded.delay(), duration));
        }
        consumedTimers.add(timerId);
        if (!recorded.fired()) {
            throw DecisionSuspended.INSTANCE;
        }
        if (recorded.fireAt().isAfter(logicalTime)) {
            logicalTime = recorded.fireAt();
        }
    }

    @Override
    public Instant currentTime() {
        return logicalTime;
    }

    @Override
    public boolean isCancelRequested() {
        return state.cancelRequested();
    }

    @Override
    public Random newRandom() {
        long seed = ((long) state.runId().hashCode() << 32) ^ (++randomSequence);
        return new Random(seed);
    }

    List<Command> commands() {
        return commands;
    }

    /**
     * Fail if history holds activities or timers that this execution never requested.
     * Only meaningful once the workflow code has run to completion.
     */
    void verifyHistoryConsumed() {
        for (ActivityInvocation invocation : state.invocations().values()) {
            if (!consumedActivities.contains(invocation.activityId())) {
                throw new NonDeterminismException(state.runId(), String.format(
                    "history records activity %s (%s) that the workflow no longer schedules",
                    invocation.activityId(), invocation.activityType()));
            }
        }
        for (String timerId : state.timers().keySet()) {
            if (!consumedTimers.contains(timerId)) {
                throw new NonDeterminismException(state.runId(),
                    "history records timer " + timerId + " that the workflow no longer starts");
            }
        }
    }

    private final class ReplayActivityHandle implements ActivityHandle {
        private final String activityId;
        private final String activityType;

        ReplayActivityHandle(String activityId, String activityType) {
            this.activityId = activityId;
            this.activityType = activityType;
        }

        @Override
        public String activityId() {
            return activityId;
        }

        @Override
        public boolean isDone() {
            ActivityInvocation invocation = state.invocation(activityId);
            return invocation != null && !invocation.isOutstanding();
        }

        @Override
        public JsonNode get() {
            ActivityInvocation invocation = state.invocation(activityId);
            if (invocation == null || invocation.isOutstanding()) {
                throw DecisionSuspended.INSTANCE;
            }
            return switch (invocation.status()) {
                case COMPLETED -> invocation.result() == null ? null : invocation.result().deepCopy();
                case FAILED -> throw new ActivityFailedException(activityId, activityType, invocation.failure());
                case SCHEDULED -> throw DecisionSuspended.INSTANCE;
            };
        }
    }
}
