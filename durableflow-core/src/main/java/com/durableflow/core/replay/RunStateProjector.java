package com.durableflow.core.replay;

import com.durableflow.core.exception.InvalidStateTransitionException;
import com.durableflow.core.model.ActivityInvocation;
import com.durableflow.core.model.Event;
import com.durableflow.core.model.EventPayloads;
import com.durableflow.core.model.EventType;
import com.durableflow.core.model.FailureDetail;
import com.durableflow.core.model.InvocationStatus;
import com.durableflow.core.model.WorkflowRunState;
import com.durableflow.core.model.WorkflowRunState.TimerState;
import com.durableflow.core.model.WorkflowStatus;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Folds a run's history into a {@link WorkflowRunState}.
 *
 * Rejects malformed histories: a first event other than WORKFLOW_STARTED, gaps in
 * sequence numbers, outcomes for attempts that are not outstanding, and events
 * after the run closed.
 */
public final class RunStateProjector {

    private RunStateProjector() {
    }

    public static WorkflowRunState project(Iterable<Event> history) {
        Fold fold = new Fold();
        for (Event event : history) {
            fold.apply(event);
        }
        if (fold.version == 0) {
            throw new IllegalArgumentException("History is empty");
        }
        return fold.toState();
    }

    private static final class Fold {
        private String workflowId;
        private String runId;
        private String workflowType;
        private JsonNode input;
        private String taskQueue;
        private Duration executionTimeout;
        private WorkflowStatus status = WorkflowStatus.CREATED;
        private long version;
        private final Map<String, ActivityInvocation> invocations = new LinkedHashMap<>();
        private final Map<String, TimerState> timers = new LinkedHashMap<>();
        private boolean cancelRequested;
        private String cancelReason;
        private JsonNode output;
        private FailureDetail failure;
        private Instant startedAt;
        private Instant lastUpdatedAt;
        private Instant closedAt;

        void apply(Event event) {
            if (event.sequenceNumber() != version + 1) {
                throw new IllegalStateException(String.format(
                    "History of run %s is not contiguous: expected sequence %d, found %d",
                    event.runId(), version + 1, event.sequenceNumber()));
            }
            if (version == 0 && event.type() != EventType.WORKFLOW_STARTED) {
                throw new IllegalStateException("History of run " + event.runId()
                    + " does not begin with WORKFLOW_STARTED");
            }
            if (status.isTerminal()) {
                throw new InvalidStateTransitionException(runId, status, "apply " + event.type());
            }

            JsonNode payload = event.payload();
            switch (event.type()) {
                case WORKFLOW_STARTED -> {
                    if (version != 0) {
                        throw new IllegalStateException("Duplicate WORKFLOW_STARTED in run " + event.runId());
                    }
                    runId = event.runId();
                    workflowId = EventPayloads.text(payload, "workflowId");
                    workflowType = EventPayloads.text(payload, "workflowType");
                    input = EventPayloads.node(payload, "input");
                    taskQueue = EventPayloads.text(payload, "taskQueue");
                    executionTimeout = EventPayloads.duration(payload, "executionTimeoutMs");
                    startedAt = event.timestamp();
                    status = WorkflowStatus.RUNNING;
                }
                case ACTIVITY_SCHEDULED -> applyScheduled(event, payload);
                case ACTIVITY_COMPLETED -> {
                    ActivityInvocation invocation = outstanding(event, payload);
                    invocations.put(invocation.activityId(),
                        invocation.withCompleted(EventPayloads.node(payload, "result"), event.timestamp()));
                }
                case ACTIVITY_FAILED -> {
                    ActivityInvocation invocation = outstanding(event, payload);
                    invocations.put(invocation.activityId(),
                        invocation.withFailed(EventPayloads.readFailure(payload.get("failure")), event.timestamp()));
                }
                case TIMER_STARTED -> {
                    String timerId = EventPayloads.text(payload, "timerId");
                    timers.put(timerId, new TimerState(timerId,
                        EventPayloads.duration(payload, "delayMs"),
                        EventPayloads.instant(payload, "fireAt"),
                        false));
                }
                case TIMER_FIRED -> {
                    String timerId = EventPayloads.text(payload, "timerId");
                    TimerState timer = timers.get(timerId);
                    if (timer == null || timer.fired()) {
                        throw new IllegalStateException("TIMER_FIRED for unknown or fired timer " + timerId);
                    }
                    timers.put(timerId, new TimerState(timerId, timer.delay(), timer.fireAt(), true));
                }
                case WORKFLOW_CANCEL_REQUESTED -> {
                    cancelRequested = true;
                    cancelReason = EventPayloads.text(payload, "reason");
                }
                case WORKFLOW_COMPLETED -> {
                    output = EventPayloads.node(payload, "output");
                    close(event);
                }
                case WORKFLOW_FAILED -> {
                    failure = EventPayloads.readFailure(payload.get("failure"));
                    close(event);
                }
                case WORKFLOW_TERMINATED -> {
                    failure = FailureDetail.of(FailureDetail.TERMINATED, EventPayloads.text(payload, "reason"));
                    close(event);
                }
                case WORKFLOW_TIMED_OUT -> {
                    failure = FailureDetail.of(FailureDetail.TIMED_OUT, "Run exceeded its execution timeout");
                    close(event);
                }
            }
            version = event.sequenceNumber();
            lastUpdatedAt = event.timestamp();
        }

        private void applyScheduled(Event event, JsonNode payload) {
            String activityId = EventPayloads.text(payload, "activityId");
            int attempt = EventPayloads.integer(payload, "attempt");
            Instant notBefore = EventPayloads.instant(payload, "notBefore");
            ActivityInvocation existing = invocations.get(activityId);
            if (existing == null) {
                if (attempt != 1) {
                    throw new IllegalStateException("First ACTIVITY_SCHEDULED of " + activityId
                        + " has attempt " + attempt);
                }
                invocations.put(activityId, new ActivityInvocation(
                    activityId,
                    EventPayloads.text(payload, "activityType"),
                    EventPayloads.node(payload, "input"),
                    1,
                    EventPayloads.readActivityOptions(payload.get("options")),
                    EventPayloads.instant(payload, "firstScheduledAt"),
                    event.timestamp(),
                    notBefore,
                    null,
                    InvocationStatus.SCHEDULED,
                    null,
                    null,
                    null
                ));
                return;
            }
            if (!existing.isOutstanding() || attempt != existing.attempt() + 1) {
                throw new IllegalStateException(String.format(
                    "ACTIVITY_SCHEDULED attempt %d of %s does not follow attempt %d (%s)",
                    attempt, activityId, existing.attempt(), existing.status()));
            }
            invocations.put(activityId, existing.withNextAttempt(attempt, event.timestamp(), notBefore,
                EventPayloads.readFailure(payload.get("previousFailure"))));
        }

        private ActivityInvocation outstanding(Event event, JsonNode payload) {
            String activityId = EventPayloads.text(payload, "activityId");
            int attempt = EventPayloads.integer(payload, "attempt");
            ActivityInvocation invocation = invocations.get(activityId);
            if (invocation == null || !invocation.isOutstanding() || invocation.attempt() != attempt) {
                throw new IllegalStateException(String.format(
                    "%s for activity %s attempt %d has no outstanding attempt",
                    event.type(), activityId, attempt));
            }
            return invocation;
        }

        private void close(Event event) {
            status = event.type().closingStatus();
            closedAt = event.timestamp();
        }

        WorkflowRunState toState() {
            return new WorkflowRunState(
                workflowId,
                runId,
                workflowType,
                input,
                taskQueue,
                executionTimeout,
                status,
                version,
                Collections.unmodifiableMap(new LinkedHashMap<>(invocations)),
                Collections.unmodifiableMap(new LinkedHashMap<>(timers)),
                cancelRequested,
                cancelReason,
                output,
                failure,
                startedAt,
                lastUpdatedAt,
                closedAt
            );
        }
    }
}
