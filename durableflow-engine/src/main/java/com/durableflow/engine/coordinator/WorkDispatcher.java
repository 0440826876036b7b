package com.durableflow.engine.coordinator;

import com.durableflow.core.model.ActivityInvocation;
import com.durableflow.core.model.DurableTimer;
import com.durableflow.core.model.Task;
import com.durableflow.core.model.WorkflowRunState;
import com.durableflow.core.model.WorkflowRunState.TimerState;
import com.durableflow.core.repository.TaskQueue;
import com.durableflow.core.repository.TimerRepository;
import com.durableflow.engine.support.InfrastructureRetry;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;

/**
 * Turns recorded history into queue entries and timers.
 *
 * Every method is idempotent: task ids and timer keys are derived from the run, so
 * re-dispatching work that is already queued changes nothing.
 */
public class WorkDispatcher {

    private static final Logger log = LoggerFactory.getLogger(WorkDispatcher.class);

    private final TaskQueue taskQueue;
    private final TimerRepository timerRepository;
    private final InfrastructureRetry infrastructureRetry;
    private final Clock clock;

    public WorkDispatcher(
            TaskQueue taskQueue,
            TimerRepository timerRepository,
            InfrastructureRetry infrastructureRetry,
            Clock clock) {
        this.taskQueue = taskQueue;
        this.timerRepository = timerRepository;
        this.infrastructureRetry = infrastructureRetry;
        this.clock = clock;
    }

    /**
     * Wake the run's workflow code up for another decision.
     */
    public void enqueueDecision(WorkflowRunState run) {
        enqueueDecision(run.taskQueue(), run.runId(), run.workflowId());
    }

    public void enqueueDecision(String queueName, String runId, String workflowId) {
        Task task = Task.decision(queueName, runId, workflowId, clock.instant());
        infrastructureRetry.run("enqueue " + task.taskId(), () -> taskQueue.enqueue(task));
    }

    /**
     * Queue the current attempt of an invocation, hidden until its notBefore.
     */
    public void enqueueActivity(WorkflowRunState run, ActivityInvocation invocation) {
        Instant now = clock.instant();
        String queueName = invocation.options().taskQueue() != null
            ? invocation.options().taskQueue()
            : run.taskQueue();
        Instant visibleAt = invocation.notBefore() != null && invocation.notBefore().isAfter(now)
            ? invocation.notBefore()
            : now;

        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("activityType", invocation.activityType());
        payload.put("idempotencyKey", invocation.idempotencyKey(run.runId()));

        Task task = Task.activity(queueName, run.runId(), run.workflowId(), invocation.activityId(),
            invocation.attempt(), payload, now, visibleAt);
        infrastructureRetry.run("enqueue " + task.taskId(), () -> taskQueue.enqueue(task));
        log.debug("Dispatched activity {} ({}) attempt {} to {}, visible at {}",
            invocation.activityId(), invocation.activityType(), invocation.attempt(), queueName, visibleAt);
    }

    public void scheduleTimer(WorkflowRunState run, TimerState timer) {
        DurableTimer durableTimer = DurableTimer.create(run.runId(), timer.timerId(), timer.fireAt(), clock.instant());
        infrastructureRetry.run("save timer " + timer.timerId(), () -> timerRepository.save(durableTimer));
    }

    /**
     * Make sure every outstanding invocation has a queued task and every pending timer is
     * stored. Repairs work lost between an append and its dispatch.
     */
    public void ensureOutstandingWork(WorkflowRunState run) {
        if (run.isClosed()) {
            return;
        }
        for (ActivityInvocation invocation : run.outstandingInvocations()) {
            enqueueActivity(run, invocation);
        }
        for (TimerState timer : run.pendingTimers()) {
            scheduleTimer(run, timer);
        }
    }
}
