package com.durableflow.engine.coordinator;

import com.durableflow.core.exception.AlreadyExistsException;
import com.durableflow.core.exception.InvalidStateTransitionException;
import com.durableflow.core.exception.NotFoundException;
import com.durableflow.core.model.DurableTimer;
import com.durableflow.core.model.Event;
import com.durableflow.core.model.EventPayloads;
import com.durableflow.core.model.EventType;
import com.durableflow.core.model.RunRecord;
import com.durableflow.core.model.WorkflowIdReusePolicy;
import com.durableflow.core.model.WorkflowOptions;
import com.durableflow.core.model.WorkflowRunState;
import com.durableflow.core.model.WorkflowRunState.TimerState;
import com.durableflow.core.model.WorkflowStatus;
import com.durableflow.core.repository.RunIndexRepository;
import com.durableflow.core.workflow.WorkflowRegistry;
import com.durableflow.engine.logging.LoggingContext;
import com.durableflow.engine.metrics.WorkflowMetrics;
import com.durableflow.engine.service.WorkflowService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Control plane of the engine: starts runs, answers status queries and applies
 * operator actions (cancel, terminate) and timer firings as events.
 *
 * Holds no run state between calls; everything is re-read from the event log.
 */
public class WorkflowCoordinator implements WorkflowService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowCoordinator.class);

    private static final int MAX_START_ATTEMPTS = 5;

    private final WorkflowRegistry workflowRegistry;
    private final RunStore runStore;
    private final RunIndexRepository runIndex;
    private final WorkDispatcher dispatcher;
    private final WorkflowMetrics metrics;
    private final Clock clock;
    private final WorkflowIdReusePolicy defaultReusePolicy;
    private final Duration resultPollInterval;

    public WorkflowCoordinator(
            WorkflowRegistry workflowRegistry,
            RunStore runStore,
            RunIndexRepository runIndex,
            WorkDispatcher dispatcher,
            WorkflowMetrics metrics,
            Clock clock,
            WorkflowIdReusePolicy defaultReusePolicy,
            Duration resultPollInterval) {
        this.workflowRegistry = workflowRegistry;
        this.runStore = runStore;
        this.runIndex = runIndex;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
        this.clock = clock;
        this.defaultReusePolicy = defaultReusePolicy;
        this.resultPollInterval = resultPollInterval;
    }

    // ========== Submission ==========

    @Override
    public String startWorkflow(StartWorkflowRequest request) {
        WorkflowRegistry.Registration registration = workflowRegistry.get(request.workflowType());
        WorkflowOptions options = registration.options();
        String workflowId = request.workflowId() != null && !request.workflowId().isBlank()
            ? request.workflowId()
            : UUID.randomUUID().toString();
        WorkflowIdReusePolicy policy = request.idReusePolicy() != null ? request.idReusePolicy() : defaultReusePolicy;
        String runId = UUID.randomUUID().toString();

        try (var ctx = LoggingContext.forRun(workflowId, runId)) {
            RunRecord record = RunRecord.open(workflowId, runId, request.workflowType(), options.taskQueue(), clock.instant());
            reserve(record, policy);

            Event started = Event.create(runId, EventType.WORKFLOW_STARTED, clock.instant(),
                EventPayloads.workflowStarted(workflowId, request.workflowType(), request.input(),
                    options.taskQueue(), options.executionTimeout()),
                Event.ACTOR_USER, "workflow-service");
            runStore.append(runId, 0, List.of(started));

            dispatcher.enqueueDecision(options.taskQueue(), runId, workflowId);
            metrics.workflowStarted(request.workflowType());
            log.info("Started workflow {} of type {} (run {}, policy {})",
                workflowId, request.workflowType(), runId, policy);
            return runId;
        }
    }

    /**
     * Register the run in the index, applying the reuse policy against open runs.
     */
    private void reserve(RunRecord record, WorkflowIdReusePolicy policy) {
        if (policy == WorkflowIdReusePolicy.ALLOW_DUPLICATE) {
            runIndex.register(record, false);
            return;
        }
        for (int attempt = 1; attempt <= MAX_START_ATTEMPTS; attempt++) {
            Optional<RunRecord> blocking = runIndex.register(record, true);
            if (blocking.isEmpty()) {
                return;
            }
            RunRecord open = blocking.get();
            Optional<WorkflowRunState> openState = runStore.find(open.runId());
            if (openState.isPresent() && openState.get().isClosed()) {
                // Index lagging behind the log
                runIndex.markClosed(open.runId(), openState.get().status(), openState.get().closedAt());
                continue;
            }
            if (policy == WorkflowIdReusePolicy.REJECT_DUPLICATE) {
                throw new AlreadyExistsException(record.workflowId(), open.runId());
            }
            if (openState.isPresent()) {
                try {
                    terminateRun(open.runId(), "Superseded by a new run of " + record.workflowId());
                } catch (InvalidStateTransitionException e) {
                    log.debug("Run {} closed before it could be terminated", open.runId());
                }
            } else {
                runIndex.markClosed(open.runId(), WorkflowStatus.TERMINATED, clock.instant());
            }
        }
        throw new AlreadyExistsException(record.workflowId(),
            runIndex.findCurrent(record.workflowId()).map(RunRecord::runId).orElse(null));
    }

    // ========== Queries ==========

    @Override
    public WorkflowStatusView getStatus(String workflowId) {
        return view(currentRun(workflowId));
    }

    @Override
    public WorkflowStatusView describe(String runId) {
        RunRecord record = runIndex.findByRunId(runId)
            .orElseThrow(() -> new NotFoundException("WorkflowRun", runId));
        return view(record);
    }

    @Override
    public List<RunRecord> listRuns(String workflowId) {
        List<RunRecord> runs = runIndex.findByWorkflowId(workflowId);
        if (runs.isEmpty()) {
            throw new NotFoundException("Workflow", workflowId);
        }
        return runs;
    }

    @Override
    public WorkflowResult getResult(String workflowId, Duration timeout) {
        RunRecord record = currentRun(workflowId);
        long deadline = System.nanoTime() + Math.max(0, timeout.toNanos());
        while (true) {
            Optional<WorkflowRunState> state = runStore.find(record.runId());
            if (state.isPresent() && state.get().isClosed()) {
                WorkflowRunState run = state.get();
                return new WorkflowResult(workflowId, run.runId(), run.status(), run.output(), run.failure());
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                WorkflowStatus status = state.map(WorkflowRunState::status).orElse(WorkflowStatus.CREATED);
                return new WorkflowResult(workflowId, record.runId(), status, null, null);
            }
            try {
                Thread.sleep(Math.max(1, Math.min(resultPollInterval.toMillis(), remaining / 1_000_000)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                WorkflowStatus status = state.map(WorkflowRunState::status).orElse(WorkflowStatus.CREATED);
                return new WorkflowResult(workflowId, record.runId(), status, null, null);
            }
        }
    }

    // ========== Operator actions ==========

    @Override
    public void requestCancellation(String workflowId, String reason) {
        RunRecord record = currentRun(workflowId);
        try (var ctx = LoggingContext.forRun(workflowId, record.runId())) {
            RunStore.Update update = runStore.update(record.runId(), state -> {
                if (state.isClosed()) {
                    throw new InvalidStateTransitionException(state.runId(), state.status(), "CANCEL");
                }
                if (state.cancelRequested()) {
                    return List.of();
                }
                return List.of(Event.create(state.runId(), EventType.WORKFLOW_CANCEL_REQUESTED, clock.instant(),
                    EventPayloads.cancelRequested(reason), Event.ACTOR_USER, "workflow-service"));
            });
            if (!update.isNoop()) {
                dispatcher.enqueueDecision(update.after());
                log.info("Cancellation requested for run {}: {}", record.runId(), reason);
            }
        }
    }

    @Override
    public void terminate(String workflowId, String reason) {
        terminateRun(currentRun(workflowId).runId(), reason);
    }

    /**
     * Close a run as TERMINATED.
     *
     * @throws InvalidStateTransitionException if the run is already closed
     */
    public void terminateRun(String runId, String reason) {
        runStore.update(runId, state -> {
            if (state.isClosed()) {
                throw new InvalidStateTransitionException(state.runId(), state.status(), "TERMINATE");
            }
            return List.of(Event.create(state.runId(), EventType.WORKFLOW_TERMINATED, clock.instant(),
                EventPayloads.workflowTerminated(reason), Event.ACTOR_USER, "workflow-service"));
        });
        log.info("Terminated run {}: {}", runId, reason);
    }

    // ========== Timer and timeout callbacks ==========

    /**
     * Record a due timer as fired and wake the run up.
     *
     * @return true when the timer needs no further firing (recorded now, earlier, or moot
     *         because the run closed)
     */
    public boolean fireTimer(DurableTimer timer) {
        Optional<WorkflowRunState> run = runStore.find(timer.runId());
        if (run.isEmpty()) {
            log.warn("Timer {} refers to unknown run {}", timer.timerId(), timer.runId());
            return true;
        }
        RunStore.Update update = runStore.update(timer.runId(), state -> {
            TimerState recorded = state.timers().get(timer.timerId());
            if (state.isClosed() || recorded == null || recorded.fired()) {
                return List.of();
            }
            return List.of(Event.create(state.runId(), EventType.TIMER_FIRED, clock.instant(),
                EventPayloads.timerFired(timer.timerId()), Event.ACTOR_SCHEDULER, "timer-scheduler"));
        });
        if (!update.isNoop()) {
            metrics.timerFired();
            dispatcher.enqueueDecision(update.after());
            log.debug("Timer {} of run {} fired", timer.timerId(), timer.runId());
        }
        return true;
    }

    /**
     * Close a run as TIMED_OUT if it is past its execution timeout.
     *
     * @return true if the run was timed out by this call
     */
    public boolean timeOutRun(String runId) {
        Instant now = clock.instant();
        RunStore.Update update = runStore.update(runId, state -> {
            Instant deadline = state.executionDeadline();
            if (state.isClosed() || deadline == null || now.isBefore(deadline)) {
                return List.of();
            }
            return List.of(Event.create(state.runId(), EventType.WORKFLOW_TIMED_OUT, now,
                EventPayloads.workflowTimedOut(state.executionTimeout()), Event.ACTOR_RECOVERY, "recovery-engine"));
        });
        return !update.isNoop();
    }

    // ========== Helpers ==========

    private RunRecord currentRun(String workflowId) {
        return runIndex.findCurrent(workflowId)
            .orElseThrow(() -> new NotFoundException("Workflow", workflowId));
    }

    private WorkflowStatusView view(RunRecord record) {
        Optional<WorkflowRunState> state = runStore.find(record.runId());
        if (state.isEmpty()) {
            return new WorkflowStatusView(record.workflowId(), record.runId(), record.workflowType(),
                WorkflowStatus.CREATED, 0, 0, 0, false, null, null, record.createdAt(), null);
        }
        WorkflowRunState run = state.get();
        return new WorkflowStatusView(
            run.workflowId(),
            run.runId(),
            run.workflowType(),
            run.status(),
            run.version(),
            run.outstandingInvocations().size(),
            run.pendingTimers().size(),
            run.cancelRequested(),
            run.failure(),
            run.startedAt(),
            run.lastUpdatedAt(),
            run.closedAt()
        );
    }
}
