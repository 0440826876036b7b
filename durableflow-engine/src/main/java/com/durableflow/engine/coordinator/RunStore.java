package com.durableflow.engine.coordinator;

import com.durableflow.core.exception.ConcurrencyConflictException;
import com.durableflow.core.exception.NotFoundException;
import com.durableflow.core.model.Event;
import com.durableflow.core.model.WorkflowRunState;
import com.durableflow.core.model.WorkflowStatus;
import com.durableflow.core.replay.RunStateProjector;
import com.durableflow.core.repository.EventLog;
import com.durableflow.core.repository.RunIndexRepository;
import com.durableflow.core.repository.TimerRepository;
import com.durableflow.engine.metrics.WorkflowMetrics;
import com.durableflow.engine.support.InfrastructureRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Read-check-append access to run histories.
 *
 * Every write is an append at the version the caller read; a conflicting append is
 * retried from a fresh read by {@link #update}, or reported to the caller by {@link #append}.
 * Closing a run also closes its run-index entry and drops its timers.
 */
public class RunStore {

    private static final Logger log = LoggerFactory.getLogger(RunStore.class);

    static final int MAX_CONFLICT_RETRIES = 10;

    private final EventLog eventLog;
    private final RunIndexRepository runIndex;
    private final TimerRepository timerRepository;
    private final InfrastructureRetry infrastructureRetry;
    private final WorkflowMetrics metrics;

    public RunStore(
            EventLog eventLog,
            RunIndexRepository runIndex,
            TimerRepository timerRepository,
            InfrastructureRetry infrastructureRetry,
            WorkflowMetrics metrics) {
        this.eventLog = eventLog;
        this.runIndex = runIndex;
        this.timerRepository = timerRepository;
        this.infrastructureRetry = infrastructureRetry;
        this.metrics = metrics;
    }

    /**
     * Result of an update: the state it was based on, the events it appended (with their
     * sequence numbers) and the state after them.
     */
    public record Update(WorkflowRunState before, List<Event> appended, WorkflowRunState after) {
        public boolean isNoop() {
            return appended.isEmpty();
        }
    }

    /**
     * Full history of a run, empty if the run has no events.
     */
    public List<Event> history(String runId) {
        return infrastructureRetry.call("read history of " + runId, () -> eventLog.read(runId, 0).toList());
    }

    public Optional<WorkflowRunState> find(String runId) {
        List<Event> history = history(runId);
        return history.isEmpty() ? Optional.empty() : Optional.of(RunStateProjector.project(history));
    }

    public WorkflowRunState load(String runId) {
        return find(runId).orElseThrow(() -> new NotFoundException("WorkflowRun", runId));
    }

    /**
     * Append events at the version the caller based them on.
     *
     * @return The appended events, with sequence numbers
     * @throws ConcurrencyConflictException if the history moved since expectedVersion
     */
    public List<Event> append(String runId, long expectedVersion, List<Event> events) {
        infrastructureRetry.call("append to " + runId, () -> eventLog.append(runId, expectedVersion, events));
        List<Event> appended = new ArrayList<>(events.size());
        long sequence = expectedVersion;
        for (Event event : events) {
            appended.add(event.withSequenceNumber(++sequence));
        }
        return appended;
    }

    /**
     * Append the events returned by {@code decide} for the current state, re-reading and
     * re-deciding on conflict. {@code decide} may return no events, and may throw to abort.
     */
    public Update update(String runId, Function<WorkflowRunState, List<Event>> decide) {
        for (int attempt = 1; ; attempt++) {
            List<Event> history = history(runId);
            if (history.isEmpty()) {
                throw new NotFoundException("WorkflowRun", runId);
            }
            WorkflowRunState before = RunStateProjector.project(history);
            List<Event> events = decide.apply(before);
            if (events.isEmpty()) {
                return new Update(before, List.of(), before);
            }
            try {
                List<Event> appended = append(runId, before.version(), events);
                List<Event> full = new ArrayList<>(history);
                full.addAll(appended);
                WorkflowRunState after = RunStateProjector.project(full);
                afterAppend(before, after);
                return new Update(before, appended, after);
            } catch (ConcurrencyConflictException e) {
                if (attempt >= MAX_CONFLICT_RETRIES) {
                    throw e;
                }
                log.debug("Conflict updating run {} at version {}, re-reading", runId, e.getExpectedVersion());
            }
        }
    }

    /**
     * Bookkeeping after an append: when the run just closed, close its index entry,
     * drop its timers and record metrics.
     */
    void afterAppend(WorkflowRunState before, WorkflowRunState after) {
        if (before.isClosed() || !after.isClosed()) {
            return;
        }
        WorkflowStatus status = after.status();
        infrastructureRetry.run("close run index entry " + after.runId(),
            () -> runIndex.markClosed(after.runId(), status, after.closedAt()));
        infrastructureRetry.run("drop timers of " + after.runId(),
            () -> timerRepository.deleteByRun(after.runId()));
        Duration duration = after.startedAt() == null || after.closedAt() == null
            ? null
            : Duration.between(after.startedAt(), after.closedAt());
        metrics.workflowClosed(after.workflowType(), status, duration);
        log.info("Run {} of workflow {} closed as {}", after.runId(), after.workflowId(), status);
    }
}
