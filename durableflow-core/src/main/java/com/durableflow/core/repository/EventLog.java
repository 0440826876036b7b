package com.durableflow.core.repository;

import com.durableflow.core.model.Event;
import java.util.List;

/**
 * Append-only, per-run ordered history of events. The single source of truth for run state.
 *
 * Layout: entries keyed by (runId, sequenceNumber).
 *
 * Durability contract: once {@link #append} returns, the events are visible to every
 * subsequent {@link #read}. Events are never deleted or reordered.
 */
public interface EventLog {

    /**
     * Append events to a run's history.
     *
     * @param runId The run
     * @param expectedVersion History length the caller based its decision on (0 for a new run)
     * @param events Events to append, in order; sequence numbers are assigned by the log
     * @return The new version (history length) of the run
     * @throws com.durableflow.core.exception.ConcurrencyConflictException if expectedVersion
     *         does not match the current length; nothing is written in that case
     */
    long append(String runId, long expectedVersion, List<Event> events);

    /**
     * Read a run's events with sequence number greater than fromVersion.
     * The returned sequence is lazy and finite; each iteration restarts the read.
     */
    EventSequence read(String runId, long fromVersion);

    /**
     * Current history length of a run, 0 if the run has no events.
     */
    long currentVersion(String runId);
}
