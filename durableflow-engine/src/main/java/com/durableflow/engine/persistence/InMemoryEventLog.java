package com.durableflow.engine.persistence;

import com.durableflow.core.exception.ConcurrencyConflictException;
import com.durableflow.core.model.Event;
import com.durableflow.core.repository.EventLog;
import com.durableflow.core.repository.EventSequence;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of EventLog.
 * For demonstration and testing purposes; appends are serialized per run.
 */
public class InMemoryEventLog implements EventLog {

    static final int PAGE_SIZE = 100;

    private final Map<String, List<Event>> histories = new ConcurrentHashMap<>();

    @Override
    public long append(String runId, long expectedVersion, List<Event> events) {
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("Cannot append an empty batch to run " + runId);
        }
        // Only an append expecting an empty history may create one.
        List<Event> history = expectedVersion == 0
            ? histories.computeIfAbsent(runId, k -> new ArrayList<>())
            : histories.get(runId);
        if (history == null) {
            throw new ConcurrencyConflictException(runId, expectedVersion, 0);
        }
        synchronized (history) {
            if (history.size() != expectedVersion) {
                throw new ConcurrencyConflictException(runId, expectedVersion, history.size());
            }
            long sequence = expectedVersion;
            for (Event event : events) {
                history.add(event.withSequenceNumber(++sequence));
            }
            return sequence;
        }
    }

    @Override
    public EventSequence read(String runId, long fromVersion) {
        return new EventSequence(fromVersion, after -> page(runId, after));
    }

    @Override
    public long currentVersion(String runId) {
        List<Event> history = histories.get(runId);
        if (history == null) {
            return 0;
        }
        synchronized (history) {
            return history.size();
        }
    }

    public Set<String> runIds() {
        return Set.copyOf(histories.keySet());
    }

    private List<Event> page(String runId, long after) {
        List<Event> history = histories.get(runId);
        if (history == null) {
            return List.of();
        }
        synchronized (history) {
            int from = (int) Math.max(after, 0);
            if (from >= history.size()) {
                return List.of();
            }
            return List.copyOf(history.subList(from, Math.min(from + PAGE_SIZE, history.size())));
        }
    }
}
