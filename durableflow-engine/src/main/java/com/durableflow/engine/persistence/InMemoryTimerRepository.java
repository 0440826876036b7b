package com.durableflow.engine.persistence;

import com.durableflow.core.model.DurableTimer;
import com.durableflow.core.repository.TimerRepository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of TimerRepository.
 * For demonstration and testing purposes.
 */
public class InMemoryTimerRepository implements TimerRepository {

    private final Map<String, DurableTimer> timers = new ConcurrentHashMap<>();

    @Override
    public void save(DurableTimer timer) {
        timers.putIfAbsent(key(timer.runId(), timer.timerId()), timer);
    }

    @Override
    public List<DurableTimer> findDue(Instant now, int limit) {
        return timers.values().stream()
            .filter(t -> t.isDue(now))
            .sorted(Comparator.comparing(DurableTimer::fireAt))
            .limit(limit)
            .toList();
    }

    @Override
    public void markFired(String runId, String timerId, Instant firedAt) {
        timers.computeIfPresent(key(runId, timerId), (k, timer) -> timer.isFired()
            ? timer
            : new DurableTimer(timer.runId(), timer.timerId(), timer.fireAt(), timer.createdAt(), firedAt));
    }

    @Override
    public void deleteByRun(String runId) {
        timers.values().removeIf(t -> t.runId().equals(runId));
    }

    @Override
    public int countPending() {
        return (int) timers.values().stream().filter(t -> !t.isFired()).count();
    }

    private static String key(String runId, String timerId) {
        return runId + "/" + timerId;
    }
}
