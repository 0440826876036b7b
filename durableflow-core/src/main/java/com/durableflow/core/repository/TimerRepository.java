package com.durableflow.core.repository;

import com.durableflow.core.model.DurableTimer;

import java.time.Instant;
import java.util.List;

/**
 * Repository for durable timers.
 */
public interface TimerRepository {

    /**
     * Save a timer. Saving a (runId, timerId) that already exists does nothing.
     */
    void save(DurableTimer timer);

    /**
     * Unfired timers whose fire time has passed, earliest first.
     */
    List<DurableTimer> findDue(Instant now, int limit);

    void markFired(String runId, String timerId, Instant firedAt);

    /**
     * Drop all timers of a run (run closed).
     */
    void deleteByRun(String runId);

    int countPending();
}
