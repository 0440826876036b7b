package com.durableflow.scheduler;

import com.durableflow.core.model.DurableTimer;
import com.durableflow.core.repository.TimerRepository;
import com.durableflow.core.test.FailureInjector;
import com.durableflow.core.test.TimeController;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class TimerSchedulerTest {

    private TimeController time;
    private MapTimerRepository timers;
    private List<String> fired;
    private FailureInjector failures;
    private TimerScheduler scheduler;

    @BeforeEach
    void setUp() {
        time = new TimeController(Instant.parse("2024-01-15T10:00:00Z"));
        timers = new MapTimerRepository();
        fired = new CopyOnWriteArrayList<>();
        failures = new FailureInjector();
        scheduler = new TimerScheduler(timers, timer -> {
            failures.maybeFail(timer.timerId());
            fired.add(timer.runId() + "/" + timer.timerId());
            return true;
        }, time, Duration.ofMillis(10), 10);
    }

    private void schedule(String runId, String timerId, Duration delay) {
        timers.save(DurableTimer.create(runId, timerId, time.now().plus(delay), time.now()));
    }

    @Test
    @DisplayName("Only due timers are fired, and each once")
    void testFiresDueTimers() {
        schedule("run-1", "timer-1", Duration.ofMinutes(1));
        schedule("run-2", "timer-1", Duration.ofMinutes(5));

        assertThat(scheduler.pollOnce()).isZero();

        time.advance(Duration.ofMinutes(1));
        assertThat(scheduler.pollOnce()).isEqualTo(1);
        assertThat(scheduler.pollOnce()).isZero();

        assertThat(fired).containsExactly("run-1/timer-1");
        assertThat(timers.countPending()).isEqualTo(1);
    }

    @Test
    @DisplayName("A failing callback leaves the timer due for the next poll")
    void testRetriesFailedCallback() {
        schedule("run-1", "timer-1", Duration.ZERO);
        failures.failTimes("timer-1", 1, () -> new IllegalStateException("event log unavailable"));

        assertThat(scheduler.pollOnce()).isZero();
        assertThat(timers.countPending()).isEqualTo(1);

        assertThat(scheduler.pollOnce()).isEqualTo(1);
        assertThat(fired).containsExactly("run-1/timer-1");
    }

    @Test
    @DisplayName("Callback declining a timer keeps it pending")
    void testDeclinedTimerStaysPending() {
        schedule("run-1", "timer-1", Duration.ZERO);
        TimerScheduler declining = new TimerScheduler(timers, timer -> false, time);

        assertThat(declining.pollOnce()).isZero();
        assertThat(timers.countPending()).isEqualTo(1);
    }

    @Test
    @DisplayName("Started scheduler polls in the background until stopped")
    void testBackgroundPolling() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        TimerScheduler background = new TimerScheduler(timers, timer -> {
            latch.countDown();
            return true;
        }, time, Duration.ofMillis(10), 10);
        schedule("run-1", "timer-1", Duration.ZERO);

        background.start();
        try {
            assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(background.isRunning()).isTrue();
        } finally {
            background.stop();
        }
        assertThat(background.isRunning()).isFalse();
    }

    /**
     * Minimal timer store keyed by run and timer id.
     */
    private static class MapTimerRepository implements TimerRepository {
        private final Map<String, DurableTimer> timers = new ConcurrentHashMap<>();

        @Override
        public void save(DurableTimer timer) {
            timers.putIfAbsent(timer.runId() + "/" + timer.timerId(), timer);
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
            timers.computeIfPresent(runId + "/" + timerId,
                (k, t) -> new DurableTimer(t.runId(), t.timerId(), t.fireAt(), t.createdAt(), firedAt));
        }

        @Override
        public void deleteByRun(String runId) {
            timers.keySet().removeIf(k -> k.startsWith(runId + "/"));
        }

        @Override
        public int countPending() {
            return (int) timers.values().stream().filter(t -> !t.isFired()).count();
        }
    }
}
