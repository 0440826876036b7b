package com.durableflow.scheduler;

import com.durableflow.core.model.DurableTimer;
import com.durableflow.core.repository.TimerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Fires durable timers when they come due.
 *
 * Responsibilities:
 * - Poll the timer store for due timers
 * - Hand each one to the callback, which records it in the run's history
 * - Mark timers fired once the callback has recorded them
 *
 * A timer whose callback fails stays due and is retried on the next poll. Firing is
 * at-least-once; the callback deduplicates against history.
 */
public class TimerScheduler {

    private static final Logger log = LoggerFactory.getLogger(TimerScheduler.class);

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);
    public static final int DEFAULT_BATCH_SIZE = 100;

    private final TimerRepository timerRepository;
    private final TimerCallback callback;
    private final Clock clock;
    private final Duration pollInterval;
    private final int batchSize;

    private final ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public TimerScheduler(TimerRepository timerRepository, TimerCallback callback, Clock clock) {
        this(timerRepository, callback, clock, DEFAULT_POLL_INTERVAL, DEFAULT_BATCH_SIZE);
    }

    public TimerScheduler(
            TimerRepository timerRepository,
            TimerCallback callback,
            Clock clock,
            Duration pollInterval,
            int batchSize) {
        this.timerRepository = timerRepository;
        this.callback = callback;
        this.clock = clock;
        this.pollInterval = pollInterval;
        this.batchSize = batchSize;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "timer-scheduler");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Start the scheduler.
     */
    public void start() {
        if (running) {
            log.warn("Timer scheduler already running");
            return;
        }

        running = true;
        log.info("Starting timer scheduler (poll interval {}ms)", pollInterval.toMillis());

        scheduler.scheduleWithFixedDelay(
            this::pollTimers,
            pollInterval.toMillis(),
            pollInterval.toMillis(),
            TimeUnit.MILLISECONDS
        );
    }

    /**
     * Stop the scheduler.
     */
    public void stop() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Timer scheduler stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Fire every timer due now, up to one batch.
     *
     * @return Number of timers fired
     */
    public int pollOnce() {
        Instant now = clock.instant();
        List<DurableTimer> dueTimers = timerRepository.findDue(now, batchSize);
        int fired = 0;
        for (DurableTimer timer : dueTimers) {
            try {
                if (fireTimer(timer, now)) {
                    fired++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to fire timer {} of run {}, will retry", timer.timerId(), timer.runId(), e);
            }
        }
        return fired;
    }

    private void pollTimers() {
        if (!running) {
            return;
        }
        try {
            pollOnce();
        } catch (RuntimeException e) {
            log.error("Error polling timers", e);
        }
    }

    private boolean fireTimer(DurableTimer timer, Instant now) {
        log.debug("Firing timer {} of run {} (due {})", timer.timerId(), timer.runId(), timer.fireAt());
        if (!callback.fire(timer)) {
            return false;
        }
        timerRepository.markFired(timer.runId(), timer.timerId(), now);
        return true;
    }

    /**
     * Records a due timer in its run's history.
     */
    @FunctionalInterface
    public interface TimerCallback {

        /**
         * @return true when the timer is settled and must not be offered again
         */
        boolean fire(DurableTimer timer);
    }
}
