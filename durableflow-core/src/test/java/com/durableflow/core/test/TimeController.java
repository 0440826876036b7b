package com.durableflow.core.test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Controllable clock for testing time-dependent behavior.
 * Hand it to any component that takes a {@link Clock}, then move time explicitly.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * TimeController time = new TimeController();
 * TaskQueue queue = new InMemoryTaskQueue(time);
 *
 * queue.dequeue("q", Duration.ofSeconds(30), "worker-1");
 * time.advance(Duration.ofSeconds(31));
 * // lease has lapsed
 * }</pre>
 */
public class TimeController extends Clock {

    private final AtomicReference<Instant> currentTime;

    /**
     * Create a time controller starting at the current time.
     */
    public TimeController() {
        this(Instant.now());
    }

    /**
     * Create a time controller starting at a specific time.
     */
    public TimeController(Instant startTime) {
        this.currentTime = new AtomicReference<>(startTime);
    }

    @Override
    public Instant instant() {
        return currentTime.get();
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }

    public Instant now() {
        return currentTime.get();
    }

    /**
     * Advance time by a duration.
     */
    public void advance(Duration duration) {
        currentTime.updateAndGet(t -> t.plus(duration));
    }

    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }

    public void advanceSeconds(long seconds) {
        advance(Duration.ofSeconds(seconds));
    }

    public void advanceMinutes(long minutes) {
        advance(Duration.ofMinutes(minutes));
    }

    /**
     * Set time to a specific instant.
     */
    public void setTime(Instant newTime) {
        currentTime.set(newTime);
    }

    /**
     * Get the duration since an instant.
     */
    public Duration durationSince(Instant since) {
        return Duration.between(since, now());
    }

    /**
     * Create a frozen time controller at a specific time.
     */
    public static TimeController frozenAt(Instant time) {
        return new TimeController(time);
    }
}
