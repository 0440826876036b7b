package com.durableflow.recovery;

import java.time.Duration;

/**
 * Sweep intervals and thresholds of the recovery engine.
 *
 * @param leaseCheckInterval how often lapsed task leases are reclaimed
 * @param runSweepInterval how often open runs are checked for timeouts and stalls
 * @param stallThreshold an open run without new events for this long gets a fresh decision task;
 *                       also the age after which a run reserved in the index but never started is closed
 * @param batchSize maximum tasks or runs handled per sweep
 */
public record RecoveryOptions(
    Duration leaseCheckInterval,
    Duration runSweepInterval,
    Duration stallThreshold,
    int batchSize
) {
    public RecoveryOptions {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1");
        }
    }

    public static RecoveryOptions defaults() {
        return new RecoveryOptions(Duration.ofSeconds(5), Duration.ofSeconds(10), Duration.ofMinutes(5), 100);
    }
}
