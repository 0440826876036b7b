package com.durableflow.core.model;

import java.time.Duration;
import java.util.Set;

/**
 * Retry behaviour of one activity invocation.
 * Resolved when the invocation is scheduled and recorded in its history, so later
 * registration changes never affect a running invocation.
 *
 * Invariants:
 * - maxAttempts >= 0 (0 = unlimited, bounded only by schedule-to-close)
 * - initialBackoff > 0
 * - maxBackoff >= initialBackoff
 * - backoffMultiplier >= 1.0
 */
public record RetryPolicy(
    Duration initialBackoff,
    double backoffMultiplier,
    Duration maxBackoff,
    int maxAttempts,
    Set<String> nonRetryableCategories
) {
    public RetryPolicy {
        if (initialBackoff == null || initialBackoff.isNegative() || initialBackoff.isZero()) {
            throw new IllegalArgumentException("initialBackoff must be positive");
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0");
        }
        nonRetryableCategories = nonRetryableCategories == null ? Set.of() : Set.copyOf(nonRetryableCategories);
    }

    /**
     * Default retry policy: unlimited attempts, 1s initial backoff doubling up to 100s.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(100), 0, Set.of());
    }

    /**
     * Single attempt only.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(Duration.ofSeconds(1), 1.0, Duration.ofSeconds(1), 1, Set.of());
    }

    /**
     * Delay before the attempt following {@code attempt}:
     * {@code min(initial * multiplier^(attempt-1), maxBackoff)}.
     *
     * @param attempt 1-indexed number of the attempt that just failed
     */
    public Duration nextBackoff(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("Attempt number must be >= 1");
        }
        double backoffMs = initialBackoff.toMillis() * Math.pow(backoffMultiplier, attempt - 1);
        double cappedMs = Math.min(backoffMs, maxBackoff.toMillis());
        return Duration.ofMillis((long) cappedMs);
    }

    /**
     * Decide whether a failed attempt may be followed by another one.
     *
     * @param attempt 1-indexed number of the attempt that failed
     * @param failureCategory category reported by the failure
     */
    public boolean shouldRetry(int attempt, String failureCategory) {
        if (failureCategory != null && nonRetryableCategories.contains(failureCategory)) {
            return false;
        }
        return hasMoreAttempts(attempt);
    }

    public boolean hasMoreAttempts(int attempt) {
        return maxAttempts == 0 || attempt < maxAttempts;
    }

    public boolean isUnlimited() {
        return maxAttempts == 0;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration initialBackoff = Duration.ofSeconds(1);
        private double backoffMultiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(100);
        private int maxAttempts = 0;
        private Set<String> nonRetryableCategories = Set.of();

        public Builder initialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder maxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder nonRetryableCategories(Set<String> nonRetryableCategories) {
            this.nonRetryableCategories = nonRetryableCategories;
            return this;
        }

        public Builder nonRetryableCategories(String... categories) {
            this.nonRetryableCategories = Set.of(categories);
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(initialBackoff, backoffMultiplier, maxBackoff, maxAttempts, nonRetryableCategories);
        }
    }
}
