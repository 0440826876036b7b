package com.durableflow.engine.support;

import com.durableflow.core.exception.DurableFlowException;
import com.durableflow.core.model.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Retries engine-internal calls against storage (event log, queue, index) that fail for
 * infrastructure reasons. Domain errors ({@link DurableFlowException}) are never retried
 * here; they carry a decision the caller must make.
 */
public class InfrastructureRetry {

    private static final Logger log = LoggerFactory.getLogger(InfrastructureRetry.class);

    private final RetryPolicy policy;

    public InfrastructureRetry(RetryPolicy policy) {
        if (policy.isUnlimited()) {
            throw new IllegalArgumentException("Infrastructure retries need a bounded maxAttempts");
        }
        this.policy = policy;
    }

    public static InfrastructureRetry defaults() {
        return new InfrastructureRetry(RetryPolicy.builder()
            .initialBackoff(Duration.ofMillis(50))
            .backoffMultiplier(2.0)
            .maxBackoff(Duration.ofSeconds(2))
            .maxAttempts(5)
            .build());
    }

    /**
     * Run an operation, retrying infrastructure failures with backoff.
     *
     * @param operation Name used in logs
     * @return The operation's result
     * @throws RuntimeException the last failure once attempts are exhausted
     */
    public <T> T call(String operation, Supplier<T> action) {
        int attempt = 1;
        while (true) {
            try {
                return action.get();
            } catch (DurableFlowException e) {
                throw e;
            } catch (RuntimeException e) {
                if (!policy.hasMoreAttempts(attempt)) {
                    log.error("{} failed after {} attempts: {}", operation, attempt, e.getMessage());
                    throw e;
                }
                Duration backoff = policy.nextBackoff(attempt);
                log.warn("{} failed (attempt {}), retrying in {}ms: {}",
                    operation, attempt, backoff.toMillis(), e.getMessage());
                pause(backoff, e);
                attempt++;
            }
        }
    }

    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    private static void pause(Duration backoff, RuntimeException cause) {
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw cause;
        }
    }
}
