package com.durableflow.core.exception;

/**
 * Thrown when an append to a run's history carries a stale expected version.
 * Benign: the caller re-reads the history and decides again.
 */
public class ConcurrencyConflictException extends DurableFlowException {

    public static final String ERROR_CODE = "CONCURRENCY_CONFLICT";

    private final String runId;
    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrencyConflictException(String runId, long expectedVersion, long actualVersion) {
        super(ERROR_CODE, String.format(
            "Concurrent append on run %s: expected version %d, actual version %d",
            runId, expectedVersion, actualVersion
        ));
        this.runId = runId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getRunId() {
        return runId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
