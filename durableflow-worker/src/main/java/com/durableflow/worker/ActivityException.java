package com.durableflow.worker;

/**
 * Exception thrown by activity handlers on failure.
 *
 * The error code becomes the failure category recorded in history; retry policies can
 * list categories they never retry. A non-retryable exception is terminal regardless of policy.
 */
public class ActivityException extends Exception {

    private final String errorCode;
    private final boolean retryable;

    public ActivityException(String errorCode, String message) {
        this(errorCode, message, true);
    }

    public ActivityException(String errorCode, String message, boolean retryable) {
        super(message);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Create a non-retryable exception (permanent failure).
     */
    public static ActivityException nonRetryable(String errorCode, String message) {
        return new ActivityException(errorCode, message, false);
    }

    /**
     * Create a retryable exception (transient failure).
     */
    public static ActivityException retryable(String errorCode, String message) {
        return new ActivityException(errorCode, message, true);
    }
}
