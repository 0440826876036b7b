package com.durableflow.core.exception;

/**
 * Base exception for all engine errors.
 */
public class DurableFlowException extends RuntimeException {

    private final String errorCode;

    public DurableFlowException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public DurableFlowException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
