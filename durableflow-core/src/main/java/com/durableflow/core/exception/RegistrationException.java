package com.durableflow.core.exception;

/**
 * Thrown when a workflow or activity type cannot be registered.
 */
public class RegistrationException extends DurableFlowException {

    public static final String ERROR_CODE = "INVALID_REGISTRATION";

    public RegistrationException(String message) {
        super(ERROR_CODE, message);
    }
}
