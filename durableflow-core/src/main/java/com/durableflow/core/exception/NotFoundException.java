package com.durableflow.core.exception;

/**
 * Thrown when a workflow, run or registration is not found.
 */
public class NotFoundException extends DurableFlowException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
