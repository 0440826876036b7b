package com.durableflow.core.exception;

/**
 * Thrown when a workflow id already has an open run and duplicates are rejected.
 */
public class AlreadyExistsException extends DurableFlowException {

    public static final String ERROR_CODE = "ALREADY_EXISTS";

    public AlreadyExistsException(String workflowId, String openRunId) {
        super(ERROR_CODE, String.format(
            "Workflow %s already has an open run: %s",
            workflowId, openRunId
        ));
    }
}
