package com.durableflow.core.exception;

import com.durableflow.core.model.WorkflowStatus;

/**
 * Thrown when an event or operation is not allowed in the run's current status.
 */
public class InvalidStateTransitionException extends DurableFlowException {

    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";

    public InvalidStateTransitionException(String runId, WorkflowStatus from, String attempted) {
        super(ERROR_CODE, String.format(
            "Run %s is %s, cannot %s",
            runId, from, attempted
        ));
    }
}
