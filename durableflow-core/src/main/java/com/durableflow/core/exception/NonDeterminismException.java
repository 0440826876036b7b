package com.durableflow.core.exception;

/**
 * Thrown when replaying workflow code produces decisions that contradict the
 * recorded history. Fatal for the run; the history itself is left untouched.
 */
public class NonDeterminismException extends DurableFlowException {

    public static final String ERROR_CODE = "WORKFLOW_NONDETERMINISM_DETECTED";

    public NonDeterminismException(String runId, String detail) {
        super(ERROR_CODE, String.format(
            "Run %s diverged from its history: %s",
            runId, detail
        ));
    }
}
