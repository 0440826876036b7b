package com.durableflow.examples.simple;

import java.util.Map;

/**
 * Input of the simple workflow.
 *
 * @param requestId caller's request id, echoed in the result
 * @param userId user the work is done for
 * @param parameters data to validate and process; must contain {@code required_field}
 * @param correlationId optional id for tracing across systems
 */
public record SimpleWorkflowInput(
    String requestId,
    String userId,
    Map<String, Object> parameters,
    String correlationId
) {
    public static SimpleWorkflowInput of(String requestId, String userId, Map<String, Object> parameters) {
        return new SimpleWorkflowInput(requestId, userId, parameters, null);
    }
}
