package com.durableflow.examples.simple;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Output of the simple workflow. Business failures are reported here rather than failing the run.
 */
public record SimpleWorkflowResult(boolean success, JsonNode resultData, String errorMessage) {

    public static SimpleWorkflowResult succeeded(JsonNode resultData) {
        return new SimpleWorkflowResult(true, resultData, null);
    }

    public static SimpleWorkflowResult failed(String errorMessage) {
        return new SimpleWorkflowResult(false, null, errorMessage);
    }
}
