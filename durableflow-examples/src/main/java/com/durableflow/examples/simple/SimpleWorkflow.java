package com.durableflow.examples.simple;

import com.durableflow.core.workflow.ActivityFailedException;
import com.durableflow.core.workflow.Workflow;
import com.durableflow.core.workflow.WorkflowContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Simple three-step workflow.
 *
 * Workflow Steps:
 * 1. validate_input - Check the parameters carry the required field
 * 2. process_data - Transform the parameters
 * 3. store_data - Persist the processed data
 *
 * Invalid input and failed activities end the run as COMPLETED with {@code success = false};
 * the run itself only fails on engine-level errors.
 */
public class SimpleWorkflow implements Workflow {

    private static final Logger log = LoggerFactory.getLogger(SimpleWorkflow.class);
    private static final ObjectMapper mapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static final String WORKFLOW_TYPE = "simple-workflow";

    // Activity types
    public static final String ACTIVITY_VALIDATE_INPUT = "validate_input";
    public static final String ACTIVITY_PROCESS_DATA = "process_data";
    public static final String ACTIVITY_STORE_DATA = "store_data";

    // Start-to-close timeouts the activities are registered with
    public static final Duration VALIDATE_TIMEOUT = Duration.ofMinutes(2);
    public static final Duration PROCESS_TIMEOUT = Duration.ofMinutes(5);
    public static final Duration STORE_TIMEOUT = Duration.ofMinutes(3);

    @Override
    public JsonNode run(WorkflowContext context, JsonNode input) {
        if (input == null || !input.isObject()) {
            return mapper.valueToTree(SimpleWorkflowResult.failed("Workflow input must be an object"));
        }
        SimpleWorkflowInput request = mapper.convertValue(input, SimpleWorkflowInput.class);
        try {
            return mapper.valueToTree(executeSteps(context, request));
        } catch (ActivityFailedException e) {
            log.debug("Simple workflow {} failed at {}: {}", context.workflowId(), e.getActivityType(), e.getMessage());
            return mapper.valueToTree(SimpleWorkflowResult.failed(
                e.getActivityType() + " failed: " + e.getFailure().message()));
        }
    }

    private SimpleWorkflowResult executeSteps(WorkflowContext context, SimpleWorkflowInput request) {
        JsonNode parameters = mapper.valueToTree(request.parameters());

        // Step 1: Validate input
        JsonNode validation = context.executeActivity(ACTIVITY_VALIDATE_INPUT, parameters);
        if (!validation.path("valid").asBoolean(false)) {
            return SimpleWorkflowResult.failed(
                "Input validation failed: " + validation.path("message").asText("Unknown error"));
        }

        // Step 2: Process data
        JsonNode processing = context.executeActivity(ACTIVITY_PROCESS_DATA, parameters);

        // Step 3: Store results
        JsonNode storage = context.executeActivity(ACTIVITY_STORE_DATA, processing);

        ObjectNode result = mapper.createObjectNode();
        result.set("validation", validation);
        result.set("processing", processing);
        result.set("storage", storage);
        result.put("workflowId", request.requestId());
        result.put("userId", request.userId());
        return SimpleWorkflowResult.succeeded(result);
    }
}
