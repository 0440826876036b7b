package com.durableflow.core.workflow;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Business logic of a workflow type.
 *
 * The code is re-executed from the start on every decision cycle, with the outcomes of
 * earlier activities served from history. It must be deterministic: no wall-clock reads,
 * no true randomness and no direct I/O. Use {@link WorkflowContext#currentTime()},
 * {@link WorkflowContext#newRandom()} and activities instead.
 */
@FunctionalInterface
public interface Workflow {

    /**
     * Run the workflow.
     *
     * @param context Deterministic primitives and activity scheduling
     * @param input The input the run was started with
     * @return The workflow output
     */
    JsonNode run(WorkflowContext context, JsonNode input);
}
