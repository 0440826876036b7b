package com.durableflow.examples.simple;

import com.durableflow.core.model.ActivityOptions;
import com.durableflow.core.workflow.WorkflowRegistry;
import com.durableflow.worker.ActivityRegistry;

import java.time.Clock;
import java.time.Duration;

/**
 * Registers the simple workflow and its activities.
 */
public final class SimpleWorkflowRegistration {

    private SimpleWorkflowRegistration() {
    }

    public static void register(WorkflowRegistry workflows, ActivityRegistry activities, Clock clock) {
        SimpleActivities handlers = new SimpleActivities(clock);

        workflows.register(SimpleWorkflow.WORKFLOW_TYPE, new SimpleWorkflow());
        activities.register(SimpleWorkflow.ACTIVITY_VALIDATE_INPUT, handlers::validateInput,
            startToClose(SimpleWorkflow.VALIDATE_TIMEOUT));
        activities.register(SimpleWorkflow.ACTIVITY_PROCESS_DATA, handlers::processData,
            startToClose(SimpleWorkflow.PROCESS_TIMEOUT));
        activities.register(SimpleWorkflow.ACTIVITY_STORE_DATA, handlers::storeData,
            startToClose(SimpleWorkflow.STORE_TIMEOUT));
    }

    private static ActivityOptions startToClose(Duration timeout) {
        return ActivityOptions.builder()
            .startToCloseTimeout(timeout)
            .build();
    }
}
