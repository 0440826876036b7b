package com.durableflow.examples.simple;

import com.durableflow.core.model.Event;
import com.durableflow.core.workflow.WorkflowRegistry;
import com.durableflow.engine.WorkflowEngine;
import com.durableflow.engine.service.WorkflowService;
import com.durableflow.engine.service.WorkflowService.StartWorkflowRequest;
import com.durableflow.engine.service.WorkflowService.WorkflowResult;
import com.durableflow.worker.ActivityRegistry;
import com.durableflow.worker.WorkerOptions;
import com.durableflow.worker.WorkerRuntime;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;

/**
 * Demonstration runner for the simple workflow on an in-memory engine.
 *
 * Shows:
 * 1. Normal successful execution
 * 2. Invalid input reported in the workflow result
 * 3. The recorded event history of a run
 */
public class SimpleWorkflowDemo {

    private static final Logger log = LoggerFactory.getLogger(SimpleWorkflowDemo.class);
    private static final ObjectMapper mapper = new ObjectMapper();
    private static final Duration RESULT_TIMEOUT = Duration.ofSeconds(30);

    private final WorkflowEngine engine;
    private final WorkerRuntime worker;

    public SimpleWorkflowDemo() {
        Clock clock = Clock.systemUTC();
        WorkflowRegistry workflows = new WorkflowRegistry();
        ActivityRegistry activities = new ActivityRegistry();
        SimpleWorkflowRegistration.register(workflows, activities, clock);

        this.engine = WorkflowEngine.builder()
            .workflowRegistry(workflows)
            .activityCatalog(activities)
            .clock(clock)
            .build();
        this.worker = WorkerRuntime.forEngine(engine, activities, WorkerOptions.builder()
            .workerId("demo-worker")
            .pollInterval(Duration.ofMillis(50))
            .build());
    }

    public static void main(String[] args) {
        SimpleWorkflowDemo demo = new SimpleWorkflowDemo();
        demo.worker.start();
        try {
            WorkflowResult completed = demo.runScenario1_NormalExecution();
            demo.runScenario2_InvalidInput();
            demo.runScenario3_History(completed.runId());
        } finally {
            demo.worker.stop();
        }
        log.info("All demonstrations complete");
    }

    /**
     * SCENARIO 1: Normal successful workflow execution.
     */
    public WorkflowResult runScenario1_NormalExecution() {
        log.info("SCENARIO 1: Normal Successful Execution");
        SimpleWorkflowInput input = SimpleWorkflowInput.of(
            "req-" + UUID.randomUUID().toString().substring(0, 8),
            "user_123",
            Map.of(SimpleActivities.REQUIRED_FIELD, "hello world", "priority", 3));

        WorkflowResult result = startAndWait(input);
        log.info("Run {} finished as {} with output {}", result.runId(), result.status(), result.output());
        return result;
    }

    /**
     * SCENARIO 2: Validation fails; the run completes and reports it.
     */
    public WorkflowResult runScenario2_InvalidInput() {
        log.info("SCENARIO 2: Invalid Input");
        SimpleWorkflowInput input = SimpleWorkflowInput.of(
            "req-" + UUID.randomUUID().toString().substring(0, 8),
            "user_456",
            Map.of("unexpected_field", "value"));

        WorkflowResult result = startAndWait(input);
        log.info("Run {} finished as {}: {}", result.runId(), result.status(),
            result.output().path("errorMessage").asText());
        return result;
    }

    /**
     * SCENARIO 3: Every step of a run is in its event history.
     */
    public void runScenario3_History(String runId) {
        log.info("SCENARIO 3: Event History of run {}", runId);
        for (Event event : engine.historyService().getHistory(runId).events()) {
            log.info("  #{} {} by {} at {}", event.sequenceNumber(), event.type(), event.actorType(), event.timestamp());
        }
    }

    private WorkflowResult startAndWait(SimpleWorkflowInput input) {
        WorkflowService service = engine.workflowService();
        service.startWorkflow(StartWorkflowRequest.of(SimpleWorkflow.WORKFLOW_TYPE, mapper.valueToTree(input))
            .withWorkflowId(input.requestId()));
        return service.getResult(input.requestId(), RESULT_TIMEOUT);
    }

    public WorkflowEngine engine() {
        return engine;
    }

    public WorkerRuntime worker() {
        return worker;
    }
}
