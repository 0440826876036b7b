package com.durableflow.api.rest;

import com.durableflow.api.config.EngineProperties;
import com.durableflow.core.model.RunRecord;
import com.durableflow.core.model.WorkflowIdReusePolicy;
import com.durableflow.engine.service.WorkflowService;
import com.durableflow.engine.service.WorkflowService.StartWorkflowRequest;
import com.durableflow.engine.service.WorkflowService.WorkflowResult;
import com.durableflow.engine.service.WorkflowService.WorkflowStatusView;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * REST API for workflow submission and control.
 */
@RestController
@RequestMapping("/api/v1/workflows")
public class WorkflowController {

    private final WorkflowService workflowService;
    private final Duration maxResultWait;

    public WorkflowController(WorkflowService workflowService, EngineProperties properties) {
        this.workflowService = workflowService;
        this.maxResultWait = properties.maxResultWait();
    }

    /**
     * Start a new workflow run.
     */
    @PostMapping("/start")
    public ResponseEntity<StartWorkflowResponse> startWorkflow(@RequestBody StartWorkflowRequestDto request) {
        if (request.workflowType() == null || request.workflowType().isBlank()) {
            throw new IllegalArgumentException("workflowType is required");
        }
        StartWorkflowRequest start = new StartWorkflowRequest(
            request.workflowType(),
            request.input(),
            request.workflowId(),
            request.idReusePolicy()
        );
        String runId = workflowService.startWorkflow(start);
        String workflowId = workflowService.describe(runId).workflowId();

        return ResponseEntity.status(HttpStatus.CREATED)
            .body(new StartWorkflowResponse(workflowId, runId));
    }

    /**
     * Status of the current run of a workflow.
     */
    @GetMapping("/{workflowId}/status")
    public ResponseEntity<WorkflowStatusView> getStatus(@PathVariable String workflowId) {
        return ResponseEntity.ok(workflowService.getStatus(workflowId));
    }

    /**
     * Result of the current run, optionally waiting for it to close.
     * Answers 202 while the run is still open.
     */
    @GetMapping("/{workflowId}/result")
    public ResponseEntity<WorkflowResult> getResult(
            @PathVariable String workflowId,
            @RequestParam(defaultValue = "0") long waitSeconds) {
        if (waitSeconds < 0) {
            throw new IllegalArgumentException("waitSeconds must not be negative");
        }
        Duration wait = Duration.ofSeconds(waitSeconds);
        if (wait.compareTo(maxResultWait) > 0) {
            wait = maxResultWait;
        }
        WorkflowResult result = workflowService.getResult(workflowId, wait);
        HttpStatus status = result.stillRunning() ? HttpStatus.ACCEPTED : HttpStatus.OK;
        return ResponseEntity.status(status).body(result);
    }

    /**
     * Request cancellation. The workflow code observes it at its next decision.
     */
    @PostMapping("/{workflowId}/cancel")
    public ResponseEntity<Map<String, Object>> cancelWorkflow(
            @PathVariable String workflowId,
            @RequestBody(required = false) ReasonRequest request) {
        String reason = request != null && request.reason() != null ? request.reason() : "Manual cancellation";
        workflowService.requestCancellation(workflowId, reason);

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
            "accepted", true,
            "workflowId", workflowId
        ));
    }

    /**
     * Terminate the current run immediately.
     */
    @PostMapping("/{workflowId}/terminate")
    public ResponseEntity<WorkflowStatusView> terminateWorkflow(
            @PathVariable String workflowId,
            @RequestBody(required = false) ReasonRequest request) {
        String reason = request != null && request.reason() != null ? request.reason() : "Manual termination";
        workflowService.terminate(workflowId, reason);
        return ResponseEntity.ok(workflowService.getStatus(workflowId));
    }

    /**
     * All runs of a workflow, newest first.
     */
    @GetMapping("/{workflowId}/runs")
    public ResponseEntity<List<RunRecord>> listRuns(@PathVariable String workflowId) {
        return ResponseEntity.ok(workflowService.listRuns(workflowId));
    }

    // ========== DTOs ==========

    public record StartWorkflowRequestDto(
        String workflowType,
        String workflowId,
        JsonNode input,
        WorkflowIdReusePolicy idReusePolicy
    ) {}

    public record StartWorkflowResponse(String workflowId, String runId) {}

    public record ReasonRequest(String reason) {}
}
