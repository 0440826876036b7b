package com.durableflow.engine.service;

import com.durableflow.core.model.FailureDetail;
import com.durableflow.core.model.RunRecord;
import com.durableflow.core.model.WorkflowIdReusePolicy;
import com.durableflow.core.model.WorkflowStatus;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Submission interface of the engine.
 * Starts runs and reports on them; never executes workflow or activity code.
 */
public interface WorkflowService {

    /**
     * Start a new workflow run.
     *
     * @param request The start request
     * @return The new run's ID
     * @throws com.durableflow.core.exception.NotFoundException if the workflow type is not registered
     * @throws com.durableflow.core.exception.AlreadyExistsException if the reuse policy rejects the start
     */
    String startWorkflow(StartWorkflowRequest request);

    /**
     * Status of the current (most recent) run of a workflow id.
     *
     * @throws com.durableflow.core.exception.NotFoundException if the workflow id is unknown
     */
    WorkflowStatusView getStatus(String workflowId);

    /**
     * Outcome of the current run, waiting up to {@code timeout} for it to close.
     * A zero timeout returns immediately.
     */
    WorkflowResult getResult(String workflowId, Duration timeout);

    /**
     * Ask the current run to cancel. The next decision lets the workflow code observe the request;
     * unless the code closes the run itself, the run fails with CANCELLED.
     * Requesting again while the run is open does nothing.
     *
     * @throws com.durableflow.core.exception.InvalidStateTransitionException if the run is closed
     */
    void requestCancellation(String workflowId, String reason);

    /**
     * Close the current run immediately as TERMINATED, without consulting workflow code.
     *
     * @throws com.durableflow.core.exception.InvalidStateTransitionException if the run is closed
     */
    void terminate(String workflowId, String reason);

    /**
     * Status of a specific run.
     */
    WorkflowStatusView describe(String runId);

    /**
     * All runs of a workflow id, newest first.
     */
    List<RunRecord> listRuns(String workflowId);

    /**
     * Request to start a workflow run.
     *
     * @param workflowId caller-chosen id, or null to generate one
     * @param idReusePolicy null to use the engine default
     */
    record StartWorkflowRequest(
        String workflowType,
        JsonNode input,
        String workflowId,
        WorkflowIdReusePolicy idReusePolicy
    ) {
        public static StartWorkflowRequest of(String workflowType, JsonNode input) {
            return new StartWorkflowRequest(workflowType, input, null, null);
        }

        public StartWorkflowRequest withWorkflowId(String workflowId) {
            return new StartWorkflowRequest(workflowType, input, workflowId, idReusePolicy);
        }

        public StartWorkflowRequest withIdReusePolicy(WorkflowIdReusePolicy idReusePolicy) {
            return new StartWorkflowRequest(workflowType, input, workflowId, idReusePolicy);
        }
    }

    /**
     * Point-in-time view of a run.
     */
    record WorkflowStatusView(
        String workflowId,
        String runId,
        String workflowType,
        WorkflowStatus status,
        long version,
        int pendingActivities,
        int pendingTimers,
        boolean cancelRequested,
        FailureDetail failure,
        Instant startedAt,
        Instant lastUpdated,
        Instant closedAt
    ) {
    }

    /**
     * Outcome of a run, or its current status if it is still open.
     */
    record WorkflowResult(
        String workflowId,
        String runId,
        WorkflowStatus status,
        JsonNode output,
        FailureDetail failure
    ) {
        public boolean stillRunning() {
            return !status.isTerminal();
        }

        public boolean succeeded() {
            return status == WorkflowStatus.COMPLETED;
        }
    }
}
