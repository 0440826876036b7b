package com.durableflow.core.repository;

import com.durableflow.core.model.RunRecord;
import com.durableflow.core.model.WorkflowStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Index from workflow id to runs, used by the submission interface and by recovery sweeps.
 */
public interface RunIndexRepository {

    /**
     * Register a new run.
     *
     * @param record The run to register
     * @param rejectIfOpen When true, registration fails if the workflow id has an open run
     * @return empty if registered, or the open run that blocked the registration
     */
    Optional<RunRecord> register(RunRecord record, boolean rejectIfOpen);

    /**
     * Mark a run closed. Closing an already closed run does nothing.
     */
    void markClosed(String runId, WorkflowStatus status, Instant closedAt);

    Optional<RunRecord> findByRunId(String runId);

    /**
     * The most recently created run of a workflow id.
     */
    Optional<RunRecord> findCurrent(String workflowId);

    /**
     * All runs of a workflow id, newest first.
     */
    List<RunRecord> findByWorkflowId(String workflowId);

    /**
     * Open runs, oldest first.
     */
    List<RunRecord> findOpen(int limit);

    int countOpen();
}
