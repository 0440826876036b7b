package com.durableflow.core.model;

/**
 * What StartWorkflow does when the workflow id already has an open run.
 */
public enum WorkflowIdReusePolicy {
    /** Start another run; the newest run becomes the current one for the id. */
    ALLOW_DUPLICATE,
    /** Fail with AlreadyExists. */
    REJECT_DUPLICATE,
    /** Terminate the open run, then start a new one. */
    TERMINATE_IF_RUNNING
}
