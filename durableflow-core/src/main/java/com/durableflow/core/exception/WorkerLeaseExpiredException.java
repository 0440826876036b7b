package com.durableflow.core.exception;

/**
 * Thrown when a worker acts on a task whose lease it no longer holds.
 * Never surfaced to users; the task is redelivered to whoever holds the current lease.
 */
public class WorkerLeaseExpiredException extends DurableFlowException {

    public static final String ERROR_CODE = "WORKER_LEASE_EXPIRED";

    public WorkerLeaseExpiredException(String queueName, String taskId) {
        super(ERROR_CODE, String.format(
            "Lease on task %s in queue %s is no longer held",
            taskId, queueName
        ));
    }
}
