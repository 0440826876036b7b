package com.durableflow.core.repository;

import com.durableflow.core.model.Task;
import com.durableflow.core.model.TaskHandle;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable named queues with visibility-timeout based at-least-once delivery.
 *
 * Layout: entries keyed by (queueName, taskId) with a lease-expiry index.
 *
 * Guarantees:
 * - Every enqueued task is eventually delivered to exactly one leaseholder at a time
 * - A task whose lease lapses (nack or expiry) becomes eligible for redelivery with an
 *   incremented delivery count
 * - FIFO by visibility time is best effort only
 */
public interface TaskQueue {

    /**
     * Enqueue a task. Idempotent by (queueName, taskId): enqueueing an id that is already
     * pending does nothing. Enqueueing a decision task whose id is currently leased marks it
     * to be re-armed, so the current lease's ack returns it to pending instead of removing it.
     */
    void enqueue(Task task);

    /**
     * Lease the next visible task of a queue.
     *
     * @param queueName The queue to poll
     * @param visibilityTimeout How long the task stays hidden from other consumers
     * @param workerId The consumer taking the lease
     * @return The leased task, or empty if nothing is visible
     */
    Optional<Task> dequeue(String queueName, Duration visibilityTimeout, String workerId);

    /**
     * Remove a leased task permanently (or re-arm it, see {@link #enqueue}).
     *
     * @throws com.durableflow.core.exception.WorkerLeaseExpiredException if the lease is no longer held
     */
    void ack(TaskHandle handle);

    /**
     * Give a lease up early; the task becomes visible again after the delay.
     *
     * @throws com.durableflow.core.exception.WorkerLeaseExpiredException if the lease is no longer held
     */
    void nack(TaskHandle handle, Duration redeliveryDelay);

    /**
     * Extend a lease (heartbeat).
     *
     * @return The new lease expiry
     * @throws com.durableflow.core.exception.WorkerLeaseExpiredException if the lease is no longer held
     */
    Instant extendLease(TaskHandle handle, Duration visibilityTimeout);

    /**
     * Return tasks whose lease expired before {@code now} to the pending state.
     *
     * @return The reclaimed tasks, as they were before reclaiming
     */
    List<Task> reclaimExpired(Instant now, int limit);

    /**
     * Look up a task by id.
     */
    Optional<Task> find(String queueName, String taskId);

    /**
     * Number of tasks (pending or leased) in a queue.
     */
    int depth(String queueName);
}
