package com.durableflow.engine.persistence;

import com.durableflow.core.exception.WorkerLeaseExpiredException;
import com.durableflow.core.model.Task;
import com.durableflow.core.test.TimeController;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for visibility-timeout leasing and at-least-once redelivery.
 */
class InMemoryTaskQueueTest {

    private static final String QUEUE = "activities";
    private static final Duration VT = Duration.ofSeconds(30);

    private TimeController time;
    private InMemoryTaskQueue queue;

    @BeforeEach
    void setUp() {
        time = new TimeController(Instant.parse("2024-01-15T10:00:00Z"));
        queue = new InMemoryTaskQueue(time);
    }

    private Task activity(String runId, String activityId, int attempt) {
        return Task.activity(QUEUE, runId, "wf-" + runId, activityId, attempt,
            JsonNodeFactory.instance.objectNode(), time.now(), time.now());
    }

    @Test
    @DisplayName("Dequeued task is leased and hidden until the lease lapses")
    void testLeaseHidesTask() {
        queue.enqueue(activity("run-1", "1", 1));

        Task leased = queue.dequeue(QUEUE, VT, "worker-a").orElseThrow();

        assertThat(leased.leaseOwner()).isEqualTo("worker-a");
        assertThat(leased.leaseExpiresAt()).isEqualTo(time.now().plus(VT));
        assertThat(leased.deliveryCount()).isEqualTo(1);
        assertThat(queue.dequeue(QUEUE, VT, "worker-b")).isEmpty();
        assertThat(queue.depth(QUEUE)).isEqualTo(1);
    }

    @Test
    @DisplayName("Unacked task is redelivered after the visibility timeout with a higher delivery count")
    void testRedeliveryAfterLeaseExpiry() {
        queue.enqueue(activity("run-1", "1", 1));
        Task first = queue.dequeue(QUEUE, VT, "worker-a").orElseThrow();

        time.advance(VT.plusSeconds(1));
        Task second = queue.dequeue(QUEUE, VT, "worker-b").orElseThrow();

        assertThat(second.taskId()).isEqualTo(first.taskId());
        assertThat(second.leaseOwner()).isEqualTo("worker-b");
        assertThat(second.deliveryCount()).isEqualTo(2);
        assertThat(second.leaseToken()).isNotEqualTo(first.leaseToken());
    }

    @Test
    @DisplayName("Ack with a stale lease token is rejected")
    void testStaleAckRejected() {
        queue.enqueue(activity("run-1", "1", 1));
        Task first = queue.dequeue(QUEUE, VT, "worker-a").orElseThrow();
        time.advance(VT.plusSeconds(1));
        Task second = queue.dequeue(QUEUE, VT, "worker-b").orElseThrow();

        assertThatThrownBy(() -> queue.ack(first.handle()))
            .isInstanceOf(WorkerLeaseExpiredException.class);

        queue.ack(second.handle());
        assertThat(queue.depth(QUEUE)).isZero();
    }

    @Test
    @DisplayName("Enqueue is idempotent by task id")
    void testEnqueueIdempotent() {
        queue.enqueue(activity("run-1", "1", 1));
        queue.enqueue(activity("run-1", "1", 1));
        queue.enqueue(activity("run-1", "1", 2));

        assertThat(queue.depth(QUEUE)).isEqualTo(2);
    }

    @Test
    @DisplayName("Task is not delivered before its visibility time")
    void testDelayedVisibility() {
        Instant visibleAt = time.now().plusSeconds(4);
        queue.enqueue(Task.activity(QUEUE, "run-1", "wf-1", "1", 2, null, time.now(), visibleAt));

        assertThat(queue.dequeue(QUEUE, VT, "worker-a")).isEmpty();

        time.advanceSeconds(4);
        assertThat(queue.dequeue(QUEUE, VT, "worker-a")).isPresent();
    }

    @Test
    @DisplayName("Nack makes the task visible again after the redelivery delay")
    void testNack() {
        queue.enqueue(activity("run-1", "1", 1));
        Task leased = queue.dequeue(QUEUE, VT, "worker-a").orElseThrow();

        queue.nack(leased.handle(), Duration.ofSeconds(2));
        assertThat(queue.dequeue(QUEUE, VT, "worker-a")).isEmpty();

        time.advanceSeconds(2);
        Task again = queue.dequeue(QUEUE, VT, "worker-a").orElseThrow();
        assertThat(again.deliveryCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Extending a lease keeps the task hidden past the original timeout")
    void testExtendLease() {
        queue.enqueue(activity("run-1", "1", 1));
        Task leased = queue.dequeue(QUEUE, VT, "worker-a").orElseThrow();

        time.advanceSeconds(20);
        Instant expiresAt = queue.extendLease(leased.handle(), VT);
        time.advanceSeconds(20);

        assertThat(expiresAt).isEqualTo(time.now().plusSeconds(10));
        assertThat(queue.dequeue(QUEUE, VT, "worker-b")).isEmpty();
        queue.ack(leased.handle());
    }

    @Test
    @DisplayName("Decision enqueued while leased is re-armed instead of dropped")
    void testDecisionRearm() {
        queue.enqueue(Task.decision(QUEUE, "run-1", "wf-1", time.now()));
        Task leased = queue.dequeue(QUEUE, VT, "dispatcher").orElseThrow();

        queue.enqueue(Task.decision(QUEUE, "run-1", "wf-1", time.now()));
        queue.ack(leased.handle());

        Optional<Task> again = queue.dequeue(QUEUE, VT, "dispatcher");
        assertThat(again).isPresent();
        assertThat(again.get().taskId()).isEqualTo(Task.decisionTaskId("run-1"));

        queue.ack(again.get().handle());
        assertThat(queue.depth(QUEUE)).isZero();
    }

    @Test
    @DisplayName("Activity task enqueued while leased is not re-armed")
    void testActivityNotRearmed() {
        queue.enqueue(activity("run-1", "1", 1));
        Task leased = queue.dequeue(QUEUE, VT, "worker-a").orElseThrow();

        queue.enqueue(activity("run-1", "1", 1));
        queue.ack(leased.handle());

        assertThat(queue.depth(QUEUE)).isZero();
    }

    @Test
    @DisplayName("Reclaim returns expired leases to pending")
    void testReclaimExpired() {
        queue.enqueue(activity("run-1", "1", 1));
        queue.enqueue(activity("run-2", "1", 1));
        Task a = queue.dequeue(QUEUE, VT, "worker-a").orElseThrow();
        time.advanceSeconds(10);
        queue.dequeue(QUEUE, VT, "worker-b").orElseThrow();

        time.advanceSeconds(25);
        List<Task> reclaimed = queue.reclaimExpired(time.now(), 10);

        assertThat(reclaimed).extracting(Task::taskId).containsExactly(a.taskId());
        Task pending = queue.find(QUEUE, a.taskId()).orElseThrow();
        assertThat(pending.isLeased()).isFalse();
        assertThatThrownBy(() -> queue.ack(a.handle()))
            .isInstanceOf(WorkerLeaseExpiredException.class);
    }

    @Test
    @DisplayName("Queues are independent")
    void testQueuesIsolated() {
        queue.enqueue(activity("run-1", "1", 1));

        assertThat(queue.dequeue("other", VT, "worker-a")).isEmpty();
        assertThat(queue.depth("other")).isZero();
    }
}
