package com.durableflow.engine.persistence;

import com.durableflow.core.exception.WorkerLeaseExpiredException;
import com.durableflow.core.model.Task;
import com.durableflow.core.model.TaskHandle;
import com.durableflow.core.model.TaskKind;
import com.durableflow.core.repository.TaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * In-memory implementation of TaskQueue.
 * For demonstration and testing purposes; all operations hold the queue's monitor.
 */
public class InMemoryTaskQueue implements TaskQueue {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTaskQueue.class);

    private static final Comparator<Task> DELIVERY_ORDER = Comparator
        .comparing((Task t) -> t.isLeased() ? t.leaseExpiresAt() : t.visibleAt())
        .thenComparing(Task::createdAt);

    private final Map<String, Map<String, Task>> queues = new HashMap<>();
    private final Set<String> rearmed = new HashSet<>();
    private final Clock clock;

    public InMemoryTaskQueue(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized void enqueue(Task task) {
        Map<String, Task> queue = queues.computeIfAbsent(task.queueName(), k -> new LinkedHashMap<>());
        Task existing = queue.get(task.taskId());
        if (existing == null) {
            queue.put(task.taskId(), task);
            log.debug("Enqueued {} on {}", task.taskId(), task.queueName());
        } else if (existing.isLeased() && existing.kind() == TaskKind.DECISION) {
            rearmed.add(key(task.queueName(), task.taskId()));
            log.debug("Re-armed leased decision task {}", task.taskId());
        }
    }

    @Override
    public synchronized Optional<Task> dequeue(String queueName, Duration visibilityTimeout, String workerId) {
        Map<String, Task> queue = queues.get(queueName);
        if (queue == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        Optional<Task> next = queue.values().stream()
            .filter(t -> isDeliverable(t, now))
            .min(DELIVERY_ORDER);
        if (next.isEmpty()) {
            return Optional.empty();
        }
        Task leased = next.get().withLease(workerId, UUID.randomUUID().toString(), now.plus(visibilityTimeout));
        queue.put(leased.taskId(), leased);
        rearmed.remove(key(queueName, leased.taskId()));
        return Optional.of(leased);
    }

    @Override
    public synchronized void ack(TaskHandle handle) {
        Task task = requireLease(handle);
        Map<String, Task> queue = queues.get(handle.queueName());
        if (rearmed.remove(key(handle.queueName(), handle.taskId()))) {
            queue.put(task.taskId(), task.withoutLease(clock.instant()));
        } else {
            queue.remove(task.taskId());
        }
    }

    @Override
    public synchronized void nack(TaskHandle handle, Duration redeliveryDelay) {
        Task task = requireLease(handle);
        rearmed.remove(key(handle.queueName(), handle.taskId()));
        queues.get(handle.queueName()).put(task.taskId(), task.withoutLease(clock.instant().plus(redeliveryDelay)));
    }

    @Override
    public synchronized Instant extendLease(TaskHandle handle, Duration visibilityTimeout) {
        Task task = requireLease(handle);
        Instant expiresAt = clock.instant().plus(visibilityTimeout);
        queues.get(handle.queueName()).put(task.taskId(), task.withLeaseExpiresAt(expiresAt));
        return expiresAt;
    }

    @Override
    public synchronized List<Task> reclaimExpired(Instant now, int limit) {
        List<Task> expired = queues.values().stream()
            .flatMap(q -> q.values().stream())
            .filter(t -> t.isLeased() && t.isLeaseExpired(now))
            .sorted(Comparator.comparing(Task::leaseExpiresAt))
            .limit(limit)
            .toList();
        for (Task task : expired) {
            rearmed.remove(key(task.queueName(), task.taskId()));
            queues.get(task.queueName()).put(task.taskId(), task.withoutLease(now));
        }
        return expired;
    }

    @Override
    public synchronized Optional<Task> find(String queueName, String taskId) {
        Map<String, Task> queue = queues.get(queueName);
        return queue == null ? Optional.empty() : Optional.ofNullable(queue.get(taskId));
    }

    @Override
    public synchronized int depth(String queueName) {
        Map<String, Task> queue = queues.get(queueName);
        return queue == null ? 0 : queue.size();
    }

    /**
     * All tasks of a queue, in insertion order.
     */
    public synchronized List<Task> snapshot(String queueName) {
        Map<String, Task> queue = queues.get(queueName);
        return queue == null ? List.of() : new ArrayList<>(queue.values());
    }

    private static boolean isDeliverable(Task task, Instant now) {
        if (task.isLeased()) {
            return task.isLeaseExpired(now);
        }
        return !task.visibleAt().isAfter(now);
    }

    private Task requireLease(TaskHandle handle) {
        Map<String, Task> queue = queues.get(handle.queueName());
        Task task = queue == null ? null : queue.get(handle.taskId());
        if (task == null || !task.isLeased() || !task.leaseToken().equals(handle.leaseToken())) {
            throw new WorkerLeaseExpiredException(handle.queueName(), handle.taskId());
        }
        return task;
    }

    private static String key(String queueName, String taskId) {
        return queueName + "|" + taskId;
    }
}
