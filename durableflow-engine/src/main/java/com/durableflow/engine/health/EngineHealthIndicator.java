package com.durableflow.engine.health;

import com.durableflow.core.repository.RunIndexRepository;
import com.durableflow.core.repository.TaskQueue;
import com.durableflow.core.repository.TimerRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health indicator for the workflow engine.
 * Reports health status based on:
 * - Storage reachability (queue, run index and timer queries succeed)
 * - Queue depths
 * - Open runs and pending timers
 */
public class EngineHealthIndicator implements HealthIndicator {

    static final int QUEUE_BACKLOG_WARNING = 10_000;

    private final TaskQueue taskQueue;
    private final RunIndexRepository runIndex;
    private final TimerRepository timerRepository;
    private final List<String> queueNames;

    public EngineHealthIndicator(
            TaskQueue taskQueue,
            RunIndexRepository runIndex,
            TimerRepository timerRepository,
            List<String> queueNames) {
        this.taskQueue = taskQueue;
        this.runIndex = runIndex;
        this.timerRepository = timerRepository;
        this.queueNames = List.copyOf(queueNames);
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        try {
            Map<String, Integer> depths = new LinkedHashMap<>();
            for (String queueName : queueNames) {
                int depth = taskQueue.depth(queueName);
                depths.put(queueName, depth);
                if (depth > QUEUE_BACKLOG_WARNING) {
                    details.put("queueWarning", "Backlog on " + queueName + " - workers may be saturated");
                }
            }
            details.put("queues", depths);
            details.put("openRuns", runIndex.countOpen());
            details.put("pendingTimers", timerRepository.countPending());

            return Health.up()
                .withDetails(details)
                .build();
        } catch (Exception e) {
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }
    }
}
