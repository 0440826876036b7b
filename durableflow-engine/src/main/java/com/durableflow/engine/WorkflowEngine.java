package com.durableflow.engine;

import com.durableflow.core.model.WorkflowIdReusePolicy;
import com.durableflow.core.replay.WorkflowReplayer;
import com.durableflow.core.repository.EventLog;
import com.durableflow.core.repository.RunIndexRepository;
import com.durableflow.core.repository.TaskQueue;
import com.durableflow.core.repository.TimerRepository;
import com.durableflow.core.workflow.ActivityCatalog;
import com.durableflow.core.workflow.WorkflowRegistry;
import com.durableflow.engine.coordinator.ActivityCoordinator;
import com.durableflow.engine.coordinator.DecisionCoordinator;
import com.durableflow.engine.coordinator.RunStore;
import com.durableflow.engine.coordinator.WorkDispatcher;
import com.durableflow.engine.coordinator.WorkflowCoordinator;
import com.durableflow.engine.history.ExecutionHistoryService;
import com.durableflow.engine.metrics.WorkflowMetrics;
import com.durableflow.engine.persistence.InMemoryEventLog;
import com.durableflow.engine.persistence.InMemoryRunIndexRepository;
import com.durableflow.engine.persistence.InMemoryTaskQueue;
import com.durableflow.engine.persistence.InMemoryTimerRepository;
import com.durableflow.engine.service.WorkflowService;
import com.durableflow.engine.support.InfrastructureRetry;

import java.time.Clock;
import java.time.Duration;

/**
 * The engine's components wired together over one set of stores.
 * Stores default to the in-memory implementations; pass JDBC ones for durability.
 *
 * <pre>{@code
 * WorkflowEngine engine = WorkflowEngine.builder()
 *     .workflowRegistry(workflows)
 *     .activityCatalog(activities)
 *     .build();
 * String runId = engine.workflowService().startWorkflow(request);
 * }</pre>
 */
public class WorkflowEngine {

    private final EventLog eventLog;
    private final TaskQueue taskQueue;
    private final RunIndexRepository runIndex;
    private final TimerRepository timerRepository;
    private final WorkflowRegistry workflowRegistry;
    private final WorkflowMetrics metrics;
    private final Clock clock;
    private final RunStore runStore;
    private final WorkDispatcher dispatcher;
    private final DecisionCoordinator decisionCoordinator;
    private final ActivityCoordinator activityCoordinator;
    private final WorkflowCoordinator workflowCoordinator;
    private final ExecutionHistoryService historyService;

    private WorkflowEngine(Builder builder) {
        this.eventLog = builder.eventLog != null ? builder.eventLog : new InMemoryEventLog();
        this.taskQueue = builder.taskQueue != null ? builder.taskQueue : new InMemoryTaskQueue(builder.clock);
        this.runIndex = builder.runIndex != null ? builder.runIndex : new InMemoryRunIndexRepository();
        this.timerRepository = builder.timerRepository != null ? builder.timerRepository : new InMemoryTimerRepository();
        this.workflowRegistry = builder.workflowRegistry;
        this.metrics = builder.metrics;
        this.clock = builder.clock;

        this.runStore = new RunStore(eventLog, runIndex, timerRepository, builder.infrastructureRetry, metrics);
        this.dispatcher = new WorkDispatcher(taskQueue, timerRepository, builder.infrastructureRetry, clock);
        this.decisionCoordinator = new DecisionCoordinator(runStore, dispatcher,
            new WorkflowReplayer(workflowRegistry), builder.activityCatalog, metrics, clock);
        this.activityCoordinator = new ActivityCoordinator(runStore, dispatcher, taskQueue, metrics, clock);
        this.workflowCoordinator = new WorkflowCoordinator(workflowRegistry, runStore, runIndex, dispatcher,
            metrics, clock, builder.defaultReusePolicy, builder.resultPollInterval);
        this.historyService = new ExecutionHistoryService(eventLog, clock);

        metrics.monitorOpenRuns(runIndex::countOpen);
    }

    public static Builder builder() {
        return new Builder();
    }

    public WorkflowService workflowService() {
        return workflowCoordinator;
    }

    public WorkflowCoordinator workflowCoordinator() {
        return workflowCoordinator;
    }

    public DecisionCoordinator decisionCoordinator() {
        return decisionCoordinator;
    }

    public ActivityCoordinator activityCoordinator() {
        return activityCoordinator;
    }

    public WorkDispatcher dispatcher() {
        return dispatcher;
    }

    public RunStore runStore() {
        return runStore;
    }

    public ExecutionHistoryService historyService() {
        return historyService;
    }

    public EventLog eventLog() {
        return eventLog;
    }

    public TaskQueue taskQueue() {
        return taskQueue;
    }

    public RunIndexRepository runIndex() {
        return runIndex;
    }

    public TimerRepository timerRepository() {
        return timerRepository;
    }

    public WorkflowRegistry workflowRegistry() {
        return workflowRegistry;
    }

    public WorkflowMetrics metrics() {
        return metrics;
    }

    public Clock clock() {
        return clock;
    }

    public static class Builder {
        private EventLog eventLog;
        private TaskQueue taskQueue;
        private RunIndexRepository runIndex;
        private TimerRepository timerRepository;
        private WorkflowRegistry workflowRegistry = new WorkflowRegistry();
        private ActivityCatalog activityCatalog = ActivityCatalog.empty();
        private WorkflowMetrics metrics = new WorkflowMetrics();
        private InfrastructureRetry infrastructureRetry = InfrastructureRetry.defaults();
        private Clock clock = Clock.systemUTC();
        private WorkflowIdReusePolicy defaultReusePolicy = WorkflowIdReusePolicy.ALLOW_DUPLICATE;
        private Duration resultPollInterval = Duration.ofMillis(50);

        public Builder eventLog(EventLog eventLog) {
            this.eventLog = eventLog;
            return this;
        }

        public Builder taskQueue(TaskQueue taskQueue) {
            this.taskQueue = taskQueue;
            return this;
        }

        public Builder runIndex(RunIndexRepository runIndex) {
            this.runIndex = runIndex;
            return this;
        }

        public Builder timerRepository(TimerRepository timerRepository) {
            this.timerRepository = timerRepository;
            return this;
        }

        public Builder workflowRegistry(WorkflowRegistry workflowRegistry) {
            this.workflowRegistry = workflowRegistry;
            return this;
        }

        public Builder activityCatalog(ActivityCatalog activityCatalog) {
            this.activityCatalog = activityCatalog;
            return this;
        }

        public Builder metrics(WorkflowMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder infrastructureRetry(InfrastructureRetry infrastructureRetry) {
            this.infrastructureRetry = infrastructureRetry;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder defaultReusePolicy(WorkflowIdReusePolicy defaultReusePolicy) {
            this.defaultReusePolicy = defaultReusePolicy;
            return this;
        }

        public Builder resultPollInterval(Duration resultPollInterval) {
            this.resultPollInterval = resultPollInterval;
            return this;
        }

        public WorkflowEngine build() {
            return new WorkflowEngine(this);
        }
    }
}
