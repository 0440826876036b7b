package com.durableflow.api.config;

import com.durableflow.core.repository.EventLog;
import com.durableflow.core.repository.RunIndexRepository;
import com.durableflow.core.repository.TaskQueue;
import com.durableflow.core.repository.TimerRepository;
import com.durableflow.core.workflow.WorkflowRegistry;
import com.durableflow.engine.WorkflowEngine;
import com.durableflow.engine.health.EngineHealthIndicator;
import com.durableflow.engine.history.ExecutionHistoryService;
import com.durableflow.engine.metrics.MetricsConfiguration;
import com.durableflow.engine.metrics.WorkflowMetrics;
import com.durableflow.engine.persistence.InMemoryEventLog;
import com.durableflow.engine.persistence.InMemoryRunIndexRepository;
import com.durableflow.engine.persistence.InMemoryTaskQueue;
import com.durableflow.engine.persistence.InMemoryTimerRepository;
import com.durableflow.engine.persistence.jdbc.JdbcEventLog;
import com.durableflow.engine.persistence.jdbc.JdbcRunIndexRepository;
import com.durableflow.engine.persistence.jdbc.JdbcTaskQueue;
import com.durableflow.engine.persistence.jdbc.JdbcTimerRepository;
import com.durableflow.engine.service.WorkflowService;
import com.durableflow.examples.simple.SimpleWorkflowRegistration;
import com.durableflow.recovery.RecoveryEngine;
import com.durableflow.recovery.RecoveryOptions;
import com.durableflow.scheduler.TimerScheduler;
import com.durableflow.worker.ActivityRegistry;
import com.durableflow.worker.WorkerOptions;
import com.durableflow.worker.WorkerRuntime;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;

/**
 * Wires the engine, its stores and the background components (worker, timer scheduler,
 * recovery) into the application context.
 *
 * Persistence is picked by {@code durableflow.persistence}: {@code memory} keeps everything
 * in the JVM, {@code jdbc} uses the configured DataSource and the schema in
 * {@code durableflow-schema.sql}.
 */
@Configuration
@EnableConfigurationProperties(EngineProperties.class)
@Import(MetricsConfiguration.class)
public class EngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EngineConfiguration.class);

    @Bean
    public Clock engineClock() {
        return Clock.systemUTC();
    }

    // ========== Registration ==========

    @Bean
    public WorkflowRegistry workflowRegistry() {
        return new WorkflowRegistry();
    }

    @Bean
    public ActivityRegistry activityRegistry(WorkflowRegistry workflowRegistry, Clock engineClock) {
        ActivityRegistry activities = new ActivityRegistry();
        SimpleWorkflowRegistration.register(workflowRegistry, activities, engineClock);
        log.info("Registered workflows {} and activities {}",
            workflowRegistry.workflowTypes(), activities.activityTypes());
        return activities;
    }

    // ========== Persistence ==========

    @Configuration
    @ConditionalOnProperty(name = "durableflow.persistence", havingValue = "memory", matchIfMissing = true)
    static class InMemoryPersistence {

        @Bean
        public EventLog eventLog() {
            return new InMemoryEventLog();
        }

        @Bean
        public TaskQueue taskQueue(Clock engineClock) {
            return new InMemoryTaskQueue(engineClock);
        }

        @Bean
        public RunIndexRepository runIndexRepository() {
            return new InMemoryRunIndexRepository();
        }

        @Bean
        public TimerRepository timerRepository() {
            return new InMemoryTimerRepository();
        }
    }

    @Configuration
    @ConditionalOnProperty(name = "durableflow.persistence", havingValue = "jdbc")
    static class JdbcPersistence {

        @Bean
        public EventLog eventLog(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate,
                                 ObjectMapper objectMapper) {
            return new JdbcEventLog(jdbcTemplate, transactionTemplate, objectMapper);
        }

        @Bean
        public TaskQueue taskQueue(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate,
                                   ObjectMapper objectMapper, Clock engineClock) {
            return new JdbcTaskQueue(jdbcTemplate, transactionTemplate, objectMapper, engineClock);
        }

        @Bean
        public RunIndexRepository runIndexRepository(JdbcTemplate jdbcTemplate,
                                                     TransactionTemplate transactionTemplate) {
            return new JdbcRunIndexRepository(jdbcTemplate, transactionTemplate);
        }

        @Bean
        public TimerRepository timerRepository(JdbcTemplate jdbcTemplate) {
            return new JdbcTimerRepository(jdbcTemplate);
        }
    }

    // ========== Engine ==========

    @Bean
    public WorkflowEngine workflowEngine(
            EngineProperties properties,
            EventLog eventLog,
            TaskQueue taskQueue,
            RunIndexRepository runIndexRepository,
            TimerRepository timerRepository,
            WorkflowRegistry workflowRegistry,
            ActivityRegistry activityRegistry,
            WorkflowMetrics workflowMetrics,
            Clock engineClock) {
        WorkflowEngine engine = WorkflowEngine.builder()
            .eventLog(eventLog)
            .taskQueue(taskQueue)
            .runIndex(runIndexRepository)
            .timerRepository(timerRepository)
            .workflowRegistry(workflowRegistry)
            .activityCatalog(activityRegistry)
            .metrics(workflowMetrics)
            .clock(engineClock)
            .defaultReusePolicy(properties.defaultReusePolicy())
            .resultPollInterval(properties.resultPollInterval())
            .build();
        for (String queueName : properties.taskQueues()) {
            workflowMetrics.monitorQueueDepth(queueName, () -> taskQueue.depth(queueName));
        }
        log.info("Workflow engine ready ({} persistence, queues {})", properties.persistence(), properties.taskQueues());
        return engine;
    }

    @Bean
    public WorkflowService workflowService(WorkflowEngine workflowEngine) {
        return workflowEngine.workflowService();
    }

    @Bean
    public ExecutionHistoryService executionHistoryService(WorkflowEngine workflowEngine) {
        return workflowEngine.historyService();
    }

    @Bean
    public EngineHealthIndicator engineHealthIndicator(WorkflowEngine workflowEngine, EngineProperties properties) {
        return new EngineHealthIndicator(
            workflowEngine.taskQueue(),
            workflowEngine.runIndex(),
            workflowEngine.timerRepository(),
            properties.taskQueues());
    }

    // ========== Background Components ==========

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnProperty(name = "durableflow.worker.enabled", havingValue = "true", matchIfMissing = true)
    public WorkerRuntime workerRuntime(WorkflowEngine workflowEngine, ActivityRegistry activityRegistry,
                                       EngineProperties properties, ObjectMapper objectMapper) {
        EngineProperties.Worker worker = properties.worker();
        WorkerOptions.Builder options = WorkerOptions.builder()
            .taskQueues(properties.taskQueues())
            .maxConcurrentTasks(worker.maxConcurrentTasks())
            .pollInterval(worker.pollInterval())
            .leaseTimeout(worker.leaseTimeout())
            .heartbeatInterval(worker.heartbeatInterval())
            .conflictRedeliveryDelay(worker.conflictRedeliveryDelay())
            .shutdownTimeout(worker.shutdownTimeout());
        if (worker.workerId() != null && !worker.workerId().isBlank()) {
            options.workerId(worker.workerId());
        }
        return new WorkerRuntime(
            workflowEngine.taskQueue(),
            workflowEngine.decisionCoordinator(),
            workflowEngine.activityCoordinator(),
            activityRegistry,
            options.build(),
            objectMapper,
            workflowEngine.clock());
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnProperty(name = "durableflow.timers.enabled", havingValue = "true", matchIfMissing = true)
    public TimerScheduler timerScheduler(WorkflowEngine workflowEngine, EngineProperties properties) {
        return new TimerScheduler(
            workflowEngine.timerRepository(),
            workflowEngine.workflowCoordinator()::fireTimer,
            workflowEngine.clock(),
            properties.timers().pollInterval(),
            properties.timers().batchSize());
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnProperty(name = "durableflow.recovery.enabled", havingValue = "true", matchIfMissing = true)
    public RecoveryEngine recoveryEngine(WorkflowEngine workflowEngine, EngineProperties properties) {
        EngineProperties.Recovery recovery = properties.recovery();
        return RecoveryEngine.forEngine(workflowEngine, new RecoveryOptions(
            recovery.leaseCheckInterval(),
            recovery.runSweepInterval(),
            recovery.stallThreshold(),
            recovery.batchSize()));
    }
}
