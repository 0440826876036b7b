package com.durableflow.engine.persistence.jdbc;

import com.durableflow.core.exception.ConcurrencyConflictException;
import com.durableflow.core.exception.WorkerLeaseExpiredException;
import com.durableflow.core.model.DurableTimer;
import com.durableflow.core.model.Event;
import com.durableflow.core.model.EventPayloads;
import com.durableflow.core.model.EventType;
import com.durableflow.core.model.RunRecord;
import com.durableflow.core.model.Task;
import com.durableflow.core.model.TaskKind;
import com.durableflow.core.model.WorkflowOptions;
import com.durableflow.core.model.WorkflowStatus;
import com.durableflow.core.test.TimeController;
import com.durableflow.core.workflow.WorkflowRegistry;
import com.durableflow.engine.WorkflowEngine;
import com.durableflow.engine.coordinator.DecisionCoordinator.DecisionOutcome;
import com.durableflow.engine.service.WorkflowService.StartWorkflowRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the PostgreSQL-backed stores.
 * Skipped when Docker is not available.
 */
@Testcontainers(disabledWithoutDocker = true)
class JdbcPersistenceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15")
        .withDatabaseName("durableflow_test")
        .withUsername("test")
        .withPassword("test");

    private static JdbcTemplate jdbcTemplate;
    private static TransactionTemplate transactionTemplate;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final TimeController time = new TimeController(Instant.now().truncatedTo(ChronoUnit.MILLIS));

    private JdbcEventLog eventLog;
    private JdbcTaskQueue taskQueue;
    private JdbcRunIndexRepository runIndex;
    private JdbcTimerRepository timerRepository;

    @BeforeAll
    static void createSchema() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
            postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        new ResourceDatabasePopulator(new ClassPathResource("durableflow-schema.sql")).execute(dataSource);
        jdbcTemplate = new JdbcTemplate(dataSource);
        transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
    }

    @BeforeEach
    void setUp() {
        jdbcTemplate.execute("TRUNCATE workflow_events, task_queue, workflow_runs, durable_timers");
        eventLog = new JdbcEventLog(jdbcTemplate, transactionTemplate, objectMapper);
        taskQueue = new JdbcTaskQueue(jdbcTemplate, transactionTemplate, objectMapper, time);
        runIndex = new JdbcRunIndexRepository(jdbcTemplate, transactionTemplate);
        timerRepository = new JdbcTimerRepository(jdbcTemplate);
    }

    private Event timerFired(String runId, String timerId) {
        return Event.create(runId, EventType.TIMER_FIRED, time.now(),
            EventPayloads.timerFired(timerId), Event.ACTOR_SCHEDULER, "test");
    }

    // ========== Event log ==========

    @Test
    @DisplayName("Appends are sequenced and read back in order across pages")
    void testEventLogAppendAndRead() {
        long version = 0;
        for (int i = 0; i < 3; i++) {
            version = eventLog.append("run-1", version, List.of(timerFired("run-1", "a" + i), timerFired("run-1", "b" + i)));
        }

        List<Event> events = eventLog.read("run-1", 2).toList();
        assertThat(version).isEqualTo(6);
        assertThat(eventLog.currentVersion("run-1")).isEqualTo(6);
        assertThat(events).extracting(Event::sequenceNumber).containsExactly(3L, 4L, 5L, 6L);
        assertThat(events.get(0).payload().get("timerId").asText()).isEqualTo("a1");
        assertThat(events.get(0).timestamp()).isEqualTo(time.now());
    }

    @Test
    @DisplayName("Stale expected version is rejected without writing")
    void testEventLogConflict() {
        eventLog.append("run-1", 0, List.of(timerFired("run-1", "a")));

        assertThatThrownBy(() -> eventLog.append("run-1", 0, List.of(timerFired("run-1", "b"), timerFired("run-1", "c"))))
            .isInstanceOf(ConcurrencyConflictException.class);
        assertThat(eventLog.currentVersion("run-1")).isEqualTo(1);
    }

    // ========== Task queue ==========

    @Test
    @DisplayName("Leased task is hidden, redelivered after expiry, and stale acks are rejected")
    void testTaskQueueLeasing() {
        taskQueue.enqueue(Task.activity("q", "run-1", "wf-1", "1", 1,
            JsonNodeFactory.instance.objectNode().put("activityType", "charge"), time.now(), time.now()));
        taskQueue.enqueue(Task.activity("q", "run-1", "wf-1", "1", 1, null, time.now(), time.now()));

        Task first = taskQueue.dequeue("q", Duration.ofSeconds(30), "worker-a").orElseThrow();
        assertThat(first.payload().get("activityType").asText()).isEqualTo("charge");
        assertThat(taskQueue.dequeue("q", Duration.ofSeconds(30), "worker-b")).isEmpty();

        time.advanceSeconds(31);
        Task second = taskQueue.dequeue("q", Duration.ofSeconds(30), "worker-b").orElseThrow();
        assertThat(second.deliveryCount()).isEqualTo(2);

        assertThatThrownBy(() -> taskQueue.ack(first.handle())).isInstanceOf(WorkerLeaseExpiredException.class);
        taskQueue.ack(second.handle());
        assertThat(taskQueue.depth("q")).isZero();
    }

    @Test
    @DisplayName("Decision enqueued while leased survives the ack")
    void testTaskQueueRearm() {
        taskQueue.enqueue(Task.decision("q", "run-1", "wf-1", time.now()));
        Task leased = taskQueue.dequeue("q", Duration.ofSeconds(30), "worker-a").orElseThrow();

        taskQueue.enqueue(Task.decision("q", "run-1", "wf-1", time.now()));
        taskQueue.ack(leased.handle());

        assertThat(taskQueue.dequeue("q", Duration.ofSeconds(30), "worker-a")).isPresent();
    }

    @Test
    @DisplayName("Expired leases are reclaimed and heartbeats keep leases alive")
    void testTaskQueueReclaimAndExtend() {
        taskQueue.enqueue(Task.decision("q", "run-1", "wf-1", time.now()));
        taskQueue.enqueue(Task.decision("q", "run-2", "wf-2", time.now()));
        Task kept = taskQueue.dequeue("q", Duration.ofSeconds(30), "worker-a").orElseThrow();
        Task lost = taskQueue.dequeue("q", Duration.ofSeconds(30), "worker-a").orElseThrow();

        time.advanceSeconds(20);
        taskQueue.extendLease(kept.handle(), Duration.ofSeconds(30));
        time.advanceSeconds(20);

        List<Task> reclaimed = taskQueue.reclaimExpired(time.now(), 10);
        assertThat(reclaimed).extracting(Task::taskId).containsExactly(lost.taskId());
        assertThat(taskQueue.find("q", lost.taskId()).orElseThrow().isLeased()).isFalse();
        taskQueue.ack(kept.handle());
    }

    // ========== Run index and timers ==========

    @Test
    @DisplayName("Registering with rejectIfOpen reports the open run")
    void testRunIndex() {
        RunRecord first = RunRecord.open("order-1", "run-1", "order", "q", time.now());
        RunRecord second = RunRecord.open("order-1", "run-2", "order", "q", time.now());

        assertThat(runIndex.register(first, true)).isEmpty();
        assertThat(runIndex.register(second, true)).map(RunRecord::runId).contains("run-1");

        runIndex.markClosed("run-1", WorkflowStatus.COMPLETED, time.now());
        assertThat(runIndex.register(second, true)).isEmpty();
        assertThat(runIndex.findCurrent("order-1")).map(RunRecord::runId).contains("run-2");
        assertThat(runIndex.findByWorkflowId("order-1")).extracting(RunRecord::runId).containsExactly("run-2", "run-1");
        assertThat(runIndex.countOpen()).isEqualTo(1);
    }

    @Test
    @DisplayName("Timers are saved once and reported due until fired")
    void testTimers() {
        timerRepository.save(DurableTimer.create("run-1", "timer-1", time.now().plusSeconds(60), time.now()));
        timerRepository.save(DurableTimer.create("run-1", "timer-1", time.now().plusSeconds(60), time.now()));

        assertThat(timerRepository.findDue(time.now(), 10)).isEmpty();
        List<DurableTimer> due = timerRepository.findDue(time.now().plusSeconds(60), 10);
        assertThat(due).hasSize(1);

        timerRepository.markFired("run-1", "timer-1", time.now());
        assertThat(timerRepository.findDue(time.now().plusSeconds(60), 10)).isEmpty();
        assertThat(timerRepository.countPending()).isZero();
    }

    // ========== Engine over JDBC ==========

    @Test
    @DisplayName("A run completes end to end over the JDBC stores")
    void testEngineOverJdbc() {
        WorkflowRegistry workflows = new WorkflowRegistry();
        workflows.register("shout", (ctx, input) -> TextNode.valueOf(ctx.executeActivity("upper", input).asText() + "!"),
            new WorkflowOptions("q", null));
        WorkflowEngine engine = WorkflowEngine.builder()
            .eventLog(eventLog)
            .taskQueue(taskQueue)
            .runIndex(runIndex)
            .timerRepository(timerRepository)
            .workflowRegistry(workflows)
            .clock(time)
            .build();

        engine.workflowService().startWorkflow(StartWorkflowRequest.of("shout", TextNode.valueOf("hi")).withWorkflowId("w-1"));
        List<DecisionOutcome> outcomes = new ArrayList<>();
        Optional<Task> next;
        while ((next = taskQueue.dequeue("q", Duration.ofSeconds(30), "worker-a")).isPresent()) {
            Task task = next.get();
            if (task.kind() == TaskKind.DECISION) {
                outcomes.add(engine.decisionCoordinator().processDecisionTask(task));
            } else {
                engine.activityCoordinator().beginAttempt(task).ifPresent(attempt -> engine.activityCoordinator()
                    .completeAttempt(attempt, TextNode.valueOf(attempt.input().asText().toUpperCase())));
            }
            taskQueue.ack(task.handle());
        }

        assertThat(outcomes).containsExactly(DecisionOutcome.APPLIED, DecisionOutcome.APPLIED);
        assertThat(engine.workflowService().getResult("w-1", Duration.ZERO).output().asText()).isEqualTo("HI!");
        assertThat(runIndex.countOpen()).isZero();
    }
}
