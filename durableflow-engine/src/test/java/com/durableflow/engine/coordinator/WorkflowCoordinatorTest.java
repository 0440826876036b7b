package com.durableflow.engine.coordinator;

import com.durableflow.core.exception.AlreadyExistsException;
import com.durableflow.core.exception.InvalidStateTransitionException;
import com.durableflow.core.exception.NotFoundException;
import com.durableflow.core.model.DurableTimer;
import com.durableflow.core.model.Event;
import com.durableflow.core.model.EventType;
import com.durableflow.core.model.FailureDetail;
import com.durableflow.core.model.RunRecord;
import com.durableflow.core.model.Task;
import com.durableflow.core.model.WorkflowIdReusePolicy;
import com.durableflow.core.model.WorkflowOptions;
import com.durableflow.core.model.WorkflowStatus;
import com.durableflow.core.test.TimeController;
import com.durableflow.core.workflow.WorkflowRegistry;
import com.durableflow.engine.WorkflowEngine;
import com.durableflow.engine.service.WorkflowService;
import com.durableflow.engine.service.WorkflowService.StartWorkflowRequest;
import com.durableflow.engine.service.WorkflowService.WorkflowResult;
import com.durableflow.engine.service.WorkflowService.WorkflowStatusView;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the submission interface and operator actions.
 */
class WorkflowCoordinatorTest {

    private static final String QUEUE = "decisions";
    private static final Duration VT = Duration.ofSeconds(30);

    private TimeController time;
    private WorkflowEngine engine;
    private WorkflowService service;

    @BeforeEach
    void setUp() {
        time = new TimeController(Instant.parse("2024-01-15T10:00:00Z"));
        WorkflowRegistry workflows = new WorkflowRegistry();
        WorkflowOptions options = new WorkflowOptions(QUEUE, Duration.ofHours(1));
        workflows.register("echo", (ctx, input) -> input, options);
        workflows.register("reminder", (ctx, input) -> {
            ctx.sleep(Duration.ofMinutes(10));
            return TextNode.valueOf("reminded");
        }, options);
        engine = WorkflowEngine.builder()
            .workflowRegistry(workflows)
            .clock(time)
            .resultPollInterval(Duration.ofMillis(5))
            .build();
        service = engine.workflowService();
    }

    private String start(String type, String workflowId, WorkflowIdReusePolicy policy) {
        return service.startWorkflow(StartWorkflowRequest.of(type, TextNode.valueOf("payload"))
            .withWorkflowId(workflowId)
            .withIdReusePolicy(policy));
    }

    private void drainDecisions() {
        Task task;
        while ((task = engine.taskQueue().dequeue(QUEUE, VT, "worker-1").orElse(null)) != null) {
            engine.decisionCoordinator().processDecisionTask(task);
            engine.taskQueue().ack(task.handle());
        }
    }

    @Nested
    class Start {

        @Test
        @DisplayName("Start records WORKFLOW_STARTED and queues the first decision")
        void testStart() {
            String runId = start("echo", "order-1", null);

            List<Event> history = engine.runStore().history(runId);
            assertThat(history).extracting(Event::type).containsExactly(EventType.WORKFLOW_STARTED);
            assertThat(history.get(0).actorType()).isEqualTo(Event.ACTOR_USER);
            assertThat(engine.taskQueue().find(QUEUE, Task.decisionTaskId(runId))).isPresent();

            WorkflowStatusView status = service.getStatus("order-1");
            assertThat(status.status()).isEqualTo(WorkflowStatus.RUNNING);
            assertThat(status.runId()).isEqualTo(runId);
            assertThat(status.lastUpdated()).isEqualTo(time.now());
        }

        @Test
        @DisplayName("Missing workflow id is generated")
        void testGeneratedWorkflowId() {
            String runId = service.startWorkflow(StartWorkflowRequest.of("echo", null));

            RunRecord record = engine.runIndex().findByRunId(runId).orElseThrow();
            assertThat(record.workflowId()).isNotBlank();
        }

        @Test
        @DisplayName("Unknown workflow type is rejected")
        void testUnknownType() {
            assertThatThrownBy(() -> start("missing", "order-1", null))
                .isInstanceOf(NotFoundException.class);
            assertThat(engine.runIndex().countOpen()).isZero();
        }

        @Test
        @DisplayName("REJECT_DUPLICATE fails while a run is open and succeeds once it closed")
        void testRejectDuplicate() {
            String first = start("echo", "order-1", WorkflowIdReusePolicy.REJECT_DUPLICATE);

            assertThatThrownBy(() -> start("echo", "order-1", WorkflowIdReusePolicy.REJECT_DUPLICATE))
                .isInstanceOf(AlreadyExistsException.class)
                .hasMessageContaining(first);

            drainDecisions();
            String second = start("echo", "order-1", WorkflowIdReusePolicy.REJECT_DUPLICATE);
            assertThat(second).isNotEqualTo(first);
        }

        @Test
        @DisplayName("ALLOW_DUPLICATE starts another run that becomes current")
        void testAllowDuplicate() {
            String first = start("reminder", "order-1", WorkflowIdReusePolicy.ALLOW_DUPLICATE);
            String second = start("reminder", "order-1", null);

            assertThat(service.getStatus("order-1").runId()).isEqualTo(second);
            assertThat(service.listRuns("order-1")).extracting(RunRecord::runId).containsExactly(second, first);
            assertThat(service.describe(first).status()).isEqualTo(WorkflowStatus.RUNNING);
        }

        @Test
        @DisplayName("TERMINATE_IF_RUNNING terminates the open run first")
        void testTerminateIfRunning() {
            String first = start("reminder", "order-1", null);
            String second = start("reminder", "order-1", WorkflowIdReusePolicy.TERMINATE_IF_RUNNING);

            assertThat(service.describe(first).status()).isEqualTo(WorkflowStatus.TERMINATED);
            assertThat(service.getStatus("order-1").runId()).isEqualTo(second);
            assertThat(engine.runIndex().countOpen()).isEqualTo(1);
        }
    }

    @Nested
    class Queries {

        @Test
        @DisplayName("Unknown workflow ids and runs are reported as not found")
        void testNotFound() {
            assertThatThrownBy(() -> service.getStatus("nope")).isInstanceOf(NotFoundException.class);
            assertThatThrownBy(() -> service.describe("nope")).isInstanceOf(NotFoundException.class);
            assertThatThrownBy(() -> service.listRuns("nope")).isInstanceOf(NotFoundException.class);
        }

        @Test
        @DisplayName("GetResult with zero timeout returns immediately while the run is open")
        void testResultStillRunning() {
            start("echo", "order-1", null);

            WorkflowResult result = service.getResult("order-1", Duration.ZERO);

            assertThat(result.stillRunning()).isTrue();
            assertThat(result.output()).isNull();
        }

        @Test
        @DisplayName("GetResult returns the output of a completed run")
        void testResultCompleted() {
            start("echo", "order-1", null);
            drainDecisions();

            WorkflowResult result = service.getResult("order-1", Duration.ofSeconds(1));

            assertThat(result.succeeded()).isTrue();
            assertThat(result.output().asText()).isEqualTo("payload");
        }

        @Test
        @DisplayName("Status reports pending timers")
        void testPendingTimers() {
            start("reminder", "order-1", null);
            drainDecisions();

            WorkflowStatusView status = service.getStatus("order-1");
            assertThat(status.pendingTimers()).isEqualTo(1);
            assertThat(status.pendingActivities()).isZero();
        }
    }

    @Nested
    class OperatorActions {

        @Test
        @DisplayName("Cancellation is recorded once and fails the run as CANCELLED on the next decision")
        void testCancel() {
            String runId = start("reminder", "order-1", null);
            drainDecisions();

            service.requestCancellation("order-1", "customer changed their mind");
            service.requestCancellation("order-1", "again");

            assertThat(engine.runStore().history(runId))
                .filteredOn(e -> e.type() == EventType.WORKFLOW_CANCEL_REQUESTED)
                .hasSize(1);
            assertThat(service.getStatus("order-1").cancelRequested()).isTrue();

            drainDecisions();
            WorkflowResult result = service.getResult("order-1", Duration.ZERO);
            assertThat(result.status()).isEqualTo(WorkflowStatus.FAILED);
            assertThat(result.failure().category()).isEqualTo(FailureDetail.CANCELLED);
            assertThat(engine.timerRepository().countPending()).isZero();
        }

        @Test
        @DisplayName("Cancelling or terminating a closed run is an invalid transition")
        void testActionsOnClosedRun() {
            start("echo", "order-1", null);
            drainDecisions();

            assertThatThrownBy(() -> service.requestCancellation("order-1", "late"))
                .isInstanceOf(InvalidStateTransitionException.class);
            assertThatThrownBy(() -> service.terminate("order-1", "late"))
                .isInstanceOf(InvalidStateTransitionException.class);
        }

        @Test
        @DisplayName("Terminate closes the run and its index entry")
        void testTerminate() {
            String runId = start("reminder", "order-1", null);
            drainDecisions();

            service.terminate("order-1", "stuck");

            assertThat(service.getStatus("order-1").status()).isEqualTo(WorkflowStatus.TERMINATED);
            RunRecord record = engine.runIndex().findByRunId(runId).orElseThrow();
            assertThat(record.closeStatus()).isEqualTo(WorkflowStatus.TERMINATED);
            assertThat(engine.timerRepository().countPending()).isZero();
        }
    }

    @Nested
    class Callbacks {

        @Test
        @DisplayName("Firing a timer records TIMER_FIRED once and wakes the run")
        void testFireTimer() {
            String runId = start("reminder", "order-1", null);
            drainDecisions();
            time.advance(Duration.ofMinutes(10));
            DurableTimer due = engine.timerRepository().findDue(time.now(), 10).get(0);

            assertThat(engine.workflowCoordinator().fireTimer(due)).isTrue();
            assertThat(engine.workflowCoordinator().fireTimer(due)).isTrue();

            assertThat(engine.runStore().history(runId))
                .filteredOn(e -> e.type() == EventType.TIMER_FIRED)
                .hasSize(1);

            drainDecisions();
            WorkflowResult result = service.getResult("order-1", Duration.ZERO);
            assertThat(result.output().asText()).isEqualTo("reminded");
        }

        @Test
        @DisplayName("Runs are timed out only once past their execution timeout")
        void testTimeOutRun() {
            String runId = start("reminder", "order-1", null);

            assertThat(engine.workflowCoordinator().timeOutRun(runId)).isFalse();

            time.advance(Duration.ofHours(1));
            assertThat(engine.workflowCoordinator().timeOutRun(runId)).isTrue();
            assertThat(engine.workflowCoordinator().timeOutRun(runId)).isFalse();
            assertThat(service.describe(runId).status()).isEqualTo(WorkflowStatus.TIMED_OUT);
        }
    }
}
