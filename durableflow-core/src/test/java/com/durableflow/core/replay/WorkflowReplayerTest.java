package com.durableflow.core.replay;

import com.durableflow.core.exception.NonDeterminismException;
import com.durableflow.core.exception.NotFoundException;
import com.durableflow.core.model.Event;
import com.durableflow.core.model.FailureDetail;
import com.durableflow.core.model.WorkflowStatus;
import com.durableflow.core.test.HistoryBuilder;
import com.durableflow.core.workflow.ActivityFailedException;
import com.durableflow.core.workflow.ActivityHandle;
import com.durableflow.core.workflow.WorkflowRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowReplayerTest {

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    private WorkflowReplayer replayer;

    @BeforeEach
    void setUp() {
        WorkflowRegistry registry = new WorkflowRegistry();
        registry.register("two-step", (ctx, input) -> {
            JsonNode first = ctx.executeActivity("first", input);
            JsonNode second = ctx.executeActivity("second", first);
            ObjectNode out = JSON.objectNode();
            out.set("first", first);
            out.set("second", second);
            return out;
        });
        registry.register("fan-out", (ctx, input) -> {
            ActivityHandle a = ctx.scheduleActivity("left", input);
            ActivityHandle b = ctx.scheduleActivity("right", input);
            return JSON.arrayNode().add(a.get()).add(b.get());
        });
        registry.register("sleepy", (ctx, input) -> {
            ctx.sleep(Duration.ofMinutes(5));
            return ctx.executeActivity("after-sleep", TextNode.valueOf(ctx.currentTime().toString()));
        });
        registry.register("catching", (ctx, input) -> {
            try {
                return ctx.executeActivity("first", input);
            } catch (ActivityFailedException e) {
                return TextNode.valueOf("fallback:" + e.getFailure().category());
            }
        });
        registry.register("cancellable", (ctx, input) -> {
            JsonNode reserved = ctx.executeActivity("reserve", input);
            if (ctx.isCancelRequested()) {
                return TextNode.valueOf("released " + reserved.asText());
            }
            return ctx.executeActivity("charge", reserved);
        });
        registry.register("broken", (ctx, input) -> {
            throw new IllegalStateException("bad input");
        });
        replayer = new WorkflowReplayer(registry);
    }

    // ========== Progress ==========

    @Test
    @DisplayName("New run schedules its first activity")
    void freshRun_shouldScheduleFirstActivity() {
        ReplayResult result = replayer.replay(
            HistoryBuilder.started("run-1", "two-step", TextNode.valueOf("in")).build());

        assertThat(result.state().status()).isEqualTo(WorkflowStatus.RUNNING);
        assertThat(result.commands()).containsExactly(
            new Command.ScheduleActivity("1", "first", TextNode.valueOf("in"), null));
    }

    @Test
    @DisplayName("History ending in an unanswered ACTIVITY_SCHEDULED yields RUNNING and no commands")
    void outstandingActivity_shouldWait() {
        ReplayResult result = replayer.replay(HistoryBuilder.started("run-1", "two-step", TextNode.valueOf("in"))
            .scheduled("1", "first", TextNode.valueOf("in"))
            .build());

        assertThat(result.state().status()).isEqualTo(WorkflowStatus.RUNNING);
        assertThat(result.commands()).isEmpty();
        assertThat(result.isWaiting()).isTrue();
    }

    @Test
    @DisplayName("Completed activity feeds the next one")
    void completedActivity_shouldScheduleNext() {
        ReplayResult result = replayer.replay(HistoryBuilder.started("run-1", "two-step", TextNode.valueOf("in"))
            .scheduled("1", "first", TextNode.valueOf("in"))
            .completed("1", TextNode.valueOf("A"))
            .build());

        assertThat(result.commands()).containsExactly(
            new Command.ScheduleActivity("2", "second", TextNode.valueOf("A"), null));
    }

    @Test
    @DisplayName("Run completes with the composition of both results")
    void allActivitiesDone_shouldComplete() {
        ReplayResult result = replayer.replay(HistoryBuilder.started("run-1", "two-step", TextNode.valueOf("in"))
            .scheduled("1", "first", TextNode.valueOf("in"))
            .completed("1", TextNode.valueOf("A"))
            .scheduled("2", "second", TextNode.valueOf("A"))
            .completed("2", TextNode.valueOf("B"))
            .build());

        ObjectNode expected = JSON.objectNode();
        expected.put("first", "A");
        expected.put("second", "B");
        assertThat(result.commands()).containsExactly(new Command.CompleteWorkflow(expected));
        assertThat(result.closesRun()).isTrue();
    }

    @Test
    @DisplayName("Parallel activities are scheduled in one decision")
    void fanOut_shouldScheduleBoth() {
        ReplayResult first = replayer.replay(HistoryBuilder.started("run-1", "fan-out", TextNode.valueOf("x")).build());

        assertThat(first.commands()).extracting(c -> ((Command.ScheduleActivity) c).activityId())
            .containsExactly("1", "2");

        ReplayResult partial = replayer.replay(HistoryBuilder.started("run-1", "fan-out", TextNode.valueOf("x"))
            .scheduled("1", "left", TextNode.valueOf("x"))
            .scheduled("2", "right", TextNode.valueOf("x"))
            .completed("1", TextNode.valueOf("L"))
            .build());

        assertThat(partial.commands()).isEmpty();
    }

    // ========== Timers ==========

    @Test
    @DisplayName("Sleep starts a timer, and fired timers advance logical time")
    void sleep_shouldUseDurableTimer() {
        ReplayResult start = replayer.replay(HistoryBuilder.started("run-1", "sleepy", null).build());
        assertThat(start.commands()).containsExactly(new Command.StartTimer("timer-1", Duration.ofMinutes(5)));

        ReplayResult waiting = replayer.replay(HistoryBuilder.started("run-1", "sleepy", null)
            .timerStarted("timer-1", Duration.ofMinutes(5))
            .build());
        assertThat(waiting.commands()).isEmpty();

        ReplayResult fired = replayer.replay(HistoryBuilder.started("run-1", "sleepy", null)
            .timerStarted("timer-1", Duration.ofMinutes(5))
            .after(Duration.ofMinutes(6))
            .timerFired("timer-1")
            .build());
        String logicalTime = HistoryBuilder.START.plus(Duration.ofMinutes(5)).toString();
        assertThat(fired.commands()).containsExactly(
            new Command.ScheduleActivity("1", "after-sleep", TextNode.valueOf(logicalTime), null));
    }

    // ========== Failures ==========

    @Test
    @DisplayName("Uncaught terminal activity failure fails the run with its detail")
    void terminalActivityFailure_shouldFailWorkflow() {
        FailureDetail failure = FailureDetail.of("INVALID_CARD", "card declined");
        ReplayResult result = replayer.replay(HistoryBuilder.started("run-1", "two-step", null)
            .scheduled("1", "first", null)
            .failed("1", failure)
            .build());

        assertThat(result.commands()).containsExactly(new Command.FailWorkflow(failure));
    }

    @Test
    @DisplayName("Workflow code may catch activity failures")
    void caughtActivityFailure_shouldComplete() {
        ReplayResult result = replayer.replay(HistoryBuilder.started("run-1", "catching", null)
            .scheduled("1", "first", null)
            .failed("1", FailureDetail.of("INVALID_CARD", "declined"))
            .build());

        assertThat(result.commands()).containsExactly(
            new Command.CompleteWorkflow(TextNode.valueOf("fallback:INVALID_CARD")));
    }

    @Test
    @DisplayName("Exception in workflow code fails the run")
    void workflowException_shouldFailWorkflow() {
        ReplayResult result = replayer.replay(HistoryBuilder.started("run-1", "broken", null).build());

        Command.FailWorkflow fail = (Command.FailWorkflow) result.commands().get(0);
        assertThat(fail.failure().category()).isEqualTo(FailureDetail.WORKFLOW_ERROR);
        assertThat(fail.failure().message()).contains("bad input");
    }

    @Test
    @DisplayName("Cancellation request steers the run to FailWorkflow(CANCELLED)")
    void cancelRequested_shouldFailWithCancelled() {
        ReplayResult result = replayer.replay(HistoryBuilder.started("run-1", "two-step", null)
            .scheduled("1", "first", null)
            .cancelRequested("no longer needed")
            .completed("1", TextNode.valueOf("A"))
            .build());

        assertThat(result.commands()).containsExactly(
            new Command.FailWorkflow(FailureDetail.of(FailureDetail.CANCELLED, "no longer needed")));
    }

    @Test
    @DisplayName("Workflow code sees the cancellation and closes the run itself")
    void cancelRequested_shouldBeVisibleToWorkflowCode() {
        ReplayResult result = replayer.replay(HistoryBuilder.started("run-1", "cancellable", null)
            .scheduled("1", "reserve", null)
            .cancelRequested("stop")
            .completed("1", TextNode.valueOf("seat-7"))
            .build());

        assertThat(result.commands()).containsExactly(
            new Command.CompleteWorkflow(TextNode.valueOf("released seat-7")));
    }

    @Test
    @DisplayName("Cancellation while an activity is in flight waits for its outcome")
    void cancelRequested_whileActivityInFlight_shouldWait() {
        ReplayResult result = replayer.replay(HistoryBuilder.started("run-1", "cancellable", null)
            .scheduled("1", "reserve", null)
            .cancelRequested("stop")
            .build());

        assertThat(result.state().status()).isEqualTo(WorkflowStatus.RUNNING);
        assertThat(result.commands()).isEmpty();
    }

    @Test
    @DisplayName("Cancellation while the code only waits on a timer fails the run")
    void cancelRequested_whileSleeping_shouldFailWithCancelled() {
        ReplayResult result = replayer.replay(HistoryBuilder.started("run-1", "sleepy", null)
            .timerStarted("timer-1", Duration.ofMinutes(5))
            .cancelRequested("stop")
            .build());

        assertThat(result.commands()).containsExactly(
            new Command.FailWorkflow(FailureDetail.of(FailureDetail.CANCELLED, "stop")));
    }

    @Test
    @DisplayName("Without a cancellation the same code carries on")
    void noCancel_shouldContinue() {
        ReplayResult result = replayer.replay(HistoryBuilder.started("run-1", "cancellable", null)
            .scheduled("1", "reserve", null)
            .completed("1", TextNode.valueOf("seat-7"))
            .build());

        assertThat(result.commands()).containsExactly(
            new Command.ScheduleActivity("2", "charge", TextNode.valueOf("seat-7"), null));
    }

    @Test
    @DisplayName("Closed run yields no commands")
    void closedRun_shouldYieldNothing() {
        ReplayResult result = replayer.replay(HistoryBuilder.started("run-1", "two-step", null)
            .workflowCompleted(TextNode.valueOf("done"))
            .build());

        assertThat(result.state().status()).isEqualTo(WorkflowStatus.COMPLETED);
        assertThat(result.commands()).isEmpty();
    }

    // ========== Nondeterminism ==========

    @Test
    @DisplayName("Activity type differing from history is detected")
    void differentActivityType_shouldBeDetected() {
        List<Event> history = HistoryBuilder.started("run-1", "two-step", null)
            .scheduled("1", "something-else", null)
            .build();

        assertThatThrownBy(() -> replayer.replay(history))
            .isInstanceOf(NonDeterminismException.class)
            .hasMessageContaining("something-else");
    }

    @Test
    @DisplayName("Recorded activity the code no longer schedules is detected")
    void unconsumedHistory_shouldBeDetected() {
        List<Event> history = HistoryBuilder.started("run-1", "two-step", null)
            .scheduled("1", "first", null)
            .completed("1", TextNode.valueOf("A"))
            .scheduled("2", "second", TextNode.valueOf("A"))
            .completed("2", TextNode.valueOf("B"))
            .scheduled("3", "third", null)
            .build();

        assertThatThrownBy(() -> replayer.replay(history))
            .isInstanceOf(NonDeterminismException.class)
            .hasMessageContaining("third");
    }

    @Test
    void unknownWorkflowType_shouldBeRejected() {
        assertThatThrownBy(() -> replayer.replay(HistoryBuilder.started("run-1", "unknown", null).build()))
            .isInstanceOf(NotFoundException.class);
    }
}
