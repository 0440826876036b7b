package com.durableflow.core.replay;

import com.durableflow.core.exception.NonDeterminismException;
import com.durableflow.core.model.ActivityInvocation;
import com.durableflow.core.model.Event;
import com.durableflow.core.model.FailureDetail;
import com.durableflow.core.model.WorkflowRunState;
import com.durableflow.core.workflow.ActivityFailedException;
import com.durableflow.core.workflow.Workflow;
import com.durableflow.core.workflow.WorkflowRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Deterministic workflow state machine.
 *
 * {@code replay(history) -> (state, commands)} re-executes the run's workflow code from
 * the start against its recorded history. Activities are never executed here: their
 * recorded outcomes are served back to the code. No I/O, no wall clock; the same
 * history always yields the same commands.
 *
 * <ul>
 *   <li>Closed run: its terminal state and no commands</li>
 *   <li>Cancellation requested: the code runs with {@code isCancelRequested()} true; if it
 *       returns or fails on its own that outcome closes the run. While an activity it already
 *       scheduled is still outstanding and it asks for nothing new, the run waits for that
 *       outcome; otherwise a single FailWorkflow(CANCELLED) and nothing new is scheduled</li>
 *   <li>Code waits on an outstanding activity or timer: RUNNING plus whatever new
 *       activities or timers it requested before waiting (possibly none)</li>
 *   <li>Code returns: CompleteWorkflow; an uncaught activity failure or other
 *       exception: FailWorkflow</li>
 * </ul>
 */
public class WorkflowReplayer {

    private static final Logger log = LoggerFactory.getLogger(WorkflowReplayer.class);

    private final WorkflowRegistry registry;

    public WorkflowReplayer(WorkflowRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param history The run's full history, in order
     * @throws NonDeterminismException when the code contradicts history
     */
    public ReplayResult replay(List<Event> history) {
        WorkflowRunState state = RunStateProjector.project(history);

        if (state.isClosed()) {
            return new ReplayResult(state, List.of());
        }
        Workflow workflow = registry.get(state.workflowType()).workflow();
        ReplayWorkflowContext context = new ReplayWorkflowContext(state);
        JsonNode input = state.input() == null ? null : state.input().deepCopy();

        Command closing;
        try {
            JsonNode output = workflow.run(context, input);
            closing = new Command.CompleteWorkflow(output);
        } catch (DecisionSuspended suspended) {
            if (state.cancelRequested()) {
                if (context.commands().isEmpty() && hasOutstandingActivity(state)) {
                    log.debug("Run {} cancelling once in-flight activities report", state.runId());
                    return new ReplayResult(state, List.of());
                }
                return new ReplayResult(state, List.of(cancelled(state)));
            }
            log.debug("Run {} waiting at version {} with {} new commands",
                state.runId(), state.version(), context.commands().size());
            return new ReplayResult(state, context.commands());
        } catch (ActivityFailedException e) {
            closing = new Command.FailWorkflow(e.getFailure());
        } catch (NonDeterminismException e) {
            throw e;
        } catch (RuntimeException e) {
            closing = new Command.FailWorkflow(FailureDetail.of(
                FailureDetail.WORKFLOW_ERROR, e.getClass().getSimpleName() + ": " + e.getMessage()));
        }

        // Activities or timers requested on the way out are abandoned with the run.
        context.verifyHistoryConsumed();
        return new ReplayResult(state, List.of(closing));
    }

    private static boolean hasOutstandingActivity(WorkflowRunState state) {
        return state.invocations().values().stream().anyMatch(ActivityInvocation::isOutstanding);
    }

    private static Command cancelled(WorkflowRunState state) {
        String reason = state.cancelReason() != null ? state.cancelReason() : "Cancellation requested";
        return new Command.FailWorkflow(FailureDetail.of(FailureDetail.CANCELLED, reason));
    }
}
