package com.durableflow.core.replay;

import com.durableflow.core.model.WorkflowRunState;
import java.util.List;

/**
 * Outcome of a replay: the state folded from history and the new commands.
 * An empty command list means the run is waiting on an outstanding activity or timer.
 */
public record ReplayResult(WorkflowRunState state, List<Command> commands) {

    public ReplayResult {
        commands = List.copyOf(commands);
    }

    public boolean isWaiting() {
        return commands.isEmpty();
    }

    public boolean closesRun() {
        return commands.stream().anyMatch(Command::closesRun);
    }
}
