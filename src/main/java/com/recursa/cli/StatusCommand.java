package com.recursa.cli;

import com.recursa.core.model.AgentFrame;
import com.recursa.core.model.FrameStatus;
import com.recursa.core.persistence.PersistedTaskState;
import com.recursa.core.persistence.TaskStateQueryService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: recursa status &lt;task-id&gt;
 * <p>
 * Shows the persisted stack and the hierarchy tree of a task.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show task status")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    private final TaskStateQueryService queryService;

    public StatusCommand(TaskStateQueryService queryService) {
        this.queryService = queryService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        var stateOpt = queryService.getLatestState(taskId);
        if (stateOpt.isEmpty()) {
            ConsoleOutput.error("Task not found: " + taskId);
            return;
        }
        PersistedTaskState state = stateOpt.get();

        System.out.println();
        System.out.println("TASK " + state.taskId());
        System.out.println("Input: " + ConsoleOutput.truncate(state.initialInput(), 80));
        System.out.println("Root agent: " + state.rootAgent() + "   (version " + state.version()
                + ", updated " + state.updatedAt() + ")");

        FrameStatus status = state.taskStatus();
        if (status == FrameStatus.COMPLETED) {
            ConsoleOutput.success("Status: " + status);
        } else if (status == FrameStatus.FAILED) {
            ConsoleOutput.error("Status: " + status);
        } else {
            ConsoleOutput.info("Status: " + status + " (resume with: recursa resume " + state.taskId() + ")");
        }

        if (!state.stack().isEmpty()) {
            System.out.println();
            System.out.println("STACK (top last):");
            for (AgentFrame frame : state.stack()) {
                var history = state.histories().get(frame.agentId());
                int facts = history != null ? history.facts().size() : 0;
                int turns = history != null ? history.turnsCompleted() : 0;
                System.out.printf("  L%-3d %-40s %4d actions %4d turns%n", frame.level(), frame.agentId(), facts, turns);
            }
        }

        System.out.println();
        System.out.println("HIERARCHY:");
        queryService.hierarchyTree(taskId).forEach(ConsoleOutput::hierarchyEntry);
    }
}
