package com.recursa.cli;

import com.recursa.core.persistence.PersistedTaskState;
import com.recursa.core.persistence.TaskStateQueryService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: recursa history
 * <p>
 * Lists known tasks as a table: Task ID | Status | Frames | Input (truncated).
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List known tasks")
@Component
public class HistoryCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    private final TaskStateQueryService queryService;

    public HistoryCommand(TaskStateQueryService queryService) {
        this.queryService = queryService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<String> taskIds = queryService.listTaskIds();
        if (taskIds.isEmpty()) {
            ConsoleOutput.info("No tasks found.");
            return;
        }
        List<String> display = taskIds.size() > limit
                ? taskIds.subList(taskIds.size() - limit, taskIds.size())
                : taskIds;

        ConsoleOutput.info("Tasks (" + display.size() + " of " + taskIds.size() + "):");
        System.out.println();
        System.out.printf("  %-44s %-10s %-7s %s%n", "TASK ID", "STATUS", "FRAMES", "INPUT");
        System.out.println("  " + "-".repeat(90));

        for (String taskId : display) {
            var stateOpt = queryService.getLatestState(taskId);
            if (stateOpt.isPresent()) {
                PersistedTaskState state = stateOpt.get();
                System.out.printf("  %-44s %-10s %-7d %s%n", taskId, state.taskStatus(),
                        state.hierarchy().size(), ConsoleOutput.truncate(state.initialInput(), 30));
            } else {
                System.out.printf("  %-44s %-10s %-7s %s%n", taskId, "UNKNOWN", "-", "-");
            }
        }
    }
}
