package com.recursa.cli;

import com.recursa.core.engine.AgentRuntime;
import com.recursa.core.events.EventBus;
import com.recursa.core.model.TaskOutcome;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: recursa run "&lt;input&gt;"
 * <p>
 * Starts the root agent on the input and prints events as frames are pushed,
 * consolidated and popped.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Start a task")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Task input for the root agent")
    private String input;

    @Option(names = {"--task-id", "-t"}, description = "Explicit task id (default: derived from the input)")
    private String taskId;

    @Option(names = {"--quiet", "-q"}, description = "Do not print execution events")
    private boolean quiet;

    @Option(names = {"--events", "-e"}, description = "Only print events of this family, e.g. consolidation or frame")
    private String events;

    private final AgentRuntime runtime;
    private final EventBus eventBus;

    public RunCommand(AgentRuntime runtime, EventBus eventBus) {
        this.runtime = runtime;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        String id = taskId == null || taskId.isBlank() ? runtime.taskIdFor(input) : taskId;
        EventBus.Subscription subscription = quiet ? () -> { }
                : eventBus.subscribe(id, ConsoleOutput.eventFamily(events), ConsoleOutput::event);
        try {
            TaskOutcome outcome = runtime.start(id, input);
            ConsoleOutput.outcome(outcome);
            return outcome.completed() ? 0 : 1;
        } finally {
            subscription.unsubscribe();
        }
    }
}
