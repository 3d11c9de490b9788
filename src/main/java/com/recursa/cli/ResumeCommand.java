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
 * CLI command: recursa resume &lt;task-id&gt;
 * <p>
 * Continues a persisted task from the top of its stack.
 */
@Command(name = "resume", mixinStandardHelpOptions = true, description = "Resume an interrupted task")
@Component
public class ResumeCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    @Option(names = {"--quiet", "-q"}, description = "Do not print execution events")
    private boolean quiet;

    @Option(names = {"--events", "-e"}, description = "Only print events of this family, e.g. consolidation or frame")
    private String events;

    private final AgentRuntime runtime;
    private final EventBus eventBus;

    public ResumeCommand(AgentRuntime runtime, EventBus eventBus) {
        this.runtime = runtime;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Resuming task " + taskId + "...");
        EventBus.Subscription subscription = quiet ? () -> { }
                : eventBus.subscribe(taskId, ConsoleOutput.eventFamily(events), ConsoleOutput::event);
        try {
            TaskOutcome outcome = runtime.resume(taskId);
            ConsoleOutput.outcome(outcome);
            return outcome.completed() ? 0 : 1;
        } finally {
            subscription.unsubscribe();
        }
    }
}
