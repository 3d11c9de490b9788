package com.recursa.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command. Routes to subcommands: run, resume, status, history.
 */
@Command(
        name = "recursa",
        mixinStandardHelpOptions = true,
        version = "Recursa 0.1.0",
        description = "Hierarchical agent runtime with consolidation and crash-safe resume",
        subcommands = {
                RunCommand.class,
                ResumeCommand.class,
                StatusCommand.class,
                HistoryCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class RecursaCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
