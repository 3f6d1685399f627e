package com.prioritymind.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command. Routes to check-cycle, context and serve.
 */
@Command(
        name = "prioritymind",
        mixinStandardHelpOptions = true,
        version = "Prioritymind 0.1.0",
        description = "Task-graph maintenance and reflection-aware prioritization",
        subcommands = {
                CheckCycleCommand.class,
                ContextCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class PrioritymindCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
