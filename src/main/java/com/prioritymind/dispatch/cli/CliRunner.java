package com.prioritymind.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the picocli command tree inside the Spring context and hands its exit code
 * back to Spring Boot.
 * <p>
 * Exit codes: 0 success, 1 a cycle was found, 2 unusable input or an unexpected
 * failure. Unexpected failures print one error line instead of a stack trace.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    static final int EXIT_FAILURE = 2;

    private final PrioritymindCommand prioritymindCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(PrioritymindCommand prioritymindCommand, IFactory factory) {
        this.prioritymindCommand = prioritymindCommand;
        this.factory = factory;
    }

    /**
     * True when the subcommand is {@code serve}. Only the first positional argument
     * counts, so a task file that happens to be named "serve" is not mistaken for it.
     */
    public static boolean isServeCommand(String... args) {
        for (String arg : args) {
            if (!arg.startsWith("-")) {
                return "serve".equals(arg);
            }
        }
        return false;
    }

    static CommandLine configure(CommandLine commandLine) {
        return commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            log.debug("Command {} failed", cmd.getCommandName(), ex);
            ConsoleOutput.error(cmd.getCommandName() + " failed: " + ex.getMessage());
            return EXIT_FAILURE;
        });
    }

    @Override
    public void run(String... args) {
        // The embedded web server keeps the JVM alive in serve mode; picocli would return at once.
        if (isServeCommand(args)) {
            return;
        }
        exitCode = configure(new CommandLine(prioritymindCommand, factory)).execute(args);
        log.debug("CLI finished with exit code {}", exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
