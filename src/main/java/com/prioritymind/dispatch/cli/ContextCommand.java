package com.prioritymind.dispatch.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prioritymind.core.context.IncrementalContextBuilder;
import com.prioritymind.core.context.IncrementalContextFormatter;
import com.prioritymind.core.model.IncrementalContext;
import com.prioritymind.core.model.TaskSummary;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: prioritymind context &lt;tasks.json&gt; [--baseline-doc ID]... [--baseline-created-at TS]
 * <p>
 * Prints the planner context that would be sent for the given task summaries
 * and baseline, with the estimated token savings.
 */
@Command(name = "context", mixinStandardHelpOptions = true,
        description = "Preview the incremental planner context for a task file")
@Component
public class ContextCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "JSON file containing an array of task summaries")
    private Path tasksFile;

    @Option(names = "--baseline-doc", description = "Document id covered by the baseline (repeatable)")
    private List<String> baselineDocs = new ArrayList<>();

    @Option(names = "--baseline-created-at", description = "ISO-8601 timestamp of the baseline")
    private String baselineCreatedAt;

    private final ObjectMapper objectMapper;
    private final IncrementalContextBuilder builder;
    private final IncrementalContextFormatter formatter;

    public ContextCommand(ObjectMapper objectMapper, IncrementalContextBuilder builder,
                          IncrementalContextFormatter formatter) {
        this.objectMapper = objectMapper;
        this.builder = builder;
        this.formatter = formatter;
    }

    @Override
    public Integer call() {
        List<TaskSummary> tasks;
        try {
            tasks = objectMapper.readValue(tasksFile.toFile(), new TypeReference<List<TaskSummary>>() {});
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read " + tasksFile + ": " + e.getMessage());
            return 2;
        }

        IncrementalContext context = builder.build(tasks, baselineDocs, baselineCreatedAt);
        var prompt = formatter.buildPromptContext(context);

        ConsoleOutput.printBanner();
        ConsoleOutput.info(context.firstRun()
                ? "First run: all " + prompt.taskCount() + " task(s) are new"
                : prompt.newTaskCount() + " new of " + prompt.taskCount() + " task(s), ~"
                        + context.tokenSavingsEstimate() + " tokens saved");
        ConsoleOutput.section("BASELINE");
        System.out.println(prompt.baselineSummary());
        ConsoleOutput.section("NEW TASKS");
        System.out.println(prompt.newTasksText());
        return 0;
    }
}
