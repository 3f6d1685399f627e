package com.prioritymind.dispatch.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prioritymind.core.graph.DependencyGraph;
import com.prioritymind.core.model.Task;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: prioritymind check-cycle &lt;tasks.json&gt;
 * <p>
 * Reads a JSON array of tasks and reports either a schedulable order or the
 * tasks caught in or behind a dependency cycle. Exits 1 when a cycle exists.
 */
@Command(name = "check-cycle", mixinStandardHelpOptions = true,
        description = "Check a task file for circular dependencies")
@Component
public class CheckCycleCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "JSON file containing an array of tasks")
    private Path tasksFile;

    private final ObjectMapper objectMapper;

    public CheckCycleCommand(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        List<Task> tasks;
        try {
            tasks = objectMapper.readValue(tasksFile.toFile(), new TypeReference<List<Task>>() {});
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read " + tasksFile + ": " + e.getMessage());
            return 2;
        }

        if (DependencyGraph.detectCycle(tasks)) {
            ConsoleOutput.error("Circular dependency detected among " + tasks.size() + " task(s)");
            System.out.println("  Unschedulable: " + String.join(", ", DependencyGraph.unschedulable(tasks)));
            return 1;
        }

        ConsoleOutput.success("No cycles in " + tasks.size() + " task(s)");
        System.out.println("  Order: " + String.join(" -> ", DependencyGraph.topologicalOrder(tasks)));
        return 0;
    }
}
