package com.prioritymind.core.session;

import com.prioritymind.core.model.Task;
import com.prioritymind.core.model.TaskSummary;

import java.util.List;

/**
 * Inputs for a full planning run. Null or empty fields fall back to what the
 * session already holds.
 *
 * @param tasks         dependency graph to store with the session
 * @param taskSummaries task corpus the planner ranks
 */
public record PrioritizeCommand(
    String outcome,
    List<Task> tasks,
    List<TaskSummary> taskSummaries
) {

    public PrioritizeCommand {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        taskSummaries = taskSummaries == null ? List.of() : List.copyOf(taskSummaries);
    }
}
