package com.prioritymind.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.prioritymind.core.model.Task;
import com.prioritymind.core.model.TaskSummary;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/sessions/{id}/prioritize.
 *
 * @param outcome       desired outcome; nullable after the first run
 * @param tasks         dependency graph; nullable, keeps the stored one
 * @param taskSummaries tasks to rank; nullable, keeps the stored ones
 */
public record PrioritizeRequest(
    String outcome,
    List<Task> tasks,
    @JsonProperty("task_summaries") List<TaskSummary> taskSummaries
) {}
