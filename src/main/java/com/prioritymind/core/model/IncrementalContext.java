package com.prioritymind.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Partition of the task corpus into an already-summarized baseline and new tasks.
 *
 * @param baseline null on the first run
 */
public record IncrementalContext(
    @JsonProperty("is_first_run") boolean firstRun,
    BaselineSummary baseline,
    @JsonProperty("new_tasks") List<TaskSummary> newTasks,
    @JsonProperty("all_tasks") List<TaskSummary> allTasks,
    @JsonProperty("token_savings_estimate") int tokenSavingsEstimate
) implements Serializable {}
