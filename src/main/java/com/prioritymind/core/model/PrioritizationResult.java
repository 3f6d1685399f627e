package com.prioritymind.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Structured output from the planner for one prioritization pass.
 *
 * @param orderedTaskIds   included tasks in priority order
 * @param confidenceScores per-task confidence in [0,1]
 * @param correctionsMade  free-text note on what the planner changed; long notes signal uncertainty
 * @param confidence       overall confidence in [0,1]
 */
public record PrioritizationResult(
    @JsonProperty("ordered_task_ids") List<String> orderedTaskIds,
    @JsonProperty("confidence_scores") Map<String, Double> confidenceScores,
    @JsonProperty("included_tasks") List<IncludedTask> includedTasks,
    @JsonProperty("excluded_tasks") List<ExcludedTask> excludedTasks,
    @JsonProperty("corrections_made") String correctionsMade,
    double confidence
) implements Serializable {

    public PrioritizationResult {
        orderedTaskIds = orderedTaskIds == null ? List.of() : orderedTaskIds;
        confidenceScores = confidenceScores == null ? Map.of() : confidenceScores;
        includedTasks = includedTasks == null ? List.of() : includedTasks;
        excludedTasks = excludedTasks == null ? List.of() : excludedTasks;
    }

    public record IncludedTask(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("inclusion_reason") String inclusionReason,
        @JsonProperty("alignment_score") int alignmentScore
    ) implements Serializable {}

    public record ExcludedTask(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("task_text") String taskText,
        @JsonProperty("exclusion_reason") String exclusionReason,
        @JsonProperty("alignment_score") int alignmentScore
    ) implements Serializable {}
}
