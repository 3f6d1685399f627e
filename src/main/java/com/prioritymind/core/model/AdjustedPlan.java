package com.prioritymind.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * A baseline plan re-ranked by active reflections.
 * <p>
 * {@code confidenceScores} is insertion-ordered by the adjusted ranking.
 */
public record AdjustedPlan(
    @JsonProperty("ordered_task_ids") List<String> orderedTaskIds,
    @JsonProperty("confidence_scores") Map<String, Double> confidenceScores,
    AdjustmentDiff diff,
    @JsonProperty("adjustment_metadata") AdjustmentMetadata metadata
) implements Serializable {

    public record AdjustmentDiff(
        List<MovedTask> moved,
        List<FilteredTask> filtered
    ) implements Serializable {

        public static AdjustmentDiff empty() {
            return new AdjustmentDiff(List.of(), List.of());
        }
    }

    /**
     * @param from 1-indexed rank in the baseline
     * @param to   1-indexed rank after adjustment
     */
    public record MovedTask(
        @JsonProperty("task_id") String taskId,
        int from,
        int to,
        String reason
    ) implements Serializable {}

    public record FilteredTask(
        @JsonProperty("task_id") String taskId,
        String reason
    ) implements Serializable {}

    public record ReflectionUsage(
        String id,
        String text,
        @JsonProperty("recency_weight") double recencyWeight,
        @JsonProperty("created_at") String createdAt
    ) implements Serializable {}

    public record AdjustmentMetadata(
        List<ReflectionUsage> reflections,
        @JsonProperty("tasks_moved") int tasksMoved,
        @JsonProperty("tasks_filtered") int tasksFiltered,
        @JsonProperty("duration_ms") long durationMs,
        List<String> warnings
    ) implements Serializable {}
}
