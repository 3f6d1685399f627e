package com.prioritymind.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Ordered plan produced by the last full planning pass. Never modified after creation;
 * adjusted plans are diffed against it. Repeated task ids keep their first position.
 *
 * @param createdAt when the planner produced it; null if unknown
 */
public record BaselinePlan(
    @JsonProperty("ordered_task_ids") List<String> orderedTaskIds,
    @JsonProperty("confidence_scores") Map<String, Double> confidenceScores,
    @JsonProperty("created_at") Instant createdAt
) implements Serializable {

    public BaselinePlan {
        orderedTaskIds = orderedTaskIds == null ? List.of() : List.copyOf(new LinkedHashSet<>(orderedTaskIds));
        confidenceScores = confidenceScores == null ? Map.of() : Map.copyOf(confidenceScores);
    }
}
