package com.prioritymind.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Compact description of the tasks the planner has already seen.
 *
 * @param ageHours hours since {@code createdAt}; null when the timestamp does not parse
 */
public record BaselineSummary(
    @JsonProperty("document_ids") List<String> documentIds,
    @JsonProperty("document_count") int documentCount,
    @JsonProperty("task_count") int taskCount,
    @JsonProperty("top_task_ids") List<String> topTaskIds,
    @JsonProperty("created_at") String createdAt,
    @JsonProperty("age_hours") Double ageHours
) implements Serializable {}
