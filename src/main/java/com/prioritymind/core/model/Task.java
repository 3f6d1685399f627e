package com.prioritymind.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * A single unit of work in a session's dependency graph.
 *
 * @param id             zero-padded sequence id (e.g., "003")
 * @param text           what this task should accomplish
 * @param estimatedHours effort estimate, strictly positive
 * @param dependsOn      ids of prerequisite tasks, in order, without duplicates
 */
public record Task(
    String id,
    String text,
    @JsonProperty("estimated_hours") double estimatedHours,
    @JsonProperty("depends_on") List<String> dependsOn
) implements Serializable {

    public Task {
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }

    public Task withDependsOn(List<String> newDependsOn) {
        return new Task(id, text, estimatedHours, newDependsOn);
    }
}
