package com.prioritymind.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Outcome of a bridging-task insertion.
 * <p>
 * On failure {@link #updatedPlan} is null and {@link #failure} says which
 * check rejected the insertion; the caller's plan is left untouched.
 */
public record InsertionResult(
    boolean success,
    @JsonProperty("inserted_ids") List<String> insertedIds,
    String error,
    InsertionFailure failure,
    @JsonProperty("updated_plan") List<Task> updatedPlan
) implements Serializable {

    public static InsertionResult succeeded(List<String> insertedIds, List<Task> updatedPlan) {
        return new InsertionResult(true, List.copyOf(insertedIds), null, null, List.copyOf(updatedPlan));
    }

    public static InsertionResult failed(InsertionFailure failure, String error) {
        return new InsertionResult(false, List.of(), error, failure, null);
    }
}
