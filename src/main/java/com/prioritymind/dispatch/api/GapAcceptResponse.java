package com.prioritymind.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.prioritymind.core.model.Task;

import java.util.List;

/**
 * JSON response for a successful bridging-task insertion.
 */
public record GapAcceptResponse(
    @JsonProperty("inserted_ids") List<String> insertedIds,
    List<Task> tasks
) {}
