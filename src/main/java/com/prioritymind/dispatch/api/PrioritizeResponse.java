package com.prioritymind.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.prioritymind.core.model.BaselinePlan;
import com.prioritymind.core.model.EvaluationResult;
import com.prioritymind.core.model.PrioritizationResult.ExcludedTask;
import com.prioritymind.core.planner.PrioritizationOutcome;
import com.prioritymind.core.planner.PrioritizationOutcome.LoopMetadata;

import java.util.List;

/**
 * JSON response for a full prioritization run.
 */
public record PrioritizeResponse(
    @JsonProperty("session_id") String sessionId,
    BaselinePlan plan,
    @JsonProperty("excluded_tasks") List<ExcludedTask> excludedTasks,
    @JsonProperty("corrections_made") String correctionsMade,
    EvaluationResult evaluation,
    LoopMetadata metadata
) {

    static PrioritizeResponse from(String sessionId, PrioritizationOutcome outcome) {
        return new PrioritizeResponse(sessionId, outcome.plan(), outcome.result().excludedTasks(),
                outcome.result().correctionsMade(), outcome.evaluation(), outcome.metadata());
    }
}
