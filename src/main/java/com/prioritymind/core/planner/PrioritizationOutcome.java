package com.prioritymind.core.planner;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.prioritymind.core.model.BaselinePlan;
import com.prioritymind.core.model.EvaluationResult;
import com.prioritymind.core.model.PrioritizationResult;

/**
 * Result of one full prioritization run.
 *
 * @param evaluation last evaluator verdict; null when no evaluation ran
 */
public record PrioritizationOutcome(
    BaselinePlan plan,
    PrioritizationResult result,
    EvaluationResult evaluation,
    LoopMetadata metadata
) {

    public record LoopMetadata(
        int iterations,
        @JsonProperty("evaluation_triggered") boolean evaluationTriggered,
        boolean converged,
        @JsonProperty("duration_ms") long durationMs,
        @JsonProperty("final_confidence") double finalConfidence,
        @JsonProperty("token_savings_estimate") int tokenSavingsEstimate,
        @JsonProperty("new_task_count") int newTaskCount
    ) {}
}
