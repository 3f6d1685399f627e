package com.prioritymind.core.planner;

import com.prioritymind.core.context.IncrementalContextFormatter.PromptContext;

import java.util.List;

/**
 * What the planner sees on one iteration.
 *
 * @param evaluatorFeedback feedback from the previous evaluation; null on the first draft
 */
public record PlannerInput(
    String outcome,
    List<String> reflections,
    PromptContext context,
    int iteration,
    int maxIterations,
    String evaluatorFeedback
) {

    public PlannerInput withRefinement(int nextIteration, String feedback) {
        return new PlannerInput(outcome, reflections, context, nextIteration, maxIterations, feedback);
    }
}
