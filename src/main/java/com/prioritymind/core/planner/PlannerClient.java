package com.prioritymind.core.planner;

import com.prioritymind.core.model.EvaluationResult;
import com.prioritymind.core.model.PrioritizationResult;

/**
 * The external planner: drafts a prioritization and judges drafts.
 */
public interface PlannerClient {

    /**
     * @throws PlannerException if no usable draft was produced
     */
    PrioritizationResult generate(PlannerInput input);

    /**
     * @throws PlannerException if no usable evaluation was produced
     */
    EvaluationResult evaluate(PrioritizationResult draft, PlannerInput input);
}
