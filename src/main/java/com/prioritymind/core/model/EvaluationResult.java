package com.prioritymind.core.model;

import java.io.Serializable;

/**
 * Verdict of the planner's self-check pass on a draft prioritization.
 */
public record EvaluationResult(
    Status status,
    String feedback
) implements Serializable {

    public enum Status { PASS, NEEDS_IMPROVEMENT, FAIL }

    public boolean passed() {
        return status == Status.PASS;
    }
}
