package com.prioritymind.core.planner;

/**
 * The planner collaborator could not produce a usable draft or evaluation.
 */
public class PlannerException extends RuntimeException {

    public PlannerException(String message) {
        super(message);
    }

    public PlannerException(String message, Throwable cause) {
        super(message, cause);
    }
}
