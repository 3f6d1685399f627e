package com.prioritymind.core.reflection;

/**
 * The stored plan is not in a state that allows re-ranking. Not retryable:
 * the caller has to run a full analysis first.
 */
public class PlanPreconditionException extends RuntimeException {
    public PlanPreconditionException(String message) {
        super(message);
    }
}
