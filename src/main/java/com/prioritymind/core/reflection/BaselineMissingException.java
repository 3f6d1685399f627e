package com.prioritymind.core.reflection;

/**
 * Thrown when re-ranking is requested before any baseline plan exists.
 */
public class BaselineMissingException extends PlanPreconditionException {
    public BaselineMissingException() {
        super("Baseline plan not found. Run full analysis first.");
    }
}
