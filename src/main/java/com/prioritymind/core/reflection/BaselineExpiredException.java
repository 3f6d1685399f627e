package com.prioritymind.core.reflection;

/**
 * Thrown when the baseline plan is older than the hard staleness limit.
 */
public class BaselineExpiredException extends PlanPreconditionException {

    private final double ageHours;

    public BaselineExpiredException(double ageHours, int maxAgeDays) {
        super(String.format("Baseline plan too old (%.0f hours, limit %d days). Run full analysis.",
                ageHours, maxAgeDays));
        this.ageHours = ageHours;
    }

    public double ageHours() {
        return ageHours;
    }
}
