package com.prioritymind.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Micrometer metrics for planning, adjustment and graph edits.
 */
@Service
public class PrioritymindMetrics {

    private final MeterRegistry registry;

    public PrioritymindMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPlanningDuration(long ms) {
        Timer.builder("prioritymind.planning.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param triggered whether the draft was sent for evaluation
     * @param converged whether the loop ended on a passing evaluation (or needed none)
     */
    public void recordPlanningLoop(int iterations, boolean triggered, boolean converged) {
        DistributionSummary.builder("prioritymind.planning.iterations")
                .register(registry)
                .record(iterations);
        Counter.builder("prioritymind.planning.evaluations")
                .tag("triggered", String.valueOf(triggered))
                .tag("converged", String.valueOf(converged))
                .register(registry)
                .increment();
    }

    public void recordAdjustment(long ms, int tasksMoved) {
        Timer.builder("prioritymind.adjustment.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
        DistributionSummary.builder("prioritymind.adjustment.tasks_moved")
                .description("Tasks whose rank changed in one adjustment")
                .register(registry)
                .record(tasksMoved);
    }

    public void recordAdjustmentRejected(String reason) {
        Counter.builder("prioritymind.adjustment.rejected")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "success" or the lower-cased failure kind
     */
    public void recordInsertion(String outcome, int insertedCount) {
        Counter.builder("prioritymind.insertions.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
        if (insertedCount > 0) {
            DistributionSummary.builder("prioritymind.insertions.tasks")
                    .register(registry)
                    .record(insertedCount);
        }
    }

    public void recordReflection(String action) {
        Counter.builder("prioritymind.reflections.total")
                .tag("action", action)
                .register(registry)
                .increment();
    }
}
