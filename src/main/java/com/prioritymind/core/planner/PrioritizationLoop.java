package com.prioritymind.core.planner;

import com.prioritymind.core.config.PrioritymindProperties;
import com.prioritymind.core.context.IncrementalContextBuilder;
import com.prioritymind.core.context.IncrementalContextFormatter;
import com.prioritymind.core.evaluation.EvaluationNeedHeuristic;
import com.prioritymind.core.model.BaselinePlan;
import com.prioritymind.core.model.EvaluationResult;
import com.prioritymind.core.model.PrioritizationResult;
import com.prioritymind.core.planner.PrioritizationOutcome.LoopMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Full planning run: trims the planner input to new tasks, takes a draft, and
 * only when the draft looks doubtful runs evaluate/refine rounds until the
 * evaluator passes it or the iteration cap is reached.
 */
@Service
public class PrioritizationLoop {

    private static final Logger log = LoggerFactory.getLogger(PrioritizationLoop.class);

    private static final int ITERATION_CAP = 3;

    private final PlannerClient plannerClient;
    private final IncrementalContextBuilder contextBuilder;
    private final IncrementalContextFormatter contextFormatter;
    private final EvaluationNeedHeuristic heuristic;
    private final int maxIterations;
    private final Clock clock;

    public PrioritizationLoop(PlannerClient plannerClient,
                              IncrementalContextBuilder contextBuilder,
                              IncrementalContextFormatter contextFormatter,
                              EvaluationNeedHeuristic heuristic,
                              PrioritymindProperties properties,
                              Clock clock) {
        this.plannerClient = plannerClient;
        this.contextBuilder = contextBuilder;
        this.contextFormatter = contextFormatter;
        this.heuristic = heuristic;
        this.maxIterations = Math.min(ITERATION_CAP, Math.max(1, properties.getEvaluation().getMaxIterations()));
        this.clock = clock;
    }

    public PrioritizationOutcome prioritize(PlannerRequest request) {
        long start = System.currentTimeMillis();
        var context = contextBuilder.build(request.tasks(), request.baselineDocumentIds(), request.baselineCreatedAt());
        var input = new PlannerInput(request.outcome(), request.reflections(),
                contextFormatter.buildPromptContext(context), 1, maxIterations, null);

        PrioritizationResult current = plannerClient.generate(input);
        int iteration = 1;
        boolean triggered = heuristic.needsEvaluation(current, request.previousPlan());
        boolean converged = !triggered;
        EvaluationResult lastEvaluation = null;

        while (triggered) {
            EvaluationResult evaluation;
            try {
                evaluation = plannerClient.evaluate(current, input);
            } catch (PlannerException e) {
                log.warn("Evaluation failed on iteration {}; keeping current draft: {}", iteration, e.getMessage());
                break;
            }
            lastEvaluation = evaluation;
            if (evaluation.passed()) {
                converged = true;
                break;
            }
            if (iteration >= maxIterations) {
                log.info("Iteration cap {} reached with status {}", maxIterations, evaluation.status());
                break;
            }
            iteration++;
            input = input.withRefinement(iteration, evaluation.feedback());
            current = plannerClient.generate(input);
        }

        long durationMs = System.currentTimeMillis() - start;
        var metadata = new LoopMetadata(iteration, triggered, converged, durationMs, current.confidence(),
                context.tokenSavingsEstimate(), context.newTasks().size());
        log.info("Prioritization finished: {} iteration(s), evaluation {}, converged={}, confidence={}, {}ms",
                iteration, triggered ? "triggered" : "skipped", converged, current.confidence(), durationMs);
        return new PrioritizationOutcome(toBaselinePlan(current), current, lastEvaluation, metadata);
    }

    private BaselinePlan toBaselinePlan(PrioritizationResult result) {
        List<String> ordered = List.copyOf(new LinkedHashSet<>(result.orderedTaskIds()));
        var scores = new LinkedHashMap<String, Double>();
        for (var taskId : ordered) {
            Double score = result.confidenceScores().get(taskId);
            if (score != null) {
                scores.put(taskId, Math.max(0.0, Math.min(1.0, score)));
            }
        }
        return new BaselinePlan(ordered, scores, clock.instant());
    }
}
