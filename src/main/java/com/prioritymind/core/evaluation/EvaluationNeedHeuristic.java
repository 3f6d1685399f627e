package com.prioritymind.core.evaluation;

import com.prioritymind.core.config.PrioritymindProperties;
import com.prioritymind.core.model.BaselinePlan;
import com.prioritymind.core.model.PrioritizationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Decides whether a planner draft warrants a second, self-check pass.
 * Any single trigger is enough.
 */
@Service
public class EvaluationNeedHeuristic {

    private static final Logger log = LoggerFactory.getLogger(EvaluationNeedHeuristic.class);

    private final PrioritymindProperties.Evaluation settings;

    public EvaluationNeedHeuristic(PrioritymindProperties properties) {
        this.settings = properties.getEvaluation();
    }

    /**
     * @param result       the planner's draft
     * @param previousPlan the last baseline, or null on first run
     */
    public boolean needsEvaluation(PrioritizationResult result, BaselinePlan previousPlan) {
        if (result.confidence() < settings.getMinConfidence()) {
            log.debug("Evaluation needed: confidence {} below {}", result.confidence(), settings.getMinConfidence());
            return true;
        }
        if (result.includedTasks().size() < settings.getMinIncludedTasks()) {
            log.debug("Evaluation needed: only {} included task(s)", result.includedTasks().size());
            return true;
        }
        String corrections = result.correctionsMade();
        if (corrections != null && corrections.length() > settings.getMaxCorrectionsLength()) {
            log.debug("Evaluation needed: corrections note is {} chars", corrections.length());
            return true;
        }
        if (previousPlan != null && hasMajorMovement(result.orderedTaskIds(), previousPlan.orderedTaskIds())) {
            log.debug("Evaluation needed: major movement against previous plan");
            return true;
        }
        return false;
    }

    /**
     * True when more than the configured share of tasks present in both orderings
     * moved more than the configured number of ranks. Tasks only in one ordering
     * do not count.
     */
    public boolean hasMajorMovement(List<String> current, List<String> previous) {
        if (current == null || previous == null || current.isEmpty() || previous.isEmpty()) {
            return false;
        }
        Map<String, Integer> previousRank = new HashMap<>();
        for (int i = 0; i < previous.size(); i++) {
            previousRank.putIfAbsent(previous.get(i), i);
        }

        int common = 0;
        int majorMoves = 0;
        for (int i = 0; i < current.size(); i++) {
            Integer before = previousRank.get(current.get(i));
            if (before == null) {
                continue;
            }
            common++;
            if (Math.abs(i - before) > settings.getMajorMoveDistance()) {
                majorMoves++;
            }
        }
        if (common == 0) {
            return false;
        }
        return (double) majorMoves / common > settings.getMajorMoveRatio();
    }
}
