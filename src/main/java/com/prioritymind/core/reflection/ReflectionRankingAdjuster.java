package com.prioritymind.core.reflection;

import com.prioritymind.core.config.PrioritymindProperties;
import com.prioritymind.core.model.AdjustedPlan;
import com.prioritymind.core.model.AdjustedPlan.AdjustmentDiff;
import com.prioritymind.core.model.AdjustedPlan.AdjustmentMetadata;
import com.prioritymind.core.model.AdjustedPlan.MovedTask;
import com.prioritymind.core.model.AdjustedPlan.ReflectionUsage;
import com.prioritymind.core.model.BaselinePlan;
import com.prioritymind.core.model.Reflection;
import com.prioritymind.core.model.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Re-ranks a stored baseline plan using the user's active reflections, without
 * calling the planner.
 * <p>
 * Each task is compared against every active reflection by embedding similarity,
 * scaled by the reflection's recency weight. The reflection with the highest
 * weighted similarity drives the task's adjustment:
 * <ul>
 *   <li>above the boost threshold (0.7): confidence rises by the excess</li>
 *   <li>below the penalty threshold (0.3): confidence drops by the deficit</li>
 *   <li>in between: unchanged</li>
 * </ul>
 * Either change is multiplied by the configured factor (0.3 by default). Tasks are
 * then stably re-sorted by confidence. Demoted tasks stay in the list; nothing is filtered.
 */
@Service
public class ReflectionRankingAdjuster {

    private static final Logger log = LoggerFactory.getLogger(ReflectionRankingAdjuster.class);

    static final String STALE_WARNING =
            "Baseline plan older than 24 hours. Consider running a fresh analysis soon.";

    private final SimilarityService similarityService;
    private final PrioritymindProperties.Ranking ranking;
    private final PrioritymindProperties.Baseline baselineLimits;
    private final Clock clock;

    public ReflectionRankingAdjuster(SimilarityService similarityService,
                                     PrioritymindProperties properties,
                                     Clock clock) {
        this.similarityService = similarityService;
        this.ranking = properties.getRanking();
        this.baselineLimits = properties.getBaseline();
        this.clock = clock;
    }

    /**
     * Computes the adjusted plan.
     *
     * @param baselinePlan      plan from the last full analysis
     * @param reflections       reflections to consider; inactive or blank ones are ignored
     * @param taskEmbeddings    task id to embedding; tasks without one keep their baseline score
     * @return adjusted ordering, scores and diff against the baseline
     * @throws BaselineMissingException if there is no baseline or it has no tasks
     * @throws BaselineExpiredException if the baseline is older than the hard limit
     */
    public AdjustedPlan adjust(BaselinePlan baselinePlan, List<Reflection> reflections,
                               Map<String, float[]> taskEmbeddings) {
        long start = System.nanoTime();
        if (baselinePlan == null || baselinePlan.orderedTaskIds().isEmpty()) {
            throw new BaselineMissingException();
        }
        List<String> warnings = checkStaleness(baselinePlan);

        List<Reflection> active = reflections == null ? List.of() : reflections.stream()
                .filter(Reflection::active)
                .filter(r -> r.text() != null && !r.text().isBlank())
                .toList();

        if (active.isEmpty()) {
            log.debug("No active reflections; returning baseline order for {} tasks",
                    baselinePlan.orderedTaskIds().size());
            return new AdjustedPlan(
                    baselinePlan.orderedTaskIds(),
                    baselineScoresInOrder(baselinePlan),
                    AdjustmentDiff.empty(),
                    new AdjustmentMetadata(List.of(), 0, 0, elapsedMs(start), warnings));
        }

        var usages = new ArrayList<ReflectionUsage>(active.size());
        var weights = new double[active.size()];
        for (int i = 0; i < active.size(); i++) {
            var reflection = active.get(i);
            weights[i] = RecencyWeights.weightOf(reflection.createdAt(), clock);
            usages.add(new ReflectionUsage(reflection.id(), reflection.text(), weights[i], reflection.createdAt()));
        }

        Map<String, float[]> embeddings = taskEmbeddings == null ? Map.of() : taskEmbeddings;
        var influence = new double[active.size()];
        var scored = new ArrayList<TaskScore>(baselinePlan.orderedTaskIds().size());
        int rank = 1;
        for (var taskId : baselinePlan.orderedTaskIds()) {
            double base = baselinePlan.confidenceScores().getOrDefault(taskId, ranking.getFallbackConfidence());
            var score = scoreTask(taskId, rank++, base, embeddings.get(taskId), active, weights);
            if (score.driver() >= 0) {
                influence[score.driver()] += Math.abs(score.adjusted() - score.base());
            }
            scored.add(score);
        }

        var reordered = new ArrayList<>(scored);
        reordered.sort(Comparator.comparingDouble((TaskScore s) -> s.adjusted()).reversed());

        String shiftReason = reason("Shifted by '%s' context", active.get(strongest(influence)).text());
        var moved = new ArrayList<MovedTask>();
        var orderedIds = new ArrayList<String>(reordered.size());
        var confidence = new LinkedHashMap<String, Double>();
        for (int i = 0; i < reordered.size(); i++) {
            var score = reordered.get(i);
            orderedIds.add(score.taskId());
            confidence.put(score.taskId(), score.adjusted());
            int to = i + 1;
            if (to != score.baselineRank()) {
                moved.add(new MovedTask(score.taskId(), score.baselineRank(), to, moveReason(score, active, shiftReason)));
            }
        }
        baselinePlan.confidenceScores().forEach(confidence::putIfAbsent);

        long durationMs = elapsedMs(start);
        log.info("Adjusted {} tasks with {} reflection(s): {} moved in {}ms",
                orderedIds.size(), active.size(), moved.size(), durationMs);

        return new AdjustedPlan(
                List.copyOf(orderedIds),
                confidence,
                new AdjustmentDiff(List.copyOf(moved), List.of()),
                new AdjustmentMetadata(List.copyOf(usages), moved.size(), 0, durationMs, warnings));
    }

    private TaskScore scoreTask(String taskId, int baselineRank, double base, float[] taskEmbedding,
                                List<Reflection> active, double[] weights) {
        if (taskEmbedding == null) {
            return new TaskScore(taskId, baselineRank, base, round(clamp(base)), -1, Effect.NONE);
        }

        int driver = -1;
        double best = -1.0;
        for (int i = 0; i < active.size(); i++) {
            float[] reflectionEmbedding = active.get(i).embedding();
            if (reflectionEmbedding == null) {
                continue;
            }
            double weighted = similarityService.similarity(taskEmbedding, reflectionEmbedding) * weights[i];
            if (weighted > best) {
                best = weighted;
                driver = i;
            }
        }
        if (driver < 0) {
            return new TaskScore(taskId, baselineRank, base, round(clamp(base)), -1, Effect.NONE);
        }

        double delta = 0.0;
        Effect effect = Effect.NONE;
        if (best > ranking.getBoostThreshold()) {
            delta = (Math.min(1.0, best) - ranking.getBoostThreshold()) * ranking.getBoostFactor();
            effect = Effect.BOOST;
        } else if (best < ranking.getPenaltyThreshold()) {
            delta = -(ranking.getPenaltyThreshold() - Math.max(0.0, best)) * ranking.getPenaltyFactor();
            effect = Effect.PENALTY;
        }
        return new TaskScore(taskId, baselineRank, base, round(clamp(base + delta)), driver, effect);
    }

    private String moveReason(TaskScore score, List<Reflection> active, String shiftReason) {
        return switch (score.effect()) {
            case BOOST -> reason("Matches '%s' context", active.get(score.driver()).text());
            case PENALTY -> reason("Low relevance to '%s' context", active.get(score.driver()).text());
            case NONE -> shiftReason;
        };
    }

    private List<String> checkStaleness(BaselinePlan baselinePlan) {
        if (baselinePlan.createdAt() == null) {
            return List.of();
        }
        double ageHours = Timestamps.ageHours(baselinePlan.createdAt(), clock.instant());
        if (ageHours > baselineLimits.getMaxAgeDays() * 24.0) {
            log.warn("Refusing adjustment: baseline is {} hours old", Math.round(ageHours));
            throw new BaselineExpiredException(ageHours, baselineLimits.getMaxAgeDays());
        }
        if (ageHours > baselineLimits.getStaleWarningHours()) {
            return List.of(STALE_WARNING);
        }
        return List.of();
    }

    private static Map<String, Double> baselineScoresInOrder(BaselinePlan baselinePlan) {
        var scores = new LinkedHashMap<String, Double>();
        for (var taskId : baselinePlan.orderedTaskIds()) {
            Double value = baselinePlan.confidenceScores().get(taskId);
            if (value != null) {
                scores.put(taskId, value);
            }
        }
        baselinePlan.confidenceScores().forEach(scores::putIfAbsent);
        return scores;
    }

    private String reason(String template, String reflectionText) {
        String compact = reflectionText.replaceAll("\\s+", " ").replaceAll("[\"']", "").trim();
        int room = ranking.getMaxReasonLength() - (template.length() - 2);
        if (compact.length() > room) {
            compact = compact.substring(0, Math.max(0, room - 3)) + "...";
        }
        return String.format(template, compact);
    }

    private static int strongest(double[] influence) {
        int best = 0;
        for (int i = 1; i < influence.length; i++) {
            if (influence[i] > influence[best]) {
                best = i;
            }
        }
        return best;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(3, RoundingMode.HALF_UP).doubleValue();
    }

    private static long elapsedMs(long startNanos) {
        return Math.max(0, Math.round((System.nanoTime() - startNanos) / 1_000_000.0));
    }

    private enum Effect { BOOST, PENALTY, NONE }

    private record TaskScore(String taskId, int baselineRank, double base, double adjusted,
                             int driver, Effect effect) {}
}
