package com.prioritymind.core.session;

import com.prioritymind.core.embedding.EmbeddingClient;
import com.prioritymind.core.events.EventBus;
import com.prioritymind.core.events.PlanEvent;
import com.prioritymind.core.graph.BridgingTaskInserter;
import com.prioritymind.core.graph.DependencyGraph;
import com.prioritymind.core.metrics.PrioritymindMetrics;
import com.prioritymind.core.model.AdjustedPlan;
import com.prioritymind.core.model.BridgingTask;
import com.prioritymind.core.model.Gap;
import com.prioritymind.core.model.InsertionResult;
import com.prioritymind.core.model.PlanSession;
import com.prioritymind.core.model.Reflection;
import com.prioritymind.core.model.Task;
import com.prioritymind.core.model.TaskSummary;
import com.prioritymind.core.persistence.PlanStore;
import com.prioritymind.core.planner.PlannerRequest;
import com.prioritymind.core.planner.PrioritizationLoop;
import com.prioritymind.core.planner.PrioritizationOutcome;
import com.prioritymind.core.reflection.BaselineExpiredException;
import com.prioritymind.core.reflection.BaselineMissingException;
import com.prioritymind.core.reflection.ReflectionRankingAdjuster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Entry point for everything that changes a plan session: full prioritization,
 * reflection-based adjustment and bridging-task insertion.
 * <p>
 * Each operation loads the session, runs the core component, stores the result
 * and then publishes an event. Operations on the same session are serialized.
 */
@Service
public class PlanSessionService {

    private static final Logger log = LoggerFactory.getLogger(PlanSessionService.class);

    private final PlanStore store;
    private final PrioritizationLoop prioritizationLoop;
    private final ReflectionRankingAdjuster adjuster;
    private final BridgingTaskInserter inserter;
    private final ReflectionService reflectionService;
    private final EmbeddingClient embeddingClient;
    private final SessionLocks locks;
    private final EventBus eventBus;
    private final PrioritymindMetrics metrics;
    private final Clock clock;

    public PlanSessionService(PlanStore store,
                              PrioritizationLoop prioritizationLoop,
                              ReflectionRankingAdjuster adjuster,
                              BridgingTaskInserter inserter,
                              ReflectionService reflectionService,
                              EmbeddingClient embeddingClient,
                              SessionLocks locks,
                              EventBus eventBus,
                              PrioritymindMetrics metrics,
                              Clock clock) {
        this.store = store;
        this.prioritizationLoop = prioritizationLoop;
        this.adjuster = adjuster;
        this.inserter = inserter;
        this.reflectionService = reflectionService;
        this.embeddingClient = embeddingClient;
        this.locks = locks;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * @throws SessionNotFoundException if nothing is stored under {@code sessionId}
     */
    public PlanSession getSession(String sessionId) {
        return store.findSession(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    /**
     * Runs the planner and stores the result as the session's new baseline. Creates
     * the session on first use. Any previous adjusted plan is discarded.
     *
     * @throws IllegalArgumentException if there is no outcome or no task to rank,
     *                                  or the supplied task graph has a cycle
     */
    public PrioritizationOutcome prioritize(String sessionId, PrioritizeCommand command) {
        PrioritizationOutcome outcome = locks.withLock(sessionId, "prioritize", () -> {
            PlanSession session = store.findSession(sessionId).orElse(PlanSession.empty(sessionId));

            String outcomeText = isBlank(command.outcome()) ? session.outcome() : command.outcome().trim();
            if (isBlank(outcomeText)) {
                throw new IllegalArgumentException("outcome: an outcome is required before prioritizing");
            }
            List<TaskSummary> summaries = command.taskSummaries().isEmpty()
                    ? session.taskSummaries() : command.taskSummaries();
            if (summaries.isEmpty()) {
                throw new IllegalArgumentException("task_summaries: no tasks to prioritize");
            }
            List<Task> tasks = command.tasks().isEmpty() ? session.tasks() : command.tasks();
            if (DependencyGraph.detectCycle(tasks)) {
                throw new IllegalArgumentException("tasks: dependency graph contains a circular dependency");
            }

            var request = new PlannerRequest(sessionId, outcomeText,
                    reflectionService.activeReflections(sessionId).stream().map(Reflection::text).toList(),
                    summaries,
                    session.baselinePlan(),
                    session.baselineDocumentIds(),
                    session.baselinePlan() == null || session.baselinePlan().createdAt() == null
                            ? null : session.baselinePlan().createdAt().toString());

            PrioritizationOutcome result = prioritizationLoop.prioritize(request);

            var updated = new PlanSession(sessionId, outcomeText, tasks, summaries, result.plan(), null,
                    documentIds(summaries), clock.instant());
            store.saveSession(updated);
            refreshTaskEmbeddings(session, updated);
            return result;
        });

        var meta = outcome.metadata();
        metrics.recordPlanningDuration(meta.durationMs());
        metrics.recordPlanningLoop(meta.iterations(), meta.evaluationTriggered(), meta.converged());
        eventBus.publish(new PlanEvent(PlanEvent.PLAN_PRIORITIZED, sessionId, Map.of(
                "task_count", outcome.plan().orderedTaskIds().size(),
                "iterations", meta.iterations(),
                "converged", meta.converged(),
                "confidence", meta.finalConfidence()), clock.instant()));
        return outcome;
    }

    /**
     * Re-ranks the stored baseline with the session's active reflections and stores
     * the adjusted plan. The baseline itself is left as it is.
     *
     * @throws SessionNotFoundException if the session does not exist
     * @throws BaselineMissingException if no baseline has been computed yet
     * @throws BaselineExpiredException if the baseline is too old to adjust
     */
    public AdjustedPlan adjust(String sessionId) {
        AdjustedPlan adjusted = locks.withLock(sessionId, "adjust", () -> {
            PlanSession session = getSession(sessionId);
            List<Reflection> active = reflectionService.activeReflections(sessionId);
            AdjustedPlan plan;
            try {
                plan = adjuster.adjust(session.baselinePlan(), active, taskEmbeddings(session));
            } catch (BaselineMissingException e) {
                metrics.recordAdjustmentRejected("baseline_missing");
                throw e;
            } catch (BaselineExpiredException e) {
                metrics.recordAdjustmentRejected("baseline_expired");
                throw e;
            }
            store.saveSession(session.withAdjustedPlan(plan, clock.instant()));
            return plan;
        });

        metrics.recordAdjustment(adjusted.metadata().durationMs(), adjusted.metadata().tasksMoved());
        eventBus.publish(new PlanEvent(PlanEvent.PLAN_ADJUSTED, sessionId, Map.of(
                "tasks_moved", adjusted.metadata().tasksMoved(),
                "reflections", adjusted.metadata().reflections().size(),
                "warnings", adjusted.metadata().warnings()), clock.instant()));
        return adjusted;
    }

    /**
     * Splices bridging tasks into the session's task graph. The stored graph changes
     * only when the insertion succeeds.
     *
     * @throws SessionNotFoundException if the session does not exist
     */
    public InsertionResult insertBridgingTasks(String sessionId, Gap gap, List<BridgingTask> bridgingTasks) {
        InsertionResult result = locks.withLock(sessionId, "insert", () -> {
            PlanSession session = getSession(sessionId);
            InsertionResult inserted = inserter.insertBridgingTasks(gap, bridgingTasks, session.tasks());
            if (inserted.success() && !inserted.insertedIds().isEmpty()) {
                store.saveSession(session.withTasks(inserted.updatedPlan(), clock.instant()));
            }
            return inserted;
        });

        String outcome = result.success() ? "success" : result.failure().name().toLowerCase();
        metrics.recordInsertion(outcome, result.insertedIds().size());
        if (result.success() && !result.insertedIds().isEmpty()) {
            eventBus.publish(new PlanEvent(PlanEvent.PLAN_TASKS_INSERTED, sessionId, Map.of(
                    "inserted_ids", result.insertedIds(),
                    "predecessor_id", gap.predecessorId(),
                    "successor_id", gap.successorId()), clock.instant()));
        }
        return result;
    }

    private Map<String, float[]> taskEmbeddings(PlanSession session) {
        Map<String, float[]> embeddings = new HashMap<>(store.findTaskEmbeddings(session.sessionId()));
        if (session.baselinePlan() == null) {
            return embeddings;
        }
        Map<String, String> texts = taskTexts(session);
        var missing = new ArrayList<String>();
        for (var taskId : session.baselinePlan().orderedTaskIds()) {
            if (!embeddings.containsKey(taskId) && texts.containsKey(taskId)) {
                missing.add(taskId);
            }
        }
        if (!missing.isEmpty()) {
            embeddings.putAll(embed(session.sessionId(), missing, texts));
        }
        return embeddings;
    }

    /**
     * Task ids are reused across runs, so a cached vector is only kept while the
     * task's text is unchanged.
     */
    private void refreshTaskEmbeddings(PlanSession previous, PlanSession session) {
        Map<String, String> texts = taskTexts(session);
        Map<String, String> previousTexts = taskTexts(previous);
        List<String> changed = texts.entrySet().stream()
                .filter(e -> previousTexts.containsKey(e.getKey())
                        && !previousTexts.get(e.getKey()).equals(e.getValue()))
                .map(Map.Entry::getKey)
                .toList();
        if (!changed.isEmpty()) {
            store.deleteTaskEmbeddings(session.sessionId(), changed);
            log.debug("Dropped embeddings for {} task(s) whose text changed", changed.size());
        }
        Map<String, float[]> known = store.findTaskEmbeddings(session.sessionId());
        List<String> missing = texts.keySet().stream().filter(id -> !known.containsKey(id)).toList();
        if (!missing.isEmpty()) {
            embed(session.sessionId(), missing, texts);
        }
    }

    private Map<String, float[]> embed(String sessionId, List<String> taskIds, Map<String, String> texts) {
        List<float[]> vectors = embeddingClient.embedAll(taskIds.stream().map(texts::get).toList());
        if (vectors.size() != taskIds.size()) {
            log.warn("Embeddings unavailable for {} task(s); they keep their baseline score", taskIds.size());
            return Map.of();
        }
        var computed = new HashMap<String, float[]>();
        for (int i = 0; i < taskIds.size(); i++) {
            computed.put(taskIds.get(i), vectors.get(i));
        }
        store.saveTaskEmbeddings(sessionId, computed);
        log.debug("Embedded {} task(s)", computed.size());
        return computed;
    }

    private static Map<String, String> taskTexts(PlanSession session) {
        var texts = new HashMap<String, String>();
        session.tasks().forEach(t -> texts.put(t.id(), t.text()));
        session.taskSummaries().forEach(s -> {
            if (!isBlank(s.taskText())) {
                texts.put(s.taskId(), s.taskText());
            }
        });
        return texts;
    }

    private static List<String> documentIds(List<TaskSummary> summaries) {
        var ids = new LinkedHashSet<String>();
        for (var summary : summaries) {
            if (!isBlank(summary.documentId())) {
                ids.add(summary.documentId());
            }
        }
        return List.copyOf(ids);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
