package com.prioritymind.core.planner;

import com.prioritymind.core.model.BaselinePlan;
import com.prioritymind.core.model.TaskSummary;

import java.util.List;

/**
 * Inputs for one full prioritization run.
 *
 * @param reflections         texts of the currently active reflections
 * @param previousPlan        last baseline, or null on first run
 * @param baselineDocumentIds documents the previous baseline covered
 * @param baselineCreatedAt   raw timestamp of the previous baseline, or null
 */
public record PlannerRequest(
    String sessionId,
    String outcome,
    List<String> reflections,
    List<TaskSummary> tasks,
    BaselinePlan previousPlan,
    List<String> baselineDocumentIds,
    String baselineCreatedAt
) {

    public PlannerRequest {
        reflections = reflections == null ? List.of() : List.copyOf(reflections);
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        baselineDocumentIds = baselineDocumentIds == null ? List.of() : List.copyOf(baselineDocumentIds);
    }
}
