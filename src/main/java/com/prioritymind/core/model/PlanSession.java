package com.prioritymind.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Everything stored for one user/outcome: the task graph, the baseline plan, the
 * latest adjusted plan and the documents the baseline was built from.
 *
 * @param baselinePlan null until the first full prioritization
 * @param adjustedPlan null until reflections have been applied
 */
public record PlanSession(
    @JsonProperty("session_id") String sessionId,
    String outcome,
    List<Task> tasks,
    @JsonProperty("task_summaries") List<TaskSummary> taskSummaries,
    @JsonProperty("baseline_plan") BaselinePlan baselinePlan,
    @JsonProperty("adjusted_plan") AdjustedPlan adjustedPlan,
    @JsonProperty("baseline_document_ids") List<String> baselineDocumentIds,
    @JsonProperty("updated_at") Instant updatedAt
) implements Serializable {

    public PlanSession {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        taskSummaries = taskSummaries == null ? List.of() : List.copyOf(taskSummaries);
        baselineDocumentIds = baselineDocumentIds == null ? List.of() : List.copyOf(baselineDocumentIds);
    }

    public static PlanSession empty(String sessionId) {
        return new PlanSession(sessionId, null, List.of(), List.of(), null, null, List.of(), null);
    }

    public PlanSession withTasks(List<Task> newTasks, Instant now) {
        return new PlanSession(sessionId, outcome, newTasks, taskSummaries, baselinePlan, adjustedPlan,
                baselineDocumentIds, now);
    }

    public PlanSession withAdjustedPlan(AdjustedPlan plan, Instant now) {
        return new PlanSession(sessionId, outcome, tasks, taskSummaries, baselinePlan, plan,
                baselineDocumentIds, now);
    }
}
