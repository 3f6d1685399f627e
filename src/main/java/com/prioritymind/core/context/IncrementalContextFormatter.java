package com.prioritymind.core.context;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prioritymind.core.config.PrioritymindProperties;
import com.prioritymind.core.model.BaselineSummary;
import com.prioritymind.core.model.IncrementalContext;
import com.prioritymind.core.model.TaskSummary;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders an {@link IncrementalContext} as planner prompt text. Pure string
 * formatting with no side effects.
 */
@Component
public class IncrementalContextFormatter {

    static final String NO_BASELINE = "No previous baseline.";
    static final String NO_NEW_TASKS = "No new tasks to analyze.";

    private final ObjectMapper objectMapper;
    private final int maxListedDocumentIds;

    public IncrementalContextFormatter(ObjectMapper objectMapper, PrioritymindProperties properties) {
        this.objectMapper = objectMapper;
        this.maxListedDocumentIds = properties.getContext().getMaxListedDocumentIds();
    }

    /**
     * Prompt-ready text plus counts.
     */
    public record PromptContext(
        String baselineSummary,
        String newTasksText,
        int taskCount,
        int newTaskCount
    ) {}

    public String formatBaselineSummary(BaselineSummary baseline) {
        if (baseline == null) {
            return NO_BASELINE;
        }

        String ageText = "";
        if (baseline.ageHours() != null) {
            ageText = baseline.ageHours() < 1
                    ? " (less than 1 hour ago)"
                    : " (" + Math.round(baseline.ageHours()) + " hours ago)";
        }

        var lines = new ArrayList<String>();
        lines.add("BASELINE CONTEXT (previously analyzed" + ageText + "):");
        lines.add("- " + plural(baseline.documentCount(), "document") + " with "
                + plural(baseline.taskCount(), "task"));

        List<String> docIds = baseline.documentIds();
        if (!docIds.isEmpty() && docIds.size() <= maxListedDocumentIds) {
            lines.add("- Document IDs: " + String.join(", ", docIds));
        } else if (docIds.size() > maxListedDocumentIds) {
            lines.add("- Document IDs: " + String.join(", ", docIds.subList(0, maxListedDocumentIds))
                    + ", ... (" + (docIds.size() - maxListedDocumentIds) + " more)");
        }

        if (!baseline.topTaskIds().isEmpty()) {
            lines.add("- Top task IDs from baseline: " + String.join(", ", baseline.topTaskIds()));
        }

        lines.add("");
        lines.add("NOTE: Baseline tasks have already been analyzed and prioritized. "
                + "Focus on integrating NEW tasks below with the existing baseline.");
        return String.join("\n", lines);
    }

    /**
     * One compact JSON object per line: id, text, document_id, source, lnoCategory.
     */
    public String formatNewTasks(List<TaskSummary> newTasks) {
        if (newTasks == null || newTasks.isEmpty()) {
            return NO_NEW_TASKS;
        }
        return newTasks.stream().map(this::toLine).collect(Collectors.joining("\n"));
    }

    public PromptContext buildPromptContext(IncrementalContext context) {
        return new PromptContext(
                formatBaselineSummary(context.baseline()),
                formatNewTasks(context.newTasks()),
                context.allTasks().size(),
                context.newTasks().size());
    }

    private String toLine(TaskSummary task) {
        var record = new LinkedHashMap<String, Object>();
        record.put("id", task.taskId());
        record.put("text", task.taskText());
        record.put("document_id", task.documentId());
        record.put("source", task.source());
        if (task.lnoCategory() != null) {
            record.put("lnoCategory", task.lnoCategory());
        }
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize task " + task.taskId(), e);
        }
    }

    private static String plural(int count, String noun) {
        return count + " " + noun + (count == 1 ? "" : "s");
    }
}
