package com.prioritymind.core.context;

import com.prioritymind.core.config.PrioritymindProperties;
import com.prioritymind.core.model.BaselineSummary;
import com.prioritymind.core.model.IncrementalContext;
import com.prioritymind.core.model.TaskSummary;
import com.prioritymind.core.model.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Splits the task corpus into tasks from documents the planner has already seen
 * (summarized) and new tasks (sent in full), to keep planner input small as the
 * corpus grows.
 */
@Service
public class IncrementalContextBuilder {

    private static final Logger log = LoggerFactory.getLogger(IncrementalContextBuilder.class);

    private final PrioritymindProperties.Context settings;
    private final Clock clock;

    public IncrementalContextBuilder(PrioritymindProperties properties, Clock clock) {
        this.settings = properties.getContext();
        this.clock = clock;
    }

    /**
     * @param allTasks            every task to prioritize
     * @param baselineDocumentIds documents covered by the last successful prioritization
     * @param baselineCreatedAt   when that prioritization ran (raw ISO-8601); null if never
     */
    public IncrementalContext build(List<TaskSummary> allTasks, List<String> baselineDocumentIds,
                                    String baselineCreatedAt) {
        List<TaskSummary> tasks = allTasks == null ? List.of() : List.copyOf(allTasks);
        List<String> docIds = baselineDocumentIds == null ? List.of() : List.copyOf(baselineDocumentIds);

        if (docIds.isEmpty() || baselineCreatedAt == null) {
            log.debug("First run: all {} tasks are new", tasks.size());
            return new IncrementalContext(true, null, tasks, tasks, 0);
        }

        Set<String> baselineDocs = Set.copyOf(docIds);
        var baselineTasks = new ArrayList<TaskSummary>();
        var newTasks = new ArrayList<TaskSummary>();
        for (var task : tasks) {
            if (hasDocument(task) && baselineDocs.contains(task.documentId())) {
                baselineTasks.add(task);
            } else {
                newTasks.add(task);
            }
        }

        var summary = summarize(baselineTasks, docIds, baselineCreatedAt);
        int savings = Math.max(0,
                baselineTasks.size() * settings.getTokensPerTask() - settings.getSummaryOverheadTokens());

        log.info("Incremental context: {} baseline task(s) from {} document(s), {} new, ~{} tokens saved",
                baselineTasks.size(), summary.documentCount(), newTasks.size(), savings);
        return new IncrementalContext(false, summary, List.copyOf(newTasks), tasks, savings);
    }

    private BaselineSummary summarize(List<TaskSummary> baselineTasks, List<String> docIds, String createdAt) {
        var seenDocs = new LinkedHashSet<String>();
        baselineTasks.forEach(t -> seenDocs.add(t.documentId()));
        List<String> documentIds = seenDocs.isEmpty() ? docIds : List.copyOf(seenDocs);

        List<String> topTaskIds = baselineTasks.stream()
                .limit(settings.getRepresentativeTaskCount())
                .map(TaskSummary::taskId)
                .toList();

        Double ageHours = Timestamps.parse(createdAt)
                .map(created -> Timestamps.ageHours(created, clock.instant()))
                .orElse(null);

        return new BaselineSummary(documentIds, documentIds.size(), baselineTasks.size(),
                topTaskIds, createdAt, ageHours);
    }

    private static boolean hasDocument(TaskSummary task) {
        return task.documentId() != null && !task.documentId().isBlank();
    }
}
