package com.prioritymind.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Minimal projection of a task used to build planner prompts.
 *
 * @param documentId  source document; null or blank when unknown
 * @param lnoCategory leverage / neutral / overhead classification, if any
 */
public record TaskSummary(
    @JsonProperty("task_id") String taskId,
    @JsonProperty("task_text") String taskText,
    @JsonProperty("document_id") String documentId,
    String source,
    @JsonProperty("lno_category") String lnoCategory
) implements Serializable {

    public TaskSummary(String taskId, String taskText, String documentId, String source) {
        this(taskId, taskText, documentId, source, null);
    }
}
