package com.prioritymind.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A task proposed to fill a gap between two existing tasks, before it has an id.
 */
public record BridgingTask(
    String text,
    @JsonProperty("estimated_hours") double estimatedHours
) implements Serializable {}
