package com.prioritymind.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * The pair of tasks between which bridging tasks are inserted.
 *
 * @param predecessorId task before the gap, or {@link #START_OF_PLAN} to insert at the front
 * @param successorId   task after the gap
 */
public record Gap(
    @JsonProperty("predecessor_id") String predecessorId,
    @JsonProperty("successor_id") String successorId
) implements Serializable {

    /** Predecessor id meaning "no predecessor, insert at the start of the plan". */
    public static final String START_OF_PLAN = "000";

    public boolean startsPlan() {
        return START_OF_PLAN.equals(predecessorId);
    }
}
