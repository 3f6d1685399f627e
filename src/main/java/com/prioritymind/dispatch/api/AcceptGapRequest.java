package com.prioritymind.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.prioritymind.core.model.BridgingTask;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/sessions/{id}/gaps/accept.
 *
 * @param predecessorId task before the gap, or "000" for the start of the plan
 */
public record AcceptGapRequest(
    @JsonProperty("predecessor_id") String predecessorId,
    @JsonProperty("successor_id") String successorId,
    @JsonProperty("bridging_tasks") List<BridgingTask> bridgingTasks
) {}
