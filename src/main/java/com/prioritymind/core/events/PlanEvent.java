package com.prioritymind.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A change to a plan session, streamed to the UI over SSE.
 *
 * @param eventType one of the constants below
 * @param sessionId the session this event belongs to
 * @param payload   event-specific data
 * @param timestamp when the event occurred
 */
public record PlanEvent(
    String eventType,
    String sessionId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String PLAN_PRIORITIZED = "plan.prioritized";
    public static final String PLAN_ADJUSTED = "plan.adjusted";
    public static final String PLAN_TASKS_INSERTED = "plan.tasks_inserted";
    public static final String REFLECTION_CREATED = "reflection.created";
    public static final String REFLECTION_TOGGLED = "reflection.toggled";
}
