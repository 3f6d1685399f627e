package com.prioritymind.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON for reflection endpoints: {@code text} on create, {@code is_active}
 * on toggle (omit it to flip the current state).
 */
public record ReflectionRequest(
    String text,
    @JsonProperty("is_active") Boolean active
) {}
