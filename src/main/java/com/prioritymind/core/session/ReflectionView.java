package com.prioritymind.core.session;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.prioritymind.core.model.Reflection;

/**
 * A reflection as shown to the user, with its current recency weight.
 */
public record ReflectionView(
    String id,
    String text,
    @JsonProperty("created_at") String createdAt,
    @JsonProperty("is_active") boolean active,
    @JsonProperty("recency_weight") double recencyWeight
) {

    static ReflectionView of(Reflection reflection, double recencyWeight) {
        return new ReflectionView(reflection.id(), reflection.text(), reflection.createdAt(),
                reflection.active(), recencyWeight);
    }
}
