package com.prioritymind.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Objects;

/**
 * A short, user-toggleable note describing current context or constraints.
 * <p>
 * {@code createdAt} is kept as the raw ISO-8601 text it was stored with; a value
 * that does not parse degrades to "no recency signal" instead of failing.
 *
 * @param embedding vector produced by the embedding collaborator; null if it was unavailable
 * @param active    whether the reflection currently influences ranking
 */
public record Reflection(
    String id,
    String text,
    @JsonProperty("created_at") String createdAt,
    float[] embedding,
    @JsonProperty("is_active") boolean active
) implements Serializable {

    public Reflection withActive(boolean newActive) {
        return new Reflection(id, text, createdAt, embedding, newActive);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Reflection other)) return false;
        return active == other.active
                && Objects.equals(id, other.id)
                && Objects.equals(text, other.text)
                && Objects.equals(createdAt, other.createdAt)
                && Arrays.equals(embedding, other.embedding);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(id, text, createdAt, active) + Arrays.hashCode(embedding);
    }

    @Override
    public String toString() {
        return "Reflection[id=" + id + ", text=" + text + ", createdAt=" + createdAt
                + ", embedding=" + (embedding == null ? "null" : embedding.length + " dims")
                + ", active=" + active + "]";
    }
}
