package com.prioritymind.core.embedding;

import java.util.List;
import java.util.Optional;

/**
 * Produces fixed-length vectors for task and reflection text.
 * <p>
 * Callers treat a missing vector as "no similarity signal", so implementations
 * report an unavailable model with an empty result instead of an exception.
 */
public interface EmbeddingClient {

    Optional<float[]> embed(String text);

    /**
     * @return one vector per input in the same order, or an empty list if the batch failed
     */
    List<float[]> embedAll(List<String> texts);
}
