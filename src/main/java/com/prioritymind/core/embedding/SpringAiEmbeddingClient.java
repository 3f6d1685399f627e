package com.prioritymind.core.embedding;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingResponse;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * {@link EmbeddingClient} over the Spring AI {@link EmbeddingModel} configured for the app.
 */
@Service
public class SpringAiEmbeddingClient implements EmbeddingClient {

    private static final Logger log = LoggerFactory.getLogger(SpringAiEmbeddingClient.class);

    private final EmbeddingModel embeddingModel;

    public SpringAiEmbeddingClient(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
        log.info("SpringAiEmbeddingClient initialized with {}", embeddingModel.getClass().getSimpleName());
    }

    @Override
    public Optional<float[]> embed(String text) {
        if (text == null || text.isBlank()) {
            log.warn("Cannot generate embedding for empty text");
            return Optional.empty();
        }
        List<float[]> vectors = embedAll(List.of(text));
        return vectors.isEmpty() ? Optional.empty() : Optional.of(vectors.get(0));
    }

    @Override
    public List<float[]> embedAll(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        try {
            EmbeddingResponse response = embeddingModel.embedForResponse(texts);
            if (response.getResults().size() != texts.size()) {
                log.warn("Embedding model returned {} vectors for {} texts", response.getResults().size(), texts.size());
                return List.of();
            }
            return response.getResults().stream().map(r -> r.getOutput()).toList();
        } catch (RuntimeException e) {
            log.error("Failed to generate embeddings for {} text(s)", texts.size(), e);
            return List.of();
        }
    }
}
