package com.prioritymind.core.reflection;

import org.springframework.stereotype.Service;

/**
 * Cosine similarity, with negative correlation clamped to zero.
 */
@Service
public class CosineSimilarityService implements SimilarityService {

    @Override
    public double similarity(float[] a, float[] b) {
        if (a == null || b == null || a.length == 0 || b.length == 0) {
            return 0.0;
        }
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                    "Embeddings must have same dimension (" + a.length + " vs " + b.length + ")");
        }

        double dotProduct = 0.0;
        double norm1 = 0.0;
        double norm2 = 0.0;
        for (int i = 0; i < a.length; i++) {
            dotProduct += (double) a[i] * b[i];
            norm1 += (double) a[i] * a[i];
            norm2 += (double) b[i] * b[i];
        }
        if (norm1 == 0.0 || norm2 == 0.0) {
            return 0.0;
        }

        double cosine = dotProduct / (Math.sqrt(norm1) * Math.sqrt(norm2));
        return Math.max(0.0, Math.min(1.0, cosine));
    }
}
