package com.prioritymind.core.reflection;

/**
 * Scores how related two embedding vectors are.
 */
@FunctionalInterface
public interface SimilarityService {

    /**
     * @return similarity in [0,1]; 0 when either vector is missing or empty
     */
    double similarity(float[] a, float[] b);
}
