package com.prioritymind.core.persistence;

import com.prioritymind.core.model.PlanSession;
import com.prioritymind.core.model.Reflection;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Storage for plan sessions, their reflections and cached task embeddings.
 * Implementations must be safe for concurrent use across sessions.
 */
public interface PlanStore {

    Optional<PlanSession> findSession(String sessionId);

    void saveSession(PlanSession session);

    /**
     * @return reflections in the order they were first saved
     */
    List<Reflection> findReflections(String sessionId);

    /**
     * Inserts the reflection, or replaces the stored one with the same id in place.
     */
    void saveReflection(String sessionId, Reflection reflection);

    Map<String, float[]> findTaskEmbeddings(String sessionId);

    void saveTaskEmbeddings(String sessionId, Map<String, float[]> embeddings);

    /**
     * Drops cached embeddings for the given task ids. Unknown ids are ignored.
     */
    void deleteTaskEmbeddings(String sessionId, Collection<String> taskIds);
}
