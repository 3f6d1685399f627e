package com.prioritymind.core.persistence;

import com.prioritymind.core.model.PlanSession;
import com.prioritymind.core.model.Reflection;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link PlanStore}. State is lost on restart.
 */
public class InMemoryPlanStore implements PlanStore {

    private final Map<String, PlanSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, List<Reflection>> reflections = new ConcurrentHashMap<>();
    private final Map<String, Map<String, float[]>> taskEmbeddings = new ConcurrentHashMap<>();

    @Override
    public Optional<PlanSession> findSession(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public void saveSession(PlanSession session) {
        sessions.put(session.sessionId(), session);
    }

    @Override
    public List<Reflection> findReflections(String sessionId) {
        List<Reflection> stored = reflections.get(sessionId);
        if (stored == null) {
            return List.of();
        }
        synchronized (stored) {
            return List.copyOf(stored);
        }
    }

    @Override
    public void saveReflection(String sessionId, Reflection reflection) {
        List<Reflection> stored = reflections.computeIfAbsent(sessionId, k -> new ArrayList<>());
        synchronized (stored) {
            for (int i = 0; i < stored.size(); i++) {
                if (stored.get(i).id().equals(reflection.id())) {
                    stored.set(i, reflection);
                    return;
                }
            }
            stored.add(reflection);
        }
    }

    @Override
    public Map<String, float[]> findTaskEmbeddings(String sessionId) {
        Map<String, float[]> stored = taskEmbeddings.get(sessionId);
        return stored == null ? Map.of() : new HashMap<>(stored);
    }

    @Override
    public void saveTaskEmbeddings(String sessionId, Map<String, float[]> embeddings) {
        taskEmbeddings.computeIfAbsent(sessionId, k -> new ConcurrentHashMap<>()).putAll(embeddings);
    }

    @Override
    public void deleteTaskEmbeddings(String sessionId, Collection<String> taskIds) {
        Map<String, float[]> stored = taskEmbeddings.get(sessionId);
        if (stored != null) {
            taskIds.forEach(stored::remove);
        }
    }
}
