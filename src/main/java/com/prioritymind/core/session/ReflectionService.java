package com.prioritymind.core.session;

import com.prioritymind.core.embedding.EmbeddingClient;
import com.prioritymind.core.events.EventBus;
import com.prioritymind.core.events.PlanEvent;
import com.prioritymind.core.metrics.PrioritymindMetrics;
import com.prioritymind.core.model.Reflection;
import com.prioritymind.core.persistence.PlanStore;
import com.prioritymind.core.reflection.RecencyWeights;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Creates, lists and toggles a session's reflections. Reflections are never deleted;
 * toggling only flips whether they count.
 */
@Service
public class ReflectionService {

    private static final Logger log = LoggerFactory.getLogger(ReflectionService.class);

    static final int MIN_TEXT_LENGTH = 3;
    static final int MAX_TEXT_LENGTH = 500;

    private final PlanStore store;
    private final EmbeddingClient embeddingClient;
    private final SessionLocks locks;
    private final EventBus eventBus;
    private final PrioritymindMetrics metrics;
    private final Clock clock;

    public ReflectionService(PlanStore store, EmbeddingClient embeddingClient, SessionLocks locks,
                             EventBus eventBus, PrioritymindMetrics metrics, Clock clock) {
        this.store = store;
        this.embeddingClient = embeddingClient;
        this.locks = locks;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Stores a new active reflection. The embedding is computed now; if the model is
     * unavailable the reflection is kept without one and never matches any task.
     *
     * @throws IllegalArgumentException if the trimmed text is shorter than 3 or longer than 500 characters
     */
    public Reflection create(String sessionId, String text) {
        String trimmed = text == null ? "" : text.trim();
        if (trimmed.length() < MIN_TEXT_LENGTH || trimmed.length() > MAX_TEXT_LENGTH) {
            throw new IllegalArgumentException("text: reflection must be between "
                    + MIN_TEXT_LENGTH + " and " + MAX_TEXT_LENGTH + " characters");
        }
        float[] embedding = embeddingClient.embed(trimmed).orElse(null);
        if (embedding == null) {
            log.warn("Storing reflection without embedding; it will not affect ranking");
        }

        var reflection = new Reflection(UUID.randomUUID().toString(), trimmed,
                clock.instant().toString(), embedding, true);
        locks.withLock(sessionId, "reflection.create", () -> {
            store.saveReflection(sessionId, reflection);
            return reflection;
        });

        log.info("Created reflection {} for session {}", reflection.id(), sessionId);
        metrics.recordReflection("created");
        eventBus.publish(new PlanEvent(PlanEvent.REFLECTION_CREATED, sessionId,
                Map.of("reflection_id", reflection.id(), "text", reflection.text()), clock.instant()));
        return reflection;
    }

    /**
     * Sets the reflection's active flag, or flips it when {@code active} is null.
     *
     * @throws ReflectionNotFoundException if the session has no such reflection
     */
    public Reflection toggle(String sessionId, String reflectionId, Boolean active) {
        Reflection toggled = locks.withLock(sessionId, "reflection.toggle", () -> {
            Reflection current = store.findReflections(sessionId).stream()
                    .filter(r -> r.id().equals(reflectionId))
                    .findFirst()
                    .orElseThrow(() -> new ReflectionNotFoundException(sessionId, reflectionId));
            Reflection updated = current.withActive(active == null ? !current.active() : active);
            store.saveReflection(sessionId, updated);
            return updated;
        });

        log.info("Reflection {} is now {}", reflectionId, toggled.active() ? "active" : "inactive");
        metrics.recordReflection(toggled.active() ? "activated" : "deactivated");
        eventBus.publish(new PlanEvent(PlanEvent.REFLECTION_TOGGLED, sessionId,
                Map.of("reflection_id", reflectionId, "is_active", toggled.active()), clock.instant()));
        return toggled;
    }

    /**
     * All reflections, newest first, with their recency weight as of now.
     */
    public List<ReflectionView> list(String sessionId) {
        var views = new ArrayList<ReflectionView>();
        for (var reflection : store.findReflections(sessionId)) {
            views.add(ReflectionView.of(reflection, RecencyWeights.weightOf(reflection.createdAt(), clock)));
        }
        Collections.reverse(views);
        return views;
    }

    public List<Reflection> activeReflections(String sessionId) {
        return store.findReflections(sessionId).stream().filter(Reflection::active).toList();
    }
}
