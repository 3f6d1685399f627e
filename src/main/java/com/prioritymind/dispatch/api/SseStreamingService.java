package com.prioritymind.dispatch.api;

import com.prioritymind.core.events.EventBus;
import com.prioritymind.core.events.PlanEvent;
import com.prioritymind.core.model.PlanSession;
import com.prioritymind.core.persistence.PlanStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Streams a session's {@link PlanEvent}s to UI clients over SSE.
 * <p>
 * A client that connects after a run would otherwise see nothing until the next
 * change, so each new emitter first receives a {@value #SNAPSHOT_EVENT} frame with
 * the session's current task count and orderings. Sessions that were never
 * prioritized get no snapshot, only live events.
 * <p>
 * Subscriptions are dropped when the emitter completes, times out or errors. A
 * comment frame every 30 seconds keeps idle connections open through proxies;
 * EventSource clients ignore comments.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    static final String SNAPSHOT_EVENT = "session.snapshot";

    /** Reflection toggles can be minutes apart, so emitters live for 30 minutes. */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final EventBus eventBus;
    private final PlanStore store;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus, PlanStore store) {
        this(eventBus, store, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, PlanStore store, long timeoutMs) {
        this.eventBus = eventBus;
        this.store = store;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
        log.info("SSE heartbeat every {}s", HEARTBEAT_INTERVAL_SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Opens a stream for {@code sessionId}. The session does not have to exist;
     * events start flowing once it is created.
     */
    public SseEmitter createEmitter(String sessionId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        EventBus.Subscription subscription = eventBus.subscribe(sessionId, event -> sendEvent(emitter, event));

        var registration = new EmitterRegistration(sessionId, emitter, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> cleanup(registration));
        emitter.onError(ex -> {
            log.debug("SSE emitter error for session {}: {}", sessionId, ex.getMessage());
            cleanup(registration);
        });

        Optional<PlanSession> session = store.findSession(sessionId);
        try {
            emitter.send(SseEmitter.event().comment("connected"));
            if (session.isPresent()) {
                emitter.send(SseEmitter.event().name(SNAPSHOT_EVENT).data(snapshotOf(session.get())));
            }
        } catch (IOException e) {
            log.warn("Failed to send opening frames for session {}: {}", sessionId, e.getMessage());
        }

        log.info("SSE stream opened for session {} ({} listener(s), snapshot={})",
                sessionId, eventBus.subscriberCount(sessionId), session.isPresent());
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    public int activeEmitterCount(String sessionId) {
        return (int) activeRegistrations.stream().filter(r -> r.sessionId().equals(sessionId)).count();
    }

    /**
     * Current state of a session as sent in the opening snapshot frame. The adjusted
     * ordering is present only once reflections have been applied to this baseline.
     */
    static Map<String, Object> snapshotOf(PlanSession session) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("session_id", session.sessionId());
        data.put("task_count", session.tasks().size());
        if (session.baselinePlan() != null) {
            data.put("baseline_task_ids", session.baselinePlan().orderedTaskIds());
            if (session.baselinePlan().createdAt() != null) {
                data.put("baseline_created_at", session.baselinePlan().createdAt().toString());
            }
        }
        if (session.adjustedPlan() != null) {
            data.put("adjusted_task_ids", session.adjustedPlan().orderedTaskIds());
        }
        if (session.updatedAt() != null) {
            data.put("updated_at", session.updatedAt().toString());
        }
        return data;
    }

    private void sendHeartbeats() {
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter().send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                // onError/onCompletion callbacks remove the registration
                log.debug("Heartbeat failed for session {}: {}", registration.sessionId(), e.getMessage());
            }
        }
    }

    private void sendEvent(SseEmitter emitter, PlanEvent event) {
        try {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("session_id", event.sessionId());
            data.putAll(event.payload());
            data.put("timestamp", event.timestamp().toString());
            emitter.send(SseEmitter.event().name(event.eventType()).data(data));
        } catch (IOException e) {
            log.debug("Failed to send {} for session {}: {}",
                    event.eventType(), event.sessionId(), e.getMessage());
        }
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription().unsubscribe();
        activeRegistrations.remove(registration);
        log.debug("SSE stream closed for session {}", registration.sessionId());
    }

    private record EmitterRegistration(
            String sessionId,
            SseEmitter emitter,
            EventBus.Subscription subscription
    ) {}
}
