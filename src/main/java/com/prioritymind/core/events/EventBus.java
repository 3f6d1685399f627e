package com.prioritymind.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub for plan session events.
 * <p>
 * Session ids are client-chosen and sessions are never deleted, so a session's
 * subscriber list lives only while it has subscribers. Global subscribers receive
 * every session's events. Thread-safe for concurrent publish and subscribe.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Subscribers keyed by session id; a key is removed with its last subscriber. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<PlanEvent>>> bySession =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<PlanEvent>> everySession = new CopyOnWriteArrayList<>();

    /**
     * Delivers the event to the session's subscribers, then to global ones. A
     * failing subscriber does not stop delivery to the rest.
     */
    public void publish(PlanEvent event) {
        List<Consumer<PlanEvent>> sessionSubs = bySession.get(event.sessionId());
        int sessionCount = sessionSubs == null ? 0 : sessionSubs.size();
        log.debug("Publishing {} for session {} to {} session subscriber(s)",
                event.eventType(), event.sessionId(), sessionCount);

        if (sessionSubs != null) {
            sessionSubs.forEach(subscriber -> deliverSafely(subscriber, event));
        }
        everySession.forEach(subscriber -> deliverSafely(subscriber, event));
    }

    /**
     * Subscribes to one session's events. The session does not have to exist yet.
     *
     * @return handle that removes this subscriber; calling it twice is harmless
     */
    public Subscription subscribe(String sessionId, Consumer<PlanEvent> consumer) {
        bySession.compute(sessionId, (id, subs) -> {
            var list = subs == null ? new CopyOnWriteArrayList<Consumer<PlanEvent>>() : subs;
            list.add(consumer);
            return list;
        });
        return () -> bySession.computeIfPresent(sessionId, (id, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    public Subscription subscribeAll(Consumer<PlanEvent> consumer) {
        everySession.add(consumer);
        return () -> everySession.remove(consumer);
    }

    /**
     * @return number of subscribers currently listening to {@code sessionId}, globals excluded
     */
    public int subscriberCount(String sessionId) {
        List<Consumer<PlanEvent>> subs = bySession.get(sessionId);
        return subs == null ? 0 : subs.size();
    }

    int sessionsWithSubscribers() {
        return bySession.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<PlanEvent> subscriber, PlanEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber failed on {} for session {}: {}",
                    event.eventType(), event.sessionId(), e.getMessage(), e);
        }
    }
}
