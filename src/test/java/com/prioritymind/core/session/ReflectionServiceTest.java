package com.prioritymind.core.session;

import com.prioritymind.core.embedding.EmbeddingClient;
import com.prioritymind.core.events.EventBus;
import com.prioritymind.core.events.PlanEvent;
import com.prioritymind.core.metrics.PrioritymindMetrics;
import com.prioritymind.core.model.Reflection;
import com.prioritymind.core.persistence.InMemoryPlanStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ReflectionServiceTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    private InMemoryPlanStore store;
    private EmbeddingClient embeddingClient;
    private SimpleMeterRegistry registry;
    private List<PlanEvent> events;
    private ReflectionService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryPlanStore();
        embeddingClient = mock(EmbeddingClient.class);
        when(embeddingClient.embed(anyString())).thenReturn(Optional.of(new float[]{1f, 0f}));
        registry = new SimpleMeterRegistry();
        var eventBus = new EventBus();
        events = new ArrayList<>();
        eventBus.subscribeAll(events::add);
        service = new ReflectionService(store, embeddingClient, new SessionLocks(), eventBus,
                new PrioritymindMetrics(registry), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("stores a trimmed, active reflection with its embedding")
        void creates() {
            Reflection created = service.create("s1", "  Focus on the launch demo  ");

            assertEquals("Focus on the launch demo", created.text());
            assertTrue(created.active());
            assertEquals(NOW.toString(), created.createdAt());
            assertArrayEquals(new float[]{1f, 0f}, created.embedding());
            assertEquals(List.of(created.id()), store.findReflections("s1").stream().map(Reflection::id).toList());
        }

        @Test
        @DisplayName("publishes an event and counts the creation")
        void eventAndMetric() {
            service.create("s1", "Travel next week");

            assertEquals(1, events.size());
            assertEquals(PlanEvent.REFLECTION_CREATED, events.get(0).eventType());
            assertEquals(1.0, registry.find("prioritymind.reflections.total")
                    .tag("action", "created").counter().count());
        }

        @Test
        @DisplayName("text outside 3..500 characters after trimming is rejected")
        void lengthLimits() {
            assertThrows(IllegalArgumentException.class, () -> service.create("s1", "  ab  "));
            assertThrows(IllegalArgumentException.class, () -> service.create("s1", null));
            assertThrows(IllegalArgumentException.class, () -> service.create("s1", "x".repeat(501)));
            assertDoesNotThrow(() -> service.create("s1", "abc"));
            assertDoesNotThrow(() -> service.create("s1", "x".repeat(500)));
        }

        @Test
        @DisplayName("rejected text is not stored")
        void rejectedNotStored() {
            var ex = assertThrows(IllegalArgumentException.class, () -> service.create("s1", "no"));

            assertTrue(ex.getMessage().startsWith("text:"));
            assertTrue(store.findReflections("s1").isEmpty());
            verifyNoInteractions(embeddingClient);
        }

        @Test
        @DisplayName("unavailable embedding still stores the reflection")
        void noEmbedding() {
            when(embeddingClient.embed(anyString())).thenReturn(Optional.empty());

            Reflection created = service.create("s1", "Low energy today");

            assertNull(created.embedding());
            assertEquals(1, store.findReflections("s1").size());
        }
    }

    @Nested
    @DisplayName("toggle")
    class Toggle {

        @Test
        @DisplayName("without a value flips the flag")
        void flips() {
            var created = service.create("s1", "Focus on hiring");

            assertFalse(service.toggle("s1", created.id(), null).active());
            assertTrue(service.toggle("s1", created.id(), null).active());
        }

        @Test
        @DisplayName("with a value sets the flag")
        void sets() {
            var created = service.create("s1", "Focus on hiring");

            assertTrue(service.toggle("s1", created.id(), true).active());
            assertFalse(service.toggle("s1", created.id(), false).active());
            assertTrue(service.activeReflections("s1").isEmpty());
        }

        @Test
        @DisplayName("unknown reflection is reported")
        void unknown() {
            assertThrows(ReflectionNotFoundException.class, () -> service.toggle("s1", "nope", null));
        }

        @Test
        @DisplayName("publishes the new state")
        void event() {
            var created = service.create("s1", "Focus on hiring");
            events.clear();

            service.toggle("s1", created.id(), false);

            assertEquals(PlanEvent.REFLECTION_TOGGLED, events.get(0).eventType());
            assertEquals(false, events.get(0).payload().get("is_active"));
        }
    }

    @Test
    @DisplayName("list is newest first with recency weights")
    void list() {
        store.saveReflection("s1", new Reflection("old", "Older note", "2025-05-12T12:00:00Z", null, true));
        store.saveReflection("s1", new Reflection("new", "Newer note", "2025-06-01T11:00:00Z", null, false));

        var views = service.list("s1");

        assertEquals(List.of("new", "old"), views.stream().map(ReflectionView::id).toList());
        assertEquals(1.0, views.get(0).recencyWeight());
        assertEquals(0.25, views.get(1).recencyWeight());
        assertFalse(views.get(0).active());
    }
}
