package com.prioritymind.dispatch.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.prioritymind.core.model.AdjustedPlan;
import com.prioritymind.core.model.AdjustedPlan.AdjustmentDiff;
import com.prioritymind.core.model.AdjustedPlan.AdjustmentMetadata;
import com.prioritymind.core.model.AdjustedPlan.MovedTask;
import com.prioritymind.core.model.BaselinePlan;
import com.prioritymind.core.model.BridgingTask;
import com.prioritymind.core.model.Gap;
import com.prioritymind.core.model.InsertionFailure;
import com.prioritymind.core.model.InsertionResult;
import com.prioritymind.core.model.PlanSession;
import com.prioritymind.core.model.PrioritizationResult;
import com.prioritymind.core.model.PrioritizationResult.ExcludedTask;
import com.prioritymind.core.model.Task;
import com.prioritymind.core.model.TaskSummary;
import com.prioritymind.core.planner.PlannerException;
import com.prioritymind.core.planner.PrioritizationOutcome;
import com.prioritymind.core.planner.PrioritizationOutcome.LoopMetadata;
import com.prioritymind.core.reflection.BaselineExpiredException;
import com.prioritymind.core.reflection.BaselineMissingException;
import com.prioritymind.core.session.PlanSessionService;
import com.prioritymind.core.session.PrioritizeCommand;
import com.prioritymind.core.session.SessionNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(PlanController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class PlanControllerTest {

    private static final Instant CREATED = Instant.parse("2025-06-01T12:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private PlanSessionService sessionService;

    @MockitoBean
    private SseStreamingService sseStreamingService;

    private static PrioritizationOutcome outcome() {
        var result = new PrioritizationResult(List.of("002", "001"), Map.of("002", 0.9, "001", 0.7),
                List.of(), List.of(new ExcludedTask("003", "Update wiki", "Not tied to the launch", 2)),
                "Moved the demo first", 0.82);
        return new PrioritizationOutcome(
                new BaselinePlan(List.of("002", "001"), Map.of("002", 0.9, "001", 0.7), CREATED),
                result, null, new LoopMetadata(1, false, true, 1200, 0.82, 150, 4));
    }

    // ── POST /{id}/prioritize ────────────────────────────────────────

    @Nested
    @DisplayName("POST /api/v1/sessions/{id}/prioritize")
    class Prioritize {

        @Test
        @DisplayName("returns the new baseline with loop metadata")
        void success() throws Exception {
            when(sessionService.prioritize(eq("s1"), any())).thenReturn(outcome());

            String body = objectMapper.writeValueAsString(new PrioritizeRequest("Launch the beta",
                    List.of(new Task("001", "Write docs", 2.0, List.of())),
                    List.of(new TaskSummary("001", "Write docs", "doc-a", "embedding"))));

            mockMvc.perform(post("/api/v1/sessions/s1/prioritize")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.session_id").value("s1"))
                    .andExpect(jsonPath("$.plan.ordered_task_ids", contains("002", "001")))
                    .andExpect(jsonPath("$.excluded_tasks[0].task_id").value("003"))
                    .andExpect(jsonPath("$.corrections_made").value("Moved the demo first"))
                    .andExpect(jsonPath("$.metadata.iterations").value(1))
                    .andExpect(jsonPath("$.metadata.token_savings_estimate").value(150));

            ArgumentCaptor<PrioritizeCommand> captor = ArgumentCaptor.forClass(PrioritizeCommand.class);
            verify(sessionService).prioritize(eq("s1"), captor.capture());
            assertEquals("Launch the beta", captor.getValue().outcome());
            assertEquals("doc-a", captor.getValue().taskSummaries().get(0).documentId());
        }

        @Test
        @DisplayName("returns 400 for invalid input")
        void badRequest() throws Exception {
            when(sessionService.prioritize(eq("s1"), any()))
                    .thenThrow(new IllegalArgumentException("outcome: an outcome is required before prioritizing"));

            mockMvc.perform(post("/api/v1/sessions/s1/prioritize")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error", startsWith("outcome:")));
        }

        @Test
        @DisplayName("returns 502 when the planner fails")
        void plannerFailure() throws Exception {
            when(sessionService.prioritize(eq("s1"), any())).thenThrow(new PlannerException("Planner draft failed"));

            mockMvc.perform(post("/api/v1/sessions/s1/prioritize")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"outcome\":\"Ship\"}"))
                    .andExpect(status().isBadGateway())
                    .andExpect(jsonPath("$.error").value("Planner draft failed"));
        }
    }

    // ── GET /{id} ────────────────────────────────────────────────────

    @Test
    @DisplayName("GET /sessions/{id} returns the stored session")
    void getSession() throws Exception {
        var session = new PlanSession("s1", "Launch the beta",
                List.of(new Task("001", "Write docs", 2.0, List.of())), List.of(),
                outcome().plan(), null, List.of("doc-a"), CREATED);
        when(sessionService.getSession("s1")).thenReturn(session);

        mockMvc.perform(get("/api/v1/sessions/s1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.session_id").value("s1"))
                .andExpect(jsonPath("$.tasks[0].estimated_hours").value(2.0))
                .andExpect(jsonPath("$.baseline_plan.ordered_task_ids", hasSize(2)))
                .andExpect(jsonPath("$.baseline_document_ids[0]").value("doc-a"));
    }

    @Test
    @DisplayName("GET /sessions/{id} returns 404 for unknown session")
    void getSessionNotFound() throws Exception {
        when(sessionService.getSession("nope")).thenThrow(new SessionNotFoundException("nope"));

        mockMvc.perform(get("/api/v1/sessions/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Session not found: nope"));
    }

    // ── POST /{id}/adjust ────────────────────────────────────────────

    @Nested
    @DisplayName("POST /api/v1/sessions/{id}/adjust")
    class Adjust {

        @Test
        @DisplayName("returns the adjusted plan with diff")
        void success() throws Exception {
            var adjusted = new AdjustedPlan(List.of("001", "002"), Map.of("001", 0.95, "002", 0.6),
                    new AdjustmentDiff(List.of(new MovedTask("001", 2, 1, "Matches 'demo' context")), List.of()),
                    new AdjustmentMetadata(List.of(), 1, 0, 4, List.of()));
            when(sessionService.adjust("s1")).thenReturn(adjusted);

            mockMvc.perform(post("/api/v1/sessions/s1/adjust"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.ordered_task_ids", contains("001", "002")))
                    .andExpect(jsonPath("$.diff.moved[0].from").value(2))
                    .andExpect(jsonPath("$.diff.moved[0].to").value(1))
                    .andExpect(jsonPath("$.adjustment_metadata.tasks_moved").value(1));
        }

        @Test
        @DisplayName("returns 400 with the age for an expired baseline")
        void expired() throws Exception {
            when(sessionService.adjust("s1")).thenThrow(new BaselineExpiredException(200.4, 7));

            mockMvc.perform(post("/api/v1/sessions/s1/adjust"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.age_hours").value(200))
                    .andExpect(jsonPath("$.error").exists());
        }

        @Test
        @DisplayName("returns 400 when no baseline exists")
        void missing() throws Exception {
            when(sessionService.adjust("s1")).thenThrow(new BaselineMissingException());

            mockMvc.perform(post("/api/v1/sessions/s1/adjust"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.age_hours").doesNotExist());
        }

        @Test
        @DisplayName("returns 404 for unknown session")
        void notFound() throws Exception {
            when(sessionService.adjust("nope")).thenThrow(new SessionNotFoundException("nope"));

            mockMvc.perform(post("/api/v1/sessions/nope/adjust"))
                    .andExpect(status().isNotFound());
        }
    }

    // ── POST /{id}/gaps/accept ───────────────────────────────────────

    @Nested
    @DisplayName("POST /api/v1/sessions/{id}/gaps/accept")
    class AcceptGap {

        private String body(String predecessor, String successor) throws Exception {
            return objectMapper.writeValueAsString(new AcceptGapRequest(predecessor, successor,
                    List.of(new BridgingTask("Draft the script", 1.5))));
        }

        @Test
        @DisplayName("returns inserted ids and the updated graph")
        void success() throws Exception {
            var plan = List.of(
                    new Task("001", "Write docs", 2.0, List.of()),
                    new Task("002", "Draft the script", 1.5, List.of("001")),
                    new Task("005", "Record the demo", 3.0, List.of("002")));
            when(sessionService.insertBridgingTasks(eq("s1"), eq(new Gap("001", "005")), anyList()))
                    .thenReturn(InsertionResult.succeeded(List.of("002"), plan));

            mockMvc.perform(post("/api/v1/sessions/s1/gaps/accept")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body("001", "005")))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.inserted_ids", contains("002")))
                    .andExpect(jsonPath("$.tasks", hasSize(3)))
                    .andExpect(jsonPath("$.tasks[2].depends_on", contains("002")));
        }

        @Test
        @DisplayName("returns 409 for a circular dependency")
        void cycle() throws Exception {
            when(sessionService.insertBridgingTasks(eq("s1"), any(), anyList()))
                    .thenReturn(InsertionResult.failed(InsertionFailure.CIRCULAR_DEPENDENCY, "would create a cycle"));

            mockMvc.perform(post("/api/v1/sessions/s1/gaps/accept")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body("001", "005")))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.failure").value("CIRCULAR_DEPENDENCY"));
        }

        @Test
        @DisplayName("returns 409 for an id collision")
        void collision() throws Exception {
            when(sessionService.insertBridgingTasks(eq("s1"), any(), anyList()))
                    .thenReturn(InsertionResult.failed(InsertionFailure.ID_COLLISION, "task id 002 already exists"));

            mockMvc.perform(post("/api/v1/sessions/s1/gaps/accept")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body("001", "002")))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.failure").value("ID_COLLISION"));
        }

        @Test
        @DisplayName("returns 400 for an unknown task reference")
        void reference() throws Exception {
            when(sessionService.insertBridgingTasks(eq("s1"), any(), anyList()))
                    .thenReturn(InsertionResult.failed(InsertionFailure.REFERENCE, "successor task 009 not found in plan"));

            mockMvc.perform(post("/api/v1/sessions/s1/gaps/accept")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body("001", "009")))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.failure").value("REFERENCE"));
        }

        @Test
        @DisplayName("returns 400 without calling the service when ids are missing")
        void missingIds() throws Exception {
            mockMvc.perform(post("/api/v1/sessions/s1/gaps/accept")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"successor_id\":\"005\",\"bridging_tasks\":[]}"))
                    .andExpect(status().isBadRequest());
            verifyNoInteractions(sessionService);
        }

        @Test
        @DisplayName("returns 404 for unknown session")
        void notFound() throws Exception {
            when(sessionService.insertBridgingTasks(eq("nope"), any(), anyList()))
                    .thenThrow(new SessionNotFoundException("nope"));

            mockMvc.perform(post("/api/v1/sessions/nope/gaps/accept")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body("001", "005")))
                    .andExpect(status().isNotFound());
        }
    }

    // ── GET /{id}/events ─────────────────────────────────────────────

    @Test
    @DisplayName("GET /sessions/{id}/events opens an SSE stream")
    void streamEvents() throws Exception {
        when(sseStreamingService.createEmitter("s1")).thenReturn(new SseEmitter());

        mockMvc.perform(get("/api/v1/sessions/s1/events").accept(MediaType.TEXT_EVENT_STREAM))
                .andExpect(status().isOk())
                .andExpect(request().asyncStarted());
    }
}
