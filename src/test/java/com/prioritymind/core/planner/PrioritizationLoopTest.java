package com.prioritymind.core.planner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.prioritymind.core.config.PrioritymindProperties;
import com.prioritymind.core.context.IncrementalContextBuilder;
import com.prioritymind.core.context.IncrementalContextFormatter;
import com.prioritymind.core.evaluation.EvaluationNeedHeuristic;
import com.prioritymind.core.model.BaselinePlan;
import com.prioritymind.core.model.EvaluationResult;
import com.prioritymind.core.model.EvaluationResult.Status;
import com.prioritymind.core.model.PrioritizationResult;
import com.prioritymind.core.model.PrioritizationResult.IncludedTask;
import com.prioritymind.core.model.TaskSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class PrioritizationLoopTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    private PlannerClient plannerClient;
    private PrioritymindProperties properties;
    private Clock clock;

    @BeforeEach
    void setUp() {
        plannerClient = mock(PlannerClient.class);
        properties = new PrioritymindProperties();
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
    }

    private PrioritizationLoop loop() {
        return new PrioritizationLoop(plannerClient,
                new IncrementalContextBuilder(properties, clock),
                new IncrementalContextFormatter(new ObjectMapper(), properties),
                new EvaluationNeedHeuristic(properties),
                properties, clock);
    }

    private static List<String> ids(int count) {
        return IntStream.range(0, count).mapToObj(i -> "t" + i).toList();
    }

    private static PrioritizationResult draft(List<String> order, double confidence) {
        var scores = new LinkedHashMap<String, Double>();
        order.forEach(id -> scores.put(id, confidence));
        List<IncludedTask> included = order.stream().map(id -> new IncludedTask(id, "aligned", 8)).toList();
        return new PrioritizationResult(order, scores, included, List.of(), null, confidence);
    }

    private static PlannerRequest request(BaselinePlan previous, List<String> docIds, String createdAt) {
        List<TaskSummary> tasks = IntStream.range(0, 12)
                .mapToObj(i -> new TaskSummary("t" + i, "Task " + i, i < 6 ? "doc-a" : "doc-b", "embedding"))
                .toList();
        return new PlannerRequest("s1", "Launch the beta", List.of("Focus on onboarding"), tasks,
                previous, docIds, createdAt);
    }

    @Nested
    @DisplayName("evaluation skipped")
    class Skipped {

        @Test
        @DisplayName("confident draft is returned after a single planner call")
        void singleDraft() {
            when(plannerClient.generate(any())).thenReturn(draft(ids(12), 0.9));

            var outcome = loop().prioritize(request(null, List.of(), null));

            verify(plannerClient, times(1)).generate(any());
            verify(plannerClient, never()).evaluate(any(), any());
            assertEquals(1, outcome.metadata().iterations());
            assertFalse(outcome.metadata().evaluationTriggered());
            assertTrue(outcome.metadata().converged());
            assertNull(outcome.evaluation());
            assertEquals(0.9, outcome.metadata().finalConfidence());
            assertEquals(ids(12), outcome.plan().orderedTaskIds());
            assertEquals(NOW, outcome.plan().createdAt());
        }

        @Test
        @DisplayName("first draft sees only tasks outside the baseline documents")
        void incrementalInput() {
            when(plannerClient.generate(any())).thenReturn(draft(ids(12), 0.9));

            var outcome = loop().prioritize(request(null, List.of("doc-a"), "2025-06-01T06:00:00Z"));

            ArgumentCaptor<PlannerInput> captor = ArgumentCaptor.forClass(PlannerInput.class);
            verify(plannerClient).generate(captor.capture());
            var input = captor.getValue();
            assertEquals(1, input.iteration());
            assertEquals(6, input.context().newTaskCount());
            assertEquals(12, input.context().taskCount());
            assertTrue(input.context().baselineSummary().startsWith("BASELINE CONTEXT"));
            assertEquals(6, outcome.metadata().newTaskCount());
            assertEquals(200, outcome.metadata().tokenSavingsEstimate());
        }
    }

    @Nested
    @DisplayName("evaluation triggered")
    class Triggered {

        @Test
        @DisplayName("passing evaluation converges on the first draft")
        void passFirst() {
            when(plannerClient.generate(any())).thenReturn(draft(ids(12), 0.5));
            when(plannerClient.evaluate(any(), any())).thenReturn(new EvaluationResult(Status.PASS, "good"));

            var outcome = loop().prioritize(request(null, List.of(), null));

            assertEquals(1, outcome.metadata().iterations());
            assertTrue(outcome.metadata().evaluationTriggered());
            assertTrue(outcome.metadata().converged());
            assertEquals(Status.PASS, outcome.evaluation().status());
        }

        @Test
        @DisplayName("feedback is passed to the next draft and a later pass converges")
        void refineThenPass() {
            when(plannerClient.generate(any()))
                    .thenReturn(draft(ids(12), 0.5))
                    .thenReturn(draft(ids(12), 0.85));
            when(plannerClient.evaluate(any(), any()))
                    .thenReturn(new EvaluationResult(Status.NEEDS_IMPROVEMENT, "Put t3 first"))
                    .thenReturn(new EvaluationResult(Status.PASS, "ok"));

            var outcome = loop().prioritize(request(null, List.of(), null));

            ArgumentCaptor<PlannerInput> captor = ArgumentCaptor.forClass(PlannerInput.class);
            verify(plannerClient, times(2)).generate(captor.capture());
            assertNull(captor.getAllValues().get(0).evaluatorFeedback());
            assertEquals("Put t3 first", captor.getAllValues().get(1).evaluatorFeedback());
            assertEquals(2, captor.getAllValues().get(1).iteration());
            assertEquals(2, outcome.metadata().iterations());
            assertTrue(outcome.metadata().converged());
            assertEquals(0.85, outcome.metadata().finalConfidence());
        }

        @Test
        @DisplayName("never more than three drafts, keeping the last one unconverged")
        void capped() {
            when(plannerClient.generate(any()))
                    .thenReturn(draft(ids(12), 0.4))
                    .thenReturn(draft(ids(12), 0.5))
                    .thenReturn(draft(ids(12), 0.6));
            when(plannerClient.evaluate(any(), any()))
                    .thenReturn(new EvaluationResult(Status.FAIL, "still wrong"));

            var outcome = loop().prioritize(request(null, List.of(), null));

            verify(plannerClient, times(3)).generate(any());
            verify(plannerClient, times(3)).evaluate(any(), any());
            assertEquals(3, outcome.metadata().iterations());
            assertFalse(outcome.metadata().converged());
            assertEquals(0.6, outcome.result().confidence());
            assertEquals(Status.FAIL, outcome.evaluation().status());
        }

        @Test
        @DisplayName("configured iterations above three are clamped")
        void clampIterations() {
            properties.getEvaluation().setMaxIterations(10);
            when(plannerClient.generate(any())).thenReturn(draft(ids(12), 0.4));
            when(plannerClient.evaluate(any(), any()))
                    .thenReturn(new EvaluationResult(Status.NEEDS_IMPROVEMENT, "again"));

            var outcome = loop().prioritize(request(null, List.of(), null));

            verify(plannerClient, times(3)).generate(any());
            assertEquals(3, outcome.metadata().iterations());
        }

        @Test
        @DisplayName("evaluator failure keeps the current draft")
        void evaluatorFailure() {
            when(plannerClient.generate(any())).thenReturn(draft(ids(12), 0.5));
            when(plannerClient.evaluate(any(), any())).thenThrow(new PlannerException("timeout"));

            var outcome = loop().prioritize(request(null, List.of(), null));

            verify(plannerClient, times(1)).generate(any());
            assertEquals(1, outcome.metadata().iterations());
            assertTrue(outcome.metadata().evaluationTriggered());
            assertFalse(outcome.metadata().converged());
            assertNull(outcome.evaluation());
            assertEquals(ids(12), outcome.plan().orderedTaskIds());
        }

        @Test
        @DisplayName("generator failure propagates")
        void generatorFailure() {
            when(plannerClient.generate(any())).thenThrow(new PlannerException("down"));

            assertThrows(PlannerException.class, () -> loop().prioritize(request(null, List.of(), null)));
        }
    }

    @Test
    @DisplayName("baseline plan drops duplicate ids and clamps scores")
    void baselineNormalization() {
        var scores = new LinkedHashMap<String, Double>();
        scores.put("t0", 1.4);
        scores.put("t1", -0.2);
        var messy = new PrioritizationResult(List.of("t0", "t1", "t0"), scores,
                ids(12).stream().map(id -> new IncludedTask(id, "r", 5)).toList(), List.of(), null, 0.9);
        when(plannerClient.generate(any())).thenReturn(messy);

        var plan = loop().prioritize(request(null, List.of(), null)).plan();

        assertEquals(List.of("t0", "t1"), plan.orderedTaskIds());
        assertEquals(1.0, plan.confidenceScores().get("t0"));
        assertEquals(0.0, plan.confidenceScores().get("t1"));
    }
}
