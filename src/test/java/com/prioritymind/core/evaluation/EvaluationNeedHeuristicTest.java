package com.prioritymind.core.evaluation;

import com.prioritymind.core.config.PrioritymindProperties;
import com.prioritymind.core.model.BaselinePlan;
import com.prioritymind.core.model.PrioritizationResult;
import com.prioritymind.core.model.PrioritizationResult.IncludedTask;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class EvaluationNeedHeuristicTest {

    private final EvaluationNeedHeuristic heuristic = new EvaluationNeedHeuristic(new PrioritymindProperties());

    private static List<String> ids(int count) {
        return IntStream.range(0, count).mapToObj(i -> "t" + i).toList();
    }

    private static PrioritizationResult result(List<String> order, double confidence, String corrections) {
        List<IncludedTask> included = order.stream().map(id -> new IncludedTask(id, "aligned", 8)).toList();
        return new PrioritizationResult(order, Map.of(), included, List.of(), corrections, confidence);
    }

    private static BaselinePlan plan(List<String> order) {
        return new BaselinePlan(order, Map.of(), Instant.parse("2025-06-01T00:00:00Z"));
    }

    @Nested
    @DisplayName("needsEvaluation")
    class Needs {

        @Test
        @DisplayName("confident, complete draft on first run skips evaluation")
        void confidentDraft() {
            assertFalse(heuristic.needsEvaluation(result(ids(12), 0.9, "none"), null));
        }

        @Test
        @DisplayName("low confidence triggers evaluation")
        void lowConfidence() {
            assertTrue(heuristic.needsEvaluation(result(ids(12), 0.69, null), null));
        }

        @Test
        @DisplayName("confidence exactly at the threshold does not trigger")
        void confidenceAtThreshold() {
            assertFalse(heuristic.needsEvaluation(result(ids(12), 0.7, null), null));
        }

        @Test
        @DisplayName("fewer than ten included tasks triggers evaluation")
        void fewTasks() {
            assertTrue(heuristic.needsEvaluation(result(ids(9), 0.95, null), null));
            assertFalse(heuristic.needsEvaluation(result(ids(10), 0.95, null), null));
        }

        @Test
        @DisplayName("long corrections note triggers evaluation")
        void longCorrections() {
            assertTrue(heuristic.needsEvaluation(result(ids(12), 0.9, "x".repeat(101)), null));
            assertFalse(heuristic.needsEvaluation(result(ids(12), 0.9, "x".repeat(100)), null));
        }

        @Test
        @DisplayName("major movement against the previous plan triggers evaluation")
        void movement() {
            var previous = ids(12);
            var reversed = new ArrayList<>(previous);
            Collections.reverse(reversed);

            assertTrue(heuristic.needsEvaluation(result(reversed, 0.9, null), plan(previous)));
            assertFalse(heuristic.needsEvaluation(result(previous, 0.9, null), plan(previous)));
        }
    }

    @Nested
    @DisplayName("hasMajorMovement")
    class Movement {

        @Test
        @DisplayName("empty or missing orderings never count as movement")
        void empty() {
            assertFalse(heuristic.hasMajorMovement(List.of(), ids(3)));
            assertFalse(heuristic.hasMajorMovement(ids(3), null));
        }

        @Test
        @DisplayName("moves of five ranks or fewer are not major")
        void smallMoves() {
            var previous = ids(10);
            var current = new ArrayList<>(previous);
            Collections.rotate(current, 5);

            assertFalse(heuristic.hasMajorMovement(current, previous));
        }

        @Test
        @DisplayName("ratio is measured over tasks present in both orderings")
        void commonTasksOnly() {
            // t0 moves from rank 0 to rank 6; the padding tasks are new and do not count
            List<String> previous = List.of("t0", "t1", "t2");
            List<String> current = List.of("t1", "t2", "n1", "n2", "n3", "n4", "t0");

            assertTrue(heuristic.hasMajorMovement(current, previous));
        }

        @Test
        @DisplayName("a share of exactly thirty percent is not enough")
        void ratioBoundary() {
            // 10 common tasks, 3 moved by more than five ranks
            List<String> previous = List.of("a", "b", "c", "d", "e", "f", "g", "h", "i", "j");
            List<String> current = List.of("d", "e", "f", "g", "h", "i", "j", "a", "b", "c");

            assertFalse(heuristic.hasMajorMovement(current, previous));
        }

        @Test
        @DisplayName("disjoint orderings have no common tasks and no movement")
        void disjoint() {
            assertFalse(heuristic.hasMajorMovement(List.of("x", "y"), List.of("a", "b")));
        }
    }
}
