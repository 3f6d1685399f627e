package com.prioritymind.core.graph;

import com.prioritymind.core.model.BridgingTask;
import com.prioritymind.core.model.Gap;
import com.prioritymind.core.model.InsertionFailure;
import com.prioritymind.core.model.InsertionResult;
import com.prioritymind.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Splices bridging tasks into a plan between a predecessor and a successor,
 * producing the chain {@code predecessor -> new[0] -> ... -> new[n-1] -> successor}.
 * <p>
 * The input plan is never modified. All rewiring happens on a scratch copy that is
 * returned only after the resulting graph passes cycle detection.
 */
@Service
public class BridgingTaskInserter {

    private static final Logger log = LoggerFactory.getLogger(BridgingTaskInserter.class);

    private static final int ID_WIDTH = 3;

    static final String CIRCULAR_DEPENDENCY_MESSAGE =
            "Cannot insert tasks - would create circular dependency chain. Please review the plan's dependencies.";

    /**
     * Inserts {@code bridgingTasks} into the gap.
     *
     * @param gap           predecessor/successor pair; the predecessor may be {@link Gap#START_OF_PLAN}
     * @param bridgingTasks tasks to insert, in chain order; empty is a no-op
     * @param currentPlan   the plan to insert into; left untouched
     * @return success with the new plan and inserted ids, or a failure naming the rejected check
     */
    public InsertionResult insertBridgingTasks(Gap gap, List<BridgingTask> bridgingTasks, List<Task> currentPlan) {
        if (bridgingTasks == null || bridgingTasks.isEmpty()) {
            return InsertionResult.succeeded(List.of(), currentPlan);
        }

        for (var bridging : bridgingTasks) {
            String error = validate(bridging);
            if (error != null) {
                log.info("Rejected bridging insertion {} -> {}: {}", gap.predecessorId(), gap.successorId(), error);
                return InsertionResult.failed(InsertionFailure.VALIDATION, error);
            }
        }

        boolean atStart = gap.startsPlan();
        int predecessorIndex = atStart ? -1 : indexOf(currentPlan, gap.predecessorId());
        if (!atStart && predecessorIndex < 0) {
            return InsertionResult.failed(InsertionFailure.REFERENCE,
                    "predecessor task " + gap.predecessorId() + " not found in plan");
        }
        int successorIndex = indexOf(currentPlan, gap.successorId());
        if (successorIndex < 0) {
            return InsertionResult.failed(InsertionFailure.REFERENCE,
                    "successor task " + gap.successorId() + " not found in plan");
        }

        // At the start of the plan the ids are taken from just below the successor
        String anchorId = atStart ? gap.successorId() : gap.predecessorId();
        Integer anchorNumber = parseSequence(anchorId);
        if (anchorNumber == null) {
            return InsertionResult.failed(InsertionFailure.VALIDATION,
                    (atStart ? "successor_id " : "predecessor_id ") + anchorId + " is not a numeric sequence id");
        }
        int firstNumber = atStart ? anchorNumber - bridgingTasks.size() : anchorNumber + 1;
        if (firstNumber < 1) {
            return InsertionResult.failed(InsertionFailure.ID_COLLISION,
                    "no free ids before successor " + gap.successorId() + " for "
                            + bridgingTasks.size() + " task(s)");
        }

        List<String> newIds = allocateIds(firstNumber, bridgingTasks.size());
        Set<String> existingIds = new HashSet<>();
        currentPlan.forEach(t -> existingIds.add(t.id()));
        for (var id : newIds) {
            if (existingIds.contains(id)) {
                return InsertionResult.failed(InsertionFailure.ID_COLLISION,
                        "task id " + id + " already exists; no room between "
                                + gap.predecessorId() + " and " + gap.successorId());
            }
        }

        var newTasks = new ArrayList<Task>(bridgingTasks.size());
        for (int i = 0; i < bridgingTasks.size(); i++) {
            var bridging = bridgingTasks.get(i);
            List<String> deps;
            if (i == 0) {
                deps = atStart ? List.of() : List.of(gap.predecessorId());
            } else {
                deps = List.of(newIds.get(i - 1));
            }
            newTasks.add(new Task(newIds.get(i), bridging.text().trim(), bridging.estimatedHours(), deps));
        }

        // Scratch copy: records are immutable, so a new list with rewired successor is enough
        var staged = new ArrayList<Task>(currentPlan.size() + newTasks.size());
        staged.addAll(currentPlan);
        String lastNewId = newIds.get(newIds.size() - 1);
        Task successor = staged.get(successorIndex);
        staged.set(successorIndex, successor.withDependsOn(
                rewireSuccessor(successor.dependsOn(), atStart ? null : gap.predecessorId(), lastNewId)));
        staged.addAll(predecessorIndex + 1, newTasks);

        if (DependencyGraph.detectCycle(staged)) {
            log.warn("Rejected bridging insertion {} -> {}: cycle among {}", gap.predecessorId(), gap.successorId(),
                    DependencyGraph.unschedulable(staged));
            return InsertionResult.failed(InsertionFailure.CIRCULAR_DEPENDENCY, CIRCULAR_DEPENDENCY_MESSAGE);
        }

        log.info("Inserted {} bridging task(s) {} between {} and {}", newIds.size(), newIds,
                gap.predecessorId(), gap.successorId());
        return InsertionResult.succeeded(newIds, staged);
    }

    private static String validate(BridgingTask task) {
        if (task.text() == null || task.text().isBlank()) {
            return "text: task text cannot be empty";
        }
        if (!(task.estimatedHours() > 0)) {
            return "estimated_hours: must be positive (was " + task.estimatedHours() + ")";
        }
        return null;
    }

    /**
     * Replaces the dependency on the predecessor in place, keeping the successor's
     * other prerequisites in their original positions. Without a predecessor the
     * last new id goes first.
     */
    private static List<String> rewireSuccessor(List<String> deps, String predecessorId, String lastNewId) {
        var rewired = new ArrayList<String>(deps.size() + 1);
        if (predecessorId == null) {
            rewired.add(lastNewId);
            deps.stream().filter(dep -> !dep.equals(lastNewId)).forEach(rewired::add);
            return rewired;
        }
        boolean replaced = false;
        for (var dep : deps) {
            if (!replaced && dep.equals(predecessorId)) {
                rewired.add(lastNewId);
                replaced = true;
            } else if (!dep.equals(lastNewId)) {
                rewired.add(dep);
            }
        }
        if (!replaced) {
            rewired.add(lastNewId);
        }
        return rewired;
    }

    private static List<String> allocateIds(int firstNumber, int count) {
        var ids = new ArrayList<String>(count);
        for (int i = 0; i < count; i++) {
            ids.add(String.format("%0" + ID_WIDTH + "d", firstNumber + i));
        }
        return ids;
    }

    private static Integer parseSequence(String id) {
        try {
            return Integer.parseInt(id.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static int indexOf(List<Task> plan, String id) {
        for (int i = 0; i < plan.size(); i++) {
            if (plan.get(i).id().equals(id)) {
                return i;
            }
        }
        return -1;
    }
}
