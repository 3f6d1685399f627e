package com.prioritymind.core.graph;

import com.prioritymind.core.model.Task;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Cycle detection and topological ordering over a flat task list, using Kahn's
 * algorithm on the {@code dependsOn} references.
 * <p>
 * Tasks are addressed by id only. A dependency naming an id that is not in the
 * list contributes no edge.
 */
public final class DependencyGraph {

    private DependencyGraph() {}

    /**
     * @return true if the tasks cannot be scheduled because of at least one cycle
     *         (self-dependencies included)
     */
    public static boolean detectCycle(List<Task> tasks) {
        if (tasks == null || tasks.isEmpty()) {
            return false;
        }
        return topologicalOrder(tasks).size() != distinctIds(tasks);
    }

    /**
     * Returns task ids in an order where every prerequisite precedes its dependents.
     * Ties are broken by list order. Tasks on or behind a cycle are left out, so the
     * result is shorter than the input exactly when {@link #detectCycle} is true.
     */
    public static List<String> topologicalOrder(List<Task> tasks) {
        var inDegree = new LinkedHashMap<String, Integer>();
        var dependents = new LinkedHashMap<String, List<String>>();
        for (var task : tasks) {
            inDegree.putIfAbsent(task.id(), 0);
            dependents.putIfAbsent(task.id(), new ArrayList<>());
        }

        for (var task : tasks) {
            for (var dep : task.dependsOn()) {
                List<String> edges = dependents.get(dep);
                if (edges == null) {
                    continue;
                }
                edges.add(task.id());
                inDegree.merge(task.id(), 1, Integer::sum);
            }
        }

        var queue = new ArrayDeque<String>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) queue.add(id);
        });

        var order = new ArrayList<String>(inDegree.size());
        while (!queue.isEmpty()) {
            String id = queue.poll();
            order.add(id);
            for (var dependent : dependents.get(id)) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    queue.add(dependent);
                }
            }
        }
        return order;
    }

    /**
     * Ids of tasks that never reach in-degree zero: members of a cycle and
     * everything that depends on one.
     */
    public static List<String> unschedulable(List<Task> tasks) {
        Set<String> ordered = new HashSet<>(topologicalOrder(tasks));
        Set<String> blocked = new LinkedHashSet<>();
        for (var task : tasks) {
            if (!ordered.contains(task.id())) {
                blocked.add(task.id());
            }
        }
        return List.copyOf(blocked);
    }

    private static int distinctIds(List<Task> tasks) {
        return (int) tasks.stream().map(Task::id).distinct().count();
    }
}
