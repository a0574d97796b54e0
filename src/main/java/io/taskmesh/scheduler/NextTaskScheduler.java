package io.taskmesh.scheduler;

import io.taskmesh.model.DependencyRef;
import io.taskmesh.model.Priority;
import io.taskmesh.model.Subtask;
import io.taskmesh.model.Task;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Picks the task to work on next. Stateless; the input list is never modified.
 */
public final class NextTaskScheduler {
    static final Comparator<Task> ORDER = Comparator
            .comparingInt((Task t) -> Priority.rankOf(t.priority())).reversed()
            .thenComparingInt(t -> t.dependencyList().size())
            .thenComparingInt(Task::id);

    private NextTaskScheduler() {
    }

    /**
     * Returns the highest-priority pending or in-progress task whose dependencies are all
     * complete. Ties go to fewer dependencies, then the lower id. A task stored without a
     * dependency list is never eligible; an empty list is.
     */
    public static Optional<Task> findNextTask(List<Task> tasks) {
        if (tasks == null || tasks.isEmpty()) {
            return Optional.empty();
        }
        Set<DependencyRef> completed = completedRefs(tasks);
        List<Task> eligible = new ArrayList<>();
        for (Task task : tasks) {
            if (!task.status().isActionable() || !task.hasDependencyList()) {
                continue;
            }
            if (completed.containsAll(task.dependencies())) {
                eligible.add(task);
            }
        }
        return eligible.stream().min(ORDER);
    }

    static Set<DependencyRef> completedRefs(List<Task> tasks) {
        Set<DependencyRef> completed = new HashSet<>();
        for (Task task : tasks) {
            if (task.status().isComplete()) {
                completed.add(task.ref());
            }
            for (Subtask subtask : task.subtasks()) {
                if (subtask.status().isComplete()) {
                    completed.add(subtask.ref(task.id()));
                }
            }
        }
        return completed;
    }
}
