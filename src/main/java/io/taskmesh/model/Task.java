package io.taskmesh.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A top-level unit of work inside one tag.
 *
 * <p>{@code dependencies} is {@code null} when the stored record has no dependency list at all;
 * that is distinct from an empty list and matters to the next-task scheduler. {@code priority}
 * is {@code null} when unset.
 */
public record Task(
        int id,
        String title,
        String description,
        String details,
        String testStrategy,
        TaskStatus status,
        Priority priority,
        List<DependencyRef> dependencies,
        List<Subtask> subtasks
) {
    public Task {
        if (id <= 0) {
            throw new IllegalArgumentException("Task id must be positive: " + id);
        }
        if (title == null) title = "";
        if (description == null) description = "";
        if (details == null) details = "";
        if (testStrategy == null) testStrategy = "";
        if (status == null) status = TaskStatus.PENDING;
        dependencies = dependencies == null ? null : List.copyOf(dependencies);
        subtasks = subtasks == null ? List.of() : List.copyOf(subtasks);
    }

    public static Task of(int id, String title, TaskStatus status, Priority priority, List<DependencyRef> dependencies) {
        return new Task(id, title, "", "", "", status, priority, dependencies, List.of());
    }

    public DependencyRef.TaskRef ref() {
        return new DependencyRef.TaskRef(id);
    }

    public boolean hasDependencyList() {
        return dependencies != null;
    }

    /**
     * Dependencies as a list, empty when the record has none.
     */
    public List<DependencyRef> dependencyList() {
        return dependencies == null ? Collections.emptyList() : dependencies;
    }

    public Optional<Subtask> findSubtask(int subtaskId) {
        for (Subtask subtask : subtasks) {
            if (subtask.id() == subtaskId) {
                return Optional.of(subtask);
            }
        }
        return Optional.empty();
    }

    public int nextSubtaskId() {
        int max = 0;
        for (Subtask subtask : subtasks) {
            max = Math.max(max, subtask.id());
        }
        return max + 1;
    }

    public Task withId(int value) {
        return new Task(value, title, description, details, testStrategy, status, priority, dependencies, subtasks);
    }

    public Task withTitle(String value) {
        return new Task(id, value, description, details, testStrategy, status, priority, dependencies, subtasks);
    }

    public Task withStatus(TaskStatus value) {
        return new Task(id, title, description, details, testStrategy, value, priority, dependencies, subtasks);
    }

    public Task withDependencies(List<DependencyRef> value) {
        return new Task(id, title, description, details, testStrategy, status, priority, value, subtasks);
    }

    public Task withSubtasks(List<Subtask> value) {
        return new Task(id, title, description, details, testStrategy, status, priority, dependencies, value);
    }

    public Task withoutDependency(DependencyRef ref) {
        if (dependencies == null) {
            return this;
        }
        List<DependencyRef> kept = new ArrayList<>(dependencies);
        kept.removeIf(ref::equals);
        return withDependencies(kept);
    }

    public Task replaceSubtask(Subtask replacement) {
        List<Subtask> out = new ArrayList<>(subtasks.size());
        for (Subtask subtask : subtasks) {
            out.add(subtask.id() == replacement.id() ? replacement : subtask);
        }
        return withSubtasks(out);
    }
}
