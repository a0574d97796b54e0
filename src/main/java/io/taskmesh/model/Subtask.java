package io.taskmesh.model;

import java.util.ArrayList;
import java.util.List;

public record Subtask(
        int id,
        String title,
        String description,
        String details,
        String testStrategy,
        TaskStatus status,
        List<DependencyRef> dependencies
) {
    public Subtask {
        if (id <= 0) {
            throw new IllegalArgumentException("Subtask id must be positive: " + id);
        }
        if (title == null) title = "";
        if (description == null) description = "";
        if (details == null) details = "";
        if (testStrategy == null) testStrategy = "";
        if (status == null) status = TaskStatus.PENDING;
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public DependencyRef.SubtaskRef ref(int parentId) {
        return new DependencyRef.SubtaskRef(parentId, id);
    }

    public Subtask withId(int value) {
        return new Subtask(value, title, description, details, testStrategy, status, dependencies);
    }

    public Subtask withStatus(TaskStatus value) {
        return new Subtask(id, title, description, details, testStrategy, value, dependencies);
    }

    public Subtask withDependencies(List<DependencyRef> value) {
        return new Subtask(id, title, description, details, testStrategy, status, value);
    }

    public Subtask withoutDependency(DependencyRef ref) {
        List<DependencyRef> kept = new ArrayList<>(dependencies);
        kept.removeIf(ref::equals);
        return withDependencies(kept);
    }
}
