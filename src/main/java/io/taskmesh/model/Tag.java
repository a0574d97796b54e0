package io.taskmesh.model;

import java.util.List;
import java.util.Optional;

public record Tag(List<Task> tasks, TagMetadata metadata) {
    public Tag {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }

    public static Tag empty(TagMetadata metadata) {
        return new Tag(List.of(), metadata);
    }

    public Optional<Task> findTask(int id) {
        for (Task task : tasks) {
            if (task.id() == id) {
                return Optional.of(task);
            }
        }
        return Optional.empty();
    }

    public int nextTaskId() {
        int max = 0;
        for (Task task : tasks) {
            max = Math.max(max, task.id());
        }
        return max + 1;
    }

    public long completedCount() {
        return tasks.stream().filter(t -> t.status().isComplete()).count();
    }

    /**
     * Replaces the whole task list and stamps {@code updated}.
     */
    public Tag withTasks(List<Task> value, String updatedAt) {
        TagMetadata meta = metadata == null ? TagMetadata.of(updatedAt, null) : metadata.withUpdated(updatedAt);
        return new Tag(value, meta);
    }

    public Tag withMetadata(TagMetadata value) {
        return new Tag(tasks, value);
    }
}
