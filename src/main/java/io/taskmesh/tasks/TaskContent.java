package io.taskmesh.tasks;

import io.taskmesh.error.ValidationException;

/**
 * Descriptive fields of a new task or subtask, authored by the caller.
 */
public record TaskContent(String title, String description, String details, String testStrategy) {
    public TaskContent {
        if (title == null || title.isBlank()) {
            throw new ValidationException("Title is required");
        }
        title = title.strip();
    }

    public static TaskContent titled(String title) {
        return new TaskContent(title, "", "", "");
    }
}
