package io.taskmesh.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TaskStatus {
    PENDING("pending"),
    IN_PROGRESS("in-progress"),
    DONE("done"),
    REVIEW("review"),
    DEFERRED("deferred"),
    CANCELLED("cancelled"),
    // Written by older tools; read-only alias of DONE for scheduling purposes.
    COMPLETED("completed");

    private final String wireName;

    TaskStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isComplete() {
        return this == DONE || this == COMPLETED;
    }

    public boolean isActionable() {
        return this == PENDING || this == IN_PROGRESS;
    }

    public static TaskStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return PENDING;
        }
        String value = raw.trim();
        for (TaskStatus status : values()) {
            if (status.wireName.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + raw);
    }
}
