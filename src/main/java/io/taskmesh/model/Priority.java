package io.taskmesh.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Priority {
    HIGH("high", 3),
    MEDIUM("medium", 2),
    LOW("low", 1);

    private final String wireName;
    private final int rank;

    Priority(String wireName, int rank) {
        this.wireName = wireName;
        this.rank = rank;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public int rank() {
        return rank;
    }

    /**
     * Rank used for scheduling; an unset priority ranks as {@link #MEDIUM}.
     */
    public static int rankOf(Priority priority) {
        return priority == null ? MEDIUM.rank : priority.rank;
    }

    public static Priority fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return MEDIUM;
        }
        for (Priority value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim()) || value.wireName.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown priority: " + raw);
    }
}
