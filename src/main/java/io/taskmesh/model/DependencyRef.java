package io.taskmesh.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Comparator;

/**
 * A dependency edge target: either a top-level task or a subtask of some task.
 *
 * <p>Older task files store a subtask's dependencies as bare integers where values below
 * {@link #SIBLING_ID_LIMIT} name a sibling subtask. That rule is applied only when reading such
 * integers ({@link #fromSubtaskInt}); once parsed, references are explicit and are written back
 * in an unambiguous form.
 */
public interface DependencyRef {
    int SIBLING_ID_LIMIT = 100;

    Comparator<DependencyRef> ORDER = Comparator
            .comparingInt((DependencyRef ref) -> ref instanceof TaskRef ? 0 : 1)
            .thenComparingInt(DependencyRef::taskId)
            .thenComparingInt(ref -> ref instanceof SubtaskRef ? ((SubtaskRef) ref).subtaskId() : 0);

    /**
     * Id of the top-level task this reference lives under.
     */
    int taskId();

    static TaskRef task(int id) {
        return new TaskRef(id);
    }

    static SubtaskRef subtask(int parentId, int subtaskId) {
        return new SubtaskRef(parentId, subtaskId);
    }

    /**
     * Parses {@code "7"} as a task reference and {@code "7.2"} as a subtask reference.
     */
    static DependencyRef parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Dependency id cannot be empty");
        }
        String value = raw.trim();
        int dot = value.indexOf('.');
        try {
            if (dot < 0) {
                return new TaskRef(Integer.parseInt(value));
            }
            int parent = Integer.parseInt(value.substring(0, dot));
            int child = Integer.parseInt(value.substring(dot + 1));
            return new SubtaskRef(parent, child);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed dependency id: " + raw, e);
        }
    }

    /**
     * Interprets a bare integer found in the dependency list of a subtask of {@code parentId}.
     */
    static DependencyRef fromSubtaskInt(int parentId, int raw) {
        if (raw < SIBLING_ID_LIMIT) {
            return new SubtaskRef(parentId, raw);
        }
        return new TaskRef(raw);
    }

    record TaskRef(int id) implements DependencyRef {
        public TaskRef {
            if (id <= 0) {
                throw new IllegalArgumentException("Task id must be positive: " + id);
            }
        }

        @Override
        public int taskId() {
            return id;
        }

        @JsonValue
        public int value() {
            return id;
        }

        @Override
        public String toString() {
            return Integer.toString(id);
        }
    }

    record SubtaskRef(int parentId, int subtaskId) implements DependencyRef {
        public SubtaskRef {
            if (parentId <= 0 || subtaskId <= 0) {
                throw new IllegalArgumentException("Subtask reference must be positive: " + parentId + "." + subtaskId);
            }
        }

        @Override
        public int taskId() {
            return parentId;
        }

        @JsonValue
        @Override
        public String toString() {
            return parentId + "." + subtaskId;
        }
    }
}
