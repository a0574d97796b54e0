package io.taskmesh.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.taskmesh.model.Task;

import java.util.List;

/**
 * Outcome of {@link DependencyGraph#validateAndFix}: the repaired list and what was changed.
 */
public record FixResult(
        @JsonIgnore List<Task> tasks,
        boolean changed,
        int duplicatesRemoved,
        int selfDependenciesRemoved,
        int missingRemoved,
        int cyclesBroken,
        int subtasksFreed
) {
    public int totalFixes() {
        return duplicatesRemoved + selfDependenciesRemoved + missingRemoved + cyclesBroken + subtasksFreed;
    }
}
