package io.taskmesh.graph;

import io.taskmesh.model.DependencyRef;

import java.util.List;

public record DependencyCheck(List<DependencyRef> valid, List<String> invalid) {
    public boolean allValid() {
        return invalid.isEmpty();
    }
}
