package io.taskmesh.graph;

import io.taskmesh.model.Task;

import java.util.List;

/**
 * One task in a built dependency tree, holding the subtrees of its task-level dependencies.
 */
public record GraphNode(Task task, List<GraphNode> dependencies) {
    public GraphNode {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public int id() {
        return task.id();
    }
}
