package io.taskmesh.graph;

import io.taskmesh.model.Task;

import java.util.List;
import java.util.Map;

/**
 * Tasks reachable from a set of roots, ordered by hop count then id.
 */
public record RelatedTasks(Map<Integer, Integer> depths, List<Task> tasks) {
    public int depthOf(int taskId) {
        Integer depth = depths.get(taskId);
        return depth == null ? -1 : depth;
    }
}
