package io.taskmesh.graph;

import io.taskmesh.model.DependencyRef;
import io.taskmesh.model.Priority;
import io.taskmesh.model.Subtask;
import io.taskmesh.model.Task;
import io.taskmesh.model.TaskStatus;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DependencyGraphTest {
    @Test
    void validateDependenciesSplitsKnownFromUnknownIds() {
        List<Task> tasks = List.of(
                withSubtasks(task(1), subtask(1)),
                task(2)
        );

        DependencyCheck check = DependencyGraph.validateDependencies(List.of("1", "1.1", "9", "x", "2.5", "1"), tasks);

        assertEquals(List.of(DependencyRef.task(1), DependencyRef.subtask(1, 1)), check.valid());
        assertEquals(List.of("9", "x", "2.5"), check.invalid());
        assertFalse(check.allValid());
    }

    @Test
    void buildGraphTerminatesOnCycles() {
        List<Task> tasks = List.of(task(1, 2), task(2, 3), task(3, 1));
        Map<Integer, Integer> depths = new HashMap<>();

        GraphNode root = DependencyGraph.buildGraph(tasks, 1, new HashSet<>(), depths, 0);

        assertNotNull(root);
        assertEquals(2, root.dependencies().get(0).id());
        GraphNode third = root.dependencies().get(0).dependencies().get(0);
        assertEquals(3, third.id());
        assertTrue(third.dependencies().isEmpty());
        assertEquals(Map.of(1, 0, 2, 1, 3, 2), depths);
    }

    @Test
    void buildGraphReturnsNullForVisitedOrMissingRoots() {
        List<Task> tasks = List.of(task(1));
        Set<Integer> visited = new HashSet<>(Set.of(1));
        assertNull(DependencyGraph.buildGraph(tasks, 1, visited, new HashMap<>(), 0));
        assertNull(DependencyGraph.buildGraph(tasks, 42));
    }

    @Test
    void buildGraphStopsBelowMaxDepth() {
        List<Task> tasks = List.of(task(1, 2), task(2, 3), task(3, 4), task(4));
        Map<Integer, Integer> depths = new HashMap<>();

        DependencyGraph.buildGraph(tasks, 1, new HashSet<>(), depths, 0, 2);

        assertEquals(Set.of(1, 2, 3), depths.keySet());
    }

    @Test
    void collectRelatedRecordsMinimumDepth() {
        List<Task> tasks = List.of(task(1, 2, 3), task(2, 3), task(3), task(4, 1));

        RelatedTasks related = DependencyGraph.collectRelated(tasks, List.of(1), 5);

        assertEquals(Map.of(1, 0, 2, 1, 3, 1), related.depths());
        assertEquals(List.of(1, 2, 3), related.tasks().stream().map(Task::id).toList());
        assertEquals(-1, related.depthOf(4));
    }

    @Test
    void formatChainRendersATree() {
        List<Task> tasks = List.of(task(1, 2, 3), task(2), task(3));
        String tree = DependencyGraph.formatChain(DependencyGraph.buildGraph(tasks, 1), 5);

        assertTrue(tree.contains("└── Task 1: Task 1"));
        assertTrue(tree.contains("├── Task 2: Task 2"));
        assertTrue(tree.contains("└── Task 3: Task 3"));
        assertEquals("", DependencyGraph.formatChain(null, 5));
    }

    @Test
    void detectCircularFollowsDirectTransitiveAndSubtaskEdges() {
        Task parentWithSubtaskDep = withSubtasks(task(4),
                new Subtask(1, "s", "", "", "", TaskStatus.PENDING, List.of(DependencyRef.task(5))));
        List<Task> tasks = List.of(task(1, 2), task(2, 3), task(3), parentWithSubtaskDep, task(5));

        assertTrue(DependencyGraph.detectCircular(tasks, 1, 2));
        assertTrue(DependencyGraph.detectCircular(tasks, 1, 3));
        assertFalse(DependencyGraph.detectCircular(tasks, 3, 1));
        assertTrue(DependencyGraph.detectCircular(tasks, 4, 5));
        assertFalse(DependencyGraph.detectCircular(tasks, 5, 4));
        assertTrue(DependencyGraph.detectCircular(tasks, 2, 2));
    }

    @Test
    void detectCircularTerminatesOnExistingCycles() {
        List<Task> tasks = List.of(task(1, 2), task(2, 1), task(3));
        assertFalse(DependencyGraph.detectCircular(tasks, 1, 3));
    }

    @Test
    void isCircularDependencyChecksReachability() {
        List<Task> tasks = List.of(task(1, 2), task(2), task(3));

        assertTrue(DependencyGraph.isCircularDependency(tasks, DependencyRef.task(1), List.of(DependencyRef.task(2))));
        assertFalse(DependencyGraph.isCircularDependency(tasks, DependencyRef.task(3), List.of(DependencyRef.task(2))));
    }

    @Test
    void validateTaskDependenciesReportsEachKindOfIssue() {
        List<Task> tasks = List.of(task(1, 1, 9), task(2, 3), task(3, 2));

        List<DependencyIssue> issues = DependencyGraph.validateTaskDependencies(tasks);

        assertEquals(4, issues.size());
        assertEquals(DependencyIssue.Type.SELF, issues.get(0).type());
        assertEquals(DependencyIssue.Type.MISSING, issues.get(1).type());
        assertEquals("9", issues.get(1).dependencyId());
        assertEquals(DependencyIssue.Type.CIRCULAR, issues.get(2).type());
        assertEquals("2", issues.get(2).taskId());
        assertEquals("3", issues.get(3).taskId());
    }

    @Test
    void validateAndFixRepairsTheWholeList() {
        Task blocked = withSubtasks(task(2),
                new Subtask(1, "a", "", "", "", TaskStatus.PENDING, List.of(DependencyRef.task(1))),
                new Subtask(2, "b", "", "", "", TaskStatus.PENDING, List.of(DependencyRef.subtask(2, 1))));
        List<Task> tasks = List.of(task(1, 2, 2, 1, 9), blocked, task(3, 4), task(4, 3));

        FixResult result = DependencyGraph.validateAndFix(tasks);

        assertTrue(result.changed());
        assertEquals(1, result.duplicatesRemoved());
        assertEquals(1, result.selfDependenciesRemoved());
        assertEquals(1, result.missingRemoved());
        assertEquals(1, result.cyclesBroken());
        assertEquals(1, result.subtasksFreed());
        assertEquals(5, result.totalFixes());
        assertEquals(List.of(DependencyRef.task(2)), result.tasks().get(0).dependencies());
        assertTrue(result.tasks().get(1).subtasks().get(0).dependencies().isEmpty());
        assertTrue(DependencyGraph.validateTaskDependencies(result.tasks()).isEmpty());
        assertEquals(List.of(DependencyRef.task(1)), tasks.get(1).subtasks().get(0).dependencies());
    }

    @Test
    void validateAndFixLeavesCleanListsAlone() {
        List<Task> tasks = List.of(task(1), task(2, 1));
        FixResult result = DependencyGraph.validateAndFix(tasks);
        assertFalse(result.changed());
        assertEquals(0, result.totalFixes());
        assertEquals(tasks, result.tasks());
    }

    private static Task task(int id, Integer... deps) {
        List<DependencyRef> refs = Arrays.stream(deps).map(d -> (DependencyRef) DependencyRef.task(d)).toList();
        return Task.of(id, "Task " + id, TaskStatus.PENDING, Priority.MEDIUM, refs);
    }

    private static Task withSubtasks(Task task, Subtask... subtasks) {
        return task.withSubtasks(List.of(subtasks));
    }

    private static Subtask subtask(int id) {
        return new Subtask(id, "Subtask " + id, "", "", "", TaskStatus.PENDING, List.of());
    }
}
