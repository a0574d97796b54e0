package io.taskmesh.graph;

import io.taskmesh.model.DependencyRef;
import io.taskmesh.model.Subtask;
import io.taskmesh.model.Task;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Graph algorithms over the dependency edges of one tag's task list. Everything here is pure:
 * inputs are never modified, and every traversal keeps a visited set so cyclic input terminates.
 */
public final class DependencyGraph {
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private static final Logger logger = LogManager.getLogger(DependencyGraph.class);

    private DependencyGraph() {
    }

    public static boolean exists(List<Task> tasks, DependencyRef ref) {
        Optional<Task> task = find(tasks, ref.taskId());
        if (task.isEmpty()) {
            return false;
        }
        if (ref instanceof DependencyRef.SubtaskRef) {
            return task.get().findSubtask(((DependencyRef.SubtaskRef) ref).subtaskId()).isPresent();
        }
        return true;
    }

    /**
     * Splits raw dependency ids into those naming an existing task or subtask and those that
     * do not parse or name nothing. Nothing is thrown; callers warn about and drop the invalid
     * ones.
     */
    public static DependencyCheck validateDependencies(Collection<String> candidateIds, List<Task> existingTasks) {
        LinkedHashSet<DependencyRef> valid = new LinkedHashSet<>();
        List<String> invalid = new ArrayList<>();
        if (candidateIds == null) {
            return new DependencyCheck(List.of(), List.of());
        }
        for (String raw : candidateIds) {
            DependencyRef ref;
            try {
                ref = DependencyRef.parse(raw);
            } catch (IllegalArgumentException e) {
                invalid.add(String.valueOf(raw));
                continue;
            }
            if (exists(existingTasks, ref)) {
                valid.add(ref);
            } else {
                invalid.add(raw.trim());
            }
        }
        return new DependencyCheck(List.copyOf(valid), List.copyOf(invalid));
    }

    public static GraphNode buildGraph(List<Task> tasks, int rootId) {
        return buildGraph(tasks, rootId, new HashSet<>(), new HashMap<>(), 0, UNBOUNDED);
    }

    public static GraphNode buildGraph(List<Task> tasks, int rootId, Set<Integer> visited, Map<Integer, Integer> depthMap, int depth) {
        return buildGraph(tasks, rootId, visited, depthMap, depth, UNBOUNDED);
    }

    /**
     * Builds the task-level dependency tree under {@code rootId}. A node already in
     * {@code visited} yields {@code null}, which is what bounds the walk on cycles;
     * {@code depthMap} keeps the smallest depth each id was reached at.
     */
    public static GraphNode buildGraph(
            List<Task> tasks,
            int rootId,
            Set<Integer> visited,
            Map<Integer, Integer> depthMap,
            int depth,
            int maxDepth
    ) {
        if (visited.contains(rootId) || depth > maxDepth) {
            return null;
        }
        Optional<Task> task = find(tasks, rootId);
        if (task.isEmpty()) {
            return null;
        }
        visited.add(rootId);
        depthMap.merge(rootId, depth, Math::min);
        List<GraphNode> children = new ArrayList<>();
        for (DependencyRef ref : task.get().dependencyList()) {
            if (ref instanceof DependencyRef.TaskRef) {
                GraphNode child = buildGraph(tasks, ref.taskId(), visited, depthMap, depth + 1, maxDepth);
                if (child != null) {
                    children.add(child);
                }
            }
        }
        return new GraphNode(task.get(), List.copyOf(children));
    }

    /**
     * Breadth-first walk from {@code rootIds} through task dependencies, returning every
     * reachable task id with the minimum number of hops to reach it.
     */
    public static RelatedTasks collectRelated(List<Task> tasks, Collection<Integer> rootIds, int maxDepth) {
        LinkedHashMap<Integer, Integer> depths = new LinkedHashMap<>();
        Deque<int[]> worklist = new ArrayDeque<>();
        for (Integer id : rootIds) {
            if (id != null && find(tasks, id).isPresent() && !depths.containsKey(id)) {
                depths.put(id, 0);
                worklist.add(new int[]{id, 0});
            }
        }
        while (!worklist.isEmpty()) {
            int[] item = worklist.poll();
            int depth = item[1];
            if (depth >= maxDepth) {
                continue;
            }
            Task task = find(tasks, item[0]).orElseThrow();
            for (DependencyRef ref : task.dependencyList()) {
                if (!(ref instanceof DependencyRef.TaskRef)) {
                    continue;
                }
                int id = ref.taskId();
                if (depths.containsKey(id) || find(tasks, id).isEmpty()) {
                    continue;
                }
                depths.put(id, depth + 1);
                worklist.add(new int[]{id, depth + 1});
            }
        }
        List<Task> ordered = new ArrayList<>();
        for (Integer id : depths.keySet()) {
            ordered.add(find(tasks, id).orElseThrow());
        }
        ordered.sort(Comparator.comparingInt((Task t) -> depths.get(t.id())).thenComparingInt(Task::id));
        return new RelatedTasks(Map.copyOf(depths), List.copyOf(ordered));
    }

    /**
     * Renders a built graph as an indented tree, stopping below {@code maxDepth}.
     */
    public static String formatChain(GraphNode root, int maxDepth) {
        StringBuilder sb = new StringBuilder();
        if (root != null) {
            appendChain(sb, root, "", true, 0, maxDepth);
        }
        return sb.toString();
    }

    private static void appendChain(StringBuilder sb, GraphNode node, String prefix, boolean last, int depth, int maxDepth) {
        if (depth > maxDepth) {
            return;
        }
        sb.append('\n').append(prefix).append(last ? "└── " : "├── ")
                .append("Task ").append(node.id()).append(": ").append(node.task().title());
        String childPrefix = prefix + (last ? "    " : "│   ");
        List<GraphNode> children = node.dependencies();
        for (int i = 0; i < children.size(); i++) {
            appendChain(sb, children.get(i), childPrefix, i == children.size() - 1, depth + 1, maxDepth);
        }
    }

    /**
     * True when making task {@code childId} a subtask or dependent of {@code parentId} would
     * close a cycle, i.e. the parent already depends on the child directly, transitively, or
     * through one of its subtasks.
     */
    public static boolean detectCircular(List<Task> tasks, int parentId, int childId) {
        if (parentId == childId) {
            return true;
        }
        Optional<Task> parent = find(tasks, parentId);
        if (parent.isEmpty()) {
            return false;
        }
        Deque<DependencyRef> worklist = new ArrayDeque<>(outgoing(parent.get()));
        Set<DependencyRef> visited = new HashSet<>();
        visited.add(parent.get().ref());
        while (!worklist.isEmpty()) {
            DependencyRef ref = worklist.poll();
            if (ref.taskId() == childId) {
                return true;
            }
            if (!visited.add(ref)) {
                continue;
            }
            if (ref instanceof DependencyRef.TaskRef) {
                find(tasks, ref.taskId()).ifPresent(task -> worklist.addAll(outgoing(task)));
            } else {
                DependencyRef.SubtaskRef sub = (DependencyRef.SubtaskRef) ref;
                find(tasks, sub.parentId())
                        .flatMap(task -> task.findSubtask(sub.subtaskId()))
                        .ifPresent(subtask -> worklist.addAll(subtask.dependencies()));
            }
        }
        return false;
    }

    /**
     * True when following dependencies from {@code start} reaches any reference in
     * {@code chain}. Adding {@code start} as a dependency of the head of the chain would then
     * create a cycle.
     */
    public static boolean isCircularDependency(List<Task> tasks, DependencyRef start, Collection<? extends DependencyRef> chain) {
        Set<DependencyRef> targets = new HashSet<>(chain);
        Deque<DependencyRef> worklist = new ArrayDeque<>();
        worklist.add(start);
        Set<DependencyRef> visited = new HashSet<>();
        while (!worklist.isEmpty()) {
            DependencyRef ref = worklist.poll();
            if (targets.contains(ref)) {
                return true;
            }
            if (!visited.add(ref)) {
                continue;
            }
            worklist.addAll(directDependencies(tasks, ref));
        }
        return false;
    }

    public static List<DependencyIssue> validateTaskDependencies(List<Task> tasks) {
        List<DependencyIssue> issues = new ArrayList<>();
        for (Task task : tasks) {
            collectIssues(tasks, task.ref(), task.dependencyList(), issues);
            for (Subtask subtask : task.subtasks()) {
                collectIssues(tasks, subtask.ref(task.id()), subtask.dependencies(), issues);
            }
        }
        return issues;
    }

    private static void collectIssues(List<Task> tasks, DependencyRef owner, List<DependencyRef> deps, List<DependencyIssue> issues) {
        boolean circular = false;
        for (DependencyRef dep : deps) {
            if (dep.equals(owner)) {
                issues.add(new DependencyIssue(DependencyIssue.Type.SELF, owner.toString(), dep.toString(),
                        describe(owner) + " depends on itself"));
                continue;
            }
            if (!exists(tasks, dep)) {
                issues.add(new DependencyIssue(DependencyIssue.Type.MISSING, owner.toString(), dep.toString(),
                        describe(owner) + " depends on non-existent " + describe(dep)));
                continue;
            }
            if (!circular && isCircularDependency(tasks, dep, List.of(owner))) {
                circular = true;
            }
        }
        if (circular) {
            issues.add(new DependencyIssue(DependencyIssue.Type.CIRCULAR, owner.toString(), null,
                    describe(owner) + " is part of a circular dependency chain"));
        }
    }

    /**
     * Repairs a task list: drops duplicate, self and dangling dependencies, breaks cycles by
     * removing the edge that closes each one, and gives every task with subtasks at least one
     * subtask without dependencies.
     */
    public static FixResult validateAndFix(List<Task> tasks) {
        int duplicates = 0;
        int selfRefs = 0;
        int missing = 0;
        List<Task> cleaned = new ArrayList<>(tasks.size());
        for (Task task : tasks) {
            Task current = task;
            if (task.dependencies() != null) {
                Cleaned deps = clean(tasks, task.ref(), task.dependencies());
                duplicates += deps.duplicates();
                selfRefs += deps.selfRefs();
                missing += deps.missing();
                current = current.withDependencies(deps.kept());
            }
            List<Subtask> subtasks = new ArrayList<>(task.subtasks().size());
            for (Subtask subtask : task.subtasks()) {
                Cleaned deps = clean(tasks, subtask.ref(task.id()), subtask.dependencies());
                duplicates += deps.duplicates();
                selfRefs += deps.selfRefs();
                missing += deps.missing();
                subtasks.add(subtask.withDependencies(deps.kept()));
            }
            cleaned.add(current.withSubtasks(subtasks));
        }

        List<Edge> backEdges = findBackEdges(cleaned);
        for (Edge edge : backEdges) {
            logger.warn("Breaking circular dependency: {} no longer depends on {}", edge.from(), edge.to());
            cleaned = removeEdge(cleaned, edge);
        }

        int freed = 0;
        List<Task> out = new ArrayList<>(cleaned.size());
        for (Task task : cleaned) {
            List<Subtask> subtasks = task.subtasks();
            boolean hasIndependent = subtasks.isEmpty()
                    || subtasks.stream().anyMatch(st -> st.dependencies().isEmpty());
            if (!hasIndependent) {
                List<Subtask> updated = new ArrayList<>(subtasks);
                updated.set(0, subtasks.get(0).withDependencies(List.of()));
                task = task.withSubtasks(updated);
                freed++;
            }
            out.add(task);
        }
        boolean changed = !out.equals(tasks);
        return new FixResult(List.copyOf(out), changed, duplicates, selfRefs, missing, backEdges.size(), freed);
    }

    private static Cleaned clean(List<Task> tasks, DependencyRef owner, List<DependencyRef> deps) {
        LinkedHashSet<DependencyRef> kept = new LinkedHashSet<>();
        int duplicates = 0;
        int selfRefs = 0;
        int missing = 0;
        for (DependencyRef dep : deps) {
            if (dep.equals(owner)) {
                selfRefs++;
                logger.warn("Removing self-dependency of {}", owner);
            } else if (!exists(tasks, dep)) {
                missing++;
                logger.warn("Removing dependency of {} on missing {}", owner, dep);
            } else if (!kept.add(dep)) {
                duplicates++;
            }
        }
        return new Cleaned(List.copyOf(kept), duplicates, selfRefs, missing);
    }

    private static List<Edge> findBackEdges(List<Task> tasks) {
        Map<DependencyRef, List<DependencyRef>> graph = new LinkedHashMap<>();
        for (Task task : tasks) {
            graph.put(task.ref(), task.dependencyList());
            for (Subtask subtask : task.subtasks()) {
                graph.put(subtask.ref(task.id()), subtask.dependencies());
            }
        }
        Set<DependencyRef> visiting = new HashSet<>();
        Set<DependencyRef> visited = new HashSet<>();
        List<Edge> backEdges = new ArrayList<>();
        for (DependencyRef node : graph.keySet()) {
            dfsBackEdges(node, graph, visiting, visited, backEdges);
        }
        return backEdges;
    }

    private static void dfsBackEdges(
            DependencyRef node,
            Map<DependencyRef, List<DependencyRef>> graph,
            Set<DependencyRef> visiting,
            Set<DependencyRef> visited,
            List<Edge> backEdges
    ) {
        if (visited.contains(node)) return;
        visiting.add(node);
        for (DependencyRef dep : graph.getOrDefault(node, List.of())) {
            if (visiting.contains(dep)) {
                backEdges.add(new Edge(node, dep));
            } else {
                dfsBackEdges(dep, graph, visiting, visited, backEdges);
            }
        }
        visiting.remove(node);
        visited.add(node);
    }

    private static List<Task> removeEdge(List<Task> tasks, Edge edge) {
        List<Task> out = new ArrayList<>(tasks.size());
        for (Task task : tasks) {
            if (task.id() != edge.from().taskId()) {
                out.add(task);
            } else if (edge.from() instanceof DependencyRef.SubtaskRef) {
                int subtaskId = ((DependencyRef.SubtaskRef) edge.from()).subtaskId();
                out.add(task.findSubtask(subtaskId)
                        .map(st -> task.replaceSubtask(st.withoutDependency(edge.to())))
                        .orElse(task));
            } else {
                out.add(task.withoutDependency(edge.to()));
            }
        }
        return out;
    }

    private static List<DependencyRef> outgoing(Task task) {
        List<DependencyRef> out = new ArrayList<>(task.dependencyList());
        for (Subtask subtask : task.subtasks()) {
            out.addAll(subtask.dependencies());
        }
        return out;
    }

    private static List<DependencyRef> directDependencies(List<Task> tasks, DependencyRef ref) {
        Optional<Task> task = find(tasks, ref.taskId());
        if (task.isEmpty()) {
            return List.of();
        }
        if (ref instanceof DependencyRef.SubtaskRef) {
            int subtaskId = ((DependencyRef.SubtaskRef) ref).subtaskId();
            return task.get().findSubtask(subtaskId).map(Subtask::dependencies).orElse(List.of());
        }
        return task.get().dependencyList();
    }

    private static Optional<Task> find(List<Task> tasks, int id) {
        for (Task task : tasks) {
            if (task.id() == id) {
                return Optional.of(task);
            }
        }
        return Optional.empty();
    }

    private static String describe(DependencyRef ref) {
        return ref instanceof DependencyRef.SubtaskRef ? "subtask " + ref : "task " + ref;
    }

    private record Cleaned(List<DependencyRef> kept, int duplicates, int selfRefs, int missing) {
    }

    private record Edge(DependencyRef from, DependencyRef to) {
    }
}
