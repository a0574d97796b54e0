package io.taskmesh.tasks;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.taskmesh.error.CircularDependencyException;
import io.taskmesh.error.NotFoundException;
import io.taskmesh.error.ValidationException;
import io.taskmesh.graph.DependencyCheck;
import io.taskmesh.graph.DependencyGraph;
import io.taskmesh.graph.DependencyIssue;
import io.taskmesh.graph.FixResult;
import io.taskmesh.graph.GraphNode;
import io.taskmesh.graph.RelatedTasks;
import io.taskmesh.model.DependencyRef;
import io.taskmesh.model.Priority;
import io.taskmesh.model.Subtask;
import io.taskmesh.model.Tag;
import io.taskmesh.model.TagMetadata;
import io.taskmesh.model.TaggedDocument;
import io.taskmesh.model.Task;
import io.taskmesh.model.TaskStatus;
import io.taskmesh.scheduler.NextTaskScheduler;
import io.taskmesh.storage.TaskDocumentStore;
import io.taskmesh.tags.TagContext;
import io.taskmesh.tags.TagNames;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Task mutations and queries against one resolved tag. Each call is one read-modify-write
 * pass: load the whole document, rewrite the tag's task list, save the whole document.
 * Preconditions are checked before anything is written.
 */
public final class TaskOperations {
    private static final Logger logger = LogManager.getLogger(TaskOperations.class);

    private final TagContext tags;
    private final String tagOverride;
    private final Clock clock;

    public TaskOperations(TagContext tags, String tagOverride) {
        this(tags, tagOverride, Clock.systemUTC());
    }

    public TaskOperations(TagContext tags, String tagOverride, Clock clock) {
        this.tags = tags;
        this.tagOverride = tagOverride;
        this.clock = clock;
    }

    public AddedTask addTask(TaskContent content, List<String> dependencies, Priority priority) {
        if (content == null) {
            throw new ValidationException("Task content is required");
        }
        Workspace ws = open();
        DependencyCheck check = DependencyGraph.validateDependencies(dependencies, ws.tasks());
        warnDropped(check, "new task");

        int id = ws.tag().nextTaskId();
        Task task = new Task(
                id,
                content.title(),
                content.description(),
                content.details(),
                content.testStrategy(),
                TaskStatus.PENDING,
                priority == null ? Priority.MEDIUM : priority,
                check.valid(),
                List.of()
        );
        List<Task> updated = new ArrayList<>(ws.tasks());
        updated.add(task);
        commit(ws, updated);
        logger.info("Added task {} to tag \"{}\"", id, ws.tagName());
        return new AddedTask(ws.tagName(), task, check.invalid());
    }

    public SubtaskAdded addSubtask(int parentId, TaskContent content, List<String> dependencies, TaskStatus status) {
        if (content == null) {
            throw new ValidationException("Subtask content is required");
        }
        Workspace ws = open();
        Task parent = requireTask(ws, parentId);
        DependencyCheck check = DependencyGraph.validateDependencies(dependencies, ws.tasks());
        warnDropped(check, "new subtask of task " + parentId);

        Subtask subtask = new Subtask(
                parent.nextSubtaskId(),
                content.title(),
                content.description(),
                content.details(),
                content.testStrategy(),
                status == null ? TaskStatus.PENDING : status,
                check.valid()
        );
        List<Subtask> subtasks = new ArrayList<>(parent.subtasks());
        subtasks.add(subtask);
        commit(ws, replace(ws.tasks(), parent.withSubtasks(subtasks)));
        logger.info("Added subtask {} to tag \"{}\"", subtask.ref(parentId), ws.tagName());
        return new SubtaskAdded(ws.tagName(), parentId, subtask, null, check.invalid());
    }

    /**
     * Turns top-level task {@code existingTaskId} into a new subtask of {@code parentId},
     * removing it from the task list and from every other dependency list. Rejected when the
     * parent already depends on the task in any way.
     */
    public SubtaskAdded convertTaskToSubtask(int parentId, int existingTaskId) {
        if (parentId == existingTaskId) {
            throw new ValidationException("Task " + parentId + " cannot become a subtask of itself");
        }
        Workspace ws = open();
        Task parent = requireTask(ws, parentId);
        Task existing = requireTask(ws, existingTaskId);
        if (DependencyGraph.detectCircular(ws.tasks(), parentId, existingTaskId)) {
            throw new CircularDependencyException(
                    "Cannot make task " + existingTaskId + " a subtask of task " + parentId
                            + ": task " + parentId + " already depends on it");
        }
        if (!existing.subtasks().isEmpty()) {
            logger.warn("Task {} has {} subtask(s) that are dropped by the conversion", existingTaskId, existing.subtasks().size());
        }

        Subtask subtask = new Subtask(
                parent.nextSubtaskId(),
                existing.title(),
                existing.description(),
                existing.details(),
                existing.testStrategy(),
                existing.status(),
                existing.dependencyList()
        );
        List<Subtask> subtasks = new ArrayList<>(parent.subtasks());
        subtasks.add(subtask);

        List<Task> updated = new ArrayList<>();
        for (Task task : ws.tasks()) {
            if (task.id() == existingTaskId) {
                continue;
            }
            Task current = task.id() == parentId ? parent.withSubtasks(subtasks) : task;
            updated.add(stripTaskReferences(current, dep -> dep.taskId() == existingTaskId));
        }
        commit(ws, updated);
        logger.info("Converted task {} into subtask {}", existingTaskId, subtask.ref(parentId));
        return new SubtaskAdded(ws.tagName(), parentId, subtask, existingTaskId, List.of());
    }

    /**
     * Removes the comma-separated tasks ({@code "5"}) and subtasks ({@code "5.2"}) and every
     * reference to them. Ids that name nothing are reported as skipped.
     */
    public RemovalReport removeTasks(String ids) {
        List<DependencyRef> refs = parseIds(ids);
        Workspace ws = open();
        List<Task> tasks = new ArrayList<>(ws.tasks());
        List<Removed> removed = new ArrayList<>();
        List<String> skipped = new ArrayList<>();

        for (DependencyRef ref : refs) {
            Optional<Task> owner = find(tasks, ref.taskId());
            if (ref instanceof DependencyRef.SubtaskRef) {
                int subtaskId = ((DependencyRef.SubtaskRef) ref).subtaskId();
                Optional<Subtask> subtask = owner.flatMap(t -> t.findSubtask(subtaskId));
                if (subtask.isEmpty()) {
                    skipped.add(ref.toString());
                    continue;
                }
                List<Subtask> kept = new ArrayList<>(owner.get().subtasks());
                kept.removeIf(st -> st.id() == subtaskId);
                tasks = replace(tasks, owner.get().withSubtasks(kept));
                tasks = stripEverywhere(tasks, ref::equals);
                removed.add(new Removed(ref.toString(), subtask.get().title()));
            } else {
                if (owner.isEmpty()) {
                    skipped.add(ref.toString());
                    continue;
                }
                tasks.removeIf(t -> t.id() == ref.taskId());
                tasks = stripEverywhere(tasks, dep -> dep.taskId() == ref.taskId());
                removed.add(new Removed(ref.toString(), owner.get().title()));
            }
        }
        if (!removed.isEmpty()) {
            commit(ws, tasks);
        }
        for (String id : skipped) {
            logger.warn("Nothing to remove for id {} in tag \"{}\"", id, ws.tagName());
        }
        return new RemovalReport(ws.tagName(), List.copyOf(removed), List.copyOf(skipped));
    }

    public DependencyChange addDependency(String id, String dependsOn) {
        DependencyRef target = parseId(id);
        DependencyRef dependency = parseId(dependsOn);
        Workspace ws = open();
        List<DependencyRef> current = requireDependencies(ws, target);
        if (!DependencyGraph.exists(ws.tasks(), dependency)) {
            throw new NotFoundException(describe(dependency) + " does not exist in tag \"" + ws.tagName() + "\"");
        }
        if (target.equals(dependency)) {
            throw new ValidationException(describe(target) + " cannot depend on itself");
        }
        if (current.contains(dependency)) {
            logger.info("{} already depends on {}", describe(target), dependency);
            return new DependencyChange(ws.tagName(), target.toString(), dependency.toString(), false, names(current));
        }
        if (DependencyGraph.isCircularDependency(ws.tasks(), dependency, List.of(target))) {
            throw new CircularDependencyException(
                    "Adding " + dependency + " as a dependency of " + target + " would create a circular dependency");
        }
        List<DependencyRef> updated = new ArrayList<>(current);
        updated.add(dependency);
        updated.sort(DependencyRef.ORDER);
        commit(ws, withDependencies(ws.tasks(), target, updated));
        logger.info("{} now depends on {}", describe(target), dependency);
        return new DependencyChange(ws.tagName(), target.toString(), dependency.toString(), true, names(updated));
    }

    public DependencyChange removeDependency(String id, String dependsOn) {
        DependencyRef target = parseId(id);
        DependencyRef dependency = parseId(dependsOn);
        Workspace ws = open();
        List<DependencyRef> current = requireDependencies(ws, target);
        if (!current.contains(dependency)) {
            logger.info("{} does not depend on {}", describe(target), dependency);
            return new DependencyChange(ws.tagName(), target.toString(), dependency.toString(), false, names(current));
        }
        List<DependencyRef> updated = new ArrayList<>(current);
        updated.removeIf(dependency::equals);
        commit(ws, withDependencies(ws.tasks(), target, updated));
        logger.info("{} no longer depends on {}", describe(target), dependency);
        return new DependencyChange(ws.tagName(), target.toString(), dependency.toString(), true, names(updated));
    }

    /**
     * Sets the status of each comma-separated id. Marking a task done also marks its
     * unfinished subtasks.
     */
    public StatusReport setStatus(String ids, TaskStatus status) {
        if (status == null) {
            throw new ValidationException("Status is required");
        }
        List<DependencyRef> refs = parseIds(ids);
        Workspace ws = open();
        List<Task> tasks = new ArrayList<>(ws.tasks());
        List<StatusUpdate> updates = new ArrayList<>();
        for (DependencyRef ref : refs) {
            Task task = find(tasks, ref.taskId())
                    .orElseThrow(() -> new NotFoundException("Task " + ref.taskId() + " not found in tag \"" + ws.tagName() + "\""));
            if (ref instanceof DependencyRef.SubtaskRef) {
                Subtask subtask = task.findSubtask(((DependencyRef.SubtaskRef) ref).subtaskId())
                        .orElseThrow(() -> new NotFoundException("Subtask " + ref + " not found"));
                Task updated = task.replaceSubtask(subtask.withStatus(status));
                tasks = replace(tasks, updated);
                updates.add(new StatusUpdate(ref.toString(), subtask.status(), status));
                if (status.isComplete() && !updated.status().isComplete()
                        && updated.subtasks().stream().allMatch(st -> st.status().isComplete())) {
                    logger.info("All subtasks of task {} are done; the task itself is still {}", task.id(), updated.status().wireName());
                }
            } else {
                Task updated = task.withStatus(status);
                if (status.isComplete()) {
                    List<Subtask> subtasks = new ArrayList<>();
                    for (Subtask subtask : task.subtasks()) {
                        subtasks.add(subtask.status().isComplete() ? subtask : subtask.withStatus(status));
                    }
                    updated = updated.withSubtasks(subtasks);
                }
                tasks = replace(tasks, updated);
                updates.add(new StatusUpdate(ref.toString(), task.status(), status));
            }
        }
        commit(ws, tasks);
        return new StatusReport(ws.tagName(), List.copyOf(updates));
    }

    /**
     * Looks up one task ({@code "5"}) or subtask ({@code "5.2"}). A subtask comes back with a
     * summary of its parent.
     */
    public ShownTask showTask(String id) {
        DependencyRef ref = parseId(id);
        Workspace ws = open();
        Task task = requireTask(ws, ref.taskId());
        if (ref instanceof DependencyRef.SubtaskRef) {
            Subtask subtask = task.findSubtask(((DependencyRef.SubtaskRef) ref).subtaskId())
                    .orElseThrow(() -> new NotFoundException("Subtask " + ref + " not found in tag \"" + ws.tagName() + "\""));
            return new ShownTask(ws.tagName(), ref.toString(), null, subtask,
                    new ParentSummary(task.id(), task.title(), task.status()));
        }
        return new ShownTask(ws.tagName(), ref.toString(), task, null, null);
    }

    /**
     * Deletes subtask {@code "p.s"}. With {@code convertToTask} it comes back as a new
     * top-level task that depends on its former parent; references from elsewhere follow it,
     * references from inside the former parent are dropped since they would now close a cycle.
     */
    public SubtaskRemoved removeSubtask(String id, boolean convertToTask) {
        DependencyRef ref = parseId(id);
        if (!(ref instanceof DependencyRef.SubtaskRef)) {
            throw new ValidationException("Invalid subtask id \"" + id + "\": expected parent.subtask");
        }
        int subtaskId = ((DependencyRef.SubtaskRef) ref).subtaskId();
        Workspace ws = open();
        Task parent = requireTask(ws, ref.taskId());
        Subtask removed = parent.findSubtask(subtaskId)
                .orElseThrow(() -> new NotFoundException("Subtask " + ref + " not found in tag \"" + ws.tagName() + "\""));
        List<Subtask> kept = new ArrayList<>(parent.subtasks());
        kept.removeIf(st -> st.id() == subtaskId);
        Task updatedParent = stripTaskReferences(parent.withSubtasks(kept), ref::equals);

        if (!convertToTask) {
            List<Task> tasks = stripEverywhere(replace(ws.tasks(), updatedParent), ref::equals);
            commit(ws, tasks);
            logger.info("Removed subtask {} from tag \"{}\"", ref, ws.tagName());
            return new SubtaskRemoved(ws.tagName(), ref.toString(), removed, null);
        }

        int newId = ws.tag().nextTaskId();
        DependencyRef.TaskRef newRef = DependencyRef.task(newId);
        List<DependencyRef> dependencies = new ArrayList<>(removed.dependencies());
        if (!dependencies.contains(parent.ref())) {
            dependencies.add(parent.ref());
        }
        Task converted = new Task(
                newId,
                removed.title(),
                removed.description(),
                removed.details(),
                removed.testStrategy(),
                removed.status(),
                parent.priority() == null ? Priority.MEDIUM : parent.priority(),
                dependencies,
                List.of()
        );
        List<Task> tasks = remapEverywhere(replace(ws.tasks(), updatedParent), dep -> dep.equals(ref) ? newRef : dep);
        tasks.add(converted);
        commit(ws, tasks);
        logger.info("Converted subtask {} into task {}", ref, newId);
        return new SubtaskRemoved(ws.tagName(), ref.toString(), removed, converted);
    }

    /**
     * Empties the subtask lists of the comma-separated tasks and drops every reference to the
     * cleared subtasks. Unknown task ids are skipped.
     */
    public ClearReport clearSubtasks(String ids) {
        List<DependencyRef> refs = parseIds(ids);
        List<Integer> taskIds = new ArrayList<>();
        for (DependencyRef ref : refs) {
            if (ref instanceof DependencyRef.SubtaskRef) {
                throw new ValidationException("clear-subtasks takes task ids, not subtask id " + ref);
            }
            taskIds.add(ref.taskId());
        }
        return clear(open(), taskIds);
    }

    public ClearReport clearAllSubtasks() {
        Workspace ws = open();
        return clear(ws, ws.tasks().stream().map(Task::id).toList());
    }

    private ClearReport clear(Workspace ws, List<Integer> taskIds) {
        List<Task> tasks = new ArrayList<>(ws.tasks());
        List<Cleared> cleared = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (int id : taskIds) {
            Optional<Task> task = find(tasks, id);
            if (task.isEmpty()) {
                logger.warn("Task {} not found in tag \"{}\"", id, ws.tagName());
                skipped.add(Integer.toString(id));
                continue;
            }
            int count = task.get().subtasks().size();
            if (count > 0) {
                tasks = replace(tasks, task.get().withSubtasks(List.of()));
                tasks = stripEverywhere(tasks, dep -> dep instanceof DependencyRef.SubtaskRef && dep.taskId() == id);
                logger.info("Cleared {} subtask(s) from task {}", count, id);
            }
            cleared.add(new Cleared(id, task.get().title(), count));
        }
        if (cleared.stream().anyMatch(c -> c.subtasksCleared() > 0)) {
            commit(ws, tasks);
        }
        return new ClearReport(ws.tagName(), List.copyOf(cleared), List.copyOf(skipped));
    }

    /**
     * Moves each source id to the destination id at the same position in the two
     * comma-separated lists, renumbering the item and rewriting every reference to it. A task
     * can become a subtask and the other way round. Destinations must be free. All moves are
     * applied before anything is written, so one bad pair writes nothing.
     */
    public MoveReport moveTasks(String fromIds, String toIds) {
        List<DependencyRef> sources = parseIdList(fromIds);
        List<DependencyRef> destinations = parseIdList(toIds);
        if (sources.size() != destinations.size()) {
            throw new ValidationException("Number of source ids (" + sources.size()
                    + ") must match number of destination ids (" + destinations.size() + ")");
        }
        Workspace ws = open();
        List<Task> tasks = new ArrayList<>(ws.tasks());
        List<Moved> moves = new ArrayList<>();
        for (int i = 0; i < sources.size(); i++) {
            DependencyRef from = sources.get(i);
            DependencyRef to = destinations.get(i);
            if (from.equals(to)) {
                throw new ValidationException("Cannot move " + from + " onto itself");
            }
            String title;
            if (from instanceof DependencyRef.TaskRef && to instanceof DependencyRef.TaskRef) {
                title = moveTaskToTask(tasks, from.taskId(), to.taskId());
            } else if (from instanceof DependencyRef.TaskRef) {
                title = moveTaskToSubtask(tasks, from.taskId(), (DependencyRef.SubtaskRef) to);
            } else if (to instanceof DependencyRef.TaskRef) {
                title = moveSubtaskToTask(tasks, (DependencyRef.SubtaskRef) from, to.taskId());
            } else {
                title = moveSubtaskToSubtask(tasks, (DependencyRef.SubtaskRef) from, (DependencyRef.SubtaskRef) to);
            }
            moves.add(new Moved(from.toString(), to.toString(), title));
            logger.info("Moved {} to {} in tag \"{}\"", from, to, ws.tagName());
        }
        commit(ws, tasks);
        return new MoveReport(ws.tagName(), List.copyOf(moves));
    }

    private static String moveTaskToTask(List<Task> tasks, int fromId, int toId) {
        Task source = requireIn(tasks, fromId);
        requireFree(tasks, toId);
        tasks.remove(source);
        insertInIdOrder(tasks, source.withId(toId));
        remapInPlace(tasks, dep -> {
            if (dep.taskId() != fromId) {
                return dep;
            }
            return dep instanceof DependencyRef.TaskRef
                    ? DependencyRef.task(toId)
                    : DependencyRef.subtask(toId, ((DependencyRef.SubtaskRef) dep).subtaskId());
        });
        return source.title();
    }

    private static String moveSubtaskToTask(List<Task> tasks, DependencyRef.SubtaskRef from, int toId) {
        Task parent = requireIn(tasks, from.parentId());
        Subtask subtask = requireSubtask(parent, from);
        requireFree(tasks, toId);
        List<Subtask> kept = new ArrayList<>(parent.subtasks());
        kept.remove(subtask);
        replaceInPlace(tasks, parent.withSubtasks(kept));
        insertInIdOrder(tasks, new Task(
                toId,
                subtask.title(),
                subtask.description(),
                subtask.details(),
                subtask.testStrategy(),
                subtask.status(),
                Priority.MEDIUM,
                subtask.dependencies(),
                List.of()
        ));
        DependencyRef.TaskRef toRef = DependencyRef.task(toId);
        remapInPlace(tasks, dep -> dep.equals(from) ? toRef : dep);
        return subtask.title();
    }

    private static String moveTaskToSubtask(List<Task> tasks, int fromId, DependencyRef.SubtaskRef to) {
        Task source = requireIn(tasks, fromId);
        if (to.parentId() == fromId) {
            throw new ValidationException("Task " + fromId + " cannot become a subtask of itself");
        }
        Task parent = requireIn(tasks, to.parentId());
        if (parent.findSubtask(to.subtaskId()).isPresent()) {
            throw new ValidationException("Subtask " + to + " already exists");
        }
        if (DependencyGraph.detectCircular(tasks, parent.id(), fromId)) {
            throw new CircularDependencyException(
                    "Cannot move task " + fromId + " under task " + parent.id() + ": task " + parent.id() + " already depends on it");
        }
        if (!source.subtasks().isEmpty()) {
            logger.warn("Task {} has {} subtask(s) that are dropped by the move", fromId, source.subtasks().size());
        }
        Predicate<DependencyRef> droppedSubtask = dep -> dep instanceof DependencyRef.SubtaskRef && dep.taskId() == fromId;
        List<DependencyRef> dependencies = new ArrayList<>(source.dependencyList());
        dependencies.removeIf(droppedSubtask);
        Subtask moved = new Subtask(
                to.subtaskId(),
                source.title(),
                source.description(),
                source.details(),
                source.testStrategy(),
                source.status(),
                dependencies
        );
        tasks.remove(source);
        List<Task> stripped = stripEverywhere(tasks, droppedSubtask);
        tasks.clear();
        tasks.addAll(stripped);
        Task target = requireIn(tasks, to.parentId());
        replaceInPlace(tasks, target.withSubtasks(withSubtaskInserted(target.subtasks(), moved)));
        remapInPlace(tasks, dep -> dep.equals(DependencyRef.task(fromId)) ? to : dep);
        return source.title();
    }

    private static String moveSubtaskToSubtask(List<Task> tasks, DependencyRef.SubtaskRef from, DependencyRef.SubtaskRef to) {
        Task sourceParent = requireIn(tasks, from.parentId());
        Subtask subtask = requireSubtask(sourceParent, from);
        Task targetParent = requireIn(tasks, to.parentId());
        if (targetParent.findSubtask(to.subtaskId()).isPresent()) {
            throw new ValidationException("Subtask " + to + " already exists");
        }
        List<Subtask> kept = new ArrayList<>(sourceParent.subtasks());
        kept.remove(subtask);
        replaceInPlace(tasks, sourceParent.withSubtasks(kept));
        Task target = requireIn(tasks, to.parentId());
        replaceInPlace(tasks, target.withSubtasks(withSubtaskInserted(target.subtasks(), subtask.withId(to.subtaskId()))));
        remapInPlace(tasks, dep -> dep.equals(from) ? to : dep);
        return subtask.title();
    }

    public ValidationReport validateDependencies() {
        Workspace ws = open();
        List<DependencyIssue> issues = DependencyGraph.validateTaskDependencies(ws.tasks());
        int subtasks = ws.tasks().stream().mapToInt(t -> t.subtasks().size()).sum();
        for (DependencyIssue issue : issues) {
            logger.warn("{}", issue.message());
        }
        return new ValidationReport(ws.tagName(), ws.tasks().size(), subtasks, issues.isEmpty(), List.copyOf(issues));
    }

    public FixReport fixDependencies() {
        Workspace ws = open();
        FixResult result = DependencyGraph.validateAndFix(ws.tasks());
        if (result.changed()) {
            commit(ws, result.tasks());
            logger.info("Applied {} dependency fix(es) in tag \"{}\"", result.totalFixes(), ws.tagName());
        } else {
            logger.info("No dependency issues in tag \"{}\"", ws.tagName());
        }
        return new FixReport(ws.tagName(), result);
    }

    public NextTask nextTask() {
        Workspace ws = open();
        Task next = NextTaskScheduler.findNextTask(ws.tasks()).orElse(null);
        return new NextTask(ws.tagName(), next);
    }

    public TaskList listTasks(TaskStatus status) {
        Workspace ws = open();
        List<Task> tasks = status == null
                ? ws.tasks()
                : ws.tasks().stream().filter(t -> t.status() == status).toList();
        return new TaskList(ws.tagName(), tasks.size(), tasks);
    }

    /**
     * The dependency tree under one task, bounded by the configured graph depth.
     */
    public DependencyChain dependencyChain(int taskId) {
        Workspace ws = open();
        requireTask(ws, taskId);
        int maxDepth = tags.settings().maxGraphDepth();
        Map<Integer, Integer> depths = new HashMap<>();
        GraphNode root = DependencyGraph.buildGraph(ws.tasks(), taskId, new HashSet<>(), depths, 0, maxDepth);
        RelatedTasks related = DependencyGraph.collectRelated(ws.tasks(), List.of(taskId), maxDepth);
        List<Integer> ids = related.tasks().stream().map(Task::id).filter(id -> id != taskId).toList();
        return new DependencyChain(ws.tagName(), taskId, maxDepth, ids, related.depths(), DependencyGraph.formatChain(root, maxDepth));
    }

    private Workspace open() {
        String tagName = tags.resolveCurrentTag(tagOverride);
        Path file = tags.config().tasksFile();
        TaskDocumentStore.LoadedDocument loaded = tags.store().load(file, tagName);
        tags.acknowledgeLegacyLayout(loaded.legacy());
        Tag tag = loaded.document().tag(tagName).orElse(null);
        boolean existing = tag != null;
        if (!existing) {
            logger.info("Tag \"{}\" does not exist yet; it is created on the first write", tagName);
            tag = Tag.empty(TagMetadata.of(now(), "Tag created on " + LocalDate.now(clock)));
        }
        return new Workspace(file, loaded.document(), tagName, tag, existing);
    }

    private void commit(Workspace ws, List<Task> tasks) {
        if (!ws.existing()) {
            requireCreatable(ws.tagName());
        }
        TaggedDocument document = ws.document();
        document.put(ws.tagName(), ws.tag().withTasks(tasks, now()));
        tags.store().save(ws.file(), document);
    }

    /**
     * A write to a missing tag creates it, but only under a valid new name and only when the
     * tag was asked for explicitly or is the configured default. A current tag left in
     * {@code state.json} after the tag itself is gone is not brought back.
     */
    private void requireCreatable(String tagName) {
        boolean explicit = tagOverride != null && !tagOverride.isBlank();
        if (!explicit && !tagName.equals(tags.settings().defaultTag())) {
            throw new NotFoundException("Current tag \"" + tagName + "\" no longer exists; switch to another tag first");
        }
        TagNames.requireValidNewName(tagName);
    }

    private Task requireTask(Workspace ws, int id) {
        return ws.tag().findTask(id)
                .orElseThrow(() -> new NotFoundException("Task " + id + " not found in tag \"" + ws.tagName() + "\""));
    }

    private List<DependencyRef> requireDependencies(Workspace ws, DependencyRef ref) {
        Task task = requireTask(ws, ref.taskId());
        if (ref instanceof DependencyRef.SubtaskRef) {
            return task.findSubtask(((DependencyRef.SubtaskRef) ref).subtaskId())
                    .orElseThrow(() -> new NotFoundException("Subtask " + ref + " not found in tag \"" + ws.tagName() + "\""))
                    .dependencies();
        }
        return task.dependencyList();
    }

    private static List<Task> withDependencies(List<Task> tasks, DependencyRef target, List<DependencyRef> deps) {
        Task task = find(tasks, target.taskId()).orElseThrow();
        if (target instanceof DependencyRef.SubtaskRef) {
            Subtask subtask = task.findSubtask(((DependencyRef.SubtaskRef) target).subtaskId()).orElseThrow();
            return replace(tasks, task.replaceSubtask(subtask.withDependencies(deps)));
        }
        return replace(tasks, task.withDependencies(deps));
    }

    private static Task stripTaskReferences(Task task, Predicate<DependencyRef> drop) {
        return stripEverywhere(List.of(task), drop).get(0);
    }

    /**
     * Rewrites every dependency of every task and subtask through {@code mapping}, dropping
     * duplicates the rewrite produces.
     */
    private static List<Task> remapEverywhere(List<Task> tasks, UnaryOperator<DependencyRef> mapping) {
        List<Task> out = new ArrayList<>(tasks.size());
        for (Task task : tasks) {
            Task current = task.dependencies() == null ? task : task.withDependencies(remap(task.dependencies(), mapping));
            List<Subtask> subtasks = new ArrayList<>(current.subtasks().size());
            for (Subtask subtask : current.subtasks()) {
                subtasks.add(subtask.withDependencies(remap(subtask.dependencies(), mapping)));
            }
            out.add(current.withSubtasks(subtasks));
        }
        return out;
    }

    private static List<DependencyRef> remap(List<DependencyRef> deps, UnaryOperator<DependencyRef> mapping) {
        LinkedHashSet<DependencyRef> out = new LinkedHashSet<>();
        for (DependencyRef dep : deps) {
            out.add(mapping.apply(dep));
        }
        return new ArrayList<>(out);
    }

    private static void remapInPlace(List<Task> tasks, UnaryOperator<DependencyRef> mapping) {
        List<Task> remapped = remapEverywhere(tasks, mapping);
        tasks.clear();
        tasks.addAll(remapped);
    }

    private static void replaceInPlace(List<Task> tasks, Task replacement) {
        for (int i = 0; i < tasks.size(); i++) {
            if (tasks.get(i).id() == replacement.id()) {
                tasks.set(i, replacement);
                return;
            }
        }
    }

    private static void insertInIdOrder(List<Task> tasks, Task task) {
        int index = 0;
        while (index < tasks.size() && tasks.get(index).id() < task.id()) {
            index++;
        }
        tasks.add(index, task);
    }

    private static List<Subtask> withSubtaskInserted(List<Subtask> subtasks, Subtask subtask) {
        List<Subtask> out = new ArrayList<>(subtasks);
        int index = 0;
        while (index < out.size() && out.get(index).id() < subtask.id()) {
            index++;
        }
        out.add(index, subtask);
        return out;
    }

    private static Task requireIn(List<Task> tasks, int id) {
        return find(tasks, id).orElseThrow(() -> new NotFoundException("Task " + id + " not found"));
    }

    private static Subtask requireSubtask(Task parent, DependencyRef.SubtaskRef ref) {
        return parent.findSubtask(ref.subtaskId()).orElseThrow(() -> new NotFoundException("Subtask " + ref + " not found"));
    }

    private static void requireFree(List<Task> tasks, int id) {
        if (find(tasks, id).isPresent()) {
            throw new ValidationException("Task " + id + " already exists; choose an unused id");
        }
    }

    private static List<Task> stripEverywhere(List<Task> tasks, Predicate<DependencyRef> drop) {
        List<Task> out = new ArrayList<>(tasks.size());
        for (Task task : tasks) {
            Task current = task;
            if (task.dependencies() != null && task.dependencies().stream().anyMatch(drop)) {
                List<DependencyRef> kept = new ArrayList<>(task.dependencies());
                kept.removeIf(drop);
                current = current.withDependencies(kept);
            }
            List<Subtask> subtasks = new ArrayList<>(current.subtasks().size());
            for (Subtask subtask : current.subtasks()) {
                if (subtask.dependencies().stream().anyMatch(drop)) {
                    List<DependencyRef> kept = new ArrayList<>(subtask.dependencies());
                    kept.removeIf(drop);
                    subtask = subtask.withDependencies(kept);
                }
                subtasks.add(subtask);
            }
            out.add(current.withSubtasks(subtasks));
        }
        return out;
    }

    private static List<Task> replace(List<Task> tasks, Task replacement) {
        List<Task> out = new ArrayList<>(tasks.size());
        for (Task task : tasks) {
            out.add(task.id() == replacement.id() ? replacement : task);
        }
        return out;
    }

    private static Optional<Task> find(List<Task> tasks, int id) {
        return tasks.stream().filter(t -> t.id() == id).findFirst();
    }

    private static List<DependencyRef> parseIds(String ids) {
        if (ids == null || ids.isBlank()) {
            throw new ValidationException("At least one task id is required");
        }
        Set<DependencyRef> refs = new LinkedHashSet<>();
        for (String part : ids.split(",")) {
            if (!part.isBlank()) {
                refs.add(parseId(part));
            }
        }
        if (refs.isEmpty()) {
            throw new ValidationException("At least one task id is required");
        }
        return List.copyOf(refs);
    }

    private static List<DependencyRef> parseIdList(String ids) {
        if (ids == null || ids.isBlank()) {
            throw new ValidationException("At least one task id is required");
        }
        List<DependencyRef> refs = new ArrayList<>();
        for (String part : ids.split(",")) {
            refs.add(parseId(part));
        }
        return refs;
    }

    private static DependencyRef parseId(String raw) {
        try {
            return DependencyRef.parse(raw);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid task id \"" + raw + "\": expected a number or parent.subtask");
        }
    }

    private static void warnDropped(DependencyCheck check, String owner) {
        for (String invalid : check.invalid()) {
            logger.warn("Dropping dependency {} of {}: no such task or subtask", invalid, owner);
        }
    }

    private static List<String> names(List<DependencyRef> refs) {
        return refs.stream().map(DependencyRef::toString).toList();
    }

    private static String describe(DependencyRef ref) {
        return ref instanceof DependencyRef.SubtaskRef ? "Subtask " + ref : "Task " + ref;
    }

    private String now() {
        return Instant.now(clock).toString();
    }

    private record Workspace(Path file, TaggedDocument document, String tagName, Tag tag, boolean existing) {
        List<Task> tasks() {
            return tag.tasks();
        }
    }

    public record AddedTask(String tag, Task task, List<String> droppedDependencies) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SubtaskAdded(String tag, int parentId, Subtask subtask, Integer convertedFrom, List<String> droppedDependencies) {
    }

    public record Removed(String id, String title) {
    }

    public record RemovalReport(String tag, List<Removed> removed, List<String> skipped) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ShownTask(String tag, String id, Task task, Subtask subtask, ParentSummary parent) {
    }

    public record ParentSummary(int id, String title, TaskStatus status) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SubtaskRemoved(String tag, String id, Subtask removed, Task convertedTask) {
    }

    public record Cleared(int id, String title, int subtasksCleared) {
    }

    public record ClearReport(String tag, List<Cleared> cleared, List<String> skipped) {
    }

    public record Moved(String from, String to, String title) {
    }

    public record MoveReport(String tag, List<Moved> moves) {
    }

    public record DependencyChange(String tag, String id, String dependsOn, boolean changed, List<String> dependencies) {
    }

    public record StatusUpdate(String id, TaskStatus oldStatus, TaskStatus newStatus) {
    }

    public record StatusReport(String tag, List<StatusUpdate> updated) {
    }

    public record ValidationReport(String tag, int taskCount, int subtaskCount, boolean valid, List<DependencyIssue> issues) {
    }

    public record FixReport(String tag, FixResult fixes) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record NextTask(String tag, Task task) {
    }

    public record TaskList(String tag, int count, List<Task> tasks) {
    }

    public record DependencyChain(
            String tag,
            int taskId,
            int maxDepth,
            List<Integer> relatedTaskIds,
            Map<Integer, Integer> depths,
            String tree
    ) {
    }
}
