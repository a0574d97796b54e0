package io.taskmesh.cli;

import io.taskmesh.api.CommandResult;
import io.taskmesh.config.TaskMeshConfig;
import io.taskmesh.model.Priority;
import io.taskmesh.model.TaskStatus;
import io.taskmesh.tags.TagContext;
import io.taskmesh.tasks.TaskContent;
import io.taskmesh.tasks.TaskOperations;
import io.taskmesh.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.PrintStream;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

@Command(
        name = "taskmesh",
        mixinStandardHelpOptions = true,
        description = "Tagged task store with dependency-aware next-task selection",
        subcommands = {
                TaskMeshCommand.TagsCommand.class,
                TaskMeshCommand.AddTagCommand.class,
                TaskMeshCommand.UseTagCommand.class,
                TaskMeshCommand.RenameTagCommand.class,
                TaskMeshCommand.CopyTagCommand.class,
                TaskMeshCommand.DeleteTagCommand.class,
                TaskMeshCommand.BranchTagCommand.class,
                TaskMeshCommand.ListCommand.class,
                TaskMeshCommand.NextCommand.class,
                TaskMeshCommand.ShowCommand.class,
                TaskMeshCommand.AddTaskCommand.class,
                TaskMeshCommand.AddSubtaskCommand.class,
                TaskMeshCommand.RemoveTaskCommand.class,
                TaskMeshCommand.RemoveSubtaskCommand.class,
                TaskMeshCommand.ClearSubtasksCommand.class,
                TaskMeshCommand.MoveTaskCommand.class,
                TaskMeshCommand.AddDependencyCommand.class,
                TaskMeshCommand.RemoveDependencyCommand.class,
                TaskMeshCommand.SetStatusCommand.class,
                TaskMeshCommand.ValidateDependenciesCommand.class,
                TaskMeshCommand.FixDependenciesCommand.class,
                TaskMeshCommand.ChainCommand.class
        }
)
public final class TaskMeshCommand implements Runnable {
    @Option(names = {"--root"}, description = "Project root directory", defaultValue = ".")
    String root;

    @Option(names = {"--file"}, description = "Task file, relative to the project root")
    String file;

    @Option(names = {"--tag"}, description = "Tag to operate on instead of the current tag")
    String tag;

    PrintStream out = System.out;

    @Override
    public void run() {
        out.println("Use subcommands: tags | add-tag | use-tag | rename-tag | copy-tag | delete-tag | branch-tag | list | next | show | add-task | add-subtask | remove-task | remove-subtask | clear-subtasks | move-task | add-dependency | remove-dependency | set-status | validate-dependencies | fix-dependencies | chain");
    }

    TagContext tags() {
        return new TagContext(TaskMeshConfig.fromRoot(root, file));
    }

    TaskOperations operations() {
        return new TaskOperations(tags(), tag);
    }

    <T> int emit(String operation, Supplier<T> action) {
        CommandResult<T> result = CommandResult.run(operation, action);
        out.println(Jsons.toJson(result));
        return result.exitCode();
    }

    @Command(name = "tags", description = "List tags with task counts")
    static final class TagsCommand implements Callable<Integer> {
        @ParentCommand
        TaskMeshCommand parent;

        @Option(names = {"--show-metadata"}, description = "Include tag metadata")
        boolean showMetadata;

        @Override
        public Integer call() {
            return parent.emit("tags", () -> parent.tags().listTags(showMetadata));
        }
    }

    @Command(name = "add-tag", description = "Create a tag, empty or copied from another")
    static final class AddTagCommand implements Callable<Integer> {
        @ParentCommand
        TaskMeshCommand parent;

        @Parameters(index = "0", description = "New tag name")
        String name;

        @Option(names = {"--copy-from-current"}, description = "Copy the tasks of the current tag")
        boolean copyFromCurrent;

        @Option(names = {"--copy-from"}, description = "Copy the tasks of this tag")
        String copyFrom;

        @Option(names = {"--description", "-d"}, description = "Tag description")
        String description;

        @Override
        public Integer call() {
            return parent.emit("add-tag", () -> parent.tags().createTag(
                    name, new TagContext.CreateOptions(copyFromCurrent, copyFrom, description)));
        }
    }

    @Command(name = "use-tag", description = "Switch the current tag")
    static final class UseTagCommand implements Callable<Integer> {
        @ParentCommand
        TaskMeshCommand parent;

        @Parameters(index = "0", description = "Tag name")
        String name;

        @Override
        public Integer call() {
            return parent.emit("use-tag", () -> parent.tags().useTag(name));
        }
    }

    @Command(name = "rename-tag", description = "Rename a tag")
    static final class RenameTagCommand implements Callable<Integer> {
        @ParentCommand
        TaskMeshCommand parent;

        @Parameters(index = "0", description = "Current name")
        String oldName;

        @Parameters(index = "1", description = "New name")
        String newName;

        @Override
        public Integer call() {
            return parent.emit("rename-tag", () -> parent.tags().renameTag(oldName, newName));
        }
    }

    @Command(name = "copy-tag", description = "Copy a tag and its tasks under a new name")
    static final class CopyTagCommand implements Callable<Integer> {
        @ParentCommand
        TaskMeshCommand parent;

        @Parameters(index = "0", description = "Source tag")
        String source;

        @Parameters(index = "1", description = "Target tag")
        String target;

        @Option(names = {"--description", "-d"}, description = "Description of the copy")
        String description;

        @Override
        public Integer call() {
            return parent.emit("copy-tag", () -> parent.tags().copyTag(source, target, description));
        }
    }

    @Command(name = "delete-tag", description = "Delete tags and all of their tasks")
    static final class DeleteTagCommand implements Callable<Integer> {
        @ParentCommand
        TaskMeshCommand parent;

        @Parameters(arity = "1..*", description = "Tag names")
        List<String> names;

        @Option(names = {"--yes", "-y"}, description = "Skip the confirmation prompts")
        boolean yes;

        @Override
        public Integer call() {
            return parent.emit("delete-tag", () -> parent.tags().deleteTags(names, yes, new ConsoleDeletionConfirmer()));
        }
    }

    @Command(name = "branch-tag", description = "Create a tag for a branch, or switch to the current branch's tag")
    static final class BranchTagCommand implements Callable<Integer> {
        @ParentCommand
        TaskMeshCommand parent;

        @Option(names = {"--branch"}, description = "Branch to create a tag for; omit to follow the current branch")
        String branch;

        @Option(names = {"--create"}, description = "Create the tag when the current branch has none")
        boolean create;

        @Option(names = {"--copy-from-current"}, description = "Copy the tasks of the current tag into a new tag")
        boolean copyFromCurrent;

        @Option(names = {"--switch"}, description = "Switch to the tag created for --branch")
        boolean autoSwitch;

        @Override
        public Integer call() {
            if (branch == null || branch.isBlank()) {
                return parent.emit("branch-tag", () -> parent.tags().autoSwitchForBranch(create, copyFromCurrent));
            }
            return parent.emit("branch-tag", () -> parent.tags().createTagFromBranch(
                    branch, new TagContext.BranchTagOptions(copyFromCurrent, null, null, autoSwitch)));
        }
    }

    @Command(name = "list", description = "List the tasks of the current tag")
    static final class ListCommand implements Callable<Integer> {
        @ParentCommand
        TaskMeshCommand parent;

        @Option(names = {"--status"}, description = "Only tasks with this status")
        String status;

        @Override
        public Integer call() {
            return parent.emit("list", () -> parent.operations().listTasks(
                    status == null ? null : TaskStatus.fromString(status)));
        }
    }

    @Command(name = "next", description = "Show the task to work on next")
    static final class NextCommand implements Callable<Integer> {
        @ParentCommand
        TaskMeshCommand parent;

        @Override
        public Integer call() {
            return parent.emit("next", () -> parent.operations().nextTask());
        }
    }

    @Command(name = "show", description = "Show one task or subtask")
    static final class ShowCommand implements Callable<Integer> {
        @ParentCommand
        TaskMeshCommand parent;

        @Parameters(index = "0", description = "Task id (5) or subtask id (5.2)")
        String id;

        @Override
        public Integer call() {
            return parent.emit("show", () -> parent.operations().showTask(id));
        }
    }

    @Command(name = "add-task", description = "Add a task with the given content")
    static final class AddTaskCommand implements Callable<Integer> {
        @ParentCommand
        TaskMeshCommand parent;

        @Option(names = {"--title"}, required = true, description = "Task title")
        String title;

        @Option(names = {"--description"}, description = "Task description")
        String description;

        @Option(names = {"--details"}, description = "Implementation details")
        String details;

        @Option(names = {"--test-strategy"}, description = "How to verify the task")
        String testStrategy;

        @Option(names = {"--dependencies"}, split = ",", description = "Comma-separated dependency ids")
        List<String> dependencies;

        @Option(names = {"--priority"}, description = "Priority: high|medium|low")
        String priority;

        @Override
        public Integer call() {
            return parent.emit("add-task", () -> parent.operations().addTask(
                    new TaskContent(title, description, details, testStrategy),
                    dependencies,
                    priority == null ? null : Priority.fromString(priority)));
        }
    }

    @Command(name = "add-subtask", description = "Add a subtask, or convert a task into one")
    static final class AddSubtaskCommand implements Callable<Integer> {
        @ParentCommand
        TaskMeshCommand parent;

        @Option(names = {"--parent"}, required = true, description = "Parent task id")
        int parentId;

        @Option(names = {"--task-id"}, description = "Existing task to convert")
        Integer existingTaskId;

        @Option(names = {"--title"}, description = "Subtask title")
        String title;

        @Option(names = {"--description"}, description = "Subtask description")
        String description;

        @Option(names = {"--details"}, description = "Implementation details")
        String details;

        @Option(names = {"--dependencies"}, split = ",", description = "Comma-separated dependency ids")
        List<String> dependencies;

        @Option(names = {"--status"}, description = "Initial status")
        String status;

        @Override
        public Integer call() {
            if (existingTaskId != null) {
                return parent.emit("add-subtask", () -> parent.operations().convertTaskToSubtask(parentId, existingTaskId));
            }
            return parent.emit("add-subtask", () -> parent.operations().addSubtask(
                    parentId,
                    new TaskContent(title, description, details, ""),
                    dependencies,
                    status == null ? null : TaskStatus.fromString(status)));
        }
    }

    @Command(name = "remove-task", description = "Remove tasks or subtasks (e.g. 5,6.2)")
    static final class RemoveTaskCommand implements Callable<Integer> {
        @ParentCommand
        TaskMeshCommand parent;

        @Parameters(index = "0", description = "Comma-separated ids")
        String ids;

        @Override
        public Integer call() {
            return parent.emit("remove-task", () -> parent.operations().removeTasks(ids));
        }
    }

    @Command(name = "remove-subtask", description = "Remove a subtask, or turn it back into a task")
    static final class RemoveSubtaskCommand implements Callable<Integer> {
        @ParentCommand
        TaskMeshCommand parent;

        @Option(names = {"--id"}, required = true, description = "Subtask id (parent.subtask)")
        String id;

        @Option(names = {"--convert"}, description = "Keep it as a new top-level task")
        boolean convert;

        @Override
        public Integer call() {
            return parent.emit("remove-subtask", () -> parent.operations().removeSubtask(id, convert));
        }
    }

    @Command(name = "clear-subtasks", description = "Remove all subtasks of the given tasks")
    static final class ClearSubtasksCommand implements Callable<Integer> {
        @ParentCommand
        TaskMeshCommand parent;

        @Option(names = {"--id"}, description = "Comma-separated task ids")
        String ids;

        @Option(names = {"--all"}, description = "Clear the subtasks of every task")
        boolean all;

        @Override
        public Integer call() {
            if (all) {
                return parent.emit("clear-subtasks", () -> parent.operations().clearAllSubtasks());
            }
            return parent.emit("clear-subtasks", () -> parent.operations().clearSubtasks(ids));
        }
    }

    @Command(name = "move-task", description = "Move tasks or subtasks to new ids (e.g. --from 5,6.1 --to 9,7.3)")
    static final class MoveTaskCommand implements Callable<Integer> {
        @ParentCommand
        TaskMeshCommand parent;

        @Option(names = {"--from"}, required = true, description = "Comma-separated source ids")
        String from;

        @Option(names = {"--to"}, required = true, description = "Comma-separated destination ids")
        String to;

        @Override
        public Integer call() {
            return parent.emit("move-task", () -> parent.operations().moveTasks(from, to));
        }
    }

    @Command(name = "add-dependency", description = "Make a task or subtask depend on another")
    static final class AddDependencyCommand implements Callable<Integer> {
        @ParentCommand
        TaskMeshCommand parent;

        @Option(names = {"--id"}, required = true, description = "Dependent task or subtask id")
        String id;

        @Option(names = {"--depends-on"}, required = true, description = "Dependency task or subtask id")
        String dependsOn;

        @Override
        public Integer call() {
            return parent.emit("add-dependency", () -> parent.operations().addDependency(id, dependsOn));
        }
    }

    @Command(name = "remove-dependency", description = "Remove a dependency")
    static final class RemoveDependencyCommand implements Callable<Integer> {
        @ParentCommand
        TaskMeshCommand parent;

        @Option(names = {"--id"}, required = true, description = "Dependent task or subtask id")
        String id;

        @Option(names = {"--depends-on"}, required = true, description = "Dependency task or subtask id")
        String dependsOn;

        @Override
        public Integer call() {
            return parent.emit("remove-dependency", () -> parent.operations().removeDependency(id, dependsOn));
        }
    }

    @Command(name = "set-status", description = "Set the status of tasks or subtasks")
    static final class SetStatusCommand implements Callable<Integer> {
        @ParentCommand
        TaskMeshCommand parent;

        @Option(names = {"--id"}, required = true, description = "Comma-separated ids")
        String ids;

        @Option(names = {"--status"}, required = true, description = "pending|in-progress|done|review|deferred|cancelled")
        String status;

        @Override
        public Integer call() {
            return parent.emit("set-status", () -> parent.operations().setStatus(ids, TaskStatus.fromString(status)));
        }
    }

    @Command(name = "validate-dependencies", description = "Report invalid and circular dependencies")
    static final class ValidateDependenciesCommand implements Callable<Integer> {
        @ParentCommand
        TaskMeshCommand parent;

        @Override
        public Integer call() {
            return parent.emit("validate-dependencies", () -> parent.operations().validateDependencies());
        }
    }

    @Command(name = "fix-dependencies", description = "Remove invalid dependencies and break cycles")
    static final class FixDependenciesCommand implements Callable<Integer> {
        @ParentCommand
        TaskMeshCommand parent;

        @Override
        public Integer call() {
            return parent.emit("fix-dependencies", () -> parent.operations().fixDependencies());
        }
    }

    @Command(name = "chain", description = "Show the dependency tree of a task")
    static final class ChainCommand implements Callable<Integer> {
        @ParentCommand
        TaskMeshCommand parent;

        @Parameters(index = "0", description = "Task id")
        int taskId;

        @Override
        public Integer call() {
            return parent.emit("chain", () -> parent.operations().dependencyChain(taskId));
        }
    }
}
