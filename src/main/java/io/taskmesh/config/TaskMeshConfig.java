package io.taskmesh.config;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves every file location of one project from its root directory.
 */
public final class TaskMeshConfig {
    public static final String TASKMASTER_DIR = ".taskmaster";
    public static final String TASKS_FILE = "tasks.json";
    public static final String STATE_FILE = "state.json";
    public static final String CONFIG_FILE = "config.json";
    public static final String LEGACY_TASKS_DIR = "tasks";

    private final Path projectRoot;
    private final Path tasksFileOverride;

    public TaskMeshConfig(Path projectRoot, Path tasksFileOverride) {
        this.projectRoot = projectRoot;
        this.tasksFileOverride = tasksFileOverride;
    }

    public static TaskMeshConfig fromRoot(String root) {
        return fromRoot(root, null);
    }

    public static TaskMeshConfig fromRoot(String root, String tasksFile) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(".")
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        Path override = tasksFile == null || tasksFile.isBlank()
                ? null
                : base.resolve(tasksFile).normalize();
        return new TaskMeshConfig(base, override);
    }

    public Path projectRoot() {
        return projectRoot;
    }

    public Path taskmasterDir() {
        return projectRoot.resolve(TASKMASTER_DIR);
    }

    /**
     * The task document. An explicit override wins; otherwise {@code .taskmaster/tasks/tasks.json},
     * unless only the legacy {@code tasks/tasks.json} exists.
     */
    public Path tasksFile() {
        if (tasksFileOverride != null) {
            return tasksFileOverride;
        }
        Path current = taskmasterDir().resolve("tasks").resolve(TASKS_FILE);
        Path legacy = legacyTasksFile();
        if (!Files.exists(current) && Files.exists(legacy)) {
            return legacy;
        }
        return current;
    }

    public Path legacyTasksFile() {
        return projectRoot.resolve(LEGACY_TASKS_DIR).resolve(TASKS_FILE);
    }

    public Path stateFile() {
        return taskmasterDir().resolve(STATE_FILE);
    }

    public Path configFile() {
        return taskmasterDir().resolve(CONFIG_FILE);
    }
}
