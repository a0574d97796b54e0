package io.taskmesh.config;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TaskMeshConfigTest {

    @Test
    void tasksFileFallsBackToLegacyLocationOnlyWhenAlone() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-config-paths-");
        try {
            TaskMeshConfig config = TaskMeshConfig.fromRoot(root.toString());
            Path current = root.toAbsolutePath().normalize().resolve(".taskmaster/tasks/tasks.json");
            assertEquals(current, config.tasksFile());

            Files.createDirectories(config.legacyTasksFile().getParent());
            Files.writeString(config.legacyTasksFile(), "{}", StandardCharsets.UTF_8);
            assertEquals(config.legacyTasksFile(), config.tasksFile());

            Files.createDirectories(current.getParent());
            Files.writeString(current, "{}", StandardCharsets.UTF_8);
            assertEquals(current, config.tasksFile());

            TaskMeshConfig overridden = TaskMeshConfig.fromRoot(root.toString(), "plans/work.json");
            assertEquals(root.toAbsolutePath().normalize().resolve("plans/work.json"), overridden.tasksFile());
            assertEquals(config.stateFile(), overridden.stateFile());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void settingsReadGlobalSectionWithDefaults() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-config-settings-");
        try {
            TaskMeshConfig config = TaskMeshConfig.fromRoot(root.toString());
            assertEquals(ProjectSettings.defaults(), ProjectSettings.load(config.configFile()));

            Files.createDirectories(config.taskmasterDir());
            Files.writeString(config.configFile(), "{\"global\":{\"defaultTag\":\"team\",\"maxGraphDepth\":3}}", StandardCharsets.UTF_8);
            ProjectSettings settings = ProjectSettings.load(config.configFile());
            assertEquals("team", settings.defaultTag());
            assertEquals(3, settings.maxGraphDepth());

            Files.writeString(config.configFile(), "{\"global\":{\"maxGraphDepth\":-1}}", StandardCharsets.UTF_8);
            assertEquals(ProjectSettings.defaults(), ProjectSettings.load(config.configFile()));

            Files.writeString(config.configFile(), "{ broken", StandardCharsets.UTF_8);
            assertEquals(ProjectSettings.defaults(), ProjectSettings.load(config.configFile()));
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
