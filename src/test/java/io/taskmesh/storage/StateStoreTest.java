package io.taskmesh.storage;

import io.taskmesh.model.TaskState;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StateStoreTest {
    @Test
    void missingOrMalformedStateFallsBackToDefaults() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-state-malformed-");
        StateStore store = new StateStore(root.resolve("state.json"));
        assertEquals(TaskState.defaults(), store.read());

        Files.writeString(store.file(), "{broken", StandardCharsets.UTF_8);
        TaskState state = store.read();
        assertNull(state.currentTag());
        assertFalse(state.migrationNoticeShown());

        Files.writeString(store.file(), "[1,2]", StandardCharsets.UTF_8);
        assertEquals(TaskState.defaults(), store.read());
        Files.delete(store.file());
        Files.delete(root);
    }

    @Test
    void writeThenReadKeepsMappingOrder() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-state-roundtrip-");
        StateStore store = new StateStore(root.resolve(".taskmaster").resolve("state.json"));
        TaskState state = TaskState.defaults()
                .switchedTo("feature", "2026-01-05T10:00:00Z")
                .withBranchMapping("feature/b", "feature-b")
                .withBranchMapping("feature/a", "feature-a")
                .withMigrationNoticeShown(true);

        store.write(state);
        TaskState loaded = store.read();

        assertEquals(state, loaded);
        assertEquals("[feature/b, feature/a]", loaded.branchTagMapping().keySet().toString());
        assertTrue(Files.exists(store.file()));
    }
}
