package io.taskmesh.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.taskmesh.model.TaskState;
import io.taskmesh.util.Jsons;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Side-state ({@code state.json}). Reading never fails: a missing or malformed file yields
 * {@link TaskState#defaults()}.
 */
public final class StateStore {
    private static final Logger logger = LogManager.getLogger(StateStore.class);

    private final Path file;

    public StateStore(Path file) {
        this.file = file;
    }

    public Path file() {
        return file;
    }

    public TaskState read() {
        if (!Files.exists(file)) {
            return TaskState.defaults();
        }
        try {
            JsonNode root = Jsons.mapper().readTree(file.toFile());
            if (root == null || !root.isObject()) {
                logger.warn("State file {} is not a JSON object, using defaults", file);
                return TaskState.defaults();
            }
            Map<String, String> mapping = new LinkedHashMap<>();
            JsonNode branches = root.path("branchTagMapping");
            if (branches.isObject()) {
                branches.fields().forEachRemaining(entry -> {
                    if (entry.getValue().isTextual()) {
                        mapping.put(entry.getKey(), entry.getValue().asText());
                    }
                });
            }
            String current = root.path("currentTag").asText(null);
            return new TaskState(
                    current == null || current.isBlank() ? null : current,
                    root.path("lastSwitched").asText(null),
                    mapping,
                    root.path("migrationNoticeShown").asBoolean(false)
            );
        } catch (IOException e) {
            logger.warn("Could not read state file {}, using defaults: {}", file, e.getMessage());
            return TaskState.defaults();
        }
    }

    public void write(TaskState state) {
        ObjectNode root = Jsons.mapper().createObjectNode();
        if (state.currentTag() != null) {
            root.put("currentTag", state.currentTag());
        }
        if (state.lastSwitched() != null) {
            root.put("lastSwitched", state.lastSwitched());
        }
        ObjectNode mapping = root.putObject("branchTagMapping");
        state.branchTagMapping().forEach(mapping::put);
        root.put("migrationNoticeShown", state.migrationNoticeShown());
        try {
            Jsons.writeFile(file, root);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write state file: " + file, e);
        }
    }
}
