package io.taskmesh.config;

import com.fasterxml.jackson.databind.JsonNode;
import io.taskmesh.model.TaggedDocument;
import io.taskmesh.util.Jsons;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Values read from {@code .taskmaster/config.json} under {@code global}. A missing or
 * unreadable file yields the defaults.
 */
public record ProjectSettings(String defaultTag, int maxGraphDepth) {
    public static final int DEFAULT_MAX_GRAPH_DEPTH = 5;

    private static final Logger logger = LogManager.getLogger(ProjectSettings.class);

    public ProjectSettings {
        if (defaultTag == null || defaultTag.isBlank()) defaultTag = TaggedDocument.MASTER;
        if (maxGraphDepth <= 0) maxGraphDepth = DEFAULT_MAX_GRAPH_DEPTH;
    }

    public static ProjectSettings defaults() {
        return new ProjectSettings(TaggedDocument.MASTER, DEFAULT_MAX_GRAPH_DEPTH);
    }

    public static ProjectSettings load(Path configFile) {
        if (!Files.exists(configFile)) {
            return defaults();
        }
        try {
            JsonNode root = Jsons.mapper().readTree(configFile.toFile());
            JsonNode global = root == null ? null : root.path("global");
            if (global == null || !global.isObject()) {
                return defaults();
            }
            return new ProjectSettings(
                    global.path("defaultTag").asText(null),
                    global.path("maxGraphDepth").asInt(DEFAULT_MAX_GRAPH_DEPTH)
            );
        } catch (IOException e) {
            logger.warn("Ignoring unreadable config {}: {}", configFile, e.getMessage());
            return defaults();
        }
    }
}
