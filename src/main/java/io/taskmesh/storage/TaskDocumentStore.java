package io.taskmesh.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.taskmesh.error.StoreParseException;
import io.taskmesh.model.TaggedDocument;
import io.taskmesh.model.Task;
import io.taskmesh.util.Jsons;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Reads and writes the tagged task document. Every save rewrites the entire document; there
 * is no per-tag write path.
 */
public final class TaskDocumentStore {
    private static final Logger logger = LogManager.getLogger(TaskDocumentStore.class);

    private final Clock clock;

    public TaskDocumentStore() {
        this(Clock.systemUTC());
    }

    public TaskDocumentStore(Clock clock) {
        this.clock = clock;
    }

    public TaggedDocument load(Path file) {
        return read(file).document();
    }

    /**
     * Loads the document and exposes the tasks of {@code tagName}; an unknown tag yields an
     * empty task list.
     */
    public LoadedDocument load(Path file, String tagName) {
        RawRead raw = read(file);
        return new LoadedDocument(raw.document(), raw.legacy(), raw.existed(), tagName, raw.document().tasksFor(tagName));
    }

    public void save(Path file, TaggedDocument document) {
        TaskDocumentCodec codec = new TaskDocumentCodec(file);
        try {
            Jsons.writeFile(file, codec.encode(document));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write task file: " + file, e);
        }
        logger.debug("Saved {} tag(s) to {}", document.size(), file);
    }

    private RawRead read(Path file) {
        String now = Instant.now(clock).toString();
        String raw;
        try {
            raw = Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            logger.debug("No task file at {}, starting from an empty document", file);
            return new RawRead(TaggedDocument.withEmptyMaster(now), false, false);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read task file: " + file, e);
        }
        if (raw.isBlank()) {
            return new RawRead(TaggedDocument.withEmptyMaster(now), false, true);
        }
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(raw);
        } catch (JsonProcessingException e) {
            throw new StoreParseException(file, e.getOriginalMessage(), e);
        }
        boolean legacy = TaskDocumentCodec.isLegacyShape(root);
        if (legacy) {
            logger.info("Task file {} uses the single-namespace layout; presenting it as tag \"{}\"", file, TaggedDocument.MASTER);
        }
        TaggedDocument document = new TaskDocumentCodec(file).decode(root, now);
        return new RawRead(document, legacy, true);
    }

    private record RawRead(TaggedDocument document, boolean legacy, boolean existed) {
    }

    /**
     * @param legacy  the file was in the pre-tag layout and has not been rewritten yet
     * @param existed the file was present on disk
     */
    public record LoadedDocument(TaggedDocument document, boolean legacy, boolean existed, String tagName, List<Task> tasks) {
    }
}
