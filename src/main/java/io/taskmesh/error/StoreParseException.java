package io.taskmesh.error;

import java.nio.file.Path;

/**
 * The task file exists but cannot be read as a task document.
 */
public class StoreParseException extends TaskMeshException {
    public static final String CODE = "PARSE_ERROR";

    private final Path file;

    public StoreParseException(Path file, String message) {
        super(CODE, "Invalid task file " + file + ": " + message);
        this.file = file;
    }

    public StoreParseException(Path file, String message, Throwable cause) {
        super(CODE, "Invalid task file " + file + ": " + message, cause);
        this.file = file;
    }

    public Path file() {
        return file;
    }
}
