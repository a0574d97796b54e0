package io.taskmesh.error;

/**
 * Base of the typed failures raised by task and tag operations. The code is stable and is
 * what callers put into error envelopes and map to exit codes.
 */
public class TaskMeshException extends RuntimeException {
    private final String code;

    public TaskMeshException(String code, String message) {
        super(message);
        this.code = code;
    }

    public TaskMeshException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
