package io.taskmesh.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.taskmesh.error.TaskMeshException;
import io.taskmesh.error.ValidationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.UncheckedIOException;
import java.util.function.Supplier;

/**
 * Uniform envelope handed back to the CLI and any RPC-style caller:
 * {@code {success, data}} or {@code {success:false, error:{code, message}}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CommandResult<T>(boolean success, T data, ErrorInfo error) {
    public static final String IO_ERROR = "IO_ERROR";
    public static final String UNEXPECTED_ERROR = "UNEXPECTED_ERROR";

    private static final Logger logger = LogManager.getLogger(CommandResult.class);

    public static <T> CommandResult<T> ok(T data) {
        return new CommandResult<>(true, data, null);
    }

    public static <T> CommandResult<T> failure(String code, String message) {
        return new CommandResult<>(false, null, new ErrorInfo(code, message));
    }

    /**
     * Runs one operation and folds any failure into the envelope. This is the single place
     * where operation exceptions are caught.
     */
    public static <T> CommandResult<T> run(String operation, Supplier<T> action) {
        try {
            return ok(action.get());
        } catch (TaskMeshException e) {
            logger.error("{} failed: {}", operation, e.getMessage());
            return failure(e.code(), e.getMessage());
        } catch (IllegalArgumentException e) {
            logger.error("{} rejected input: {}", operation, e.getMessage());
            return failure(ValidationException.CODE, e.getMessage());
        } catch (UncheckedIOException e) {
            logger.error("{} failed on I/O", operation, e);
            return failure(IO_ERROR, e.getMessage());
        } catch (RuntimeException e) {
            logger.error("{} failed unexpectedly", operation, e);
            return failure(UNEXPECTED_ERROR, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    /**
     * Process exit code for the CLI: 0 on success, 2 for caller mistakes, 1 otherwise.
     */
    public int exitCode() {
        if (success) {
            return 0;
        }
        return switch (error.code()) {
            case "VALIDATION_ERROR", "NOT_FOUND", "RESERVED_NAME", "CIRCULAR_DEPENDENCY", "CANCELLED" -> 2;
            default -> 1;
        };
    }

    public record ErrorInfo(String code, String message) {
    }
}
