package io.taskmesh.error;

public class ValidationException extends TaskMeshException {
    public static final String CODE = "VALIDATION_ERROR";

    public ValidationException(String message) {
        super(CODE, message);
    }
}
