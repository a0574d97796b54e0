package io.taskmesh.error;

public class NotFoundException extends TaskMeshException {
    public static final String CODE = "NOT_FOUND";

    public NotFoundException(String message) {
        super(CODE, message);
    }
}
