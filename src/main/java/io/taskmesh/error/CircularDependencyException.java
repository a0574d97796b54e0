package io.taskmesh.error;

public class CircularDependencyException extends TaskMeshException {
    public static final String CODE = "CIRCULAR_DEPENDENCY";

    public CircularDependencyException(String message) {
        super(CODE, message);
    }
}
