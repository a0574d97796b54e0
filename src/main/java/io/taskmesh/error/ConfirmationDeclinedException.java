package io.taskmesh.error;

public class ConfirmationDeclinedException extends TaskMeshException {
    public static final String CODE = "CANCELLED";

    public ConfirmationDeclinedException(String message) {
        super(CODE, message);
    }
}
