package io.taskmesh.error;

public class ReservedNameException extends TaskMeshException {
    public static final String CODE = "RESERVED_NAME";

    public ReservedNameException(String message) {
        super(CODE, message);
    }
}
