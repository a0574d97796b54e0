package io.taskmesh;

import io.taskmesh.cli.TaskMeshCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new TaskMeshCommand()).execute(args);
        System.exit(code);
    }
}
