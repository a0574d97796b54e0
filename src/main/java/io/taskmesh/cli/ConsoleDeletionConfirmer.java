package io.taskmesh.cli;

import io.taskmesh.tags.DeletionConfirmer;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Asks on the terminal. Prompts go to stderr so stdout stays a single JSON document.
 */
final class ConsoleDeletionConfirmer implements DeletionConfirmer {
    private final BufferedReader in;
    private final PrintStream prompt;

    ConsoleDeletionConfirmer() {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.err);
    }

    ConsoleDeletionConfirmer(BufferedReader in, PrintStream prompt) {
        this.in = in;
        this.prompt = prompt;
    }

    @Override
    public boolean confirmIntent(String tagName, int taskCount) {
        prompt.printf("Delete tag \"%s\" and its %d task(s)? This cannot be undone. [y/N] ", tagName, taskCount);
        String answer = readLine();
        return answer != null && (answer.trim().equalsIgnoreCase("y") || answer.trim().toLowerCase(Locale.ROOT).equals("yes"));
    }

    @Override
    public String retypeName(String tagName) {
        prompt.printf("Type the tag name \"%s\" to confirm: ", tagName);
        String answer = readLine();
        return answer == null ? "" : answer.trim();
    }

    private String readLine() {
        prompt.flush();
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read confirmation", e);
        }
    }
}
