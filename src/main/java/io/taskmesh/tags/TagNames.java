package io.taskmesh.tags;

import io.taskmesh.error.ReservedNameException;
import io.taskmesh.error.ValidationException;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Tag name rules and the branch-name to tag-name mapping.
 */
public final class TagNames {
    static final int MAX_BRANCH_TAG_LENGTH = 50;

    private static final Pattern VALID = Pattern.compile("^[a-zA-Z0-9_-]+$");
    private static final Set<String> RESERVED = Set.of("master", "main", "default");
    private static final Set<String> RESERVED_BRANCHES = Set.of("main", "master", "develop", "dev", "head");

    private TagNames() {
    }

    public static boolean isReserved(String name) {
        return name != null && RESERVED.contains(name.toLowerCase(Locale.ROOT));
    }

    /**
     * Rejects names a new tag may not take: blank, outside {@code [a-zA-Z0-9_-]}, or reserved.
     */
    public static String requireValidNewName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Tag name is required");
        }
        if (!VALID.matcher(name).matches()) {
            throw new ValidationException("Tag name \"" + name + "\" may only contain letters, numbers, hyphens and underscores");
        }
        if (isReserved(name)) {
            throw new ReservedNameException("\"" + name + "\" is a reserved tag name");
        }
        return name;
    }

    public static String sanitizeBranch(String branch) {
        if (branch == null || branch.isBlank()) {
            return "";
        }
        String out = branch
                .replaceAll("[^a-zA-Z0-9_-]", "-")
                .replaceAll("^-+|-+$", "")
                .replaceAll("-+", "-")
                .toLowerCase(Locale.ROOT);
        return out.length() > MAX_BRANCH_TAG_LENGTH ? out.substring(0, MAX_BRANCH_TAG_LENGTH) : out;
    }

    /**
     * False for integration branches (main, master, develop, dev, HEAD) and for names that
     * sanitize to nothing.
     */
    public static boolean isValidBranchForTag(String branch) {
        if (branch == null || branch.isBlank()) {
            return false;
        }
        if (RESERVED_BRANCHES.contains(branch.toLowerCase(Locale.ROOT))) {
            return false;
        }
        return !sanitizeBranch(branch).isEmpty();
    }
}
