package io.taskmesh.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record TaskState(
        String currentTag,
        String lastSwitched,
        Map<String, String> branchTagMapping,
        boolean migrationNoticeShown
) {
    public TaskState {
        branchTagMapping = branchTagMapping == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(branchTagMapping));
    }

    public static TaskState defaults() {
        return new TaskState(null, null, Map.of(), false);
    }

    public TaskState switchedTo(String tag, String at) {
        return new TaskState(tag, at, branchTagMapping, migrationNoticeShown);
    }

    public TaskState withBranchMapping(String branch, String tag) {
        Map<String, String> mapping = new LinkedHashMap<>(branchTagMapping);
        mapping.put(branch, tag);
        return new TaskState(currentTag, lastSwitched, mapping, migrationNoticeShown);
    }

    /**
     * Points the current tag and any branch mapped to {@code oldTag} at {@code newTag}.
     */
    public TaskState withTagRenamed(String oldTag, String newTag) {
        Map<String, String> mapping = new LinkedHashMap<>();
        branchTagMapping.forEach((branch, tag) -> mapping.put(branch, tag.equals(oldTag) ? newTag : tag));
        String current = oldTag.equals(currentTag) ? newTag : currentTag;
        return new TaskState(current, lastSwitched, mapping, migrationNoticeShown);
    }

    public TaskState withMigrationNoticeShown(boolean value) {
        return new TaskState(currentTag, lastSwitched, branchTagMapping, value);
    }
}
