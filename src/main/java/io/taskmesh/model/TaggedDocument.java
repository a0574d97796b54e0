package io.taskmesh.model;

import io.taskmesh.error.NotFoundException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The whole task file: tag name to tag, in file order. The {@value #MASTER} tag is always
 * present.
 */
public final class TaggedDocument {
    public static final String MASTER = "master";
    public static final String MASTER_DESCRIPTION = "Tasks live here by default";

    private final LinkedHashMap<String, Tag> tags;

    public TaggedDocument(Map<String, Tag> tags) {
        this.tags = new LinkedHashMap<>(tags == null ? Map.of() : tags);
    }

    public static TaggedDocument withEmptyMaster(String createdAt) {
        TaggedDocument document = new TaggedDocument(Map.of());
        document.put(MASTER, Tag.empty(TagMetadata.of(createdAt, MASTER_DESCRIPTION)));
        return document;
    }

    public Optional<Tag> tag(String name) {
        return Optional.ofNullable(tags.get(name));
    }

    public Tag requireTag(String name) {
        Tag tag = tags.get(name);
        if (tag == null) {
            throw new NotFoundException("Tag \"" + name + "\" does not exist");
        }
        return tag;
    }

    public List<Task> tasksFor(String name) {
        Tag tag = tags.get(name);
        return tag == null ? List.of() : tag.tasks();
    }

    public boolean contains(String name) {
        return tags.containsKey(name);
    }

    public void put(String name, Tag tag) {
        tags.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(tag, "tag"));
    }

    public Tag remove(String name) {
        return tags.remove(name);
    }

    /**
     * Moves a tag to a new key, keeping its position in file order.
     */
    public void rename(String oldName, String newName, Tag renamed) {
        LinkedHashMap<String, Tag> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Tag> entry : tags.entrySet()) {
            if (entry.getKey().equals(oldName)) {
                copy.put(newName, renamed);
            } else {
                copy.put(entry.getKey(), entry.getValue());
            }
        }
        tags.clear();
        tags.putAll(copy);
    }

    public List<String> tagNames() {
        return List.copyOf(tags.keySet());
    }

    public Map<String, Tag> asMap() {
        return Collections.unmodifiableMap(tags);
    }

    public int size() {
        return tags.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TaggedDocument)) return false;
        TaggedDocument other = (TaggedDocument) o;
        return tags.equals(other.tags);
    }

    @Override
    public int hashCode() {
        return tags.hashCode();
    }

    @Override
    public String toString() {
        return "TaggedDocument" + tags.keySet();
    }
}
