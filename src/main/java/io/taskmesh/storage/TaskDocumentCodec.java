package io.taskmesh.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.taskmesh.error.StoreParseException;
import io.taskmesh.model.DependencyRef;
import io.taskmesh.model.Priority;
import io.taskmesh.model.Subtask;
import io.taskmesh.model.Tag;
import io.taskmesh.model.TagMetadata;
import io.taskmesh.model.TaggedDocument;
import io.taskmesh.model.Task;
import io.taskmesh.model.TaskStatus;
import io.taskmesh.util.Jsons;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps the JSON task document to the entity records and back, validating every record on the
 * way in. All field-level checks for stored data live here.
 */
final class TaskDocumentCodec {
    private final Path file;

    TaskDocumentCodec(Path file) {
        this.file = file;
    }

    /**
     * True for the single-namespace shape {@code {tasks:[...]}} written before tags existed.
     */
    static boolean isLegacyShape(JsonNode root) {
        if (root == null || !root.isObject() || !root.path("tasks").isArray()) {
            return false;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (isTagNode(entry.getValue())) {
                return false;
            }
        }
        return true;
    }

    private static boolean isTagNode(JsonNode node) {
        return node != null && node.isObject() && node.path("tasks").isArray();
    }

    TaggedDocument decode(JsonNode root, String nowIso) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            return TaggedDocument.withEmptyMaster(nowIso);
        }
        if (!root.isObject()) {
            throw new StoreParseException(file, "top-level value must be a JSON object");
        }
        if (isLegacyShape(root)) {
            JsonNode metadata = root.path("metadata");
            TagMetadata meta = metadata.isObject()
                    ? decodeMetadata(metadata)
                    : new TagMetadata(nowIso, nowIso, TaggedDocument.MASTER_DESCRIPTION, null, null);
            Map<String, Tag> tags = new LinkedHashMap<>();
            tags.put(TaggedDocument.MASTER, new Tag(decodeTasks(TaggedDocument.MASTER, root.path("tasks")), meta));
            return new TaggedDocument(tags);
        }
        Map<String, Tag> tags = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String name = entry.getKey();
            JsonNode value = entry.getValue();
            if (!value.isObject()) {
                // Non-tag keys left by older writers, e.g. a stray "tag" string.
                continue;
            }
            JsonNode tasks = value.path("tasks");
            if (!tasks.isMissingNode() && !tasks.isArray()) {
                throw new StoreParseException(file, "tag \"" + name + "\" has a non-array tasks field");
            }
            JsonNode metadata = value.path("metadata");
            tags.put(name, new Tag(
                    decodeTasks(name, tasks),
                    metadata.isObject() ? decodeMetadata(metadata) : null
            ));
        }
        TaggedDocument document = new TaggedDocument(tags);
        if (!document.contains(TaggedDocument.MASTER)) {
            document.put(TaggedDocument.MASTER, Tag.empty(TagMetadata.of(nowIso, TaggedDocument.MASTER_DESCRIPTION)));
        }
        return document;
    }

    ObjectNode encode(TaggedDocument document) {
        ObjectNode root = Jsons.mapper().createObjectNode();
        for (Map.Entry<String, Tag> entry : document.asMap().entrySet()) {
            ObjectNode tagNode = root.putObject(entry.getKey());
            ArrayNode tasks = tagNode.putArray("tasks");
            for (Task task : entry.getValue().tasks()) {
                tasks.add(encodeTask(task));
            }
            TagMetadata metadata = entry.getValue().metadata();
            if (metadata != null) {
                tagNode.set("metadata", Jsons.mapper().valueToTree(metadata));
            }
        }
        return root;
    }

    ObjectNode encodeTask(Task task) {
        ObjectNode node = Jsons.mapper().createObjectNode();
        node.put("id", task.id());
        node.put("title", task.title());
        node.put("description", task.description());
        node.put("details", task.details());
        node.put("testStrategy", task.testStrategy());
        node.put("status", task.status().wireName());
        if (task.priority() != null) {
            node.put("priority", task.priority().wireName());
        }
        if (task.dependencies() != null) {
            ArrayNode deps = node.putArray("dependencies");
            for (DependencyRef ref : task.dependencies()) {
                if (ref instanceof DependencyRef.TaskRef) {
                    deps.add(ref.taskId());
                } else {
                    deps.add(ref.toString());
                }
            }
        }
        ArrayNode subtasks = node.putArray("subtasks");
        for (Subtask subtask : task.subtasks()) {
            subtasks.add(encodeSubtask(subtask));
        }
        return node;
    }

    private ObjectNode encodeSubtask(Subtask subtask) {
        ObjectNode node = Jsons.mapper().createObjectNode();
        node.put("id", subtask.id());
        node.put("title", subtask.title());
        node.put("description", subtask.description());
        node.put("details", subtask.details());
        node.put("testStrategy", subtask.testStrategy());
        node.put("status", subtask.status().wireName());
        ArrayNode deps = node.putArray("dependencies");
        for (DependencyRef ref : subtask.dependencies()) {
            // Strings only: a bare int here would be re-read through the sibling convention.
            deps.add(ref.toString());
        }
        return node;
    }

    private List<Task> decodeTasks(String tagName, JsonNode array) {
        List<Task> out = new ArrayList<>();
        if (array == null || array.isMissingNode() || array.isNull()) {
            return out;
        }
        Set<Integer> seen = new HashSet<>();
        for (JsonNode node : array) {
            Task task = decodeTask(tagName, node);
            if (!seen.add(task.id())) {
                throw new StoreParseException(file, "duplicate task id " + task.id() + " in tag \"" + tagName + "\"");
            }
            out.add(task);
        }
        return out;
    }

    private Task decodeTask(String tagName, JsonNode node) {
        String where = "tag \"" + tagName + "\"";
        if (!node.isObject()) {
            throw new StoreParseException(file, "task entry in " + where + " is not an object");
        }
        int id = requirePositiveId(node, "task in " + where);
        String at = "task " + id + " in " + where;
        JsonNode title = node.path("title");
        if (!title.isTextual()) {
            throw new StoreParseException(file, at + " has no string title");
        }
        List<DependencyRef> dependencies = null;
        JsonNode deps = node.path("dependencies");
        if (deps.isArray()) {
            dependencies = new ArrayList<>();
            for (JsonNode dep : deps) {
                dependencies.add(decodeTaskDependency(at, dep));
            }
        } else if (!deps.isMissingNode() && !deps.isNull()) {
            throw new StoreParseException(file, at + " has a non-array dependencies field");
        }
        List<Subtask> subtasks = new ArrayList<>();
        JsonNode subs = node.path("subtasks");
        if (subs.isArray()) {
            Set<Integer> seen = new HashSet<>();
            for (JsonNode sub : subs) {
                Subtask subtask = decodeSubtask(id, at, sub);
                if (!seen.add(subtask.id())) {
                    throw new StoreParseException(file, "duplicate subtask id " + subtask.id() + " under " + at);
                }
                subtasks.add(subtask);
            }
        } else if (!subs.isMissingNode() && !subs.isNull()) {
            throw new StoreParseException(file, at + " has a non-array subtasks field");
        }
        return new Task(
                id,
                title.asText(),
                textOrEmpty(node, "description"),
                textOrEmpty(node, "details"),
                textOrEmpty(node, "testStrategy"),
                decodeStatus(at, node.path("status")),
                decodePriority(at, node.path("priority")),
                dependencies,
                subtasks
        );
    }

    private Subtask decodeSubtask(int parentId, String parentAt, JsonNode node) {
        if (!node.isObject()) {
            throw new StoreParseException(file, "subtask entry under " + parentAt + " is not an object");
        }
        int id = requirePositiveId(node, "subtask under " + parentAt);
        String at = "subtask " + parentId + "." + id;
        List<DependencyRef> dependencies = new ArrayList<>();
        JsonNode deps = node.path("dependencies");
        if (deps.isArray()) {
            for (JsonNode dep : deps) {
                dependencies.add(decodeSubtaskDependency(parentId, at, dep));
            }
        } else if (!deps.isMissingNode() && !deps.isNull()) {
            throw new StoreParseException(file, at + " has a non-array dependencies field");
        }
        return new Subtask(
                id,
                node.path("title").asText(""),
                textOrEmpty(node, "description"),
                textOrEmpty(node, "details"),
                textOrEmpty(node, "testStrategy"),
                decodeStatus(at, node.path("status")),
                dependencies
        );
    }

    private DependencyRef decodeTaskDependency(String at, JsonNode dep) {
        try {
            if (dep.isIntegralNumber()) {
                return DependencyRef.task(requireInt(dep, at));
            }
            if (dep.isTextual()) {
                return DependencyRef.parse(dep.asText());
            }
        } catch (IllegalArgumentException e) {
            throw new StoreParseException(file, at + ": " + e.getMessage(), e);
        }
        throw new StoreParseException(file, at + " has a dependency that is neither a number nor an id string: " + dep);
    }

    private DependencyRef decodeSubtaskDependency(int parentId, String at, JsonNode dep) {
        try {
            if (dep.isIntegralNumber()) {
                return DependencyRef.fromSubtaskInt(parentId, requireInt(dep, at));
            }
            if (dep.isTextual()) {
                return DependencyRef.parse(dep.asText());
            }
        } catch (IllegalArgumentException e) {
            throw new StoreParseException(file, at + ": " + e.getMessage(), e);
        }
        throw new StoreParseException(file, at + " has a dependency that is neither a number nor an id string: " + dep);
    }

    private TaskStatus decodeStatus(String at, JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return TaskStatus.PENDING;
        }
        try {
            return TaskStatus.fromString(node.asText());
        } catch (IllegalArgumentException e) {
            throw new StoreParseException(file, at + ": " + e.getMessage(), e);
        }
    }

    private Priority decodePriority(String at, JsonNode node) {
        if (node.isMissingNode() || node.isNull() || node.asText().isBlank()) {
            return null;
        }
        try {
            return Priority.fromString(node.asText());
        } catch (IllegalArgumentException e) {
            throw new StoreParseException(file, at + ": " + e.getMessage(), e);
        }
    }

    private TagMetadata decodeMetadata(JsonNode node) {
        JsonNode copied = node.path("copiedFrom");
        JsonNode renamed = node.path("renamed");
        return new TagMetadata(
                node.path("created").asText(null),
                node.path("updated").asText(null),
                node.path("description").asText(null),
                copied.isObject()
                        ? new TagMetadata.CopiedFrom(copied.path("tag").asText(null), copied.path("date").asText(null))
                        : null,
                renamed.isObject()
                        ? new TagMetadata.Renamed(renamed.path("from").asText(null), renamed.path("date").asText(null))
                        : null
        );
    }

    private int requirePositiveId(JsonNode node, String what) {
        JsonNode id = node.path("id");
        int value;
        if (id.isIntegralNumber()) {
            value = requireInt(id, what);
        } else if (id.isTextual() && id.asText().trim().matches("\\d+")) {
            try {
                value = Integer.parseInt(id.asText().trim());
            } catch (NumberFormatException e) {
                throw new StoreParseException(file, what + " has an id out of range: " + id.asText(), e);
            }
        } else {
            throw new StoreParseException(file, what + " has no integer id");
        }
        if (value <= 0) {
            throw new StoreParseException(file, what + " has non-positive id " + value);
        }
        return value;
    }

    // intValue() wraps out-of-range numbers silently
    private int requireInt(JsonNode number, String at) {
        if (!number.canConvertToInt()) {
            throw new StoreParseException(file, at + " has a number out of range: " + number.asText());
        }
        return number.intValue();
    }

    private static String textOrEmpty(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? "" : value.asText();
    }
}
