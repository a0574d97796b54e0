package io.taskmesh.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Tag bookkeeping. Timestamps are ISO-8601 strings as found in the file.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TagMetadata(
        String created,
        String updated,
        String description,
        CopiedFrom copiedFrom,
        Renamed renamed
) {
    public static TagMetadata of(String created, String description) {
        return new TagMetadata(created, created, description, null, null);
    }

    public TagMetadata withUpdated(String value) {
        return new TagMetadata(created, value, description, copiedFrom, renamed);
    }

    public TagMetadata withCreated(String value) {
        return new TagMetadata(value, updated, description, copiedFrom, renamed);
    }

    public TagMetadata withDescription(String value) {
        return new TagMetadata(created, updated, value, copiedFrom, renamed);
    }

    public TagMetadata withCopiedFrom(CopiedFrom value) {
        return new TagMetadata(created, updated, description, value, renamed);
    }

    public TagMetadata withRenamed(Renamed value) {
        return new TagMetadata(created, updated, description, copiedFrom, value);
    }

    public record CopiedFrom(String tag, String date) {
    }

    public record Renamed(String from, String date) {
    }
}
