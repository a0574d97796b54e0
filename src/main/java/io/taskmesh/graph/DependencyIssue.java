package io.taskmesh.graph;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DependencyIssue(Type type, String taskId, String dependencyId, String message) {
    public enum Type {
        SELF("self"),
        MISSING("missing"),
        CIRCULAR("circular");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String wireName() {
            return wireName;
        }
    }
}
