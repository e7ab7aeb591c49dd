package org.posts.validation;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.function.Predicate;

/**
 * JSON schema primitive types, named as they appear in error messages.
 */
public enum JsonType {
    STRING("string", JsonNode::isTextual),
    OBJECT("object", JsonNode::isObject);

    private final String schemaName;
    private final Predicate<JsonNode> matcher;

    JsonType(String schemaName, Predicate<JsonNode> matcher) {
        this.schemaName = schemaName;
        this.matcher = matcher;
    }

    public String getSchemaName() {
        return schemaName;
    }

    public boolean matches(JsonNode node) {
        return node != null && matcher.test(node);
    }
}
