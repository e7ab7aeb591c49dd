package org.posts.validation;

/**
 * One declared property of the payload: it must be present and of the given type.
 */
public record FieldRule(String name, JsonType type) {
}
