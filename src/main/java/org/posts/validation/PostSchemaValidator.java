package org.posts.validation;

import com.fasterxml.jackson.databind.JsonNode;
import org.posts.exception.PostValidationException;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Checks an inbound post payload against the fixed schema: an object with
 * required string properties {@code title} then {@code body}.
 * Rules run in declaration order and the first failure is reported alone.
 */
@Component
public class PostSchemaValidator {

    public static final List<FieldRule> POST_RULES = List.of(
            new FieldRule("title", JsonType.STRING),
            new FieldRule("body", JsonType.STRING)
    );

    private final List<FieldRule> rules;

    public PostSchemaValidator() {
        this(POST_RULES);
    }

    PostSchemaValidator(List<FieldRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * @throws PostValidationException with the message of the first failing rule
     */
    public void validate(JsonNode payload) {
        if (!JsonType.OBJECT.matches(payload)) {
            throw typeMismatch(payload, JsonType.OBJECT);
        }
        for (FieldRule rule : rules) {
            if (!payload.has(rule.name())) {
                throw new PostValidationException(JsonValueRenderer.quote(rule.name()) + " is a required property");
            }
            JsonNode value = payload.get(rule.name());
            if (!rule.type().matches(value)) {
                throw typeMismatch(value, rule.type());
            }
        }
    }

    private static PostValidationException typeMismatch(JsonNode value, JsonType expected) {
        return new PostValidationException(
                JsonValueRenderer.render(value) + " is not of type '" + expected.getSchemaName() + "'");
    }
}
