package com.vidnyan.linthub.adapter.out.linter;

import com.fasterxml.jackson.databind.JsonNode;
import com.vidnyan.linthub.domain.model.Linter;

/**
 * One record of linter JSON output with type-checked field access.
 */
final class RawRecord {

    private final Linter linter;
    private final JsonNode node;

    RawRecord(Linter linter, JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new MalformedToolOutputException(linter, "expected an object, got " + describe(node));
        }
        this.linter = linter;
        this.node = node;
    }

    String requireString(String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw mismatch(field, value);
        }
        return value.asText();
    }

    int requireInt(String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isInt()) {
            throw mismatch(field, value);
        }
        return value.intValue();
    }

    /**
     * Integer field that may be null or missing.
     */
    Integer optionalInt(String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isInt()) {
            throw mismatch(field, value);
        }
        return value.intValue();
    }

    private MalformedToolOutputException mismatch(String field, JsonNode value) {
        return new MalformedToolOutputException(linter, "got " + describe(value) + " for " + field);
    }

    private static String describe(JsonNode value) {
        return value == null ? "nothing" : value.getNodeType().toString().toLowerCase();
    }
}
