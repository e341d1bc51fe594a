package com.gateflow.core.validation;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Small JSON accessors shared by the gate profiles.
 */
final class JsonChecks {

    private JsonChecks() {}

    static boolean isNonBlankText(JsonNode node) {
        return node != null && node.isTextual() && !node.asText().isBlank();
    }

    static boolean hasArray(JsonNode output, String field) {
        JsonNode node = output.get(field);
        return node != null && node.isArray();
    }

    /**
     * Checks that a field, when present, is a non-blank path. Absence is reported by the engine.
     */
    static void requirePath(JsonNode output, String field, ValidationIssues issues) {
        JsonNode node = output.get(field);
        if (node != null && !node.isNull() && !isNonBlankText(node)) {
            issues.major("'" + field + "' must be a non-blank path");
        }
    }

    /**
     * Collects the text values of a string-or-array field.
     */
    static List<String> texts(JsonNode node) {
        var values = new ArrayList<String>();
        if (node == null || node.isNull() || node.isMissingNode()) {
            return values;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                if (isNonBlankText(item)) {
                    values.add(item.asText());
                }
            }
        } else if (isNonBlankText(node)) {
            values.add(node.asText());
        }
        return values;
    }
}
