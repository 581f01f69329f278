package com.echelon.packs;

import com.echelon.kernel.error.KernelException;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Readers for already schema-validated action input.
 * <p>
 * The kernel has checked types and required fields before a handler runs, so these only
 * deal with absent values and the formats the schema subset cannot express.
 */
public final class PackInputs {

    private PackInputs() {
        // utility class
    }

    /** Returns the string field, or null when absent or JSON null. */
    public static String text(JsonNode input, String field) {
        JsonNode value = input.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    public static boolean has(JsonNode input, String field) {
        JsonNode value = input.get(field);
        return value != null && !value.isNull();
    }

    /** Returns the string array field as an ordered set, or null when absent. */
    public static Set<String> textSet(JsonNode input, String field) {
        List<String> values = textList(input, field);
        return values == null ? null : new LinkedHashSet<>(values);
    }

    /** Returns the string array field, or null when absent. */
    public static List<String> textList(JsonNode input, String field) {
        JsonNode value = input.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        List<String> values = new ArrayList<>();
        value.forEach(item -> values.add(item.asText()));
        return values;
    }

    /**
     * Parses an ISO-8601 instant field.
     *
     * @throws KernelException {@code VALIDATION_ERROR} if the value is not an instant
     */
    public static Instant instant(JsonNode input, String field) {
        String value = text(input, field);
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw KernelException.invalidInput(field + " must be an ISO-8601 timestamp");
        }
    }

    public static int integer(JsonNode input, String field, int defaultValue) {
        JsonNode value = input.get(field);
        return value == null || value.isNull() ? defaultValue : value.asInt();
    }
}
