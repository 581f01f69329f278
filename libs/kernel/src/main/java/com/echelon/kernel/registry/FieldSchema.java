package com.echelon.kernel.registry;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A JSON-Schema-shaped description of an action's input or output.
 * <p>
 * Supports the subset the kernel validates: {@code type}, nested {@code properties},
 * {@code required}, {@code enum}, {@code minimum}/{@code maximum} and array {@code items}.
 * Instances serialize to the same shape, which is what {@code meta.actions} returns.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record FieldSchema(
        String type,
        String description,
        Map<String, FieldSchema> properties,
        List<String> required,
        @JsonProperty("enum") List<String> enumValues,
        Double minimum,
        Double maximum,
        FieldSchema items) {

    public static final String OBJECT = "object";
    public static final String STRING = "string";
    public static final String INTEGER = "integer";
    public static final String NUMBER = "number";
    public static final String BOOLEAN = "boolean";
    public static final String ARRAY = "array";

    public FieldSchema {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("schema type must not be blank");
        }
        properties = properties == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        required = required == null ? List.of() : List.copyOf(required);
        enumValues = enumValues == null ? List.of() : List.copyOf(enumValues);
    }

    private static FieldSchema of(String type) {
        return new FieldSchema(type, null, null, null, null, null, null, null);
    }

    public static FieldSchema string() {
        return of(STRING);
    }

    public static FieldSchema integer() {
        return of(INTEGER);
    }

    public static FieldSchema number() {
        return of(NUMBER);
    }

    public static FieldSchema bool() {
        return of(BOOLEAN);
    }

    public static FieldSchema array(FieldSchema items) {
        return new FieldSchema(ARRAY, null, null, null, null, null, null, items);
    }

    /** An object with no declared properties. */
    public static FieldSchema object() {
        return of(OBJECT);
    }

    /** An object with the given properties (in declaration order) and required names. */
    public static FieldSchema object(Map<String, FieldSchema> properties, String... required) {
        return new FieldSchema(OBJECT, null, properties, Arrays.asList(required), null, null, null, null);
    }

    public FieldSchema describedAs(String text) {
        return new FieldSchema(type, text, properties, required, enumValues, minimum, maximum, items);
    }

    public FieldSchema oneOf(String... values) {
        return new FieldSchema(type, description, properties, required, Arrays.asList(values), minimum, maximum, items);
    }

    public FieldSchema min(double value) {
        return new FieldSchema(type, description, properties, required, enumValues, value, maximum, items);
    }

    public FieldSchema max(double value) {
        return new FieldSchema(type, description, properties, required, enumValues, minimum, value, items);
    }
}
