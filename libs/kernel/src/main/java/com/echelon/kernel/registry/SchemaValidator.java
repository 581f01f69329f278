package com.echelon.kernel.registry;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Validates a JSON payload against a {@link FieldSchema}.
 *
 * <p>WHY manual validation over a JSON-Schema library: the kernel supports a small, fixed
 * subset, returns all errors at once in a {@link ValidationResult}, and is fast. Unknown
 * properties are ignored.
 */
public final class SchemaValidator {

    private SchemaValidator() {
        // utility class
    }

    /**
     * Validates an action input. A missing or null payload is treated as an empty object.
     */
    public static ValidationResult validate(FieldSchema schema, JsonNode payload) {
        List<String> errors = new ArrayList<>();
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            checkRequired("", schema, null, errors);
        } else if (FieldSchema.OBJECT.equals(schema.type()) && !payload.isObject()) {
            errors.add("payload must be an object");
        } else {
            checkObject("", schema, payload, errors);
        }
        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    private static void checkObject(String path, FieldSchema schema, JsonNode value, List<String> errors) {
        checkRequired(path, schema, value, errors);
        for (Map.Entry<String, FieldSchema> property : schema.properties().entrySet()) {
            JsonNode child = value.get(property.getKey());
            if (child != null && !child.isNull()) {
                checkValue(qualify(path, property.getKey()), property.getValue(), child, errors);
            }
        }
    }

    private static void checkRequired(String path, FieldSchema schema, JsonNode value, List<String> errors) {
        for (String field : schema.required()) {
            JsonNode child = value == null ? null : value.get(field);
            if (child == null || child.isNull()) {
                errors.add("Missing required field: " + qualify(path, field));
            }
        }
    }

    private static void checkValue(String field, FieldSchema schema, JsonNode value, List<String> errors) {
        switch (schema.type()) {
            case FieldSchema.STRING:
                if (!value.isTextual()) {
                    errors.add(field + " must be a string");
                } else if (!schema.enumValues().isEmpty() && !schema.enumValues().contains(value.asText())) {
                    errors.add(field + " must be one of: " + String.join(", ", schema.enumValues()));
                }
                break;
            case FieldSchema.INTEGER:
                if (!value.isIntegralNumber()) {
                    errors.add(field + " must be an integer");
                } else {
                    checkRange(field, schema, value.asDouble(), errors);
                }
                break;
            case FieldSchema.NUMBER:
                if (!value.isNumber()) {
                    errors.add(field + " must be a number");
                } else {
                    checkRange(field, schema, value.asDouble(), errors);
                }
                break;
            case FieldSchema.BOOLEAN:
                if (!value.isBoolean()) {
                    errors.add(field + " must be a boolean");
                }
                break;
            case FieldSchema.ARRAY:
                if (!value.isArray()) {
                    errors.add(field + " must be an array");
                } else if (schema.items() != null) {
                    int index = 0;
                    for (Iterator<JsonNode> it = value.elements(); it.hasNext(); index++) {
                        JsonNode item = it.next();
                        if (!item.isNull()) {
                            checkValue(field + "[" + index + "]", schema.items(), item, errors);
                        }
                    }
                }
                break;
            case FieldSchema.OBJECT:
                if (!value.isObject()) {
                    errors.add(field + " must be an object");
                } else {
                    checkObject(field, schema, value, errors);
                }
                break;
            default:
                errors.add(field + " has unsupported schema type '" + schema.type() + "'");
        }
    }

    private static void checkRange(String field, FieldSchema schema, double number, List<String> errors) {
        if (schema.minimum() != null && number < schema.minimum()) {
            errors.add(field + " must be >= " + format(schema.minimum()));
        }
        if (schema.maximum() != null && number > schema.maximum()) {
            errors.add(field + " must be <= " + format(schema.maximum()));
        }
    }

    private static String format(double bound) {
        return bound == Math.rint(bound) ? Long.toString((long) bound) : Double.toString(bound);
    }

    private static String qualify(String path, String field) {
        return path.isEmpty() ? field : path + "." + field;
    }
}
