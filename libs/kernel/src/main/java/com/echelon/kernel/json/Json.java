package com.echelon.kernel.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Shared Jackson mapper plus canonical JSON and SHA-256 helpers.
 * <p>
 * WHY Jackson: the host is a Spring Boot service and Jackson is its default JSON library.
 * The {@code JavaTimeModule} handles {@code Instant} as ISO 8601 strings in store values
 * and audit lines.
 */
public final class Json {

    private static final ObjectMapper MAPPER = createMapper();
    private static final ObjectMapper CANONICAL = createMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private Json() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /** Returns the shared ObjectMapper. */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static ObjectNode object() {
        return MAPPER.createObjectNode();
    }

    /**
     * Serializes a value to a JSON string.
     *
     * @throws JsonException if serialization fails
     */
    public static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new JsonException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * Deserializes a JSON string.
     *
     * @throws JsonException if the JSON is malformed or does not match the type
     */
    public static <T> T read(String json, Class<T> type) {
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new JsonException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }

    public static JsonNode toTree(Object value) {
        return value == null ? MAPPER.nullNode() : MAPPER.valueToTree(value);
    }

    /**
     * Serializes a JSON tree with object keys sorted at every level.
     */
    public static String canonical(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return "null";
        }
        try {
            Object plain = MAPPER.treeToValue(node, Object.class);
            return CANONICAL.writeValueAsString(plain);
        } catch (JsonProcessingException e) {
            throw new JsonException("Failed to canonicalize JSON", e);
        }
    }

    /** Lower-case hex SHA-256 of the UTF-8 bytes of {@code value}. */
    public static String sha256Hex(String value) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    /**
     * Thrown when JSON serialization or deserialization fails.
     */
    public static class JsonException extends RuntimeException {
        public JsonException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
