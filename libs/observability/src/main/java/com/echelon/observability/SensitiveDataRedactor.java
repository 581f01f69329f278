package com.echelon.observability;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Redacts sensitive fields from request payloads and messages before they reach audit
 * entries or logs.
 * <p>
 * Field names are matched case-insensitively against a set of patterns (password, token,
 * secret, authorization, api key, credential, cookie, private key, session). Nested maps and
 * lists are walked recursively. Free-text values (error messages) are scrubbed of
 * {@code key=value} style secrets and truncated.
 */
public final class SensitiveDataRedactor {

    /** The replacement string for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    /** Default maximum length of a redacted message. */
    public static final int DEFAULT_MAX_MESSAGE_LENGTH = 500;

    private static final Set<String> DEFAULT_SENSITIVE_PATTERNS = Set.of(
            "password", "passwd", "token", "secret", "authorization",
            "apikey", "api_key", "api-key", "credential", "cookie",
            "privatekey", "private_key", "private-key", "session", "bearer"
    );

    private static final List<Pattern> MESSAGE_PATTERNS = List.of(
            Pattern.compile("(api[_-]?key|apikey)\\s*[:=]\\s*['\"]?([a-zA-Z0-9_\\-]{10,})['\"]?",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("(token|access[_-]?token|bearer)\\s*[:=]\\s*['\"]?([a-zA-Z0-9_\\-.]{10,})['\"]?",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("(secret|password|pwd|passwd)\\s*[:=]\\s*['\"]?([^\\s'\"]{6,})['\"]?",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("(authorization|auth)\\s*[:=]\\s*['\"]?([^\\s'\"]{10,})['\"]?",
                    Pattern.CASE_INSENSITIVE)
    );

    private final Set<String> sensitivePatterns;
    private final Pattern compiledPattern;

    /**
     * Creates a redactor with the default sensitive field patterns.
     */
    public SensitiveDataRedactor() {
        this(DEFAULT_SENSITIVE_PATTERNS);
    }

    /**
     * Creates a redactor with custom sensitive field patterns (case-insensitive).
     *
     * @param patterns field name patterns to treat as sensitive
     */
    public SensitiveDataRedactor(Set<String> patterns) {
        this.sensitivePatterns = Set.copyOf(patterns);
        String regex = String.join("|", sensitivePatterns.stream()
                .map(Pattern::quote)
                .toList());
        this.compiledPattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a new map with sensitive field values replaced by {@value #REDACTED}.
     * Nested maps and lists are redacted recursively. Null input returns an empty map.
     *
     * @param data the payload map (keys are field names, values are arbitrary)
     * @return a new map with sensitive values redacted
     */
    public Map<String, Object> redact(Map<String, ?> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }

        Map<String, Object> result = new LinkedHashMap<>(data.size());
        for (Map.Entry<String, ?> entry : data.entrySet()) {
            String key = entry.getKey();
            if (isSensitive(key)) {
                result.put(key, REDACTED);
            } else {
                result.put(key, redactValue(entry.getValue()));
            }
        }
        return result;
    }

    /**
     * Scrubs {@code key=value} style secrets from free text and truncates it to
     * {@value #DEFAULT_MAX_MESSAGE_LENGTH} characters.
     *
     * @param message the message to scrub (may be null)
     * @return the scrubbed message, or null when the input is null or blank
     */
    public String redactMessage(String message) {
        return redactMessage(message, DEFAULT_MAX_MESSAGE_LENGTH);
    }

    /**
     * Scrubs {@code key=value} style secrets from free text and truncates it.
     *
     * @param message   the message to scrub (may be null)
     * @param maxLength maximum length before a truncation marker is appended
     * @return the scrubbed message, or null when the input is null or blank
     */
    public String redactMessage(String message, int maxLength) {
        if (message == null || message.isBlank()) {
            return null;
        }
        String redacted = message;
        for (Pattern pattern : MESSAGE_PATTERNS) {
            Matcher matcher = pattern.matcher(redacted);
            redacted = matcher.replaceAll(m -> Matcher.quoteReplacement(m.group(1) + ": " + REDACTED));
        }
        if (redacted.length() > maxLength) {
            redacted = redacted.substring(0, maxLength) + "... [truncated]";
        }
        return redacted;
    }

    /**
     * Checks whether a field name matches any sensitive pattern (case-insensitive).
     *
     * @param fieldName the field name to check
     * @return true if the field name contains a sensitive pattern
     */
    public boolean isSensitive(String fieldName) {
        if (fieldName == null) {
            return false;
        }
        return compiledPattern.matcher(fieldName).find();
    }

    /**
     * Returns the set of sensitive patterns this redactor uses.
     */
    public Set<String> sensitivePatterns() {
        return sensitivePatterns;
    }

    @SuppressWarnings("unchecked")
    private Object redactValue(Object value) {
        if (value instanceof Map<?, ?> nested) {
            return redact((Map<String, ?>) nested);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(redactValue(item));
            }
            return copy;
        }
        return value;
    }
}
