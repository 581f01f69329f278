package com.echelon.observability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SensitiveDataRedactor}: field redaction, nesting, case insensitivity and
 * free-text scrubbing.
 */
@DisplayName("SensitiveDataRedactor")
class SensitiveDataRedactorTest {

    private final SensitiveDataRedactor redactor = new SensitiveDataRedactor();

    @Nested
    @DisplayName("Field redaction")
    class Fields {

        @Test
        @DisplayName("should redact secrets and keep ordinary fields")
        void shouldRedactSecrets() {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("url", "https://hooks.example.com");
            data.put("secret", "whsec_123");
            data.put("api_key", "ock_abcdef");
            data.put("Authorization", "Bearer xyz");

            Map<String, Object> result = redactor.redact(data);

            assertThat(result.get("url")).isEqualTo("https://hooks.example.com");
            assertThat(result.get("secret")).isEqualTo(SensitiveDataRedactor.REDACTED);
            assertThat(result.get("api_key")).isEqualTo(SensitiveDataRedactor.REDACTED);
            assertThat(result.get("Authorization")).isEqualTo(SensitiveDataRedactor.REDACTED);
        }

        @Test
        @DisplayName("should not redact identifiers that merely end in 'id'")
        void shouldKeepIdentifiers() {
            Map<String, Object> result = redactor.redact(Map.of("key_id", "k-1", "webhook_id", "w-1"));

            assertThat(result).containsEntry("key_id", "k-1").containsEntry("webhook_id", "w-1");
        }

        @Test
        @DisplayName("should redact nested maps and lists")
        void shouldRedactNested() {
            Map<String, Object> data = Map.of(
                    "settings", Map.of("theme", "dark", "smtp_password", "hunter22"),
                    "hooks", List.of(Map.of("url", "u", "secret", "s")));

            Map<String, Object> result = redactor.redact(data);

            @SuppressWarnings("unchecked")
            Map<String, Object> settings = (Map<String, Object>) result.get("settings");
            assertThat(settings).containsEntry("theme", "dark")
                    .containsEntry("smtp_password", SensitiveDataRedactor.REDACTED);
            @SuppressWarnings("unchecked")
            List<Map<String, Object>> hooks = (List<Map<String, Object>>) result.get("hooks");
            assertThat(hooks.get(0)).containsEntry("secret", SensitiveDataRedactor.REDACTED);
        }

        @Test
        @DisplayName("should return an empty map for null input")
        void shouldHandleNull() {
            assertThat(redactor.redact(null)).isEmpty();
        }

        @Test
        @DisplayName("should honour custom patterns")
        void shouldHonourCustomPatterns() {
            var custom = new SensitiveDataRedactor(Set.of("ssn"));

            assertThat(custom.redact(Map.of("SSN", "123", "password", "p")))
                    .containsEntry("SSN", SensitiveDataRedactor.REDACTED)
                    .containsEntry("password", "p");
        }
    }

    @Nested
    @DisplayName("Message redaction")
    class Messages {

        @Test
        @DisplayName("should scrub key=value secrets from free text")
        void shouldScrubSecrets() {
            String scrubbed = redactor.redactMessage("upstream rejected api_key=ock_1234567890abcdef");

            assertThat(scrubbed).contains("api_key: [REDACTED]").doesNotContain("ock_1234567890abcdef");
        }

        @Test
        @DisplayName("should truncate long messages")
        void shouldTruncate() {
            String scrubbed = redactor.redactMessage("x".repeat(600));

            assertThat(scrubbed).hasSize(500 + "... [truncated]".length()).endsWith("[truncated]");
        }

        @Test
        @DisplayName("should return null for blank messages")
        void shouldReturnNullForBlank() {
            assertThat(redactor.redactMessage("  ")).isNull();
            assertThat(redactor.redactMessage(null)).isNull();
        }
    }
}
