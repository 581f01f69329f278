package com.echelon.security;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("CredentialExtractor")
class CredentialExtractorTest {

    @Nested
    @DisplayName("valid headers")
    class ValidHeaders {

        @Test
        @DisplayName("prefers X-API-Key over Authorization")
        void prefersApiKeyHeader() {
            assertThat(CredentialExtractor.extract("ock_abc", "Bearer other")).contains("ock_abc");
        }

        @Test
        @DisplayName("falls back to bearer token")
        void fallsBackToBearer() {
            assertThat(CredentialExtractor.extract(null, "Bearer ock_xyz")).contains("ock_xyz");
        }

        @Test
        @DisplayName("is case-insensitive for 'Bearer' prefix and trims whitespace")
        void caseInsensitive() {
            assertThat(CredentialExtractor.extractBearer("bearer   my-token")).contains("my-token");
        }
    }

    @Nested
    @DisplayName("invalid headers")
    class InvalidHeaders {

        @Test
        @DisplayName("returns empty when both headers are missing")
        void bothMissing() {
            assertThat(CredentialExtractor.extract(null, null)).isEmpty();
            assertThat(CredentialExtractor.extract(" ", "")).isEmpty();
        }

        @Test
        @DisplayName("returns empty for 'Basic' auth scheme")
        void basicScheme() {
            assertThat(CredentialExtractor.extractBearer("Basic dXNlcjpwYXNz")).isEmpty();
        }

        @Test
        @DisplayName("returns empty for 'Bearer' with no token")
        void bearerNoToken() {
            assertThat(CredentialExtractor.extractBearer("Bearer ")).isEmpty();
            assertThat(CredentialExtractor.extractBearer("Bearer")).isEmpty();
        }
    }
}
