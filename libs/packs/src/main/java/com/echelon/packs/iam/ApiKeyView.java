package com.echelon.packs.iam;

import com.echelon.security.Credential;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

/**
 * What callers see of an API key. Never carries the hash; {@code key} is set only in the
 * response that created it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiKeyView(
        @JsonProperty("key_id") String keyId,
        String key,
        String prefix,
        String name,
        List<String> scopes,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("expires_at") Instant expiresAt,
        @JsonProperty("last_used_at") Instant lastUsedAt,
        @JsonProperty("revoked_at") Instant revokedAt,
        String status) {

    public static ApiKeyView of(Credential credential, Instant now) {
        return withKey(credential, null, now);
    }

    public static ApiKeyView withKey(Credential credential, String rawKey, Instant now) {
        String status = credential.isRevoked() ? "revoked" : credential.isExpired(now) ? "expired" : "active";
        return new ApiKeyView(credential.credentialId(), rawKey, credential.keyPrefix(), credential.name(),
                credential.scopes().stream().sorted().toList(), credential.createdAt(), credential.expiresAt(),
                credential.lastUsedAt(), credential.revokedAt(), status);
    }
}
