package com.echelon.controlplane.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/**
 * Body of {@code POST /api/v1/manage}.
 *
 * @param action         namespace-qualified action name
 * @param params         action input; {@code payload} is accepted as an alias
 * @param idempotencyKey optional; the {@code Idempotency-Key} header takes precedence
 * @param dryRun         describe the impact without executing
 * @param timeoutMs      optional deadline for the whole request
 */
public record ManageRequest(
        @NotBlank @Size(max = 128) String action,
        @JsonAlias("payload") JsonNode params,
        @JsonProperty("idempotency_key") @Size(max = 255) String idempotencyKey,
        @JsonProperty("dry_run") boolean dryRun,
        @JsonProperty("timeout_ms") @Positive Long timeoutMs) {
}
