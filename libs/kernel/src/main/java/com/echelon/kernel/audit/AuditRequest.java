package com.echelon.kernel.audit;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

/**
 * The request facts an audit entry is built from. Identity fields are filled in once the
 * caller has been resolved.
 */
public record AuditRequest(
        String requestId,
        Instant receivedAt,
        String tenantId,
        String actorId,
        String action,
        JsonNode payload,
        String idempotencyKey,
        String sourceIp,
        boolean dryRun) {

    public AuditRequest withIdentity(String resolvedTenantId, String resolvedActorId) {
        return new AuditRequest(requestId, receivedAt, resolvedTenantId, resolvedActorId, action, payload,
                idempotencyKey, sourceIp, dryRun);
    }
}
