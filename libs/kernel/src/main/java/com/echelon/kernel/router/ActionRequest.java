package com.echelon.kernel.router;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;

/**
 * One call into the kernel, already lifted out of its transport.
 *
 * @param credential     raw API key
 * @param tenantHint     tenant the caller claims to act for (optional)
 * @param action         namespace-qualified action name
 * @param idempotencyKey optional deduplication key
 * @param payload        action input (JSON object)
 * @param sourceIp       caller address (optional)
 * @param dryRun         describe impact without executing
 * @param timeout        optional deadline for the whole request
 * @param correlationId  optional upstream correlation ID
 */
public record ActionRequest(
        String credential,
        String tenantHint,
        String action,
        String idempotencyKey,
        JsonNode payload,
        String sourceIp,
        boolean dryRun,
        Duration timeout,
        String correlationId) {

    /** Minimal request: no tenant hint, key, dry run or timeout. */
    public static ActionRequest of(String credential, String action, JsonNode payload) {
        return new ActionRequest(credential, null, action, null, payload, null, false, null, null);
    }

    public ActionRequest withIdempotencyKey(String key) {
        return new ActionRequest(credential, tenantHint, action, key, payload, sourceIp, dryRun, timeout, correlationId);
    }

    public ActionRequest withTenantHint(String hint) {
        return new ActionRequest(credential, hint, action, idempotencyKey, payload, sourceIp, dryRun, timeout, correlationId);
    }

    public ActionRequest withSourceIp(String ip) {
        return new ActionRequest(credential, tenantHint, action, idempotencyKey, payload, ip, dryRun, timeout, correlationId);
    }

    public ActionRequest asDryRun() {
        return new ActionRequest(credential, tenantHint, action, idempotencyKey, payload, sourceIp, true, timeout, correlationId);
    }

    public ActionRequest withTimeout(Duration limit) {
        return new ActionRequest(credential, tenantHint, action, idempotencyKey, payload, sourceIp, dryRun, limit, correlationId);
    }
}
