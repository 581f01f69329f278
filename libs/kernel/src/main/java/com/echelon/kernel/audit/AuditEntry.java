package com.echelon.kernel.audit;

import com.echelon.kernel.error.ResponseStatus;
import java.time.Instant;
import java.util.Map;

/**
 * One append-only audit record. Every request outcome that reaches a caller produces one.
 *
 * @param eventId        unique event ID
 * @param requestId      kernel request ID returned to the caller
 * @param timestamp      time the outcome was decided
 * @param tenantId       caller's tenant, null if authentication failed
 * @param actorId        credential ID, {@code "unknown"} if authentication failed
 * @param action         requested action name
 * @param pack           first segment of the action name
 * @param status         allowed, denied or error
 * @param code           response code
 * @param input          redacted request payload
 * @param requestHash    SHA-256 of the canonical redacted request
 * @param errorMessage   redacted, truncated error message (null on success)
 * @param idempotencyKey caller-supplied key, may be null
 * @param sourceIp       caller address, may be null
 * @param dryRun         dry-run flag
 * @param latencyMs      time from request receipt to outcome
 */
public record AuditEntry(
        String eventId,
        String requestId,
        Instant timestamp,
        String tenantId,
        String actorId,
        String action,
        String pack,
        ResponseStatus status,
        String code,
        Map<String, Object> input,
        String requestHash,
        String errorMessage,
        String idempotencyKey,
        String sourceIp,
        boolean dryRun,
        long latencyMs) {

    public static final String UNKNOWN_ACTOR = "unknown";

    public AuditEntry {
        input = input == null ? Map.of() : input;
        actorId = actorId == null ? UNKNOWN_ACTOR : actorId;
    }
}
