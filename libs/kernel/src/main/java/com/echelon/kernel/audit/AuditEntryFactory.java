package com.echelon.kernel.audit;

import com.echelon.kernel.error.ResponseStatus;
import com.echelon.kernel.json.Json;
import com.echelon.observability.SensitiveDataRedactor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Builds {@link AuditEntry} values: redacts the payload and the error message, hashes the
 * redacted request and stamps latency.
 */
public class AuditEntryFactory {

    private final SensitiveDataRedactor redactor;
    private final Clock clock;

    public AuditEntryFactory(SensitiveDataRedactor redactor, Clock clock) {
        this.redactor = Objects.requireNonNull(redactor, "redactor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public AuditEntry create(AuditRequest request, ResponseStatus status, String code, String errorMessage) {
        Instant now = clock.instant();
        Map<String, Object> input = redactPayload(request.payload());
        ObjectNode hashed = Json.object();
        hashed.put("action", request.action());
        hashed.set("payload", Json.toTree(input));
        long latency = request.receivedAt() == null ? 0
                : Math.max(0, Duration.between(request.receivedAt(), now).toMillis());
        return new AuditEntry(
                UUID.randomUUID().toString(),
                request.requestId(),
                now,
                request.tenantId(),
                request.actorId(),
                request.action(),
                packOf(request.action()),
                status,
                code,
                input,
                Json.sha256Hex(Json.canonical(hashed)),
                redactor.redactMessage(errorMessage),
                request.idempotencyKey(),
                request.sourceIp(),
                request.dryRun(),
                latency);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> redactPayload(JsonNode payload) {
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            return Map.of();
        }
        Map<String, Object> plain;
        if (payload.isObject()) {
            plain = Json.mapper().convertValue(payload, LinkedHashMap.class);
        } else {
            plain = new LinkedHashMap<>();
            plain.put("value", Json.mapper().convertValue(payload, Object.class));
        }
        return redactor.redact(plain);
    }

    static String packOf(String action) {
        if (action == null || action.isBlank()) {
            return null;
        }
        int dot = action.indexOf('.');
        return dot < 0 ? action : action.substring(0, dot);
    }
}
