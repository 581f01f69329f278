package com.echelon.observability;

/**
 * Immutable correlation context that flows with a single action request through the kernel.
 * <p>
 * Every request entering the action router establishes a {@code CorrelationContext}. Its values
 * are injected into SLF4J MDC so every log line emitted while the request is processed (by the
 * kernel or by a pack handler) can be tied back to the request and its audit entry.
 *
 * @param correlationId unique ID for the caller's flow (propagated from the host when present)
 * @param tenantId      resolved tenant (nullable until the credential has been resolved)
 * @param actorId       credential ID of the caller (nullable until resolved)
 * @param requestId     unique ID of this request, echoed in the response and the audit entry
 * @param action        namespace-qualified action name (e.g. {@code iam.keys.create})
 */
public record CorrelationContext(
        String correlationId,
        String tenantId,
        String actorId,
        String requestId,
        String action
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for tenant ID. */
    public static final String MDC_TENANT_ID = "tenantId";

    /** MDC key for actor (credential) ID. */
    public static final String MDC_ACTOR_ID = "actorId";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    /** MDC key for action name. */
    public static final String MDC_ACTION = "action";

    /**
     * Compact constructor: ensures correlationId is never null.
     */
    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Returns a copy carrying the resolved tenant and actor.
     */
    public CorrelationContext withIdentity(String tenantId, String actorId) {
        return new CorrelationContext(correlationId, tenantId, actorId, requestId, action);
    }
}
