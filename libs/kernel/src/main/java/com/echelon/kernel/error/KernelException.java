package com.echelon.kernel.error;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Every failure the kernel reports to a caller.
 * <p>
 * WHY a RuntimeException with typed accessors: failures cross the registry, the quota
 * components and pack handlers without checked-exception plumbing, and the router turns
 * each one into a structured response with {@link #kind()}, {@link #code()} and
 * {@link #details()}.
 */
public class KernelException extends RuntimeException {

    /** Shared message for every authentication failure so callers cannot probe key state. */
    public static final String INVALID_CREDENTIAL_MESSAGE = "Invalid or missing API key";

    private final ErrorKind kind;
    private final String code;
    private final Map<String, Object> details;

    public KernelException(ErrorKind kind, String code, String message, Map<String, Object> details) {
        this(kind, code, message, details, null);
    }

    public KernelException(ErrorKind kind, String code, String message, Map<String, Object> details,
                           Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.code = code == null ? kind.defaultCode() : code;
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    public ErrorKind kind() {
        return kind;
    }

    public String code() {
        return code;
    }

    public Map<String, Object> details() {
        return details;
    }

    public ResponseStatus status() {
        return kind.status();
    }

    public static KernelException unauthenticated() {
        return new KernelException(ErrorKind.UNAUTHENTICATED, null, INVALID_CREDENTIAL_MESSAGE, null);
    }

    public static KernelException forbidden(String requiredScope) {
        return new KernelException(ErrorKind.FORBIDDEN, null,
                "Missing required scope: " + requiredScope, Map.of("requiredScope", requiredScope));
    }

    public static KernelException tenantMismatch(String tenantHint) {
        return new KernelException(ErrorKind.FORBIDDEN, ErrorCodes.TENANT_MISMATCH,
                "API key does not belong to tenant '%s'".formatted(tenantHint), null);
    }

    public static KernelException unknownAction(String action) {
        return new KernelException(ErrorKind.UNKNOWN_ACTION, null,
                "Unknown action: " + action, Map.of("action", action));
    }

    public static KernelException invalidInput(List<String> violations) {
        String message = violations.size() == 1
                ? violations.get(0)
                : "Validation failed with %d errors".formatted(violations.size());
        return new KernelException(ErrorKind.INVALID_INPUT, null, message,
                Map.of("violations", List.copyOf(violations)));
    }

    public static KernelException invalidInput(String violation) {
        return invalidInput(List.of(violation));
    }

    /**
     * A resource named in the payload does not exist for the caller's tenant. Reported as
     * invalid input with code {@code NOT_FOUND}.
     */
    public static KernelException resourceNotFound(String resourceType, String resourceId) {
        return new KernelException(ErrorKind.INVALID_INPUT, ErrorCodes.NOT_FOUND,
                "%s not found: %s".formatted(resourceType, resourceId),
                Map.of("resourceType", resourceType, "resourceId", resourceId));
    }

    public static KernelException idempotencyConflict(String idempotencyKey) {
        return new KernelException(ErrorKind.IDEMPOTENCY_CONFLICT, null,
                "Idempotency key was already used with a different request",
                Map.of("idempotencyKey", idempotencyKey));
    }

    public static KernelException idempotencyInFlight(String idempotencyKey) {
        return new KernelException(ErrorKind.IDEMPOTENCY_CONFLICT, ErrorCodes.IDEMPOTENCY_IN_FLIGHT,
                "A request with this idempotency key is still in progress",
                Map.of("idempotencyKey", idempotencyKey));
    }

    public static KernelException rateLimited(String dimension, String window, long limit,
                                              long retryAfterSeconds) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("dimension", dimension);
        details.put("window", window);
        details.put("limit", limit);
        details.put("retryAfterSeconds", retryAfterSeconds);
        return new KernelException(ErrorKind.RATE_LIMITED, null,
                "Rate limit exceeded for %s (%d per %s); retry after %ds"
                        .formatted(dimension, limit, window, retryAfterSeconds), details);
    }

    public static KernelException ceilingExceeded(String ceiling, long limit) {
        return new KernelException(ErrorKind.CEILING_EXCEEDED, null,
                "Hard ceiling exceeded: %s (limit %d)".formatted(ceiling, limit),
                Map.of("ceiling", ceiling, "limit", limit));
    }

    public static KernelException invalidVerificationToken() {
        return new KernelException(ErrorKind.INVALID_VERIFICATION_TOKEN, null,
                "Verification token is invalid, expired or already used", null);
    }

    public static KernelException timeout(Duration timeout) {
        return new KernelException(ErrorKind.TIMEOUT, null,
                "Request did not complete within %d ms".formatted(timeout.toMillis()),
                Map.of("timeoutMs", timeout.toMillis()));
    }

    public static KernelException internal(String message, Throwable cause) {
        return new KernelException(ErrorKind.INTERNAL, null, message, null, cause);
    }
}
