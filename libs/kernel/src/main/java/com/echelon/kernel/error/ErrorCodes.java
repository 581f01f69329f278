package com.echelon.kernel.error;

/**
 * Stable wire codes carried on every kernel response.
 */
public final class ErrorCodes {

    public static final String OK = "OK";
    public static final String IDEMPOTENT_REPLAY = "IDEMPOTENT_REPLAY";
    public static final String DRY_RUN = "DRY_RUN";

    public static final String INVALID_API_KEY = "INVALID_API_KEY";
    public static final String SCOPE_DENIED = "SCOPE_DENIED";
    public static final String TENANT_MISMATCH = "TENANT_MISMATCH";
    public static final String NOT_FOUND = "NOT_FOUND";
    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String IDEMPOTENCY_CONFLICT = "IDEMPOTENCY_CONFLICT";
    public static final String IDEMPOTENCY_IN_FLIGHT = "IDEMPOTENCY_IN_FLIGHT";
    public static final String RATE_LIMITED = "RATE_LIMITED";
    public static final String CEILING_EXCEEDED = "CEILING_EXCEEDED";
    public static final String INVALID_VERIFICATION_TOKEN = "INVALID_VERIFICATION_TOKEN";
    public static final String TIMEOUT = "TIMEOUT";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private ErrorCodes() {
        // utility class
    }
}
