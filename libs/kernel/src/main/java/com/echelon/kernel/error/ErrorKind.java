package com.echelon.kernel.error;

/**
 * The kernel's error taxonomy.
 * <p>
 * WHY an enum carrying status and default code: hosts map kinds to transport statuses
 * (HTTP, gRPC) without inspecting messages, and the audit trail records the same code
 * the caller sees.
 */
public enum ErrorKind {

    UNAUTHENTICATED(ResponseStatus.DENIED, ErrorCodes.INVALID_API_KEY),
    FORBIDDEN(ResponseStatus.DENIED, ErrorCodes.SCOPE_DENIED),
    UNKNOWN_ACTION(ResponseStatus.ERROR, ErrorCodes.NOT_FOUND),
    INVALID_INPUT(ResponseStatus.ERROR, ErrorCodes.VALIDATION_ERROR),
    IDEMPOTENCY_CONFLICT(ResponseStatus.ERROR, ErrorCodes.IDEMPOTENCY_CONFLICT),
    RATE_LIMITED(ResponseStatus.DENIED, ErrorCodes.RATE_LIMITED),
    CEILING_EXCEEDED(ResponseStatus.DENIED, ErrorCodes.CEILING_EXCEEDED),
    INVALID_VERIFICATION_TOKEN(ResponseStatus.ERROR, ErrorCodes.INVALID_VERIFICATION_TOKEN),
    TIMEOUT(ResponseStatus.ERROR, ErrorCodes.TIMEOUT),
    INTERNAL(ResponseStatus.ERROR, ErrorCodes.INTERNAL_ERROR);

    private final ResponseStatus status;
    private final String defaultCode;

    ErrorKind(ResponseStatus status, String defaultCode) {
        this.status = status;
        this.defaultCode = defaultCode;
    }

    public ResponseStatus status() {
        return status;
    }

    public String defaultCode() {
        return defaultCode;
    }
}
