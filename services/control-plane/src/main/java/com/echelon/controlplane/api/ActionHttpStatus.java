package com.echelon.controlplane.api;

import com.echelon.kernel.error.ErrorCodes;
import com.echelon.kernel.router.ActionResponse;
import com.echelon.kernel.router.ErrorDetail;
import java.util.Optional;
import org.springframework.http.HttpStatus;

/**
 * HTTP status for a kernel response. Only this class knows about HTTP; the kernel reports
 * error kinds and codes.
 */
final class ActionHttpStatus {

    private ActionHttpStatus() {
        // utility class
    }

    static HttpStatus of(ActionResponse response) {
        ErrorDetail error = response.error();
        if (error == null) {
            return HttpStatus.OK;
        }
        if (ErrorCodes.NOT_FOUND.equals(error.code())) {
            return HttpStatus.NOT_FOUND;
        }
        switch (error.kind()) {
            case UNAUTHENTICATED:
                return HttpStatus.UNAUTHORIZED;
            case FORBIDDEN:
                return HttpStatus.FORBIDDEN;
            case UNKNOWN_ACTION:
                return HttpStatus.NOT_FOUND;
            case INVALID_INPUT:
            case INVALID_VERIFICATION_TOKEN:
                return HttpStatus.BAD_REQUEST;
            case IDEMPOTENCY_CONFLICT:
                return HttpStatus.CONFLICT;
            case RATE_LIMITED:
            case CEILING_EXCEEDED:
                return HttpStatus.TOO_MANY_REQUESTS;
            case TIMEOUT:
                return HttpStatus.GATEWAY_TIMEOUT;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    /** Seconds for a {@code Retry-After} header, when the kernel reported one. */
    static Optional<Long> retryAfterSeconds(ActionResponse response) {
        if (response.error() == null) {
            return Optional.empty();
        }
        Object value = response.error().details().get("retryAfterSeconds");
        return value instanceof Number number ? Optional.of(Math.max(1L, number.longValue())) : Optional.empty();
    }
}
