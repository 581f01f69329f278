package com.echelon.kernel.router;

import com.echelon.kernel.error.ErrorKind;
import com.echelon.kernel.error.KernelException;
import java.util.Map;

/**
 * Structured error carried by a failed {@link ActionResponse}.
 */
public record ErrorDetail(ErrorKind kind, String code, String message, Map<String, Object> details) {

    public ErrorDetail {
        details = details == null ? Map.of() : details;
    }

    public static ErrorDetail from(KernelException e) {
        return new ErrorDetail(e.kind(), e.code(), e.getMessage(), e.details());
    }
}
