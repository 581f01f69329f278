package com.echelon.kernel.router;

import com.echelon.kernel.error.ErrorKind;
import com.echelon.kernel.error.KernelException;
import com.echelon.kernel.error.ResponseStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * What the kernel returns for every request. Exactly one of {@code data} and {@code error} is set.
 *
 * @param status             allowed, denied or error
 * @param code               stable response code
 * @param requestId          kernel request ID (also in the audit trail)
 * @param data               action output on success
 * @param error              structured error on failure
 * @param dryRun             echoes the request's dry-run flag
 * @param constraintsApplied human-readable constraints, e.g. tenant scoping and remaining quota
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ActionResponse(
        ResponseStatus status,
        String code,
        String requestId,
        JsonNode data,
        ErrorDetail error,
        boolean dryRun,
        List<String> constraintsApplied) {

    public ActionResponse {
        constraintsApplied = constraintsApplied == null ? List.of() : List.copyOf(constraintsApplied);
    }

    public static ActionResponse success(String code, String requestId, JsonNode data, boolean dryRun,
                                         List<String> constraintsApplied) {
        return new ActionResponse(ResponseStatus.ALLOWED, code, requestId, data, null, dryRun, constraintsApplied);
    }

    public static ActionResponse failure(String requestId, KernelException e, boolean dryRun) {
        return new ActionResponse(e.status(), e.code(), requestId, null, ErrorDetail.from(e), dryRun, null);
    }

    public boolean ok() {
        return status == ResponseStatus.ALLOWED;
    }

    /** Error kind, or null on success. */
    public ErrorKind errorKind() {
        return error == null ? null : error.kind();
    }
}
