package com.echelon.kernel.verification;

import com.echelon.kernel.audit.AuditEntryFactory;
import com.echelon.kernel.audit.AuditLog;
import com.echelon.kernel.audit.AuditRequest;
import com.echelon.kernel.error.ErrorCodes;
import com.echelon.kernel.error.KernelException;
import com.echelon.kernel.json.Json;
import com.echelon.kernel.router.ActionResponse;
import com.echelon.observability.MetricFactory;
import com.echelon.security.TenantVerifier;
import com.echelon.security.VerificationResult;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * Kernel-facing side of the tenant verification state machine.
 * <p>
 * Wraps {@link TenantVerifier} so that redemption attempts are audited as action
 * {@value #ACTION} and failures surface as {@code INVALID_VERIFICATION_TOKEN} responses. A
 * successful redemption widens every credential of the tenant on its next resolution; nothing
 * here touches the credentials themselves.
 */
public class VerificationService {

    public static final String ACTION = "tenant.verify";
    static final String ACTOR = "verification-token";

    private final TenantVerifier verifier;
    private final AuditLog auditLog;
    private final AuditEntryFactory auditEntries;
    private final MetricFactory metrics;
    private final Clock clock;

    public VerificationService(TenantVerifier verifier, AuditLog auditLog, AuditEntryFactory auditEntries,
                               MetricFactory metrics, Clock clock) {
        this.verifier = Objects.requireNonNull(verifier, "verifier");
        this.auditLog = Objects.requireNonNull(auditLog, "auditLog");
        this.auditEntries = Objects.requireNonNull(auditEntries, "auditEntries");
        this.metrics = metrics;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Issues a token for the external signup workflow. The raw token is returned once.
     */
    public String issueToken(String tenantId) {
        return verifier.issue(tenantId);
    }

    /**
     * Redeems a token for the tenant.
     *
     * @param sourceIp caller address for the audit trail, may be null
     */
    public ActionResponse redeem(String tenantId, String rawToken, String sourceIp) {
        String requestId = "req_" + UUID.randomUUID().toString().replace("-", "");
        AuditRequest audit = new AuditRequest(requestId, clock.instant(), tenantId, ACTOR, ACTION,
                Json.object().put("tenantId", tenantId), null, sourceIp, false);

        VerificationResult result = verifier.redeem(tenantId, rawToken);
        ActionResponse response;
        String message = null;
        if (result == VerificationResult.VERIFIED) {
            ObjectNode data = Json.object();
            data.put("tenantId", tenantId);
            data.put("verificationState", "verified");
            response = ActionResponse.success(ErrorCodes.OK, requestId, data, false,
                    List.of("tenant_scoped: " + tenantId));
        } else {
            KernelException e = KernelException.invalidVerificationToken();
            response = ActionResponse.failure(requestId, e, false);
            message = e.getMessage();
        }
        auditLog.record(auditEntries.create(audit, response.status(), response.code(), message));
        if (metrics != null) {
            metrics.counter("echelon.verifications", "Verification token redemptions",
                    "result", result.name().toLowerCase(Locale.ROOT)).increment();
        }
        return response;
    }
}
