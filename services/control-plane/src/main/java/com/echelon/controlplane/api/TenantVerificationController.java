package com.echelon.controlplane.api;

import com.echelon.kernel.router.ActionResponse;
import com.echelon.kernel.verification.VerificationService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Redeems a verification token delivered out of band to the tenant. No API key is required:
 * possession of the token is the proof.
 */
@RestController
@RequestMapping("/api/v1/tenants")
public class TenantVerificationController {

    private final VerificationService verification;

    public TenantVerificationController(VerificationService verification) {
        this.verification = verification;
    }

    public record VerifyRequest(@NotBlank String token) {
    }

    @PostMapping(path = "/{tenantId}/verify", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ActionResponse> verify(@PathVariable String tenantId,
                                                 @Valid @RequestBody VerifyRequest body,
                                                 HttpServletRequest http) {
        ActionResponse response = verification.redeem(tenantId, body.token(), http.getRemoteAddr());
        return ManageController.toEntity(response);
    }
}
