package com.echelon.controlplane.api;

import com.echelon.kernel.json.Json;
import com.echelon.kernel.router.ActionRequest;
import com.echelon.kernel.router.ActionResponse;
import com.echelon.kernel.router.ActionRouter;
import com.echelon.observability.CorrelationContext;
import com.echelon.observability.CorrelationContextHolder;
import com.echelon.security.CredentialExtractor;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.time.Duration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * The single management entry point. Every action, including {@code meta.actions}, is invoked
 * through {@code POST /api/v1/manage}; the kernel decides the outcome and this controller only
 * translates it to HTTP.
 */
@RestController
@RequestMapping("/api/v1")
public class ManageController {

    public static final String API_KEY_HEADER = "X-API-Key";
    public static final String TENANT_HEADER = "X-Tenant-Id";
    public static final String IDEMPOTENCY_HEADER = "Idempotency-Key";

    private final ActionRouter router;

    public ManageController(ActionRouter router) {
        this.router = router;
    }

    @PostMapping(path = "/manage", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ActionResponse> manage(
            @Valid @RequestBody ManageRequest body,
            @RequestHeader(name = API_KEY_HEADER, required = false) String apiKey,
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestHeader(name = TENANT_HEADER, required = false) String tenantHint,
            @RequestHeader(name = IDEMPOTENCY_HEADER, required = false) String idempotencyHeader,
            HttpServletRequest http) {

        String credential = CredentialExtractor.extract(apiKey, authorization).orElse(null);
        String idempotencyKey = idempotencyHeader != null && !idempotencyHeader.isBlank()
                ? idempotencyHeader : body.idempotencyKey();
        String correlationId = CorrelationContextHolder.get()
                .map(CorrelationContext::correlationId)
                .orElse(null);

        ActionRequest request = new ActionRequest(
                credential,
                tenantHint,
                body.action(),
                idempotencyKey,
                body.params() == null ? Json.object() : body.params(),
                http.getRemoteAddr(),
                body.dryRun(),
                body.timeoutMs() == null ? null : Duration.ofMillis(body.timeoutMs()),
                correlationId);

        ActionResponse response = router.route(request);
        return toEntity(response);
    }

    static ResponseEntity<ActionResponse> toEntity(ActionResponse response) {
        HttpStatus status = ActionHttpStatus.of(response);
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(status);
        ActionHttpStatus.retryAfterSeconds(response)
                .ifPresent(seconds -> builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(seconds)));
        return builder.body(response);
    }
}
