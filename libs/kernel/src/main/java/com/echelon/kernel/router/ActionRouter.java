package com.echelon.kernel.router;

import com.echelon.kernel.audit.AuditEntryFactory;
import com.echelon.kernel.audit.AuditLog;
import com.echelon.kernel.audit.AuditRequest;
import com.echelon.kernel.ceiling.CeilingEnforcer;
import com.echelon.kernel.error.ErrorCodes;
import com.echelon.kernel.error.ErrorKind;
import com.echelon.kernel.error.KernelException;
import com.echelon.kernel.idempotency.IdempotencyOutcome;
import com.echelon.kernel.idempotency.IdempotencyStore;
import com.echelon.kernel.idempotency.RequestFingerprint;
import com.echelon.kernel.identity.IdentityResolver;
import com.echelon.kernel.identity.ResolvedIdentity;
import com.echelon.kernel.json.Json;
import com.echelon.kernel.ratelimit.RateLimitDecision;
import com.echelon.kernel.ratelimit.RateLimiter;
import com.echelon.kernel.ratelimit.WindowLease;
import com.echelon.kernel.registry.Action;
import com.echelon.kernel.registry.ActionContext;
import com.echelon.kernel.registry.ActionDefinition;
import com.echelon.kernel.registry.ActionResult;
import com.echelon.kernel.registry.PackRegistry;
import com.echelon.kernel.registry.SchemaValidator;
import com.echelon.kernel.registry.ValidationResult;
import com.echelon.observability.CorrelationContext;
import com.echelon.observability.CorrelationContextHolder;
import com.echelon.observability.MetricFactory;
import com.echelon.observability.SpanHelper;
import com.echelon.security.TenantMismatchException;
import com.fasterxml.jackson.databind.JsonNode;
import io.opentelemetry.api.trace.SpanKind;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The kernel's single entry point.
 * <p>
 * Runs every request through the same pipeline: envelope validation, identity resolution,
 * action lookup, dry-run support, scope check, idempotency check-or-reserve, ceilings, rate
 * limits, input validation, then the handler inside a tracing span. Every outcome is audited
 * and returned as an {@link ActionResponse}; {@link #route(ActionRequest)} never throws.
 * <p>
 * Quota increments and idempotency reservations taken for a request that is rejected before
 * its handler starts are handed back. Once the handler has started they stay consumed, and
 * the idempotency record is settled by the handler's own completion, even after a timeout.
 */
public class ActionRouter {

    private static final Logger log = LoggerFactory.getLogger(ActionRouter.class);

    static final int MAX_IDEMPOTENCY_KEY_LENGTH = 255;
    private static final Pattern ACTION_NAME = Pattern.compile("^[a-z][a-z0-9_-]*(\\.[a-z0-9_-]+)+$");

    private final IdentityResolver resolver;
    private final PackRegistry registry;
    private final IdempotencyStore idempotency;
    private final CeilingEnforcer ceilings;
    private final RateLimiter rateLimiter;
    private final AuditLog auditLog;
    private final AuditEntryFactory auditEntries;
    private final SpanHelper spans;
    private final MetricFactory metrics;
    private final Clock clock;
    private final ExecutorService handlerExecutor;
    private final Duration defaultTimeout;

    public ActionRouter(IdentityResolver resolver, PackRegistry registry, IdempotencyStore idempotency,
                        CeilingEnforcer ceilings, RateLimiter rateLimiter, AuditLog auditLog,
                        AuditEntryFactory auditEntries, SpanHelper spans, MetricFactory metrics,
                        Clock clock, ExecutorService handlerExecutor, Duration defaultTimeout) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.idempotency = Objects.requireNonNull(idempotency, "idempotency");
        this.ceilings = Objects.requireNonNull(ceilings, "ceilings");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.auditLog = Objects.requireNonNull(auditLog, "auditLog");
        this.auditEntries = Objects.requireNonNull(auditEntries, "auditEntries");
        this.spans = Objects.requireNonNull(spans, "spans");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.handlerExecutor = Objects.requireNonNull(handlerExecutor, "handlerExecutor");
        this.defaultTimeout = defaultTimeout;
    }

    /**
     * Routes one request. Never throws.
     */
    public ActionResponse route(ActionRequest request) {
        String requestId = "req_" + UUID.randomUUID().toString().replace("-", "");
        long startNanos = System.nanoTime();
        CorrelationContext previous = CorrelationContextHolder.get().orElse(null);
        String correlationId = isBlank(request.correlationId()) ? requestId : request.correlationId();
        CorrelationContextHolder.set(new CorrelationContext(correlationId, null, null, requestId, request.action()));

        RequestState state = new RequestState(request, requestId, startNanos,
                new AuditRequest(requestId, clock.instant(), null, null, request.action(), request.payload(),
                        request.idempotencyKey(), request.sourceIp(), request.dryRun()));
        ActionResponse response;
        String auditMessage = null;
        try {
            response = execute(state);
        } catch (KernelException e) {
            state.rollback();
            response = ActionResponse.failure(requestId, e, request.dryRun());
            auditMessage = e.getCause() != null ? String.valueOf(e.getCause().getMessage()) : e.getMessage();
        } catch (RuntimeException e) {
            state.rollback();
            log.error("Unexpected failure routing action {}", request.action(), e);
            KernelException internal = KernelException.internal("Internal error", e);
            response = ActionResponse.failure(requestId, internal, request.dryRun());
            auditMessage = e.getMessage();
        } finally {
            if (previous != null) {
                CorrelationContextHolder.set(previous);
            } else {
                CorrelationContextHolder.clear();
            }
        }
        auditLog.record(auditEntries.create(state.audit, response.status(), response.code(), auditMessage));
        recordMetrics(response, startNanos);
        return response;
    }

    private ActionResponse execute(RequestState state) {
        ActionRequest request = state.request;
        validateEnvelope(request);

        ResolvedIdentity identity = resolver.resolve(request.credential(), request.tenantHint());
        state.audit = state.audit.withIdentity(identity.tenantId(), identity.credentialId());
        CorrelationContextHolder.get().ifPresent(ctx ->
                CorrelationContextHolder.set(ctx.withIdentity(identity.tenantId(), identity.credentialId())));

        Action action = registry.lookup(request.action())
                .orElseThrow(() -> KernelException.unknownAction(request.action()));
        ActionDefinition def = action.definition();
        if (request.dryRun() && !def.supportsDryRun()) {
            throw KernelException.invalidInput("Action '%s' does not support dry_run".formatted(def.name()));
        }
        IdentityResolver.requireScope(identity, def.requiredScope());

        boolean keyed = def.sideEffecting() && !request.dryRun() && !isBlank(request.idempotencyKey());
        if (keyed) {
            String fingerprint = RequestFingerprint.of(def.name(), payloadOrEmpty(request.payload()));
            IdempotencyOutcome outcome = idempotency.checkOrReserve(
                    identity.tenantId(), request.idempotencyKey(), def.name(), fingerprint);
            switch (outcome.kind()) {
                case HIT:
                    return ActionResponse.success(ErrorCodes.IDEMPOTENT_REPLAY, state.requestId, outcome.cached(),
                            false, List.of("tenant_scoped: " + identity.tenantId(), "idempotent_replay: true"));
                case CONFLICT:
                    throw KernelException.idempotencyConflict(request.idempotencyKey());
                case IN_FLIGHT:
                    throw KernelException.idempotencyInFlight(request.idempotencyKey());
                default:
                    state.reservation = outcome.reservation();
            }
        }

        if (request.dryRun()) {
            ceilings.check(identity.tenantId(), def.name());
        } else {
            state.ceilingLeases = ceilings.enforce(identity.tenantId(), def.name());
        }
        state.rateDecision = rateLimiter.checkAndIncrement(new RateLimiter.Subject(
                identity.credentialId(), identity.tenantId(), identity.tier(), request.sourceIp()), def.name());

        JsonNode input = payloadOrEmpty(request.payload());
        ValidationResult validation = SchemaValidator.validate(def.inputSchema(), input);
        if (!validation.valid()) {
            throw KernelException.invalidInput(validation.errors());
        }

        ActionContext context = new ActionContext(state.requestId, identity.tenantId(), identity.credentialId(),
                identity.tier(), identity.effectiveScopes(), request.dryRun(), request.idempotencyKey(),
                request.sourceIp(), clock);
        ActionResult result = invoke(state, action, context, input);

        List<String> constraints = new ArrayList<>();
        constraints.add("tenant_scoped: " + identity.tenantId());
        if (state.rateDecision != null && state.rateDecision.limit() != Long.MAX_VALUE) {
            constraints.add("rate_limit: %d/%d remaining".formatted(
                    state.rateDecision.remaining(), state.rateDecision.limit()));
        }
        String code = request.dryRun() ? ErrorCodes.DRY_RUN : ErrorCodes.OK;
        return ActionResponse.success(code, state.requestId, result.data(), request.dryRun(), constraints);
    }

    private ActionResult invoke(RequestState state, Action action, ActionContext context, JsonNode input) {
        Duration timeout = state.request.timeout() != null ? state.request.timeout() : defaultTimeout;
        long remainingNanos = timeout == null ? Long.MAX_VALUE
                : timeout.toNanos() - (System.nanoTime() - state.startNanos);
        if (remainingNanos <= 0) {
            throw KernelException.timeout(timeout);
        }

        CorrelationContext correlation = CorrelationContextHolder.get().orElse(null);
        CompletableFuture<ActionResult> execution = CompletableFuture.supplyAsync(
                () -> runHandler(action, context, input, correlation), handlerExecutor);
        state.handlerStarted();
        IdempotencyOutcome.Reservation reservation = state.takeReservation();
        if (reservation != null) {
            execution = execution.whenComplete((result, failure) -> settle(reservation, result, failure));
        }

        try {
            ActionResult result = timeout == null
                    ? execution.get()
                    : execution.get(remainingNanos, TimeUnit.NANOSECONDS);
            if (context.dryRun() && result.impact() == null) {
                throw KernelException.internal("Dry run of '%s' returned no impact".formatted(action.name()), null);
            }
            return result;
        } catch (TimeoutException e) {
            log.warn("Action {} timed out after {} ms; execution continues in background",
                    action.name(), timeout.toMillis());
            throw KernelException.timeout(timeout);
        } catch (ExecutionException e) {
            throw translate(action, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw KernelException.internal("Interrupted while executing " + action.name(), e);
        }
    }

    private ActionResult runHandler(Action action, ActionContext context, JsonNode input,
                                    CorrelationContext correlation) {
        Callable<ActionResult> call = () -> spans.withSpan("action " + action.name(), SpanKind.INTERNAL,
                Map.of("action.name", action.name(), "action.dry_run", String.valueOf(context.dryRun())),
                () -> action.handler().handle(context, input));
        try {
            ActionResult result = correlation == null
                    ? call.call()
                    : CorrelationContextHolder.callWithContext(correlation, call);
            if (result == null) {
                throw new IllegalStateException("Handler for " + action.name() + " returned no result");
            }
            return result;
        } catch (Exception e) {
            throw new CompletionException(e);
        }
    }

    private void settle(IdempotencyOutcome.Reservation reservation, ActionResult result, Throwable failure) {
        if (failure != null) {
            idempotency.release(reservation);
            return;
        }
        try {
            if (!idempotency.complete(reservation, result.data())) {
                log.warn("Idempotency reservation {} was lost before completion", reservation.storeKey());
            }
        } catch (RuntimeException e) {
            log.error("Failed to store idempotency record {}", reservation.storeKey(), e);
        }
    }

    private static KernelException translate(Action action, Throwable cause) {
        if (cause instanceof KernelException) {
            return (KernelException) cause;
        }
        if (cause instanceof TenantMismatchException) {
            return new KernelException(ErrorKind.FORBIDDEN, ErrorCodes.TENANT_MISMATCH,
                    "Resource belongs to another tenant", null);
        }
        log.error("Handler for {} failed", action.name(), cause);
        return KernelException.internal("Internal error while executing " + action.name(), cause);
    }

    private static void validateEnvelope(ActionRequest request) {
        List<String> errors = new ArrayList<>();
        if (isBlank(request.action())) {
            errors.add("action must not be blank");
        } else if (!ACTION_NAME.matcher(request.action()).matches()) {
            errors.add("action must be a namespace-qualified name like 'iam.keys.list'");
        }
        JsonNode payload = request.payload();
        if (payload != null && !payload.isNull() && !payload.isObject()) {
            errors.add("payload must be an object");
        }
        if (request.idempotencyKey() != null && (request.idempotencyKey().isBlank()
                || request.idempotencyKey().length() > MAX_IDEMPOTENCY_KEY_LENGTH)) {
            errors.add("idempotencyKey must be 1-" + MAX_IDEMPOTENCY_KEY_LENGTH + " characters");
        }
        if (request.timeout() != null && (request.timeout().isZero() || request.timeout().isNegative())) {
            errors.add("timeout must be positive");
        }
        if (!errors.isEmpty()) {
            throw KernelException.invalidInput(errors);
        }
    }

    private void recordMetrics(ActionResponse response, long startNanos) {
        String outcome = response.status().name().toLowerCase(Locale.ROOT);
        metrics.counter("echelon.actions", "Kernel requests by outcome", "outcome", outcome, "code", response.code())
                .increment();
        metrics.timer("echelon.action.duration", "Kernel request latency", "outcome", outcome)
                .record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
    }

    private static JsonNode payloadOrEmpty(JsonNode payload) {
        return payload == null || payload.isNull() || payload.isMissingNode() ? Json.object() : payload;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Mutable per-request bookkeeping: what must be handed back if the request fails before
     * its handler starts.
     */
    private final class RequestState {

        final ActionRequest request;
        final String requestId;
        final long startNanos;
        AuditRequest audit;
        IdempotencyOutcome.Reservation reservation;
        List<WindowLease> ceilingLeases = List.of();
        RateLimitDecision rateDecision;
        boolean handlerStarted;

        RequestState(ActionRequest request, String requestId, long startNanos, AuditRequest audit) {
            this.request = request;
            this.requestId = requestId;
            this.startNanos = startNanos;
            this.audit = audit;
        }

        void handlerStarted() {
            handlerStarted = true;
        }

        IdempotencyOutcome.Reservation takeReservation() {
            IdempotencyOutcome.Reservation taken = reservation;
            reservation = null;
            return taken;
        }

        void rollback() {
            if (handlerStarted) {
                return;
            }
            if (reservation != null) {
                idempotency.release(reservation);
                reservation = null;
            }
            ceilings.release(ceilingLeases);
            if (rateDecision != null) {
                rateLimiter.release(rateDecision);
            }
        }
    }
}
