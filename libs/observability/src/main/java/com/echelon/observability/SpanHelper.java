package com.echelon.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Opens OpenTelemetry spans around action handlers and tags them with the current
 * {@link CorrelationContext}.
 * <p>
 * Only the OTel API is used here; the host decides whether an SDK and exporter are installed.
 * Without one, {@code OpenTelemetry.noop()} tracers make every call a no-op.
 * <p>
 * Handler exceptions may quote payload values, so a failed span records the exception type
 * only, never its message.
 */
public final class SpanHelper {

    static final String ATTR_CORRELATION_ID = "correlation.id";
    static final String ATTR_REQUEST_ID = "request.id";
    static final String ATTR_TENANT_ID = "tenant.id";
    static final String ATTR_ACTOR_ID = "actor.id";
    static final String ATTR_ACTION = "action.name";
    static final String ATTR_ERROR_TYPE = "error.type";

    private final Tracer tracer;

    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Runs {@code callable} inside a new span.
     *
     * @param attributes extra span attributes, added before the correlation attributes
     * @throws Exception whatever the callable throws, after the span is marked failed
     */
    public <T> T withSpan(String spanName, SpanKind kind, Map<String, String> attributes,
                          Callable<T> callable) throws Exception {
        SpanBuilder builder = tracer.spanBuilder(spanName).setSpanKind(kind);
        attributes.forEach(builder::setAttribute);
        CorrelationContextHolder.get().ifPresent(ctx -> {
            builder.setAttribute(ATTR_CORRELATION_ID, ctx.correlationId());
            setIfPresent(builder, ATTR_REQUEST_ID, ctx.requestId());
            setIfPresent(builder, ATTR_TENANT_ID, ctx.tenantId());
            setIfPresent(builder, ATTR_ACTOR_ID, ctx.actorId());
            setIfPresent(builder, ATTR_ACTION, ctx.action());
        });

        Span span = builder.startSpan();
        try (Scope ignored = span.makeCurrent()) {
            T result = callable.call();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (Exception e) {
            span.setAttribute(ATTR_ERROR_TYPE, e.getClass().getName());
            span.setStatus(StatusCode.ERROR, e.getClass().getSimpleName());
            throw e;
        } finally {
            span.end();
        }
    }

    /** Internal span without extra attributes. */
    public <T> T withSpan(String spanName, Callable<T> callable) throws Exception {
        return withSpan(spanName, SpanKind.INTERNAL, Map.of(), callable);
    }

    public Tracer tracer() {
        return tracer;
    }

    private static void setIfPresent(SpanBuilder builder, String key, String value) {
        if (value != null) {
            builder.setAttribute(key, value);
        }
    }
}
