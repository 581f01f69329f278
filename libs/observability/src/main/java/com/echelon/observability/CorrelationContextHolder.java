package com.echelon.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Per-thread {@link CorrelationContext}, mirrored into the SLF4J MDC.
 * <p>
 * Each of the five context fields maps to one MDC key; a null field removes its key so a
 * log line never shows a value left over from an earlier request on the same thread.
 * <p>
 * The router runs handlers on a worker pool, so the context does not follow the request on
 * its own. {@link #callWithContext(CorrelationContext, Callable)} installs it on the worker
 * and restores whatever the worker had before.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * Installs the context on this thread and in the MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        mdc(CorrelationContext.MDC_CORRELATION_ID, context.correlationId());
        mdc(CorrelationContext.MDC_TENANT_ID, context.tenantId());
        mdc(CorrelationContext.MDC_ACTOR_ID, context.actorId());
        mdc(CorrelationContext.MDC_REQUEST_ID, context.requestId());
        mdc(CorrelationContext.MDC_ACTION, context.action());
    }

    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /** Removes the context and every MDC key it owns. */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_TENANT_ID);
        MDC.remove(CorrelationContext.MDC_ACTOR_ID);
        MDC.remove(CorrelationContext.MDC_REQUEST_ID);
        MDC.remove(CorrelationContext.MDC_ACTION);
    }

    /** Runs {@code runnable} under {@code context}, then restores the previous one. */
    public static void runWithContext(CorrelationContext context, Runnable runnable) {
        CorrelationContext previous = CONTEXT.get();
        set(context);
        try {
            runnable.run();
        } finally {
            restore(previous);
        }
    }

    /**
     * Value-returning variant of {@link #runWithContext(CorrelationContext, Runnable)}.
     *
     * @throws Exception whatever the callable throws
     */
    public static <T> T callWithContext(CorrelationContext context, Callable<T> callable) throws Exception {
        CorrelationContext previous = CONTEXT.get();
        set(context);
        try {
            return callable.call();
        } finally {
            restore(previous);
        }
    }

    private static void restore(CorrelationContext previous) {
        if (previous == null) {
            clear();
        } else {
            set(previous);
        }
    }

    private static void mdc(String key, String value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }
}
