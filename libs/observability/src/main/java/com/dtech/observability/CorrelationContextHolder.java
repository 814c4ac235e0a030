package com.dtech.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Thread-local holder for {@link CorrelationContext} that keeps the SLF4J MDC in step.
 * <p>
 * Servlet filters call {@link #set} on entry and {@link #clear} in a {@code finally} block;
 * work handed to another thread must go through {@link #runWithContext}.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // utility class
    }

    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        putMdc(CorrelationContext.MDC_CORRELATION_ID, context.correlationId());
        putMdc(CorrelationContext.MDC_REQUEST_ID, context.requestId());
        putMdc(CorrelationContext.MDC_TENANT_ID, context.tenantId());
        putMdc(CorrelationContext.MDC_USER_ID, context.userId());
    }

    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Replaces the current context with {@code change} applied to it. No-op when nothing is set.
     */
    public static void update(UnaryOperator<CorrelationContext> change) {
        CorrelationContext current = CONTEXT.get();
        if (current != null) {
            set(change.apply(current));
        }
    }

    public static void clear() {
        CONTEXT.remove();
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_REQUEST_ID);
        MDC.remove(CorrelationContext.MDC_TENANT_ID);
        MDC.remove(CorrelationContext.MDC_USER_ID);
    }

    /**
     * Runs {@code runnable} under {@code context}, then restores whatever was set before.
     */
    public static void runWithContext(CorrelationContext context, Runnable runnable) {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            runnable.run();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    private static void putMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
