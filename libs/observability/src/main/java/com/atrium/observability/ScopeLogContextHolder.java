package com.atrium.observability;

import java.util.Optional;
import org.slf4j.MDC;

/**
 * Thread-local holder for {@link ScopeLogContext} with an SLF4J MDC bridge.
 *
 * <p>Stores are confined to one scheduler thread, so setting the context on that thread tags every
 * store log line with the active scope. Work handed to another thread must carry the context over
 * with {@link #runWithContext(ScopeLogContext, Runnable)}.
 */
public final class ScopeLogContextHolder {

    private static final ThreadLocal<ScopeLogContext> CONTEXT = new ThreadLocal<>();

    private ScopeLogContextHolder() {
        // utility class
    }

    /**
     * Sets the scope context for the current thread and populates MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(ScopeLogContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    public static Optional<ScopeLogContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /** Removes the context and every scope MDC key from the current thread. */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(ScopeLogContext.MDC_CORRELATION_ID);
        MDC.remove(ScopeLogContext.MDC_PRINCIPAL_ID);
        MDC.remove(ScopeLogContext.MDC_SCOPE_TYPE);
        MDC.remove(ScopeLogContext.MDC_SCOPE_ID);
        MDC.remove(ScopeLogContext.MDC_WORKSPACE_ID);
    }

    /**
     * Runs the task with the given context, then restores whatever was set before (or clears).
     */
    public static void runWithContext(ScopeLogContext context, Runnable runnable) {
        ScopeLogContext previous = CONTEXT.get();
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

    private static void populateMdc(ScopeLogContext ctx) {
        setMdc(ScopeLogContext.MDC_CORRELATION_ID, ctx.correlationId());
        setMdc(ScopeLogContext.MDC_PRINCIPAL_ID, ctx.principalId());
        setMdc(ScopeLogContext.MDC_SCOPE_TYPE, ctx.scopeType());
        setMdc(ScopeLogContext.MDC_SCOPE_ID, ctx.scopeId());
        setMdc(ScopeLogContext.MDC_WORKSPACE_ID, ctx.workspaceId());
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
