package com.healthwatch.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Thread-local holder for {@link CorrelationContext} with SLF4J MDC bridge.
 * <p>
 * Setting a context populates the {@code correlationId}, {@code component} and {@code hostName}
 * MDC keys; clearing it removes them. Callers that hand work to another thread must transfer
 * the context explicitly, e.g. with {@link #callWithContext(CorrelationContext, Supplier)}.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * Sets the correlation context for the current thread and populates SLF4J MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        setMdc(CorrelationContext.MDC_CORRELATION_ID, context.correlationId());
        setMdc(CorrelationContext.MDC_COMPONENT, context.component());
        setMdc(CorrelationContext.MDC_HOST_NAME, context.hostName());
    }

    /**
     * Returns the current thread's correlation context, if set.
     */
    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Returns the current correlation ID, if a context is set.
     */
    public static Optional<String> correlationId() {
        return get().map(CorrelationContext::correlationId);
    }

    /**
     * Clears the correlation context and removes its MDC keys for the current thread.
     */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_COMPONENT);
        MDC.remove(CorrelationContext.MDC_HOST_NAME);
    }

    /**
     * Sets the given context until the returned scope is closed, then restores the previous
     * context (or clears if there was none). Use with try-with-resources around work that throws
     * checked exceptions.
     */
    public static Scope open(CorrelationContext context) {
        CorrelationContext previous = CONTEXT.get();
        set(context);
        return new Scope(previous);
    }

    /**
     * Runs the supplier with the given context set, then restores the previous context
     * (or clears if there was none).
     *
     * @return the supplier's result
     */
    public static <T> T callWithContext(CorrelationContext context, Supplier<T> work) {
        try (Scope ignored = open(context)) {
            return work.get();
        }
    }

    /**
     * Restores the context that was current when {@link #open(CorrelationContext)} was called.
     */
    public static final class Scope implements AutoCloseable {

        private final CorrelationContext previous;

        private Scope(CorrelationContext previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
