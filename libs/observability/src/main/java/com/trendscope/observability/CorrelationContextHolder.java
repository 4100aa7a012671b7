package com.trendscope.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Thread-local holder for {@link CorrelationContext} with SLF4J MDC bridge.
 * <p>
 * Setting a context populates the MDC keys so that every log statement on this thread
 * includes them; clearing removes them. Work handed to another thread (the per-source
 * fan-out executor) does not inherit the context; capture it with {@link #get()} and
 * re-establish it with {@link #callWithContext(CorrelationContext, Supplier)}.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
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
        MDC.put(CorrelationContext.MDC_CORRELATION_ID, context.correlationId());
        MDC.put(CorrelationContext.MDC_ORIGIN, context.origin());
    }

    /**
     * Returns the current thread's correlation context, if set.
     */
    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Clears the correlation context and removes its MDC keys for the current thread.
     */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_ORIGIN);
    }

    /**
     * Runs {@code work} with {@code context} installed, then restores whatever was there before.
     * A null context runs the work unchanged.
     */
    public static <T> T callWithContext(CorrelationContext context, Supplier<T> work) {
        if (context == null) {
            return work.get();
        }
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            return work.get();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    /**
     * Void variant of {@link #callWithContext(CorrelationContext, Supplier)}.
     */
    public static void runWithContext(CorrelationContext context, Runnable work) {
        callWithContext(context, () -> {
            work.run();
            return null;
        });
    }
}
