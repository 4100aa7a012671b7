package com.trendscope.observability;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that copies the current
 * {@link CorrelationContext} onto every span it starts.
 * <p>
 * Does not configure the SDK. The service obtains its tracer from {@code GlobalOpenTelemetry};
 * libraries and tests fall back to {@link #noop()}.
 */
public final class SpanHelper {

    public static final String ATTR_CORRELATION_ID = "correlation.id";
    public static final String ATTR_ORIGIN = "correlation.origin";

    private final Tracer tracer;

    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Returns a helper whose spans go nowhere.
     */
    public static SpanHelper noop() {
        return new SpanHelper(OpenTelemetry.noop().getTracer("trendscope"));
    }

    /**
     * Executes {@code callable} inside a new {@link SpanKind#INTERNAL} span.
     *
     * @throws Exception whatever the callable throws, after recording it on the span
     */
    public <T> T withSpan(String spanName, Callable<T> callable) throws Exception {
        return withSpan(spanName, SpanKind.INTERNAL, Map.of(), callable);
    }

    /**
     * Executes {@code callable} inside a new span with explicit kind and attributes. The span
     * status is OK on return and ERROR (with the exception recorded) on throw.
     */
    public <T> T withSpan(String spanName, SpanKind kind, Map<String, String> attributes,
                          Callable<T> callable) throws Exception {
        var spanBuilder = tracer.spanBuilder(spanName).setSpanKind(kind);
        attributes.forEach(spanBuilder::setAttribute);

        Span span = spanBuilder.startSpan();
        CorrelationContextHolder.get().ifPresent(ctx -> {
            span.setAttribute(ATTR_CORRELATION_ID, ctx.correlationId());
            span.setAttribute(ATTR_ORIGIN, ctx.origin());
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = callable.call();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (Exception e) {
            span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    public Tracer tracer() {
        return tracer;
    }
}
