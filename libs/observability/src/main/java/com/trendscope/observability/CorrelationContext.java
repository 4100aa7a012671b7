package com.trendscope.observability;

import java.util.UUID;

/**
 * Immutable correlation context attached to one unit of work.
 * <p>
 * A unit of work is either an inbound HTTP request or one cycle of a background job
 * (the trending refresh loop, the self-healing monitor). The identifiers are pushed into
 * SLF4J MDC by {@link CorrelationContextHolder} so every log line of that unit carries them,
 * and {@link SpanHelper} copies them onto spans.
 *
 * @param correlationId unique ID for the unit of work (propagated from {@code X-Correlation-ID} for HTTP)
 * @param origin        what started the work, e.g. {@code http}, {@code refresh-loop}, {@code self-healing}
 */
public record CorrelationContext(String correlationId, String origin) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for the origin of the unit of work. */
    public static final String MDC_ORIGIN = "origin";

    public static final String ORIGIN_HTTP = "http";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
        if (origin == null || origin.isBlank()) {
            throw new IllegalArgumentException("origin must not be null or blank");
        }
    }

    /**
     * Creates a context for an inbound HTTP request.
     *
     * @param correlationId the propagated ID, or null/blank to generate one
     */
    public static CorrelationContext forHttp(String correlationId) {
        String id = (correlationId == null || correlationId.isBlank())
                ? UUID.randomUUID().toString()
                : correlationId;
        return new CorrelationContext(id, ORIGIN_HTTP);
    }

    /**
     * Creates a context for one cycle of a background job. The ID is prefixed with the job
     * name so cycles are easy to grep, e.g. {@code refresh-loop-3f2a...}.
     */
    public static CorrelationContext forJob(String jobName) {
        if (jobName == null || jobName.isBlank()) {
            throw new IllegalArgumentException("jobName must not be null or blank");
        }
        return new CorrelationContext(jobName + "-" + UUID.randomUUID(), jobName);
    }
}
