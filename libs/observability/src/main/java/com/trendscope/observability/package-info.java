/**
 * Cross-cutting observability helpers shared by the TrendScope modules.
 *
 * <ul>
 *   <li>{@link com.trendscope.observability.CorrelationContextHolder}: correlation ID in SLF4J MDC
 *   <li>{@link com.trendscope.observability.MetricFactory}: Micrometer meters with a service tag
 *   <li>{@link com.trendscope.observability.SpanHelper}: OpenTelemetry spans carrying the correlation ID
 *   <li>{@link com.trendscope.observability.HealthCheckRegistry}: concurrent health check aggregation
 * </ul>
 */
package com.trendscope.observability;
