package com.trendscope.observability;

import java.util.concurrent.CompletableFuture;

/**
 * A single health check.
 * <p>
 * Implementations either call a dependency or, as the trending source checks do, report the
 * outcome of the last real interaction with it. The result is asynchronous so that a
 * {@link HealthCheckRegistry} can run many checks concurrently under one timeout.
 */
@FunctionalInterface
public interface HealthCheck {

    CompletableFuture<ComponentHealth> check();
}
