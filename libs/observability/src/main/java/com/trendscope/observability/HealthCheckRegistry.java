package com.trendscope.observability;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Registry that runs its {@link HealthCheck}s concurrently and folds them into one
 * {@link HealthResult}.
 * <p>
 * Checks are kept in registration order, which is also the order of
 * {@link HealthResult#checks()}. A check that throws, fails its future, or exceeds the
 * timeout is reported as {@link HealthStatus#UNHEALTHY}.
 */
public final class HealthCheckRegistry {

    /** Default timeout for individual health checks (5 seconds). */
    public static final long DEFAULT_TIMEOUT_MS = 5000;

    private final Map<String, HealthCheck> checks = new LinkedHashMap<>();
    private final long timeoutMs;

    public HealthCheckRegistry() {
        this(DEFAULT_TIMEOUT_MS);
    }

    /**
     * @param timeoutMs timeout in milliseconds for each individual health check
     */
    public HealthCheckRegistry(long timeoutMs) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }
        this.timeoutMs = timeoutMs;
    }

    /**
     * Registers a check under {@code name}, replacing (in place) any check with the same name.
     */
    public synchronized void register(String name, HealthCheck check) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (check == null) {
            throw new IllegalArgumentException("check must not be null");
        }
        checks.put(name, check);
    }

    /**
     * Runs all registered checks concurrently and aggregates the results.
     */
    public HealthResult checkAll() {
        Map<String, HealthCheck> current;
        synchronized (this) {
            current = new LinkedHashMap<>(checks);
        }

        Map<String, CompletableFuture<ComponentHealth>> futures = new LinkedHashMap<>();
        current.forEach((name, check) -> futures.put(name, start(name, check)));

        Map<String, ComponentHealth> results = new LinkedHashMap<>();
        HealthStatus overall = HealthStatus.HEALTHY;
        for (Map.Entry<String, CompletableFuture<ComponentHealth>> entry : futures.entrySet()) {
            String name = entry.getKey();
            ComponentHealth result;
            try {
                result = entry.getValue().orTimeout(timeoutMs, TimeUnit.MILLISECONDS).join();
            } catch (Exception e) {
                result = ComponentHealth.unhealthy(name, "Timeout or error: " + e.getMessage(), timeoutMs);
            }
            results.put(name, result);
            overall = overall.worst(result.status());
        }
        return new HealthResult(overall, results, Instant.now());
    }

    public synchronized int size() {
        return checks.size();
    }

    private static CompletableFuture<ComponentHealth> start(String name, HealthCheck check) {
        try {
            CompletableFuture<ComponentHealth> future = check.check();
            return future != null
                    ? future
                    : CompletableFuture.failedFuture(new IllegalStateException(name + " returned no result"));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
