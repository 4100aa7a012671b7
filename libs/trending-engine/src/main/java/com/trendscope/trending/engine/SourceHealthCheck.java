package com.trendscope.trending.engine;

import com.trendscope.observability.ComponentHealth;
import com.trendscope.observability.HealthCheck;
import com.trendscope.trending.model.SourceHealth;

import java.util.concurrent.CompletableFuture;

/**
 * Reports a source's last fetch outcome as a {@link HealthCheck}, without contacting the
 * source: {@code OK} is healthy, {@code UNKNOWN} degraded, {@code ERROR} unhealthy.
 */
public final class SourceHealthCheck implements HealthCheck {

    private final SourceHealthRegistry registry;
    private final String source;

    SourceHealthCheck(SourceHealthRegistry registry, String source) {
        this.registry = registry;
        this.source = source;
    }

    @Override
    public CompletableFuture<ComponentHealth> check() {
        SourceHealth health = registry.get(source).orElse(SourceHealth.unknown(source));
        ComponentHealth result = switch (health.status()) {
            case OK -> ComponentHealth.healthy(source, 0);
            case UNKNOWN -> ComponentHealth.degraded(source, "no fetch attempted yet", 0);
            case ERROR -> ComponentHealth.unhealthy(source, health.message(), 0);
        };
        return CompletableFuture.completedFuture(result);
    }

    public String source() {
        return source;
    }
}
