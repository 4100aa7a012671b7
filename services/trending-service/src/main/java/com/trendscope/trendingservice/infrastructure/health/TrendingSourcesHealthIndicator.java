package com.trendscope.trendingservice.infrastructure.health;

import com.trendscope.observability.ComponentHealth;
import com.trendscope.observability.HealthCheckRegistry;
import com.trendscope.observability.HealthResult;
import com.trendscope.observability.HealthStatus;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator component {@code trendingSources}: the last fetch outcome of every source.
 *
 * <p>The aggregation keeps serving while any source works, so the component is {@code DOWN} only
 * when every source is unhealthy. With no sources configured it is {@code UP}.
 */
@Component
public class TrendingSourcesHealthIndicator implements HealthIndicator {

    private final HealthCheckRegistry sourceHealthChecks;

    public TrendingSourcesHealthIndicator(HealthCheckRegistry sourceHealthChecks) {
        this.sourceHealthChecks = sourceHealthChecks;
    }

    @Override
    public Health health() {
        HealthResult result = sourceHealthChecks.checkAll();
        Health.Builder builder =
                result.allMatch(HealthStatus.UNHEALTHY) ? Health.down() : Health.up();
        builder.withDetail("aggregate", result.status().name());
        result.checks().forEach((name, component) -> builder.withDetail(name, describe(component)));
        return builder.build();
    }

    private static Map<String, Object> describe(ComponentHealth component) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("status", component.status().name());
        if (component.message() != null) {
            detail.put("message", component.message());
        }
        return detail;
    }
}
