package com.trendscope.observability;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate health result from all registered checks.
 *
 * @param status    worst status among the components, HEALTHY when there are none
 * @param checks    component results keyed by name, in registration order
 * @param timestamp when the checks completed
 */
public record HealthResult(HealthStatus status, Map<String, ComponentHealth> checks, Instant timestamp) {

    public HealthResult {
        checks = Collections.unmodifiableMap(new LinkedHashMap<>(checks));
    }

    /**
     * Returns true when every component reports {@code status}. False for an empty result.
     */
    public boolean allMatch(HealthStatus status) {
        return !checks.isEmpty() && checks.values().stream().allMatch(h -> h.status() == status);
    }
}
