package com.trendscope.trendingservice.infrastructure.healing;

import com.trendscope.observability.ComponentHealth;
import com.trendscope.observability.CorrelationContext;
import com.trendscope.observability.CorrelationContextHolder;
import com.trendscope.observability.HealthCheckRegistry;
import com.trendscope.observability.HealthResult;
import com.trendscope.observability.HealthStatus;
import com.trendscope.trending.engine.TrendingService;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic diagnose-and-heal cycle for the trending sources.
 *
 * <p>Each cycle reads the per-source health checks. When any source is not healthy, the remedy is
 * a forced refresh, which retries every source and rewrites the cache; the cycle then reports
 * {@code healing}. Disabled with {@code trendscope.trending.self-healing.enabled=false}.
 */
@Component
@ConditionalOnProperty(
        name = "trendscope.trending.self-healing.enabled",
        havingValue = "true",
        matchIfMissing = true)
public class SelfHealingMonitor {

    private static final Logger log = LoggerFactory.getLogger(SelfHealingMonitor.class);

    static final String COMPONENT = "trending-sources";
    static final String JOB_NAME = "self-healing";

    private final TrendingService trendingService;
    private final HealthCheckRegistry sourceHealthChecks;

    public SelfHealingMonitor(
            TrendingService trendingService, HealthCheckRegistry sourceHealthChecks) {
        this.trendingService = trendingService;
        this.sourceHealthChecks = sourceHealthChecks;
    }

    @Scheduled(
            initialDelayString = "${trendscope.trending.self-healing.interval-ms:300000}",
            fixedDelayString = "${trendscope.trending.self-healing.interval-ms:300000}")
    public void scheduledCycle() {
        CorrelationContextHolder.runWithContext(CorrelationContext.forJob(JOB_NAME), this::runHealthCycle);
    }

    /**
     * Runs one diagnose-and-heal cycle.
     */
    public MonitorResult runHealthCycle() {
        Map<String, String> diagnostics = diagnose();
        if (MonitorResult.HEALTHY.equals(diagnostics.get("status"))) {
            log.debug("Self-healing check: all trending sources healthy");
            return new MonitorResult(COMPONENT, MonitorResult.HEALTHY, diagnostics);
        }

        log.warn("Self-healing: {}; forcing a trending refresh", diagnostics.get("reason"));
        try {
            trendingService.fetchTrending(null, true);
        } catch (RuntimeException e) {
            log.error("Self-healing refresh failed", e);
            return new MonitorResult(COMPONENT, MonitorResult.FAILED, diagnostics);
        }
        return new MonitorResult(COMPONENT, MonitorResult.HEALING, diagnostics);
    }

    private Map<String, String> diagnose() {
        HealthResult result = sourceHealthChecks.checkAll();
        Map<String, String> diagnostics = new LinkedHashMap<>();
        result.checks().forEach((name, health) -> diagnostics.put(name, health.status().name()));

        List<String> notHealthy =
                result.checks().values().stream()
                        .filter(health -> health.status() != HealthStatus.HEALTHY)
                        .map(ComponentHealth::name)
                        .toList();
        if (notHealthy.isEmpty()) {
            diagnostics.put("status", MonitorResult.HEALTHY);
        } else {
            diagnostics.put("status", "unhealthy");
            diagnostics.put("reason", "sources not healthy: " + String.join(", ", notHealthy));
        }
        return diagnostics;
    }
}
