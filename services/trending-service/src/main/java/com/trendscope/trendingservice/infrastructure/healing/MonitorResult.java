package com.trendscope.trendingservice.infrastructure.healing;

import java.util.Map;

/**
 * Outcome of one self-healing cycle.
 *
 * @param component monitored component
 * @param status {@code healthy} when nothing needed fixing, {@code healing} when a remedy ran,
 *     {@code failed} when the remedy itself threw
 * @param details diagnostics gathered before healing, one entry per source plus {@code status}
 *     and {@code reason}
 */
public record MonitorResult(String component, String status, Map<String, String> details) {

    public static final String HEALTHY = "healthy";
    public static final String HEALING = "healing";
    public static final String FAILED = "failed";

    public MonitorResult {
        details = Map.copyOf(details);
    }
}
