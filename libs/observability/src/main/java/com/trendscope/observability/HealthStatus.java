package com.trendscope.observability;

/**
 * Health status for an individual component or the aggregate.
 */
public enum HealthStatus {

    /** Component answered normally on its last attempt. */
    HEALTHY,

    /** Component has not been exercised yet, or works with reduced quality. */
    DEGRADED,

    /** Component failed on its last attempt. */
    UNHEALTHY;

    /**
     * Returns the worse of this status and {@code other}.
     */
    public HealthStatus worst(HealthStatus other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
