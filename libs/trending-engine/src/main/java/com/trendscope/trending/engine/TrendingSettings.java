package com.trendscope.trending.engine;

import java.time.Duration;

/**
 * Tuning knobs of a {@link TrendingService}.
 *
 * @param defaultLimit           page size when callers give none; also the minimum fetched per refresh
 * @param refreshIntervalSeconds cache TTL and the period of the background refresh loop
 * @param sourceTimeout          upper bound on a single source fetch within a refresh
 */
public record TrendingSettings(int defaultLimit, int refreshIntervalSeconds, Duration sourceTimeout) {

    public static final Duration DEFAULT_SOURCE_TIMEOUT = Duration.ofSeconds(15);

    public TrendingSettings {
        if (defaultLimit < 1) {
            throw new IllegalArgumentException("defaultLimit must be positive");
        }
        if (refreshIntervalSeconds < 1) {
            throw new IllegalArgumentException("refreshIntervalSeconds must be positive");
        }
        if (sourceTimeout == null) {
            sourceTimeout = DEFAULT_SOURCE_TIMEOUT;
        }
        if (sourceTimeout.isZero() || sourceTimeout.isNegative()) {
            throw new IllegalArgumentException("sourceTimeout must be positive");
        }
    }

    public TrendingSettings(int defaultLimit, int refreshIntervalSeconds) {
        this(defaultLimit, refreshIntervalSeconds, DEFAULT_SOURCE_TIMEOUT);
    }

    public Duration refreshInterval() {
        return Duration.ofSeconds(refreshIntervalSeconds);
    }
}
