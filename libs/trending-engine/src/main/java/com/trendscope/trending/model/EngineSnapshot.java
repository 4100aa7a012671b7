package com.trendscope.trending.model;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of the aggregation engine for status endpoints.
 *
 * @param defaultLimit           page size used when callers give no limit
 * @param refreshIntervalSeconds cache TTL and background refresh period
 * @param lastRefreshAt          completion time of the latest refresh, null before the first
 * @param sources                health of every configured source, in configuration order
 * @param cachedLimits           limits whose entries were unexpired at the last store, ascending
 */
public record EngineSnapshot(
        int defaultLimit,
        long refreshIntervalSeconds,
        Instant lastRefreshAt,
        List<SourceHealth> sources,
        List<Integer> cachedLimits
) {

    public EngineSnapshot {
        sources = List.copyOf(sources);
        cachedLimits = List.copyOf(cachedLimits);
    }
}
