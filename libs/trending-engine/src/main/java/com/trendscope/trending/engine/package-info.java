/**
 * The aggregation engine: {@link com.trendscope.trending.engine.TrendingService} with its TTL
 * cache, per-source health records and background refresh loop.
 */
package com.trendscope.trending.engine;
