package com.trendscope.trendingservice.config;

import com.trendscope.trending.engine.TrendingSettings;
import com.trendscope.trending.source.GitHubTrendingSource;
import com.trendscope.trending.source.HackerNewsTrendingSource;
import com.trendscope.trending.source.RedditTrendingSource;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Trending engine configuration, bound from {@code trendscope.trending.*}.
 *
 * <pre>
 * trendscope:
 *   trending:
 *     default-limit: 10
 *     max-limit: 100
 *     refresh-seconds: 900
 *     sources: reddit,hackernews,github
 *     http-timeout-seconds: 10
 *     source-timeout-seconds: 15
 *     self-healing:
 *       enabled: true
 *       interval-ms: 300000
 * </pre>
 *
 * <p>Omitted or non-positive numbers fall back to the defaults above; the compact constructor runs
 * before Bean Validation.
 *
 * @param defaultLimit items returned when a request gives no limit
 * @param maxLimit largest limit a request may ask for
 * @param refreshSeconds cache TTL and background refresh period
 * @param sources source names in consultation order; unknown names are skipped at startup
 * @param httpTimeoutSeconds connect and request timeout of upstream HTTP calls
 * @param sourceTimeoutSeconds upper bound on one source fetch within a refresh
 * @param selfHealing self-healing monitor settings
 */
@ConfigurationProperties(prefix = "trendscope.trending")
@Validated
public record TrendingProperties(
        @Min(1) int defaultLimit,
        @Min(1) int maxLimit,
        @Min(1) int refreshSeconds,
        List<String> sources,
        @Min(1) int httpTimeoutSeconds,
        @Min(1) int sourceTimeoutSeconds,
        @Valid SelfHealing selfHealing) {

    public static final List<String> DEFAULT_SOURCES =
            List.of(
                    RedditTrendingSource.NAME,
                    HackerNewsTrendingSource.NAME,
                    GitHubTrendingSource.NAME);

    public TrendingProperties {
        if (defaultLimit <= 0) {
            defaultLimit = 10;
        }
        if (maxLimit <= 0) {
            maxLimit = 100;
        }
        if (refreshSeconds <= 0) {
            refreshSeconds = 900;
        }
        if (sources == null || sources.isEmpty()) {
            sources = DEFAULT_SOURCES;
        } else {
            sources = sources.stream().map(String::trim).filter(s -> !s.isEmpty()).toList();
        }
        if (httpTimeoutSeconds <= 0) {
            httpTimeoutSeconds = 10;
        }
        if (sourceTimeoutSeconds <= 0) {
            sourceTimeoutSeconds = 15;
        }
        if (selfHealing == null) {
            selfHealing = new SelfHealing(null, 0);
        }
        if (defaultLimit > maxLimit) {
            throw new IllegalArgumentException(
                    "default-limit (" + defaultLimit + ") must not exceed max-limit (" + maxLimit + ")");
        }
    }

    public TrendingSettings toSettings() {
        return new TrendingSettings(
                defaultLimit, refreshSeconds, Duration.ofSeconds(sourceTimeoutSeconds));
    }

    public Duration httpTimeout() {
        return Duration.ofSeconds(httpTimeoutSeconds);
    }

    /**
     * @param enabled whether the monitor bean is created at all (default true)
     * @param intervalMs delay between health cycles in milliseconds (default 300000)
     */
    public record SelfHealing(Boolean enabled, long intervalMs) {

        public SelfHealing {
            if (enabled == null) {
                enabled = Boolean.TRUE;
            }
            if (intervalMs <= 0) {
                intervalMs = 300_000;
            }
        }
    }
}
