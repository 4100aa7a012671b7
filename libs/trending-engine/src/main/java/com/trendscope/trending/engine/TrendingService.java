package com.trendscope.trending.engine;

import com.trendscope.observability.CorrelationContext;
import com.trendscope.observability.CorrelationContextHolder;
import com.trendscope.observability.HealthCheckRegistry;
import com.trendscope.observability.MetricFactory;
import com.trendscope.observability.SpanHelper;
import com.trendscope.trending.model.EngineSnapshot;
import com.trendscope.trending.model.SourceHealth;
import com.trendscope.trending.model.TrendingItem;
import com.trendscope.trending.source.SourceFetchException;
import com.trendscope.trending.source.TrendingSource;
import io.opentelemetry.api.trace.SpanKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Aggregates trending items from all configured sources behind a limit-keyed TTL cache.
 * <p>
 * A refresh fetches from every source concurrently, weights each source's scores, merges
 * duplicates by URL and ranks by weighted score. A failing or slow source contributes nothing
 * and is marked as failed in the health records; it never fails the refresh. Concurrent
 * callers that miss the cache may refresh in parallel; the last one to finish wins the cache
 * slot.
 * <p>
 * One instance is shared by request handlers and the background refresh loop started with
 * {@link #registerBackgroundRefresh()}. Call {@link #close()} when done.
 */
public final class TrendingService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TrendingService.class);

    static final String SPAN_SOURCE_FETCH = "trending.source.fetch";

    private final List<TrendingSource> sources;
    private final TrendingSettings settings;
    private final TrendingCache cache;
    private final SourceHealthRegistry health;
    private final RefreshScheduler scheduler;
    private final ExecutorService fanOut;
    private final MetricFactory metrics;
    private final SpanHelper spans;
    private final AtomicLong mergedItems;
    private final AtomicBoolean closed = new AtomicBoolean();

    public TrendingService(List<? extends TrendingSource> sources, TrendingSettings settings) {
        this(sources, settings, MetricFactory.standalone("trending-engine"), SpanHelper.noop(), Clock.systemUTC());
    }

    public TrendingService(List<? extends TrendingSource> sources, TrendingSettings settings,
                           MetricFactory metrics, SpanHelper spans, Clock clock) {
        if (sources == null) {
            throw new IllegalArgumentException("sources must not be null");
        }
        if (settings == null || metrics == null || spans == null || clock == null) {
            throw new IllegalArgumentException("settings, metrics, spans and clock are required");
        }
        this.sources = List.copyOf(sources);
        this.settings = settings;
        this.metrics = metrics;
        this.spans = spans;

        List<String> names = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (TrendingSource source : this.sources) {
            if (!seen.add(source.name())) {
                throw new IllegalArgumentException("duplicate source name: " + source.name());
            }
            if (!(source.weight() > 0)) {
                throw new IllegalArgumentException("weight of " + source.name() + " must be positive");
            }
            names.add(source.name());
        }

        this.cache = new TrendingCache(clock, settings.refreshInterval());
        this.health = new SourceHealthRegistry(names, clock);
        this.scheduler = new RefreshScheduler(() -> fetchTrending(null, true), settings.refreshInterval());
        this.fanOut = Executors.newCachedThreadPool(fanOutThreads());
        this.mergedItems = metrics.gauge("trending.items.merged", "Items in the latest merged ranking");
    }

    /**
     * Returns the top {@link TrendingSettings#defaultLimit()} items.
     */
    public List<TrendingItem> fetchTrending() {
        return fetchTrending(null, false);
    }

    public List<TrendingItem> fetchTrending(int limit) {
        return fetchTrending(limit, false);
    }

    /**
     * Returns at most {@code limit} items, ranked by weighted score.
     * <p>
     * Served from cache when an unexpired entry exists for exactly {@code limit} and
     * {@code forceRefresh} is false; otherwise refreshes from all sources first. Upstream
     * failures never propagate: with every source down the result is empty.
     *
     * @param limit        number of items wanted, or null for the default limit
     * @param forceRefresh bypass the cache
     * @throws IllegalArgumentException if {@code limit} is less than 1
     * @throws IllegalStateException    if the service has been closed
     */
    public List<TrendingItem> fetchTrending(Integer limit, boolean forceRefresh) {
        int requested = limit == null ? settings.defaultLimit() : limit;
        if (requested < 1) {
            throw new IllegalArgumentException("limit must be positive, got " + requested);
        }
        if (closed.get()) {
            throw new IllegalStateException("trending service is closed");
        }

        if (!forceRefresh) {
            Optional<List<TrendingItem>> cached = cache.lookup(requested);
            if (cached.isPresent()) {
                metrics.counter("trending.cache.requests", "Trending cache lookups", "result", "hit").increment();
                log.debug("Serving trending limit={} from cache", requested);
                return top(cached.get(), requested);
            }
            metrics.counter("trending.cache.requests", "Trending cache lookups", "result", "miss").increment();
        }
        return top(refresh(requested), requested);
    }

    /**
     * Health of every configured source, in configuration order.
     */
    public List<SourceHealth> getSourceHealth() {
        return health.snapshot();
    }

    /**
     * Diagnostic view of the engine. The cached limits are those whose entries were unexpired
     * when the cache last stored; expired entries are dropped on every store.
     */
    public EngineSnapshot snapshot() {
        return new EngineSnapshot(
                settings.defaultLimit(),
                settings.refreshIntervalSeconds(),
                cache.lastStoredAt().orElse(null),
                health.snapshot(),
                cache.keys());
    }

    /**
     * Registers one {@link SourceHealthCheck} per source, named after the source.
     */
    public void registerHealthChecks(HealthCheckRegistry registry) {
        for (TrendingSource source : sources) {
            registry.register(source.name(), new SourceHealthCheck(health, source.name()));
        }
    }

    /**
     * Starts the background refresh loop. No-op if it is already running.
     */
    public void registerBackgroundRefresh() {
        if (closed.get()) {
            throw new IllegalStateException("trending service is closed");
        }
        if (!scheduler.start()) {
            log.debug("Trending refresh loop already running");
        }
    }

    /**
     * Stops the background refresh loop and waits for it to exit. An in-flight refresh
     * completes first. The loop can be started again afterwards.
     */
    public void shutdown() {
        scheduler.stop();
    }

    public boolean isBackgroundRefreshRunning() {
        return scheduler.isRunning();
    }

    public TrendingSettings settings() {
        return settings;
    }

    public List<String> sourceNames() {
        return sources.stream().map(TrendingSource::name).toList();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        shutdown();
        fanOut.shutdown();
        try {
            if (!fanOut.awaitTermination(settings.sourceTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                fanOut.shutdownNow();
            }
        } catch (InterruptedException e) {
            fanOut.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private List<TrendingItem> refresh(int requested) {
        int fetchLimit = Math.max(requested, settings.defaultLimit());
        log.debug("Refreshing trending cache for limit={}", fetchLimit);
        long started = System.nanoTime();

        CorrelationContext context = CorrelationContextHolder.get().orElse(null);
        List<CompletableFuture<List<TrendingItem>>> pending = new ArrayList<>(sources.size());
        for (TrendingSource source : sources) {
            pending.add(fetchSource(source, fetchLimit, context));
        }
        List<List<TrendingItem>> results = new ArrayList<>(pending.size());
        for (CompletableFuture<List<TrendingItem>> future : pending) {
            results.add(future.join());
        }

        List<TrendingItem> merged = TrendingMerger.merge(results);
        cache.store(merged, fetchLimit, requested);
        mergedItems.set(merged.size());
        metrics.timer("trending.refresh", "Full refresh across all sources")
                .record(System.nanoTime() - started, TimeUnit.NANOSECONDS);
        log.info("Refreshed trending cache: {} items from {} sources (limit={})",
                merged.size(), sources.size(), fetchLimit);
        return merged;
    }

    private CompletableFuture<List<TrendingItem>> fetchSource(TrendingSource source, int limit,
                                                              CorrelationContext context) {
        long started = System.nanoTime();
        return CompletableFuture
                .supplyAsync(() -> CorrelationContextHolder.callWithContext(context, () -> invoke(source, limit)), fanOut)
                .orTimeout(settings.sourceTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .handle((items, error) -> {
                    metrics.timer("trending.source.latency", "Latency of one source fetch", "source", source.name())
                            .record(System.nanoTime() - started, TimeUnit.NANOSECONDS);
                    if (error == null) {
                        health.recordSuccess(source.name());
                        countFetch(source, "success");
                        return items;
                    }
                    String message = source.name() + " fetch failed: " + describe(error);
                    log.warn(message);
                    health.recordFailure(source.name(), message);
                    countFetch(source, "failure");
                    return List.of();
                });
    }

    private List<TrendingItem> invoke(TrendingSource source, int limit) {
        List<TrendingItem> items;
        try {
            items = spans.withSpan(SPAN_SOURCE_FETCH, SpanKind.CLIENT,
                    Map.of("trending.source", source.name(), "trending.limit", String.valueOf(limit)),
                    () -> source.fetch(limit));
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new SourceFetchException(source.name(), e.getMessage(), e);
        }
        if (items == null) {
            throw new SourceFetchException(source.name(), "adapter returned no item list");
        }
        return TrendingMerger.weigh(items, source.weight());
    }

    private void countFetch(TrendingSource source, String outcome) {
        metrics.counter("trending.source.fetch", "Source fetch attempts",
                "source", source.name(), "outcome", outcome).increment();
    }

    private String describe(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof TimeoutException) {
            return "timed out after " + settings.sourceTimeout().toMillis() + "ms";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static List<TrendingItem> top(List<TrendingItem> ranked, int limit) {
        return ranked.size() <= limit ? ranked : List.copyOf(ranked.subList(0, limit));
    }

    private static ThreadFactory fanOutThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "trending-fetch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
