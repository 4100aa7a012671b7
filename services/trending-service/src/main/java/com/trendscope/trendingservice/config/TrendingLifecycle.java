package com.trendscope.trendingservice.config;

import com.trendscope.observability.CorrelationContext;
import com.trendscope.observability.CorrelationContextHolder;
import com.trendscope.trending.engine.TrendingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Primes the trending cache and runs the background refresh loop for the lifetime of the
 * application context.
 *
 * <p>Start performs one forced refresh before the loop begins, so the first request after startup
 * is served from cache. Stop ends the loop, then closes the engine.
 */
@Component
public class TrendingLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(TrendingLifecycle.class);

    static final String PRIME_JOB = "cache-prime";

    private final TrendingService trendingService;
    private volatile boolean running;

    public TrendingLifecycle(TrendingService trendingService) {
        this.trendingService = trendingService;
    }

    @Override
    public void start() {
        log.info("Priming trending cache");
        CorrelationContextHolder.runWithContext(
                CorrelationContext.forJob(PRIME_JOB), () -> trendingService.fetchTrending(null, true));
        trendingService.registerBackgroundRefresh();
        running = true;
    }

    @Override
    public void stop() {
        log.info("Stopping trending refresh loop");
        trendingService.shutdown();
        trendingService.close();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
