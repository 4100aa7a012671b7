package com.trendscope.trendingservice.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trendscope.observability.HealthCheckRegistry;
import com.trendscope.observability.MetricFactory;
import com.trendscope.observability.SpanHelper;
import com.trendscope.trending.engine.TrendingService;
import com.trendscope.trending.source.JsonHttpFetcher;
import com.trendscope.trending.source.SourceCatalog;
import com.trendscope.trending.source.TrendingSource;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the trending engine and its observability collaborators.
 *
 * <p>The source catalog holds the built-in adapters plus every {@link TrendingSource} bean in the
 * context, so an extra source only needs a bean and an entry in {@code trendscope.trending.sources}.
 */
@Configuration
public class TrendingEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(TrendingEngineConfig.class);

    @Bean
    public JsonHttpFetcher jsonHttpFetcher(TrendingProperties properties, ObjectMapper objectMapper) {
        return new JsonHttpFetcher(properties.httpTimeout(), objectMapper);
    }

    @Bean
    public SourceCatalog sourceCatalog(
            JsonHttpFetcher fetcher, ObjectProvider<TrendingSource> additionalSources) {
        SourceCatalog catalog = SourceCatalog.defaults(fetcher);
        additionalSources.orderedStream().forEach(source -> catalog.register(source.name(), () -> source));
        return catalog;
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry meterRegistry, ServiceProperties service) {
        return new MetricFactory(meterRegistry, service.name());
    }

    @Bean
    public SpanHelper spanHelper(ServiceProperties service) {
        return new SpanHelper(GlobalOpenTelemetry.getTracer(service.name()));
    }

    @Bean(destroyMethod = "close")
    public TrendingService trendingService(
            SourceCatalog catalog,
            TrendingProperties properties,
            MetricFactory metrics,
            SpanHelper spans) {
        List<TrendingSource> sources = catalog.resolve(properties.sources());
        if (sources.isEmpty()) {
            log.warn("No trending sources configured; every request will return an empty ranking");
        }
        log.info(
                "Trending sources: {} (default-limit={}, refresh={}s)",
                sources.stream().map(TrendingSource::name).toList(),
                properties.defaultLimit(),
                properties.refreshSeconds());
        return new TrendingService(sources, properties.toSettings(), metrics, spans, Clock.systemUTC());
    }

    @Bean
    public HealthCheckRegistry sourceHealthChecks(TrendingService trendingService) {
        HealthCheckRegistry registry = new HealthCheckRegistry();
        trendingService.registerHealthChecks(registry);
        log.info("Registered {} source health checks", registry.size());
        return registry;
    }
}
