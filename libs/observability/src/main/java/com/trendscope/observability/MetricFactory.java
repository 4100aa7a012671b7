package com.trendscope.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Factory for Micrometer meters that all carry a {@code service} tag.
 * <p>
 * Meters are looked up by name and tags on every call, so callers may ask for the same
 * counter repeatedly (e.g. once per source fetch) without keeping references around.
 * Gauges are backed by an {@link AtomicLong} that is created once per name/tag combination.
 */
public final class MetricFactory {

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;
    private final String serviceName;
    private final Map<String, AtomicLong> gauges = new ConcurrentHashMap<>();

    /**
     * @param registry    the Micrometer meter registry (Prometheus in the service, simple in tests)
     * @param serviceName logical service name included as a tag on every meter
     */
    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * Creates a factory over a private {@link SimpleMeterRegistry}, for callers that have no
     * registry of their own.
     */
    public static MetricFactory standalone(String serviceName) {
        return new MetricFactory(new SimpleMeterRegistry(), serviceName);
    }

    /**
     * Returns (registering on first use) a counter.
     *
     * @param tags additional tags as alternating key/value strings
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Returns (registering on first use) a timer.
     *
     * @param tags additional tags as alternating key/value strings
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Returns the value holder behind a gauge, registering the gauge on first use. Repeated
     * calls with the same name and tags return the same holder.
     */
    public AtomicLong gauge(String name, String description, String... tags) {
        Tags allTags = baseTags(tags);
        return gauges.computeIfAbsent(name + allTags, key -> {
            AtomicLong value = new AtomicLong();
            Gauge.builder(name, value, AtomicLong::doubleValue)
                    .description(description)
                    .tags(allTags)
                    .register(registry);
            return value;
        });
    }

    private Tags baseTags(String... extraTags) {
        if (extraTags.length % 2 != 0) {
            throw new IllegalArgumentException("tags must be key/value pairs");
        }
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
