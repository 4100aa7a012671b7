package com.trendscope.trending.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * Maps configured source names to adapter factories.
 * <p>
 * Configuration lists sources by name, in the order they should be consulted. Names without
 * a registered factory are skipped with a warning so a typo disables one source instead of
 * the whole service.
 */
public final class SourceCatalog {

    private static final Logger log = LoggerFactory.getLogger(SourceCatalog.class);

    private final Map<String, Supplier<? extends TrendingSource>> factories = new LinkedHashMap<>();

    /**
     * Catalog of the built-in adapters, all sharing {@code fetcher}.
     */
    public static SourceCatalog defaults(JsonHttpFetcher fetcher) {
        return new SourceCatalog()
                .register(RedditTrendingSource.NAME, () -> new RedditTrendingSource(fetcher))
                .register(HackerNewsTrendingSource.NAME, () -> new HackerNewsTrendingSource(fetcher))
                .register(GitHubTrendingSource.NAME, () -> new GitHubTrendingSource(fetcher));
    }

    public SourceCatalog register(String name, Supplier<? extends TrendingSource> factory) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory must not be null");
        }
        factories.put(name, factory);
        return this;
    }

    public Set<String> names() {
        return Set.copyOf(factories.keySet());
    }

    /**
     * Instantiates the adapters for {@code names}, keeping their order. Unknown names are
     * logged and skipped; repeated names are used once.
     */
    public List<TrendingSource> resolve(List<String> names) {
        Set<String> missing = new TreeSet<>();
        List<TrendingSource> sources = new ArrayList<>();
        for (String name : new LinkedHashSet<>(names)) {
            if (name == null || name.isBlank()) {
                continue;
            }
            Supplier<? extends TrendingSource> factory = factories.get(name);
            if (factory == null) {
                missing.add(name);
                continue;
            }
            TrendingSource source = factory.get();
            if (!name.equals(source.name())) {
                throw new IllegalStateException("factory for '" + name + "' built source '" + source.name() + "'");
            }
            sources.add(source);
        }
        if (!missing.isEmpty()) {
            log.warn("Unknown trending sources skipped: {}", String.join(", ", missing));
        }
        return sources;
    }
}
