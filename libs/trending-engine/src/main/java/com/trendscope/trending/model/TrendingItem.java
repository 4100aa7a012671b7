package com.trendscope.trending.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Normalized representation of a single trending artefact.
 * <p>
 * {@code score} is on the provider's native scale as produced by an adapter, and on the
 * weighted scale once the engine has applied the source weight (see {@link #weighted(double)}).
 * {@code metadata} is unmodifiable and may contain null values (a repository without a
 * description, for example).
 *
 * @param title    display title, never blank
 * @param url      canonical link; compared case-insensitively when merging
 * @param source   name of the provider that produced the item
 * @param score    ranking score
 * @param metadata provider-specific extras
 */
public record TrendingItem(String title, String url, String source, double score, Map<String, Object> metadata) {

    /** Metadata key holding the pre-weight score of a weighted item. */
    public static final String RAW_SCORE = "raw_score";

    public TrendingItem {
        requireText(title, "title");
        requireText(url, "url");
        requireText(source, "source");
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public TrendingItem(String title, String url, String source, double score) {
        this(title, url, source, score, Map.of());
    }

    /**
     * Key used to detect the same artefact reported by several sources.
     */
    public String dedupKey() {
        return url.toLowerCase(Locale.ROOT);
    }

    /**
     * Returns a copy whose score is multiplied by {@code weight}, with the original score kept
     * under {@link #RAW_SCORE}.
     */
    public TrendingItem weighted(double weight) {
        Map<String, Object> annotated = new LinkedHashMap<>(metadata);
        annotated.put(RAW_SCORE, score);
        return new TrendingItem(title, url, source, score * weight, annotated);
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be null or blank");
        }
    }
}
