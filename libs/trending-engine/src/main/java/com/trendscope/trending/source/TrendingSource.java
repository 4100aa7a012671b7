package com.trendscope.trending.source;

import com.trendscope.trending.model.TrendingItem;

import java.util.List;

/**
 * Adapter that fetches one page of trending artefacts from an upstream provider.
 * <p>
 * {@link #name()} is the stable identity used for health tracking and as the configured
 * source name; {@link #weight()} is a positive multiplier the engine applies to this
 * source's scores so that providers with different native scales (stars, points, upvotes)
 * can be ranked together.
 * <p>
 * Implementations drop entries that lack a title or URL rather than failing.
 */
public interface TrendingSource {

    String name();

    double weight();

    /**
     * Fetches at most {@code limit} items.
     *
     * @param limit positive upper bound on the number of items returned
     * @return items in provider order, possibly fewer than {@code limit}
     * @throws SourceFetchException on transport failure, non-success status or malformed payload
     */
    List<TrendingItem> fetch(int limit);
}
