package com.trendscope.trending.engine;

import com.trendscope.trending.model.TrendingItem;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Weighting, deduplication and ranking of per-source results.
 */
final class TrendingMerger {

    private TrendingMerger() {
    }

    /**
     * Applies a source weight to every item and records the raw score in metadata.
     */
    static List<TrendingItem> weigh(List<TrendingItem> items, double weight) {
        List<TrendingItem> weighted = new ArrayList<>(items.size());
        for (TrendingItem item : items) {
            weighted.add(item.weighted(weight));
        }
        return weighted;
    }

    /**
     * Merges weighted per-source lists into one ranking.
     * <p>
     * Items sharing a URL (case-insensitive) collapse into the one with the highest weighted
     * score; on equal scores the first seen wins, where "first" follows the order of
     * {@code perSource} and then the order within each list. The result is sorted by score,
     * descending; the sort is stable so equal scores keep merge order.
     */
    static List<TrendingItem> merge(List<List<TrendingItem>> perSource) {
        Map<String, TrendingItem> byKey = new LinkedHashMap<>();
        for (List<TrendingItem> items : perSource) {
            for (TrendingItem item : items) {
                byKey.merge(item.dedupKey(), item,
                        (existing, candidate) -> candidate.score() > existing.score() ? candidate : existing);
            }
        }
        List<TrendingItem> ranked = new ArrayList<>(byKey.values());
        ranked.sort(Comparator.comparingDouble(TrendingItem::score).reversed());
        return ranked;
    }
}
