package com.trendscope.trending.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.trendscope.trending.model.TrendingItem;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hacker News front page via the Algolia search API, scored by points.
 */
public final class HackerNewsTrendingSource implements TrendingSource {

    public static final String NAME = "hackernews";
    public static final double WEIGHT = 1.0;

    static final String ENDPOINT = "https://hn.algolia.com/api/v1/search";

    private final JsonHttpFetcher fetcher;

    public HackerNewsTrendingSource(JsonHttpFetcher fetcher) {
        this.fetcher = fetcher;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public double weight() {
        return WEIGHT;
    }

    @Override
    public List<TrendingItem> fetch(int limit) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("tags", "front_page");
        params.put("hitsPerPage", String.valueOf(limit));
        JsonNode root = fetcher.get(NAME, JsonHttpFetcher.uri(ENDPOINT, params), Map.of());

        List<TrendingItem> items = new ArrayList<>();
        for (JsonNode hit : root.path("hits")) {
            if (items.size() >= limit) {
                break;
            }
            // Comment hits carry the story fields instead of their own.
            String title = SourceJson.firstText(hit, "title", "story_title");
            String url = SourceJson.firstText(hit, "url", "story_url");
            if (title == null || url == null) {
                continue;
            }
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("author", SourceJson.text(hit, "author"));
            metadata.put("comments", SourceJson.number(hit, "num_comments"));
            items.add(new TrendingItem(title, url, NAME, SourceJson.score(hit, "points"), metadata));
        }
        return items;
    }
}
