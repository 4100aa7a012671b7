package com.trendscope.trending.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.trendscope.trending.model.TrendingItem;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Posts from Reddit's {@code r/popular} listing, scored by upvotes.
 */
public final class RedditTrendingSource implements TrendingSource {

    public static final String NAME = "reddit";
    public static final double WEIGHT = 1.1;

    static final String ENDPOINT = "https://www.reddit.com/r/popular.json";
    private static final String SITE = "https://www.reddit.com";

    private final JsonHttpFetcher fetcher;

    public RedditTrendingSource(JsonHttpFetcher fetcher) {
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
        JsonNode root = fetcher.get(NAME,
                JsonHttpFetcher.uri(ENDPOINT, Map.of("limit", String.valueOf(limit))),
                Map.of());

        List<TrendingItem> items = new ArrayList<>();
        for (JsonNode child : root.path("data").path("children")) {
            if (items.size() >= limit) {
                break;
            }
            JsonNode post = child.path("data");
            String title = SourceJson.text(post, "title");
            String permalink = SourceJson.text(post, "permalink");
            if (title == null || permalink == null) {
                continue;
            }
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("subreddit", SourceJson.text(post, "subreddit"));
            metadata.put("comments", SourceJson.number(post, "num_comments"));
            items.add(new TrendingItem(title, SITE + permalink, NAME, SourceJson.score(post, "score"), metadata));
        }
        return items;
    }
}
