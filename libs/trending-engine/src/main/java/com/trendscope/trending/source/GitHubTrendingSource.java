package com.trendscope.trending.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.trendscope.trending.model.TrendingItem;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Most-starred GitHub repositories from the repository search API, scored by stars.
 */
public final class GitHubTrendingSource implements TrendingSource {

    public static final String NAME = "github";
    public static final double WEIGHT = 1.2;

    static final String ENDPOINT = "https://api.github.com/search/repositories";
    private static final Map<String, String> HEADERS = Map.of("Accept", "application/vnd.github+json");

    private final JsonHttpFetcher fetcher;

    public GitHubTrendingSource(JsonHttpFetcher fetcher) {
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
        params.put("q", "stars:>1");
        params.put("sort", "stars");
        params.put("order", "desc");
        params.put("per_page", String.valueOf(limit));
        JsonNode root = fetcher.get(NAME, JsonHttpFetcher.uri(ENDPOINT, params), HEADERS);

        List<TrendingItem> items = new ArrayList<>();
        for (JsonNode repo : root.path("items")) {
            if (items.size() >= limit) {
                break;
            }
            String fullName = SourceJson.text(repo, "full_name");
            String htmlUrl = SourceJson.text(repo, "html_url");
            if (fullName == null || htmlUrl == null) {
                continue;
            }
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("description", SourceJson.text(repo, "description"));
            metadata.put("language", SourceJson.text(repo, "language"));
            metadata.put("stars", SourceJson.number(repo, "stargazers_count"));
            items.add(new TrendingItem(fullName, htmlUrl, NAME, SourceJson.score(repo, "stargazers_count"), metadata));
        }
        return items;
    }
}
