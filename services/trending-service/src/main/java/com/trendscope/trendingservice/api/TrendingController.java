package com.trendscope.trendingservice.api;

import com.trendscope.trending.engine.TrendingService;
import com.trendscope.trending.model.EngineSnapshot;
import com.trendscope.trending.model.SourceHealth;
import com.trendscope.trending.model.TrendingItem;
import com.trendscope.trendingservice.config.TrendingProperties;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read API over the trending engine.
 *
 * <p>{@code GET /api/v1/trending} returns the merged ranking; {@code limit} must be between 1 and
 * {@code trendscope.trending.max-limit}. {@code GET /api/v1/trending/sources} returns per-source
 * health and an engine snapshot.
 */
@RestController
@RequestMapping("/api/v1/trending")
public class TrendingController {

    private final TrendingService trendingService;
    private final TrendingProperties properties;

    public TrendingController(TrendingService trendingService, TrendingProperties properties) {
        this.trendingService = trendingService;
        this.properties = properties;
    }

    @GetMapping
    public TrendingResponse trending(
            @RequestParam(required = false) Integer limit,
            @RequestParam(defaultValue = "false") boolean refresh) {
        if (limit != null && (limit < 1 || limit > properties.maxLimit())) {
            throw new IllegalArgumentException(
                    "limit must be between 1 and " + properties.maxLimit() + ", got " + limit);
        }
        List<TrendingItem> items = trendingService.fetchTrending(limit, refresh);
        int effective = limit != null ? limit : trendingService.settings().defaultLimit();
        return new TrendingResponse(items.size(), effective, items);
    }

    @GetMapping("/sources")
    public SourcesResponse sources() {
        return new SourcesResponse(trendingService.getSourceHealth(), trendingService.snapshot());
    }

    public record TrendingResponse(int count, int limit, List<TrendingItem> items) {}

    public record SourcesResponse(List<SourceHealth> sources, EngineSnapshot service) {}
}
