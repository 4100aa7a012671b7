package com.trendscope.trendingservice.api;

import com.trendscope.trendingservice.config.ServiceProperties;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Service banner and a liveness check that does not touch the engine.
 */
@RestController
public class RootController {

    private final ServiceProperties properties;

    public RootController(ServiceProperties properties) {
        this.properties = properties;
    }

    @GetMapping("/")
    public Map<String, String> root() {
        Map<String, String> banner = new LinkedHashMap<>();
        banner.put("message", properties.name() + " is online");
        banner.put("environment", properties.environment());
        banner.put("status", "/api/v1/status/health");
        banner.put("trending", "/api/v1/trending");
        return banner;
    }

    @GetMapping("/api/v1/status/health")
    public Map<String, String> health() {
        return Map.of("status", "healthy", "timestamp", Instant.now().toString());
    }
}
