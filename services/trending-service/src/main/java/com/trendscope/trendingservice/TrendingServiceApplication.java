package com.trendscope.trendingservice;

import com.trendscope.trendingservice.config.ServiceProperties;
import com.trendscope.trendingservice.config.TrendingProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * TrendScope trending service: HTTP front end for the trending aggregation engine.
 *
 * <p>On startup the engine cache is primed with a forced refresh and the background refresh loop
 * is started (see {@link com.trendscope.trendingservice.config.TrendingLifecycle}). Besides the
 * trending API the service exposes actuator health (with a per-source component), metrics and a
 * Prometheus scrape endpoint.
 */
@SpringBootApplication
@EnableConfigurationProperties({ServiceProperties.class, TrendingProperties.class})
@EnableScheduling
public class TrendingServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(TrendingServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(TrendingServiceApplication.class, args);
        log.info("TrendScope trending service started");
    }
}
