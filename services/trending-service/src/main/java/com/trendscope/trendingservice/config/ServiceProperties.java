package com.trendscope.trendingservice.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service identity, bound from {@code trendscope.service.*}.
 *
 * @param name service name, used as the {@code service} tag on every meter and in the root banner
 * @param environment deployment environment (development, staging, production)
 */
@ConfigurationProperties(prefix = "trendscope.service")
@Validated
public record ServiceProperties(@NotBlank String name, String environment) {

    public ServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }
}
