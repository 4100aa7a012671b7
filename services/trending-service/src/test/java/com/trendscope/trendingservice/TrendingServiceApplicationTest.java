package com.trendscope.trendingservice;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasItems;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.trendscope.trending.engine.TrendingService;
import com.trendscope.trending.testing.StubTrendingSource;
import com.trendscope.trendingservice.config.TrendingProperties;
import com.trendscope.trendingservice.infrastructure.web.CorrelationIdFilter;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Full-context tests against a stub source registered as a bean. The test profile configures
 * {@code stub} plus one unknown name, which must be skipped.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Trending Service Application")
class TrendingServiceApplicationTest {

    @TestConfiguration
    static class StubSourceConfig {

        @Bean
        StubTrendingSource stubSource() {
            return new StubTrendingSource("stub")
                    .withItem("Gamma", "https://example.com/gamma", 30)
                    .withItem("Alpha", "https://example.com/alpha", 10)
                    .withItem("Beta", "https://example.com/beta", 20);
        }
    }

    @Autowired private MockMvc mockMvc;
    @Autowired private TrendingService trendingService;
    @Autowired private TrendingProperties properties;
    @Autowired private StubTrendingSource stubSource;

    @Test
    @DisplayName("Properties are loaded from the test profile")
    void propertiesAreLoaded() {
        assertThat(properties.defaultLimit()).isEqualTo(2);
        assertThat(properties.maxLimit()).isEqualTo(50);
        assertThat(properties.sources()).containsExactly("stub", "unknown-source");
    }

    @Test
    @DisplayName("Unknown configured sources are skipped")
    void unknownSourcesAreSkipped() {
        assertThat(trendingService.sourceNames()).containsExactly("stub");
    }

    @Test
    @DisplayName("Cache is primed and the refresh loop runs after startup")
    void cacheIsPrimed() throws Exception {
        assertThat(stubSource.awaitInvocation(Duration.ofSeconds(5))).isTrue();
        assertThat(trendingService.snapshot().lastRefreshAt()).isNotNull();
        assertThat(trendingService.isBackgroundRefreshRunning()).isTrue();
    }

    @Test
    @DisplayName("Root banner names the service")
    void rootBanner() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("trending-service-test is online"))
                .andExpect(jsonPath("$.trending").value("/api/v1/trending"));
    }

    @Test
    @DisplayName("Status health endpoint reports healthy")
    void statusHealth() throws Exception {
        mockMvc.perform(get("/api/v1/status/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.timestamp").isNotEmpty());
    }

    @Test
    @DisplayName("Trending endpoint returns the default number of ranked items")
    void trendingDefaultLimit() throws Exception {
        mockMvc.perform(get("/api/v1/trending"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.limit").value(2))
                .andExpect(jsonPath("$.items[0].title").value("Gamma"))
                .andExpect(jsonPath("$.items[1].title").value("Beta"))
                .andExpect(jsonPath("$.items[0].source").value("stub"))
                .andExpect(jsonPath("$.items[0].metadata.raw_score").value(30.0));
    }

    @Test
    @DisplayName("Trending endpoint honours an explicit limit")
    void trendingExplicitLimit() throws Exception {
        mockMvc.perform(get("/api/v1/trending").param("limit", "3").param("refresh", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(3))
                .andExpect(jsonPath("$.limit").value(3))
                .andExpect(jsonPath("$.items[2].title").value("Alpha"));
    }

    @Test
    @DisplayName("Out-of-range limits are rejected with a problem detail")
    void rejectsOutOfRangeLimit() throws Exception {
        mockMvc.perform(get("/api/v1/trending").param("limit", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Bad Request"))
                .andExpect(jsonPath("$.correlationId").isNotEmpty());

        mockMvc.perform(get("/api/v1/trending").param("limit", "51"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Non-numeric limits are rejected")
    void rejectsNonNumericLimit() throws Exception {
        mockMvc.perform(get("/api/v1/trending").param("limit", "ten"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Invalid value for parameter 'limit': ten"));
    }

    @Test
    @DisplayName("Sources endpoint reports health and the engine snapshot")
    void sourcesEndpoint() throws Exception {
        mockMvc.perform(get("/api/v1/trending/sources"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sources[0].source").value("stub"))
                .andExpect(jsonPath("$.sources[0].status").value("ok"))
                .andExpect(jsonPath("$.service.defaultLimit").value(2))
                .andExpect(jsonPath("$.service.refreshIntervalSeconds").value(900))
                .andExpect(jsonPath("$.service.cachedLimits", hasItems(2)))
                .andExpect(jsonPath("$.service.lastRefreshAt").isNotEmpty());
    }

    @Test
    @DisplayName("Actuator health includes the trending sources component")
    void actuatorHealth() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.components.trendingSources.status").value("UP"))
                .andExpect(jsonPath("$.components.trendingSources.details.stub.status").value("HEALTHY"));
    }

    @Test
    @DisplayName("Correlation ID is echoed on responses")
    void correlationIdEchoed() throws Exception {
        mockMvc.perform(get("/api/v1/trending").header(CorrelationIdFilter.CORRELATION_ID_HEADER, "it-123"))
                .andExpect(status().isOk())
                .andExpect(header().string(CorrelationIdFilter.CORRELATION_ID_HEADER, "it-123"));
    }
}
