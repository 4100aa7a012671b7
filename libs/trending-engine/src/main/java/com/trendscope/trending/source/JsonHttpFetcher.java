package com.trendscope.trending.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Shared HTTP plumbing for the JSON-speaking source adapters: GET with a timeout, status check,
 * and JSON parsing. Every failure surfaces as a {@link SourceFetchException} tagged with the
 * calling source's name.
 */
public class JsonHttpFetcher {

    private static final Logger log = LoggerFactory.getLogger(JsonHttpFetcher.class);

    public static final String USER_AGENT = "TrendScope/0.2";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public JsonHttpFetcher(Duration timeout, ObjectMapper objectMapper) {
        this(HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(), objectMapper, timeout);
    }

    public JsonHttpFetcher(HttpClient httpClient, ObjectMapper objectMapper, Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
    }

    /**
     * Performs a GET and parses the body as JSON.
     *
     * @param source  name of the calling source, used in error messages
     * @param uri     request URI including query string
     * @param headers extra request headers; a User-Agent is always sent
     */
    public JsonNode get(String source, URI uri, Map<String, String> headers) {
        HttpRequest.Builder request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("User-Agent", USER_AGENT)
                .GET();
        headers.forEach(request::header);

        HttpResponse<String> response;
        try {
            response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new SourceFetchException(source, "request to " + uri.getHost() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceFetchException(source, "request to " + uri.getHost() + " interrupted", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new SourceFetchException(source, uri.getHost() + " returned HTTP " + status);
        }
        log.debug("{} answered HTTP {} for {}", uri.getHost(), status, source);

        JsonNode node;
        try {
            node = objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new SourceFetchException(source, "malformed JSON from " + uri.getHost(), e);
        }
        // every upstream answers with a top-level object
        if (node == null || node.isMissingNode() || !node.isObject()) {
            throw new SourceFetchException(source, "malformed JSON from " + uri.getHost());
        }
        return node;
    }

    /**
     * Builds {@code base?k=v&...} with URL-encoded values, keeping the parameter order.
     */
    public static URI uri(String base, Map<String, String> params) {
        if (params.isEmpty()) {
            return URI.create(base);
        }
        String query = params.entrySet().stream()
                .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
        return URI.create(base + "?" + query);
    }
}
