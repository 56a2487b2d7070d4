package com.driftsentinel.rest;

import com.driftsentinel.core.source.MonitoringStoreException;
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
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Minimal PostgREST client over the JDK {@link HttpClient}.
 *
 * <p>
 * Every request carries the {@code apikey} and {@code Authorization: Bearer}
 * headers. Filters are passed as PostgREST query parameters, e.g.
 * {@code metric_date=eq.2024-05-01} or {@code order=created_at.desc}.
 * </p>
 *
 * <h3>Failures</h3>
 * <p>
 * Non-2xx responses, I/O errors, timeouts and unparseable bodies all become a
 * {@link MonitoringStoreException}. When {@link StoreConfig#getMaxRetries()}
 * is positive, I/O errors and 5xx responses are retried with a linear
 * backoff; 4xx responses are never retried.
 * </p>
 *
 * @since 1.0.0
 */
public class PostgrestClient {

    private static final Logger LOG = LoggerFactory.getLogger(PostgrestClient.class);

    private final StoreConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;

    public PostgrestClient(StoreConfig config) {
        this(config, HttpClient.newBuilder()
                .connectTimeout(Objects.requireNonNull(config, "config must not be null").getPointReadTimeout())
                .build());
    }

    PostgrestClient(StoreConfig config, HttpClient httpClient) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.mapper = RecordCodec.objectMapper();
    }

    /**
     * {@code GET /rest/v1/{relation}?params}.
     *
     * @param relation table or view name
     * @param params   PostgREST query parameters, sent in iteration order
     * @param timeout  request timeout
     * @return the JSON array of rows
     * @throws MonitoringStoreException on any failure
     */
    public JsonNode select(String relation, Map<String, String> params, Duration timeout) {
        HttpRequest request = baseRequest(relation, params, timeout)
                .GET()
                .build();
        JsonNode body = parse(send(request, "GET " + relation), relation);
        if (!body.isArray()) {
            throw new MonitoringStoreException("Expected a JSON array from " + relation + ", got: "
                    + body.getNodeType());
        }
        return body;
    }

    /**
     * {@code POST /rest/v1/{relation}} with {@code Prefer: return=representation}.
     *
     * @param relation table name
     * @param payload  row to insert
     * @return the inserted row(s) as returned by the store
     * @throws MonitoringStoreException on any failure
     */
    public JsonNode insert(String relation, JsonNode payload) {
        String json;
        try {
            json = mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new MonitoringStoreException("Failed to encode payload for " + relation, e);
        }
        HttpRequest request = baseRequest(relation, Map.of(), config.getWriteTimeout())
                .header("Content-Type", "application/json")
                .header("Prefer", "return=representation")
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                .build();
        return parse(send(request, "POST " + relation), relation);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private HttpRequest.Builder baseRequest(String relation, Map<String, String> params, Duration timeout) {
        return HttpRequest.newBuilder()
                .uri(uri(relation, params))
                .timeout(timeout)
                .header("apikey", config.getApiKey())
                .header("Authorization", "Bearer " + config.getApiKey())
                .header("Accept", "application/json");
    }

    URI uri(String relation, Map<String, String> params) {
        StringBuilder url = new StringBuilder(config.getBaseUrl()).append("/rest/v1/").append(relation);
        if (!params.isEmpty()) {
            StringJoiner query = new StringJoiner("&", "?", "");
            params.forEach((name, value) -> query.add(encode(name) + "=" + encode(value)));
            url.append(query);
        }
        return URI.create(url.toString());
    }

    private HttpResponse<String> send(HttpRequest request, String description) {
        int attempt = 0;
        while (true) {
            try {
                HttpResponse<String> response = httpClient.send(request,
                        HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
                int status = response.statusCode();
                if (status >= 200 && status < 300) {
                    return response;
                }
                if (status >= 500 && attempt < config.getMaxRetries()) {
                    LOG.warn("{} returned {}, retrying ({}/{})", description, status, attempt + 1,
                            config.getMaxRetries());
                } else {
                    throw new MonitoringStoreException(
                            description + " failed: HTTP " + status + " " + response.body(), status);
                }
            } catch (IOException e) {
                if (attempt >= config.getMaxRetries()) {
                    throw new MonitoringStoreException(description + " failed: " + e.getMessage(), e);
                }
                LOG.warn("{} failed: {}, retrying ({}/{})", description, e.getMessage(), attempt + 1,
                        config.getMaxRetries());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new MonitoringStoreException(description + " interrupted", e);
            }
            attempt++;
            backoff(attempt, description);
        }
    }

    private void backoff(int attempt, String description) {
        try {
            Thread.sleep(config.getRetryBackoff().toMillis() * attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MonitoringStoreException(description + " interrupted during retry backoff", e);
        }
    }

    private JsonNode parse(HttpResponse<String> response, String relation) {
        String body = response.body();
        if (body == null || body.isBlank()) {
            return mapper.createArrayNode();
        }
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MonitoringStoreException("Unreadable response from " + relation + ": " + e.getOriginalMessage(),
                    response.statusCode(), e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
