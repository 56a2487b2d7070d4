package com.driftsentinel.rest;

import com.driftsentinel.core.model.BaselineSnapshot;
import com.driftsentinel.core.model.MetricSnapshot;
import com.driftsentinel.core.source.MonitoringStoreException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link PostgrestMetricSource} against an in-process stub store.
 */
class PostgrestMetricSourceTest {

    private StubStoreServer server;
    private PostgrestMetricSource source;

    @BeforeEach
    void setUp() throws Exception {
        server = new StubStoreServer();
        source = new PostgrestMetricSource(server.config().build());
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    @DisplayName("Should fetch one day's metrics with an equality filter")
    void shouldFetchMetric() {
        server.respond(200, "[{\"metric_date\":\"2024-05-01\",\"total_events\":1000,\"fallback_rate\":0.08}]");

        Optional<MetricSnapshot> snapshot = source.fetchMetric(LocalDate.of(2024, 5, 1));

        assertThat(snapshot).isPresent();
        assertThat(snapshot.get().getFallbackRate()).isEqualTo(0.08);
        StubStoreServer.Request request = server.lastRequest();
        assertThat(request.method).isEqualTo("GET");
        assertThat(request.path).isEqualTo("/rest/v1/mv_daily_metrics");
        assertThat(request.query).isEqualTo("metric_date=eq.2024-05-01&limit=1");
        assertThat(request.apiKey).isEqualTo(StubStoreServer.API_KEY);
        assertThat(request.authorization).isEqualTo("Bearer " + StubStoreServer.API_KEY);
    }

    @Test
    @DisplayName("Should return empty when no row exists")
    void shouldReturnEmptyForMissingDay() {
        server.respond(200, "[]");

        assertThat(source.fetchMetric(LocalDate.of(2024, 5, 1))).isEmpty();
    }

    @Test
    @DisplayName("Should fetch the window newest first")
    void shouldFetchWindow() {
        server.respond(200, "[{\"metric_date\":\"2024-05-02\"},{\"metric_date\":\"2024-05-01\"}]");

        List<MetricSnapshot> snapshots = source.fetchMetricsSince(LocalDate.of(2024, 4, 25));

        assertThat(snapshots).extracting(MetricSnapshot::getMetricDate)
                .containsExactly(LocalDate.of(2024, 5, 2), LocalDate.of(2024, 5, 1));
        assertThat(server.lastRequest().query).isEqualTo("metric_date=gte.2024-04-25&order=metric_date.desc");
    }

    @Test
    @DisplayName("Should skip malformed rows in the window and keep the rest")
    void shouldSkipMalformedWindowRows() {
        server.respond(200, "[{\"metric_date\":\"2024-05-03\"},"
                + "{\"total_events\":5},"
                + "{\"metric_date\":\"not-a-date\"},"
                + "{\"metric_date\":\"2024-05-01\"}]");

        List<MetricSnapshot> snapshots = source.fetchMetricsSince(LocalDate.of(2024, 4, 25));

        assertThat(snapshots).extracting(MetricSnapshot::getMetricDate)
                .containsExactly(LocalDate.of(2024, 5, 3), LocalDate.of(2024, 5, 1));
    }

    @Test
    @DisplayName("Should fetch a baseline by name")
    void shouldFetchBaseline() {
        server.respond(200, "[{\"baseline_name\":\"7day_rolling\",\"baseline_fallback_rate\":0.02}]");

        Optional<BaselineSnapshot> baseline = source.fetchBaseline("7day_rolling");

        assertThat(baseline).map(BaselineSnapshot::getFallbackRate).contains(0.02);
        assertThat(server.lastRequest().path).isEqualTo("/rest/v1/monitoring_baseline");
        assertThat(server.lastRequest().query).isEqualTo("baseline_name=eq.7day_rolling&limit=1");
    }

    @Test
    @DisplayName("Should surface HTTP errors as store exceptions with the status code")
    void shouldSurfaceHttpErrors() {
        server.respond(401, "{\"message\":\"Invalid API key\"}");

        assertThatThrownBy(() -> source.fetchMetric(LocalDate.of(2024, 5, 1)))
                .isInstanceOf(MonitoringStoreException.class)
                .hasMessageContaining("401")
                .satisfies(e -> assertThat(((MonitoringStoreException) e).getStatusCode()).hasValue(401));
    }

    @Test
    @DisplayName("Should reject a response that is not a JSON array")
    void shouldRejectNonArray() {
        server.respond(200, "{\"unexpected\":true}");

        assertThatThrownBy(() -> source.fetchMetricsSince(LocalDate.of(2024, 5, 1)))
                .isInstanceOf(MonitoringStoreException.class)
                .hasMessageContaining("JSON array");
    }
}
