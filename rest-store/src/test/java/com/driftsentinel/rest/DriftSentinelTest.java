package com.driftsentinel.rest;

import com.driftsentinel.core.config.MonitoringConfig;
import com.driftsentinel.core.detection.DriftCheckResult;
import com.driftsentinel.core.detection.DriftDetector;
import com.driftsentinel.core.summary.MonitoringSummary;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests wiring the services to the stub store.
 */
class DriftSentinelTest {

    private StubStoreServer server;

    @BeforeEach
    void setUp() throws Exception {
        server = new StubStoreServer();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    @DisplayName("Should detect, save and report a fallback spike and a health decline")
    void shouldCheckAndAlert() {
        server.respond(200, "[{\"metric_date\":\"2024-05-01\",\"total_events\":1000,"
                        + "\"fallback_rate\":0.08,\"error_rate\":0.01,\"latency_p95\":1000,\"health_score\":45}]")
                .respond(200, "[{\"baseline_name\":\"7day_rolling\",\"baseline_fallback_rate\":0.02,"
                        + "\"baseline_error_rate\":0.01,\"baseline_latency_p95\":1000}]")
                .respond(201, "[{\"id\":\"alert-fallback\"}]")
                .respond(500, "insert failed");

        DriftDetector detector = DriftSentinel.createDetector(server.config().build(), MonitoringConfig.defaults());
        DriftCheckResult result = detector.checkAndAlert(LocalDate.of(2024, 5, 1), true);

        assertThat(result.getAlertsDetected()).isEqualTo(2);
        assertThat(result.getAlertsBySeverity()).containsEntry("critical", 2);
        assertThat(result.getAlerts().get(0).getAlertId()).isEqualTo("alert-fallback");
        assertThat(result.getAlerts().get(0).getSaved()).isTrue();
        assertThat(result.getAlerts().get(1).getSaved()).isFalse();
        assertThat(server.requests()).extracting(r -> r.method).containsExactly("GET", "GET", "POST", "POST");
    }

    @Test
    @DisplayName("Should build a summary from the stub store")
    void shouldBuildSummary() {
        MonitoringSummary summary = DriftSentinel.createSummary(server.config().build(), MonitoringConfig.defaults());

        assertThat(summary.getSummary(7).getWindow().getDays()).isZero();
        assertThat(server.requests()).extracting(r -> r.path).containsExactly(
                "/rest/v1/mv_daily_metrics", "/rest/v1/monitoring_alerts", "/rest/v1/monitoring_baseline");
    }
}
