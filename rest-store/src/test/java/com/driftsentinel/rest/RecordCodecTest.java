package com.driftsentinel.rest;

import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.AlertSeverity;
import com.driftsentinel.core.model.AlertStatus;
import com.driftsentinel.core.model.AlertType;
import com.driftsentinel.core.model.BaselineSnapshot;
import com.driftsentinel.core.model.MetricSnapshot;
import com.driftsentinel.core.model.ThresholdConfig;
import com.driftsentinel.core.source.MalformedRecordException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RecordCodec}.
 */
class RecordCodecTest {

    private final ObjectMapper mapper = RecordCodec.objectMapper();
    private final RecordCodec codec = new RecordCodec(mapper);

    // ------------------------------------------------------------------
    // Metrics and baselines
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should read a metrics row and default missing numbers to zero")
    void shouldReadMetricsRow() throws Exception {
        MetricSnapshot snapshot = codec.toMetricSnapshot(json(
                "{\"metric_date\":\"2024-05-01T00:00:00+00:00\",\"total_events\":1200,"
                        + "\"fallback_rate\":0.08,\"latency_p95\":1850.5,\"health_score\":null,"
                        + "\"some_new_column\":\"ignored\"}"));

        assertThat(snapshot.getMetricDate()).isEqualTo(LocalDate.of(2024, 5, 1));
        assertThat(snapshot.getTotalEvents()).isEqualTo(1200);
        assertThat(snapshot.getFallbackRate()).isEqualTo(0.08);
        assertThat(snapshot.getLatencyP95()).isEqualTo(1850.5);
        assertThat(snapshot.getHealthScore()).isZero();
        assertThat(snapshot.getErrorRate()).isZero();
    }

    @Test
    @DisplayName("Should reject a metrics row without a date")
    void shouldRejectRowWithoutDate() {
        assertThatThrownBy(() -> codec.toMetricSnapshot(json("{\"total_events\":1}")))
                .isInstanceOf(MalformedRecordException.class)
                .hasMessageContaining("metric_date");
    }

    @Test
    @DisplayName("Should read a baseline row with prefixed columns")
    void shouldReadBaselineRow() throws Exception {
        BaselineSnapshot baseline = codec.toBaselineSnapshot(json(
                "{\"baseline_name\":\"7day_rolling\",\"baseline_fallback_rate\":0.02,"
                        + "\"baseline_error_rate\":0.01,\"baseline_latency_p95\":1200,"
                        + "\"valid_until\":\"2024-05-08T00:00:00+00:00\"}"));

        assertThat(baseline.getBaselineName()).isEqualTo("7day_rolling");
        assertThat(baseline.getWindowDays()).isEqualTo(7);
        assertThat(baseline.getFallbackRate()).isEqualTo(0.02);
        assertThat(baseline.getErrorRate()).isEqualTo(0.01);
        assertThat(baseline.getDuplicateRate()).isZero();
        assertThat(baseline.getLatencyP95()).isEqualTo(1200.0);
        assertThat(baseline.getValidUntil()).isEqualTo("2024-05-08T00:00:00+00:00");
    }

    @Test
    @DisplayName("Should reject a baseline with a negative rate")
    void shouldRejectNegativeBaseline() {
        assertThatThrownBy(() -> codec.toBaselineSnapshot(json(
                "{\"baseline_name\":\"7day_rolling\",\"baseline_error_rate\":-0.01}")))
                .isInstanceOf(MalformedRecordException.class)
                .hasMessageContaining("errorRate");
    }

    // ------------------------------------------------------------------
    // Alerts
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should write an infinite deviation as the string Infinity")
    void shouldWriteInfinity() {
        ObjectNode payload = codec.toAlertPayload(Alert.builder()
                .alertType(AlertType.ERROR_SPIKE)
                .severity(AlertSeverity.CRITICAL)
                .metricName("error_rate")
                .currentValue(0.02)
                .baselineValue(0)
                .deviationRatio(Double.POSITIVE_INFINITY)
                .thresholds(ThresholdConfig.DEFAULT)
                .metricDate(LocalDate.of(2024, 5, 1))
                .context("absolute_increase", 0.02)
                .build());

        assertThat(payload.get("deviation_ratio").asText()).isEqualTo("Infinity");
        assertThat(payload.get("alert_type").asText()).isEqualTo("error_spike");
        assertThat(payload.get("severity").asText()).isEqualTo("critical");
        assertThat(payload.get("status").asText()).isEqualTo("open");
        assertThat(payload.get("metric_date").asText()).isEqualTo("2024-05-01");
        assertThat(payload.get("threshold_low").asDouble()).isEqualTo(1.5);
        assertThat(payload.get("threshold_high").asDouble()).isEqualTo(3.0);
        assertThat(payload.get("comparison_window_days").asInt()).isEqualTo(7);
        assertThat(payload.get("context_data").get("absolute_increase").asDouble()).isEqualTo(0.02);
        assertThat(payload.has("id")).isFalse();
    }

    @Test
    @DisplayName("Should read a stored alert, accepting Infinity as a deviation")
    void shouldReadStoredAlert() throws Exception {
        Alert alert = codec.toAlert(json("{\"id\":\"3f1c\",\"alert_type\":\"fallback_spike\","
                + "\"severity\":\"high\",\"metric_name\":\"fallback_rate\",\"current_value\":0.05,"
                + "\"baseline_value\":0,\"deviation_ratio\":\"Infinity\",\"threshold_low\":1.5,"
                + "\"threshold_medium\":2.0,\"threshold_high\":3.0,\"metric_date\":\"2024-05-01\","
                + "\"comparison_window_days\":7,\"context_data\":{\"absolute_increase\":0.05},"
                + "\"status\":\"acknowledged\",\"created_at\":\"2024-05-01T06:00:12.345+00:00\"}"));

        assertThat(alert.getId()).isEqualTo("3f1c");
        assertThat(alert.getAlertType()).isEqualTo(AlertType.FALLBACK_SPIKE);
        assertThat(alert.getSeverity()).isEqualTo(AlertSeverity.HIGH);
        assertThat(alert.getDeviationRatio()).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(alert.getThresholds()).isEqualTo(ThresholdConfig.DEFAULT);
        assertThat(alert.getStatus()).isEqualTo(AlertStatus.ACKNOWLEDGED);
        assertThat(alert.getContext()).containsEntry("absolute_increase", 0.05);
        assertThat(alert.getCreatedAt()).isEqualTo(Instant.parse("2024-05-01T06:00:12.345Z"));
    }

    @Test
    @DisplayName("Should rank an unknown stored severity as low")
    void shouldRankUnknownSeverityAsLow() throws Exception {
        Alert alert = codec.toAlert(json("{\"alert_type\":\"model_drift\",\"severity\":\"warning\","
                + "\"metric_name\":\"drift\",\"metric_date\":\"2024-05-01\",\"status\":\"open\"}"));

        assertThat(alert.getSeverity()).isEqualTo(AlertSeverity.LOW);
        assertThat(alert.getThresholds()).isNull();
    }

    @Test
    @DisplayName("Should reject a stored alert with an unknown type")
    void shouldRejectUnknownType() {
        assertThatThrownBy(() -> codec.toAlert(json("{\"alert_type\":\"mystery\",\"severity\":\"high\","
                + "\"metric_name\":\"x\",\"metric_date\":\"2024-05-01\",\"status\":\"open\"}")))
                .isInstanceOf(MalformedRecordException.class)
                .hasMessageContaining("mystery");
    }

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }
}
