package com.driftsentinel.core.detection;

import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.AlertSeverity;
import com.driftsentinel.core.model.AlertType;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one {@link DriftDetector#checkAndAlert(LocalDate, boolean)} run:
 * counts by severity and type plus one {@link Entry} per detected alert.
 *
 * <p>
 * Serialises to
 * {@code {metric_date, alerts_detected, alerts_by_severity, alerts_by_type, alerts}}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"metric_date", "alerts_detected", "alerts_by_severity", "alerts_by_type", "alerts"})
public final class DriftCheckResult {

    private final LocalDate metricDate;
    private final Map<String, Integer> alertsBySeverity = new LinkedHashMap<>();
    private final Map<String, Integer> alertsByType = new LinkedHashMap<>();
    private final List<Entry> alerts = new ArrayList<>();

    DriftCheckResult(LocalDate metricDate) {
        this.metricDate = Objects.requireNonNull(metricDate, "metricDate must not be null");
    }

    void add(Entry entry) {
        alertsBySeverity.merge(entry.getSeverity().getValue(), 1, Integer::sum);
        alertsByType.merge(entry.getType().getValue(), 1, Integer::sum);
        alerts.add(entry);
    }

    @JsonProperty("metric_date")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    public LocalDate getMetricDate() {
        return metricDate;
    }

    @JsonProperty("alerts_detected")
    public int getAlertsDetected() {
        return alerts.size();
    }

    /**
     * @return counts keyed by severity wire name, e.g. {@code critical}
     */
    @JsonProperty("alerts_by_severity")
    public Map<String, Integer> getAlertsBySeverity() {
        return Collections.unmodifiableMap(alertsBySeverity);
    }

    /**
     * @return counts keyed by alert type wire name, e.g. {@code fallback_spike}
     */
    @JsonProperty("alerts_by_type")
    public Map<String, Integer> getAlertsByType() {
        return Collections.unmodifiableMap(alertsByType);
    }

    @JsonProperty("alerts")
    public List<Entry> getAlerts() {
        return Collections.unmodifiableList(alerts);
    }

    @Override
    public String toString() {
        return "DriftCheckResult{" +
                "metricDate=" + metricDate +
                ", alertsDetected=" + alerts.size() +
                ", alertsBySeverity=" + alertsBySeverity +
                ", alertsByType=" + alertsByType +
                '}';
    }

    /**
     * One detected alert and, when auto-save was on, whether it was persisted.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"type", "severity", "metric", "current", "baseline", "deviation", "context",
            "alert_id", "saved"})
    public static final class Entry {

        private final Alert alert;
        private final String alertId;
        private final Boolean saved;

        private Entry(Alert alert, String alertId, Boolean saved) {
            this.alert = Objects.requireNonNull(alert, "alert must not be null");
            this.alertId = alertId;
            this.saved = saved;
        }

        static Entry unsaved(Alert alert) {
            return new Entry(alert, null, null);
        }

        static Entry saved(Alert alert, String alertId) {
            return new Entry(alert, alertId, Boolean.TRUE);
        }

        static Entry saveFailed(Alert alert) {
            return new Entry(alert, null, Boolean.FALSE);
        }

        @JsonIgnore
        public Alert getAlert() {
            return alert;
        }

        @JsonProperty("type")
        public AlertType getType() {
            return alert.getAlertType();
        }

        @JsonProperty("severity")
        public AlertSeverity getSeverity() {
            return alert.getSeverity();
        }

        @JsonProperty("metric")
        public String getMetric() {
            return alert.getMetricName();
        }

        @JsonProperty("current")
        public double getCurrent() {
            return alert.getCurrentValue();
        }

        @JsonProperty("baseline")
        public double getBaseline() {
            return alert.getBaselineValue();
        }

        @JsonProperty("deviation")
        public double getDeviation() {
            return alert.getDeviationRatio();
        }

        @JsonProperty("context")
        public Map<String, Object> getContext() {
            return alert.getContext();
        }

        /**
         * @return store id, or {@code null} if not saved
         */
        @JsonProperty("alert_id")
        public String getAlertId() {
            return alertId;
        }

        /**
         * @return {@code true}/{@code false} when auto-save ran, {@code null}
         *         when it was off
         */
        @JsonProperty("saved")
        public Boolean getSaved() {
            return saved;
        }

        @Override
        public String toString() {
            return "Entry{type=" + getType() + ", severity=" + getSeverity()
                    + ", alertId='" + alertId + "', saved=" + saved + '}';
        }
    }
}
