package com.driftsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An anomaly detected by comparing one day's metrics against a baseline.
 *
 * <p>
 * Alerts are immutable. Detectors create them with {@code status=open} and no
 * id; alerts read back from the store carry the id, creation time and
 * whatever status the store currently holds.
 * </p>
 *
 * <h3>Deviation ratio</h3>
 * <p>
 * {@code deviationRatio} is either a finite non-negative number or
 * {@link Double#POSITIVE_INFINITY}, meaning the baseline was zero while the
 * current value was not.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code alertType}, {@code severity},
 * {@code metricName} and {@code metricDate} are required; omitting any of
 * them throws {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Alert implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Store-assigned identifier, {@code null} until persisted. */
    private final String id;

    private final AlertType alertType;
    private final AlertSeverity severity;
    private final String metricName;
    private final double currentValue;
    private final double baselineValue;
    private final double deviationRatio;

    /** Threshold tiers in force when the alert was raised. */
    private final ThresholdConfig thresholds;

    private final LocalDate metricDate;
    private final int comparisonWindowDays;

    private final String affectedModel;
    private final String affectedBackend;
    private final String affectedAgent;

    /** Detector-specific details, e.g. absolute increase. */
    private final Map<String, Object> context;

    private final AlertStatus status;
    private final Instant createdAt;

    // ---------------------------------------------------------------
    // Constructors
    // ---------------------------------------------------------------

    private Alert(Builder builder) {
        this.id = builder.id;
        this.alertType = Objects.requireNonNull(builder.alertType, "alertType must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.metricName = Objects.requireNonNull(builder.metricName, "metricName must not be null");
        this.metricDate = Objects.requireNonNull(builder.metricDate, "metricDate must not be null");
        this.currentValue = builder.currentValue;
        this.baselineValue = builder.baselineValue;
        this.deviationRatio = builder.deviationRatio;
        this.thresholds = builder.thresholds;
        this.comparisonWindowDays = builder.comparisonWindowDays;
        this.affectedModel = builder.affectedModel;
        this.affectedBackend = builder.affectedBackend;
        this.affectedAgent = builder.affectedAgent;
        this.context = Collections.unmodifiableMap(new LinkedHashMap<>(builder.context));
        this.status = builder.status != null ? builder.status : AlertStatus.OPEN;
        this.createdAt = builder.createdAt;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Alert} instances.
     */
    public static class Builder {
        private String id;
        private AlertType alertType;
        private AlertSeverity severity;
        private String metricName;
        private double currentValue;
        private double baselineValue;
        private double deviationRatio;
        private ThresholdConfig thresholds;
        private LocalDate metricDate;
        private int comparisonWindowDays;
        private String affectedModel;
        private String affectedBackend;
        private String affectedAgent;
        private final Map<String, Object> context = new LinkedHashMap<>();
        private AlertStatus status;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder alertType(AlertType alertType) {
            this.alertType = alertType;
            return this;
        }

        public Builder severity(AlertSeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder metricName(String metricName) {
            this.metricName = metricName;
            return this;
        }

        public Builder currentValue(double currentValue) {
            this.currentValue = currentValue;
            return this;
        }

        public Builder baselineValue(double baselineValue) {
            this.baselineValue = baselineValue;
            return this;
        }

        public Builder deviationRatio(double deviationRatio) {
            this.deviationRatio = deviationRatio;
            return this;
        }

        public Builder thresholds(ThresholdConfig thresholds) {
            this.thresholds = thresholds;
            return this;
        }

        public Builder metricDate(LocalDate metricDate) {
            this.metricDate = metricDate;
            return this;
        }

        public Builder comparisonWindowDays(int comparisonWindowDays) {
            this.comparisonWindowDays = comparisonWindowDays;
            return this;
        }

        public Builder affectedModel(String affectedModel) {
            this.affectedModel = affectedModel;
            return this;
        }

        public Builder affectedBackend(String affectedBackend) {
            this.affectedBackend = affectedBackend;
            return this;
        }

        public Builder affectedAgent(String affectedAgent) {
            this.affectedAgent = affectedAgent;
            return this;
        }

        public Builder context(String key, Object value) {
            this.context.put(Objects.requireNonNull(key, "context key must not be null"), value);
            return this;
        }

        public Builder context(Map<String, Object> context) {
            if (context != null) {
                this.context.putAll(context);
            }
            return this;
        }

        public Builder status(AlertStatus status) {
            this.status = status;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        /**
         * Build the alert.
         *
         * @return a new {@link Alert}
         * @throws NullPointerException if a required field is {@code null}
         */
        public Alert build() {
            return new Alert(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    @JsonProperty("id")
    public String getId() {
        return id;
    }

    @JsonProperty("alert_type")
    public AlertType getAlertType() {
        return alertType;
    }

    @JsonProperty("severity")
    public AlertSeverity getSeverity() {
        return severity;
    }

    @JsonProperty("metric_name")
    public String getMetricName() {
        return metricName;
    }

    @JsonProperty("current_value")
    public double getCurrentValue() {
        return currentValue;
    }

    @JsonProperty("baseline_value")
    public double getBaselineValue() {
        return baselineValue;
    }

    @JsonProperty("deviation_ratio")
    public double getDeviationRatio() {
        return deviationRatio;
    }

    /**
     * @return {@code true} if the baseline was zero while the current value was not
     */
    @JsonIgnore
    public boolean isBaselineZero() {
        return deviationRatio == Double.POSITIVE_INFINITY;
    }

    @JsonProperty("thresholds")
    public ThresholdConfig getThresholds() {
        return thresholds;
    }

    @JsonProperty("metric_date")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    public LocalDate getMetricDate() {
        return metricDate;
    }

    @JsonProperty("comparison_window_days")
    public int getComparisonWindowDays() {
        return comparisonWindowDays;
    }

    @JsonProperty("affected_model")
    public String getAffectedModel() {
        return affectedModel;
    }

    @JsonProperty("affected_backend")
    public String getAffectedBackend() {
        return affectedBackend;
    }

    @JsonProperty("affected_agent")
    public String getAffectedAgent() {
        return affectedAgent;
    }

    /**
     * @return unmodifiable, insertion-ordered context map
     */
    @JsonProperty("context")
    public Map<String, Object> getContext() {
        return context;
    }

    @JsonProperty("status")
    public AlertStatus getStatus() {
        return status;
    }

    @JsonProperty("created_at")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    public Instant getCreatedAt() {
        return createdAt;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return Objects.equals(id, alert.id)
                && alertType == alert.alertType
                && severity == alert.severity
                && Objects.equals(metricName, alert.metricName)
                && Objects.equals(metricDate, alert.metricDate)
                && Double.compare(deviationRatio, alert.deviationRatio) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, alertType, severity, metricName, metricDate, deviationRatio);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "id='" + id + '\'' +
                ", alertType=" + alertType +
                ", severity=" + severity +
                ", metricName='" + metricName + '\'' +
                ", currentValue=" + currentValue +
                ", baselineValue=" + baselineValue +
                ", deviationRatio=" + deviationRatio +
                ", metricDate=" + metricDate +
                ", status=" + status +
                '}';
    }
}
