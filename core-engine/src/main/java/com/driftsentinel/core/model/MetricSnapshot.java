package com.driftsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Objects;

/**
 * One calendar day of aggregated service metrics.
 *
 * <p>
 * Snapshots are produced by an external rollup pipeline and are read-only
 * here. They are keyed by {@link #getMetricDate()} alone.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricSnapshot implements Serializable {

    private static final long serialVersionUID = 1L;

    private final LocalDate metricDate;

    private final long totalEvents;
    private final long successfulEvents;
    private final long failedEvents;
    private final long fallbackEvents;
    private final long duplicateEvents;

    private final double fallbackRate;
    private final double errorRate;
    private final double duplicateRate;

    private final double latencyP50;
    private final double latencyP95;
    private final double latencyP99;

    /** Composite health in {@code [0, 100]}. */
    private final double healthScore;

    private MetricSnapshot(Builder b) {
        this.metricDate = Objects.requireNonNull(b.metricDate, "metricDate must not be null");
        this.totalEvents = b.totalEvents;
        this.successfulEvents = b.successfulEvents;
        this.failedEvents = b.failedEvents;
        this.fallbackEvents = b.fallbackEvents;
        this.duplicateEvents = b.duplicateEvents;
        this.fallbackRate = b.fallbackRate;
        this.errorRate = b.errorRate;
        this.duplicateRate = b.duplicateRate;
        this.latencyP50 = b.latencyP50;
        this.latencyP95 = b.latencyP95;
        this.latencyP99 = b.latencyP99;
        this.healthScore = b.healthScore;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link MetricSnapshot}. Only {@code metricDate} is
     * required; every numeric field defaults to zero.
     */
    public static class Builder {
        private LocalDate metricDate;
        private long totalEvents;
        private long successfulEvents;
        private long failedEvents;
        private long fallbackEvents;
        private long duplicateEvents;
        private double fallbackRate;
        private double errorRate;
        private double duplicateRate;
        private double latencyP50;
        private double latencyP95;
        private double latencyP99;
        private double healthScore;

        public Builder metricDate(LocalDate v) {
            this.metricDate = v;
            return this;
        }

        public Builder totalEvents(long v) {
            this.totalEvents = v;
            return this;
        }

        public Builder successfulEvents(long v) {
            this.successfulEvents = v;
            return this;
        }

        public Builder failedEvents(long v) {
            this.failedEvents = v;
            return this;
        }

        public Builder fallbackEvents(long v) {
            this.fallbackEvents = v;
            return this;
        }

        public Builder duplicateEvents(long v) {
            this.duplicateEvents = v;
            return this;
        }

        public Builder fallbackRate(double v) {
            this.fallbackRate = v;
            return this;
        }

        public Builder errorRate(double v) {
            this.errorRate = v;
            return this;
        }

        public Builder duplicateRate(double v) {
            this.duplicateRate = v;
            return this;
        }

        public Builder latencyP50(double v) {
            this.latencyP50 = v;
            return this;
        }

        public Builder latencyP95(double v) {
            this.latencyP95 = v;
            return this;
        }

        public Builder latencyP99(double v) {
            this.latencyP99 = v;
            return this;
        }

        public Builder healthScore(double v) {
            this.healthScore = v;
            return this;
        }

        /**
         * @return a new snapshot
         * @throws NullPointerException if {@code metricDate} is {@code null}
         */
        public MetricSnapshot build() {
            return new MetricSnapshot(this);
        }
    }

    @JsonProperty("metric_date")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    public LocalDate getMetricDate() {
        return metricDate;
    }

    @JsonProperty("total_events")
    public long getTotalEvents() {
        return totalEvents;
    }

    @JsonProperty("successful_events")
    public long getSuccessfulEvents() {
        return successfulEvents;
    }

    @JsonProperty("failed_events")
    public long getFailedEvents() {
        return failedEvents;
    }

    @JsonProperty("fallback_events")
    public long getFallbackEvents() {
        return fallbackEvents;
    }

    @JsonProperty("duplicate_events")
    public long getDuplicateEvents() {
        return duplicateEvents;
    }

    @JsonProperty("fallback_rate")
    public double getFallbackRate() {
        return fallbackRate;
    }

    @JsonProperty("error_rate")
    public double getErrorRate() {
        return errorRate;
    }

    @JsonProperty("duplicate_rate")
    public double getDuplicateRate() {
        return duplicateRate;
    }

    @JsonProperty("latency_p50")
    public double getLatencyP50() {
        return latencyP50;
    }

    @JsonProperty("latency_p95")
    public double getLatencyP95() {
        return latencyP95;
    }

    @JsonProperty("latency_p99")
    public double getLatencyP99() {
        return latencyP99;
    }

    @JsonProperty("health_score")
    public double getHealthScore() {
        return healthScore;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricSnapshot that))
            return false;
        return totalEvents == that.totalEvents
                && successfulEvents == that.successfulEvents
                && failedEvents == that.failedEvents
                && fallbackEvents == that.fallbackEvents
                && duplicateEvents == that.duplicateEvents
                && Double.compare(fallbackRate, that.fallbackRate) == 0
                && Double.compare(errorRate, that.errorRate) == 0
                && Double.compare(duplicateRate, that.duplicateRate) == 0
                && Double.compare(latencyP50, that.latencyP50) == 0
                && Double.compare(latencyP95, that.latencyP95) == 0
                && Double.compare(latencyP99, that.latencyP99) == 0
                && Double.compare(healthScore, that.healthScore) == 0
                && metricDate.equals(that.metricDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricDate, totalEvents, fallbackRate, errorRate, duplicateRate,
                latencyP95, healthScore);
    }

    @Override
    public String toString() {
        return "MetricSnapshot{" +
                "metricDate=" + metricDate +
                ", totalEvents=" + totalEvents +
                ", fallbackRate=" + fallbackRate +
                ", errorRate=" + errorRate +
                ", duplicateRate=" + duplicateRate +
                ", latencyP95=" + latencyP95 +
                ", healthScore=" + healthScore +
                '}';
    }
}
