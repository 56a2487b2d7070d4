package com.driftsentinel.core.summary;

import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.BaselineSnapshot;
import com.driftsentinel.core.model.MetricSnapshot;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Dashboard snapshot produced by {@link MonitoringSummary#getSummary(int)}.
 *
 * <p>
 * Serialises to {@code {window, metrics, baseline, trends, alerts, generated_at}}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"window", "metrics", "baseline", "trends", "alerts", "generated_at"})
public final class SummaryReport {

    private final Window window;
    private final Metrics metrics;
    private final Baseline baseline;
    private final Trends trends;
    private final Alerts alerts;
    private final Instant generatedAt;

    SummaryReport(Window window, Metrics metrics, Baseline baseline, Trends trends, Alerts alerts,
            Instant generatedAt) {
        this.window = Objects.requireNonNull(window);
        this.metrics = Objects.requireNonNull(metrics);
        this.baseline = Objects.requireNonNull(baseline);
        this.trends = Objects.requireNonNull(trends);
        this.alerts = Objects.requireNonNull(alerts);
        this.generatedAt = Objects.requireNonNull(generatedAt);
    }

    @JsonProperty("window")
    public Window getWindow() {
        return window;
    }

    @JsonProperty("metrics")
    public Metrics getMetrics() {
        return metrics;
    }

    @JsonProperty("baseline")
    public Baseline getBaseline() {
        return baseline;
    }

    @JsonProperty("trends")
    public Trends getTrends() {
        return trends;
    }

    @JsonProperty("alerts")
    public Alerts getAlerts() {
        return alerts;
    }

    @JsonProperty("generated_at")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    public Instant getGeneratedAt() {
        return generatedAt;
    }

    @Override
    public String toString() {
        return "SummaryReport{window=" + window + ", trends=" + trends
                + ", openAlerts=" + alerts.getTotalOpen() + '}';
    }

    // ---------------------------------------------------------------
    // Sections
    // ---------------------------------------------------------------

    /** Requested date range and the number of days that actually had data. */
    @JsonPropertyOrder({"start_date", "end_date", "days"})
    public static final class Window {
        private final LocalDate startDate;
        private final LocalDate endDate;
        private final int days;

        Window(LocalDate startDate, LocalDate endDate, int days) {
            this.startDate = startDate;
            this.endDate = endDate;
            this.days = days;
        }

        @JsonProperty("start_date")
        @JsonFormat(shape = JsonFormat.Shape.STRING)
        public LocalDate getStartDate() {
            return startDate;
        }

        @JsonProperty("end_date")
        @JsonFormat(shape = JsonFormat.Shape.STRING)
        public LocalDate getEndDate() {
            return endDate;
        }

        @JsonProperty("days")
        public int getDays() {
            return days;
        }

        @Override
        public String toString() {
            return startDate + ".." + endDate + " (" + days + " day(s))";
        }
    }

    /** Unweighted means over the days in the window. */
    @JsonPropertyOrder({"total_events", "avg_fallback_rate", "avg_error_rate", "avg_health_score", "latest"})
    public static final class Metrics {
        private final long totalEvents;
        private final double avgFallbackRate;
        private final double avgErrorRate;
        private final double avgHealthScore;
        private final MetricSnapshot latest;

        Metrics(long totalEvents, double avgFallbackRate, double avgErrorRate, double avgHealthScore,
                MetricSnapshot latest) {
            this.totalEvents = totalEvents;
            this.avgFallbackRate = avgFallbackRate;
            this.avgErrorRate = avgErrorRate;
            this.avgHealthScore = avgHealthScore;
            this.latest = latest;
        }

        @JsonProperty("total_events")
        public long getTotalEvents() {
            return totalEvents;
        }

        @JsonProperty("avg_fallback_rate")
        public double getAvgFallbackRate() {
            return avgFallbackRate;
        }

        @JsonProperty("avg_error_rate")
        public double getAvgErrorRate() {
            return avgErrorRate;
        }

        @JsonProperty("avg_health_score")
        public double getAvgHealthScore() {
            return avgHealthScore;
        }

        /**
         * @return newest snapshot in the window, or {@code null} if there were none
         */
        @JsonProperty("latest")
        public MetricSnapshot getLatest() {
            return latest;
        }
    }

    /** Reference values; every field is {@code null} when no baseline was found. */
    @JsonPropertyOrder({"fallback_rate", "error_rate", "latency_p95", "valid_until"})
    public static final class Baseline {
        private final Double fallbackRate;
        private final Double errorRate;
        private final Double latencyP95;
        private final String validUntil;

        private Baseline(Double fallbackRate, Double errorRate, Double latencyP95, String validUntil) {
            this.fallbackRate = fallbackRate;
            this.errorRate = errorRate;
            this.latencyP95 = latencyP95;
            this.validUntil = validUntil;
        }

        static Baseline of(BaselineSnapshot snapshot) {
            if (snapshot == null) {
                return new Baseline(null, null, null, null);
            }
            return new Baseline(snapshot.getFallbackRate(), snapshot.getErrorRate(),
                    snapshot.getLatencyP95(), snapshot.getValidUntil());
        }

        @JsonProperty("fallback_rate")
        public Double getFallbackRate() {
            return fallbackRate;
        }

        @JsonProperty("error_rate")
        public Double getErrorRate() {
            return errorRate;
        }

        @JsonProperty("latency_p95")
        public Double getLatencyP95() {
            return latencyP95;
        }

        @JsonProperty("valid_until")
        public String getValidUntil() {
            return validUntil;
        }
    }

    @JsonPropertyOrder({"fallback_rate", "latency_p95"})
    public static final class Trends {
        private final Trend fallbackRate;
        private final Trend latencyP95;

        Trends(Trend fallbackRate, Trend latencyP95) {
            this.fallbackRate = fallbackRate;
            this.latencyP95 = latencyP95;
        }

        @JsonProperty("fallback_rate")
        public Trend getFallbackRate() {
            return fallbackRate;
        }

        @JsonProperty("latency_p95")
        public Trend getLatencyP95() {
            return latencyP95;
        }

        @Override
        public String toString() {
            return "{fallback_rate=" + fallbackRate.getValue() + ", latency_p95=" + latencyP95.getValue() + '}';
        }
    }

    @JsonPropertyOrder({"total_open", "by_severity", "recent"})
    public static final class Alerts {
        private final int totalOpen;
        private final Map<String, Integer> bySeverity;
        private final List<Alert> recent;

        Alerts(int totalOpen, Map<String, Integer> bySeverity, List<Alert> recent) {
            this.totalOpen = totalOpen;
            this.bySeverity = Collections.unmodifiableMap(new LinkedHashMap<>(bySeverity));
            this.recent = List.copyOf(recent);
        }

        @JsonProperty("total_open")
        public int getTotalOpen() {
            return totalOpen;
        }

        /**
         * @return open-alert counts keyed by severity wire name
         */
        @JsonProperty("by_severity")
        public Map<String, Integer> getBySeverity() {
            return bySeverity;
        }

        /**
         * @return newest alerts in the window regardless of status
         */
        @JsonProperty("recent")
        public List<Alert> getRecent() {
            return recent;
        }
    }
}
