package com.driftsentinel.core.summary;

import com.driftsentinel.core.config.MonitoringConfig;
import com.driftsentinel.core.detection.Deviation;
import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.AlertSeverity;
import com.driftsentinel.core.model.AlertStatus;
import com.driftsentinel.core.model.BaselineSnapshot;
import com.driftsentinel.core.model.MetricSnapshot;
import com.driftsentinel.core.source.AlertQuery;
import com.driftsentinel.core.source.AlertSink;
import com.driftsentinel.core.source.MetricSource;
import com.driftsentinel.core.source.MonitoringStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds dashboard summaries and filtered alert listings.
 *
 * <p>
 * Each of the three reads behind {@link #getSummary(int)} (metrics, alerts,
 * baseline) degrades independently to an empty result when the store fails,
 * so a partial summary is returned rather than none.
 * </p>
 *
 * @since 1.0.0
 */
public class MonitoringSummary {

    private static final Logger LOG = LoggerFactory.getLogger(MonitoringSummary.class);

    public static final int DEFAULT_ALERT_LIMIT = 50;

    private final MetricSource metricSource;
    private final AlertSink alertSink;
    private final Clock clock;

    private final String baselineName;
    private final int defaultWindowDays;
    private final int recentAlertCount;
    private final TrendAnalyzer trendAnalyzer;

    public MonitoringSummary(MetricSource metricSource, AlertSink alertSink) {
        this(metricSource, alertSink, MonitoringConfig.defaults());
    }

    public MonitoringSummary(MetricSource metricSource, AlertSink alertSink, MonitoringConfig config) {
        this(metricSource, alertSink, config, Clock.systemUTC());
    }

    public MonitoringSummary(MetricSource metricSource, AlertSink alertSink, MonitoringConfig config,
            Clock clock) {
        this.metricSource = Objects.requireNonNull(metricSource, "metricSource must not be null");
        this.alertSink = Objects.requireNonNull(alertSink, "alertSink must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        Objects.requireNonNull(config, "config must not be null").validate();

        this.baselineName = config.getBaselineName();
        this.defaultWindowDays = config.getSummaryWindowDays();
        this.recentAlertCount = config.getRecentAlertCount();
        this.trendAnalyzer = new TrendAnalyzer(TrendAnalyzer.DEFAULT_PERIOD, config.getTrendTolerance());
    }

    // ---------------------------------------------------------------
    // Summary
    // ---------------------------------------------------------------

    /**
     * Summary over the configured default window.
     */
    public SummaryReport getSummary() {
        return getSummary(defaultWindowDays);
    }

    /**
     * Summarise the last {@code windowDays} days (plus today).
     *
     * <p>
     * A negative window covers no days: the metrics and alerts sections come
     * back empty and only the baseline is read.
     * </p>
     *
     * @param windowDays how far back to look; {@code 0} means today only
     * @return the summary; never {@code null}
     */
    public SummaryReport getSummary(int windowDays) {
        Instant now = clock.instant();
        LocalDate endDate = LocalDate.now(clock);

        LocalDate startDate;
        List<MetricSnapshot> metrics;
        List<Alert> alerts;
        if (windowDays < 0) {
            LOG.warn("Negative summary window ({} days), returning an empty window", windowDays);
            startDate = endDate;
            metrics = List.of();
            alerts = List.of();
        } else {
            startDate = endDate.minusDays(windowDays);
            metrics = fetchMetrics(startDate);
            alerts = fetchWindowAlerts(startDate);
        }
        BaselineSnapshot baseline = fetchBaseline();

        SummaryReport report = new SummaryReport(
                new SummaryReport.Window(startDate, endDate, metrics.size()),
                summariseMetrics(metrics),
                SummaryReport.Baseline.of(baseline),
                new SummaryReport.Trends(
                        trendAnalyzer.classify(metrics, MetricSnapshot::getFallbackRate),
                        trendAnalyzer.classify(metrics, MetricSnapshot::getLatencyP95)),
                summariseAlerts(alerts),
                now);

        LOG.info("Built monitoring summary: {}", report);
        return report;
    }

    private SummaryReport.Metrics summariseMetrics(List<MetricSnapshot> metrics) {
        long totalEvents = 0;
        double fallback = 0;
        double error = 0;
        double health = 0;
        for (MetricSnapshot m : metrics) {
            totalEvents += m.getTotalEvents();
            fallback += m.getFallbackRate();
            error += m.getErrorRate();
            health += m.getHealthScore();
        }
        int n = Math.max(metrics.size(), 1);
        return new SummaryReport.Metrics(
                totalEvents,
                Deviation.round(fallback / n, 4),
                Deviation.round(error / n, 4),
                Deviation.round(health / n, 2),
                metrics.isEmpty() ? null : metrics.get(0));
    }

    private SummaryReport.Alerts summariseAlerts(List<Alert> alerts) {
        int totalOpen = 0;
        Map<String, Integer> bySeverity = new LinkedHashMap<>();
        for (Alert alert : alerts) {
            if (alert.getStatus() == AlertStatus.OPEN) {
                totalOpen++;
                bySeverity.merge(alert.getSeverity().getValue(), 1, Integer::sum);
            }
        }
        List<Alert> recent = alerts.subList(0, Math.min(recentAlertCount, alerts.size()));
        return new SummaryReport.Alerts(totalOpen, bySeverity, recent);
    }

    // ---------------------------------------------------------------
    // Alert listing
    // ---------------------------------------------------------------

    /**
     * Open alerts of medium severity or above, at most
     * {@value #DEFAULT_ALERT_LIMIT}.
     */
    public List<Alert> getAlerts() {
        return getAlerts(AlertSeverity.MEDIUM, AlertStatus.OPEN, DEFAULT_ALERT_LIMIT);
    }

    /**
     * Wire-name variant of {@link #getAlerts(AlertSeverity, AlertStatus, int)}.
     * An unrecognised threshold falls back to {@code medium}; an unrecognised
     * status matches nothing and yields an empty list.
     */
    public List<Alert> getAlerts(String threshold, String status, int limit) {
        AlertSeverity minimum = AlertSeverity.fromValue(threshold).orElseGet(() -> {
            LOG.warn("Unknown severity threshold '{}', using medium", threshold);
            return AlertSeverity.MEDIUM;
        });
        Optional<AlertStatus> alertStatus = AlertStatus.fromValue(status);
        if (alertStatus.isEmpty()) {
            LOG.warn("Unknown alert status '{}', no alerts listed", status);
            return List.of();
        }
        return getAlerts(minimum, alertStatus.get(), limit);
    }

    /**
     * List stored alerts at or above a severity.
     *
     * <p>
     * The store is asked for up to {@code 2 × limit} alerts with the given
     * status, newest first (capped at {@link Integer#MAX_VALUE}); those below
     * {@code threshold} are dropped and the rest returned in store order, at
     * most {@code limit}.
     * </p>
     *
     * @param threshold minimum severity
     * @param status    status filter
     * @param limit     maximum number of alerts; below 1 nothing is listed
     * @return matching alerts; empty if the store could not be read
     */
    public List<Alert> getAlerts(AlertSeverity threshold, AlertStatus status, int limit) {
        Objects.requireNonNull(threshold, "threshold must not be null");
        Objects.requireNonNull(status, "status must not be null");
        if (limit < 1) {
            LOG.warn("Alert limit must be >= 1, got {}; no alerts listed", limit);
            return List.of();
        }

        List<Alert> candidates;
        try {
            candidates = alertSink.fetchAlerts(AlertQuery.builder()
                    .status(status)
                    .limit((int) Math.min(2L * limit, Integer.MAX_VALUE))
                    .build());
        } catch (MonitoringStoreException e) {
            LOG.error("Failed to fetch alerts: {}", e.getMessage(), e);
            return List.of();
        }

        List<Alert> filtered = new ArrayList<>();
        for (Alert alert : candidates) {
            if (alert.getSeverity().isAtLeast(threshold)) {
                filtered.add(alert);
                if (filtered.size() >= limit) {
                    break;
                }
            }
        }
        return filtered;
    }

    // ---------------------------------------------------------------
    // Store reads
    // ---------------------------------------------------------------

    private List<MetricSnapshot> fetchMetrics(LocalDate since) {
        try {
            return metricSource.fetchMetricsSince(since);
        } catch (MonitoringStoreException e) {
            LOG.error("Failed to fetch metrics since {}: {}", since, e.getMessage(), e);
            return List.of();
        }
    }

    private List<Alert> fetchWindowAlerts(LocalDate since) {
        try {
            return alertSink.fetchAlerts(AlertQuery.builder().since(since).build());
        } catch (MonitoringStoreException e) {
            LOG.error("Failed to fetch alerts since {}: {}", since, e.getMessage(), e);
            return List.of();
        }
    }

    private BaselineSnapshot fetchBaseline() {
        try {
            return metricSource.fetchBaseline(baselineName).orElse(null);
        } catch (MonitoringStoreException e) {
            LOG.error("Failed to fetch baseline '{}': {}", baselineName, e.getMessage(), e);
            return null;
        }
    }
}
