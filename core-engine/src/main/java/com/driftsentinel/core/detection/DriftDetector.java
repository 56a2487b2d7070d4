package com.driftsentinel.core.detection;

import com.driftsentinel.core.config.MonitoringConfig;
import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.BaselineSnapshot;
import com.driftsentinel.core.model.MetricSnapshot;
import com.driftsentinel.core.model.ThresholdConfig;
import com.driftsentinel.core.source.AlertSink;
import com.driftsentinel.core.source.MalformedRecordException;
import com.driftsentinel.core.source.MetricSource;
import com.driftsentinel.core.source.MonitoringStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Detects drift and regression by comparing one day's metrics with a rolling
 * baseline.
 *
 * <h3>Algorithm</h3>
 * <ol>
 * <li>Fetch the day's {@link MetricSnapshot} and the configured
 * {@link BaselineSnapshot}.</li>
 * <li>Run every detector from {@link DetectorFactory#createAll(MonitoringConfig)}
 * against the pair.</li>
 * <li>Optionally persist each resulting {@link Alert} through the
 * {@link AlertSink}.</li>
 * </ol>
 *
 * <h3>Failure handling</h3>
 * <p>
 * Intended to run unattended. Missing rows, store failures and malformed
 * baselines are logged and degrade to "no alerts"; a failed write is reported
 * per alert as {@code saved=false}. {@link #checkAndAlert(LocalDate, boolean)}
 * never throws for either.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Instances hold only immutable configuration and may be shared, provided
 * the source and sink are thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class DriftDetector {

    private static final Logger LOG = LoggerFactory.getLogger(DriftDetector.class);

    private final MetricSource metricSource;
    private final AlertSink alertSink;
    private final Clock clock;

    private final String baselineName;
    private final ThresholdConfig thresholds;

    private final RateSpikeDetector fallbackDetector;
    private final RateSpikeDetector errorDetector;
    private final LatencySpikeDetector latencyDetector;
    private final RateSpikeDetector duplicateDetector;
    private final HealthDeclineDetector healthDetector;

    // Full pass for detectAllDrifts; the typed fields above back the single-metric checks.
    private final List<AnomalyDetector> detectors;

    public DriftDetector(MetricSource metricSource, AlertSink alertSink) {
        this(metricSource, alertSink, MonitoringConfig.defaults());
    }

    public DriftDetector(MetricSource metricSource, AlertSink alertSink, MonitoringConfig config) {
        this(metricSource, alertSink, config, Clock.systemUTC());
    }

    /**
     * @param metricSource source of daily metrics and baselines
     * @param alertSink    destination for detected alerts
     * @param config       validated on construction
     * @param clock        supplies "today" when no date is given
     * @throws IllegalStateException if {@code config} is invalid
     */
    public DriftDetector(MetricSource metricSource, AlertSink alertSink, MonitoringConfig config, Clock clock) {
        this.metricSource = Objects.requireNonNull(metricSource, "metricSource must not be null");
        this.alertSink = Objects.requireNonNull(alertSink, "alertSink must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        Objects.requireNonNull(config, "config must not be null").validate();

        this.baselineName = config.getBaselineName();
        this.thresholds = config.toThresholdConfig();
        this.fallbackDetector = DetectorFactory.fallbackSpike(config);
        this.errorDetector = DetectorFactory.errorSpike(config);
        this.latencyDetector = DetectorFactory.latencySpike(config);
        this.duplicateDetector = DetectorFactory.duplicateSpike(config);
        this.healthDetector = DetectorFactory.healthDecline(config);
        this.detectors = DetectorFactory.createAll(config);
    }

    // ---------------------------------------------------------------
    // Data access
    // ---------------------------------------------------------------

    /**
     * Fetch the metrics for {@code date}, or for today (UTC) when {@code null}.
     *
     * @return the snapshot, or empty if missing or unreadable
     */
    public Optional<MetricSnapshot> getCurrentMetrics(LocalDate date) {
        LocalDate target = date != null ? date : today();
        try {
            Optional<MetricSnapshot> snapshot = metricSource.fetchMetric(target);
            if (snapshot.isEmpty()) {
                LOG.warn("No metrics found for date: {}", target);
            }
            return snapshot;
        } catch (MonitoringStoreException e) {
            LOG.error("Failed to fetch current metrics for {}: {}", target, e.getMessage(), e);
            return Optional.empty();
        }
    }

    /**
     * Fetch the configured baseline.
     */
    public Optional<BaselineSnapshot> getBaseline() {
        return getBaseline(baselineName);
    }

    /**
     * Fetch a named baseline.
     *
     * @return the baseline, or empty if missing, unreadable or malformed
     */
    public Optional<BaselineSnapshot> getBaseline(String name) {
        Objects.requireNonNull(name, "baseline name must not be null");
        try {
            Optional<BaselineSnapshot> baseline = metricSource.fetchBaseline(name);
            if (baseline.isEmpty()) {
                LOG.warn("No baseline found: {}", name);
            }
            return baseline;
        } catch (MalformedRecordException e) {
            LOG.error("Rejected malformed baseline '{}': {}", name, e.getMessage());
            return Optional.empty();
        } catch (MonitoringStoreException e) {
            LOG.error("Failed to fetch baseline '{}': {}", name, e.getMessage(), e);
            return Optional.empty();
        }
    }

    // ---------------------------------------------------------------
    // Detection
    // ---------------------------------------------------------------

    /**
     * @see Deviation#calculate(double, double)
     */
    public double calculateDeviation(double current, double baseline) {
        return Deviation.calculate(current, baseline);
    }

    public Optional<Alert> detectFallbackSpike(MetricSnapshot current, BaselineSnapshot baseline) {
        return fallbackDetector.evaluate(current, baseline);
    }

    public Optional<Alert> detectErrorSpike(MetricSnapshot current, BaselineSnapshot baseline) {
        return errorDetector.evaluate(current, baseline);
    }

    public Optional<Alert> detectLatencySpike(MetricSnapshot current, BaselineSnapshot baseline) {
        return latencyDetector.evaluate(current, baseline);
    }

    public Optional<Alert> detectDuplicateSpike(MetricSnapshot current, BaselineSnapshot baseline) {
        return duplicateDetector.evaluate(current, baseline);
    }

    public Optional<Alert> detectHealthDecline(MetricSnapshot current, BaselineSnapshot baseline) {
        return healthDetector.evaluate(current, baseline);
    }

    /**
     * Run every detector for {@code date} (today when {@code null}).
     *
     * @return alerts in detector order: fallback, error, latency, duplicate,
     *         health; empty if the metrics or the baseline are unavailable
     */
    public List<Alert> detectAllDrifts(LocalDate date) {
        Optional<MetricSnapshot> current = getCurrentMetrics(date);
        if (current.isEmpty()) {
            LOG.warn("No current metrics available for drift detection");
            return List.of();
        }
        Optional<BaselineSnapshot> baseline = getBaseline();
        if (baseline.isEmpty()) {
            LOG.warn("No baseline available for drift detection");
            return List.of();
        }

        List<Alert> alerts = new ArrayList<>();
        for (AnomalyDetector detector : detectors) {
            try {
                detector.evaluate(current.get(), baseline.get()).ifPresent(alerts::add);
            } catch (RuntimeException e) {
                LOG.error("Detector [{}] threw an exception, continuing with next detector",
                        detector.getAlertType(), e);
            }
        }
        return alerts;
    }

    // ---------------------------------------------------------------
    // Persistence
    // ---------------------------------------------------------------

    /**
     * Persist an alert.
     *
     * @return the store-assigned id, or empty if the write failed or the store
     *         returned no id
     */
    public Optional<String> saveAlert(Alert alert) {
        Objects.requireNonNull(alert, "alert must not be null");
        try {
            Optional<String> id = alertSink.write(alert);
            if (id.isEmpty()) {
                LOG.warn("Alert store returned no id for {} alert", alert.getAlertType());
            }
            return id;
        } catch (MonitoringStoreException e) {
            LOG.error("Failed to save {} alert: {}", alert.getAlertType(), e.getMessage(), e);
            return Optional.empty();
        }
    }

    // ---------------------------------------------------------------
    // Entry point
    // ---------------------------------------------------------------

    /**
     * Check today's metrics and save every alert.
     */
    public DriftCheckResult checkAndAlert() {
        return checkAndAlert(null, true);
    }

    /**
     * Check for drift and optionally save the alerts.
     *
     * @param date     day to check, today (UTC) when {@code null}
     * @param autoSave whether to persist each alert
     * @return counts and per-alert details; never {@code null}
     */
    public DriftCheckResult checkAndAlert(LocalDate date, boolean autoSave) {
        LocalDate metricDate = date != null ? date : today();
        List<Alert> alerts = detectAllDrifts(metricDate);

        DriftCheckResult result = new DriftCheckResult(metricDate);
        int saved = 0;
        for (Alert alert : alerts) {
            if (!autoSave) {
                result.add(DriftCheckResult.Entry.unsaved(alert));
                continue;
            }
            Optional<String> id = saveAlert(alert);
            if (id.isPresent()) {
                result.add(DriftCheckResult.Entry.saved(alert, id.get()));
                saved++;
            } else {
                result.add(DriftCheckResult.Entry.saveFailed(alert));
            }
        }

        if (autoSave) {
            LOG.info("Drift check for {}: {} alert(s) detected, {} saved", metricDate, alerts.size(), saved);
        } else {
            LOG.info("Drift check for {}: {} alert(s) detected", metricDate, alerts.size());
        }
        return result;
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public ThresholdConfig getThresholds() {
        return thresholds;
    }

    public String getBaselineName() {
        return baselineName;
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }
}
