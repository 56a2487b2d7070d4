package com.driftsentinel.core.detection;

import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.AlertSeverity;
import com.driftsentinel.core.model.AlertType;
import com.driftsentinel.core.model.BaselineSnapshot;
import com.driftsentinel.core.model.MetricSnapshot;
import com.driftsentinel.core.model.ThresholdConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * p95 latency spike detector.
 *
 * <p>
 * Unlike {@link RateSpikeDetector}, a zero baseline p95 means the baseline has
 * no latency data yet, and the detector stays silent whatever the current
 * value.
 * </p>
 *
 * @since 1.0.0
 */
public class LatencySpikeDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(LatencySpikeDetector.class);

    static final String METRIC_NAME = "latency_p95";

    private final ThresholdConfig thresholds;

    public LatencySpikeDetector(ThresholdConfig thresholds) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds must not be null");
    }

    @Override
    public Optional<Alert> evaluate(MetricSnapshot current, BaselineSnapshot baseline) {
        Objects.requireNonNull(current, "current must not be null");
        Objects.requireNonNull(baseline, "baseline must not be null");

        if (baseline.getLatencyP95() == 0) {
            LOG.trace("Baseline p95 is zero, no latency data to compare against");
            return Optional.empty();
        }

        double deviation = Deviation.calculate(current.getLatencyP95(), baseline.getLatencyP95());
        Optional<AlertSeverity> severity = thresholds.getSeverity(deviation);
        if (severity.isEmpty()) {
            return Optional.empty();
        }

        LOG.debug("LATENCY_SPIKE fired: p95={}ms baseline={}ms deviation={}",
                current.getLatencyP95(), baseline.getLatencyP95(), deviation);

        return Optional.of(Alert.builder()
                .alertType(AlertType.LATENCY_SPIKE)
                .severity(severity.get())
                .metricName(METRIC_NAME)
                .currentValue(current.getLatencyP95())
                .baselineValue(baseline.getLatencyP95())
                .deviationRatio(deviation)
                .thresholds(thresholds)
                .metricDate(current.getMetricDate())
                .comparisonWindowDays(baseline.getWindowDays())
                .context("absolute_increase_ms",
                        Deviation.round(current.getLatencyP95() - baseline.getLatencyP95(), 2))
                .context("current_p50", current.getLatencyP50())
                .context("current_p99", current.getLatencyP99())
                .build());
    }

    @Override
    public AlertType getAlertType() {
        return AlertType.LATENCY_SPIKE;
    }
}
