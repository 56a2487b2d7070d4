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
import java.util.function.ToDoubleFunction;

/**
 * Rate-spike detector.
 *
 * <p>
 * Compares one rate metric (fallback, error or duplicate rate) against its
 * baseline counterpart and maps the ratio to a severity through the
 * configured {@link ThresholdConfig}.
 * </p>
 *
 * <h3>Zero baseline</h3>
 * <p>
 * A ratio against zero is undefined, so when the baseline rate is zero the
 * detector fires only if the current rate exceeds an absolute floor. The
 * alert then carries a deviation of {@link Deviation#BASELINE_ZERO}, which
 * always maps to {@code CRITICAL}.
 * </p>
 *
 * @since 1.0.0
 */
public class RateSpikeDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(RateSpikeDetector.class);

    private final AlertType alertType;
    private final String metricName;
    private final double zeroBaselineFloor;
    private final ToDoubleFunction<MetricSnapshot> currentRate;
    private final ToDoubleFunction<BaselineSnapshot> baselineRate;
    private final ThresholdConfig thresholds;
    private final boolean reportPercentages;

    /**
     * @param alertType         type stamped on emitted alerts
     * @param metricName        metric name stamped on emitted alerts
     * @param zeroBaselineFloor rate the current value must exceed when the
     *                          baseline is zero
     * @param currentRate       extracts the rate from a snapshot
     * @param baselineRate      extracts the rate from a baseline
     * @param thresholds        severity tiers
     * @param reportPercentages whether the context also carries the two rates
     *                          as percentages
     * @throws NullPointerException     if any reference argument is {@code null}
     * @throws IllegalArgumentException if {@code zeroBaselineFloor} is negative
     */
    public RateSpikeDetector(AlertType alertType,
            String metricName,
            double zeroBaselineFloor,
            ToDoubleFunction<MetricSnapshot> currentRate,
            ToDoubleFunction<BaselineSnapshot> baselineRate,
            ThresholdConfig thresholds,
            boolean reportPercentages) {
        this.alertType = Objects.requireNonNull(alertType, "alertType must not be null");
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.currentRate = Objects.requireNonNull(currentRate, "currentRate must not be null");
        this.baselineRate = Objects.requireNonNull(baselineRate, "baselineRate must not be null");
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds must not be null");
        this.reportPercentages = reportPercentages;
        if (zeroBaselineFloor < 0) {
            throw new IllegalArgumentException(
                    "zeroBaselineFloor must be >= 0 for " + metricName + ", got: " + zeroBaselineFloor);
        }
        this.zeroBaselineFloor = zeroBaselineFloor;
    }

    @Override
    public Optional<Alert> evaluate(MetricSnapshot current, BaselineSnapshot baseline) {
        Objects.requireNonNull(current, "current must not be null");
        Objects.requireNonNull(baseline, "baseline must not be null");

        double now = currentRate.applyAsDouble(current);
        double reference = baselineRate.applyAsDouble(baseline);

        double deviation;
        if (reference == 0) {
            if (now <= zeroBaselineFloor) {
                LOG.trace("{}: zero baseline and {} <= floor {}, skipping", metricName, now, zeroBaselineFloor);
                return Optional.empty();
            }
            deviation = Deviation.BASELINE_ZERO;
        } else {
            deviation = Deviation.calculate(now, reference);
        }

        Optional<AlertSeverity> severity = thresholds.getSeverity(deviation);
        if (severity.isEmpty()) {
            return Optional.empty();
        }

        LOG.debug("{} fired: current={} baseline={} deviation={} severity={}",
                alertType, now, reference, deviation, severity.get());

        Alert.Builder alert = Alert.builder()
                .alertType(alertType)
                .severity(severity.get())
                .metricName(metricName)
                .currentValue(now)
                .baselineValue(reference)
                .deviationRatio(deviation)
                .thresholds(thresholds)
                .metricDate(current.getMetricDate())
                .comparisonWindowDays(baseline.getWindowDays())
                .context("absolute_increase", Deviation.round(now - reference, 4));
        if (reportPercentages) {
            alert.context("current_percentage", Deviation.round(now * 100, 2))
                    .context("baseline_percentage", Deviation.round(reference * 100, 2));
        }
        return Optional.of(alert.build());
    }

    @Override
    public AlertType getAlertType() {
        return alertType;
    }

    public String getMetricName() {
        return metricName;
    }

    public double getZeroBaselineFloor() {
        return zeroBaselineFloor;
    }
}
