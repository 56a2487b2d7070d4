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
 * Health-score decline detector.
 *
 * <p>
 * Not ratio based: the score is compared against an ideal of 100. Scores
 * below the critical band raise a {@code CRITICAL} alert whose deviation is
 * the fraction of health lost. Scores between the critical and healthy
 * bands raise nothing.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthDeclineDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(HealthDeclineDetector.class);

    static final String METRIC_NAME = "health_score";
    static final double IDEAL_SCORE = 100.0;

    private final ThresholdConfig thresholds;
    private final double healthyScore;
    private final double criticalScore;

    /**
     * @param thresholds    tiers recorded on the alert for reference
     * @param healthyScore  scores at or above this are never reported
     * @param criticalScore scores below this are reported as critical
     * @throws IllegalArgumentException if {@code criticalScore > healthyScore}
     */
    public HealthDeclineDetector(ThresholdConfig thresholds, double healthyScore, double criticalScore) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds must not be null");
        if (criticalScore > healthyScore) {
            throw new IllegalArgumentException("criticalScore must be <= healthyScore, got: "
                    + criticalScore + " > " + healthyScore);
        }
        this.healthyScore = healthyScore;
        this.criticalScore = criticalScore;
    }

    @Override
    public Optional<Alert> evaluate(MetricSnapshot current, BaselineSnapshot baseline) {
        Objects.requireNonNull(current, "current must not be null");
        Objects.requireNonNull(baseline, "baseline must not be null");

        double score = current.getHealthScore();
        if (score >= healthyScore) {
            return Optional.empty();
        }
        if (score >= criticalScore) {
            // TODO: decide on a warning tier for the band between critical and healthy
            LOG.trace("Health score {} below healthy band but above critical, no alert", score);
            return Optional.empty();
        }

        double deviation = Deviation.round((IDEAL_SCORE - score) / IDEAL_SCORE, 4);
        LOG.debug("HEALTH_DECLINE fired: score={} deviation={}", score, deviation);

        return Optional.of(Alert.builder()
                .alertType(AlertType.HEALTH_DECLINE)
                .severity(AlertSeverity.CRITICAL)
                .metricName(METRIC_NAME)
                .currentValue(score)
                .baselineValue(IDEAL_SCORE)
                .deviationRatio(deviation)
                .thresholds(thresholds)
                .metricDate(current.getMetricDate())
                .comparisonWindowDays(baseline.getWindowDays())
                .context("health_category", "critical")
                .build());
    }

    @Override
    public AlertType getAlertType() {
        return AlertType.HEALTH_DECLINE;
    }
}
