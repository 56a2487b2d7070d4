package com.driftsentinel.core.detection;

import com.driftsentinel.core.config.MonitoringConfig;
import com.driftsentinel.core.model.AlertType;
import com.driftsentinel.core.model.BaselineSnapshot;
import com.driftsentinel.core.model.MetricSnapshot;
import com.driftsentinel.core.model.ThresholdConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Factory that creates the built-in {@link AnomalyDetector} instances from a
 * {@link MonitoringConfig}.
 *
 * <p>
 * This is the single point of extension when adding a new detector:
 * create it here and append it to {@link #createAll(MonitoringConfig)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class
    }

    public static RateSpikeDetector fallbackSpike(MonitoringConfig config) {
        return new RateSpikeDetector(AlertType.FALLBACK_SPIKE, "fallback_rate",
                config.getFallbackFloor(),
                MetricSnapshot::getFallbackRate, BaselineSnapshot::getFallbackRate,
                config.toThresholdConfig(), true);
    }

    public static RateSpikeDetector errorSpike(MonitoringConfig config) {
        return new RateSpikeDetector(AlertType.ERROR_SPIKE, "error_rate",
                config.getErrorFloor(),
                MetricSnapshot::getErrorRate, BaselineSnapshot::getErrorRate,
                config.toThresholdConfig(), false);
    }

    public static LatencySpikeDetector latencySpike(MonitoringConfig config) {
        return new LatencySpikeDetector(config.toThresholdConfig());
    }

    public static RateSpikeDetector duplicateSpike(MonitoringConfig config) {
        return new RateSpikeDetector(AlertType.DUPLICATE_SPIKE, "duplicate_rate",
                config.getDuplicateFloor(),
                MetricSnapshot::getDuplicateRate, BaselineSnapshot::getDuplicateRate,
                config.toThresholdConfig(), false);
    }

    public static HealthDeclineDetector healthDecline(MonitoringConfig config) {
        ThresholdConfig thresholds = config.toThresholdConfig();
        return new HealthDeclineDetector(thresholds, config.getHealthyScore(), config.getCriticalHealthScore());
    }

    /**
     * Create all built-in detectors in evaluation order: fallback, error,
     * latency, duplicate, health.
     *
     * @param config monitoring configuration; must not be {@code null}
     * @return unmodifiable list of detectors
     */
    public static List<AnomalyDetector> createAll(MonitoringConfig config) {
        Objects.requireNonNull(config, "MonitoringConfig must not be null");
        List<AnomalyDetector> detectors = List.of(
                fallbackSpike(config),
                errorSpike(config),
                latencySpike(config),
                duplicateSpike(config),
                healthDecline(config));
        LOG.debug("Created {} detector(s) with thresholds {}", detectors.size(), config.getThresholds());
        return detectors;
    }
}
