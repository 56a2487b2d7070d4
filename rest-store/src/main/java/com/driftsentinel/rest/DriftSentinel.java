package com.driftsentinel.rest;

import com.driftsentinel.core.config.MonitoringConfig;
import com.driftsentinel.core.config.MonitoringConfigLoader;
import com.driftsentinel.core.detection.DriftDetector;
import com.driftsentinel.core.summary.MonitoringSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the detection and summary services to a PostgREST store.
 *
 * <pre>{@code
 * DriftDetector detector = DriftSentinel.createDetector(StoreConfig.fromEnvironment());
 * DriftCheckResult result = detector.checkAndAlert();
 * }</pre>
 *
 * @since 1.0.0
 */
public final class DriftSentinel {

    private static final Logger LOG = LoggerFactory.getLogger(DriftSentinel.class);

    private DriftSentinel() {
    }

    /**
     * Create a detector using the monitoring configuration found by
     * {@link MonitoringConfigLoader#load()}.
     */
    public static DriftDetector createDetector(StoreConfig storeConfig) {
        return createDetector(storeConfig, MonitoringConfigLoader.load());
    }

    public static DriftDetector createDetector(StoreConfig storeConfig, MonitoringConfig monitoringConfig) {
        LOG.info("Creating drift detector against {}", storeConfig);
        return new DriftDetector(new PostgrestMetricSource(storeConfig),
                new PostgrestAlertSink(storeConfig), monitoringConfig);
    }

    /**
     * Create a summary service using the monitoring configuration found by
     * {@link MonitoringConfigLoader#load()}.
     */
    public static MonitoringSummary createSummary(StoreConfig storeConfig) {
        return createSummary(storeConfig, MonitoringConfigLoader.load());
    }

    public static MonitoringSummary createSummary(StoreConfig storeConfig, MonitoringConfig monitoringConfig) {
        LOG.info("Creating monitoring summary against {}", storeConfig);
        return new MonitoringSummary(new PostgrestMetricSource(storeConfig),
                new PostgrestAlertSink(storeConfig), monitoringConfig);
    }
}
