package com.driftsentinel.core.detection;

import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.AlertType;
import com.driftsentinel.core.model.BaselineSnapshot;
import com.driftsentinel.core.model.MetricSnapshot;

import java.util.Optional;

/**
 * Contract for all drift detectors.
 * <p>
 * Implementations are <strong>stateless</strong>: every call to
 * {@link #evaluate(MetricSnapshot, BaselineSnapshot)} depends only on its
 * arguments and the detector's immutable configuration, so one instance can
 * be shared across threads and runs.
 * </p>
 */
public interface AnomalyDetector {

    /**
     * Compare one day's metrics with the baseline.
     *
     * @param current  the day's aggregates
     * @param baseline the reference window
     * @return an {@link Alert} if the metric drifted far enough, empty otherwise
     */
    Optional<Alert> evaluate(MetricSnapshot current, BaselineSnapshot baseline);

    /**
     * @return the alert type this detector emits
     */
    AlertType getAlertType();
}
