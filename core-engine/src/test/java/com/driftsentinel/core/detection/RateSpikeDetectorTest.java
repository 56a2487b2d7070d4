package com.driftsentinel.core.detection;

import com.driftsentinel.core.config.MonitoringConfig;
import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.AlertSeverity;
import com.driftsentinel.core.model.AlertType;
import com.driftsentinel.core.model.BaselineSnapshot;
import com.driftsentinel.core.model.MetricSnapshot;
import com.driftsentinel.core.model.ThresholdConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RateSpikeDetector}.
 */
class RateSpikeDetectorTest {

    private RateSpikeDetector fallback;
    private RateSpikeDetector error;
    private RateSpikeDetector duplicate;

    @BeforeEach
    void setUp() {
        MonitoringConfig config = MonitoringConfig.defaults();
        fallback = DetectorFactory.fallbackSpike(config);
        error = DetectorFactory.errorSpike(config);
        duplicate = DetectorFactory.duplicateSpike(config);
    }

    @Test
    @DisplayName("Should raise a critical fallback alert at four times the baseline")
    void shouldRaiseCriticalFallbackSpike() {
        MetricSnapshot today = Snapshots.calmDay().fallbackRate(0.08).build();

        Optional<Alert> alert = fallback.evaluate(today, Snapshots.baseline().build());

        assertThat(alert).isPresent();
        Alert a = alert.get();
        assertThat(a.getAlertType()).isEqualTo(AlertType.FALLBACK_SPIKE);
        assertThat(a.getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
        assertThat(a.getMetricName()).isEqualTo("fallback_rate");
        assertThat(a.getDeviationRatio()).isEqualTo(4.0);
        assertThat(a.getCurrentValue()).isEqualTo(0.08);
        assertThat(a.getBaselineValue()).isEqualTo(0.02);
        assertThat(a.getMetricDate()).isEqualTo(Snapshots.DAY);
        assertThat(a.getComparisonWindowDays()).isEqualTo(7);
        assertThat(a.getThresholds()).isEqualTo(ThresholdConfig.DEFAULT);
        assertThat(a.getContext())
                .containsEntry("absolute_increase", 0.06)
                .containsEntry("current_percentage", 8.0)
                .containsEntry("baseline_percentage", 2.0);
    }

    @Test
    @DisplayName("Should map each threshold tier to its severity")
    void shouldMapTiers() {
        BaselineSnapshot baseline = Snapshots.baseline().errorRate(0.1).build();

        assertThat(error.evaluate(Snapshots.calmDay().errorRate(0.14).build(), baseline)).isEmpty();
        assertThat(error.evaluate(Snapshots.calmDay().errorRate(0.15).build(), baseline))
                .map(Alert::getSeverity).contains(AlertSeverity.MEDIUM);
        assertThat(error.evaluate(Snapshots.calmDay().errorRate(0.2).build(), baseline))
                .map(Alert::getSeverity).contains(AlertSeverity.HIGH);
        assertThat(error.evaluate(Snapshots.calmDay().errorRate(0.3).build(), baseline))
                .map(Alert::getSeverity).contains(AlertSeverity.CRITICAL);
    }

    @Test
    @DisplayName("Should only report percentages for the fallback rate")
    void shouldOnlyReportPercentagesForFallback() {
        Alert alert = error.evaluate(Snapshots.calmDay().errorRate(0.05).build(),
                Snapshots.baseline().build()).orElseThrow();

        assertThat(alert.getContext()).containsOnlyKeys("absolute_increase");
        assertThat(alert.getContext()).containsEntry("absolute_increase", 0.04);
    }

    @Test
    @DisplayName("Should raise a critical alert with infinite deviation above the floor on a zero baseline")
    void shouldFireAboveFloorOnZeroBaseline() {
        BaselineSnapshot zero = Snapshots.baseline().errorRate(0).build();

        Alert alert = error.evaluate(Snapshots.calmDay().errorRate(0.02).build(), zero).orElseThrow();

        assertThat(alert.getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
        assertThat(alert.getDeviationRatio()).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(alert.isBaselineZero()).isTrue();
        assertThat(alert.getBaselineValue()).isZero();
    }

    @Test
    @DisplayName("Should stay silent at or below the floor on a zero baseline")
    void shouldStaySilentAtFloorOnZeroBaseline() {
        BaselineSnapshot zero = Snapshots.baseline().errorRate(0).duplicateRate(0).build();

        assertThat(error.evaluate(Snapshots.calmDay().errorRate(0.005).build(), zero)).isEmpty();
        assertThat(error.evaluate(Snapshots.calmDay().errorRate(0.01).build(), zero)).isEmpty();
        // duplicate floor is 0.05
        assertThat(duplicate.evaluate(Snapshots.calmDay().duplicateRate(0.04).build(), zero)).isEmpty();
        assertThat(duplicate.evaluate(Snapshots.calmDay().duplicateRate(0.06).build(), zero)).isPresent();
    }

    @Test
    @DisplayName("Should treat a rate exactly at its floor as no alert")
    void shouldNotFireExactlyAtFloor() {
        BaselineSnapshot zero = Snapshots.baseline().fallbackRate(0).errorRate(0).duplicateRate(0).build();

        assertThat(fallback.evaluate(Snapshots.calmDay().fallbackRate(0.01).build(), zero)).isEmpty();
        assertThat(fallback.evaluate(Snapshots.calmDay().fallbackRate(0.0101).build(), zero)).isPresent();
        assertThat(duplicate.evaluate(Snapshots.calmDay().duplicateRate(0.05).build(), zero)).isEmpty();
        assertThat(duplicate.evaluate(Snapshots.calmDay().duplicateRate(0.0501).build(), zero)).isPresent();
    }

    @Test
    @DisplayName("Should not fire when the rate falls")
    void shouldNotFireOnDecrease() {
        assertThat(fallback.evaluate(Snapshots.calmDay().fallbackRate(0.001).build(),
                Snapshots.baseline().build())).isEmpty();
    }

    @Test
    @DisplayName("Should reject a negative floor")
    void shouldRejectNegativeFloor() {
        assertThatThrownBy(() -> new RateSpikeDetector(AlertType.ERROR_SPIKE, "error_rate", -0.1,
                MetricSnapshot::getErrorRate, BaselineSnapshot::getErrorRate, ThresholdConfig.DEFAULT, false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("zeroBaselineFloor");
    }
}
