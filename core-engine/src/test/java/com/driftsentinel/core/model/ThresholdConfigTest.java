package com.driftsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ThresholdConfig}.
 */
class ThresholdConfigTest {

    private final ThresholdConfig thresholds = ThresholdConfig.DEFAULT;

    @Test
    @DisplayName("Should map ratios to severities at tier boundaries")
    void shouldMapBoundaries() {
        assertThat(thresholds.getSeverity(1.49)).isEmpty();
        assertThat(thresholds.getSeverity(1.5)).contains(AlertSeverity.MEDIUM);
        assertThat(thresholds.getSeverity(1.99)).contains(AlertSeverity.MEDIUM);
        assertThat(thresholds.getSeverity(2.0)).contains(AlertSeverity.HIGH);
        assertThat(thresholds.getSeverity(2.99)).contains(AlertSeverity.HIGH);
        assertThat(thresholds.getSeverity(3.0)).contains(AlertSeverity.CRITICAL);
    }

    @Test
    @DisplayName("Should map an infinite ratio to critical")
    void shouldMapInfinityToCritical() {
        assertThat(thresholds.getSeverity(Double.POSITIVE_INFINITY)).contains(AlertSeverity.CRITICAL);
    }

    @Test
    @DisplayName("Should never produce low severity")
    void shouldNeverProduceLow() {
        for (double ratio = 0; ratio < 10; ratio += 0.05) {
            assertThat(thresholds.getSeverity(ratio).orElse(AlertSeverity.MEDIUM)).isNotEqualTo(AlertSeverity.LOW);
        }
    }

    @Test
    @DisplayName("Should reject tiers that are not strictly ascending")
    void shouldRejectNonAscending() {
        assertThatThrownBy(() -> new ThresholdConfig(2.0, 2.0, 3.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("low < medium < high");
        assertThatThrownBy(() -> new ThresholdConfig(0, 1, 2))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ThresholdConfig(1, 2, Double.NaN))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("finite");
    }
}
