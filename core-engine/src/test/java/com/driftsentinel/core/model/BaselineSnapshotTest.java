package com.driftsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link BaselineSnapshot}.
 */
class BaselineSnapshotTest {

    @Test
    @DisplayName("Should default the window to seven days")
    void shouldDefaultWindow() {
        BaselineSnapshot baseline = BaselineSnapshot.builder()
                .baselineName(BaselineSnapshot.DEFAULT_NAME)
                .fallbackRate(0.02)
                .build();

        assertThat(baseline.getWindowDays()).isEqualTo(7);
        assertThat(baseline.getBaselineName()).isEqualTo("7day_rolling");
        assertThat(baseline.getValidUntil()).isNull();
    }

    @Test
    @DisplayName("Should reject negative rates and report every problem at once")
    void shouldRejectNegativeValues() {
        assertThatThrownBy(() -> BaselineSnapshot.builder()
                .baselineName("broken")
                .fallbackRate(-0.1)
                .latencyP95(-5)
                .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("broken")
                .hasMessageContaining("fallbackRate")
                .hasMessageContaining("latencyP95");
    }

    @Test
    @DisplayName("Should reject a non-positive window")
    void shouldRejectNonPositiveWindow() {
        assertThatThrownBy(() -> BaselineSnapshot.builder().baselineName("b").windowDays(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("windowDays");
    }
}
