package com.driftsentinel.core.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Deviation}.
 */
class DeviationTest {

    @Test
    @DisplayName("Should divide current by baseline and round to four places")
    void shouldDivideAndRound() {
        assertThat(Deviation.calculate(0.08, 0.02)).isEqualTo(4.0);
        assertThat(Deviation.calculate(1, 3)).isEqualTo(0.3333);
        assertThat(Deviation.calculate(250, 100)).isEqualTo(2.5);
    }

    @Test
    @DisplayName("Should return infinity for a positive value over a zero baseline")
    void shouldReturnInfinityForZeroBaseline() {
        assertThat(Deviation.calculate(0.05, 0)).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(Deviation.calculate(0.05, 0)).isEqualTo(Deviation.BASELINE_ZERO);
    }

    @Test
    @DisplayName("Should return 1.0 when both values are zero")
    void shouldReturnOneForZeroOverZero() {
        assertThat(Deviation.calculate(0, 0)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should clamp a negative current value to zero")
    void shouldClampNegativeCurrent() {
        assertThat(Deviation.calculate(-0.5, 0.1)).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Should reject a negative baseline")
    void shouldRejectNegativeBaseline() {
        assertThatThrownBy(() -> Deviation.calculate(1, -0.1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("baseline");
    }

    @Test
    @DisplayName("Should round half-even and pass non-finite values through")
    void shouldRoundHalfEven() {
        assertThat(Deviation.round(0.12345, 4)).isEqualTo(0.1234);
        assertThat(Deviation.round(0.12355, 4)).isEqualTo(0.1236);
        assertThat(Deviation.round(Double.POSITIVE_INFINITY, 4)).isEqualTo(Double.POSITIVE_INFINITY);
    }
}
