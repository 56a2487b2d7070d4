package com.driftsentinel.core.summary;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TrendAnalyzer}.
 */
class TrendAnalyzerTest {

    private final TrendAnalyzer analyzer = new TrendAnalyzer();

    @Test
    @DisplayName("Should report up when the recent mean is more than 10% higher")
    void shouldReportUp() {
        // newest first: recent mean 0.05, previous mean 0.02
        List<Double> rates = List.of(0.05, 0.05, 0.05, 0.02, 0.02, 0.02);

        assertThat(analyzer.classify(rates, Double::doubleValue)).isEqualTo(Trend.UP);
    }

    @Test
    @DisplayName("Should report down when the recent mean is more than 10% lower")
    void shouldReportDown() {
        List<Double> latencies = List.of(800.0, 800.0, 800.0, 1000.0, 1000.0, 1000.0);

        assertThat(analyzer.classify(latencies, Double::doubleValue)).isEqualTo(Trend.DOWN);
    }

    @Test
    @DisplayName("Should report stable within the tolerance band")
    void shouldReportStable() {
        List<Double> values = List.of(1.05, 1.0, 1.05, 1.0, 1.0, 1.0);

        assertThat(analyzer.classify(values, Double::doubleValue)).isEqualTo(Trend.STABLE);
    }

    @Test
    @DisplayName("Should report unknown with fewer than six rows")
    void shouldReportUnknown() {
        assertThat(analyzer.classify(List.of(1.0, 2.0, 3.0, 4.0, 5.0), Double::doubleValue))
                .isEqualTo(Trend.UNKNOWN);
        assertThat(analyzer.classify(List.<Double>of(), Double::doubleValue)).isEqualTo(Trend.UNKNOWN);
    }

    @Test
    @DisplayName("Should only look at the six newest rows")
    void shouldIgnoreOlderRows() {
        List<Double> values = List.of(1.0, 1.0, 1.0, 1.0, 1.0, 1.0, 50.0, 50.0);

        assertThat(analyzer.classify(values, Double::doubleValue)).isEqualTo(Trend.STABLE);
    }

    @Test
    @DisplayName("Should reject an invalid period")
    void shouldRejectInvalidPeriod() {
        assertThatThrownBy(() -> new TrendAnalyzer(0, 0.1)).isInstanceOf(IllegalArgumentException.class);
    }
}
