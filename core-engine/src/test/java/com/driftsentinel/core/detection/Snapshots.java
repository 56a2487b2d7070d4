package com.driftsentinel.core.detection;

import com.driftsentinel.core.model.BaselineSnapshot;
import com.driftsentinel.core.model.MetricSnapshot;

import java.time.LocalDate;

/**
 * Snapshot builders pre-filled with a calm day and a matching baseline.
 */
final class Snapshots {

    static final LocalDate DAY = LocalDate.of(2024, 5, 1);

    private Snapshots() {
    }

    static MetricSnapshot.Builder calmDay() {
        return MetricSnapshot.builder()
                .metricDate(DAY)
                .totalEvents(1000)
                .successfulEvents(970)
                .failedEvents(10)
                .fallbackEvents(20)
                .duplicateEvents(5)
                .fallbackRate(0.02)
                .errorRate(0.01)
                .duplicateRate(0.005)
                .latencyP50(400)
                .latencyP95(1000)
                .latencyP99(1500)
                .healthScore(95);
    }

    static BaselineSnapshot.Builder baseline() {
        return BaselineSnapshot.builder()
                .baselineName(BaselineSnapshot.DEFAULT_NAME)
                .windowDays(7)
                .fallbackRate(0.02)
                .errorRate(0.01)
                .duplicateRate(0.005)
                .latencyP50(400)
                .latencyP95(1000)
                .latencyP99(1500);
    }
}
