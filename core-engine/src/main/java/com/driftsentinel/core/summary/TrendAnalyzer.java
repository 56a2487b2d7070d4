package com.driftsentinel.core.summary;

import java.util.List;
import java.util.Objects;
import java.util.function.ToDoubleFunction;

/**
 * Classifies the direction of a metric by comparing the mean of the most
 * recent {@code period} days with the mean of the {@code period} days before
 * them.
 *
 * <p>
 * With the default period of 3 and tolerance of 0.1: {@code up} if the recent
 * mean exceeds the previous mean by more than 10%, {@code down} if it is more
 * than 10% below, otherwise {@code stable}. Fewer than {@code 2 × period}
 * rows yield {@code unknown}.
 * </p>
 *
 * @since 1.0.0
 */
public final class TrendAnalyzer {

    public static final int DEFAULT_PERIOD = 3;
    public static final double DEFAULT_TOLERANCE = 0.1;

    private final int period;
    private final double tolerance;

    public TrendAnalyzer() {
        this(DEFAULT_PERIOD, DEFAULT_TOLERANCE);
    }

    /**
     * @param period    days per comparison period, {@code >= 1}
     * @param tolerance relative change treated as noise, in {@code [0, 1)}
     */
    public TrendAnalyzer(int period, double tolerance) {
        if (period < 1) {
            throw new IllegalArgumentException("period must be >= 1, got: " + period);
        }
        if (tolerance < 0 || tolerance >= 1) {
            throw new IllegalArgumentException("tolerance must be in [0, 1), got: " + tolerance);
        }
        this.period = period;
        this.tolerance = tolerance;
    }

    /**
     * @param rows   observations ordered newest first
     * @param metric extracts the value to compare
     * @return the trend of {@code metric} across the two newest periods
     */
    public <T> Trend classify(List<T> rows, ToDoubleFunction<T> metric) {
        Objects.requireNonNull(rows, "rows must not be null");
        Objects.requireNonNull(metric, "metric must not be null");
        if (rows.size() < 2 * period) {
            return Trend.UNKNOWN;
        }

        double recent = mean(rows.subList(0, period), metric);
        double previous = mean(rows.subList(period, 2 * period), metric);

        if (recent > previous * (1 + tolerance)) {
            return Trend.UP;
        }
        if (recent < previous * (1 - tolerance)) {
            return Trend.DOWN;
        }
        return Trend.STABLE;
    }

    public int getPeriod() {
        return period;
    }

    private static <T> double mean(List<T> rows, ToDoubleFunction<T> metric) {
        double sum = 0;
        for (T row : rows) {
            sum += metric.applyAsDouble(row);
        }
        return sum / rows.size();
    }
}
