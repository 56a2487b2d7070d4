package com.driftsentinel.core.detection;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Deviation-ratio arithmetic shared by the detectors.
 *
 * @since 1.0.0
 */
public final class Deviation {

    /** Ratio reported when the baseline was zero and the current value was not. */
    public static final double BASELINE_ZERO = Double.POSITIVE_INFINITY;

    private Deviation() {
        // utility class
    }

    /**
     * Ratio of {@code current} to {@code baseline}.
     *
     * <ul>
     * <li>{@code baseline == 0} and {@code current > 0} &rarr; {@link #BASELINE_ZERO}</li>
     * <li>{@code baseline == 0} and {@code current <= 0} &rarr; {@code 1.0}</li>
     * <li>negative {@code current} is clamped to zero</li>
     * <li>otherwise {@code current / baseline}, rounded to 4 places</li>
     * </ul>
     *
     * @param current  observed value
     * @param baseline reference value, must be {@code >= 0}
     * @return a ratio {@code >= 0}, or positive infinity
     * @throws IllegalArgumentException if {@code baseline} is negative or NaN
     */
    public static double calculate(double current, double baseline) {
        if (Double.isNaN(baseline) || baseline < 0) {
            throw new IllegalArgumentException("baseline must be >= 0, got: " + baseline);
        }
        if (baseline == 0) {
            return current > 0 ? BASELINE_ZERO : 1.0;
        }
        double clamped = current < 0 ? 0 : current;
        return round(clamped / baseline, 4);
    }

    /**
     * Round half-even to {@code scale} decimal places. Non-finite values are
     * returned unchanged.
     *
     * @param value value to round
     * @param scale number of decimal places
     * @return rounded value
     */
    public static double round(double value, int scale) {
        if (!Double.isFinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_EVEN).doubleValue();
    }
}
