package com.driftsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable mapping from a deviation ratio to an {@link AlertSeverity}.
 *
 * <p>
 * Three ascending cut-offs define the tiers:
 * </p>
 * <ul>
 * <li>{@code ratio >= high} &rarr; {@link AlertSeverity#CRITICAL}</li>
 * <li>{@code medium <= ratio < high} &rarr; {@link AlertSeverity#HIGH}</li>
 * <li>{@code low <= ratio < medium} &rarr; {@link AlertSeverity#MEDIUM}</li>
 * <li>{@code ratio < low} &rarr; no alert</li>
 * </ul>
 *
 * <p>
 * Instances are immutable and may be shared between threads.
 * </p>
 *
 * @since 1.0.0
 */
public final class ThresholdConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Default tiers: 1.5x, 2x and 3x the baseline. */
    public static final ThresholdConfig DEFAULT = new ThresholdConfig(1.5, 2.0, 3.0);

    private final double low;
    private final double medium;
    private final double high;

    /**
     * @param low    lowest ratio that raises an alert
     * @param medium ratio at which severity becomes {@code HIGH}
     * @param high   ratio at which severity becomes {@code CRITICAL}
     * @throws IllegalArgumentException unless {@code 0 < low < medium < high}
     *                                  and all values are finite
     */
    public ThresholdConfig(double low, double medium, double high) {
        if (!Double.isFinite(low) || !Double.isFinite(medium) || !Double.isFinite(high)) {
            throw new IllegalArgumentException(
                    "Thresholds must be finite, got: " + low + ", " + medium + ", " + high);
        }
        if (low <= 0 || low >= medium || medium >= high) {
            throw new IllegalArgumentException(
                    "Thresholds must satisfy 0 < low < medium < high, got: "
                            + low + ", " + medium + ", " + high);
        }
        this.low = low;
        this.medium = medium;
        this.high = high;
    }

    /**
     * Map a deviation ratio to a severity.
     *
     * @param deviationRatio ratio of current to baseline, may be
     *                       {@link Double#POSITIVE_INFINITY}
     * @return severity, or empty when the ratio is below {@code low}
     */
    public Optional<AlertSeverity> getSeverity(double deviationRatio) {
        if (deviationRatio >= high) {
            return Optional.of(AlertSeverity.CRITICAL);
        }
        if (deviationRatio >= medium) {
            return Optional.of(AlertSeverity.HIGH);
        }
        if (deviationRatio >= low) {
            return Optional.of(AlertSeverity.MEDIUM);
        }
        return Optional.empty();
    }

    @JsonProperty("low")
    public double getLow() {
        return low;
    }

    @JsonProperty("medium")
    public double getMedium() {
        return medium;
    }

    @JsonProperty("high")
    public double getHigh() {
        return high;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ThresholdConfig that))
            return false;
        return Double.compare(low, that.low) == 0
                && Double.compare(medium, that.medium) == 0
                && Double.compare(high, that.high) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(low, medium, high);
    }

    @Override
    public String toString() {
        return "ThresholdConfig{low=" + low + ", medium=" + medium + ", high=" + high + '}';
    }
}
