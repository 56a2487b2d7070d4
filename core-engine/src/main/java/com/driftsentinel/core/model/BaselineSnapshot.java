package com.driftsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Rolling-window reference values that current metrics are compared against.
 *
 * <p>
 * Baselines are maintained by an external job and looked up by
 * {@link #getBaselineName()}. {@code validUntil} is carried through as an
 * expiry hint; nothing in the detection path enforces it.
 * </p>
 *
 * <h3>Validation</h3>
 * <p>
 * {@link Builder#build()} rejects negative rates or latencies and a
 * non-positive window, so a malformed row never reaches the detectors.
 * </p>
 *
 * @since 1.0.0
 */
public final class BaselineSnapshot implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Name of the baseline the detector reads when none is configured. */
    public static final String DEFAULT_NAME = "7day_rolling";

    private final String baselineName;
    private final int windowDays;
    private final double fallbackRate;
    private final double errorRate;
    private final double duplicateRate;
    private final double latencyP50;
    private final double latencyP95;
    private final double latencyP99;
    private final String validUntil;

    private BaselineSnapshot(Builder b) {
        this.baselineName = b.baselineName;
        this.windowDays = b.windowDays;
        this.fallbackRate = b.fallbackRate;
        this.errorRate = b.errorRate;
        this.duplicateRate = b.duplicateRate;
        this.latencyP50 = b.latencyP50;
        this.latencyP95 = b.latencyP95;
        this.latencyP99 = b.latencyP99;
        this.validUntil = b.validUntil;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baselineName;
        private int windowDays = 7;
        private double fallbackRate;
        private double errorRate;
        private double duplicateRate;
        private double latencyP50;
        private double latencyP95;
        private double latencyP99;
        private String validUntil;

        public Builder baselineName(String v) {
            this.baselineName = v;
            return this;
        }

        public Builder windowDays(int v) {
            this.windowDays = v;
            return this;
        }

        public Builder fallbackRate(double v) {
            this.fallbackRate = v;
            return this;
        }

        public Builder errorRate(double v) {
            this.errorRate = v;
            return this;
        }

        public Builder duplicateRate(double v) {
            this.duplicateRate = v;
            return this;
        }

        public Builder latencyP50(double v) {
            this.latencyP50 = v;
            return this;
        }

        public Builder latencyP95(double v) {
            this.latencyP95 = v;
            return this;
        }

        public Builder latencyP99(double v) {
            this.latencyP99 = v;
            return this;
        }

        public Builder validUntil(String v) {
            this.validUntil = v;
            return this;
        }

        /**
         * Build and validate the baseline.
         *
         * @return a new {@link BaselineSnapshot}
         * @throws NullPointerException     if {@code baselineName} is {@code null}
         * @throws IllegalArgumentException if the window is not positive or any
         *                                  rate or latency is negative
         */
        public BaselineSnapshot build() {
            Objects.requireNonNull(baselineName, "baselineName must not be null");
            List<String> errors = new ArrayList<>();
            if (windowDays <= 0) {
                errors.add("windowDays must be > 0, got: " + windowDays);
            }
            requireNonNegative(errors, "fallbackRate", fallbackRate);
            requireNonNegative(errors, "errorRate", errorRate);
            requireNonNegative(errors, "duplicateRate", duplicateRate);
            requireNonNegative(errors, "latencyP50", latencyP50);
            requireNonNegative(errors, "latencyP95", latencyP95);
            requireNonNegative(errors, "latencyP99", latencyP99);
            if (!errors.isEmpty()) {
                throw new IllegalArgumentException(
                        "Invalid baseline '" + baselineName + "': " + String.join("; ", errors));
            }
            return new BaselineSnapshot(this);
        }

        private static void requireNonNegative(List<String> errors, String name, double value) {
            if (Double.isNaN(value) || value < 0) {
                errors.add(name + " must be >= 0, got: " + value);
            }
        }
    }

    @JsonProperty("baseline_name")
    public String getBaselineName() {
        return baselineName;
    }

    @JsonProperty("window_days")
    public int getWindowDays() {
        return windowDays;
    }

    @JsonProperty("fallback_rate")
    public double getFallbackRate() {
        return fallbackRate;
    }

    @JsonProperty("error_rate")
    public double getErrorRate() {
        return errorRate;
    }

    @JsonProperty("duplicate_rate")
    public double getDuplicateRate() {
        return duplicateRate;
    }

    @JsonProperty("latency_p50")
    public double getLatencyP50() {
        return latencyP50;
    }

    @JsonProperty("latency_p95")
    public double getLatencyP95() {
        return latencyP95;
    }

    @JsonProperty("latency_p99")
    public double getLatencyP99() {
        return latencyP99;
    }

    /**
     * @return expiry hint as stored, or {@code null}
     */
    @JsonProperty("valid_until")
    public String getValidUntil() {
        return validUntil;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BaselineSnapshot that))
            return false;
        return windowDays == that.windowDays
                && Double.compare(fallbackRate, that.fallbackRate) == 0
                && Double.compare(errorRate, that.errorRate) == 0
                && Double.compare(duplicateRate, that.duplicateRate) == 0
                && Double.compare(latencyP50, that.latencyP50) == 0
                && Double.compare(latencyP95, that.latencyP95) == 0
                && Double.compare(latencyP99, that.latencyP99) == 0
                && baselineName.equals(that.baselineName)
                && Objects.equals(validUntil, that.validUntil);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baselineName, windowDays, fallbackRate, errorRate, duplicateRate, latencyP95);
    }

    @Override
    public String toString() {
        return "BaselineSnapshot{" +
                "baselineName='" + baselineName + '\'' +
                ", windowDays=" + windowDays +
                ", fallbackRate=" + fallbackRate +
                ", errorRate=" + errorRate +
                ", duplicateRate=" + duplicateRate +
                ", latencyP95=" + latencyP95 +
                ", validUntil='" + validUntil + '\'' +
                '}';
    }
}
