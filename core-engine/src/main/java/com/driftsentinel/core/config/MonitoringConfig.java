package com.driftsentinel.core.config;

import com.driftsentinel.core.model.BaselineSnapshot;
import com.driftsentinel.core.model.ThresholdConfig;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the monitoring YAML configuration.
 *
 * <p>
 * Expected YAML structure (every key is optional; the values shown are the
 * defaults):
 * </p>
 *
 * <pre>
 * baselineName: 7day_rolling
 * thresholds:
 *   low: 1.5
 *   medium: 2.0
 *   high: 3.0
 * fallbackFloor: 0.01
 * errorFloor: 0.01
 * duplicateFloor: 0.05
 * healthyScore: 80
 * criticalHealthScore: 50
 * summaryWindowDays: 7
 * trendTolerance: 0.1
 * recentAlertCount: 5
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify every value.
 * </p>
 *
 * @since 1.0.0
 */
public class MonitoringConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Baseline row compared against by the drift detector and summary. */
    private String baselineName = BaselineSnapshot.DEFAULT_NAME;

    private Thresholds thresholds = new Thresholds();

    // --- Zero-baseline floors for the rate detectors ---
    private double fallbackFloor = 0.01;
    private double errorFloor = 0.01;
    private double duplicateFloor = 0.05;

    // --- Health bands ---
    /** Scores at or above this never alert. */
    private double healthyScore = 80;

    /** Scores below this raise a critical alert. */
    private double criticalHealthScore = 50;

    // --- Summary ---
    private int summaryWindowDays = 7;

    /** Relative change between trend periods treated as noise. */
    private double trendTolerance = 0.1;

    private int recentAlertCount = 5;

    /**
     * @return a configuration holding only defaults
     */
    public static MonitoringConfig defaults() {
        return new MonitoringConfig();
    }

    /**
     * Validate every value, collecting all errors into a single exception.
     *
     * @throws IllegalStateException if one or more values are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (baselineName == null || baselineName.isBlank()) {
            errors.add("'baselineName' is required");
        }
        if (thresholds == null) {
            errors.add("'thresholds' must not be null");
        } else {
            try {
                thresholds.toThresholdConfig();
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }
        requireFloor(errors, "fallbackFloor", fallbackFloor);
        requireFloor(errors, "errorFloor", errorFloor);
        requireFloor(errors, "duplicateFloor", duplicateFloor);

        if (criticalHealthScore < 0 || healthyScore > 100 || criticalHealthScore > healthyScore) {
            errors.add("Health bands must satisfy 0 <= criticalHealthScore <= healthyScore <= 100, got: "
                    + criticalHealthScore + ", " + healthyScore);
        }
        if (summaryWindowDays < 1) {
            errors.add("'summaryWindowDays' must be >= 1, got: " + summaryWindowDays);
        }
        if (trendTolerance < 0 || trendTolerance >= 1) {
            errors.add("'trendTolerance' must be in [0, 1), got: " + trendTolerance);
        }
        if (recentAlertCount < 0) {
            errors.add("'recentAlertCount' must be >= 0, got: " + recentAlertCount);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Monitoring configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    private static void requireFloor(List<String> errors, String name, double value) {
        if (value < 0 || value >= 1) {
            errors.add("'" + name + "' must be in [0, 1), got: " + value);
        }
    }

    /**
     * @return immutable thresholds built from {@link #getThresholds()}
     * @throws IllegalArgumentException if the tiers are not ascending
     */
    public ThresholdConfig toThresholdConfig() {
        return thresholds.toThresholdConfig();
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required by SnakeYAML)
    // ---------------------------------------------------------------

    public String getBaselineName() {
        return baselineName;
    }

    public void setBaselineName(String baselineName) {
        this.baselineName = baselineName;
    }

    public Thresholds getThresholds() {
        return thresholds;
    }

    public void setThresholds(Thresholds thresholds) {
        this.thresholds = thresholds;
    }

    public double getFallbackFloor() {
        return fallbackFloor;
    }

    public void setFallbackFloor(double fallbackFloor) {
        this.fallbackFloor = fallbackFloor;
    }

    public double getErrorFloor() {
        return errorFloor;
    }

    public void setErrorFloor(double errorFloor) {
        this.errorFloor = errorFloor;
    }

    public double getDuplicateFloor() {
        return duplicateFloor;
    }

    public void setDuplicateFloor(double duplicateFloor) {
        this.duplicateFloor = duplicateFloor;
    }

    public double getHealthyScore() {
        return healthyScore;
    }

    public void setHealthyScore(double healthyScore) {
        this.healthyScore = healthyScore;
    }

    public double getCriticalHealthScore() {
        return criticalHealthScore;
    }

    public void setCriticalHealthScore(double criticalHealthScore) {
        this.criticalHealthScore = criticalHealthScore;
    }

    public int getSummaryWindowDays() {
        return summaryWindowDays;
    }

    public void setSummaryWindowDays(int summaryWindowDays) {
        this.summaryWindowDays = summaryWindowDays;
    }

    public double getTrendTolerance() {
        return trendTolerance;
    }

    public void setTrendTolerance(double trendTolerance) {
        this.trendTolerance = trendTolerance;
    }

    public int getRecentAlertCount() {
        return recentAlertCount;
    }

    public void setRecentAlertCount(int recentAlertCount) {
        this.recentAlertCount = recentAlertCount;
    }

    @Override
    public String toString() {
        return "MonitoringConfig{" +
                "baselineName='" + baselineName + '\'' +
                ", thresholds=" + thresholds +
                ", fallbackFloor=" + fallbackFloor +
                ", errorFloor=" + errorFloor +
                ", duplicateFloor=" + duplicateFloor +
                ", healthyScore=" + healthyScore +
                ", criticalHealthScore=" + criticalHealthScore +
                ", summaryWindowDays=" + summaryWindowDays +
                ", trendTolerance=" + trendTolerance +
                ", recentAlertCount=" + recentAlertCount +
                '}';
    }

    /**
     * Mutable YAML view of {@link ThresholdConfig}.
     */
    public static class Thresholds implements Serializable {

        private static final long serialVersionUID = 1L;

        private double low = ThresholdConfig.DEFAULT.getLow();
        private double medium = ThresholdConfig.DEFAULT.getMedium();
        private double high = ThresholdConfig.DEFAULT.getHigh();

        public ThresholdConfig toThresholdConfig() {
            return new ThresholdConfig(low, medium, high);
        }

        public double getLow() {
            return low;
        }

        public void setLow(double low) {
            this.low = low;
        }

        public double getMedium() {
            return medium;
        }

        public void setMedium(double medium) {
            this.medium = medium;
        }

        public double getHigh() {
            return high;
        }

        public void setHigh(double high) {
            this.high = high;
        }

        @Override
        public String toString() {
            return "{low=" + low + ", medium=" + medium + ", high=" + high + '}';
        }
    }
}
