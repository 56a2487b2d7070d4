package com.driftsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Ordered alert severity levels.
 *
 * <p>
 * {@link #LOW} exists so that stored alerts and query thresholds can name it,
 * but no detector ever emits it.
 * </p>
 *
 * @since 1.0.0
 */
public enum AlertSeverity {

    LOW("low", 0),
    MEDIUM("medium", 1),
    HIGH("high", 2),
    CRITICAL("critical", 3);

    private final String value;
    private final int rank;

    AlertSeverity(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    /**
     * @return lowercase name used on the wire
     */
    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * @return ordering rank, {@code low=0} through {@code critical=3}
     */
    public int getRank() {
        return rank;
    }

    /**
     * @param other severity to compare against
     * @return {@code true} if this severity ranks at or above {@code other}
     */
    public boolean isAtLeast(AlertSeverity other) {
        return rank >= other.rank;
    }

    /**
     * Resolve a wire name, case-insensitively.
     *
     * @param value wire name, may be {@code null}
     * @return matching severity, or empty if unknown
     */
    public static Optional<AlertSeverity> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalised = value.trim().toLowerCase(Locale.ROOT);
        for (AlertSeverity severity : values()) {
            if (severity.value.equals(normalised)) {
                return Optional.of(severity);
            }
        }
        return Optional.empty();
    }
}
