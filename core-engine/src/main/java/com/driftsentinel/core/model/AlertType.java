package com.driftsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Kinds of anomaly an {@link Alert} can report.
 *
 * <p>
 * {@link #MODEL_DRIFT} is accepted from the alert store but has no built-in
 * detector.
 * </p>
 *
 * @since 1.0.0
 */
public enum AlertType {

    FALLBACK_SPIKE("fallback_spike"),
    ERROR_SPIKE("error_spike"),
    LATENCY_SPIKE("latency_spike"),
    DUPLICATE_SPIKE("duplicate_spike"),
    MODEL_DRIFT("model_drift"),
    HEALTH_DECLINE("health_decline");

    private final String value;

    AlertType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<AlertType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalised = value.trim().toLowerCase(Locale.ROOT);
        for (AlertType type : values()) {
            if (type.value.equals(normalised)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
