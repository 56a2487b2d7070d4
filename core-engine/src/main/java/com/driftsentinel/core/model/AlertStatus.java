package com.driftsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Lifecycle status of a stored alert. Transitions are owned by the alert
 * store; detection only ever writes {@link #OPEN}.
 *
 * @since 1.0.0
 */
public enum AlertStatus {

    OPEN("open"),
    ACKNOWLEDGED("acknowledged"),
    RESOLVED("resolved"),
    IGNORED("ignored");

    private final String value;

    AlertStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<AlertStatus> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalised = value.trim().toLowerCase(Locale.ROOT);
        for (AlertStatus status : values()) {
            if (status.value.equals(normalised)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
