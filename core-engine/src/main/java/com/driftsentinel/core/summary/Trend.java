package com.driftsentinel.core.summary;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction of a metric between two consecutive reporting periods.
 *
 * @since 1.0.0
 */
public enum Trend {

    UP("up"),
    DOWN("down"),
    STABLE("stable"),

    /** Not enough data to compare two periods. */
    UNKNOWN("unknown");

    private final String value;

    Trend(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
