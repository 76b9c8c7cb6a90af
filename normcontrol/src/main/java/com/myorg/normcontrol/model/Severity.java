package com.myorg.normcontrol.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Finding severity. Declaration order is the total order used for sorting and scoring:
 * {@code INFO < WARNING < HIGH < CRITICAL}.
 */
public enum Severity {
    INFO("info"),
    WARNING("warning"),
    HIGH("high"),
    CRITICAL("critical");

    private final String value;

    Severity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    /**
     * Accepts the canonical names plus the {@code low} and {@code medium} aliases used by older rule sets.
     */
    @JsonCreator
    public static Severity fromValue(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Severity must not be null");
        }
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "info":
            case "low":
                return INFO;
            case "warning":
            case "medium":
                return WARNING;
            case "high":
                return HIGH;
            case "critical":
                return CRITICAL;
            default:
                throw new IllegalArgumentException("Unknown severity: " + raw);
        }
    }
}
