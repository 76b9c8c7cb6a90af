package com.myorg.normcontrol.patterns;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What a rule is evaluated against.
 */
public enum RuleTarget {
    PAGE("page"),
    SECTION("section"),
    DOCUMENT("document");

    private final String value;

    RuleTarget(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static RuleTarget fromValue(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Rule target must not be null");
        }
        String key = raw.trim().toLowerCase(Locale.ROOT);
        for (RuleTarget target : values()) {
            if (target.value.equals(key)) {
                return target;
            }
        }
        throw new IllegalArgumentException("Unknown rule target: " + raw);
    }
}
