package com.myorg.normcontrol.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Logical role of a page inside a project document. Sections reuse the same values.
 */
public enum PageRole {
    TITLE("title"),
    GENERAL_DATA("general_data"),
    DRAWING("drawing"),
    SPECIFICATION("specification"),
    DETAILS("details"),
    MAIN_CONTENT("main_content"),
    // only for pages whose text could not be extracted at all
    UNKNOWN("unknown");

    private final String value;

    PageRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static PageRole fromValue(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Page role must not be null");
        }
        String key = raw.trim().toLowerCase(Locale.ROOT);
        for (PageRole role : values()) {
            if (role.value.equals(key)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown page role: " + raw);
    }
}
