package com.myorg.normcontrol.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum OverallStatus {
    PASS("pass"),
    WARNING("warning"),
    FAIL("fail");

    private final String value;

    OverallStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
