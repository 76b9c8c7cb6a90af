package com.myorg.normcontrol.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Design stage a document set belongs to.
 */
public enum ProjectStage {
    WORKING("working", "Рабочая документация"),
    DESIGN("design", "Проектная документация"),
    SKETCH("sketch", "Эскизная документация");

    private final String value;
    private final String title;

    ProjectStage(String value, String title) {
        this.value = value;
        this.title = title;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getTitle() {
        return title;
    }

    @JsonCreator
    public static ProjectStage fromValue(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Project stage must not be null");
        }
        String key = raw.trim().toLowerCase(Locale.ROOT);
        for (ProjectStage stage : values()) {
            if (stage.value.equals(key) || stage.name().toLowerCase(Locale.ROOT).equals(key)) {
                return stage;
            }
        }
        throw new IllegalArgumentException("Unknown project stage: " + raw);
    }
}
