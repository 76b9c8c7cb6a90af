package com.myorg.normcontrol.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One {@code (page_number, text)} pair as delivered by the text extraction service.
 * A {@code null} text means extraction failed for that page.
 */
public record PageText(
        @JsonProperty("page_number") int pageNumber,
        @JsonProperty("text") String text
) {
    @JsonCreator
    public PageText {
    }

    public static PageText of(int pageNumber, String text) {
        return new PageText(pageNumber, text);
    }
}
