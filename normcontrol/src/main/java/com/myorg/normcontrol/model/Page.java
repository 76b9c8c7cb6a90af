package com.myorg.normcontrol.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * One unit of extracted document text. The pipeline never mutates a page; classification
 * produces a new instance through {@link #toBuilder()}.
 */
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = "rawText")
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Page {

    @JsonProperty("page_number")
    private int pageNumber;

    /**
     * May be empty. {@code null} when the extraction service could not read the page.
     */
    @JsonProperty("raw_text")
    private String rawText;

    @JsonProperty("classified_role")
    private PageRole classifiedRole;

    @JsonProperty("confidence")
    private double confidence;

    // only set for drawing pages
    @JsonProperty("stamp")
    private StampInfo stamp;

    public static Page of(PageText pageText) {
        return Page.builder()
                .pageNumber(pageText.pageNumber())
                .rawText(pageText.text())
                .build();
    }

    @JsonIgnore
    public String getTextOrEmpty() {
        return rawText == null ? "" : rawText;
    }

    @JsonIgnore
    public boolean isClassified() {
        return classifiedRole != null;
    }
}
