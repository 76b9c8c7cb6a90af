package com.myorg.normcontrol.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Per-page line of the report; raw text is left out.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PageSummary {

    @JsonProperty("page_number")
    private int pageNumber;

    @JsonProperty("role")
    private PageRole role;

    @JsonProperty("confidence")
    private double confidence;

    @JsonProperty("has_stamp")
    private Boolean hasStamp;

    @JsonProperty("findings_count")
    private int findingsCount;

    public static PageSummary of(Page page, int findingsCount) {
        return PageSummary.builder()
                .pageNumber(page.getPageNumber())
                .role(page.getClassifiedRole())
                .confidence(page.getConfidence())
                .hasStamp(page.getStamp() == null ? null : page.getStamp().isHasStamp())
                .findingsCount(findingsCount)
                .build();
    }
}
