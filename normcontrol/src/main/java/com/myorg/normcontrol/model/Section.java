package com.myorg.normcontrol.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Contiguous run of pages sharing one role. {@code startPage} and {@code endPage} are inclusive.
 */
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(value = "pages_count", allowGetters = true)
public class Section {

    @JsonProperty("section_type")
    private PageRole sectionType;

    @JsonProperty("start_page")
    private int startPage;

    @JsonProperty("end_page")
    private int endPage;

    @JsonProperty("pages_count")
    public int getPagesCount() {
        return endPage - startPage + 1;
    }

    public boolean contains(int pageNumber) {
        return pageNumber >= startPage && pageNumber <= endPage;
    }
}
