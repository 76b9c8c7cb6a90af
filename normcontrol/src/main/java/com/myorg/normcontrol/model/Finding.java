package com.myorg.normcontrol.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.myorg.normcontrol.patterns.RuleTarget;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * One compliance observation produced by a rule. A finding without a page number is document-level.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Finding {

    @JsonProperty("rule_id")
    private String ruleId;

    @JsonProperty("category")
    private String category;

    @JsonProperty("severity")
    private Severity severity;

    @JsonProperty("target")
    private RuleTarget target;

    @JsonProperty("title")
    private String title;

    @JsonProperty("description")
    private String description;

    @JsonProperty("recommendation")
    private String recommendation;

    @JsonProperty("norm_reference")
    private String normReference;

    @JsonProperty("page_number")
    private Integer pageNumber;

    @JsonProperty("section_type")
    private PageRole sectionType;

    @JsonProperty("confidence")
    private double confidence;

    @JsonIgnore
    public boolean isDocumentLevel() {
        return pageNumber == null;
    }
}
