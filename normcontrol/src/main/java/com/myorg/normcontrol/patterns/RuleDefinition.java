package com.myorg.normcontrol.patterns;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.myorg.normcontrol.model.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.List;

/**
 * One compliance rule as stored in the pattern library. Severity is fixed per rule.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RuleDefinition {

    @JsonProperty("id")
    private String id;

    @JsonProperty("category")
    private String category;

    @JsonProperty("target")
    private RuleTarget target;

    /**
     * Page roles (for page rules) or section types (for section rules) the rule applies to.
     * Empty means every role.
     */
    @JsonProperty("applies_to")
    private List<String> appliesTo;

    @JsonProperty("severity")
    private Severity severity;

    @JsonProperty("title")
    private String title;

    @JsonProperty("description")
    private String description;

    @JsonProperty("recommendation")
    private String recommendation;

    @JsonProperty("norm_reference")
    private String normReference;

    @JsonProperty("check")
    private CheckDefinition check;

    public List<String> getAppliesTo() {
        return appliesTo == null ? List.of() : List.copyOf(appliesTo);
    }
}
