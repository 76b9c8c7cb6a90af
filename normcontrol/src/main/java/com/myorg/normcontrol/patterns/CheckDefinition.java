package com.myorg.normcontrol.patterns;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.List;

/**
 * Declarative form of a rule predicate. Which attributes matter depends on {@code type}:
 * <ul>
 *   <li>{@code contains_any}, {@code contains_all}: {@code keywords}, or {@code keyword_set} naming a library list</li>
 *   <li>{@code matches}: {@code pattern}</li>
 *   <li>{@code well_formed}: {@code candidate_pattern} and {@code pattern}</li>
 *   <li>{@code stamp_present}: nothing</li>
 *   <li>{@code stamp_field}, {@code project_field}: {@code field}</li>
 *   <li>{@code project_field_format}: {@code field} and {@code pattern}; holds when the field is absent</li>
 *   <li>{@code conditional}: {@code keywords} (trigger) and {@code checks} (first entry)</li>
 *   <li>{@code any_of}: {@code checks}</li>
 *   <li>{@code role_present}: {@code role}</li>
 *   <li>{@code sheet_numbering}: nothing</li>
 *   <li>{@code min_length}: {@code min_length}</li>
 * </ul>
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CheckDefinition {

    @JsonProperty("type")
    private String type;

    @JsonProperty("keywords")
    private List<String> keywords;

    @JsonProperty("keyword_set")
    private String keywordSet;

    @JsonProperty("pattern")
    private String pattern;

    @JsonProperty("candidate_pattern")
    private String candidatePattern;

    @JsonProperty("field")
    private String field;

    @JsonProperty("role")
    private String role;

    @JsonProperty("min_length")
    private Integer minLength;

    @JsonProperty("checks")
    private List<CheckDefinition> checks;

    public List<String> getKeywords() {
        return keywords == null ? List.of() : List.copyOf(keywords);
    }

    public List<CheckDefinition> getChecks() {
        return checks == null ? List.of() : List.copyOf(checks);
    }
}
