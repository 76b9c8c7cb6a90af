package com.myorg.normcontrol.patterns;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serialized form of the pattern library, as read from JSON. Compiled into a {@link PatternLibrary}
 * before use.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(onlyExplicitlyIncluded = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class PatternLibraryDefinition {

    @ToString.Include
    @JsonProperty("version")
    private String version;

    @JsonProperty("role_priority")
    private List<String> rolePriority;

    @JsonProperty("keyword_sets")
    private Map<String, List<String>> keywordSets;

    @JsonProperty("stage_codes")
    private Map<String, String> stageCodes;

    @JsonProperty("stamp_indicators")
    private List<String> stampIndicators;

    @JsonProperty("stamp_fields")
    private List<FieldPatternDefinition> stampFields;

    @JsonProperty("project_code_patterns")
    private List<String> projectCodePatterns;

    @JsonProperty("project_field_weights")
    private Map<String, Double> projectFieldWeights;

    @JsonProperty("marks")
    private List<MarkProfile> marks;

    @JsonProperty("summary_recommendations")
    private Map<String, String> summaryRecommendations;

    @JsonProperty("rules")
    private List<RuleDefinition> rules;

    @JsonProperty("norm_rules")
    private List<RuleDefinition> normRules;

    /**
     * Rule ids from {@code norm_rules} per mark, mark/stage or generic key.
     */
    @JsonProperty("norm_rule_sets")
    private Map<String, List<String>> normRuleSets;

    public List<String> getRolePriority() {
        return rolePriority == null ? List.of() : List.copyOf(rolePriority);
    }

    public Map<String, List<String>> getKeywordSets() {
        return keywordSets == null ? Map.of() : new LinkedHashMap<>(keywordSets);
    }

    public Map<String, String> getStageCodes() {
        return stageCodes == null ? Map.of() : new LinkedHashMap<>(stageCodes);
    }

    public List<String> getStampIndicators() {
        return stampIndicators == null ? List.of() : List.copyOf(stampIndicators);
    }

    public List<FieldPatternDefinition> getStampFields() {
        return stampFields == null ? List.of() : List.copyOf(stampFields);
    }

    public List<String> getProjectCodePatterns() {
        return projectCodePatterns == null ? List.of() : List.copyOf(projectCodePatterns);
    }

    public Map<String, Double> getProjectFieldWeights() {
        return projectFieldWeights == null ? Map.of() : new LinkedHashMap<>(projectFieldWeights);
    }

    public List<MarkProfile> getMarks() {
        return marks == null ? List.of() : List.copyOf(marks);
    }

    public Map<String, String> getSummaryRecommendations() {
        return summaryRecommendations == null ? Map.of() : new LinkedHashMap<>(summaryRecommendations);
    }

    public List<RuleDefinition> getRules() {
        return rules == null ? List.of() : List.copyOf(rules);
    }

    public List<RuleDefinition> getNormRules() {
        return normRules == null ? List.of() : List.copyOf(normRules);
    }

    public Map<String, List<String>> getNormRuleSets() {
        return normRuleSets == null ? Map.of() : new LinkedHashMap<>(normRuleSets);
    }
}
