package com.myorg.normcontrol.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.List;
import java.util.Map;

/**
 * Final output of one analysis run.
 */
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ComplianceReport {

    @JsonProperty("document_id")
    private String documentId;

    @JsonProperty("pattern_library_version")
    private String patternLibraryVersion;

    @JsonProperty("total_pages")
    private int totalPages;

    @JsonProperty("pages")
    private List<PageSummary> pages;

    @JsonProperty("metadata")
    private DocumentMetadata metadata;

    @JsonProperty("sections")
    private List<Section> sections;

    @JsonProperty("findings")
    private List<Finding> findings;

    // keyed by severity value, highest severity first
    @JsonProperty("severity_counts")
    private Map<String, Integer> severityCounts;

    @JsonProperty("total_findings")
    private int totalFindings;

    @JsonProperty("compliant_pages")
    private int compliantPages;

    @JsonProperty("compliance_percentage")
    private double compliancePercentage;

    @JsonProperty("compliance_score")
    private double complianceScore;

    @JsonProperty("overall_status")
    private OverallStatus overallStatus;

    @JsonProperty("recommendations")
    private List<String> recommendations;

    @JsonProperty("execution_time_ms")
    private Long executionTimeMs;

    @JsonProperty("stage_timings")
    private Map<String, Long> stageTimings;

    public List<PageSummary> getPages() {
        return pages == null ? List.of() : List.copyOf(pages);
    }

    public List<Section> getSections() {
        return sections == null ? List.of() : List.copyOf(sections);
    }

    public List<Finding> getFindings() {
        return findings == null ? List.of() : List.copyOf(findings);
    }

    public Map<String, Integer> getSeverityCounts() {
        return severityCounts == null ? Map.of() : severityCounts;
    }

    public List<String> getRecommendations() {
        return recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    public int count(Severity severity) {
        return getSeverityCounts().getOrDefault(severity.getValue(), 0);
    }

    /**
     * Copy without wall-clock figures, for comparing two runs over the same input.
     */
    public ComplianceReport withoutTimings() {
        return toBuilder().executionTimeMs(null).stageTimings(null).build();
    }
}
