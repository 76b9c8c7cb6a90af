package com.myorg.normcontrol.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * One line of the analysis history index.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisHistoryEntry {

    @JsonProperty("document_id")
    private String documentId;

    // ISO-8601 instant
    @JsonProperty("analyzed_at")
    private String analyzedAt;

    @JsonProperty("pattern_library_version")
    private String patternLibraryVersion;

    @JsonProperty("total_pages")
    private int totalPages;

    @JsonProperty("overall_status")
    private OverallStatus overallStatus;

    @JsonProperty("compliance_score")
    private double complianceScore;

    @JsonProperty("total_findings")
    private int totalFindings;

    @JsonProperty("critical_findings")
    private int criticalFindings;

    public static AnalysisHistoryEntry of(ComplianceReport report, Instant analyzedAt) {
        return AnalysisHistoryEntry.builder()
                .documentId(report.getDocumentId())
                .analyzedAt(analyzedAt.toString())
                .patternLibraryVersion(report.getPatternLibraryVersion())
                .totalPages(report.getTotalPages())
                .overallStatus(report.getOverallStatus())
                .complianceScore(report.getComplianceScore())
                .totalFindings(report.getTotalFindings())
                .criticalFindings(report.count(Severity.CRITICAL))
                .build();
    }
}
