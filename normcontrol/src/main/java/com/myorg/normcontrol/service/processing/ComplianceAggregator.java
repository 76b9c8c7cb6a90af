package com.myorg.normcontrol.service.processing;

import com.myorg.normcontrol.config.ComplianceProperties;
import com.myorg.normcontrol.model.ComplianceReport;
import com.myorg.normcontrol.model.DocumentMetadata;
import com.myorg.normcontrol.model.Finding;
import com.myorg.normcontrol.model.OverallStatus;
import com.myorg.normcontrol.model.Page;
import com.myorg.normcontrol.model.PageSummary;
import com.myorg.normcontrol.model.Section;
import com.myorg.normcontrol.model.Severity;
import com.myorg.normcontrol.patterns.PatternLibrary;
import com.myorg.normcontrol.patterns.RuleTarget;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reduces the findings of a run into a {@link ComplianceReport}. Pure: no I/O, no clock.
 * <p>
 * Score is {@code 100} minus the sum of severity penalties, clamped to {@code [0, 100]}.
 * Status is {@code fail} exactly when a critical finding exists; otherwise {@code warning} when a
 * high or warning finding exists or the score is under the pass threshold; otherwise {@code pass}.
 */
public class ComplianceAggregator {

    private static final int MAX_RECOMMENDATIONS = 10;

    private final ComplianceProperties.Penalties penalties;
    private final double passThreshold;

    public ComplianceAggregator(ComplianceProperties.Penalties penalties, double passThreshold) {
        for (Severity severity : Severity.values()) {
            if (penalties.forSeverity(severity) < 0) {
                throw new IllegalArgumentException("Penalty for " + severity.getValue() + " must not be negative");
            }
        }
        if (passThreshold < 0 || passThreshold > 100) {
            throw new IllegalArgumentException("Pass threshold must be within [0, 100]: " + passThreshold);
        }
        this.penalties = penalties;
        this.passThreshold = passThreshold;
    }

    public ComplianceReport aggregate(String documentId,
                                      PatternLibrary library,
                                      List<Page> pages,
                                      DocumentMetadata metadata,
                                      List<Section> sections,
                                      List<Finding> findings) {
        Map<String, Integer> counts = severityCounts(findings);
        double score = score(findings);
        OverallStatus status = status(counts, score);

        Map<Integer, Integer> perPage = pageFindingCounts(findings);
        List<PageSummary> summaries = new ArrayList<>(pages.size());
        int compliantPages = 0;
        for (Page page : pages) {
            int n = perPage.getOrDefault(page.getPageNumber(), 0);
            if (n == 0) compliantPages++;
            summaries.add(PageSummary.of(page, n));
        }
        double percentage = pages.isEmpty() ? 100.0 : round1(compliantPages * 100.0 / pages.size());

        return ComplianceReport.builder()
                .documentId(documentId)
                .patternLibraryVersion(library.version())
                .totalPages(pages.size())
                .pages(summaries)
                .metadata(metadata)
                .sections(sections)
                .findings(findings)
                .severityCounts(counts)
                .totalFindings(findings.size())
                .compliantPages(compliantPages)
                .compliancePercentage(percentage)
                .complianceScore(score)
                .overallStatus(status)
                .recommendations(recommendations(findings, counts, score, library))
                .build();
    }

    public double score(Collection<Finding> findings) {
        long penalty = 0;
        for (Finding f : findings) {
            penalty += penalties.forSeverity(f.getSeverity());
        }
        return Math.max(0.0, Math.min(100.0, 100.0 - penalty));
    }

    public OverallStatus status(Map<String, Integer> counts, double score) {
        if (counts.getOrDefault(Severity.CRITICAL.getValue(), 0) > 0) {
            return OverallStatus.FAIL;
        }
        boolean hasWarnings = counts.getOrDefault(Severity.HIGH.getValue(), 0) > 0
                || counts.getOrDefault(Severity.WARNING.getValue(), 0) > 0;
        if (hasWarnings || score < passThreshold) {
            return OverallStatus.WARNING;
        }
        return OverallStatus.PASS;
    }

    /**
     * Counts per severity value, highest severity first, zero counts included.
     */
    public static Map<String, Integer> severityCounts(Collection<Finding> findings) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (int i = Severity.values().length - 1; i >= 0; i--) {
            counts.put(Severity.values()[i].getValue(), 0);
        }
        for (Finding f : findings) {
            counts.merge(f.getSeverity().getValue(), 1, Integer::sum);
        }
        return counts;
    }

    private static Map<Integer, Integer> pageFindingCounts(Collection<Finding> findings) {
        Map<Integer, Integer> perPage = new HashMap<>();
        for (Finding f : findings) {
            if (f.getTarget() == RuleTarget.PAGE && f.getPageNumber() != null) {
                perPage.merge(f.getPageNumber(), 1, Integer::sum);
            }
        }
        return perPage;
    }

    /**
     * Summary lines for each severity present, then distinct finding recommendations,
     * most severe first.
     */
    private List<String> recommendations(List<Finding> findings, Map<String, Integer> counts,
                                         double score, PatternLibrary library) {
        Set<String> out = new LinkedHashSet<>();
        if (counts.get(Severity.CRITICAL.getValue()) > 0) {
            library.summaryRecommendation("critical").ifPresent(out::add);
        }
        if (counts.get(Severity.HIGH.getValue()) > 0) {
            library.summaryRecommendation("high").ifPresent(out::add);
        }
        if (counts.get(Severity.WARNING.getValue()) > 0) {
            library.summaryRecommendation("warning").ifPresent(out::add);
        }
        if (score < passThreshold) {
            library.summaryRecommendation("low_score").ifPresent(out::add);
        }

        // stable sort keeps rule order within one severity
        findings.stream()
                .sorted(Comparator.comparing(Finding::getSeverity).reversed())
                .map(Finding::getRecommendation)
                .filter(r -> r != null && !r.isBlank())
                .forEach(r -> {
                    if (out.size() < MAX_RECOMMENDATIONS) out.add(r);
                });
        return List.copyOf(out);
    }

    private static double round1(double v) {
        return Math.round(v * 10.0) / 10.0;
    }
}
