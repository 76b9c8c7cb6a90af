package com.myorg.normcontrol.service.processing;

import com.myorg.normcontrol.Fixtures;
import com.myorg.normcontrol.config.ComplianceProperties;
import com.myorg.normcontrol.model.ComplianceReport;
import com.myorg.normcontrol.model.DocumentMetadata;
import com.myorg.normcontrol.model.Finding;
import com.myorg.normcontrol.model.OverallStatus;
import com.myorg.normcontrol.model.Page;
import com.myorg.normcontrol.model.PageRole;
import com.myorg.normcontrol.model.PageSummary;
import com.myorg.normcontrol.model.Section;
import com.myorg.normcontrol.model.Severity;
import com.myorg.normcontrol.patterns.RuleTarget;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class ComplianceAggregatorTest {

    private final ComplianceAggregator aggregator = new ComplianceAggregator(new ComplianceProperties.Penalties(), 80.0);

    private static Finding finding(Severity severity, Integer page) {
        return Finding.builder()
                .ruleId("rule_" + severity.getValue())
                .severity(severity)
                .target(page == null ? RuleTarget.DOCUMENT : RuleTarget.PAGE)
                .pageNumber(page)
                .recommendation("fix " + severity.getValue())
                .build();
    }

    private static List<Finding> repeat(Severity severity, int n) {
        List<Finding> out = new ArrayList<>();
        for (int i = 0; i < n; i++) out.add(finding(severity, null));
        return out;
    }

    private ComplianceReport aggregate(List<Page> pages, List<Finding> findings) {
        return aggregator.aggregate("doc", Fixtures.defaultLibrary(), pages, DocumentMetadata.empty(),
                List.<Section>of(), findings);
    }

    @Nested
    @DisplayName("score")
    class Score {

        @Test
        @DisplayName("starts at 100 and subtracts severity penalties")
        void penalties() {
            assertThat(aggregator.score(List.of())).isEqualTo(100.0);
            assertThat(aggregator.score(List.of(finding(Severity.CRITICAL, 1)))).isEqualTo(80.0);
            assertThat(aggregator.score(List.of(finding(Severity.HIGH, 1), finding(Severity.INFO, null))))
                    .isEqualTo(80.0);
        }

        @Test
        @DisplayName("never drops below zero")
        void clamped() {
            assertThat(aggregator.score(repeat(Severity.CRITICAL, 6))).isZero();
        }

        @Test
        @DisplayName("adding a finding never raises the score")
        void monotonic() {
            List<Finding> findings = new ArrayList<>();
            double previous = aggregator.score(findings);
            for (Severity s : List.of(Severity.INFO, Severity.CRITICAL, Severity.WARNING, Severity.HIGH, Severity.INFO)) {
                findings.add(finding(s, null));
                double current = aggregator.score(findings);
                assertThat(current).isLessThanOrEqualTo(previous);
                previous = current;
            }
        }

        @Test
        @DisplayName("zero penalties keep a perfect score")
        void zeroPenalties() {
            ComplianceProperties.Penalties none = new ComplianceProperties.Penalties();
            none.setCritical(0);
            none.setHigh(0);
            none.setWarning(0);
            none.setInfo(0);

            assertThat(new ComplianceAggregator(none, 80).score(repeat(Severity.CRITICAL, 3))).isEqualTo(100.0);
        }
    }

    @Nested
    @DisplayName("status")
    class Status {

        @Test
        @DisplayName("fails exactly when a critical finding exists")
        void critical() {
            assertThat(aggregate(List.of(), List.of(finding(Severity.CRITICAL, null))).getOverallStatus())
                    .isEqualTo(OverallStatus.FAIL);
        }

        @Test
        @DisplayName("a critical finding fails even when its penalty is zero")
        void criticalWithoutPenalty() {
            ComplianceProperties.Penalties penalties = new ComplianceProperties.Penalties();
            penalties.setCritical(0);
            ComplianceAggregator lenient = new ComplianceAggregator(penalties, 80);

            ComplianceReport report = lenient.aggregate("doc", Fixtures.defaultLibrary(), List.of(),
                    DocumentMetadata.empty(), List.of(), List.of(finding(Severity.CRITICAL, null)));

            assertThat(report.getComplianceScore()).isEqualTo(100.0);
            assertThat(report.getOverallStatus()).isEqualTo(OverallStatus.FAIL);
        }

        @Test
        @DisplayName("high and warning findings give a warning")
        void warnings() {
            assertThat(aggregate(List.of(), List.of(finding(Severity.HIGH, null))).getOverallStatus())
                    .isEqualTo(OverallStatus.WARNING);
            assertThat(aggregate(List.of(), List.of(finding(Severity.WARNING, null))).getOverallStatus())
                    .isEqualTo(OverallStatus.WARNING);
        }

        @Test
        @DisplayName("info findings pass until the score drops under the threshold")
        void infoOnly() {
            assertThat(aggregate(List.of(), repeat(Severity.INFO, 4)).getOverallStatus())
                    .isEqualTo(OverallStatus.PASS);
            assertThat(aggregate(List.of(), repeat(Severity.INFO, 5)).getOverallStatus())
                    .isEqualTo(OverallStatus.WARNING);
        }

        @Test
        @DisplayName("no findings pass")
        void clean() {
            assertThat(aggregate(List.of(), List.of()).getOverallStatus()).isEqualTo(OverallStatus.PASS);
        }
    }

    @Nested
    @DisplayName("report")
    class Report {

        private final List<Page> pages = List.of(
                Fixtures.page(1, PageRole.TITLE, ""),
                Fixtures.page(2, PageRole.DRAWING, ""),
                Fixtures.page(3, PageRole.DRAWING, ""));

        @Test
        @DisplayName("counts pages without page findings as compliant")
        void compliantPages() {
            ComplianceReport report = aggregate(pages, List.of(
                    finding(Severity.WARNING, 2), finding(Severity.INFO, 2), finding(Severity.HIGH, null)));

            assertThat(report.getTotalPages()).isEqualTo(3);
            assertThat(report.getCompliantPages()).isEqualTo(2);
            assertThat(report.getCompliancePercentage()).isEqualTo(66.7);
            assertThat(report.getPages()).extracting(PageSummary::getFindingsCount).containsExactly(0, 2, 0);
        }

        @Test
        @DisplayName("an empty document is fully compliant")
        void emptyDocument() {
            ComplianceReport report = aggregate(List.of(), List.of());

            assertThat(report.getCompliancePercentage()).isEqualTo(100.0);
            assertThat(report.getComplianceScore()).isEqualTo(100.0);
            assertThat(report.getRecommendations()).isEmpty();
        }

        @Test
        @DisplayName("lists every severity, highest first")
        void severityCounts() {
            ComplianceReport report = aggregate(pages, List.of(finding(Severity.INFO, 1), finding(Severity.INFO, 3)));

            assertThat(report.getSeverityCounts()).containsExactly(
                    entry("critical", 0),
                    entry("high", 0),
                    entry("warning", 0),
                    entry("info", 2));
            assertThat(report.getTotalFindings()).isEqualTo(2);
            assertThat(report.count(Severity.INFO)).isEqualTo(2);
        }

        @Test
        @DisplayName("summary recommendations come before distinct finding recommendations")
        void recommendations() {
            ComplianceReport report = aggregate(pages, List.of(
                    finding(Severity.WARNING, 2), finding(Severity.CRITICAL, 3), finding(Severity.WARNING, 1)));

            assertThat(report.getRecommendations()).containsExactly(
                    "Устранить критические нарушения",
                    "Исправить предупреждения",
                    "Повысить общее соответствие нормам",
                    "fix critical",
                    "fix warning");
        }

        @Test
        @DisplayName("caps recommendations at ten")
        void cap() {
            List<Finding> findings = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                findings.add(Finding.builder().ruleId("r" + i).severity(Severity.INFO)
                        .target(RuleTarget.DOCUMENT).recommendation("recommendation " + i).build());
            }

            assertThat(aggregate(pages, findings).getRecommendations()).hasSize(10);
        }
    }

    @Nested
    @DisplayName("configuration")
    class Configuration {

        @Test
        @DisplayName("rejects negative penalties")
        void negativePenalty() {
            ComplianceProperties.Penalties penalties = new ComplianceProperties.Penalties();
            penalties.setWarning(-1);

            assertThatThrownBy(() -> new ComplianceAggregator(penalties, 80))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("warning");
        }

        @Test
        @DisplayName("rejects a threshold outside 0..100")
        void threshold() {
            assertThatThrownBy(() -> new ComplianceAggregator(new ComplianceProperties.Penalties(), 120))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new ComplianceAggregator(new ComplianceProperties.Penalties(), -1))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
