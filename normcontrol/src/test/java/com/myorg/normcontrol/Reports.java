package com.myorg.normcontrol;

import com.myorg.normcontrol.model.ComplianceReport;
import com.myorg.normcontrol.model.DocumentMetadata;
import com.myorg.normcontrol.model.Finding;
import com.myorg.normcontrol.model.OverallStatus;
import com.myorg.normcontrol.model.PageRole;
import com.myorg.normcontrol.model.PageSummary;
import com.myorg.normcontrol.model.ProjectInfo;
import com.myorg.normcontrol.model.ProjectStage;
import com.myorg.normcontrol.model.Section;
import com.myorg.normcontrol.model.Severity;
import com.myorg.normcontrol.model.StampInfo;
import com.myorg.normcontrol.patterns.RuleTarget;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hand-built reports for persistence and export tests.
 */
public final class Reports {

    private Reports() {
    }

    public static ComplianceReport sample(String documentId) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put("critical", 1);
        counts.put("high", 0);
        counts.put("warning", 0);
        counts.put("info", 1);

        return ComplianceReport.builder()
                .documentId(documentId)
                .patternLibraryVersion("2024.06-1")
                .totalPages(2)
                .pages(List.of(
                        PageSummary.builder().pageNumber(1).role(PageRole.TITLE).confidence(0.9).findingsCount(0).build(),
                        PageSummary.builder().pageNumber(2).role(PageRole.DRAWING).confidence(0.75)
                                .hasStamp(false).findingsCount(1).build()))
                .metadata(DocumentMetadata.builder()
                        .projectInfo(ProjectInfo.builder()
                                .projectCode("2024-01-15-КЖ")
                                .projectName("Комбинат по переработке руды")
                                .stage(ProjectStage.WORKING)
                                .documentMark("КЖ")
                                .documentSet("Конструкции железобетонные")
                                .confidence(1.0)
                                .build())
                        .firstPageStamp(StampInfo.builder().hasStamp(true).sheetNumber(1).confidence(0.15).build())
                        .applicableNorms(List.of("СП 63.13330.2018"))
                        .build())
                .sections(List.of(
                        Section.builder().sectionType(PageRole.TITLE).startPage(1).endPage(1).build(),
                        Section.builder().sectionType(PageRole.DRAWING).startPage(2).endPage(2).build()))
                .findings(List.of(
                        Finding.builder()
                                .ruleId("missing_stamp").category("title_block").severity(Severity.CRITICAL)
                                .target(RuleTarget.PAGE).title("Отсутствует штамп чертежа")
                                .description("На листе чертежа не найдена основная надпись (штамп)")
                                .recommendation("Добавить основную надпись")
                                .normReference("ГОСТ Р 21.101-2020")
                                .pageNumber(2).confidence(0.75).build(),
                        Finding.builder()
                                .ruleId("no_norm_references").category("norm_references").severity(Severity.INFO)
                                .target(RuleTarget.DOCUMENT).title("Нет ссылок на нормативные документы")
                                .recommendation("Указать применяемые нормативные документы")
                                .confidence(1.0).build()))
                .severityCounts(counts)
                .totalFindings(2)
                .compliantPages(1)
                .compliancePercentage(50.0)
                .complianceScore(75.0)
                .overallStatus(OverallStatus.FAIL)
                .recommendations(List.of("Устранить критические нарушения", "Добавить основную надпись"))
                .executionTimeMs(12L)
                .stageTimings(Map.of("classification", 3L))
                .build();
    }
}
