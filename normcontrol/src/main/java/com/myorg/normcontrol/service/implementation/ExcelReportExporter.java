package com.myorg.normcontrol.service.implementation;

import com.myorg.normcontrol.model.ComplianceReport;
import com.myorg.normcontrol.model.Finding;
import com.myorg.normcontrol.model.PageSummary;
import com.myorg.normcontrol.model.ProjectInfo;
import com.myorg.normcontrol.model.Section;
import com.myorg.normcontrol.service.ReportExporter;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;
import java.util.Map;

/**
 * Writes a compliance report as an XLSX workbook with Summary, Findings, Sections and Pages sheets.
 */
@Slf4j
public class ExcelReportExporter implements ReportExporter {
    static final String SUMMARY_SHEET = "Summary";
    static final String FINDINGS_SHEET = "Findings";
    static final String SECTIONS_SHEET = "Sections";
    static final String PAGES_SHEET = "Pages";

    // fixed widths; autoSizeColumn needs fonts that headless hosts often lack
    private static final int NARROW = 3000;
    private static final int MEDIUM = 6000;
    private static final int WIDE = 16000;

    @Override
    public void export(ComplianceReport report, OutputStream out) throws IOException {
        try (Workbook workbook = new XSSFWorkbook()) {
            CellStyle header = workbook.createCellStyle();
            Font bold = workbook.createFont();
            bold.setBold(true);
            header.setFont(bold);

            writeSummary(workbook.createSheet(SUMMARY_SHEET), report, header);
            writeFindings(workbook.createSheet(FINDINGS_SHEET), report.getFindings(), header);
            writeSections(workbook.createSheet(SECTIONS_SHEET), report.getSections(), header);
            writePages(workbook.createSheet(PAGES_SHEET), report.getPages(), header);

            workbook.write(out);
        }
        log.info("Excel report exported for {} ({} findings)", report.getDocumentId(), report.getTotalFindings());
    }

    private void writeSummary(Sheet sheet, ComplianceReport report, CellStyle header) {
        ProjectInfo info = report.getMetadata() == null ? ProjectInfo.empty() : report.getMetadata().getProjectInfo();
        int r = 0;
        addRow(sheet, r++, header, "Metric", "Value");
        addRow(sheet, r++, null, "Document", report.getDocumentId());
        addRow(sheet, r++, null, "Pattern library", report.getPatternLibraryVersion());
        addRow(sheet, r++, null, "Project code", info.getProjectCode());
        addRow(sheet, r++, null, "Project name", info.getProjectName());
        addRow(sheet, r++, null, "Stage", info.getStage() == null ? null : info.getStage().getTitle());
        addRow(sheet, r++, null, "Document mark", info.getDocumentMark());
        addRow(sheet, r++, null, "Total pages", report.getTotalPages());
        addRow(sheet, r++, null, "Compliant pages", report.getCompliantPages());
        addRow(sheet, r++, null, "Compliance %", report.getCompliancePercentage());
        addRow(sheet, r++, null, "Compliance score", report.getComplianceScore());
        addRow(sheet, r++, null, "Overall status", report.getOverallStatus() == null ? null : report.getOverallStatus().getValue());
        addRow(sheet, r++, null, "Total findings", report.getTotalFindings());
        for (Map.Entry<String, Integer> e : report.getSeverityCounts().entrySet()) {
            addRow(sheet, r++, null, "Findings: " + e.getKey(), e.getValue());
        }
        r++;
        addRow(sheet, r++, header, "Recommendations");
        for (String recommendation : report.getRecommendations()) {
            addRow(sheet, r++, null, recommendation);
        }
        sheet.setColumnWidth(0, MEDIUM);
        sheet.setColumnWidth(1, WIDE);
    }

    private void writeFindings(Sheet sheet, List<Finding> findings, CellStyle header) {
        addRow(sheet, 0, header, "severity", "rule_id", "category", "page", "section", "title",
                "description", "recommendation", "norm_reference");
        int r = 1;
        for (Finding f : findings) {
            addRow(sheet, r++, null,
                    f.getSeverity().getValue(),
                    f.getRuleId(),
                    f.getCategory(),
                    f.getPageNumber(),
                    f.getSectionType() == null ? null : f.getSectionType().getValue(),
                    f.getTitle(),
                    f.getDescription(),
                    f.getRecommendation(),
                    f.getNormReference());
        }
        int[] widths = {NARROW, MEDIUM, MEDIUM, NARROW, MEDIUM, WIDE, WIDE, WIDE, MEDIUM};
        for (int c = 0; c < widths.length; c++) sheet.setColumnWidth(c, widths[c]);
    }

    private void writeSections(Sheet sheet, List<Section> sections, CellStyle header) {
        addRow(sheet, 0, header, "section_type", "start_page", "end_page", "pages_count");
        int r = 1;
        for (Section s : sections) {
            addRow(sheet, r++, null, s.getSectionType().getValue(), s.getStartPage(), s.getEndPage(), s.getPagesCount());
        }
        for (int c = 0; c < 4; c++) sheet.setColumnWidth(c, MEDIUM);
    }

    private void writePages(Sheet sheet, List<PageSummary> pages, CellStyle header) {
        addRow(sheet, 0, header, "page", "role", "confidence", "has_stamp", "findings");
        int r = 1;
        for (PageSummary p : pages) {
            addRow(sheet, r++, null, p.getPageNumber(), p.getRole() == null ? null : p.getRole().getValue(),
                    p.getConfidence(), p.getHasStamp(), p.getFindingsCount());
        }
        for (int c = 0; c < 5; c++) sheet.setColumnWidth(c, MEDIUM);
    }

    private void addRow(Sheet sheet, int rowIndex, CellStyle style, Object... values) {
        Row row = sheet.createRow(rowIndex);
        for (int c = 0; c < values.length; c++) {
            Object value = values[c];
            if (value == null) continue;
            Cell cell = row.createCell(c);
            if (value instanceof Number n) {
                cell.setCellValue(n.doubleValue());
            } else {
                cell.setCellValue(String.valueOf(value));
            }
            if (style != null) cell.setCellStyle(style);
        }
    }
}
