package com.myorg.normcontrol.service.implementation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.myorg.normcontrol.config.ComplianceProperties;
import com.myorg.normcontrol.model.ComplianceReport;
import com.myorg.normcontrol.model.OverallStatus;
import com.myorg.normcontrol.model.PageText;
import com.myorg.normcontrol.patterns.PatternLibraryLoader;
import com.myorg.normcontrol.patterns.PatternLibraryProvider;
import com.myorg.normcontrol.rules.DefaultRulePredicateFactory;
import com.myorg.normcontrol.service.ComplianceAnalyzer;
import com.myorg.normcontrol.service.TextExtractionService;
import com.myorg.normcontrol.service.processing.ComplianceAggregator;
import com.myorg.normcontrol.service.processing.GeneralDataDetector;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Standalone runner: extracts a PDF with PDFBox, analyzes it and writes the JSON report.
 *
 * Usage: run main with args: <input-pdf> [output-json]
 */
@Slf4j
public class ComplianceRunner {
    private final TextExtractionService textExtraction;
    private final ComplianceAnalyzer analyzer;
    private final ObjectMapper mapper;

    public ComplianceRunner(TextExtractionService textExtraction, ComplianceAnalyzer analyzer, ObjectMapper mapper) {
        this.textExtraction = textExtraction;
        this.analyzer = analyzer;
        this.mapper = mapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Run the analysis and write the report.
     *
     * @param pdfPath    input PDF file path
     * @param outputPath output JSON file path
     * @throws IOException on IO errors
     */
    public ComplianceReport run(Path pdfPath, Path outputPath) throws IOException {
        File pdfFile = pdfPath.toFile();
        if (!pdfFile.exists()) {
            throw new FileNotFoundException("PDF not found: " + pdfFile.getAbsolutePath());
        }
        log.info("Analyzing PDF: {}", pdfFile.getAbsolutePath());
        List<PageText> pages = textExtraction.extract(pdfFile);

        ComplianceReport report = analyzer.analyze(documentId(pdfPath), pages);

        File out = outputPath.toFile();
        File parent = out.getAbsoluteFile().getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            throw new IOException("Could not create output directory: " + parent.getAbsolutePath());
        }
        mapper.writeValue(out, report);
        log.info("Completed: pages={}, findings={}, score={}, status={} -> {}",
                report.getTotalPages(), report.getTotalFindings(), report.getComplianceScore(),
                report.getOverallStatus().getValue(), outputPath);
        return report;
    }

    static String documentId(Path pdfPath) {
        String name = pdfPath.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /**
     * Wires the pipeline without Spring, using default properties and no report store.
     */
    public static ComplianceRunner standalone(ComplianceProperties properties, ExecutorService executor) {
        ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
        PatternLibraryProvider provider = new PatternLibraryProvider(
                new PatternLibraryLoader(mapper).load(properties.getPatternLibrary()));
        ComplianceAnalyzer analyzer = new CompliancePipelineOrchestrator(
                provider,
                new GeneralDataDetector(properties.getGeneralDataFallbackPage()),
                new KeywordPageClassifier(),
                new PatternMetadataExtractor(properties.getMaxTextLength()),
                new PatternRuleEngine(new DefaultRulePredicateFactory(), properties.getMaxTextLength()),
                new RoleRunSectionSegmenter(),
                new ComplianceAggregator(properties.getPenalties(), properties.getPassThreshold()),
                null,
                executor);
        return new ComplianceRunner(new PdfBoxTextExtractionService(), analyzer, mapper);
    }

    /* ----------------- main for quick testing ----------------- */
    public static void main(String[] args) throws IOException {
        if (args.length < 1) {
            log.error("Usage: ComplianceRunner <input-pdf> [output-json]");
            System.exit(2);
        }
        Path pdf = Path.of(args[0]);
        Path out = (args.length >= 2) ? Path.of(args[1]) : Path.of(documentId(pdf) + "_compliance.json");

        ComplianceProperties properties = new ComplianceProperties();
        ExecutorService executor = Executors.newFixedThreadPool(properties.workerThreads());
        ComplianceReport report;
        try {
            report = standalone(properties, executor).run(pdf, out);
        } finally {
            executor.shutdown();
        }
        System.exit(report.getOverallStatus() == OverallStatus.FAIL ? 1 : 0);
    }
}
