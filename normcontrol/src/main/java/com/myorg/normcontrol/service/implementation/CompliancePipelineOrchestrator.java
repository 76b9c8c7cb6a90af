package com.myorg.normcontrol.service.implementation;

import com.myorg.normcontrol.exception.InternalPipelineException;
import com.myorg.normcontrol.exception.NormControlException;
import com.myorg.normcontrol.exception.ValidationException;
import com.myorg.normcontrol.metrics.PerfProbe;
import com.myorg.normcontrol.model.ComplianceReport;
import com.myorg.normcontrol.model.DocumentMetadata;
import com.myorg.normcontrol.model.Finding;
import com.myorg.normcontrol.model.GeneralDataLocation;
import com.myorg.normcontrol.model.Page;
import com.myorg.normcontrol.model.PageClassification;
import com.myorg.normcontrol.model.PageRole;
import com.myorg.normcontrol.model.PageText;
import com.myorg.normcontrol.model.Section;
import com.myorg.normcontrol.patterns.PatternLibrary;
import com.myorg.normcontrol.patterns.PatternLibraryProvider;
import com.myorg.normcontrol.rules.RuleSet;
import com.myorg.normcontrol.service.ComplianceAnalyzer;
import com.myorg.normcontrol.service.MetadataExtractor;
import com.myorg.normcontrol.service.PageClassifier;
import com.myorg.normcontrol.service.ReportStore;
import com.myorg.normcontrol.service.RuleEngine;
import com.myorg.normcontrol.service.SectionSegmenter;
import com.myorg.normcontrol.service.processing.ComplianceAggregator;
import com.myorg.normcontrol.service.processing.GeneralDataDetector;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Runs the analysis stages in fixed order:
 * <ol>
 *   <li>general data detection, then page classification and drawing-stamp extraction on the
 *       worker pool, while the first page is analyzed concurrently</li>
 *   <li>page and document rules, including the normative rules of the document mark and stage</li>
 *   <li>segmentation and section rules</li>
 *   <li>aggregation, then persistence</li>
 * </ol>
 * Per-page work is joined in page order before the next stage starts. The pattern library is
 * read once per run. No retries: the first failure ends the run.
 */
@Slf4j
public class CompliancePipelineOrchestrator implements ComplianceAnalyzer {

    private final PatternLibraryProvider libraryProvider;
    private final GeneralDataDetector generalDataDetector;
    private final PageClassifier classifier;
    private final MetadataExtractor metadataExtractor;
    private final RuleEngine ruleEngine;
    private final SectionSegmenter segmenter;
    private final ComplianceAggregator aggregator;
    private final ReportStore reportStore;
    private final Executor executor;

    /**
     * @param reportStore may be {@code null}, in which case reports are not persisted
     */
    public CompliancePipelineOrchestrator(PatternLibraryProvider libraryProvider,
                                          GeneralDataDetector generalDataDetector,
                                          PageClassifier classifier,
                                          MetadataExtractor metadataExtractor,
                                          RuleEngine ruleEngine,
                                          SectionSegmenter segmenter,
                                          ComplianceAggregator aggregator,
                                          ReportStore reportStore,
                                          Executor executor) {
        this.libraryProvider = libraryProvider;
        this.generalDataDetector = generalDataDetector;
        this.classifier = classifier;
        this.metadataExtractor = metadataExtractor;
        this.ruleEngine = ruleEngine;
        this.segmenter = segmenter;
        this.aggregator = aggregator;
        this.reportStore = reportStore;
        this.executor = executor;
    }

    @Override
    public ComplianceReport analyze(String documentId, List<PageText> input) {
        List<Page> pages = ingest(documentId, input);
        PatternLibrary library = libraryProvider.current();
        PerfProbe probe = new PerfProbe("analysis[" + documentId + "]");
        log.info("Analysis started: document={}, pages={}, patternLibrary={}",
                documentId, pages.size(), library.version());

        // first page analysis does not depend on classification
        CompletableFuture<DocumentMetadata> firstPage = CompletableFuture.supplyAsync(() -> {
            long start = PerfProbe.now();
            DocumentMetadata metadata = pages.isEmpty()
                    ? DocumentMetadata.empty()
                    : metadataExtractor.extractDocumentMetadata(pages.get(0).getRawText(), library);
            probe.record("first_page_analysis", start, 1);
            return metadata;
        }, executor);

        long t0 = PerfProbe.now();
        GeneralDataLocation generalData = generalDataDetector.detect(pages, library).orElse(null);
        probe.record("general_data_detection", t0, pages.size());

        t0 = PerfProbe.now();
        List<Page> classified = onWorkers(pages, page -> classify(page, generalData, library));
        probe.record("classification", t0, pages.size());

        DocumentMetadata metadata = join(firstPage);

        t0 = PerfProbe.now();
        RuleSet rules = ruleEngine.prepare(library, metadata);
        List<List<Finding>> pageFindings = onWorkers(classified, page -> ruleEngine.evaluatePage(rules, page, metadata));
        List<Finding> findings = new ArrayList<>();
        pageFindings.forEach(findings::addAll);
        probe.record("page_rules", t0, classified.size());

        t0 = PerfProbe.now();
        findings.addAll(ruleEngine.evaluateDocument(rules, classified, metadata));
        probe.record("document_rules", t0, 1);

        t0 = PerfProbe.now();
        List<Section> sections = segmenter.segment(classified);
        probe.record("segmentation", t0, sections.size());

        t0 = PerfProbe.now();
        for (Section section : sections) {
            List<Page> sectionPages = classified.subList(section.getStartPage() - 1, section.getEndPage());
            findings.addAll(ruleEngine.evaluateSection(rules, section, sectionPages, metadata));
        }
        probe.record("section_rules", t0, sections.size());

        t0 = PerfProbe.now();
        ComplianceReport report = aggregator.aggregate(documentId, library, classified, metadata, sections, findings);
        probe.record("aggregation", t0, findings.size());

        report = report.toBuilder()
                .stageTimings(probe.timings())
                .executionTimeMs(probe.done())
                .build();
        log.info("Analysis complete: document={}, status={}, score={}, findings={}",
                documentId, report.getOverallStatus().getValue(), report.getComplianceScore(), report.getTotalFindings());

        if (reportStore != null) {
            reportStore.save(report);
        }
        return report;
    }

    private Page classify(Page page, GeneralDataLocation generalData, PatternLibrary library) {
        PageClassification c = classifier.classify(page.getRawText(), page.getPageNumber(), generalData, library);
        Page.PageBuilder builder = page.toBuilder()
                .classifiedRole(c.role())
                .confidence(c.confidence());
        if (c.role() == PageRole.DRAWING) {
            builder.stamp(metadataExtractor.extractStamp(page.getRawText(), library));
        }
        return builder.build();
    }

    /**
     * Pages sorted by number. Numbers must be unique, positive and gap-free from 1.
     */
    static List<Page> ingest(String documentId, List<PageText> input) {
        if (documentId == null || documentId.isBlank()) {
            throw new ValidationException("document_id must not be blank");
        }
        if (input == null) {
            throw new ValidationException("pages must not be null");
        }
        Set<Integer> seen = new HashSet<>();
        for (PageText page : input) {
            if (page == null) {
                throw new ValidationException("pages must not contain null entries");
            }
            if (page.pageNumber() <= 0) {
                throw new ValidationException("Page numbers must be positive, got " + page.pageNumber());
            }
            if (!seen.add(page.pageNumber())) {
                throw new ValidationException("Duplicate page number " + page.pageNumber());
            }
        }
        List<PageText> ordered = new ArrayList<>(input);
        ordered.sort(Comparator.comparingInt(PageText::pageNumber));
        for (int i = 0; i < ordered.size(); i++) {
            if (ordered.get(i).pageNumber() != i + 1) {
                throw new ValidationException("Page numbers must run from 1 without gaps; page " + (i + 1) + " is missing");
            }
        }
        return ordered.stream().map(Page::of).toList();
    }

    private <T> List<T> onWorkers(List<Page> pages, Function<Page, T> task) {
        List<CompletableFuture<T>> futures = new ArrayList<>(pages.size());
        for (Page page : pages) {
            futures.add(CompletableFuture.supplyAsync(() -> task.apply(page), executor));
        }
        List<T> results = new ArrayList<>(futures.size());
        for (CompletableFuture<T> future : futures) {
            results.add(join(future));
        }
        return results;
    }

    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof NormControlException n) {
                throw n;
            }
            throw new InternalPipelineException("Pipeline stage failed: " + cause, cause);
        }
    }
}
