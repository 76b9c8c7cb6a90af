package com.myorg.normcontrol.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.normcontrol.patterns.PatternLibraryLoader;
import com.myorg.normcontrol.patterns.PatternLibraryProvider;
import com.myorg.normcontrol.rules.DefaultRulePredicateFactory;
import com.myorg.normcontrol.rules.RulePredicateFactory;
import com.myorg.normcontrol.service.ComplianceAnalyzer;
import com.myorg.normcontrol.service.MetadataExtractor;
import com.myorg.normcontrol.service.PageClassifier;
import com.myorg.normcontrol.service.ReportExporter;
import com.myorg.normcontrol.service.ReportStore;
import com.myorg.normcontrol.service.RuleEngine;
import com.myorg.normcontrol.service.SectionSegmenter;
import com.myorg.normcontrol.service.TextExtractionService;
import com.myorg.normcontrol.service.implementation.CompliancePipelineOrchestrator;
import com.myorg.normcontrol.service.implementation.ExcelReportExporter;
import com.myorg.normcontrol.service.implementation.JacksonReportStore;
import com.myorg.normcontrol.service.implementation.PatternMetadataExtractor;
import com.myorg.normcontrol.service.implementation.PatternRuleEngine;
import com.myorg.normcontrol.service.implementation.PdfBoxTextExtractionService;
import com.myorg.normcontrol.service.processing.ComplianceAggregator;
import com.myorg.normcontrol.service.processing.GeneralDataDetector;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Wires the analysis pipeline from configuration properties.
 */
@Configuration
public class PipelineConfig {

    @Bean
    public PatternLibraryLoader patternLibraryLoader(ObjectMapper objectMapper, ResourceLoader resourceLoader) {
        return new PatternLibraryLoader(objectMapper, resourceLoader);
    }

    /**
     * Fails application start-up when the configured library is missing or malformed.
     */
    @Bean
    public PatternLibraryProvider patternLibraryProvider(PatternLibraryLoader loader, ComplianceProperties properties) {
        return new PatternLibraryProvider(loader.load(properties.getPatternLibrary()));
    }

    @Bean
    public RulePredicateFactory rulePredicateFactory() {
        return new DefaultRulePredicateFactory();
    }

    @Bean
    public GeneralDataDetector generalDataDetector(ComplianceProperties properties) {
        return new GeneralDataDetector(properties.getGeneralDataFallbackPage());
    }

    @Bean
    public MetadataExtractor metadataExtractor(ComplianceProperties properties) {
        return new PatternMetadataExtractor(properties.getMaxTextLength());
    }

    @Bean
    public RuleEngine ruleEngine(RulePredicateFactory predicateFactory, ComplianceProperties properties) {
        return new PatternRuleEngine(predicateFactory, properties.getMaxTextLength());
    }

    @Bean
    public ComplianceAggregator complianceAggregator(ComplianceProperties properties) {
        return new ComplianceAggregator(properties.getPenalties(), properties.getPassThreshold());
    }

    @Bean
    public ReportStore reportStore(ObjectMapper objectMapper, StorageProperties storage) {
        return new JacksonReportStore(objectMapper, Path.of(storage.getBasePath()),
                storage.getHistoryFile(), Clock.systemUTC());
    }

    @Bean
    public ReportExporter reportExporter() {
        return new ExcelReportExporter();
    }

    @Bean
    public TextExtractionService textExtractionService() {
        return new PdfBoxTextExtractionService();
    }

    @Bean
    public ComplianceAnalyzer complianceAnalyzer(PatternLibraryProvider provider,
                                                 GeneralDataDetector detector,
                                                 PageClassifier classifier,
                                                 MetadataExtractor metadataExtractor,
                                                 RuleEngine ruleEngine,
                                                 SectionSegmenter segmenter,
                                                 ComplianceAggregator aggregator,
                                                 ReportStore reportStore,
                                                 @Qualifier("complianceExecutor") Executor executor) {
        return new CompliancePipelineOrchestrator(provider, detector, classifier, metadataExtractor,
                ruleEngine, segmenter, aggregator, reportStore, executor);
    }
}
