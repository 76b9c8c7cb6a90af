package com.myorg.normcontrol.service.implementation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.myorg.normcontrol.exception.CollaboratorUnavailableException;
import com.myorg.normcontrol.model.AnalysisHistoryEntry;
import com.myorg.normcontrol.model.ComplianceReport;
import com.myorg.normcontrol.service.JsonlWriter;
import com.myorg.normcontrol.service.ReportStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.DigestUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * File-system document store: one pretty-printed JSON file per document, overwritten on
 * re-analysis, plus an append-only JSONL history of every run.
 */
@Slf4j
public class JacksonReportStore implements ReportStore {

    static final String COLLABORATOR = "document-store";

    private final ObjectMapper mapper;
    private final Path baseDir;
    private final Path historyFile;
    private final JsonlWriter<AnalysisHistoryEntry> historyWriter;
    private final Clock clock;

    public JacksonReportStore(ObjectMapper mapper, Path baseDir, String historyFileName, Clock clock) {
        this(mapper, baseDir, historyFileName, new JacksonJsonlWriter<>(mapper), clock);
    }

    public JacksonReportStore(ObjectMapper mapper, Path baseDir, String historyFileName,
                              JsonlWriter<AnalysisHistoryEntry> historyWriter, Clock clock) {
        this.mapper = mapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.historyFile = this.baseDir.resolve(historyFileName);
        this.historyWriter = historyWriter;
        this.clock = clock;
    }

    @Override
    public synchronized void save(ComplianceReport report) {
        Path target = reportFile(report.getDocumentId());
        try {
            Files.createDirectories(baseDir);
            mapper.writeValue(target.toFile(), report);
            historyWriter.append(historyFile.toFile(), List.of(AnalysisHistoryEntry.of(report, clock.instant())));
        } catch (IOException e) {
            throw new CollaboratorUnavailableException(COLLABORATOR,
                    "Cannot store report for " + report.getDocumentId() + ": " + e.getMessage(), e);
        }
        log.info("Report stored: {} -> {}", report.getDocumentId(), target);
    }

    @Override
    public Optional<ComplianceReport> find(String documentId) {
        Path source = reportFile(documentId);
        if (!Files.isRegularFile(source)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(source.toFile(), ComplianceReport.class));
        } catch (IOException e) {
            throw new CollaboratorUnavailableException(COLLABORATOR,
                    "Cannot read report for " + documentId + ": " + e.getMessage(), e);
        }
    }

    /**
     * Document ids become file names; anything outside letters, digits, dot, dash and
     * underscore is replaced so an id can never escape the base directory. A short hash of
     * the raw id keeps ids that sanitize to the same text apart.
     */
    Path reportFile(String documentId) {
        String safe = documentId.replaceAll("[^\\p{L}\\p{Nd}._-]", "_");
        String hash = DigestUtils.md5DigestAsHex(documentId.getBytes(StandardCharsets.UTF_8)).substring(0, 8);
        return baseDir.resolve(safe + "-" + hash + ".json");
    }
}
