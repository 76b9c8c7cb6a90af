package com.myorg.normcontrol.controller;

import com.myorg.normcontrol.config.StorageProperties;
import com.myorg.normcontrol.exception.ReportNotFoundException;
import com.myorg.normcontrol.exception.ValidationException;
import com.myorg.normcontrol.model.ComplianceReport;
import com.myorg.normcontrol.model.PageText;
import com.myorg.normcontrol.service.ComplianceAnalyzer;
import com.myorg.normcontrol.service.ReportExporter;
import com.myorg.normcontrol.service.ReportStore;
import com.myorg.normcontrol.service.TextExtractionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.List;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/compliance")
public class ComplianceController {

    static final MediaType XLSX =
            MediaType.parseMediaType("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

    private static final Logger PerfLogger = LoggerFactory.getLogger("performance");

    private final ComplianceAnalyzer analyzer;
    private final TextExtractionService textExtraction;
    private final ReportStore reportStore;
    private final ReportExporter reportExporter;
    private final StorageProperties storageProperties;

    /**
     * Analyzes pages whose text was extracted upstream.
     */
    @PostMapping(value = "/analyze", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ComplianceReport> analyze(@RequestBody AnalyzeRequest request) {
        if (request == null) {
            throw new ValidationException("Request body is required.");
        }
        ComplianceReport report = analyzer.analyze(request.getDocumentId(), request.getPages());
        return ResponseEntity.ok(report);
    }

    /**
     * Extracts text from an uploaded PDF and analyzes it. The file name without extension
     * becomes the document id.
     */
    @PostMapping(value = "/analyze-pdf", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ComplianceReport> analyzePdf(@RequestParam("file") MultipartFile file) throws IOException {
        if (file == null || file.isEmpty()) {
            throw new ValidationException("Please upload a non-empty PDF file.");
        }
        final String originalName = file.getOriginalFilename();
        if (originalName == null || originalName.isBlank()) {
            throw new ValidationException("Uploaded file has no filename.");
        }
        final String lower = originalName.toLowerCase();
        final String contentType = file.getContentType() == null ? "" : file.getContentType().toLowerCase();
        if (!(lower.endsWith(".pdf") || contentType.contains("pdf"))) {
            throw new ValidationException("Only PDF files are accepted.");
        }

        Path uploadDir = Path.of(storageProperties.getBasePath()).toAbsolutePath().normalize().resolve("uploads");
        Files.createDirectories(uploadDir);
        String fileName = Path.of(originalName).getFileName().toString();
        // one file per request; clients may upload the same name concurrently
        Path pdfPath = Files.createTempFile(uploadDir, "upload-", "-" + fileName);

        long t0 = System.nanoTime();
        try (InputStream in = file.getInputStream()) {
            Files.copy(in, pdfPath, StandardCopyOption.REPLACE_EXISTING);
        }
        PerfLogger.info("Upload saved: {} in {} ms", pdfPath.getFileName(), msSince(t0));

        t0 = System.nanoTime();
        List<PageText> pages = textExtraction.extract(pdfPath.toFile());
        PerfLogger.info("Text extracted: {} pages in {} ms", pages.size(), msSince(t0));

        return ResponseEntity.ok(analyzer.analyze(documentId(fileName), pages));
    }

    @GetMapping("/reports/{documentId}")
    public ResponseEntity<ComplianceReport> getReport(@PathVariable String documentId) {
        return ResponseEntity.ok(stored(documentId));
    }

    @GetMapping("/reports/{documentId}/xlsx")
    public ResponseEntity<byte[]> getReportWorkbook(@PathVariable String documentId) throws IOException {
        ComplianceReport report = stored(documentId);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        reportExporter.export(report, out);
        return ResponseEntity.ok()
                .headers(headers -> headers.setContentDisposition(ContentDisposition.attachment()
                        .filename(documentId + "_compliance.xlsx", StandardCharsets.UTF_8)
                        .build()))
                .contentType(XLSX)
                .body(out.toByteArray());
    }

    // ===== Helpers =====

    private ComplianceReport stored(String documentId) {
        return reportStore.find(documentId).orElseThrow(() -> new ReportNotFoundException(documentId));
    }

    static String documentId(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private static long msSince(long nano) {
        return Duration.ofNanos(System.nanoTime() - nano).toMillis();
    }
}
