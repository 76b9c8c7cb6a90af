package com.myorg.normcontrol.service.implementation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.normcontrol.Pdfs;
import com.myorg.normcontrol.config.ComplianceProperties;
import com.myorg.normcontrol.model.ComplianceReport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ComplianceRunnerTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(2);

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    @Test
    void documentIdIsTheFileNameWithoutExtension() {
        assertThat(ComplianceRunner.documentId(Path.of("in", "KZH-001.rev2.pdf"))).isEqualTo("KZH-001.rev2");
        assertThat(ComplianceRunner.documentId(Path.of("noext"))).isEqualTo("noext");
        assertThat(ComplianceRunner.documentId(Path.of(".pdf"))).isEqualTo(".pdf");
    }

    @Test
    void analyzesAPdfAndWritesTheReport(@TempDir Path dir) throws IOException {
        Path pdf = Pdfs.write(dir.resolve("KZH-001.pdf"), "Cover sheet", "Notes", "Plan");
        Path out = dir.resolve("out/report.json");

        ComplianceReport report = ComplianceRunner.standalone(new ComplianceProperties(), executor).run(pdf, out);

        assertThat(report.getDocumentId()).isEqualTo("KZH-001");
        assertThat(report.getTotalPages()).isEqualTo(3);
        assertThat(out).exists();
        ComplianceReport written = new ObjectMapper().readValue(out.toFile(), ComplianceReport.class);
        assertThat(written.withoutTimings()).isEqualTo(report.withoutTimings());
    }

    @Test
    void missingPdfIsReported(@TempDir Path dir) {
        ComplianceRunner runner = ComplianceRunner.standalone(new ComplianceProperties(), executor);

        assertThatThrownBy(() -> runner.run(dir.resolve("absent.pdf"), dir.resolve("r.json")))
                .isInstanceOf(FileNotFoundException.class);
    }
}
