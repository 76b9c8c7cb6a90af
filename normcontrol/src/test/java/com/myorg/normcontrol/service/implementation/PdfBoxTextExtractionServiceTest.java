package com.myorg.normcontrol.service.implementation;

import com.myorg.normcontrol.Pdfs;
import com.myorg.normcontrol.exception.CollaboratorUnavailableException;
import com.myorg.normcontrol.model.PageText;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PdfBoxTextExtractionServiceTest {

    private final PdfBoxTextExtractionService service = new PdfBoxTextExtractionService();

    @Test
    void extractsEveryPageInOrder(@TempDir Path dir) throws IOException {
        Path pdf = Pdfs.write(dir.resolve("set.pdf"), "Cover sheet", "General data", "Floor plan");

        List<PageText> pages = service.extract(pdf.toFile());

        assertThat(pages).extracting(PageText::pageNumber).containsExactly(1, 2, 3);
        assertThat(pages.get(0).text()).contains("Cover sheet");
        assertThat(pages.get(2).text()).contains("Floor plan");
    }

    @Test
    void missingFileIsACollaboratorFailure(@TempDir Path dir) {
        assertThatThrownBy(() -> service.extract(dir.resolve("absent.pdf").toFile()))
                .isInstanceOf(CollaboratorUnavailableException.class)
                .hasMessageContaining("does not exist");
    }

    @Test
    void corruptFileIsACollaboratorFailure(@TempDir Path dir) throws IOException {
        Path broken = Files.writeString(dir.resolve("broken.pdf"), "this is not a pdf");

        assertThatThrownBy(() -> service.extract(broken.toFile()))
                .isInstanceOf(CollaboratorUnavailableException.class)
                .satisfies(e -> assertThat(((CollaboratorUnavailableException) e).getCollaborator())
                        .isEqualTo(PdfBoxTextExtractionService.COLLABORATOR));
    }
}
