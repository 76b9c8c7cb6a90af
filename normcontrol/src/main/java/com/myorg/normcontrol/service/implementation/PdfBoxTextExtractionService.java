package com.myorg.normcontrol.service.implementation;

import com.myorg.normcontrol.exception.CollaboratorUnavailableException;
import com.myorg.normcontrol.model.PageText;
import com.myorg.normcontrol.service.TextExtractionService;
import com.myorg.normcontrol.service.processing.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Page-by-page text extraction with PDFBox. A page whose text cannot be stripped is returned
 * with {@code null} text so the pipeline can mark it {@code unknown}; an unreadable file is a
 * collaborator failure.
 */
@Slf4j
public class PdfBoxTextExtractionService implements TextExtractionService {

    static final String COLLABORATOR = "text-extraction";

    @Override
    public List<PageText> extract(File pdfFile) {
        Objects.requireNonNull(pdfFile, "pdfFile must not be null");
        if (!pdfFile.exists()) {
            throw new CollaboratorUnavailableException(COLLABORATOR,
                    "PDF file does not exist: " + pdfFile.getAbsolutePath(), null);
        }

        List<PageText> pages = new ArrayList<>();
        try (PDDocument document = PDDocument.load(pdfFile)) {
            PDFTextStripper stripper = new PDFTextStripper();
            // title blocks sit in the corner of the sheet; position order keeps their lines together
            stripper.setSortByPosition(true);

            int totalPages = document.getNumberOfPages();
            for (int page = 1; page <= totalPages; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                pages.add(PageText.of(page, stripPage(stripper, document, page)));
            }
        } catch (IOException e) {
            throw new CollaboratorUnavailableException(COLLABORATOR,
                    "Cannot read PDF " + pdfFile.getName() + ": " + e.getMessage(), e);
        }

        log.info("Extracted text of {} pages from {}", pages.size(), pdfFile.getName());
        return pages;
    }

    private static String stripPage(PDFTextStripper stripper, PDDocument document, int page) {
        try {
            return TextNormalizer.normalize(stripper.getText(document));
        } catch (IOException | RuntimeException e) {
            log.warn("Text of page {} could not be extracted: {}", page, e.toString());
            return null;
        }
    }
}
