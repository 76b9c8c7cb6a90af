package com.myorg.normcontrol.rules;

import com.myorg.normcontrol.model.DocumentMetadata;
import com.myorg.normcontrol.model.Page;
import com.myorg.normcontrol.model.PageRole;
import com.myorg.normcontrol.model.Section;
import com.myorg.normcontrol.model.StampInfo;
import com.myorg.normcontrol.patterns.RuleTarget;
import com.myorg.normcontrol.service.processing.TextNormalizer;
import lombok.Getter;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * What a rule is evaluated against: one page, one section or the whole document.
 * Text of multi-page targets is the page texts joined with newlines, in page order. Each page
 * contributes at most {@code maxTextLength} characters, the same bound metadata extraction uses.
 */
@Getter
public final class RuleContext {

    private final RuleTarget target;
    private final String text;
    private final String lowerText;
    private final Integer pageNumber;
    // page role or section type; null for the document
    private final PageRole role;
    private final StampInfo stamp;
    private final DocumentMetadata metadata;
    private final List<Page> pages;
    private final double confidence;

    private RuleContext(RuleTarget target, List<Page> pages, Integer pageNumber, PageRole role,
                        StampInfo stamp, DocumentMetadata metadata, double confidence, int maxTextLength) {
        this.target = target;
        this.pages = List.copyOf(pages);
        this.text = this.pages.stream()
                .map(p -> TextNormalizer.truncate(p.getTextOrEmpty(), maxTextLength))
                .collect(Collectors.joining("\n"));
        this.lowerText = text.toLowerCase(Locale.ROOT);
        this.pageNumber = pageNumber;
        this.role = role;
        this.stamp = stamp;
        this.metadata = metadata == null ? DocumentMetadata.empty() : metadata;
        this.confidence = confidence;
    }

    public static RuleContext forPage(Page page, DocumentMetadata metadata, int maxTextLength) {
        return new RuleContext(RuleTarget.PAGE, List.of(page), page.getPageNumber(),
                page.getClassifiedRole(), page.getStamp(), metadata, page.getConfidence(), maxTextLength);
    }

    /**
     * @param sectionPages the pages inside {@code section}, in page order
     */
    public static RuleContext forSection(Section section, List<Page> sectionPages, DocumentMetadata metadata,
                                         int maxTextLength) {
        double meanConfidence = sectionPages.stream().mapToDouble(Page::getConfidence).average().orElse(0.0);
        return new RuleContext(RuleTarget.SECTION, sectionPages, section.getStartPage(),
                section.getSectionType(), null, metadata, meanConfidence, maxTextLength);
    }

    public static RuleContext forDocument(List<Page> pages, DocumentMetadata metadata, int maxTextLength) {
        return new RuleContext(RuleTarget.DOCUMENT, pages, null, null, null, metadata, 1.0, maxTextLength);
    }
}
