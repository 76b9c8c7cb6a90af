package com.myorg.normcontrol.service.processing;

import com.myorg.normcontrol.model.GeneralDataLocation;
import com.myorg.normcontrol.model.Page;
import com.myorg.normcontrol.patterns.PatternLibrary;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Locates the "general data" sheet in one pass over the document.
 * <p>
 * The first page mentioning a general-data indicator wins. Without one, the configured
 * fallback page is used when the document is long enough; otherwise nothing is returned.
 */
@Slf4j
public class GeneralDataDetector {

    private final int fallbackPage;

    public GeneralDataDetector(int fallbackPage) {
        this.fallbackPage = fallbackPage;
    }

    /**
     * @param pages pages sorted by page number
     */
    public Optional<GeneralDataLocation> detect(List<Page> pages, PatternLibrary library) {
        List<String> indicators = library.keywords(PatternLibrary.GENERAL_DATA_INDICATORS);
        for (Page page : pages) {
            String text = TextNormalizer.lower(page.getRawText());
            if (indicators.stream().anyMatch(text::contains)) {
                log.debug("General data sheet found on page {}", page.getPageNumber());
                return Optional.of(GeneralDataLocation.detected(page.getPageNumber()));
            }
        }
        boolean fallbackExists = fallbackPage >= 1
                && pages.stream().anyMatch(p -> p.getPageNumber() == fallbackPage);
        if (fallbackExists) {
            log.debug("No general data indicator, falling back to page {}", fallbackPage);
            return Optional.of(GeneralDataLocation.fallback(fallbackPage));
        }
        log.debug("No general data sheet in a {}-page document", pages.size());
        return Optional.empty();
    }

    public int getFallbackPage() {
        return fallbackPage;
    }
}
