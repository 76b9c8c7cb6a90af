package com.myorg.normcontrol.service.implementation;

import com.myorg.normcontrol.model.GeneralDataLocation;
import com.myorg.normcontrol.model.PageClassification;
import com.myorg.normcontrol.model.PageRole;
import com.myorg.normcontrol.patterns.PatternLibrary;
import com.myorg.normcontrol.service.PageClassifier;
import com.myorg.normcontrol.service.processing.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Keyword-count classifier.
 * <ul>
 *   <li>{@code null} text: {@code unknown}, score 0</li>
 *   <li>pages before a known general data sheet: {@code title}, score 0.9</li>
 *   <li>the general data sheet itself: score 1.0 when detected, 0.5 when assumed</li>
 *   <li>otherwise the role with most matched keywords, score {@code 1 - 0.5^matches};
 *       ties go to the role earlier in the library priority list</li>
 *   <li>no match: {@code main_content}, score 0.1 (0.0 for blank text)</li>
 * </ul>
 */
@Slf4j
@Service
public class KeywordPageClassifier implements PageClassifier {

    static final double FORCED_TITLE_SCORE = 0.9;
    static final double DETECTED_GENERAL_DATA_SCORE = 1.0;
    static final double FALLBACK_GENERAL_DATA_SCORE = 0.5;
    static final double NO_MATCH_SCORE = 0.1;

    @Override
    public PageClassification classify(String text, int pageNumber, GeneralDataLocation generalDataPage,
                                        PatternLibrary library) {
        if (text == null) {
            return new PageClassification(PageRole.UNKNOWN, 0.0);
        }
        if (generalDataPage != null) {
            if (pageNumber < generalDataPage.pageNumber()) {
                return new PageClassification(PageRole.TITLE, FORCED_TITLE_SCORE);
            }
            if (pageNumber == generalDataPage.pageNumber()) {
                return new PageClassification(PageRole.GENERAL_DATA,
                        generalDataPage.explicit() ? DETECTED_GENERAL_DATA_SCORE : FALLBACK_GENERAL_DATA_SCORE);
            }
        }
        if (text.isBlank()) {
            return new PageClassification(PageRole.MAIN_CONTENT, 0.0);
        }

        String lower = TextNormalizer.lower(text);
        PageRole best = null;
        int bestMatches = 0;
        // priority order, so a later role needs strictly more matches to win
        for (PageRole role : library.rolePriority()) {
            int matches = countMatches(lower, library, role);
            if (matches > bestMatches) {
                best = role;
                bestMatches = matches;
            }
        }
        if (best == null) {
            return new PageClassification(PageRole.MAIN_CONTENT, NO_MATCH_SCORE);
        }
        log.trace("Page {} -> {} ({} keyword matches)", pageNumber, best.getValue(), bestMatches);
        return new PageClassification(best, 1.0 - Math.pow(0.5, bestMatches));
    }

    private static int countMatches(String lowerText, PatternLibrary library, PageRole role) {
        int matches = 0;
        for (String keyword : library.roleKeywords(role)) {
            if (lowerText.contains(keyword)) {
                matches++;
            }
        }
        return matches;
    }
}
