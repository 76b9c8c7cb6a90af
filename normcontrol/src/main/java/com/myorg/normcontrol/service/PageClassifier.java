package com.myorg.normcontrol.service;

import com.myorg.normcontrol.model.GeneralDataLocation;
import com.myorg.normcontrol.model.PageClassification;
import com.myorg.normcontrol.patterns.PatternLibrary;

/**
 * Assigns a logical role to one page.
 */
public interface PageClassifier {

    /**
     * @param text            page text; {@code null} when extraction failed
     * @param pageNumber      1-based page number
     * @param generalDataPage location of the general data sheet, {@code null} when not found
     * @param library         pattern snapshot of the current run
     */
    PageClassification classify(String text, int pageNumber, GeneralDataLocation generalDataPage,
                                 PatternLibrary library);
}
