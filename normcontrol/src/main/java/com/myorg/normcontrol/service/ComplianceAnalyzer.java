package com.myorg.normcontrol.service;

import com.myorg.normcontrol.model.ComplianceReport;
import com.myorg.normcontrol.model.PageText;

import java.util.List;

/**
 * Entry point of the analysis pipeline.
 */
public interface ComplianceAnalyzer {

    /**
     * Analyzes one document.
     *
     * @param documentId caller's identifier, echoed in the report
     * @param pages      ordered page texts; empty text is valid input
     * @return the compliance report; a failing document is a normal result
     * @throws com.myorg.normcontrol.exception.ValidationException        on duplicate or non-positive page numbers
     * @throws com.myorg.normcontrol.exception.InternalPipelineException  when a structural check fails
     */
    ComplianceReport analyze(String documentId, List<PageText> pages);
}
