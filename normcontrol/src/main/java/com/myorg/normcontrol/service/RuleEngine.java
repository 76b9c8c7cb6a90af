package com.myorg.normcontrol.service;

import com.myorg.normcontrol.model.DocumentMetadata;
import com.myorg.normcontrol.model.Finding;
import com.myorg.normcontrol.model.Page;
import com.myorg.normcontrol.model.Section;
import com.myorg.normcontrol.patterns.PatternLibrary;
import com.myorg.normcontrol.rules.RuleSet;

import java.util.List;

/**
 * Evaluates compliance rules. A rule whose check fails yields exactly one finding.
 */
public interface RuleEngine {

    /**
     * Selects and compiles the rules of a run: the library's general rules followed by the
     * normative rules of the document mark and stage found in {@code metadata}.
     */
    RuleSet prepare(PatternLibrary library, DocumentMetadata metadata);

    List<Finding> evaluatePage(RuleSet rules, Page page, DocumentMetadata metadata);

    /**
     * @param sectionPages the pages covered by {@code section}, in page order
     */
    List<Finding> evaluateSection(RuleSet rules, Section section, List<Page> sectionPages,
                                  DocumentMetadata metadata);

    List<Finding> evaluateDocument(RuleSet rules, List<Page> pages, DocumentMetadata metadata);
}
