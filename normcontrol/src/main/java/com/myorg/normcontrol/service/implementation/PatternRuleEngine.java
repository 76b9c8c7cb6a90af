package com.myorg.normcontrol.service.implementation;

import com.myorg.normcontrol.config.ComplianceProperties;
import com.myorg.normcontrol.model.DocumentMetadata;
import com.myorg.normcontrol.model.Finding;
import com.myorg.normcontrol.model.Page;
import com.myorg.normcontrol.model.ProjectInfo;
import com.myorg.normcontrol.model.Section;
import com.myorg.normcontrol.patterns.PatternLibrary;
import com.myorg.normcontrol.patterns.RuleDefinition;
import com.myorg.normcontrol.patterns.RuleTarget;
import com.myorg.normcontrol.rules.CompiledRule;
import com.myorg.normcontrol.rules.RuleContext;
import com.myorg.normcontrol.rules.RulePredicateFactory;
import com.myorg.normcontrol.rules.RuleSet;
import com.myorg.normcontrol.service.RuleEngine;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Rule engine over pattern library rules. Findings come out in rule order for each target,
 * which keeps reports reproducible. Page text is cut to {@code maxTextLength} before any
 * check runs.
 */
@Slf4j
public class PatternRuleEngine implements RuleEngine {

    private final RulePredicateFactory predicateFactory;
    private final int maxTextLength;

    public PatternRuleEngine(RulePredicateFactory predicateFactory) {
        this(predicateFactory, ComplianceProperties.DEFAULT_MAX_TEXT_LENGTH);
    }

    public PatternRuleEngine(RulePredicateFactory predicateFactory, int maxTextLength) {
        this.predicateFactory = predicateFactory;
        this.maxTextLength = maxTextLength;
    }

    @Override
    public RuleSet prepare(PatternLibrary library, DocumentMetadata metadata) {
        ProjectInfo info = metadata == null ? ProjectInfo.empty() : metadata.getProjectInfo();
        List<RuleDefinition> normRules = library.normRules(info.getDocumentMark(), info.getStage());

        List<CompiledRule> compiled = new ArrayList<>();
        for (RuleDefinition rule : library.rules()) {
            compiled.add(new CompiledRule(rule, predicateFactory.create(rule.getCheck(), library)));
        }
        for (RuleDefinition rule : normRules) {
            compiled.add(new CompiledRule(rule, predicateFactory.create(rule.getCheck(), library)));
        }
        log.debug("Prepared {} rules ({} normative) for mark={}, stage={}",
                compiled.size(), normRules.size(), info.getDocumentMark(), info.getStage());
        return new RuleSet(library.version(), compiled);
    }

    @Override
    public List<Finding> evaluatePage(RuleSet rules, Page page, DocumentMetadata metadata) {
        return evaluate(rules, RuleTarget.PAGE, RuleContext.forPage(page, metadata, maxTextLength));
    }

    @Override
    public List<Finding> evaluateSection(RuleSet rules, Section section, List<Page> sectionPages,
                                         DocumentMetadata metadata) {
        return evaluate(rules, RuleTarget.SECTION,
                RuleContext.forSection(section, sectionPages, metadata, maxTextLength));
    }

    @Override
    public List<Finding> evaluateDocument(RuleSet rules, List<Page> pages, DocumentMetadata metadata) {
        return evaluate(rules, RuleTarget.DOCUMENT, RuleContext.forDocument(pages, metadata, maxTextLength));
    }

    private static List<Finding> evaluate(RuleSet rules, RuleTarget target, RuleContext context) {
        List<Finding> findings = new ArrayList<>();
        for (CompiledRule rule : rules.rules(target)) {
            Finding finding = rule.evaluate(context);
            if (finding != null) {
                findings.add(finding);
            }
        }
        return findings;
    }
}
