package com.myorg.normcontrol.rules;

import com.myorg.normcontrol.model.Finding;
import com.myorg.normcontrol.model.PageRole;
import com.myorg.normcontrol.patterns.RuleDefinition;
import com.myorg.normcontrol.patterns.RuleTarget;
import lombok.Getter;

import java.util.EnumSet;
import java.util.Set;

/**
 * A rule definition bound to its predicate.
 */
@Getter
public final class CompiledRule {

    private final RuleDefinition definition;
    private final RulePredicate predicate;
    private final Set<PageRole> appliesTo;

    public CompiledRule(RuleDefinition definition, RulePredicate predicate) {
        this.definition = definition;
        this.predicate = predicate;
        Set<PageRole> roles = EnumSet.noneOf(PageRole.class);
        definition.getAppliesTo().forEach(r -> roles.add(PageRole.fromValue(r)));
        this.appliesTo = roles;
    }

    public String getId() {
        return definition.getId();
    }

    public RuleTarget getTarget() {
        return definition.getTarget();
    }

    public boolean appliesTo(RuleContext context) {
        if (context.getTarget() != definition.getTarget()) {
            return false;
        }
        return appliesTo.isEmpty() || appliesTo.contains(context.getRole());
    }

    /**
     * @return a finding when the rule applies and its predicate does not hold, otherwise {@code null}
     */
    public Finding evaluate(RuleContext context) {
        if (!appliesTo(context) || predicate.test(context)) {
            return null;
        }
        return Finding.builder()
                .ruleId(definition.getId())
                .category(definition.getCategory())
                .severity(definition.getSeverity())
                .target(definition.getTarget())
                .title(definition.getTitle())
                .description(definition.getDescription())
                .recommendation(definition.getRecommendation())
                .normReference(definition.getNormReference())
                .pageNumber(context.getTarget() == RuleTarget.DOCUMENT ? null : context.getPageNumber())
                .sectionType(context.getTarget() == RuleTarget.SECTION ? context.getRole() : null)
                .confidence(context.getConfidence())
                .build();
    }
}
