package com.myorg.normcontrol.rules.predicate;

import com.myorg.normcontrol.rules.RuleContext;
import com.myorg.normcontrol.rules.RulePredicate;

public final class ProjectFieldPredicate implements RulePredicate {

    private final String field;

    public ProjectFieldPredicate(String field) {
        this.field = field;
    }

    @Override
    public boolean test(RuleContext context) {
        return context.getMetadata().getProjectInfo().hasField(field);
    }
}
