package com.myorg.normcontrol.rules.predicate;

import com.myorg.normcontrol.model.PageRole;
import com.myorg.normcontrol.rules.RuleContext;
import com.myorg.normcontrol.rules.RulePredicate;

/**
 * Holds when at least one page in scope was classified with the role.
 */
public final class RolePresentPredicate implements RulePredicate {

    private final PageRole role;

    public RolePresentPredicate(PageRole role) {
        this.role = role;
    }

    @Override
    public boolean test(RuleContext context) {
        return context.getPages().stream().anyMatch(p -> p.getClassifiedRole() == role);
    }
}
