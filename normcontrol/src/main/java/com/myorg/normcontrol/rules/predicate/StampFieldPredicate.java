package com.myorg.normcontrol.rules.predicate;

import com.myorg.normcontrol.rules.RuleContext;
import com.myorg.normcontrol.rules.RulePredicate;

/**
 * Holds when the page stamp has the named field. A page without stamp data fails.
 */
public final class StampFieldPredicate implements RulePredicate {

    private final String field;

    public StampFieldPredicate(String field) {
        this.field = field;
    }

    @Override
    public boolean test(RuleContext context) {
        return context.getStamp() != null && context.getStamp().hasField(field);
    }
}
