package com.myorg.normcontrol.rules.predicate;

import com.myorg.normcontrol.rules.RuleContext;
import com.myorg.normcontrol.rules.RulePredicate;

public final class StampPresentPredicate implements RulePredicate {

    @Override
    public boolean test(RuleContext context) {
        return context.getStamp() != null && context.getStamp().isHasStamp();
    }
}
