package com.myorg.normcontrol.rules.predicate;

import com.myorg.normcontrol.rules.RuleContext;
import com.myorg.normcontrol.rules.RulePredicate;

import java.util.List;

public final class AnyOfPredicate implements RulePredicate {

    private final List<RulePredicate> alternatives;

    public AnyOfPredicate(List<RulePredicate> alternatives) {
        this.alternatives = List.copyOf(alternatives);
    }

    @Override
    public boolean test(RuleContext context) {
        return alternatives.stream().anyMatch(p -> p.test(context));
    }
}
