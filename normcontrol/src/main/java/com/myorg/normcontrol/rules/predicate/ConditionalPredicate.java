package com.myorg.normcontrol.rules.predicate;

import com.myorg.normcontrol.rules.RuleContext;
import com.myorg.normcontrol.rules.RulePredicate;

/**
 * "If the trigger holds, the requirement must hold too."
 */
public final class ConditionalPredicate implements RulePredicate {

    private final RulePredicate trigger;
    private final RulePredicate requirement;

    public ConditionalPredicate(RulePredicate trigger, RulePredicate requirement) {
        this.trigger = trigger;
        this.requirement = requirement;
    }

    @Override
    public boolean test(RuleContext context) {
        return !trigger.test(context) || requirement.test(context);
    }
}
