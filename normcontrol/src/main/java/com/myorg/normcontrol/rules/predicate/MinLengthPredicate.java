package com.myorg.normcontrol.rules.predicate;

import com.myorg.normcontrol.rules.RuleContext;
import com.myorg.normcontrol.rules.RulePredicate;

/**
 * Holds when the trimmed text has at least {@code minLength} characters.
 */
public final class MinLengthPredicate implements RulePredicate {

    private final int minLength;

    public MinLengthPredicate(int minLength) {
        this.minLength = minLength;
    }

    @Override
    public boolean test(RuleContext context) {
        return context.getText().strip().length() >= minLength;
    }
}
