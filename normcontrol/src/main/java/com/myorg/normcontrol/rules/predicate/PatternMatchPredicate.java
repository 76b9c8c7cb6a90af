package com.myorg.normcontrol.rules.predicate;

import com.myorg.normcontrol.rules.RuleContext;
import com.myorg.normcontrol.rules.RulePredicate;

import java.util.regex.Pattern;

/**
 * Holds when the pattern is found anywhere in the text.
 */
public final class PatternMatchPredicate implements RulePredicate {

    private final Pattern pattern;

    public PatternMatchPredicate(Pattern pattern) {
        this.pattern = pattern;
    }

    @Override
    public boolean test(RuleContext context) {
        return pattern.matcher(context.getText()).find();
    }
}
