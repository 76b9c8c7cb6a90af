package com.myorg.normcontrol.rules.predicate;

import com.myorg.normcontrol.rules.RuleContext;
import com.myorg.normcontrol.rules.RulePredicate;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Every occurrence of {@code candidate} must start with a match of {@code wellFormed}.
 * Text without candidates holds trivially.
 * <p>
 * Used for normative references: {@code ГОСТ 21.501} is a candidate, {@code ГОСТ 21.501-2018}
 * is well formed.
 */
public final class WellFormedPredicate implements RulePredicate {

    private final Pattern candidate;
    private final Pattern wellFormed;

    public WellFormedPredicate(Pattern candidate, Pattern wellFormed) {
        this.candidate = candidate;
        this.wellFormed = wellFormed;
    }

    @Override
    public boolean test(RuleContext context) {
        Matcher m = candidate.matcher(context.getText());
        while (m.find()) {
            if (!wellFormed.matcher(m.group()).lookingAt()) {
                return false;
            }
        }
        return true;
    }
}
