package com.myorg.normcontrol.rules.predicate;

import com.myorg.normcontrol.rules.RuleContext;
import com.myorg.normcontrol.rules.RulePredicate;

import java.util.List;
import java.util.Locale;

/**
 * Holds when the text contains at least one keyword (case-insensitive substring match).
 */
public final class ContainsAnyPredicate implements RulePredicate {

    private final List<String> keywords;

    public ContainsAnyPredicate(List<String> keywords) {
        this.keywords = keywords.stream().map(k -> k.toLowerCase(Locale.ROOT)).toList();
    }

    @Override
    public boolean test(RuleContext context) {
        String text = context.getLowerText();
        return keywords.stream().anyMatch(text::contains);
    }
}
