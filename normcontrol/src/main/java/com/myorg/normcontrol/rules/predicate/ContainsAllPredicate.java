package com.myorg.normcontrol.rules.predicate;

import com.myorg.normcontrol.rules.RuleContext;
import com.myorg.normcontrol.rules.RulePredicate;

import java.util.List;
import java.util.Locale;

public final class ContainsAllPredicate implements RulePredicate {

    private final List<String> keywords;

    public ContainsAllPredicate(List<String> keywords) {
        this.keywords = keywords.stream().map(k -> k.toLowerCase(Locale.ROOT)).toList();
    }

    @Override
    public boolean test(RuleContext context) {
        String text = context.getLowerText();
        return keywords.stream().allMatch(text::contains);
    }
}
