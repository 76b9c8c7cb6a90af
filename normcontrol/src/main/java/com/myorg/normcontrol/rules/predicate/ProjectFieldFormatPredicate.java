package com.myorg.normcontrol.rules.predicate;

import com.myorg.normcontrol.rules.RuleContext;
import com.myorg.normcontrol.rules.RulePredicate;

import java.util.regex.Pattern;

/**
 * Holds when the project field is absent or matches {@code format}. Absence is left to a
 * {@link ProjectFieldPredicate} rule so one defect is not reported twice.
 */
public final class ProjectFieldFormatPredicate implements RulePredicate {

    private final String field;
    private final Pattern format;

    public ProjectFieldFormatPredicate(String field, Pattern format) {
        this.field = field;
        this.format = format;
    }

    @Override
    public boolean test(RuleContext context) {
        String value = context.getMetadata().getProjectInfo().fieldValue(field);
        if (value == null || value.isBlank()) {
            return true;
        }
        return format.matcher(value.trim()).find();
    }
}
