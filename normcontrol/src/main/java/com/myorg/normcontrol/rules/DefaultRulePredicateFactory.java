package com.myorg.normcontrol.rules;

import com.myorg.normcontrol.exception.PatternLibraryException;
import com.myorg.normcontrol.model.PageRole;
import com.myorg.normcontrol.patterns.CheckDefinition;
import com.myorg.normcontrol.patterns.CheckTypes;
import com.myorg.normcontrol.patterns.PatternLibrary;
import com.myorg.normcontrol.rules.predicate.AnyOfPredicate;
import com.myorg.normcontrol.rules.predicate.ConditionalPredicate;
import com.myorg.normcontrol.rules.predicate.ContainsAllPredicate;
import com.myorg.normcontrol.rules.predicate.ContainsAnyPredicate;
import com.myorg.normcontrol.rules.predicate.MinLengthPredicate;
import com.myorg.normcontrol.rules.predicate.PatternMatchPredicate;
import com.myorg.normcontrol.rules.predicate.ProjectFieldFormatPredicate;
import com.myorg.normcontrol.rules.predicate.ProjectFieldPredicate;
import com.myorg.normcontrol.rules.predicate.RolePresentPredicate;
import com.myorg.normcontrol.rules.predicate.SheetNumberingPredicate;
import com.myorg.normcontrol.rules.predicate.StampFieldPredicate;
import com.myorg.normcontrol.rules.predicate.StampPresentPredicate;
import com.myorg.normcontrol.rules.predicate.WellFormedPredicate;

import java.util.List;

/**
 * Factory for every check type in {@link CheckTypes}.
 */
public class DefaultRulePredicateFactory implements RulePredicateFactory {

    @Override
    public RulePredicate create(CheckDefinition check, PatternLibrary library) {
        if (check == null || check.getType() == null) {
            throw new PatternLibraryException("Check definition without a type");
        }
        switch (check.getType()) {
            case CheckTypes.CONTAINS_ANY:
                return new ContainsAnyPredicate(keywords(check, library));
            case CheckTypes.CONTAINS_ALL:
                return new ContainsAllPredicate(keywords(check, library));
            case CheckTypes.MATCHES:
                return new PatternMatchPredicate(library.pattern(check.getPattern()));
            case CheckTypes.WELL_FORMED:
                return new WellFormedPredicate(
                        library.pattern(check.getCandidatePattern()), library.pattern(check.getPattern()));
            case CheckTypes.STAMP_PRESENT:
                return new StampPresentPredicate();
            case CheckTypes.STAMP_FIELD:
                return new StampFieldPredicate(check.getField());
            case CheckTypes.PROJECT_FIELD:
                return new ProjectFieldPredicate(check.getField());
            case CheckTypes.PROJECT_FIELD_FORMAT:
                return new ProjectFieldFormatPredicate(check.getField(), library.pattern(check.getPattern()));
            case CheckTypes.CONDITIONAL:
                return new ConditionalPredicate(
                        new ContainsAnyPredicate(keywords(check, library)),
                        create(firstNested(check), library));
            case CheckTypes.ANY_OF:
                return new AnyOfPredicate(check.getChecks().stream().map(c -> create(c, library)).toList());
            case CheckTypes.ROLE_PRESENT:
                return new RolePresentPredicate(PageRole.fromValue(check.getRole()));
            case CheckTypes.SHEET_NUMBERING:
                return new SheetNumberingPredicate();
            case CheckTypes.MIN_LENGTH:
                return new MinLengthPredicate(check.getMinLength() == null ? 0 : check.getMinLength());
            default:
                throw new PatternLibraryException("Unknown check type '" + check.getType() + "'");
        }
    }

    private static List<String> keywords(CheckDefinition check, PatternLibrary library) {
        if (check.getKeywordSet() != null) {
            return library.keywords(check.getKeywordSet());
        }
        return check.getKeywords();
    }

    private static CheckDefinition firstNested(CheckDefinition check) {
        if (check.getChecks().isEmpty()) {
            throw new PatternLibraryException("Conditional check without a nested check");
        }
        return check.getChecks().get(0);
    }
}
