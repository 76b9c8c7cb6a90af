package com.myorg.normcontrol.rules;

/**
 * A compliance requirement. {@link #test} returns {@code true} when the context satisfies it;
 * a rule emits a finding when its predicate does not hold.
 * <p>
 * Implementations must be side-effect free and thread-safe.
 */
@FunctionalInterface
public interface RulePredicate {

    boolean test(RuleContext context);
}
