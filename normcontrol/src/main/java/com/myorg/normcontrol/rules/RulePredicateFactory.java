package com.myorg.normcontrol.rules;

import com.myorg.normcontrol.patterns.CheckDefinition;
import com.myorg.normcontrol.patterns.PatternLibrary;

/**
 * Turns declarative check definitions into predicates. Adding a check type means adding a
 * predicate and teaching a factory about it; the engine itself does not change.
 */
public interface RulePredicateFactory {

    RulePredicate create(CheckDefinition check, PatternLibrary library);
}
