package com.myorg.normcontrol.rules;

import com.myorg.normcontrol.patterns.RuleTarget;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Rules selected for one analysis run, in evaluation order.
 */
public final class RuleSet {

    private final String libraryVersion;
    private final List<CompiledRule> rules;
    private final Map<RuleTarget, List<CompiledRule>> byTarget = new EnumMap<>(RuleTarget.class);

    public RuleSet(String libraryVersion, List<CompiledRule> rules) {
        this.libraryVersion = libraryVersion;
        this.rules = List.copyOf(rules);
        for (RuleTarget target : RuleTarget.values()) {
            byTarget.put(target, this.rules.stream().filter(r -> r.getTarget() == target).toList());
        }
    }

    public String libraryVersion() {
        return libraryVersion;
    }

    public List<CompiledRule> rules() {
        return rules;
    }

    public List<CompiledRule> rules(RuleTarget target) {
        return byTarget.get(target);
    }

    public int size() {
        return rules.size();
    }
}
