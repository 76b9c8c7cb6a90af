package com.myorg.normcontrol.patterns;

import com.myorg.normcontrol.exception.PatternLibraryException;
import com.myorg.normcontrol.model.PageRole;
import com.myorg.normcontrol.model.ProjectStage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiled, read-only pattern library. Every regex found in the definition is compiled once when
 * the library is built, so a malformed library fails at load time and never mid-analysis.
 * <p>
 * Keyword lists are stored lower-cased; callers match them against lower-cased text. Lookups for
 * unknown keys return empty values rather than failing.
 * <p>
 * Instances are immutable and safe to share between analysis threads.
 */
public final class PatternLibrary {

    public static final int REGEX_FLAGS =
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    public static final String GENERIC_RULE_SET = "generic";
    public static final String ANY_MARK = "*";

    public static final String GENERAL_DATA_INDICATORS = "general_data_indicators";
    public static final String PROJECT_CODE_HINTS = "project_code_hints";
    public static final String PROJECT_NAME_KEYWORDS = "project_name_keywords";
    public static final String PROJECT_NAME_CONTINUATIONS = "project_name_continuations";
    public static final String PROJECT_NAME_LABELS = "project_name_labels";

    private static final String ROLE_PREFIX = "role.";
    private static final String STAGE_PREFIX = "stage.";

    private final String version;
    private final List<PageRole> rolePriority;
    private final Map<String, List<String>> keywordSets;
    private final Map<String, ProjectStage> stageCodes;
    private final List<Pattern> stampIndicators;
    private final List<FieldPatterns> stampFields;
    private final List<Pattern> projectCodePatterns;
    private final Map<String, Double> projectFieldWeights;
    private final List<MarkProfile> marks;
    private final Map<String, String> summaryRecommendations;
    private final List<RuleDefinition> rules;
    private final Map<String, List<RuleDefinition>> normRuleSets;
    private final Map<String, Pattern> patternCache = new ConcurrentHashMap<>();

    /**
     * Extraction patterns for one structured field, in priority order.
     */
    public record FieldPatterns(String field, List<Pattern> patterns, double weight) {
    }

    private PatternLibrary(PatternLibraryDefinition definition) {
        if (definition.getVersion() == null || definition.getVersion().isBlank()) {
            throw new PatternLibraryException("Pattern library has no version");
        }
        this.version = definition.getVersion().trim();
        this.rolePriority = parseRolePriority(definition.getRolePriority());
        this.keywordSets = lowerCaseKeywordSets(definition.getKeywordSets());
        this.stageCodes = parseStageCodes(definition.getStageCodes());
        this.stampIndicators = compileAll(definition.getStampIndicators());
        this.stampFields = compileFields(definition.getStampFields());
        this.projectCodePatterns = compileAll(definition.getProjectCodePatterns());
        this.projectFieldWeights = Collections.unmodifiableMap(new LinkedHashMap<>(definition.getProjectFieldWeights()));
        this.marks = List.copyOf(definition.getMarks());
        this.summaryRecommendations = Collections.unmodifiableMap(
                new LinkedHashMap<>(definition.getSummaryRecommendations()));

        this.rules = List.copyOf(definition.getRules());
        rules.forEach(this::validateRule);
        definition.getNormRules().forEach(this::validateRule);
        this.normRuleSets = resolveNormRuleSets(definition.getNormRules(), definition.getNormRuleSets());
    }

    private static Map<String, List<RuleDefinition>> resolveNormRuleSets(
            List<RuleDefinition> normRules, Map<String, List<String>> setIds) {
        Map<String, RuleDefinition> byId = new LinkedHashMap<>();
        for (RuleDefinition rule : normRules) {
            if (byId.putIfAbsent(rule.getId(), rule) != null) {
                throw new PatternLibraryException("Norm rule " + rule.getId() + " is defined more than once");
            }
        }
        Map<String, List<RuleDefinition>> sets = new LinkedHashMap<>();
        setIds.forEach((key, ids) -> {
            List<RuleDefinition> resolved = new ArrayList<>();
            for (String id : ids == null ? List.<String>of() : ids) {
                RuleDefinition rule = byId.get(id);
                if (rule == null) {
                    throw new PatternLibraryException("Norm rule set '" + key + "' refers to unknown rule '" + id + "'");
                }
                resolved.add(rule);
            }
            sets.put(ruleSetKey(key), List.copyOf(resolved));
        });
        return Collections.unmodifiableMap(sets);
    }

    public static PatternLibrary compile(PatternLibraryDefinition definition) {
        if (definition == null) {
            throw new PatternLibraryException("Pattern library definition is null");
        }
        return new PatternLibrary(definition);
    }

    public String version() {
        return version;
    }

    /**
     * Tie-break order between page roles, highest priority first.
     */
    public List<PageRole> rolePriority() {
        return rolePriority;
    }

    public int priorityOf(PageRole role) {
        int index = rolePriority.indexOf(role);
        return index < 0 ? rolePriority.size() : index;
    }

    public List<String> roleKeywords(PageRole role) {
        return keywords(ROLE_PREFIX + role.getValue());
    }

    public List<String> stageKeywords(ProjectStage stage) {
        return keywords(STAGE_PREFIX + stage.getValue());
    }

    /**
     * Keyword list by category; an unknown category yields an empty list.
     */
    public List<String> keywords(String category) {
        if (category == null) {
            return List.of();
        }
        return keywordSets.getOrDefault(category, List.of());
    }

    public boolean hasKeywordSet(String category) {
        return category != null && keywordSets.containsKey(category);
    }

    /**
     * Maps a stamp stage code such as {@code Р} or {@code П} to a stage.
     */
    public Optional<ProjectStage> stageForCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(stageCodes.get(code.trim().toLowerCase(Locale.ROOT)));
    }

    public List<Pattern> stampIndicators() {
        return stampIndicators;
    }

    public List<FieldPatterns> stampFields() {
        return stampFields;
    }

    public List<Pattern> projectCodePatterns() {
        return projectCodePatterns;
    }

    public double projectFieldWeight(String field) {
        Double weight = projectFieldWeights.get(field);
        return weight == null ? 0.0 : weight;
    }

    public List<MarkProfile> marks() {
        return marks;
    }

    public Optional<MarkProfile> mark(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String key = normalizeMark(code);
        return marks.stream().filter(m -> key.equals(normalizeMark(m.getCode()))).findFirst();
    }

    public Optional<String> summaryRecommendation(String key) {
        return Optional.ofNullable(summaryRecommendations.get(key));
    }

    public List<RuleDefinition> rules() {
        return rules;
    }

    public List<RuleDefinition> rules(RuleTarget target) {
        return rules.stream().filter(r -> r.getTarget() == target).toList();
    }

    public List<RuleDefinition> rulesInCategory(String category) {
        if (category == null) {
            return List.of();
        }
        return rules.stream().filter(r -> category.equals(r.getCategory())).toList();
    }

    /**
     * Normative rules for a document. Mark-specific sets ({@code MARK/stage}, then {@code MARK})
     * are used when present, the {@code generic} set otherwise. Stage-wide sets, keyed with an
     * asterisk in place of the mark, are appended in both cases. Either argument may be {@code null}.
     */
    public List<RuleDefinition> normRules(String markCode, ProjectStage stage) {
        String mark = markCode == null || markCode.isBlank() ? null : ruleSetKey(markCode);
        String stageKey = stage == null ? null : stage.getValue();

        List<RuleDefinition> selected = new ArrayList<>();
        if (mark != null && stageKey != null) {
            selected.addAll(normRuleSets.getOrDefault(mark + "/" + stageKey, List.of()));
        }
        if (mark != null) {
            selected.addAll(normRuleSets.getOrDefault(mark, List.of()));
        }
        if (selected.isEmpty()) {
            selected.addAll(normRuleSets.getOrDefault(GENERIC_RULE_SET, List.of()));
        }
        if (stageKey != null) {
            selected.addAll(normRuleSets.getOrDefault(ANY_MARK + "/" + stageKey, List.of()));
        }
        return List.copyOf(selected);
    }

    /**
     * Compiled form of a regex that appears in this library.
     */
    public Pattern pattern(String regex) {
        return patternCache.computeIfAbsent(regex, PatternLibrary::compileRegex);
    }

    private List<Pattern> compileAll(List<String> regexes) {
        return regexes.stream().map(this::pattern).toList();
    }

    private List<FieldPatterns> compileFields(List<FieldPatternDefinition> definitions) {
        List<FieldPatterns> out = new ArrayList<>();
        for (FieldPatternDefinition def : definitions) {
            if (def.getField() == null || def.getField().isBlank()) {
                throw new PatternLibraryException("Stamp field pattern without a field name");
            }
            if (def.getWeight() < 0) {
                throw new PatternLibraryException("Negative weight for stamp field " + def.getField());
            }
            out.add(new FieldPatterns(def.getField(), compileAll(def.getPatterns()), def.getWeight()));
        }
        return List.copyOf(out);
    }

    private void validateRule(RuleDefinition rule) {
        if (rule.getId() == null || rule.getId().isBlank()) {
            throw new PatternLibraryException("Rule without an id");
        }
        if (rule.getTarget() == null) {
            throw new PatternLibraryException("Rule " + rule.getId() + " has no target");
        }
        if (rule.getSeverity() == null) {
            throw new PatternLibraryException("Rule " + rule.getId() + " has no severity");
        }
        for (String role : rule.getAppliesTo()) {
            parseRole(role, rule.getId());
        }
        validateCheck(rule.getId(), rule.getCheck());
    }

    private void validateCheck(String ruleId, CheckDefinition check) {
        if (check == null || check.getType() == null) {
            throw new PatternLibraryException("Rule " + ruleId + " has no check");
        }
        String type = check.getType();
        if (!CheckTypes.ALL.contains(type)) {
            throw new PatternLibraryException("Rule " + ruleId + " uses unknown check type '" + type + "'");
        }
        switch (type) {
            case CheckTypes.CONTAINS_ANY:
            case CheckTypes.CONTAINS_ALL:
                requireKeywords(ruleId, check);
                break;
            case CheckTypes.MATCHES:
                pattern(require(ruleId, "pattern", check.getPattern()));
                break;
            case CheckTypes.WELL_FORMED:
                pattern(require(ruleId, "pattern", check.getPattern()));
                pattern(require(ruleId, "candidate_pattern", check.getCandidatePattern()));
                break;
            case CheckTypes.STAMP_FIELD:
            case CheckTypes.PROJECT_FIELD:
                require(ruleId, "field", check.getField());
                break;
            case CheckTypes.PROJECT_FIELD_FORMAT:
                require(ruleId, "field", check.getField());
                pattern(require(ruleId, "pattern", check.getPattern()));
                break;
            case CheckTypes.CONDITIONAL:
                requireKeywords(ruleId, check);
                if (check.getChecks().isEmpty()) {
                    throw new PatternLibraryException("Rule " + ruleId + ": conditional check needs a nested check");
                }
                validateCheck(ruleId, check.getChecks().get(0));
                break;
            case CheckTypes.ANY_OF:
                if (check.getChecks().isEmpty()) {
                    throw new PatternLibraryException("Rule " + ruleId + ": any_of check needs nested checks");
                }
                check.getChecks().forEach(nested -> validateCheck(ruleId, nested));
                break;
            case CheckTypes.ROLE_PRESENT:
                parseRole(require(ruleId, "role", check.getRole()), ruleId);
                break;
            case CheckTypes.MIN_LENGTH:
                if (check.getMinLength() == null || check.getMinLength() < 0) {
                    throw new PatternLibraryException("Rule " + ruleId + ": min_length must be a non-negative number");
                }
                break;
            default:
                // stamp_present and sheet_numbering take no attributes
                break;
        }
    }

    private void requireKeywords(String ruleId, CheckDefinition check) {
        if (check.getKeywordSet() != null) {
            if (!hasKeywordSet(check.getKeywordSet())) {
                throw new PatternLibraryException(
                        "Rule " + ruleId + " refers to unknown keyword set '" + check.getKeywordSet() + "'");
            }
            return;
        }
        if (check.getKeywords().isEmpty()) {
            throw new PatternLibraryException("Rule " + ruleId + ": " + check.getType() + " check needs keywords");
        }
    }

    private static String require(String ruleId, String attribute, String value) {
        if (value == null || value.isBlank()) {
            throw new PatternLibraryException("Rule " + ruleId + " is missing '" + attribute + "'");
        }
        return value;
    }

    private static PageRole parseRole(String role, String context) {
        try {
            return PageRole.fromValue(role);
        } catch (IllegalArgumentException e) {
            throw new PatternLibraryException("Invalid role in " + context + ": " + e.getMessage(), e);
        }
    }

    private static List<PageRole> parseRolePriority(List<String> raw) {
        List<PageRole> roles = new ArrayList<>();
        for (String value : raw) {
            PageRole role = parseRole(value, "role_priority");
            if (!roles.contains(role)) {
                roles.add(role);
            }
        }
        return List.copyOf(roles);
    }

    private static Map<String, List<String>> lowerCaseKeywordSets(Map<String, List<String>> raw) {
        Map<String, List<String>> sets = new LinkedHashMap<>();
        raw.forEach((category, keywords) -> sets.put(category, keywords == null ? List.of()
                : keywords.stream().map(k -> k.toLowerCase(Locale.ROOT)).toList()));
        return Collections.unmodifiableMap(sets);
    }

    private static Map<String, ProjectStage> parseStageCodes(Map<String, String> raw) {
        Map<String, ProjectStage> codes = new LinkedHashMap<>();
        raw.forEach((code, stage) -> {
            try {
                codes.put(code.trim().toLowerCase(Locale.ROOT), ProjectStage.fromValue(stage));
            } catch (IllegalArgumentException e) {
                throw new PatternLibraryException("Invalid stage code mapping " + code + " -> " + stage, e);
            }
        });
        return Collections.unmodifiableMap(codes);
    }

    private static String ruleSetKey(String key) {
        return key.trim().toLowerCase(Locale.ROOT);
    }

    private static String normalizeMark(String code) {
        return code == null ? "" : code.trim().toUpperCase(Locale.ROOT);
    }

    private static Pattern compileRegex(String regex) {
        try {
            return Pattern.compile(regex, REGEX_FLAGS);
        } catch (PatternSyntaxException e) {
            throw new PatternLibraryException("Invalid regular expression in pattern library: " + regex, e);
        }
    }
}
