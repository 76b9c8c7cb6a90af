package com.myorg.normcontrol.patterns;

import java.util.Set;

/**
 * Check type names understood by the rule engine.
 */
public final class CheckTypes {

    public static final String CONTAINS_ANY = "contains_any";
    public static final String CONTAINS_ALL = "contains_all";
    public static final String MATCHES = "matches";
    public static final String WELL_FORMED = "well_formed";
    public static final String STAMP_PRESENT = "stamp_present";
    public static final String STAMP_FIELD = "stamp_field";
    public static final String PROJECT_FIELD = "project_field";
    public static final String PROJECT_FIELD_FORMAT = "project_field_format";
    public static final String CONDITIONAL = "conditional";
    public static final String ANY_OF = "any_of";
    public static final String ROLE_PRESENT = "role_present";
    public static final String SHEET_NUMBERING = "sheet_numbering";
    public static final String MIN_LENGTH = "min_length";

    public static final Set<String> ALL = Set.of(
            CONTAINS_ANY, CONTAINS_ALL, MATCHES, WELL_FORMED, STAMP_PRESENT, STAMP_FIELD,
            PROJECT_FIELD, PROJECT_FIELD_FORMAT, CONDITIONAL, ANY_OF, ROLE_PRESENT,
            SHEET_NUMBERING, MIN_LENGTH);

    private CheckTypes() {
    }
}
