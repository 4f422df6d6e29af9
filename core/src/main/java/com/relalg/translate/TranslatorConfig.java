package com.relalg.translate;

/**
 * Constants shared by the translators and their collaborators.
 */
public final class TranslatorConfig {

    private TranslatorConfig() {} // Utility class

    /** Function of the synthetic per-row ordinal that LIMIT/OFFSET is lowered to */
    public static final String ROWNUM_FUNCTION = "rownum";

    /** Function tag of a column reference in expression ASTs */
    public static final String COLUMN_VALUE_FUNCTION = "columnValue";

    /** Base name of the resource bundle holding error and warning texts */
    public static final String MESSAGE_BUNDLE = "messages";

    /** Metadata key marking relations defined inline in the query */
    public static final String META_INLINE_RELATION = "isInlineRelation";

    /** Metadata key holding the source text of an inline relation */
    public static final String META_INLINE_DEFINITION = "inlineRelationDefinition";

    // ==================== Message keys ====================

    public static final String ERROR_RELATION_NOT_FOUND = "db.messages.translate.error-relation-not-found";

    public static final String WARNING_DISTINCT_MISSING = "db.messages.translate.warning-distinct-missing";

    public static final String WARNING_IGNORED_ALL_ON_SET_OPERATORS =
        "db.messages.translate.warning-ignored-all-on-set-operators";
}
