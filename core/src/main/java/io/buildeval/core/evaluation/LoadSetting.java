package io.buildeval.core.evaluation;

/**
 * Switches that relax or tighten how imports are loaded. Combine them in an
 * {@link java.util.EnumSet}.
 */
public enum LoadSetting {
    /**
     * Imports of files that do not exist, and SDKs that cannot be resolved, are
     * skipped.
     */
    IGNORE_MISSING_IMPORTS,
    /** Imports whose file is not a well-formed project are skipped. */
    IGNORE_INVALID_IMPORTS,
    /**
     * Imports whose {@code Project} expands to nothing are skipped instead of
     * failing.
     */
    IGNORE_EMPTY_IMPORTS,
    /**
     * Duplicate imports are kept in the imports-including-duplicates view;
     * circular ones are dropped from both.
     */
    RECORD_DUPLICATE_BUT_NOT_CIRCULAR_IMPORTS,
    /** A circular import fails the evaluation. */
    REJECT_CIRCULAR_IMPORTS
}
