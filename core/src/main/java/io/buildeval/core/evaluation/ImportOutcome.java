package io.buildeval.core.evaluation;

/** What one {@code <Import>} achieved. */
public enum ImportOutcome {
    /** At least one file was imported. */
    PROJECTS_IMPORTED,
    /**
     * Files were found but all of them were skipped as duplicates or cycles.
     */
    FOUND_FILES_TO_IMPORT_BUT_IGNORED,
    /** The expression expanded to nothing, or its wildcards matched nothing. */
    IMPORT_EXPRESSION_RESOLVED_TO_NOTHING,
    /** An exact path did not exist and missing imports are ignored. */
    TRIED_TO_IMPORT_BUT_FILE_NOT_FOUND
}
