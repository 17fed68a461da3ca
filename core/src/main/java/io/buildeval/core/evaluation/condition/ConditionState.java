package io.buildeval.core.evaluation.condition;

import java.nio.file.Path;

/** What a condition is evaluated against. */
public interface ConditionState {

    /**
     * Expands property, item and metadata references in {@code text}; the
     * result stays escaped.
     */
    String expand(String text);

    /** Directory relative paths in {@code Exists()} are resolved against. */
    Path evaluationDirectory();

    /**
     * Collector for values compared against properties, or {@code null} when
     * not collected.
     */
    default ConditionedProperties conditionedProperties() {
        return null;
    }
}
