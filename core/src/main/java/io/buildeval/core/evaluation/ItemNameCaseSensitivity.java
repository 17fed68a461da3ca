package io.buildeval.core.evaluation;

import java.util.Locale;

/** How item types are compared when items are stored and referenced. */
public enum ItemNameCaseSensitivity {
    /** {@code @(compile)} finds items declared as {@code <Compile>}. */
    CASE_INSENSITIVE,
    /**
     * Item types must match exactly; a mismatched reference expands to nothing.
     */
    CASE_SENSITIVE;

    String key(String itemType) {
        return this == CASE_INSENSITIVE ? itemType.toLowerCase(Locale.ROOT) : itemType;
    }
}
