package io.buildeval.core.evaluation.condition;

/**
 * Which kinds of references a condition may contain. Property references are
 * always allowed.
 */
public enum ParserOptions {
    /**
     * Properties only: property, import and choose conditions outside targets.
     */
    PROPERTIES(false, false, false),
    /** Properties and item lists: item conditions. */
    PROPERTIES_AND_ITEM_LISTS(true, false, false),
    /** Properties and custom metadata: item definition conditions. */
    PROPERTIES_AND_CUSTOM_METADATA(false, false, true),
    /** Everything: item metadata conditions. */
    ALL(true, true, true);

    private final boolean itemLists;
    private final boolean builtInMetadata;
    private final boolean customMetadata;

    ParserOptions(boolean itemLists, boolean builtInMetadata, boolean customMetadata) {
        this.itemLists = itemLists;
        this.builtInMetadata = builtInMetadata;
        this.customMetadata = customMetadata;
    }

    public boolean allowItemLists() {
        return itemLists;
    }

    public boolean allowBuiltInMetadata() {
        return builtInMetadata;
    }

    public boolean allowCustomMetadata() {
        return customMetadata;
    }

    public boolean allowItemMetadata() {
        return builtInMetadata && customMetadata;
    }
}
