package io.buildeval.core.evaluation.expander;

/**
 * Which kinds of references an expansion replaces. Property references are
 * always expanded.
 */
public enum ExpanderOptions {
    PROPERTIES(false, false),
    PROPERTIES_AND_ITEMS(true, false),
    PROPERTIES_AND_METADATA(false, true),
    ALL(true, true);

    private final boolean items;
    private final boolean metadata;

    ExpanderOptions(boolean items, boolean metadata) {
        this.items = items;
        this.metadata = metadata;
    }

    public boolean expandItems() {
        return items;
    }

    public boolean expandMetadata() {
        return metadata;
    }
}
