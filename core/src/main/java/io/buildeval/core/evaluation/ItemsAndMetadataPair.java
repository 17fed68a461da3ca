package io.buildeval.core.evaluation;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Item types and metadata references found in one or more expressions. Names
 * compare case-insensitively.
 */
public final class ItemsAndMetadataPair {

    private final Set<String> items = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
    private final Map<String, MetadataReference> metadata = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    void addItem(String itemType) {
        items.add(itemType);
    }

    void addMetadata(MetadataReference reference) {
        metadata.put(reference.qualifiedName(), reference);
    }

    /** Referenced item types. */
    public Set<String> items() {
        return Collections.unmodifiableSet(items);
    }

    /**
     * Metadata references keyed by qualified name ({@code Type.Name} or
     * {@code Name}).
     */
    public Map<String, MetadataReference> metadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public boolean isEmpty() {
        return items.isEmpty() && metadata.isEmpty();
    }
}
