package io.buildeval.core.evaluation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Default metadata for one item type, merged from every item definition group
 * that applied.
 */
public final class ItemDefinition {

    private final String itemType;
    private final Map<String, EvaluatedMetadata> metadata = new LinkedHashMap<>();

    ItemDefinition(String itemType) {
        this.itemType = itemType;
    }

    public String itemType() {
        return itemType;
    }

    public Optional<EvaluatedMetadata> getMetadata(String name) {
        return Optional.ofNullable(metadata.get(name.toLowerCase(Locale.ROOT)));
    }

    /** Unescaped value, or the empty string when not defined. */
    public String getMetadataValue(String name) {
        return getMetadata(name).map(EvaluatedMetadata::evaluatedValue).orElse("");
    }

    /** Current metadata, one per name, in order of first definition. */
    public List<EvaluatedMetadata> metadata() {
        return List.copyOf(metadata.values());
    }

    public int metadataCount() {
        return metadata.size();
    }

    void setMetadata(EvaluatedMetadata value) {
        metadata.put(value.name().toLowerCase(Locale.ROOT), value);
    }

    @Override
    public String toString() {
        return itemType + metadata.values();
    }
}
