package io.buildeval.core.evaluation;

/**
 * A {@code %(...)} reference.
 *
 * @param itemType     qualifying item type, or {@code null} for {@code %(Name)}
 * @param metadataName metadata name
 */
public record MetadataReference(String itemType, String metadataName) {

    /** {@code Type.Name} or {@code Name}. */
    public String qualifiedName() {
        return itemType == null ? metadataName : itemType + "." + metadataName;
    }
}
