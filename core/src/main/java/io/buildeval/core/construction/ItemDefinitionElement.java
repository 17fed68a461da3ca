package io.buildeval.core.construction;

import java.util.List;
import java.util.Map;

/**
 * Default metadata for one item type, declared inside an
 * {@code <ItemDefinitionGroup>}.
 */
public final class ItemDefinitionElement extends ProjectElementContainer {

    ItemDefinitionElement(String itemType, Map<String, String> attributes, ElementLocation location) {
        super(itemType, attributes, location);
    }

    public String itemType() {
        return elementName();
    }

    public List<MetadataElement> metadata() {
        return childrenOfType(MetadataElement.class);
    }
}
