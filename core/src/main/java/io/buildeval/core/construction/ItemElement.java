package io.buildeval.core.construction;

import java.util.List;
import java.util.Map;

/**
 * An item declaration. The element name is the item type; {@code Include},
 * {@code Exclude}, {@code Remove} and {@code Update} are unevaluated. Metadata
 * declared as attributes and as child elements is exposed through
 * {@link #metadata()} in document order, attributes first.
 */
public final class ItemElement extends ProjectElementContainer {

    ItemElement(String itemType, Map<String, String> attributes, ElementLocation location) {
        super(itemType, attributes, location);
    }

    public String itemType() {
        return elementName();
    }

    public String include() {
        return attribute("Include");
    }

    public String exclude() {
        return attribute("Exclude");
    }

    public String remove() {
        return attribute("Remove");
    }

    public String update() {
        return attribute("Update");
    }

    public List<MetadataElement> metadata() {
        return childrenOfType(MetadataElement.class);
    }
}
