package io.buildeval.core.construction;

import java.util.List;
import java.util.Map;

/** An {@code <ItemGroup>}. */
public final class ItemGroupElement extends ProjectElementContainer {

    ItemGroupElement(Map<String, String> attributes, ElementLocation location) {
        super("ItemGroup", attributes, location);
    }

    public List<ItemElement> items() {
        return childrenOfType(ItemElement.class);
    }
}
