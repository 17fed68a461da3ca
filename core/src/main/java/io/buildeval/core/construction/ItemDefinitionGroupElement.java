package io.buildeval.core.construction;

import java.util.List;
import java.util.Map;

/** An {@code <ItemDefinitionGroup>}. */
public final class ItemDefinitionGroupElement extends ProjectElementContainer {

    ItemDefinitionGroupElement(Map<String, String> attributes, ElementLocation location) {
        super("ItemDefinitionGroup", attributes, location);
    }

    public List<ItemDefinitionElement> itemDefinitions() {
        return childrenOfType(ItemDefinitionElement.class);
    }
}
