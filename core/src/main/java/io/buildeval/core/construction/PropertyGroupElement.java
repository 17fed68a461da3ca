package io.buildeval.core.construction;

import java.util.List;
import java.util.Map;

/** A {@code <PropertyGroup>}. */
public final class PropertyGroupElement extends ProjectElementContainer {

    PropertyGroupElement(Map<String, String> attributes, ElementLocation location) {
        super("PropertyGroup", attributes, location);
    }

    public List<PropertyElement> properties() {
        return childrenOfType(PropertyElement.class);
    }
}
