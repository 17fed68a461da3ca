package io.buildeval.core.construction;

import java.util.Map;

/**
 * A property assignment inside a {@code <PropertyGroup>}; the element name is
 * the property name.
 */
public final class PropertyElement extends ProjectElement {

    private final String value;

    PropertyElement(String name, String value, Map<String, String> attributes, ElementLocation location) {
        super(name, attributes, location);
        this.value = value;
    }

    public String name() {
        return elementName();
    }

    /** Unevaluated value. */
    public String value() {
        return value;
    }
}
