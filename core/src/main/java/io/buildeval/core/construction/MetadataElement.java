package io.buildeval.core.construction;

import java.util.Map;

/** A metadata declaration on an item or item definition. */
public final class MetadataElement extends ProjectElement {

    private final String value;
    private final boolean expressedAsAttribute;

    MetadataElement(
            String name,
            String value,
            boolean expressedAsAttribute,
            Map<String, String> attributes,
            ElementLocation location) {
        super(name, attributes, location);
        this.value = value;
        this.expressedAsAttribute = expressedAsAttribute;
    }

    public String name() {
        return elementName();
    }

    /** Unevaluated value. */
    public String value() {
        return value;
    }

    /**
     * {@code true} when declared as an attribute of the item rather than a
     * child element.
     */
    public boolean expressedAsAttribute() {
        return expressedAsAttribute;
    }
}
