package io.buildeval.core.evaluation;

import io.buildeval.core.construction.MetadataElement;

/**
 * A metadata value on an item or item definition. Immutable; the predecessor is
 * the value this one replaced on the same item, on its item definition, or on
 * the item it was copied from.
 */
public final class EvaluatedMetadata {

    private final String name;
    private final String escapedValue;
    private final MetadataElement xml;
    private final EvaluatedMetadata predecessor;
    private final boolean imported;

    EvaluatedMetadata(
            String name, String escapedValue, MetadataElement xml, EvaluatedMetadata predecessor, boolean imported) {
        this.name = name;
        this.escapedValue = escapedValue == null ? "" : escapedValue;
        this.xml = xml;
        this.predecessor = predecessor;
        this.imported = imported;
    }

    public String name() {
        return name;
    }

    public String evaluatedValue() {
        return EscapingUtilities.unescape(escapedValue);
    }

    public String evaluatedValueEscaped() {
        return escapedValue;
    }

    /**
     * The value as written, or the evaluated value when there is no defining
     * element.
     */
    public String unevaluatedValue() {
        return xml != null ? xml.value() : escapedValue;
    }

    /** The defining element, or {@code null}. */
    public MetadataElement xml() {
        return xml;
    }

    /** The value this one replaced, or {@code null}. */
    public EvaluatedMetadata predecessor() {
        return predecessor;
    }

    public boolean isImported() {
        return imported;
    }

    @Override
    public String toString() {
        return name + "=" + evaluatedValue();
    }
}
