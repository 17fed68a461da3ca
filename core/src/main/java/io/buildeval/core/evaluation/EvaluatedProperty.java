package io.buildeval.core.evaluation;

import io.buildeval.core.construction.PropertyElement;
import java.util.Objects;

/**
 * A property after evaluation. Immutable; the predecessor chain points
 * backwards only, to the property this one replaced, and ends in {@code null}.
 */
public final class EvaluatedProperty {

    private final String name;
    private final String escapedValue;
    private final String unevaluatedValue;
    private final PropertySource source;
    private final PropertyElement xml;
    private final EvaluatedProperty predecessor;
    private final boolean imported;

    EvaluatedProperty(
            String name,
            String escapedValue,
            String unevaluatedValue,
            PropertySource source,
            PropertyElement xml,
            EvaluatedProperty predecessor,
            boolean imported) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.escapedValue = escapedValue == null ? "" : escapedValue;
        this.unevaluatedValue = unevaluatedValue == null ? this.escapedValue : unevaluatedValue;
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.xml = xml;
        this.predecessor = predecessor;
        this.imported = imported;
    }

    /**
     * A property with no defining element: environment, toolset, global or
     * reserved.
     */
    static EvaluatedProperty of(String name, String escapedValue, PropertySource source) {
        return new EvaluatedProperty(name, escapedValue, escapedValue, source, null, null, false);
    }

    EvaluatedProperty withPredecessor(EvaluatedProperty newPredecessor) {
        return new EvaluatedProperty(name, escapedValue, unevaluatedValue, source, xml, newPredecessor, imported);
    }

    public String name() {
        return name;
    }

    /** The value with escape sequences decoded. */
    public String evaluatedValue() {
        return EscapingUtilities.unescape(escapedValue);
    }

    /** The value as stored by the engine, with {@code %XX} escapes intact. */
    public String evaluatedValueEscaped() {
        return escapedValue;
    }

    /** The value as written, before expansion. */
    public String unevaluatedValue() {
        return unevaluatedValue;
    }

    public PropertySource source() {
        return source;
    }

    /**
     * The defining element, or {@code null} for properties that do not come
     * from a project file.
     */
    public PropertyElement xml() {
        return xml;
    }

    /** The property this one overwrote, or {@code null}. */
    public EvaluatedProperty predecessor() {
        return predecessor;
    }

    /**
     * {@code true} when the defining element lives in a file other than the
     * main project.
     */
    public boolean isImported() {
        return imported;
    }

    public boolean isGlobal() {
        return source == PropertySource.GLOBAL;
    }

    public boolean isEnvironment() {
        return source == PropertySource.ENVIRONMENT;
    }

    public boolean isReserved() {
        return source == PropertySource.RESERVED;
    }

    @Override
    public String toString() {
        return name + "=" + evaluatedValue();
    }
}
