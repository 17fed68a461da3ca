package io.buildeval.core.evaluation.expander;

/** Supplies property values to an {@link Expander}. */
@FunctionalInterface
public interface PropertyProvider {

    /**
     * Returns the escaped value of a property.
     *
     * @param name property name, already trimmed
     * @return the value, or {@code null} when the property is not defined
     */
    String getValueEscaped(String name);
}
