package io.buildeval.core.evaluation.expander;

/**
 * Resolves {@code %(m)} and {@code %(Type.m)} references for the item being
 * evaluated.
 */
@FunctionalInterface
public interface MetadataProvider {

    /**
     * @param itemType qualifying item type, or {@code null} for an unqualified
     *     reference
     * @param name metadata name
     * @return the escaped value, empty when undefined, or {@code null} to leave
     *     the reference as is
     */
    String getMetadataValueEscaped(String itemType, String name);
}
