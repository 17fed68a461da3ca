package io.buildeval.core.spi;

import io.buildeval.core.construction.ElementLocation;
import io.buildeval.core.evaluation.PropertySource;

/**
 * SPI for observing an evaluation: import decisions, warnings and property
 * tracking.
 *
 * <p>
 * All methods receive immutable event objects and default to doing nothing, so
 * implementations override only what they need. Evaluations of different
 * projects may notify the same listener concurrently, so implementations must
 * be thread-safe. Exceptions thrown by listeners are caught by the evaluator
 * and logged; they never fail the evaluation.
 *
 * <p>
 * Property tracking events are only raised for the kinds enabled in the
 * evaluation settings.
 */
public interface EvaluationListener {

    /** A listener that ignores every event. */
    EvaluationListener NONE = new EvaluationListener() {};

    /**
     * Called when an import resolved to a file whose content is evaluated.
     *
     * @param event contains the importing location, the raw Project attribute
     *     and the imported file
     */
    default void onImportResolved(ImportResolvedEvent event) {}

    /**
     * Called when an import is skipped: false condition, missing file,
     * duplicate or circular.
     *
     * @param event contains the importing location, the reason and, for false
     *     conditions, the condition with its expanded form
     */
    default void onImportIgnored(ImportIgnoredEvent event) {}

    /**
     * Called the first time a property is read before it was assigned.
     *
     * @param event contains the property name and the location of the read
     */
    default void onUninitializedPropertyRead(UninitializedPropertyReadEvent event) {}

    /**
     * Called when a property defined earlier is assigned again.
     *
     * @param event contains name, previous value, new value, location
     */
    default void onPropertyReassignment(PropertyReassignmentEvent event) {}

    /**
     * Called when a property receives its first value.
     *
     * @param event contains name, value and where the value came from
     */
    default void onPropertyInitialValueSet(PropertyInitialValueSetEvent event) {}

    /**
     * Called when an expanded property took its value from an environment
     * variable.
     *
     * @param event contains the variable name, its value and the location of
     *     the read
     */
    default void onEnvironmentVariableRead(EnvironmentVariableReadEvent event) {}

    /**
     * Called for non-fatal problems such as duplicate imports.
     *
     * @param event contains code, message, location
     */
    default void onWarning(WarningEvent event) {}

    /**
     * Called for informational messages.
     *
     * @param event contains the message text
     */
    default void onMessage(MessageEvent event) {}

    // --- Event records ---

    /** Why an import contributed nothing. */
    enum ImportIgnoredReason {
        FALSE_CONDITION,
        FILE_NOT_FOUND,
        EMPTY_EXPRESSION,
        DUPLICATE,
        CIRCULAR,
        SDK_NOT_RESOLVED
    }

    /** Event emitted when an import resolves to a file. */
    record ImportResolvedEvent(ElementLocation location, String unexpandedProject, String importedFile) {}

    /** Event emitted when an import is skipped. */
    record ImportIgnoredEvent(
            ElementLocation location,
            String unexpandedProject,
            String importedFile,
            ImportIgnoredReason reason,
            String condition,
            String expandedCondition) {}

    /** Event emitted on the first read of an unassigned property. */
    record UninitializedPropertyReadEvent(String propertyName, ElementLocation location) {}

    /** Event emitted when a property is reassigned. */
    record PropertyReassignmentEvent(
            String propertyName, String previousValue, String newValue, ElementLocation location) {}

    /** Event emitted when a property receives its first value. */
    record PropertyInitialValueSetEvent(
            String propertyName, String value, PropertySource source, ElementLocation location) {}

    /** Event emitted when a property value is read from the environment. */
    record EnvironmentVariableReadEvent(String variableName, String value, ElementLocation location) {}

    /** Event emitted for evaluation warnings. */
    record WarningEvent(String code, String message, ElementLocation location) {}

    /** Event emitted for informational messages. */
    record MessageEvent(String text) {}
}
