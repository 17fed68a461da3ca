package io.buildeval.core.evaluation;

import io.buildeval.core.construction.ProjectRootElement;
import io.buildeval.core.error.ConditionEvaluationException;
import io.buildeval.core.evaluation.condition.ConditionEvaluator;
import io.buildeval.core.evaluation.condition.ConditionState;
import io.buildeval.core.evaluation.condition.ParserOptions;
import io.buildeval.core.evaluation.expander.Expander;
import io.buildeval.core.evaluation.expander.ExpanderOptions;
import io.buildeval.core.toolset.Toolset;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * The result of one evaluation pass. Immutable once returned by the
 * {@link Evaluator}; a re-evaluation produces a new instance.
 */
public final class EvaluatedProject {

    private final ProjectRootElement xml;
    private final Toolset toolset;
    private final PropertyDictionary properties;
    private final ItemDictionary items;
    private final Map<String, ItemDefinition> itemDefinitions;
    private final List<EvaluatedMetadata> allEvaluatedItemDefinitionMetadata;
    private final List<ResolvedImport> imports;
    private final List<ResolvedImport> importsIncludingDuplicates;
    private final Map<String, EvaluatedTarget> targets;
    private final List<String> defaultTargets;
    private final List<String> initialTargets;
    private final Map<String, String> globalProperties;
    private final Map<String, List<String>> conditionedProperties;
    private final ConditionEvaluator conditionEvaluator;
    private final Expander expander;

    EvaluatedProject(
            ProjectRootElement xml,
            Toolset toolset,
            PropertyDictionary properties,
            ItemDictionary items,
            Map<String, ItemDefinition> itemDefinitions,
            List<EvaluatedMetadata> allEvaluatedItemDefinitionMetadata,
            List<ResolvedImport> imports,
            List<ResolvedImport> importsIncludingDuplicates,
            Map<String, EvaluatedTarget> targets,
            List<String> defaultTargets,
            List<String> initialTargets,
            Map<String, String> globalProperties,
            Map<String, List<String>> conditionedProperties,
            ConditionEvaluator conditionEvaluator) {
        this.xml = xml;
        this.toolset = toolset;
        this.properties = properties;
        this.items = items;
        this.itemDefinitions = Collections.unmodifiableMap(new LinkedHashMap<>(itemDefinitions));
        this.allEvaluatedItemDefinitionMetadata = List.copyOf(allEvaluatedItemDefinitionMetadata);
        this.imports = List.copyOf(imports);
        this.importsIncludingDuplicates = List.copyOf(importsIncludingDuplicates);
        this.targets = Collections.unmodifiableMap(new LinkedHashMap<>(targets));
        this.defaultTargets = List.copyOf(defaultTargets);
        this.initialTargets = List.copyOf(initialTargets);
        Map<String, String> globals = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        globals.putAll(globalProperties);
        this.globalProperties = Collections.unmodifiableMap(globals);
        this.conditionedProperties = conditionedProperties;
        this.conditionEvaluator = conditionEvaluator;
        this.expander = new Expander(this::propertyValueEscaped, items::getItems, xml.directory());
    }

    /** The main project. */
    public ProjectRootElement xml() {
        return xml;
    }

    public Path fullPath() {
        return xml.fullPath();
    }

    public Path directory() {
        return xml.directory();
    }

    public Toolset toolset() {
        return toolset;
    }

    // --- Properties ---

    public Optional<EvaluatedProperty> getProperty(String name) {
        return properties.get(name);
    }

    /**
     * Unescaped value of a property, or the empty string when it is not
     * defined.
     */
    public String getPropertyValue(String name) {
        return getProperty(name).map(EvaluatedProperty::evaluatedValue).orElse("");
    }

    /** Current properties, one per name. */
    public List<EvaluatedProperty> properties() {
        return properties.values();
    }

    /**
     * Every property assignment of the pass: first the properties without a
     * defining element (environment, toolset, global, reserved), then every
     * assignment from project files whose condition was true, in evaluation
     * order, including overwritten ones.
     */
    public List<EvaluatedProperty> allEvaluatedProperties() {
        List<EvaluatedProperty> result = new ArrayList<>();
        for (EvaluatedProperty p : properties.allEntries()) {
            if (p.xml() == null) {
                result.add(p);
            }
        }
        for (EvaluatedProperty p : properties.allEntries()) {
            if (p.xml() != null) {
                result.add(p);
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Global properties this pass was evaluated with, by case-insensitive name.
     */
    public Map<String, String> globalProperties() {
        return globalProperties;
    }

    // --- Items ---

    public List<EvaluatedItem> getItems(String itemType) {
        return items.getItems(itemType);
    }

    public List<EvaluatedItem> items() {
        return items.items();
    }

    public Set<String> itemTypes() {
        return items.itemTypes();
    }

    /** Every item created by the pass, including items removed later. */
    public List<EvaluatedItem> allEvaluatedItems() {
        return items.allEntries();
    }

    /**
     * Item definitions by item type; keys are the type names as first declared.
     */
    public Map<String, ItemDefinition> itemDefinitions() {
        return itemDefinitions;
    }

    public Optional<ItemDefinition> getItemDefinition(String itemType) {
        for (ItemDefinition definition : itemDefinitions.values()) {
            if (items.caseSensitivity().key(definition.itemType()).equals(items.caseSensitivity().key(itemType))) {
                return Optional.of(definition);
            }
        }
        return Optional.empty();
    }

    /**
     * Every item definition metadata assignment whose condition was true, in
     * evaluation order.
     */
    public List<EvaluatedMetadata> allEvaluatedItemDefinitionMetadata() {
        return allEvaluatedItemDefinitionMetadata;
    }

    // --- Imports and targets ---

    public List<ResolvedImport> imports() {
        return imports;
    }

    public List<ResolvedImport> importsIncludingDuplicates() {
        return importsIncludingDuplicates;
    }

    /** Targets by case-insensitive name; the last definition of a name wins. */
    public Map<String, EvaluatedTarget> targets() {
        return targets;
    }

    public Optional<EvaluatedTarget> getTarget(String name) {
        return Optional.ofNullable(targets.get(name.toLowerCase(Locale.ROOT)));
    }

    public List<String> defaultTargets() {
        return defaultTargets;
    }

    public List<String> initialTargets() {
        return initialTargets;
    }

    /**
     * Values properties were compared against in conditions, per property name.
     */
    public Map<String, List<String>> conditionedProperties() {
        return conditionedProperties;
    }

    /**
     * Evaluates a condition against the final state, relative to the main
     * project directory.
     *
     * @throws ConditionEvaluationException when the condition is malformed
     */
    public boolean evaluateCondition(String condition) {
        ConditionState state = new ConditionState() {
            @Override
            public String expand(String text) {
                return expander.expandIntoStringLeaveEscaped(text, ExpanderOptions.PROPERTIES_AND_ITEMS, null, null);
            }

            @Override
            public Path evaluationDirectory() {
                return xml.directory();
            }
        };
        return conditionEvaluator.evaluate(condition, ParserOptions.PROPERTIES_AND_ITEM_LISTS, state, null);
    }

    private String propertyValueEscaped(String name) {
        EvaluatedProperty property = properties.lookup(name);
        if (property != null) {
            return property.evaluatedValueEscaped();
        }
        return ThisFileProperties.valueEscaped(name.trim(), xml);
    }

    @Override
    public String toString() {
        return "EvaluatedProject[" + xml.fullPath() + ", properties=" + properties.size() + ", items=" + items.size()
                + ", imports=" + imports.size() + "]";
    }
}
