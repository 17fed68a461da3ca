package io.buildeval.core.evaluation;

import io.buildeval.core.cache.ProjectRootElementCache;
import io.buildeval.core.construction.ChooseElement;
import io.buildeval.core.construction.ElementLocation;
import io.buildeval.core.construction.ImportElement;
import io.buildeval.core.construction.ImportGroupElement;
import io.buildeval.core.construction.ItemDefinitionElement;
import io.buildeval.core.construction.ItemDefinitionGroupElement;
import io.buildeval.core.construction.ItemElement;
import io.buildeval.core.construction.ItemGroupElement;
import io.buildeval.core.construction.MetadataElement;
import io.buildeval.core.construction.ProjectElement;
import io.buildeval.core.construction.ProjectElementContainer;
import io.buildeval.core.construction.ProjectRootElement;
import io.buildeval.core.construction.PropertyElement;
import io.buildeval.core.construction.PropertyGroupElement;
import io.buildeval.core.construction.ReservedPropertyNames;
import io.buildeval.core.construction.TargetElement;
import io.buildeval.core.construction.XmlNames;
import io.buildeval.core.error.InvalidConfigurationException;
import io.buildeval.core.error.ProjectEvaluationException;
import io.buildeval.core.evaluation.condition.ConditionEvaluator;
import io.buildeval.core.evaluation.condition.ConditionState;
import io.buildeval.core.evaluation.condition.ConditionedProperties;
import io.buildeval.core.evaluation.condition.ParserOptions;
import io.buildeval.core.evaluation.expander.ExpandedItem;
import io.buildeval.core.evaluation.expander.Expander;
import io.buildeval.core.evaluation.expander.ExpanderOptions;
import io.buildeval.core.evaluation.expander.MetadataProvider;
import io.buildeval.core.sdk.SdkResolverService;
import io.buildeval.core.spi.EvaluationListener;
import io.buildeval.core.spi.EvaluationListener.EnvironmentVariableReadEvent;
import io.buildeval.core.spi.EvaluationListener.PropertyInitialValueSetEvent;
import io.buildeval.core.spi.EvaluationListener.PropertyReassignmentEvent;
import io.buildeval.core.spi.EvaluationListener.UninitializedPropertyReadEvent;
import io.buildeval.core.toolset.SubToolset;
import io.buildeval.core.toolset.Toolset;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates a parsed project into an {@link EvaluatedProject}.
 *
 * <p>
 * A pass sets the initial properties (environment, toolset, sub-toolset,
 * global, reserved), walks properties, imports and {@code <Choose>} depth-first
 * in document order with imported files substituted in place, and then
 * evaluates item definitions, items and targets in the order they were
 * collected.
 *
 * <p>
 * The evaluator itself holds only shared, thread-safe collaborators; every call
 * to {@link #evaluate} works on its own state and publishes the result only
 * when it completed. A fatal error aborts the pass and nothing is published.
 */
public final class Evaluator {

    private static final Logger LOG = LoggerFactory.getLogger(Evaluator.class);

    /** Warning code for a property read before its first assignment. */
    public static final String UNINITIALIZED_PROPERTY_CODE = "MSB4211";

    /** Error code for an invalid name in {@code TreatAsLocalProperty}. */
    public static final String INVALID_TREAT_AS_LOCAL_CODE = "MSB4228";

    /** Property selecting the sub-toolset overlay. */
    public static final String SUB_TOOLSET_VERSION_PROPERTY = "VisualStudioVersion";

    private final ProjectRootElementCache cache;
    private final SdkResolverService sdkResolver;
    private final ConditionEvaluator conditionEvaluator;
    private final EvaluationListener listener;
    private final EvaluationSettings settings;
    private final Map<String, String> environment;

    /**
     * @param cache parsed files, shared with other evaluations
     * @param sdkResolver resolves SDK imports
     * @param conditionEvaluator parses and caches conditions, shared with other
     *     evaluations
     * @param listener receives evaluation events; may be
     *     {@link EvaluationListener#NONE}
     * @param settings evaluation switches
     * @param environment environment variables visible as properties
     */
    public Evaluator(
            ProjectRootElementCache cache,
            SdkResolverService sdkResolver,
            ConditionEvaluator conditionEvaluator,
            EvaluationListener listener,
            EvaluationSettings settings,
            Map<String, String> environment) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.sdkResolver = Objects.requireNonNull(sdkResolver, "sdkResolver must not be null");
        this.conditionEvaluator = Objects.requireNonNull(conditionEvaluator, "conditionEvaluator must not be null");
        this.listener = listener != null ? listener : EvaluationListener.NONE;
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.environment = Map.copyOf(environment);
    }

    public EvaluationSettings settings() {
        return settings;
    }

    /**
     * Evaluates {@code project}.
     *
     * @param globalProperties unescaped global property values; copied
     * @param toolset toolset supplying base properties and import search paths
     * @throws ProjectEvaluationException when the project or one of its imports
     *     cannot be evaluated
     */
    public EvaluatedProject evaluate(ProjectRootElement project, Map<String, String> globalProperties, Toolset toolset) {
        Objects.requireNonNull(project, "project must not be null");
        Objects.requireNonNull(toolset, "toolset must not be null");
        String evaluationId = UUID.randomUUID().toString().substring(0, 8);
        long start = System.nanoTime();
        LOG.debug("Evaluation started: project={}, evaluationId={}", project.fullPath(), evaluationId);
        EvaluatedProject result = new Pass(project, globalProperties, toolset).run();
        LOG.info(
                "Evaluation finished: project={}, evaluationId={}, properties={}, items={}, imports={}, durationMs={}",
                project.fullPath(),
                evaluationId,
                result.properties().size(),
                result.items().size(),
                result.imports().size(),
                (System.nanoTime() - start) / 1_000_000);
        return result;
    }

    /** State of a single evaluation. */
    private final class Pass implements ImportResolver.Host {

        private final ProjectRootElement root;
        private final Path projectDirectory;
        private final Toolset toolset;
        private final Map<String, String> globals = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private final Set<String> treatAsLocal = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        private final PropertyDictionary properties = new PropertyDictionary();
        private final ItemDictionary items = new ItemDictionary(settings.itemNameCaseSensitivity());
        private final Map<String, ItemDefinition> itemDefinitions = new LinkedHashMap<>();
        private final List<EvaluatedMetadata> itemDefinitionMetadataLog = new ArrayList<>();
        private final List<ItemDefinitionGroupElement> itemDefinitionGroups = new ArrayList<>();
        private final List<ItemGroupElement> itemGroups = new ArrayList<>();
        private final List<TargetElement> targetElements = new ArrayList<>();
        private final List<String> initialTargets = new ArrayList<>();
        private List<String> defaultTargets;
        private final ConditionedProperties conditionedProperties = new ConditionedProperties();
        private final Deque<ProjectRootElement> fileStack = new ArrayDeque<>();
        private final ListenerNotifier notifier = new ListenerNotifier(listener);
        private final Expander expander;
        private final ImportResolver importResolver;

        /**
         * File whose {@code MSBuildThisFile*} values expansions currently see.
         */
        private ProjectRootElement currentFile;

        // Uninitialized-read tracking; reads are only tracked while a property element's value is expanded.
        private final Map<String, ElementLocation> usedUninitialized = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private final Set<String> reportedUninitializedReads = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        private String currentPropertyName;
        private ElementLocation readTrackingLocation;

        Pass(ProjectRootElement root, Map<String, String> globalProperties, Toolset toolset) {
            this.root = root;
            this.projectDirectory = root.directory();
            this.toolset = toolset;
            if (globalProperties != null) {
                this.globals.putAll(globalProperties);
            }
            this.currentFile = root;
            this.expander = new Expander(this::getValueEscaped, items::getItems, projectDirectory);
            this.importResolver = new ImportResolver(root, toolset, cache, sdkResolver, settings, notifier, this);
        }

        EvaluatedProject run() {
            addEnvironmentProperties();
            addToolsetProperties();
            addSubToolsetProperties();
            addGlobalProperties();
            addReservedProperties();

            performDepthFirstPass(root);

            for (ItemDefinitionGroupElement group : itemDefinitionGroups) {
                evaluateItemDefinitionGroup(group);
            }
            for (ItemGroupElement group : itemGroups) {
                evaluateItemGroup(group);
            }
            Map<String, EvaluatedTarget> targets = new LinkedHashMap<>();
            for (TargetElement target : targetElements) {
                targets.put(
                        target.name().toLowerCase(Locale.ROOT),
                        new EvaluatedTarget(target.name(), target, target.containingProject() != root));
            }
            List<String> defaults = defaultTargets;
            if (defaults == null || defaults.isEmpty()) {
                defaults = targetElements.isEmpty() ? List.of() : List.of(targetElements.get(0).name());
            }
            List<String> initial = new ArrayList<>();
            for (String target : initialTargets) {
                String unescaped = EscapingUtilities.unescape(target.trim());
                if (!unescaped.isEmpty()) {
                    initial.add(unescaped);
                }
            }

            Map<String, ItemDefinition> definitionsByType = new LinkedHashMap<>();
            itemDefinitions.values().forEach(d -> definitionsByType.put(d.itemType(), d));

            return new EvaluatedProject(
                    root,
                    toolset,
                    properties,
                    items,
                    definitionsByType,
                    itemDefinitionMetadataLog,
                    importResolver.imports(),
                    importResolver.importsIncludingDuplicates(),
                    targets,
                    defaults,
                    initial,
                    globals,
                    conditionedProperties.asMap(),
                    conditionEvaluator);
        }

        // --- Initial properties ---

        private void addEnvironmentProperties() {
            new TreeMap<>(environment).forEach((name, value) -> {
                if (XmlNames.isValidName(name) && !ReservedPropertyNames.isReserved(name)) {
                    setInitial(name, EscapingUtilities.escape(value), PropertySource.ENVIRONMENT);
                }
            });
        }

        private void addToolsetProperties() {
            toolset.properties().forEach((name, value) -> setInitial(
                    name, expander.expandPropertiesLeaveEscaped(value, null), PropertySource.TOOLSET));
        }

        private void addSubToolsetProperties() {
            String version = globals.get(SUB_TOOLSET_VERSION_PROPERTY);
            if (version == null) {
                EvaluatedProperty existing = properties.lookup(SUB_TOOLSET_VERSION_PROPERTY);
                version = existing != null ? existing.evaluatedValue() : toolset.defaultSubToolsetVersion();
            }
            if (version == null || version.isEmpty()) {
                return;
            }
            if (!properties.contains(SUB_TOOLSET_VERSION_PROPERTY)) {
                setInitial(SUB_TOOLSET_VERSION_PROPERTY, EscapingUtilities.escape(version), PropertySource.TOOLSET);
            }
            Optional<SubToolset> subToolset = toolset.subToolset(version);
            if (subToolset.isEmpty()) {
                LOG.debug("No sub-toolset for {}={}", SUB_TOOLSET_VERSION_PROPERTY, version);
                return;
            }
            subToolset.get().properties().forEach((name, value) -> setInitial(
                    name, expander.expandPropertiesLeaveEscaped(value, null), PropertySource.TOOLSET));
        }

        private void addGlobalProperties() {
            globals.forEach((name, value) -> setInitial(name, EscapingUtilities.escape(value), PropertySource.GLOBAL));
        }

        private void addReservedProperties() {
            setInitial(ReservedPropertyNames.TOOLS_VERSION, EscapingUtilities.escape(toolset.toolsVersion()),
                    PropertySource.RESERVED);
            String toolsPath = toolset.toolsPath() != null ? toolset.toolsPath().toString() : "";
            setInitial(ReservedPropertyNames.TOOLS_PATH, EscapingUtilities.escape(toolsPath), PropertySource.RESERVED);
            setInitial(ReservedPropertyNames.BIN_PATH, EscapingUtilities.escape(toolsPath), PropertySource.RESERVED);

            String fileName = root.fileName();
            setReserved(ReservedPropertyNames.PROJECT_FILE, fileName);
            setReserved(ReservedPropertyNames.PROJECT_NAME, WellKnownMetadata.fileNameWithoutExtension(fileName));
            setReserved(ReservedPropertyNames.PROJECT_EXTENSION, WellKnownMetadata.extension(fileName));
            setReserved(ReservedPropertyNames.PROJECT_FULL_PATH, root.fullPath().toString());
            setReserved(ReservedPropertyNames.PROJECT_DIRECTORY, projectDirectory.toString());
            setReserved(ReservedPropertyNames.PROJECT_DIRECTORY_NO_ROOT, ThisFileProperties.withoutRoot(projectDirectory));
        }

        private void setReserved(String name, String unescapedValue) {
            setInitial(name, EscapingUtilities.escape(unescapedValue), PropertySource.RESERVED);
        }

        private void setInitial(String name, String escapedValue, PropertySource source) {
            EvaluatedProperty stored = properties.set(EvaluatedProperty.of(name, escapedValue, source));
            if (settings.tracks(PropertyTracking.PROPERTY_INITIAL_VALUE_SET) && stored.predecessor() == null) {
                notifier.notify("onPropertyInitialValueSet", l -> l.onPropertyInitialValueSet(
                        new PropertyInitialValueSetEvent(name, stored.evaluatedValue(), source, null)));
            }
        }

        // --- Property, import and choose pass ---

        private void performDepthFirstPass(ProjectRootElement file) {
            fileStack.push(file);
            ProjectRootElement outerFile = currentFile;
            currentFile = file;
            try {
                LOG.debug("Evaluating file: file={}, depth={}", file.fullPath(), fileStack.size());
                initialTargets.addAll(ExpressionShredder.splitSemiColonSeparatedList(
                        expander.expandPropertiesLeaveEscaped(file.initialTargets(), file.location())));
                addTreatAsLocalProperties(file);
                updateDefaultTargets(file);

                for (ProjectElement element : file.children()) {
                    if (element instanceof PropertyGroupElement) {
                        evaluatePropertyGroup((PropertyGroupElement) element);
                    } else if (element instanceof ItemGroupElement) {
                        itemGroups.add((ItemGroupElement) element);
                    } else if (element instanceof ItemDefinitionGroupElement) {
                        itemDefinitionGroups.add((ItemDefinitionGroupElement) element);
                    } else if (element instanceof TargetElement) {
                        targetElements.add((TargetElement) element);
                    } else if (element instanceof ImportElement) {
                        evaluateImport((ImportElement) element);
                    } else if (element instanceof ImportGroupElement) {
                        evaluateImportGroup((ImportGroupElement) element);
                    } else if (element instanceof ChooseElement) {
                        evaluateChoose((ChooseElement) element);
                    }
                }
            } finally {
                fileStack.pop();
                currentFile = outerFile;
            }
        }

        private void addTreatAsLocalProperties(ProjectRootElement file) {
            String attribute = file.treatAsLocalProperty();
            if (attribute.isEmpty()) {
                return;
            }
            String expanded = expander.expandPropertiesLeaveEscaped(attribute, file.location());
            for (String entry : expanded.split(";")) {
                String name = EscapingUtilities.unescape(entry).strip();
                if (name.isEmpty()) {
                    continue;
                }
                if (!XmlNames.isValidName(name)) {
                    throw new InvalidConfigurationException(
                            "The name \"" + name + "\" in the TreatAsLocalProperty attribute is not a valid property"
                                    + " name. The character \"" + name.charAt(XmlNames.indexOfInvalidChar(name))
                                    + "\" is not allowed.",
                            INVALID_TREAT_AS_LOCAL_CODE,
                            file.location());
                }
                treatAsLocal.add(name);
            }
        }

        /**
         * The first file, outermost first, that declares default targets wins.
         */
        private void updateDefaultTargets(ProjectRootElement file) {
            if (defaultTargets != null) {
                return;
            }
            String expanded = expander.expandPropertiesLeaveEscaped(file.defaultTargets(), file.location());
            if (expanded.isEmpty()) {
                return;
            }
            properties.set(EvaluatedProperty.of(
                    ReservedPropertyNames.PROJECT_DEFAULT_TARGETS, expanded, PropertySource.RESERVED));
            List<String> targets = new ArrayList<>();
            for (String part : expanded.split(";")) {
                String target = EscapingUtilities.unescape(part.trim());
                if (!target.isEmpty()) {
                    targets.add(target);
                }
            }
            if (!targets.isEmpty()) {
                defaultTargets = targets;
            }
        }

        private void evaluatePropertyGroup(PropertyGroupElement group) {
            if (!evaluatePropertyCondition(group, group.containingProject().directory())) {
                return;
            }
            for (PropertyElement property : group.childrenOfType(PropertyElement.class)) {
                evaluateProperty(property);
            }
        }

        private void evaluateProperty(PropertyElement element) {
            String name = element.name();
            if (!evaluatePropertyCondition(element, projectDirectory)) {
                return;
            }
            if (globals.containsKey(name) && !treatAsLocal.contains(name)) {
                notifier.message("Property \"" + name + "\" was not set to \"" + element.value() + "\" at "
                        + element.location() + " because a global property of the same name takes precedence.");
                return;
            }

            currentPropertyName = name;
            readTrackingLocation = element.location();
            String value;
            try {
                value = expander.expandIntoStringLeaveEscaped(
                        element.value(), ExpanderOptions.PROPERTIES, null, element.location());
            } finally {
                currentPropertyName = null;
                readTrackingLocation = null;
            }

            ElementLocation firstRead = usedUninitialized.remove(name);
            if (firstRead != null && !value.isEmpty()) {
                notifier.warning(
                        UNINITIALIZED_PROPERTY_CODE,
                        "The property \"" + name + "\" is being set to a value for the first time, but it was"
                                + " already consumed at \"" + firstRead + "\".",
                        element.location());
            }

            EvaluatedProperty stored = properties.set(new EvaluatedProperty(
                    name, value, element.value(), PropertySource.XML, element, null, isImported(element)));
            EvaluatedProperty predecessor = stored.predecessor();
            if (predecessor != null) {
                if (!predecessor.evaluatedValueEscaped().equals(value)) {
                    LOG.debug("Property reassignment: $({})=\"{}\" (previous value: \"{}\") at {}",
                            name, stored.evaluatedValue(), predecessor.evaluatedValue(), element.location());
                }
                if (settings.tracks(PropertyTracking.PROPERTY_REASSIGNMENT)) {
                    notifier.notify("onPropertyReassignment", l -> l.onPropertyReassignment(new PropertyReassignmentEvent(
                            name, predecessor.evaluatedValue(), stored.evaluatedValue(), element.location())));
                }
            } else if (settings.tracks(PropertyTracking.PROPERTY_INITIAL_VALUE_SET)) {
                notifier.notify("onPropertyInitialValueSet", l -> l.onPropertyInitialValueSet(
                        new PropertyInitialValueSetEvent(
                                name, stored.evaluatedValue(), PropertySource.XML, element.location())));
            }
        }

        private void evaluateImportGroup(ImportGroupElement group) {
            if (!evaluatePropertyCondition(group, group.containingProject().directory())) {
                LOG.debug("Import group skipped, condition false: condition={}, at={}", group.condition(), group.location());
                return;
            }
            for (ImportElement element : group.childrenOfType(ImportElement.class)) {
                evaluateImport(element);
            }
        }

        private void evaluateImport(ImportElement element) {
            for (ResolvedImport resolved : importResolver.resolve(element)) {
                performDepthFirstPass(resolved.importedProject());
            }
        }

        private void evaluateChoose(ChooseElement choose) {
            for (ProjectElementContainer when : choose.whens()) {
                if (evaluatePropertyCondition(when, projectDirectory)) {
                    evaluateBranch(when);
                    return;
                }
            }
            choose.otherwise().ifPresent(this::evaluateBranch);
        }

        private void evaluateBranch(ProjectElementContainer branch) {
            for (ProjectElement child : branch.children()) {
                if (child instanceof PropertyGroupElement) {
                    evaluatePropertyGroup((PropertyGroupElement) child);
                } else if (child instanceof ItemGroupElement) {
                    itemGroups.add((ItemGroupElement) child);
                } else if (child instanceof ChooseElement) {
                    evaluateChoose((ChooseElement) child);
                }
            }
        }

        // --- Item definitions ---

        private void evaluateItemDefinitionGroup(ItemDefinitionGroupElement group) {
            currentFile = group.containingProject();
            if (!evaluateCondition(group.condition(), ParserOptions.PROPERTIES, null, projectDirectory,
                    group.location(), false)) {
                return;
            }
            for (ItemDefinitionElement element : group.childrenOfType(ItemDefinitionElement.class)) {
                if (!evaluateCondition(element.condition(), ParserOptions.PROPERTIES, null, projectDirectory,
                        element.location(), false)) {
                    continue;
                }
                ItemDefinition definition = itemDefinitions.computeIfAbsent(
                        items.caseSensitivity().key(element.itemType()), k -> new ItemDefinition(element.itemType()));
                MetadataProvider provider = (type, name) -> {
                    if (type != null && !sameItemType(type, definition.itemType())) {
                        return "";
                    }
                    return definition.getMetadata(name).map(EvaluatedMetadata::evaluatedValueEscaped).orElse("");
                };
                for (MetadataElement metadata : element.childrenOfType(MetadataElement.class)) {
                    if (!evaluateCondition(metadata.condition(), ParserOptions.PROPERTIES_AND_CUSTOM_METADATA, provider,
                            projectDirectory, metadata.location(), false)) {
                        continue;
                    }
                    String value = expander.expandIntoStringLeaveEscaped(
                            metadata.value(), ExpanderOptions.PROPERTIES_AND_METADATA, provider, metadata.location());
                    EvaluatedMetadata evaluated = new EvaluatedMetadata(
                            metadata.name(),
                            value,
                            metadata,
                            definition.getMetadata(metadata.name()).orElse(null),
                            isImported(metadata));
                    definition.setMetadata(evaluated);
                    itemDefinitionMetadataLog.add(evaluated);
                }
            }
        }

        // --- Items ---

        private void evaluateItemGroup(ItemGroupElement group) {
            currentFile = group.containingProject();
            if (!evaluateCondition(group.condition(), ParserOptions.PROPERTIES_AND_ITEM_LISTS, null, projectDirectory,
                    group.location(), false)) {
                return;
            }
            for (ItemElement element : group.childrenOfType(ItemElement.class)) {
                if (!evaluateCondition(element.condition(), ParserOptions.PROPERTIES_AND_ITEM_LISTS, null,
                        projectDirectory, element.location(), false)) {
                    continue;
                }
                if (!element.include().isEmpty()) {
                    evaluateInclude(element);
                } else if (!element.remove().isEmpty()) {
                    evaluateRemove(element);
                } else if (!element.update().isEmpty()) {
                    evaluateUpdate(element);
                }
            }
        }

        private void evaluateInclude(ItemElement element) {
            ItemDefinition definition = itemDefinitions.get(items.caseSensitivity().key(element.itemType()));
            Path definingProject = element.containingProject().fullPath();
            boolean imported = isImported(element);
            List<EvaluatedItem> created = new ArrayList<>();

            String expanded = expander.expandPropertiesLeaveEscaped(element.include(), element.location());
            for (String fragment : ExpressionShredder.splitSemiColonSeparatedList(expanded)) {
                Optional<List<ExpandedItem>> vector = expander.expandSingleItemVectorIntoItems(fragment, element.location());
                if (vector.isPresent()) {
                    for (ExpandedItem source : vector.get()) {
                        EvaluatedItem item = new EvaluatedItem(element.itemType(), source.includeEscaped(), element,
                                definition, projectDirectory, definingProject, null, imported);
                        if (source.source() != null && source.carriesMetadata()) {
                            copyMetadata(source.source(), item);
                        }
                        created.add(item);
                    }
                    continue;
                }
                String flattened = expander.expandItemVectorsLeaveEscaped(fragment, element.location());
                for (String piece : ExpressionShredder.splitSemiColonSeparatedList(flattened)) {
                    if (EscapingUtilities.containsWildcards(piece)) {
                        for (FileMatcher.Match match : FileMatcher.match(projectDirectory, EscapingUtilities.unescape(piece))) {
                            created.add(new EvaluatedItem(element.itemType(), EscapingUtilities.escape(match.path()),
                                    element, definition, projectDirectory, definingProject,
                                    EscapingUtilities.escape(match.recursiveDir()), imported));
                        }
                    } else {
                        created.add(new EvaluatedItem(element.itemType(), piece, element, definition,
                                projectDirectory, definingProject, null, imported));
                    }
                }
            }

            if (!element.exclude().isEmpty()) {
                Set<String> excludes = matchKeys(element.exclude(), element.location());
                created.removeIf(item -> excludes.contains(specKey(item.evaluatedInclude())));
            }
            applyMetadata(element, created);
            for (EvaluatedItem item : created) {
                items.add(item);
            }
            LOG.debug("Items included: type={}, count={}, at={}", element.itemType(), created.size(), element.location());
        }

        private void evaluateRemove(ItemElement element) {
            Set<String> keys = matchKeys(element.remove(), element.location());
            int removed = 0;
            for (EvaluatedItem item : new ArrayList<>(items.getItems(element.itemType()))) {
                if (keys.contains(specKey(item.evaluatedInclude())) && items.remove(item)) {
                    removed++;
                }
            }
            LOG.debug("Items removed: type={}, count={}, at={}", element.itemType(), removed, element.location());
        }

        private void evaluateUpdate(ItemElement element) {
            Set<String> keys = matchKeys(element.update(), element.location());
            List<EvaluatedItem> matching = new ArrayList<>();
            for (EvaluatedItem item : items.getItems(element.itemType())) {
                if (keys.contains(specKey(item.evaluatedInclude()))) {
                    matching.add(item);
                }
            }
            applyMetadata(element, matching);
        }

        /**
         * Keys of every item spec an Exclude, Remove or Update attribute names.
         */
        private Set<String> matchKeys(String attribute, ElementLocation location) {
            Set<String> keys = new HashSet<>();
            String expanded = expander.expandPropertiesLeaveEscaped(attribute, location);
            for (String fragment : ExpressionShredder.splitSemiColonSeparatedList(expanded)) {
                Optional<List<ExpandedItem>> vector = expander.expandSingleItemVectorIntoItems(fragment, location);
                if (vector.isPresent()) {
                    vector.get().forEach(i -> keys.add(specKey(EscapingUtilities.unescape(i.includeEscaped()))));
                    continue;
                }
                String flattened = expander.expandItemVectorsLeaveEscaped(fragment, location);
                for (String piece : ExpressionShredder.splitSemiColonSeparatedList(flattened)) {
                    if (EscapingUtilities.containsWildcards(piece)) {
                        FileMatcher.match(projectDirectory, EscapingUtilities.unescape(piece))
                                .forEach(m -> keys.add(specKey(m.path())));
                    } else {
                        keys.add(specKey(EscapingUtilities.unescape(piece)));
                    }
                }
            }
            return keys;
        }

        /**
         * Normalized, case-insensitive form of an item spec used to match items
         * against each other.
         */
        private String specKey(String unescapedSpec) {
            String spec = unescapedSpec.trim().replace('\\', '/');
            try {
                return projectDirectory.resolve(spec).normalize().toString().toLowerCase(Locale.ROOT);
            } catch (InvalidPathException e) {
                return spec.toLowerCase(Locale.ROOT);
            }
        }

        private void copyMetadata(EvaluatedItem source, EvaluatedItem target) {
            List<EvaluatedMetadata> metadata = sameItemType(source.itemType(), target.itemType())
                    ? source.directMetadata()
                    : source.metadata();
            for (EvaluatedMetadata m : metadata) {
                target.setMetadata(m);
            }
        }

        /**
         * Evaluates the item element's metadata, in document order, separately
         * on every item.
         */
        private void applyMetadata(ItemElement element, List<EvaluatedItem> targets) {
            List<MetadataElement> metadataElements = element.metadata();
            if (metadataElements.isEmpty()) {
                return;
            }
            boolean imported = isImported(element);
            for (EvaluatedItem item : targets) {
                MetadataProvider provider = (type, name) -> {
                    if (type != null && !sameItemType(type, item.itemType())) {
                        return "";
                    }
                    return item.getMetadataValueEscaped(name);
                };
                for (MetadataElement metadata : metadataElements) {
                    if (!evaluateCondition(metadata.condition(), ParserOptions.ALL, provider, projectDirectory,
                            metadata.location(), false)) {
                        continue;
                    }
                    String value = expander.expandIntoStringLeaveEscaped(
                            metadata.value(), ExpanderOptions.ALL, provider, metadata.location());
                    item.setMetadata(new EvaluatedMetadata(
                            metadata.name(), value, metadata, metadataPredecessor(item, element, metadata.name()), imported));
                }
            }
        }

        /**
         * The value a new metadata assignment replaces: an earlier assignment
         * by the same element, else the item definition's value, else the value
         * copied from the source item.
         */
        private EvaluatedMetadata metadataPredecessor(EvaluatedItem item, ItemElement element, String name) {
            EvaluatedMetadata direct = item.directMetadata(name);
            if (direct != null && direct.xml() != null && direct.xml().parent() == element) {
                return direct;
            }
            if (item.definition() != null) {
                Optional<EvaluatedMetadata> fromDefinition = item.definition().getMetadata(name);
                if (fromDefinition.isPresent()) {
                    return fromDefinition.get();
                }
            }
            return direct;
        }

        private boolean sameItemType(String a, String b) {
            return items.caseSensitivity().key(a).equals(items.caseSensitivity().key(b));
        }

        // --- Conditions ---

        /**
         * Condition of an element evaluated in the property pass; compared
         * values are collected.
         */
        private boolean evaluatePropertyCondition(ProjectElement element, Path directory) {
            return evaluateCondition(element.condition(), ParserOptions.PROPERTIES, null, directory,
                    element.location(), true);
        }

        private boolean evaluateCondition(
                String condition,
                ParserOptions options,
                MetadataProvider metadata,
                Path directory,
                ElementLocation location,
                boolean collectConditionedProperties) {
            if (condition.isEmpty()) {
                return true;
            }
            return conditionEvaluator.evaluate(
                    condition, options, new State(options, metadata, directory, collectConditionedProperties), location);
        }

        private final class State implements ConditionState {
            private final ExpanderOptions expanderOptions;
            private final MetadataProvider metadata;
            private final Path directory;
            private final boolean collect;

            State(ParserOptions options, MetadataProvider metadata, Path directory, boolean collect) {
                this.expanderOptions = expanderOptionsFor(options);
                this.metadata = metadata;
                this.directory = directory;
                this.collect = collect;
            }

            @Override
            public String expand(String text) {
                return expander.expandIntoStringLeaveEscaped(text, expanderOptions, metadata, null);
            }

            @Override
            public Path evaluationDirectory() {
                return directory;
            }

            @Override
            public ConditionedProperties conditionedProperties() {
                return collect ? conditionedProperties : null;
            }
        }

        private ExpanderOptions expanderOptionsFor(ParserOptions options) {
            switch (options) {
                case PROPERTIES_AND_ITEM_LISTS:
                    return ExpanderOptions.PROPERTIES_AND_ITEMS;
                case PROPERTIES_AND_CUSTOM_METADATA:
                    return ExpanderOptions.PROPERTIES_AND_METADATA;
                case ALL:
                    return ExpanderOptions.ALL;
                default:
                    return ExpanderOptions.PROPERTIES;
            }
        }

        // --- Property lookup ---

        /**
         * Property provider of the expander: stored properties, then the
         * this-file properties.
         */
        private String getValueEscaped(String name) {
            EvaluatedProperty property = properties.lookup(name);
            if (property != null) {
                if (property.isEnvironment() && settings.tracks(PropertyTracking.ENVIRONMENT_VARIABLE_READ)) {
                    ElementLocation location = readTrackingLocation;
                    notifier.notify("onEnvironmentVariableRead", l -> l.onEnvironmentVariableRead(
                            new EnvironmentVariableReadEvent(property.name(), property.evaluatedValue(), location)));
                }
                return property.evaluatedValueEscaped();
            }
            String thisFile = ThisFileProperties.valueEscaped(name.trim(), currentFile);
            if (thisFile != null) {
                return thisFile;
            }
            recordUninitializedRead(name.trim());
            return null;
        }

        private void recordUninitializedRead(String name) {
            if (readTrackingLocation == null || name.equalsIgnoreCase(currentPropertyName)) {
                return;
            }
            ElementLocation location = readTrackingLocation;
            if (settings.warnOnUninitializedProperty() && !usedUninitialized.containsKey(name)) {
                usedUninitialized.put(name, location);
            }
            if (settings.tracks(PropertyTracking.UNINITIALIZED_PROPERTY_READ) && reportedUninitializedReads.add(name)) {
                notifier.notify("onUninitializedPropertyRead", l -> l.onUninitializedPropertyRead(
                        new UninitializedPropertyReadEvent(name, location)));
            }
        }

        private boolean isImported(ProjectElement element) {
            return element.containingProject() != root;
        }

        // --- ImportResolver.Host ---

        @Override
        public String expandProperties(String expression, ElementLocation location) {
            return expander.expandPropertiesLeaveEscaped(expression, location);
        }

        @Override
        public boolean evaluateCondition(String condition, Path directory, ElementLocation location) {
            return evaluateCondition(condition, ParserOptions.PROPERTIES, null, directory, location, true);
        }

        @Override
        public Optional<Boolean> evaluateConditionForLogging(String condition, Path directory, ElementLocation location) {
            return conditionEvaluator.evaluateForLogging(
                    condition, ParserOptions.PROPERTIES, new State(ParserOptions.PROPERTIES, null, directory, false),
                    location);
        }

        @Override
        public String expandForLogging(String condition, ElementLocation location) {
            try {
                return expander.expandPropertiesLeaveEscaped(condition, location);
            } catch (ProjectEvaluationException e) {
                LOG.debug("Condition could not be expanded for logging: condition={}, error={}", condition, e.getMessage());
                return null;
            }
        }

        @Override
        public String propertyValueEscaped(String name) {
            EvaluatedProperty property = properties.lookup(name);
            return property != null ? property.evaluatedValueEscaped() : null;
        }

        @Override
        public boolean isBeingEvaluated(Path file) {
            for (ProjectRootElement open : fileStack) {
                if (open.fullPath().equals(file)) {
                    return true;
                }
            }
            return false;
        }
    }
}
