package io.buildeval.core.evaluation;

import io.buildeval.core.construction.ItemElement;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * An item after evaluation.
 *
 * <p>
 * Metadata lookups consult the item's own metadata first and then its item
 * definition. The well-known metadata ({@link WellKnownMetadata}) are computed
 * from the include on every read.
 */
public final class EvaluatedItem {

    private final String itemType;
    private final String includeEscaped;
    private final ItemElement xml;
    private final ItemDefinition definition;
    private final Path baseDirectory;
    private final Path definingProject;
    private final String recursiveDir;
    private final boolean imported;
    private final Map<String, EvaluatedMetadata> metadata = new LinkedHashMap<>();

    EvaluatedItem(
            String itemType,
            String includeEscaped,
            ItemElement xml,
            ItemDefinition definition,
            Path baseDirectory,
            Path definingProject,
            String recursiveDir,
            boolean imported) {
        this.itemType = itemType;
        this.includeEscaped = includeEscaped;
        this.xml = xml;
        this.definition = definition;
        this.baseDirectory = baseDirectory;
        this.definingProject = definingProject;
        this.recursiveDir = recursiveDir;
        this.imported = imported;
    }

    public String itemType() {
        return itemType;
    }

    public String evaluatedInclude() {
        return EscapingUtilities.unescape(includeEscaped);
    }

    public String evaluatedIncludeEscaped() {
        return includeEscaped;
    }

    /** The declaring element. */
    public ItemElement xml() {
        return xml;
    }

    /**
     * The item definition supplying default metadata, or {@code null} when none
     * exists for the type.
     */
    public ItemDefinition definition() {
        return definition;
    }

    public boolean isImported() {
        return imported;
    }

    /** Full path of the file the item was declared in, or {@code null}. */
    public Path definingProject() {
        return definingProject;
    }

    /** Custom metadata set on the item or inherited from its definition. */
    public Optional<EvaluatedMetadata> getMetadata(String name) {
        EvaluatedMetadata direct = metadata.get(key(name));
        if (direct != null) {
            return Optional.of(direct);
        }
        return definition != null ? definition.getMetadata(name) : Optional.empty();
    }

    /**
     * Unescaped value of a custom or well-known metadata, or the empty string.
     */
    public String getMetadataValue(String name) {
        return EscapingUtilities.unescape(getMetadataValueEscaped(name));
    }

    public String getMetadataValueEscaped(String name) {
        if (WellKnownMetadata.isWellKnown(name)) {
            return WellKnownMetadata.compute(name, includeEscaped, baseDirectory, definingProject, recursiveDir);
        }
        return getMetadata(name).map(EvaluatedMetadata::evaluatedValueEscaped).orElse("");
    }

    /**
     * {@code true} when custom metadata of that name is set directly or by the
     * definition.
     */
    public boolean hasMetadata(String name) {
        return getMetadata(name).isPresent();
    }

    /** Metadata set on the item itself, in order of first assignment. */
    public List<EvaluatedMetadata> directMetadata() {
        return List.copyOf(metadata.values());
    }

    /**
     * Effective custom metadata: definition values overridden by the item's
     * own.
     */
    public List<EvaluatedMetadata> metadata() {
        Map<String, EvaluatedMetadata> merged = new LinkedHashMap<>();
        if (definition != null) {
            for (EvaluatedMetadata m : definition.metadata()) {
                merged.put(key(m.name()), m);
            }
        }
        merged.putAll(metadata);
        return new ArrayList<>(merged.values());
    }

    Path baseDirectory() {
        return baseDirectory;
    }

    String recursiveDir() {
        return recursiveDir;
    }

    void setMetadata(EvaluatedMetadata value) {
        metadata.put(key(value.name()), value);
    }

    /** The item's own value of {@code name}, ignoring the definition. */
    EvaluatedMetadata directMetadata(String name) {
        return metadata.get(key(name));
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return itemType + "(" + evaluatedInclude() + ")";
    }
}
