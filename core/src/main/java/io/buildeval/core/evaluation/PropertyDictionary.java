package io.buildeval.core.evaluation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Properties by case-insensitive name, in order of first definition. Every
 * {@link #set} is also appended to an ordered history that keeps overwritten
 * entries.
 *
 * <p>
 * Not thread-safe; each evaluation owns its dictionary.
 */
public final class PropertyDictionary {

    private final Map<String, EvaluatedProperty> properties = new LinkedHashMap<>();
    private final List<EvaluatedProperty> history = new ArrayList<>();

    /**
     * Inserts or overwrites a property. The entry currently stored under the
     * same name becomes the predecessor of the stored entry.
     *
     * @return the stored entry
     */
    public EvaluatedProperty set(EvaluatedProperty property) {
        String key = key(property.name());
        EvaluatedProperty prior = properties.get(key);
        EvaluatedProperty stored = prior == null ? property : property.withPredecessor(prior);
        properties.put(key, stored);
        history.add(stored);
        return stored;
    }

    public Optional<EvaluatedProperty> get(String name) {
        return Optional.ofNullable(lookup(name));
    }

    /**
     * Returns the property, or {@code null}. Surrounding whitespace in
     * {@code name} is ignored.
     */
    public EvaluatedProperty lookup(String name) {
        return name == null ? null : properties.get(key(name.trim()));
    }

    /** Removes a property; its history entries are kept. */
    public Optional<EvaluatedProperty> remove(String name) {
        return Optional.ofNullable(properties.remove(key(name)));
    }

    public boolean contains(String name) {
        return lookup(name) != null;
    }

    public int size() {
        return properties.size();
    }

    /** Current properties, one per name. */
    public List<EvaluatedProperty> values() {
        return List.copyOf(properties.values());
    }

    /** Every entry ever set, in order, including overwritten ones. */
    public List<EvaluatedProperty> allEntries() {
        return Collections.unmodifiableList(history);
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
