package io.buildeval.core.evaluation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Items grouped by item type, compared according to the configured
 * {@link ItemNameCaseSensitivity}. Keeps every added item in an ordered
 * history, including items removed later.
 *
 * <p>
 * Not thread-safe; each evaluation owns its dictionary.
 */
public final class ItemDictionary {

    private final ItemNameCaseSensitivity caseSensitivity;
    private final Map<String, List<EvaluatedItem>> byType = new LinkedHashMap<>();
    private final List<EvaluatedItem> ordered = new ArrayList<>();
    private final List<EvaluatedItem> history = new ArrayList<>();

    public ItemDictionary(ItemNameCaseSensitivity caseSensitivity) {
        this.caseSensitivity = caseSensitivity;
    }

    public void add(EvaluatedItem item) {
        byType.computeIfAbsent(caseSensitivity.key(item.itemType()), k -> new ArrayList<>()).add(item);
        ordered.add(item);
        history.add(item);
    }

    /** Removes exactly this item instance. */
    public boolean remove(EvaluatedItem item) {
        List<EvaluatedItem> list = byType.get(caseSensitivity.key(item.itemType()));
        if (list == null || !removeIdentical(list, item)) {
            return false;
        }
        removeIdentical(ordered, item);
        return true;
    }

    /** Items of one type in evaluation order; empty when there are none. */
    public List<EvaluatedItem> getItems(String itemType) {
        List<EvaluatedItem> list = byType.get(caseSensitivity.key(itemType));
        return list == null ? List.of() : Collections.unmodifiableList(list);
    }

    /** All current items in evaluation order. */
    public List<EvaluatedItem> items() {
        return Collections.unmodifiableList(ordered);
    }

    /** Item types that currently have at least one item, as first declared. */
    public Set<String> itemTypes() {
        return byType.values().stream()
                .filter(l -> !l.isEmpty())
                .map(l -> l.get(0).itemType())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public int size() {
        return ordered.size();
    }

    /** Every item ever added, in order. */
    public List<EvaluatedItem> allEntries() {
        return Collections.unmodifiableList(history);
    }

    public ItemNameCaseSensitivity caseSensitivity() {
        return caseSensitivity;
    }

    private static boolean removeIdentical(List<EvaluatedItem> list, EvaluatedItem item) {
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i) == item) {
                list.remove(i);
                return true;
            }
        }
        return false;
    }
}
