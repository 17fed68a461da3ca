package io.buildeval.core.evaluation.condition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Values that properties are compared against in equality conditions, such as
 * {@code Debug} and {@code AnyCPU} for
 * {@code '$(Configuration)|$(Platform)' == 'Debug|AnyCPU'}. Values are distinct
 * per property, compared case-insensitively, and kept in first-seen order.
 *
 * <p>
 * Not thread-safe; one instance belongs to one evaluation.
 */
public final class ConditionedProperties {

    private static final Pattern SINGLE_PROPERTY = Pattern.compile("^\\$\\(([^$()]*)\\)$");

    private final Map<String, List<String>> values = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    /**
     * Pairs the {@code |}-separated pieces of an unexpanded side with the
     * pieces of the other, expanded side and records every piece that is
     * compared against a single property reference.
     */
    void update(String unexpandedSide, String expandedOtherSide) {
        if (unexpandedSide == null || expandedOtherSide == null || expandedOtherSide.isEmpty()) {
            return;
        }
        String[] left = unexpandedSide.split("\\|", -1);
        String[] right = expandedOtherSide.split("\\|", -1);
        for (int i = 0; i < left.length && i < right.length; i++) {
            Matcher m = SINGLE_PROPERTY.matcher(left[i].trim());
            if (m.matches()) {
                add(m.group(1).trim(), right[i]);
            }
        }
    }

    void add(String property, String value) {
        List<String> list = values.computeIfAbsent(property, k -> new ArrayList<>());
        for (String existing : list) {
            if (existing.equalsIgnoreCase(value)) {
                return;
            }
        }
        list.add(value);
    }

    /** Snapshot keyed by property name, case-insensitive. */
    public Map<String, List<String>> asMap() {
        Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        values.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(copy);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }
}
