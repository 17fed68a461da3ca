package io.buildeval.core.evaluation.expander;

import io.buildeval.core.evaluation.EscapingUtilities;
import io.buildeval.core.evaluation.ItemExpressionCapture;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Applies one transform of an item vector, either a quoted template such as
 * {@code '%(Filename).obj'} or an item function such as {@code Distinct()}, to
 * a list of items. Functions that are not item functions are invoked as string
 * methods on each include.
 */
final class ItemTransforms {

    private final Expander expander;
    private final Path directory;

    ItemTransforms(Expander expander, Path directory) {
        this.expander = expander;
        this.directory = directory;
    }

    List<ExpandedItem> apply(ItemExpressionCapture transform, List<ExpandedItem> items) {
        if (!transform.isFunction()) {
            return applyTemplate(transform.value(), items);
        }
        List<String> args = arguments(transform.functionArguments());
        String name = transform.functionName().trim();
        switch (name.toLowerCase(Locale.ROOT)) {
            case "distinct":
                return distinct(items, true);
            case "distinctwithcase":
                return distinct(items, false);
            case "reverse": {
                List<ExpandedItem> reversed = new ArrayList<>(items);
                Collections.reverse(reversed);
                return reversed;
            }
            case "count":
                return List.of(ExpandedItem.synthesised(Integer.toString(items.size())));
            case "metadata":
                return metadataValues(items, single(name, args));
            case "withmetadatavalue":
                return withMetadataValue(name, items, args);
            case "hasmetadata": {
                String metadata = single(name, args);
                List<ExpandedItem> result = new ArrayList<>();
                for (ExpandedItem item : items) {
                    if (!item.metadataValueEscaped(metadata, directory).isEmpty()) {
                        result.add(item);
                    }
                }
                return result;
            }
            case "anyhavemetadatavalue":
                return List.of(ExpandedItem.synthesised(withMetadataValue(name, items, args).isEmpty() ? "false" : "true"));
            case "clearmetadata": {
                List<ExpandedItem> result = new ArrayList<>();
                for (ExpandedItem item : items) {
                    result.add(new ExpandedItem(item.includeEscaped(), item.source(), false));
                }
                return result;
            }
            case "directoryname":
                return directoryNames(items);
            default:
                return stringFunction(transform, items);
        }
    }

    private List<ExpandedItem> applyTemplate(String template, List<ExpandedItem> items) {
        List<ExpandedItem> result = new ArrayList<>();
        for (ExpandedItem item : items) {
            String include = expander.expandMetadataLeaveEscaped(template, (type, name) -> {
                if (type != null && item.source() != null && !type.equalsIgnoreCase(item.source().itemType())) {
                    return "";
                }
                return item.metadataValueEscaped(name, directory);
            });
            result.add(item.withInclude(include));
        }
        return result;
    }

    private static List<ExpandedItem> distinct(List<ExpandedItem> items, boolean ignoreCase) {
        Set<String> seen = new HashSet<>();
        List<ExpandedItem> result = new ArrayList<>();
        for (ExpandedItem item : items) {
            String key = ignoreCase ? item.includeEscaped().toLowerCase(Locale.ROOT) : item.includeEscaped();
            if (seen.add(key)) {
                result.add(item);
            }
        }
        return result;
    }

    private List<ExpandedItem> metadataValues(List<ExpandedItem> items, String metadata) {
        List<ExpandedItem> result = new ArrayList<>();
        for (ExpandedItem item : items) {
            String value = item.metadataValueEscaped(metadata, directory);
            for (String part : value.split(";")) {
                String trimmed = part.trim();
                if (!trimmed.isEmpty()) {
                    result.add(item.withInclude(trimmed));
                }
            }
        }
        return result;
    }

    private List<ExpandedItem> withMetadataValue(String function, List<ExpandedItem> items, List<String> args) {
        if (args.size() != 2) {
            throw new IllegalArgumentException(function + " expects 2 arguments but got " + args.size());
        }
        String metadata = args.get(0);
        String expected = args.get(1);
        List<ExpandedItem> result = new ArrayList<>();
        for (ExpandedItem item : items) {
            String value = EscapingUtilities.unescape(item.metadataValueEscaped(metadata, directory));
            if (value.equalsIgnoreCase(expected)) {
                result.add(item);
            }
        }
        return result;
    }

    private List<ExpandedItem> directoryNames(List<ExpandedItem> items) {
        List<ExpandedItem> result = new ArrayList<>();
        for (ExpandedItem item : items) {
            String include = EscapingUtilities.unescape(item.includeEscaped()).replace('\\', '/');
            Path parent = directory.resolve(include).normalize().getParent();
            String name = parent == null ? "" : parent.toString();
            result.add(item.withInclude(EscapingUtilities.escape(name)));
        }
        return result;
    }

    /**
     * Invokes a string method, such as {@code ->Substring(0, 2)}, on each
     * include.
     */
    private List<ExpandedItem> stringFunction(ItemExpressionCapture transform, List<ExpandedItem> items) {
        String call = transform.value().trim();
        List<ExpandedItem> result = new ArrayList<>();
        for (ExpandedItem item : items) {
            String value = expander.invokeStringMethods(EscapingUtilities.unescape(item.includeEscaped()), call);
            result.add(item.withInclude(value));
        }
        return result;
    }

    private static String single(String function, List<String> args) {
        if (args.size() != 1) {
            throw new IllegalArgumentException(function + " expects 1 argument but got " + args.size());
        }
        return args.get(0);
    }

    private static List<String> arguments(String raw) {
        List<String> result = new ArrayList<>();
        for (String arg : FunctionArguments.split(raw)) {
            result.add(EscapingUtilities.unescape(FunctionArguments.unquote(arg)));
        }
        return result;
    }
}
