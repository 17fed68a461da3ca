package io.buildeval.core.evaluation.expander;

import io.buildeval.core.construction.ElementLocation;
import io.buildeval.core.construction.XmlNames;
import io.buildeval.core.error.InvalidProjectFileException;
import io.buildeval.core.evaluation.EscapingUtilities;
import io.buildeval.core.evaluation.ExpressionShredder;
import io.buildeval.core.evaluation.ItemExpressionCapture;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands {@code %(...)} metadata, {@code $(...)} property and {@code @(...)}
 * item references.
 *
 * <p>
 * Expansion runs in that order: metadata outside item vectors first, then
 * properties, then item vectors. Every result stays escaped; callers unescape
 * when they need the final text.
 *
 * <p>
 * Instances are bound to one evaluation and are not thread-safe.
 */
public final class Expander {

    /** Error code for property functions that cannot be evaluated. */
    public static final String INVALID_FUNCTION_CODE = "MSB4184";

    private static final Pattern METADATA = Pattern.compile(
            "%\\(\\s*(?:([A-Za-z_][A-Za-z_0-9\\-]*)\\s*\\.\\s*)?([A-Za-z_][A-Za-z_0-9\\-]*)\\s*\\)");

    private final PropertyProvider properties;
    private final ItemProvider items;
    private final Path directory;
    private final PropertyFunctions functions;
    private final ItemTransforms transforms;

    /**
     * @param properties property values
     * @param items current items; may be {@code null} when items are never
     *     expanded
     * @param directory directory relative paths resolve against, normally the
     *     main project's
     */
    public Expander(PropertyProvider properties, ItemProvider items, Path directory) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.items = items;
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.functions = new PropertyFunctions(properties, text -> expandPropertiesLeaveEscaped(text, null), directory);
        this.transforms = new ItemTransforms(this, directory);
    }

    public Path directory() {
        return directory;
    }

    /** Expands and unescapes. */
    public String expandIntoString(
            String expression, ExpanderOptions options, MetadataProvider metadata, ElementLocation location) {
        return EscapingUtilities.unescape(expandIntoStringLeaveEscaped(expression, options, metadata, location));
    }

    /**
     * Expands every reference {@code options} allows.
     *
     * @param metadata resolves metadata references; ignored unless
     *     {@code options} expands metadata
     * @throws InvalidProjectFileException when a property function cannot be
     *     evaluated
     */
    public String expandIntoStringLeaveEscaped(
            String expression, ExpanderOptions options, MetadataProvider metadata, ElementLocation location) {
        if (expression == null || expression.isEmpty()) {
            return "";
        }
        String result = expression;
        if (options.expandMetadata() && metadata != null) {
            result = expandMetadataLeaveEscaped(result, metadata);
        }
        result = expandPropertiesLeaveEscaped(result, location);
        if (options.expandItems()) {
            result = expandItemVectorsLeaveEscaped(result, location);
        }
        return result;
    }

    /**
     * Replaces {@code $(...)} references. Undefined properties and {@code $()}
     * expand to nothing; an unterminated {@code $(} is kept as text.
     *
     * @throws InvalidProjectFileException when a property function cannot be
     *     evaluated
     */
    public String expandPropertiesLeaveEscaped(String expression, ElementLocation location) {
        int start = expression.indexOf("$(");
        if (start < 0) {
            return expression;
        }
        StringBuilder sb = new StringBuilder(expression.length());
        int copied = 0;
        while (start >= 0) {
            int close = FunctionArguments.indexOfClosingParenthesis(expression, start + 2);
            if (close < 0) {
                break;
            }
            sb.append(expression, copied, start);
            sb.append(expandPropertyBody(expression.substring(start + 2, close).trim(), location));
            copied = close + 1;
            start = expression.indexOf("$(", copied);
        }
        sb.append(expression, copied, expression.length());
        return sb.toString();
    }

    private String expandPropertyBody(String body, ElementLocation location) {
        if (body.isEmpty()) {
            return "";
        }
        if (XmlNames.isValidName(body)) {
            String value = properties.getValueEscaped(body);
            return value == null ? "" : value;
        }
        if (body.regionMatches(true, 0, "Registry:", 0, 9)) {
            return "";
        }
        if (!PropertyFunctions.looksLikeFunction(body)) {
            throw invalidFunction(body, "it is not a valid property name or function", null, location);
        }
        try {
            return functions.evaluate(body);
        } catch (InvalidProjectFileException e) {
            if (e.location() == null && location != null) {
                throw new InvalidProjectFileException(e.getMessage(), e, e.errorCode(), location);
            }
            throw e;
        } catch (RuntimeException e) {
            throw invalidFunction(body, e.getMessage(), e, location);
        }
    }

    /**
     * Replaces {@code %(m)} and {@code %(Type.m)} references that are not
     * inside an item vector. A reference the provider answers with {@code null}
     * is left untouched.
     */
    public String expandMetadataLeaveEscaped(String expression, MetadataProvider metadata) {
        if (expression.indexOf("%(") < 0) {
            return expression;
        }
        List<ItemExpressionCapture> vectors = ExpressionShredder.getReferencedItemExpressions(expression);
        Matcher m = METADATA.matcher(expression);
        StringBuilder sb = new StringBuilder(expression.length());
        int copied = 0;
        while (m.find()) {
            if (insideVector(vectors, m.start())) {
                continue;
            }
            String value = metadata.getMetadataValueEscaped(m.group(1), m.group(2));
            if (value == null) {
                continue;
            }
            sb.append(expression, copied, m.start()).append(value);
            copied = m.end();
        }
        sb.append(expression, copied, expression.length());
        return sb.toString();
    }

    private static boolean insideVector(List<ItemExpressionCapture> vectors, int index) {
        for (ItemExpressionCapture v : vectors) {
            if (index >= v.index() && index < v.index() + v.length()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Replaces item vectors with their items joined by the vector's separator,
     * {@code ;} by default.
     */
    public String expandItemVectorsLeaveEscaped(String expression, ElementLocation location) {
        List<ItemExpressionCapture> vectors = ExpressionShredder.getReferencedItemExpressions(expression);
        if (vectors.isEmpty()) {
            return expression;
        }
        StringBuilder sb = new StringBuilder(expression.length());
        int copied = 0;
        for (ItemExpressionCapture vector : vectors) {
            sb.append(expression, copied, vector.index());
            List<String> includes = new ArrayList<>();
            for (ExpandedItem item : expandVector(vector, location)) {
                includes.add(item.includeEscaped());
            }
            sb.append(String.join(vector.separator() != null ? vector.separator() : ";", includes));
            copied = vector.index() + vector.length();
        }
        sb.append(expression, copied, expression.length());
        return sb.toString();
    }

    /**
     * Expands a fragment that consists of exactly one item vector into items.
     *
     * @param fragment a property-expanded include fragment
     * @return the items with empty includes dropped, or empty when the fragment
     *     is not a single vector
     */
    public Optional<List<ExpandedItem>> expandSingleItemVectorIntoItems(String fragment, ElementLocation location) {
        String trimmed = fragment.trim();
        List<ItemExpressionCapture> vectors = ExpressionShredder.getReferencedItemExpressions(trimmed);
        if (vectors.size() != 1) {
            return Optional.empty();
        }
        ItemExpressionCapture vector = vectors.get(0);
        if (vector.index() != 0 || vector.length() != trimmed.length()) {
            return Optional.empty();
        }
        List<ExpandedItem> result = new ArrayList<>();
        for (ExpandedItem item : expandVector(vector, location)) {
            if (!item.includeEscaped().isEmpty()) {
                result.add(item);
            }
        }
        return Optional.of(result);
    }

    private List<ExpandedItem> expandVector(ItemExpressionCapture vector, ElementLocation location) {
        if (items == null) {
            return List.of();
        }
        List<ExpandedItem> current = new ArrayList<>();
        items.getItems(vector.itemType()).forEach(i -> current.add(ExpandedItem.of(i)));
        List<ExpandedItem> result = current;
        for (ItemExpressionCapture transform : vector.captures()) {
            try {
                result = transforms.apply(transform, result);
            } catch (InvalidProjectFileException e) {
                throw e;
            } catch (RuntimeException e) {
                throw invalidFunction(vector.value(), e.getMessage(), e, location);
            }
        }
        return result;
    }

    String invokeStringMethods(String receiver, String calls) {
        return functions.evaluateOn(receiver, calls);
    }

    private static InvalidProjectFileException invalidFunction(
            String body, String reason, Throwable cause, ElementLocation location) {
        String message = "The expression \"" + body + "\" cannot be evaluated. " + reason;
        return cause == null
                ? new InvalidProjectFileException(message, INVALID_FUNCTION_CODE, location)
                : new InvalidProjectFileException(message, cause, INVALID_FUNCTION_CODE, location);
    }
}
