package io.buildeval.core.evaluation;

import java.util.List;

/**
 * One item vector ({@code @(Type->'transform'->Function(args), 'separator')})
 * found in an expression, or one transform inside such a vector.
 */
public final class ItemExpressionCapture {

    private final int index;
    private final int length;
    private final String value;
    private final String itemType;
    private final String separator;
    private final int separatorStart;
    private final List<ItemExpressionCapture> captures;
    private final String functionName;
    private final String functionArguments;

    ItemExpressionCapture(
            int index,
            int length,
            String value,
            String itemType,
            String separator,
            int separatorStart,
            List<ItemExpressionCapture> captures,
            String functionName,
            String functionArguments) {
        this.index = index;
        this.length = length;
        this.value = value;
        this.itemType = itemType;
        this.separator = separator;
        this.separatorStart = separatorStart;
        this.captures = captures == null ? List.of() : List.copyOf(captures);
        this.functionName = functionName;
        this.functionArguments = functionArguments;
    }

    static ItemExpressionCapture transform(int index, String value) {
        return new ItemExpressionCapture(index, value.length(), value, null, null, -1, null, null, null);
    }

    /** Position of the first captured character in the source expression. */
    public int index() {
        return index;
    }

    public int length() {
        return length;
    }

    /**
     * The captured text. For quoted transforms this is the text between the
     * quotes.
     */
    public String value() {
        return value;
    }

    /** Item type of a vector capture; {@code null} for transform captures. */
    public String itemType() {
        return itemType;
    }

    /** Separator text, or {@code null} when none was given. */
    public String separator() {
        return separator;
    }

    /** Offset of the separator relative to {@link #index()}, or -1. */
    public int separatorStart() {
        return separatorStart;
    }

    /** Transforms in order of appearance; empty when the vector has none. */
    public List<ItemExpressionCapture> captures() {
        return captures;
    }

    /**
     * Item function name of a transform capture such as {@code Substring(0,2)},
     * or {@code null}.
     */
    public String functionName() {
        return functionName;
    }

    /**
     * Raw, unevaluated argument text of an item function, or {@code null} when
     * empty.
     */
    public String functionArguments() {
        return functionArguments;
    }

    public boolean isFunction() {
        return functionName != null;
    }

    @Override
    public String toString() {
        return value;
    }
}
