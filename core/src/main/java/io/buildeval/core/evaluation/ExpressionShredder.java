package io.buildeval.core.evaluation;

import io.buildeval.core.construction.XmlNames;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Single-pass scanner that finds item vectors ({@code @(...)}) and metadata
 * references ({@code %(...)}) in arbitrary strings without a full parse, and
 * splits {@code ;}-separated lists without breaking item vectors apart.
 *
 * <p>
 * Malformed constructs are never errors here: a vector or metadata reference
 * that is not well formed is skipped and scanning resumes right after its first
 * character.
 */
public final class ExpressionShredder {

    private ExpressionShredder() {
        // utility class
    }

    /** What to collect while scanning. */
    private enum Collect {
        ITEM_TYPES,
        METADATA_OUTSIDE_TRANSFORMS,
        ALL;

        boolean itemTypes() {
            return this != METADATA_OUTSIDE_TRANSFORMS;
        }

        boolean metadata() {
            return this != ITEM_TYPES;
        }
    }

    private static final class Cursor {
        int i;

        Cursor(int i) {
            this.i = i;
        }
    }

    // --- List splitting ---

    /**
     * Splits on {@code ;} except inside item vectors (including their quoted
     * transform and separator clauses). Entries are trimmed and empty entries
     * dropped; blank input gives an empty list.
     */
    public static List<String> splitSemiColonSeparatedList(String expression) {
        List<String> result = new ArrayList<>();
        if (expression == null || expression.isEmpty()) {
            return result;
        }
        boolean insideItemList = false;
        boolean insideQuotedPart = false;
        int segmentStart = 0;
        for (int i = 0; i < expression.length(); i++) {
            char c = expression.charAt(i);
            switch (c) {
                case ';' -> {
                    if (!insideItemList) {
                        addTrimmed(result, expression.substring(segmentStart, i));
                        segmentStart = i + 1;
                    }
                }
                case '@' -> {
                    if (i + 1 < expression.length() && expression.charAt(i + 1) == '(') {
                        insideItemList = true;
                        i++;
                    }
                }
                case ')' -> {
                    if (insideItemList && !insideQuotedPart) {
                        insideItemList = false;
                    }
                }
                case '\'' -> {
                    if (insideItemList) {
                        insideQuotedPart = !insideQuotedPart;
                    }
                }
                default -> {
                    // ordinary character
                }
            }
        }
        addTrimmed(result, expression.substring(segmentStart));
        return result;
    }

    private static void addTrimmed(List<String> result, String segment) {
        String trimmed = segment.strip();
        if (!trimmed.isEmpty()) {
            result.add(trimmed);
        }
    }

    // --- Item and metadata references ---

    /**
     * Collects referenced item types and metadata outside transforms over
     * several expressions.
     */
    public static ItemsAndMetadataPair getReferencedItemNamesAndMetadata(Collection<String> expressions) {
        ItemsAndMetadataPair pair = new ItemsAndMetadataPair();
        for (String expression : expressions) {
            collect(expression, pair);
        }
        return pair;
    }

    /**
     * Collects the item types referenced by well-formed vectors (including
     * those with transforms and separators) and the metadata referenced outside
     * transform strings. Metadata inside a separator is reported; metadata and
     * vectors inside a transform literal are not.
     */
    public static ItemsAndMetadataPair getReferencedItemNamesAndMetadata(String expression) {
        ItemsAndMetadataPair pair = new ItemsAndMetadataPair();
        collect(expression, pair);
        return pair;
    }

    /**
     * Returns {@code true} if the expression has a metadata reference outside
     * any transform.
     */
    public static boolean containsMetadataExpressionOutsideTransform(String expression) {
        if (expression.indexOf("%(") < 0) {
            return false;
        }
        ItemsAndMetadataPair pair = new ItemsAndMetadataPair();
        scan(expression, 0, expression.length(), pair, Collect.METADATA_OUTSIDE_TRANSFORMS);
        return !pair.metadata().isEmpty();
    }

    private static void collect(String expression, ItemsAndMetadataPair pair) {
        boolean hasItems = expression.indexOf("@(") >= 0;
        boolean hasMetadata = expression.indexOf("%(") >= 0;
        if (!hasItems && !hasMetadata) {
            return;
        }
        if (!hasMetadata || isListOfItemVectorsWithoutSeparators(expression)) {
            // metadata can only sit inside transforms here, and those are never reported
            scan(expression, 0, expression.length(), pair, Collect.ITEM_TYPES);
            return;
        }
        scan(expression, 0, expression.length(), pair, Collect.ALL);
    }

    /**
     * Matches strings made only of item vectors with at most one quoted
     * transform and no separator, optionally separated by semicolons and
     * whitespace.
     */
    static boolean isListOfItemVectorsWithoutSeparators(String expression) {
        int end = expression.length();
        Cursor c = new Cursor(0);
        boolean sawVector = false;
        while (true) {
            skipSemicolonsAndWhitespace(expression, c);
            if (c.i >= end) {
                return sawVector;
            }
            if (!sink(expression, c, end, '@', '(')) {
                return false;
            }
            sinkWhitespace(expression, c);
            if (!sinkValidName(expression, c, end)) {
                return false;
            }
            backOffArrow(expression, c, end);
            sinkWhitespace(expression, c);
            if (sink(expression, c, end, '-', '>')) {
                sinkWhitespace(expression, c);
                if (!sink(expression, c, '\'')) {
                    return false;
                }
                int close = expression.indexOf('\'', c.i);
                if (close < 0) {
                    return false;
                }
                c.i = close + 1;
                sinkWhitespace(expression, c);
            }
            if (!sink(expression, c, ')')) {
                return false;
            }
            sawVector = true;
        }
    }

    private static void skipSemicolonsAndWhitespace(String expression, Cursor c) {
        while (c.i < expression.length()
                && (expression.charAt(c.i) == ';' || Character.isWhitespace(expression.charAt(c.i)))) {
            c.i++;
        }
    }

    private static void scan(String expression, int start, int end, ItemsAndMetadataPair pair, Collect what) {
        Cursor c = new Cursor(start);
        for (; c.i < end; c.i++) {
            if (sink(expression, c, end, '@', '(')) {
                int restartPoint = c.i - 1;
                sinkWhitespace(expression, c);
                int startOfName = c.i;
                if (!sinkValidName(expression, c, end)) {
                    c.i = restartPoint;
                    continue;
                }
                backOffArrow(expression, c, end);
                String name = expression.substring(startOfName, c.i);
                sinkWhitespace(expression, c);

                if (!sinkTransforms(expression, c, end, null)) {
                    c.i = restartPoint;
                    continue;
                }
                sinkWhitespace(expression, c);
                if (sink(expression, c, ',')) {
                    sinkWhitespace(expression, c);
                    if (!sink(expression, c, '\'')) {
                        c.i = restartPoint;
                        continue;
                    }
                    int closingQuote = expression.indexOf('\'', c.i);
                    if (closingQuote == -1) {
                        c.i = restartPoint;
                        continue;
                    }
                    // separators may carry batchable metadata, e.g. @(foo, '%(bar)')
                    scan(expression, c.i, closingQuote, pair, Collect.METADATA_OUTSIDE_TRANSFORMS);
                    c.i = closingQuote + 1;
                }
                sinkWhitespace(expression, c);
                if (!sink(expression, c, ')')) {
                    c.i = restartPoint;
                    continue;
                }
                if (what.itemTypes()) {
                    pair.addItem(name);
                }
                c.i--;
                continue;
            }

            if (sink(expression, c, end, '%', '(')) {
                int restartPoint = c.i - 1;
                sinkWhitespace(expression, c);
                int startOfText = c.i;
                if (!sinkValidName(expression, c, end)) {
                    c.i = restartPoint;
                    continue;
                }
                String firstPart = expression.substring(startOfText, c.i);
                String itemType = null;
                String metadataName = firstPart;
                sinkWhitespace(expression, c);
                if (sink(expression, c, '.')) {
                    sinkWhitespace(expression, c);
                    startOfText = c.i;
                    if (!sinkValidName(expression, c, end)) {
                        c.i = restartPoint;
                        continue;
                    }
                    itemType = firstPart;
                    metadataName = expression.substring(startOfText, c.i);
                }
                sinkWhitespace(expression, c);
                if (!sink(expression, c, ')')) {
                    c.i = restartPoint;
                    continue;
                }
                if (what.metadata()) {
                    pair.addMetadata(new MetadataReference(itemType, metadataName));
                }
                c.i--;
            }
        }
    }

    /**
     * Returns the item vectors of an expression in order of appearance; empty
     * when there are none.
     */
    public static List<ItemExpressionCapture> getReferencedItemExpressions(String expression) {
        return getReferencedItemExpressions(expression, 0, expression.length());
    }

    public static List<ItemExpressionCapture> getReferencedItemExpressions(String expression, int start, int end) {
        List<ItemExpressionCapture> result = new ArrayList<>();
        if (expression.indexOf('@') < 0) {
            return result;
        }
        Cursor c = new Cursor(start);
        for (; c.i < end; c.i++) {
            if (!sink(expression, c, end, '@', '(')) {
                continue;
            }
            int restartPoint = c.i - 1;
            int startPoint = c.i - 2;
            sinkWhitespace(expression, c);
            int startOfName = c.i;
            if (!sinkValidName(expression, c, end)) {
                c.i = restartPoint;
                continue;
            }
            backOffArrow(expression, c, end);
            String itemType = expression.substring(startOfName, c.i);
            sinkWhitespace(expression, c);

            List<ItemExpressionCapture> transforms = new ArrayList<>();
            if (!sinkTransforms(expression, c, end, transforms)) {
                c.i = restartPoint;
                continue;
            }
            sinkWhitespace(expression, c);

            String separator = null;
            int separatorStart = -1;
            if (sink(expression, c, ',')) {
                sinkWhitespace(expression, c);
                if (!sink(expression, c, '\'')) {
                    c.i = restartPoint;
                    continue;
                }
                int closingQuote = expression.indexOf('\'', c.i);
                if (closingQuote == -1) {
                    c.i = restartPoint;
                    continue;
                }
                separatorStart = c.i - startPoint;
                separator = expression.substring(c.i, closingQuote);
                c.i = closingQuote + 1;
            }
            sinkWhitespace(expression, c);
            if (!sink(expression, c, ')')) {
                c.i = restartPoint;
                continue;
            }
            int endPoint = c.i;
            c.i--;
            result.add(new ItemExpressionCapture(
                    startPoint,
                    endPoint - startPoint,
                    expression.substring(startPoint, endPoint),
                    itemType,
                    separator,
                    separatorStart,
                    transforms,
                    null,
                    null));
        }
        return result;
    }

    /**
     * Consumes any number of {@code ->'quoted'} or {@code ->Function(args)}
     * transforms. Returns {@code false} when an arrow is not followed by a
     * valid transform.
     */
    private static boolean sinkTransforms(String expression, Cursor c, int end, List<ItemExpressionCapture> into) {
        while (sink(expression, c, end, '-', '>')) {
            sinkWhitespace(expression, c);
            int startTransform = c.i;
            if (sinkSingleQuotedExpression(expression, c, end)) {
                if (into != null) {
                    int startQuoted = startTransform + 1;
                    int endQuoted = c.i - 1;
                    into.add(ItemExpressionCapture.transform(startQuoted, expression.substring(startQuoted, endQuoted)));
                }
                continue;
            }
            ItemExpressionCapture function = sinkItemFunctionExpression(expression, startTransform, c, end);
            if (function != null) {
                if (into != null) {
                    into.add(function);
                }
                continue;
            }
            return false;
        }
        return true;
    }

    private static boolean sinkSingleQuotedExpression(String expression, Cursor c, int end) {
        if (!sink(expression, c, '\'')) {
            return false;
        }
        while (c.i < end && expression.charAt(c.i) != '\'') {
            c.i++;
        }
        c.i++;
        return end > c.i;
    }

    private static ItemExpressionCapture sinkItemFunctionExpression(
            String expression, int startTransform, Cursor c, int end) {
        if (!sinkValidName(expression, c, end)) {
            return null;
        }
        int endFunctionName = c.i;
        sinkWhitespace(expression, c);
        int startArguments = c.i + 1;
        if (!sinkArgumentsInParentheses(expression, c, end)) {
            return null;
        }
        int endArguments = c.i - 1;
        String value = expression.substring(startTransform, c.i);
        String arguments = endArguments > startArguments ? expression.substring(startArguments, endArguments) : null;
        return new ItemExpressionCapture(
                startTransform,
                c.i - startTransform,
                value,
                null,
                null,
                -1,
                null,
                expression.substring(startTransform, endFunctionName),
                arguments);
    }

    private static boolean sinkArgumentsInParentheses(String expression, Cursor c, int end) {
        if (c.i >= expression.length() || expression.charAt(c.i) != '(') {
            return false;
        }
        int nestLevel = 1;
        c.i++;
        while (c.i < end && nestLevel > 0) {
            char ch = expression.charAt(c.i);
            if (ch == '\'' || ch == '`' || ch == '"') {
                int close = expression.indexOf(ch, c.i + 1);
                if (close < 0 || close >= end) {
                    return false;
                }
                c.i = close;
            } else if (ch == '(') {
                nestLevel++;
            } else if (ch == ')') {
                nestLevel--;
            }
            c.i++;
        }
        return nestLevel == 0;
    }

    // '-' is legal in a name, but "foo->" is the name "foo" followed by an arrow
    private static void backOffArrow(String expression, Cursor c, int end) {
        if (end > c.i && expression.charAt(c.i - 1) == '-' && expression.charAt(c.i) == '>') {
            c.i--;
        }
    }

    private static boolean sinkValidName(String expression, Cursor c, int end) {
        if (end <= c.i || !XmlNames.isValidNameStart(expression.charAt(c.i))) {
            return false;
        }
        c.i++;
        while (end > c.i && XmlNames.isValidNameChar(expression.charAt(c.i))) {
            c.i++;
        }
        return true;
    }

    private static boolean sink(String expression, Cursor c, char ch) {
        if (c.i < expression.length() && expression.charAt(c.i) == ch) {
            c.i++;
            return true;
        }
        return false;
    }

    private static boolean sink(String expression, Cursor c, int end, char c1, char c2) {
        if (c.i < end - 1 && expression.charAt(c.i) == c1 && expression.charAt(c.i + 1) == c2) {
            c.i += 2;
            return true;
        }
        return false;
    }

    private static void sinkWhitespace(String expression, Cursor c) {
        while (c.i < expression.length() && Character.isWhitespace(expression.charAt(c.i))) {
            c.i++;
        }
    }
}
