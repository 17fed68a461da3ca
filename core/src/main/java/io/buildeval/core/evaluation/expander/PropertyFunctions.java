package io.buildeval.core.evaluation.expander;

import io.buildeval.core.evaluation.EscapingUtilities;
import java.io.File;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.DoubleBinaryOperator;
import java.util.function.LongBinaryOperator;
import java.util.function.UnaryOperator;

/**
 * Evaluates the body of a property function, {@code [Type]::Member(args)} or
 * {@code Name.Member(args)}, with any number of chained {@code .Member(args)}
 * calls.
 *
 * <p>
 * Receivers and arguments are unescaped before a call. A string result is
 * escaped again unless the last call was {@code [MSBuild]::Escape} or
 * {@code [MSBuild]::Unescape}; an array result is joined with semicolons.
 */
final class PropertyFunctions {

    private final PropertyProvider properties;
    private final UnaryOperator<String> argumentExpander;
    private final Path baseDirectory;

    PropertyFunctions(PropertyProvider properties, UnaryOperator<String> argumentExpander, Path baseDirectory) {
        this.properties = properties;
        this.argumentExpander = argumentExpander;
        this.baseDirectory = baseDirectory;
    }

    /**
     * Returns {@code true} when {@code body} has the shape of a property
     * function rather than a plain property name.
     */
    static boolean looksLikeFunction(String body) {
        return body.startsWith("[") || body.indexOf('.') > 0;
    }

    /**
     * Evaluates a function body.
     *
     * @return the escaped result
     * @throws IllegalArgumentException when the body is malformed or a call
     *     fails
     */
    String evaluate(String body) {
        Cursor c = new Cursor(body);
        Object value;
        boolean raw = false;
        if (body.startsWith("[")) {
            int close = body.indexOf("]::");
            if (close < 0) {
                throw new IllegalArgumentException("Expected ']::' after the type name");
            }
            String type = body.substring(1, close).trim();
            c.pos = close + 3;
            String member = c.readName();
            List<String> args = c.readArguments();
            value = invokeStatic(type, member, args);
            raw = type.equalsIgnoreCase("MSBuild")
                    && (member.equalsIgnoreCase("Escape") || member.equalsIgnoreCase("Unescape"));
        } else {
            String name = c.readName();
            String escaped = properties.getValueEscaped(name);
            value = escaped == null ? "" : EscapingUtilities.unescape(escaped);
        }
        c.skipWhitespace();
        while (!c.atEnd()) {
            if (!c.consume('.')) {
                throw new IllegalArgumentException("Unexpected text at position " + c.pos);
            }
            value = invokeNext(c, value);
            raw = false;
        }
        return format(value, raw);
    }

    /**
     * Invokes a chain of string methods such as
     * {@code Substring(0, 2).ToUpper()} on a receiver.
     *
     * @param receiver unescaped receiver value
     * @return the escaped result
     */
    String evaluateOn(String receiver, String calls) {
        Cursor c = new Cursor(calls);
        Object value = invokeNext(c, receiver);
        while (!c.atEnd()) {
            if (!c.consume('.')) {
                throw new IllegalArgumentException("Unexpected text at position " + c.pos);
            }
            value = invokeNext(c, value);
        }
        return format(value, false);
    }

    private Object invokeNext(Cursor c, Object receiver) {
        String member = c.readName();
        List<String> args = c.readArguments();
        Object result = invokeInstance(receiver, member, args);
        c.skipWhitespace();
        return result;
    }

    static String format(Object value, boolean raw) {
        if (value == null) {
            return "";
        }
        if (value instanceof String[]) {
            List<String> parts = new ArrayList<>();
            for (String s : (String[]) value) {
                parts.add(EscapingUtilities.escape(s));
            }
            return String.join(";", parts);
        }
        String text = stringify(value);
        return raw ? text : EscapingUtilities.escape(text);
    }

    /** Converts a function result to its string form, unescaped. */
    static String stringify(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Boolean) {
            return (Boolean) value ? "True" : "False";
        }
        if (value instanceof Double) {
            double d = (Double) value;
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return Double.toString(d);
            }
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        if (value instanceof String[]) {
            return String.join(";", (String[]) value);
        }
        return value.toString();
    }

    // --- Static functions ---

    private Object invokeStatic(String type, String member, List<String> args) {
        switch (type.toLowerCase(Locale.ROOT)) {
            case "msbuild":
                return msbuild(member, args);
            case "system.io.path":
                return path(member, args);
            case "system.string":
                return stringStatic(member, args);
            case "system.environment":
                if (member.equalsIgnoreCase("NewLine") && args == null) {
                    return System.lineSeparator();
                }
                throw unknown(type, member);
            default:
                throw new IllegalArgumentException("The type '" + type + "' is not available for property functions");
        }
    }

    private Object msbuild(String member, List<String> args) {
        switch (member.toLowerCase(Locale.ROOT)) {
            case "add":
                return arithmetic(args, Math::addExact, (a, b) -> a + b);
            case "subtract":
                return arithmetic(args, Math::subtractExact, (a, b) -> a - b);
            case "multiply":
                return arithmetic(args, Math::multiplyExact, (a, b) -> a * b);
            case "divide":
                return arithmetic(args, PropertyFunctions::divideExact, (a, b) -> a / b);
            case "modulo":
                return arithmetic(args, (a, b) -> a % nonZero(b), (a, b) -> a % b);
            case "bitwiseor":
                requireCount(args, 2);
                return toLong(args.get(0)) | toLong(args.get(1));
            case "bitwiseand":
                requireCount(args, 2);
                return toLong(args.get(0)) & toLong(args.get(1));
            case "bitwisexor":
                requireCount(args, 2);
                return toLong(args.get(0)) ^ toLong(args.get(1));
            case "bitwisenot":
                requireCount(args, 1);
                return ~toLong(args.get(0));
            case "escape":
                requireCount(args, 1);
                return EscapingUtilities.escape(args.get(0));
            case "unescape":
                requireCount(args, 1);
                return EscapingUtilities.unescape(args.get(0));
            case "valueordefault":
                requireCount(args, 2);
                return args.get(0) == null || args.get(0).isEmpty() ? args.get(1) : args.get(0);
            case "ensuretrailingslash":
                requireCount(args, 1);
                return ensureTrailingSlash(args.get(0));
            case "normalizepath":
                requireAtLeast(args, 1);
                return fullPath(combine(args));
            case "normalizedirectory":
                requireAtLeast(args, 1);
                return ensureTrailingSlash(fullPath(combine(args)));
            case "makerelative":
                requireCount(args, 2);
                return makeRelative(args.get(0), args.get(1));
            case "getdirectorynameoffileabove":
                requireCount(args, 2);
                return directoryOfFileAbove(args.get(0), args.get(1));
            case "getpathoffileabove":
                requireAtLeast(args, 1);
                return pathOfFileAbove(args);
            default:
                throw unknown("MSBuild", member);
        }
    }

    private Object path(String member, List<String> args) {
        switch (member.toLowerCase(Locale.ROOT)) {
            case "combine":
                requireAtLeast(args, 1);
                return combine(args);
            case "getfilename":
                requireCount(args, 1);
                return fileName(args.get(0));
            case "getfilenamewithoutextension": {
                requireCount(args, 1);
                String file = fileName(args.get(0));
                int dot = file.lastIndexOf('.');
                return dot >= 0 ? file.substring(0, dot) : file;
            }
            case "getextension": {
                requireCount(args, 1);
                String file = fileName(args.get(0));
                int dot = file.lastIndexOf('.');
                return dot >= 0 && dot < file.length() - 1 ? file.substring(dot) : "";
            }
            case "getdirectoryname": {
                requireCount(args, 1);
                String p = args.get(0);
                int slash = lastSeparator(p);
                return slash > 0 ? p.substring(0, slash) : "";
            }
            case "getfullpath":
                requireCount(args, 1);
                return fullPath(args.get(0));
            case "ispathrooted":
                requireCount(args, 1);
                return Path.of(args.get(0)).isAbsolute();
            case "directoryseparatorchar":
                return File.separator;
            default:
                throw unknown("System.IO.Path", member);
        }
    }

    private static Object stringStatic(String member, List<String> args) {
        switch (member.toLowerCase(Locale.ROOT)) {
            case "isnullorempty":
                requireCount(args, 1);
                return args.get(0) == null || args.get(0).isEmpty();
            case "isnullorwhitespace":
                requireCount(args, 1);
                return args.get(0) == null || args.get(0).isBlank();
            case "concat": {
                StringBuilder sb = new StringBuilder();
                for (String a : args == null ? List.<String>of() : args) {
                    sb.append(a == null ? "" : a);
                }
                return sb.toString();
            }
            case "empty":
                return "";
            default:
                throw unknown("System.String", member);
        }
    }

    // --- Instance methods ---

    private Object invokeInstance(Object receiver, String member, List<String> args) {
        String lower = member.toLowerCase(Locale.ROOT);
        if (receiver instanceof String[] && lower.equals("length")) {
            return ((String[]) receiver).length;
        }
        String s = stringify(receiver);
        switch (lower) {
            case "length":
                return s.length();
            case "toupper":
            case "toupperinvariant":
                return s.toUpperCase(Locale.ROOT);
            case "tolower":
            case "tolowerinvariant":
                return s.toLowerCase(Locale.ROOT);
            case "trim":
                return trim(s, trimChars(args), true, true);
            case "trimstart":
                return trim(s, trimChars(args), true, false);
            case "trimend":
                return trim(s, trimChars(args), false, true);
            case "replace": {
                requireCount(args, 2);
                String from = args.get(0);
                if (from == null || from.isEmpty()) {
                    throw new IllegalArgumentException("String cannot be of zero length");
                }
                return s.replace(from, args.get(1) == null ? "" : args.get(1));
            }
            case "substring": {
                requireAtLeast(args, 1);
                int start = toInt(args.get(0));
                if (args.size() == 1) {
                    return s.substring(start);
                }
                return s.substring(start, start + toInt(args.get(1)));
            }
            case "contains":
                requireCount(args, 1);
                return s.contains(args.get(0));
            case "startswith":
                requireCount(args, 1);
                return s.startsWith(args.get(0));
            case "endswith":
                requireCount(args, 1);
                return s.endsWith(args.get(0));
            case "equals":
                requireCount(args, 1);
                return s.equals(args.get(0));
            case "indexof":
                requireAtLeast(args, 1);
                return args.size() == 1 ? s.indexOf(args.get(0)) : s.indexOf(args.get(0), toInt(args.get(1)));
            case "lastindexof":
                requireCount(args, 1);
                return s.lastIndexOf(args.get(0));
            case "padleft":
            case "padright":
                return pad(s, args, lower.equals("padleft"));
            case "split":
                return split(s, args);
            case "tostring":
                return s;
            default:
                throw new IllegalArgumentException("Method 'System.String." + member + "' is not available");
        }
    }

    private static String trimChars(List<String> args) {
        if (args == null || args.isEmpty()) {
            return null;
        }
        return String.join("", args);
    }

    private static String trim(String s, String chars, boolean start, boolean end) {
        int from = 0;
        int to = s.length();
        if (start) {
            while (from < to && isTrimmed(s.charAt(from), chars)) {
                from++;
            }
        }
        if (end) {
            while (to > from && isTrimmed(s.charAt(to - 1), chars)) {
                to--;
            }
        }
        return s.substring(from, to);
    }

    private static boolean isTrimmed(char c, String chars) {
        return chars == null ? Character.isWhitespace(c) : chars.indexOf(c) >= 0;
    }

    private static String[] split(String s, List<String> args) {
        String separators = args == null || args.isEmpty() ? null : String.join("", args);
        List<String> parts = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            boolean isSeparator = separators == null ? Character.isWhitespace(c) : separators.indexOf(c) >= 0;
            if (isSeparator) {
                parts.add(s.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(s.substring(start));
        return parts.toArray(new String[0]);
    }

    private static String pad(String s, List<String> args, boolean left) {
        requireAtLeast(args, 1);
        int width = toInt(args.get(0));
        char padding = args.size() > 1 && !args.get(1).isEmpty() ? args.get(1).charAt(0) : ' ';
        if (s.length() >= width) {
            return s;
        }
        String fill = String.valueOf(padding).repeat(width - s.length());
        return left ? fill + s : s + fill;
    }

    // --- Arithmetic ---

    private static Object arithmetic(List<String> args, LongBinaryOperator exact, DoubleBinaryOperator inexact) {
        requireCount(args, 2);
        Long a = tryParseLong(args.get(0));
        Long b = tryParseLong(args.get(1));
        if (a != null && b != null) {
            try {
                return exact.applyAsLong(a, b);
            } catch (ArithmeticException overflow) {
                return inexact.applyAsDouble(a, b);
            }
        }
        return inexact.applyAsDouble(toDouble(args.get(0)), toDouble(args.get(1)));
    }

    private static long divideExact(long dividend, long divisor) {
        if (dividend == Long.MIN_VALUE && nonZero(divisor) == -1) {
            throw new ArithmeticException("long overflow");
        }
        return dividend / nonZero(divisor);
    }

    private static long nonZero(long divisor) {
        if (divisor == 0) {
            throw new IllegalArgumentException("Attempted to divide by zero.");
        }
        return divisor;
    }

    private static Long tryParseLong(String text) {
        if (text == null) {
            return null;
        }
        String t = text.trim();
        if (t.isEmpty()) {
            return null;
        }
        for (int i = (t.charAt(0) == '-' || t.charAt(0) == '+') ? 1 : 0; i < t.length(); i++) {
            if (!Character.isDigit(t.charAt(i))) {
                return null;
            }
        }
        try {
            return Long.parseLong(t);
        } catch (NumberFormatException outOfRange) {
            return null;
        }
    }

    private static long toLong(String text) {
        Long value = tryParseLong(text);
        if (value == null) {
            throw new IllegalArgumentException("'" + text + "' is not an integer");
        }
        return value;
    }

    private static int toInt(String text) {
        return Math.toIntExact(toLong(text));
    }

    private static double toDouble(String text) {
        return Double.parseDouble(text.trim());
    }

    // --- Paths ---

    private static String combine(List<String> parts) {
        Path result = Path.of(parts.get(0));
        for (int i = 1; i < parts.size(); i++) {
            result = result.resolve(parts.get(i));
        }
        return result.toString();
    }

    private String fullPath(String path) {
        return baseDirectory.resolve(path.replace('\\', '/')).normalize().toString();
    }

    private static String ensureTrailingSlash(String path) {
        if (path.isEmpty() || path.endsWith("/") || path.endsWith("\\")) {
            return path;
        }
        return path + File.separator;
    }

    private String makeRelative(String base, String path) {
        Path from = Path.of(fullPath(base));
        Path to = Path.of(fullPath(path));
        String relative = from.relativize(to).toString();
        boolean trailing = path.endsWith("/") || path.endsWith("\\");
        return trailing && !relative.isEmpty() ? relative + File.separator : relative;
    }

    private String directoryOfFileAbove(String startingDirectory, String file) {
        Path dir = Path.of(fullPath(startingDirectory));
        while (dir != null) {
            if (Files.exists(dir.resolve(file))) {
                return dir.toString();
            }
            dir = dir.getParent();
        }
        return "";
    }

    private String pathOfFileAbove(List<String> args) {
        String file = args.get(0);
        String start;
        if (args.size() > 1 && !args.get(1).isEmpty()) {
            start = args.get(1);
        } else {
            String thisDir = properties.getValueEscaped("MSBuildThisFileDirectory");
            start = thisDir == null || thisDir.isEmpty() ? baseDirectory.toString() : EscapingUtilities.unescape(thisDir);
        }
        String dir = directoryOfFileAbove(start, file);
        return dir.isEmpty() ? "" : Path.of(dir).resolve(file).toString();
    }

    private static String fileName(String path) {
        return path.substring(lastSeparator(path) + 1);
    }

    private static int lastSeparator(String path) {
        return Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
    }

    // --- Argument checks ---

    private static void requireCount(List<String> args, int count) {
        int actual = args == null ? 0 : args.size();
        if (actual != count) {
            throw new IllegalArgumentException("Expected " + count + " argument(s) but got " + actual);
        }
    }

    private static void requireAtLeast(List<String> args, int count) {
        int actual = args == null ? 0 : args.size();
        if (actual < count) {
            throw new IllegalArgumentException("Expected at least " + count + " argument(s) but got " + actual);
        }
    }

    private static IllegalArgumentException unknown(String type, String member) {
        return new IllegalArgumentException("Function '" + member + "' is not available on type '" + type + "'");
    }

    /** Position within a function body. */
    private final class Cursor {

        private final String text;
        private int pos;

        Cursor(String text) {
            this.text = text;
        }

        boolean atEnd() {
            return pos >= text.length();
        }

        void skipWhitespace() {
            while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
        }

        boolean consume(char c) {
            if (pos < text.length() && text.charAt(pos) == c) {
                pos++;
                return true;
            }
            return false;
        }

        String readName() {
            skipWhitespace();
            int start = pos;
            while (pos < text.length()) {
                char c = text.charAt(pos);
                if (!Character.isLetterOrDigit(c) && c != '_' && c != '-') {
                    break;
                }
                pos++;
            }
            if (start == pos) {
                throw new IllegalArgumentException("Expected a name at position " + start);
            }
            return text.substring(start, pos);
        }

        /**
         * Reads a parenthesised argument list, or returns {@code null} for
         * member access without one.
         */
        List<String> readArguments() {
            skipWhitespace();
            if (!consume('(')) {
                return null;
            }
            int close = FunctionArguments.indexOfClosingParenthesis(text, pos);
            if (close < 0) {
                throw new IllegalArgumentException("Missing ')' after the argument list");
            }
            List<String> result = new ArrayList<>();
            for (String raw : FunctionArguments.split(text.substring(pos, close))) {
                result.add(evaluateArgument(raw));
            }
            pos = close + 1;
            return result;
        }

        private String evaluateArgument(String raw) {
            if (raw.equals("null")) {
                return null;
            }
            String unquoted = FunctionArguments.unquote(raw);
            return EscapingUtilities.unescape(argumentExpander.apply(unquoted));
        }
    }
}
