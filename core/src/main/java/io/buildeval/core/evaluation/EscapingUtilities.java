package io.buildeval.core.evaluation;

/**
 * {@code %XX} escaping of special characters. Evaluated values are kept escaped
 * internally so that an escaped {@code ;} never splits a list and an escaped
 * {@code $} never starts a property reference; they are unescaped when handed
 * to callers.
 */
public final class EscapingUtilities {

    private static final String SPECIAL_CHARS = "%*?@$();'";

    private EscapingUtilities() {
        // utility class
    }

    /**
     * Replaces every valid {@code %XX} sequence by the character it encodes.
     */
    public static String unescape(String value) {
        if (value == null || value.indexOf('%') < 0) {
            return value;
        }
        StringBuilder sb = new StringBuilder(value.length());
        int i = 0;
        while (i < value.length()) {
            char c = value.charAt(i);
            if (c == '%' && i + 2 < value.length()) {
                int hi = Character.digit(value.charAt(i + 1), 16);
                int lo = Character.digit(value.charAt(i + 2), 16);
                if (hi >= 0 && lo >= 0) {
                    sb.append((char) (hi * 16 + lo));
                    i += 3;
                    continue;
                }
            }
            sb.append(c);
            i++;
        }
        return sb.toString();
    }

    /** Escapes the characters that carry meaning in project expressions. */
    public static String escape(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        StringBuilder sb = null;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (SPECIAL_CHARS.indexOf(c) >= 0) {
                if (sb == null) {
                    sb = new StringBuilder(value.length() + 8);
                    sb.append(value, 0, i);
                }
                sb.append('%').append(String.format("%02x", (int) c));
            } else if (sb != null) {
                sb.append(c);
            }
        }
        return sb != null ? sb.toString() : value;
    }

    /**
     * Returns {@code true} if the value contains an unescaped wildcard
     * character.
     */
    public static boolean containsWildcards(String value) {
        return value.indexOf('*') >= 0 || value.indexOf('?') >= 0;
    }
}
