package io.buildeval.core.construction;

/**
 * Character classes for property, item and metadata names.
 *
 * <p>
 * A name starts with an ASCII letter, an underscore or a character of the
 * Latin-1 letter ranges U+00C0..U+00D6, U+00D8..U+00F6, U+00F8..U+00FF;
 * subsequent characters may also be ASCII digits or a hyphen.
 */
public final class XmlNames {

    private XmlNames() {
        // utility class
    }

    public static boolean isValidNameStart(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_' || isLatin1Letter(c);
    }

    public static boolean isValidNameChar(char c) {
        return isValidNameStart(c) || (c >= '0' && c <= '9') || c == '-';
    }

    /** Returns {@code true} if the whole string is a legal name. */
    public static boolean isValidName(String name) {
        if (name == null || name.isEmpty() || !isValidNameStart(name.charAt(0))) {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            if (!isValidNameChar(name.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the index of the first character that makes {@code name} illegal,
     * or -1 when the name is valid.
     */
    public static int indexOfInvalidChar(String name) {
        if (name.isEmpty()) {
            return 0;
        }
        if (!isValidNameStart(name.charAt(0))) {
            return 0;
        }
        for (int i = 1; i < name.length(); i++) {
            if (!isValidNameChar(name.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    private static boolean isLatin1Letter(char c) {
        return (c >= 'À' && c <= 'Ö') || (c >= 'Ø' && c <= 'ö') || (c >= 'ø' && c <= 'ÿ');
    }
}
