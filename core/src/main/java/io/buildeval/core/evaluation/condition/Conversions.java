package io.buildeval.core.evaluation.condition;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Conversions of unescaped condition operands to numbers, versions and
 * booleans.
 */
final class Conversions {

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)");
    private static final Pattern HEX = Pattern.compile("0[xX][0-9a-fA-F]+");
    private static final Pattern VERSION = Pattern.compile("\\d+(\\.\\d+){1,3}");

    private Conversions() {
        // utility class
    }

    /** Decimal or {@code 0x} hex number, or {@code null}. */
    static Double toNumber(String value) {
        String s = value.trim();
        if (HEX.matcher(s).matches()) {
            try {
                return (double) Long.parseLong(s.substring(2), 16);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        if (DECIMAL.matcher(s).matches()) {
            return Double.parseDouble(s);
        }
        return null;
    }

    /** Version with two to four numeric components, or {@code null}. */
    static int[] toVersion(String value) {
        String s = value.trim();
        if (!VERSION.matcher(s).matches()) {
            return null;
        }
        String[] parts = s.split("\\.");
        int[] result = new int[parts.length];
        try {
            for (int i = 0; i < parts.length; i++) {
                result[i] = Integer.parseInt(parts[i]);
            }
        } catch (NumberFormatException e) {
            return null;
        }
        return result;
    }

    static int compareVersions(int[] a, int[] b) {
        for (int i = 0; i < Math.max(a.length, b.length); i++) {
            // a missing component sorts before any present one, as in 1.0 < 1.0.0
            int x = i < a.length ? a[i] : -1;
            int y = i < b.length ? b[i] : -1;
            if (x != y) {
                return Integer.compare(x, y);
            }
        }
        return 0;
    }

    /**
     * {@code true/on/yes/!false/!off/!no} and their negations, any casing, or
     * {@code null}.
     */
    static Boolean toBoolean(String value) {
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true":
            case "on":
            case "yes":
            case "!false":
            case "!off":
            case "!no":
                return Boolean.TRUE;
            case "false":
            case "off":
            case "no":
            case "!true":
            case "!on":
            case "!yes":
                return Boolean.FALSE;
            default:
                return null;
        }
    }
}
