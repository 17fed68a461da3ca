package io.buildeval.core.evaluation.expander;

import java.util.ArrayList;
import java.util.List;

/** Scanning helpers for function bodies and argument lists. */
final class FunctionArguments {

    private FunctionArguments() {
        // utility class
    }

    static boolean isQuote(char c) {
        return c == '\'' || c == '`' || c == '"';
    }

    /**
     * Returns the index of the parenthesis closing the one just before
     * {@code start}, skipping quoted text and nested pairs, or -1 when there is
     * none.
     */
    static int indexOfClosingParenthesis(String text, int start) {
        int depth = 1;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (isQuote(c)) {
                int close = text.indexOf(c, i + 1);
                if (close < 0) {
                    return -1;
                }
                i = close;
            } else if (c == '(') {
                depth++;
            } else if (c == ')' && --depth == 0) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Splits an argument list on top-level commas. Blank input yields no
     * arguments; surrounding whitespace of each argument is trimmed but quotes
     * are kept.
     */
    static List<String> split(String arguments) {
        List<String> result = new ArrayList<>();
        if (arguments == null || arguments.isBlank()) {
            return result;
        }
        int depth = 0;
        int start = 0;
        for (int i = 0; i < arguments.length(); i++) {
            char c = arguments.charAt(i);
            if (isQuote(c)) {
                int close = arguments.indexOf(c, i + 1);
                if (close < 0) {
                    throw new IllegalArgumentException("Unterminated quote in arguments: " + arguments);
                }
                i = close;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (c == ',' && depth == 0) {
                result.add(arguments.substring(start, i).trim());
                start = i + 1;
            }
        }
        result.add(arguments.substring(start).trim());
        return result;
    }

    /** Removes one pair of matching quotes, if present. */
    static String unquote(String argument) {
        if (argument.length() >= 2) {
            char first = argument.charAt(0);
            if (isQuote(first) && argument.charAt(argument.length() - 1) == first) {
                return argument.substring(1, argument.length() - 1);
            }
        }
        return argument;
    }
}
