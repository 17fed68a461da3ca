package io.buildeval.core.evaluation.condition;

import io.buildeval.core.construction.XmlNames;
import io.buildeval.core.evaluation.WellKnownMetadata;

/**
 * Splits a condition into tokens.
 *
 * <p>
 * {@link #advance()} moves to the next token and returns {@code false} on
 * malformed input, after which {@link #errorReason()} and
 * {@link #errorPosition()} describe the problem. Positions are 1-based. Once
 * {@link Token.Type#END_OF_INPUT} is reached, further calls keep returning it.
 */
final class Scanner {

    static final String END_OF_INPUT = "end of input";

    private final String expression;
    private final ParserOptions options;
    private int parsePoint;
    private Token lookahead;
    private boolean errorState;
    private int errorPosition = -1;
    private String errorReason;
    private String unexpectedlyFound;

    Scanner(String expression, ParserOptions options) {
        this.expression = expression;
        this.options = options;
    }

    Token current() {
        return lookahead;
    }

    boolean isNext(Token.Type type) {
        return lookahead != null && lookahead.is(type);
    }

    int errorPosition() {
        return errorPosition;
    }

    /**
     * Reason code of the last lexical error, {@code UnexpectedCharacter} when
     * none was recorded.
     */
    String errorReason() {
        return errorReason != null ? errorReason : "UnexpectedCharacter";
    }

    /** The text found where something else was expected, or {@code null}. */
    String unexpectedlyFound() {
        return unexpectedlyFound;
    }

    boolean advance() {
        if (errorState) {
            return false;
        }
        if (lookahead != null && lookahead.is(Token.Type.END_OF_INPUT)) {
            return true;
        }
        skipWhiteSpace();
        errorPosition = parsePoint + 1;

        if (parsePoint >= expression.length()) {
            lookahead = Token.END_OF_INPUT;
            return true;
        }
        char c = expression.charAt(parsePoint);
        switch (c) {
            case ',':
                lookahead = Token.COMMA;
                parsePoint++;
                return true;
            case '(':
                lookahead = Token.LEFT_PARENTHESIS;
                parsePoint++;
                return true;
            case ')':
                lookahead = Token.RIGHT_PARENTHESIS;
                parsePoint++;
                return true;
            case '$':
                return parseProperty();
            case '%':
                return parseItemMetadata();
            case '@':
                if (!options.allowItemLists() && peek(1) == '(') {
                    return fail(parsePoint + 1, "ItemListNotAllowed", null);
                }
                return parseItemList();
            case '!':
                return twoCharOperator(Token.NOT_EQUAL_TO, Token.NOT);
            case '>':
                return twoCharOperator(Token.GREATER_THAN_OR_EQUAL_TO, Token.GREATER_THAN);
            case '<':
                return twoCharOperator(Token.LESS_THAN_OR_EQUAL_TO, Token.LESS_THAN);
            case '=':
                if (peek(1) == '=') {
                    lookahead = Token.EQUAL_TO;
                    parsePoint += 2;
                    return true;
                }
                String found = parsePoint + 1 < expression.length()
                        ? String.valueOf(expression.charAt(parsePoint + 1))
                        : END_OF_INPUT;
                int position = parsePoint + 2;
                parsePoint++;
                return fail(position, "IllFormedEquals", found);
            case '\'':
                return parseQuotedString();
            default:
                return parseRemaining();
        }
    }

    private boolean twoCharOperator(Token withEquals, Token single) {
        if (peek(1) == '=') {
            lookahead = withEquals;
            parsePoint += 2;
        } else {
            lookahead = single;
            parsePoint++;
        }
        return true;
    }

    // --- Properties and metadata ---

    private boolean parseProperty() {
        String text = parsePropertyOrMetadata("IllFormedProperty");
        if (text == null) {
            return false;
        }
        lookahead = new Token(Token.Type.PROPERTY, text, true);
        return true;
    }

    private boolean parseItemMetadata() {
        int start = parsePoint;
        String text = parsePropertyOrMetadata("IllFormedItemMetadata");
        if (text == null) {
            return false;
        }
        lookahead = new Token(Token.Type.ITEM_METADATA, text, true);
        return checkMetadataAllowed(text, start + 1);
    }

    /**
     * Returns the text from {@code $(} or {@code %(} through the matching
     * {@code )}, or {@code null} on error.
     */
    private String parsePropertyOrMetadata(String reasonPrefix) {
        int start = parsePoint;
        parsePoint++;
        if (parsePoint < expression.length() && expression.charAt(parsePoint) != '(') {
            fail(start + 1, reasonPrefix + "OpenParenthesis", String.valueOf(expression.charAt(parsePoint)));
            return null;
        }
        int[] end = new int[1];
        if (!scanForPropertyExpressionEnd(expression, parsePoint++, end)) {
            fail(end[0] + 1, "IllFormedPropertySpace", String.valueOf(expression.charAt(end[0])));
            return null;
        }
        parsePoint = end[0];
        if (parsePoint >= expression.length()) {
            fail(start + 1, reasonPrefix + "CloseParenthesis", END_OF_INPUT);
            return null;
        }
        parsePoint++;
        return expression.substring(start, parsePoint);
    }

    /**
     * Finds the parenthesis closing the one at {@code index}. A body that holds
     * whitespace but otherwise only name characters, such as {@code $(a b)}, is
     * rejected and {@code result[0]} is the index of the whitespace. An
     * unterminated body leaves {@code result[0]} at the end of the expression.
     */
    private static boolean scanForPropertyExpressionEnd(String expression, int index, int[] result) {
        int nestLevel = 0;
        boolean whitespaceFound = false;
        boolean nonIdentifierFound = false;
        result[0] = -1;
        while (index < expression.length()) {
            char c = expression.charAt(index);
            if (c == '(') {
                nestLevel++;
            } else if (c == ')') {
                nestLevel--;
            } else if (Character.isWhitespace(c)) {
                whitespaceFound = true;
                result[0] = index;
            } else if (!XmlNames.isValidNameChar(c)) {
                nonIdentifierFound = true;
            }

            if (c == '$' && index < expression.length() - 1 && expression.charAt(index + 1) == '(') {
                int[] nested = new int[1];
                if (!scanForPropertyExpressionEnd(expression, index + 1, nested)) {
                    result[0] = nested[0];
                    return false;
                }
                index = nested[0];
            }

            if (nestLevel == 0) {
                if (whitespaceFound && !nonIdentifierFound) {
                    return false;
                }
                result[0] = index;
                return true;
            }
            index++;
        }
        result[0] = index;
        return true;
    }

    private boolean checkMetadataAllowed(String text, int position) {
        if (options.allowItemMetadata()) {
            return true;
        }
        String name = text;
        if (name.length() > 3 && name.startsWith("%(") && name.endsWith(")")) {
            name = name.substring(2, name.length() - 1);
        }
        int period = name.indexOf('.');
        if (period > 0 && period < name.length() - 1) {
            name = name.substring(period + 1);
        }
        boolean builtIn = WellKnownMetadata.isWellKnown(name.trim());
        if ((builtIn && !options.allowBuiltInMetadata()) || (!builtIn && !options.allowCustomMetadata())) {
            return fail(position, "ItemMetadataNotAllowed", name);
        }
        return true;
    }

    // --- Item lists ---

    private boolean parseItemList() {
        int start = parsePoint;
        if (!skipItemList()) {
            return false;
        }
        lookahead = new Token(Token.Type.ITEM_LIST, expression.substring(start, parsePoint), true);
        return true;
    }

    /**
     * Moves past {@code @(...)}, treating quoted separators and transforms as
     * opaque.
     */
    private boolean skipItemList() {
        int start = parsePoint;
        parsePoint++;
        if (parsePoint < expression.length() && expression.charAt(parsePoint) != '(') {
            return fail(start + 1, "IllFormedItemListOpenParenthesis", null);
        }
        parsePoint++;
        boolean inQuotes = false;
        int parenToClose = 0;
        while (parsePoint < expression.length()) {
            char c = expression.charAt(parsePoint);
            if (c == '\'') {
                inQuotes = !inQuotes;
            } else if (c == '(' && !inQuotes) {
                parenToClose++;
            } else if (c == ')' && !inQuotes) {
                if (parenToClose == 0) {
                    break;
                }
                parenToClose--;
            }
            parsePoint++;
        }
        if (parsePoint >= expression.length()) {
            return fail(start + 1, inQuotes ? "IllFormedItemListQuote" : "IllFormedItemListCloseParenthesis", null);
        }
        parsePoint++;
        return true;
    }

    // --- Strings and numbers ---

    private boolean parseQuotedString() {
        parsePoint++;
        int start = parsePoint;
        boolean expandable = false;
        while (parsePoint < expression.length() && expression.charAt(parsePoint) != '\'') {
            char c = expression.charAt(parsePoint);
            if (c == '%' && peek(1) == '(') {
                expandable = true;
                int close = expression.indexOf(')', parsePoint);
                int endOfName = close < 0 ? expression.length() : close;
                String name = parsePoint + 3 < expression.length()
                        ? expression.substring(parsePoint + 2, Math.max(parsePoint + 2, endOfName))
                        : "";
                if (!checkMetadataAllowed(name, parsePoint + 1)) {
                    return false;
                }
            } else if (c == '@' && peek(1) == '(') {
                expandable = true;
                if (!options.allowItemLists()) {
                    return fail(start + 1, "ItemListNotAllowed", null);
                }
                if (!skipItemList()) {
                    return false;
                }
                continue;
            } else if (c == '$' && peek(1) == '(') {
                expandable = true;
            } else if (c == '%') {
                expandable = true;
            }
            parsePoint++;
        }
        if (parsePoint >= expression.length()) {
            // position of the opening quote
            return fail(start, "IllFormedQuotedString", null);
        }
        lookahead = new Token(Token.Type.STRING, expression.substring(start, parsePoint), expandable);
        parsePoint++;
        return true;
    }

    private boolean parseRemaining() {
        int start = parsePoint;
        char c = expression.charAt(parsePoint);
        if (isNumberStart(c)) {
            parseNumeric(start);
            return true;
        }
        if (isSimpleStringStart(c)) {
            parseSimpleStringOrFunction(start);
            return true;
        }
        return fail(start + 1, "UnexpectedCharacter", String.valueOf(c));
    }

    private void parseSimpleStringOrFunction(int start) {
        while (parsePoint < expression.length() && isSimpleStringChar(expression.charAt(parsePoint))) {
            parsePoint++;
        }
        String word = expression.substring(start, parsePoint);
        if ("and".equalsIgnoreCase(word)) {
            lookahead = Token.AND;
        } else if ("or".equalsIgnoreCase(word)) {
            lookahead = Token.OR;
        } else {
            skipWhiteSpace();
            if (parsePoint < expression.length() && expression.charAt(parsePoint) == '(') {
                lookahead = Token.of(Token.Type.FUNCTION, word);
            } else {
                lookahead = Token.of(Token.Type.STRING, word);
            }
        }
    }

    private void parseNumeric(int start) {
        if (expression.length() - parsePoint > 2
                && expression.charAt(parsePoint) == '0'
                && (expression.charAt(parsePoint + 1) == 'x' || expression.charAt(parsePoint + 1) == 'X')) {
            parsePoint += 2;
            while (parsePoint < expression.length() && isHexDigit(expression.charAt(parsePoint))) {
                parsePoint++;
            }
        } else {
            char sign = expression.charAt(parsePoint);
            if (sign == '+' || sign == '-') {
                parsePoint++;
            }
            skipDigits();
            if (parsePoint < expression.length() && expression.charAt(parsePoint) == '.') {
                parsePoint++;
            }
            skipDigits();
        }
        lookahead = Token.of(Token.Type.NUMERIC, expression.substring(start, parsePoint));
    }

    private boolean fail(int position, String reason, String found) {
        errorState = true;
        errorPosition = position;
        errorReason = reason;
        unexpectedlyFound = found;
        return false;
    }

    private char peek(int offset) {
        int i = parsePoint + offset;
        return i < expression.length() ? expression.charAt(i) : '\0';
    }

    private void skipWhiteSpace() {
        while (parsePoint < expression.length() && Character.isWhitespace(expression.charAt(parsePoint))) {
            parsePoint++;
        }
    }

    private void skipDigits() {
        while (parsePoint < expression.length() && Character.isDigit(expression.charAt(parsePoint))) {
            parsePoint++;
        }
    }

    static boolean isNumberStart(char c) {
        return c == '+' || c == '-' || c == '.' || Character.isDigit(c);
    }

    static boolean isSimpleStringStart(char c) {
        return c == '_' || Character.isLetter(c);
    }

    static boolean isSimpleStringChar(char c) {
        return isSimpleStringStart(c) || Character.isDigit(c);
    }

    static boolean isHexDigit(char c) {
        return Character.isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
}
