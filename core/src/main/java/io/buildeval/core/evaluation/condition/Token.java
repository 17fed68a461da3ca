package io.buildeval.core.evaluation.condition;

/**
 * A lexical token of a condition.
 *
 * @param type token kind
 * @param text source text; for quoted strings the text between the quotes
 * @param expandable {@code true} when the text may contain property, item or
 *     metadata references
 */
record Token(Type type, String text, boolean expandable) {

    enum Type {
        COMMA,
        LEFT_PARENTHESIS,
        RIGHT_PARENTHESIS,
        LESS_THAN,
        GREATER_THAN,
        LESS_THAN_OR_EQUAL_TO,
        GREATER_THAN_OR_EQUAL_TO,
        EQUAL_TO,
        NOT_EQUAL_TO,
        NOT,
        AND,
        OR,
        PROPERTY,
        STRING,
        NUMERIC,
        ITEM_LIST,
        ITEM_METADATA,
        FUNCTION,
        END_OF_INPUT
    }

    static final Token COMMA = of(Type.COMMA, ",");
    static final Token LEFT_PARENTHESIS = of(Type.LEFT_PARENTHESIS, "(");
    static final Token RIGHT_PARENTHESIS = of(Type.RIGHT_PARENTHESIS, ")");
    static final Token LESS_THAN = of(Type.LESS_THAN, "<");
    static final Token GREATER_THAN = of(Type.GREATER_THAN, ">");
    static final Token LESS_THAN_OR_EQUAL_TO = of(Type.LESS_THAN_OR_EQUAL_TO, "<=");
    static final Token GREATER_THAN_OR_EQUAL_TO = of(Type.GREATER_THAN_OR_EQUAL_TO, ">=");
    static final Token EQUAL_TO = of(Type.EQUAL_TO, "==");
    static final Token NOT_EQUAL_TO = of(Type.NOT_EQUAL_TO, "!=");
    static final Token NOT = of(Type.NOT, "!");
    static final Token AND = of(Type.AND, "and");
    static final Token OR = of(Type.OR, "or");
    static final Token END_OF_INPUT = of(Type.END_OF_INPUT, "");

    static Token of(Type type, String text) {
        return new Token(type, text, false);
    }

    boolean is(Type other) {
        return type == other;
    }

    boolean isComparison() {
        return switch (type) {
            case LESS_THAN,
                    GREATER_THAN,
                    LESS_THAN_OR_EQUAL_TO,
                    GREATER_THAN_OR_EQUAL_TO,
                    EQUAL_TO,
                    NOT_EQUAL_TO -> true;
            default -> false;
        };
    }
}
