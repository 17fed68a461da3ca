package io.buildeval.core.evaluation.condition;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for conditions.
 *
 * <pre>
 * expr       := andTerm ('or' andTerm)*
 * andTerm    := relational ('and' relational)*
 * relational := factor (relop factor)?
 * factor     := '!' factor | '(' expr ')' | function '(' args? ')' | operand
 * args       := operand (',' operand)*
 * </pre>
 */
final class ConditionParser {

    private final String expression;
    private final Scanner scanner;

    private ConditionParser(String expression, ParserOptions options) {
        this.expression = expression;
        this.scanner = new Scanner(expression, options);
    }

    /**
     * Parses {@code expression}.
     *
     * @throws ParseFailure with the reason and 1-based position of the first
     *     error
     */
    static ConditionNode parse(String expression, ParserOptions options) {
        return new ConditionParser(expression, options).parseAll();
    }

    private ConditionNode parseAll() {
        advance();
        ConditionNode node = expr();
        if (!scanner.isNext(Token.Type.END_OF_INPUT)) {
            throw unexpectedToken();
        }
        return node;
    }

    private ConditionNode expr() {
        ConditionNode node = andTerm();
        while (scanner.isNext(Token.Type.OR)) {
            advance();
            node = new OrNode(node, andTerm());
        }
        return node;
    }

    private ConditionNode andTerm() {
        ConditionNode node = relational();
        while (scanner.isNext(Token.Type.AND)) {
            advance();
            node = new AndNode(node, relational());
        }
        return node;
    }

    private ConditionNode relational() {
        ConditionNode left = factor();
        Token current = scanner.current();
        if (current.isComparison()) {
            advance();
            return new ComparisonNode(current.type(), left, factor());
        }
        return left;
    }

    private ConditionNode factor() {
        Token current = scanner.current();
        switch (current.type()) {
            case NOT:
                advance();
                return new NotNode(factor());
            case LEFT_PARENTHESIS:
                advance();
                ConditionNode inner = expr();
                expect(Token.Type.RIGHT_PARENTHESIS);
                return inner;
            case FUNCTION:
                return functionCall(current.text());
            default:
                ConditionNode operand = operand();
                if (operand == null) {
                    throw unexpectedToken();
                }
                return operand;
        }
    }

    private ConditionNode functionCall(String name) {
        advance();
        expect(Token.Type.LEFT_PARENTHESIS);
        List<ConditionNode> arguments = new ArrayList<>();
        if (!scanner.isNext(Token.Type.RIGHT_PARENTHESIS)) {
            arguments.add(requireOperand());
            while (scanner.isNext(Token.Type.COMMA)) {
                advance();
                arguments.add(requireOperand());
            }
        }
        expect(Token.Type.RIGHT_PARENTHESIS);
        return new FunctionCallNode(name, arguments);
    }

    private ConditionNode requireOperand() {
        ConditionNode operand = operand();
        if (operand == null) {
            throw unexpectedToken();
        }
        return operand;
    }

    /**
     * Consumes an operand token, or returns {@code null} when the current token
     * is not one.
     */
    private ConditionNode operand() {
        Token current = scanner.current();
        switch (current.type()) {
            case STRING:
            case PROPERTY:
            case ITEM_LIST:
            case ITEM_METADATA:
                advance();
                return new OperandNode(current.text(), current.expandable());
            case NUMERIC:
                advance();
                return new OperandNode(current.text(), false);
            default:
                return null;
        }
    }

    private void expect(Token.Type type) {
        if (!scanner.isNext(type)) {
            throw unexpectedToken();
        }
        advance();
    }

    private void advance() {
        if (!scanner.advance()) {
            throw new ParseFailure(
                    scanner.errorReason(),
                    scanner.errorPosition(),
                    describe(scanner.errorReason(), scanner.unexpectedlyFound()));
        }
    }

    private ParseFailure unexpectedToken() {
        Token current = scanner.current();
        if (current.is(Token.Type.END_OF_INPUT)) {
            return new ParseFailure(
                    "UnexpectedEndOfInput",
                    scanner.errorPosition(),
                    "unexpected end of input at position " + scanner.errorPosition());
        }
        return new ParseFailure(
                "UnexpectedToken",
                scanner.errorPosition(),
                "unexpected \"" + current.text() + "\" at position " + scanner.errorPosition());
    }

    private String describe(String reason, String found) {
        StringBuilder sb = new StringBuilder(reason).append(" at position ").append(scanner.errorPosition());
        if (found != null) {
            sb.append(", found \"").append(found).append('"');
        }
        return sb.append(" in \"").append(expression).append('"').toString();
    }

    /** A condition that could not be parsed. */
    static final class ParseFailure extends RuntimeException {

        private static final long serialVersionUID = 1L;

        private final String reason;
        private final int position;

        ParseFailure(String reason, int position, String message) {
            super(message);
            this.reason = reason;
            this.position = position;
        }

        String reason() {
            return reason;
        }

        int position() {
            return position;
        }
    }
}
