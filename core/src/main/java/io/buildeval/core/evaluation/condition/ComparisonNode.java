package io.buildeval.core.evaluation.condition;

import io.buildeval.core.evaluation.EscapingUtilities;

/**
 * {@code ==}, {@code !=}, {@code <}, {@code <=}, {@code >}, {@code >=}.
 *
 * <p>
 * Equality compares numerically when both sides are numbers, as versions when
 * both are versions, as booleans when both are booleans and otherwise as
 * case-insensitive strings. The ordering operators accept numbers and versions
 * only.
 */
final class ComparisonNode extends ConditionNode {

    private final Token.Type operator;
    private final ConditionNode left;
    private final ConditionNode right;

    ComparisonNode(Token.Type operator, ConditionNode left, ConditionNode right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    @Override
    boolean evaluate(ConditionState state) {
        String leftEscaped = left.expandedValue(state);
        String rightEscaped = right.expandedValue(state);
        String l = EscapingUtilities.unescape(leftEscaped);
        String r = EscapingUtilities.unescape(rightEscaped);
        if (operator == Token.Type.EQUAL_TO || operator == Token.Type.NOT_EQUAL_TO) {
            recordConditionedProperties(state, l, r);
            boolean equal = areEqual(l, r);
            return operator == Token.Type.EQUAL_TO ? equal : !equal;
        }
        int comparison = compareOrdered(l, r);
        return switch (operator) {
            case LESS_THAN -> comparison < 0;
            case LESS_THAN_OR_EQUAL_TO -> comparison <= 0;
            case GREATER_THAN -> comparison > 0;
            case GREATER_THAN_OR_EQUAL_TO -> comparison >= 0;
            default -> throw new IllegalStateException("Not a comparison operator: " + operator);
        };
    }

    private static boolean areEqual(String l, String r) {
        Double ln = Conversions.toNumber(l);
        Double rn = Conversions.toNumber(r);
        if (ln != null && rn != null) {
            return ln.doubleValue() == rn.doubleValue();
        }
        int[] lv = Conversions.toVersion(l);
        int[] rv = Conversions.toVersion(r);
        if (lv != null && rv != null) {
            return Conversions.compareVersions(lv, rv) == 0;
        }
        Boolean lb = Conversions.toBoolean(l);
        Boolean rb = Conversions.toBoolean(r);
        if (lb != null && rb != null) {
            return lb.booleanValue() == rb.booleanValue();
        }
        return l.equalsIgnoreCase(r);
    }

    private static int compareOrdered(String l, String r) {
        Double ln = Conversions.toNumber(l);
        Double rn = Conversions.toNumber(r);
        if (ln != null && rn != null) {
            return Double.compare(ln, rn);
        }
        int[] lv = Conversions.toVersion(l);
        int[] rv = Conversions.toVersion(r);
        if (lv != null && rv != null) {
            return Conversions.compareVersions(lv, rv);
        }
        String offending = ln == null && lv == null ? l : r;
        throw new Failure(
                "ComparisonOnNonNumericExpression",
                "a numeric comparison was attempted on \"" + offending + "\" that does not evaluate to a number");
    }

    private void recordConditionedProperties(ConditionState state, String l, String r) {
        ConditionedProperties collector = state.conditionedProperties();
        if (collector == null) {
            return;
        }
        collector.update(left.unexpandedValue(), r);
        collector.update(right.unexpandedValue(), l);
    }
}
