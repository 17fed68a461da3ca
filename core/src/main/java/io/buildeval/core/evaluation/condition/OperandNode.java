package io.buildeval.core.evaluation.condition;

import io.buildeval.core.evaluation.EscapingUtilities;

/**
 * A string, number, property, item list or metadata operand. Expandable
 * operands are expanded against the state each time they are read.
 */
final class OperandNode extends ConditionNode {

    private final String text;
    private final boolean expandable;

    OperandNode(String text, boolean expandable) {
        this.text = text;
        this.expandable = expandable;
    }

    @Override
    boolean evaluate(ConditionState state) {
        String value = EscapingUtilities.unescape(expandedValue(state));
        Boolean result = Conversions.toBoolean(value);
        if (result == null) {
            throw new Failure(
                    "ConditionNotBoolean",
                    "\"" + text + "\" evaluates to \"" + value + "\" instead of a boolean");
        }
        return result;
    }

    @Override
    String expandedValue(ConditionState state) {
        return expandable ? state.expand(text) : text;
    }

    @Override
    String unexpandedValue() {
        return text;
    }
}
