package io.buildeval.core.evaluation.condition;

final class NotNode extends ConditionNode {

    private final ConditionNode operand;

    NotNode(ConditionNode operand) {
        this.operand = operand;
    }

    @Override
    boolean evaluate(ConditionState state) {
        return !operand.evaluate(state);
    }
}
