package io.buildeval.core.evaluation.condition;

/**
 * Short-circuit disjunction: the right side is not evaluated when the left is
 * true.
 */
final class OrNode extends ConditionNode {

    private final ConditionNode left;
    private final ConditionNode right;

    OrNode(ConditionNode left, ConditionNode right) {
        this.left = left;
        this.right = right;
    }

    @Override
    boolean evaluate(ConditionState state) {
        return left.evaluate(state) || right.evaluate(state);
    }
}
