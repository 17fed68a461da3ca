package io.buildeval.core.evaluation.condition;

/**
 * Short-circuit conjunction: the right side is not evaluated when the left is
 * false.
 */
final class AndNode extends ConditionNode {

    private final ConditionNode left;
    private final ConditionNode right;

    AndNode(ConditionNode left, ConditionNode right) {
        this.left = left;
        this.right = right;
    }

    @Override
    boolean evaluate(ConditionState state) {
        return left.evaluate(state) && right.evaluate(state);
    }
}
