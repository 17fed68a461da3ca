package io.buildeval.core.evaluation.condition;

/**
 * Node of a parsed condition. Nodes are immutable and may be evaluated
 * concurrently against different states.
 */
abstract class ConditionNode {

    /** Evaluates this node as a boolean. */
    abstract boolean evaluate(ConditionState state);

    /**
     * Escaped value of this node when used as an operand. Boolean nodes yield
     * {@code true} or {@code false}.
     */
    String expandedValue(ConditionState state) {
        return Boolean.toString(evaluate(state));
    }

    /**
     * Source text of an operand before expansion, or {@code null} for operator
     * nodes.
     */
    String unexpandedValue() {
        return null;
    }

    /**
     * Raised while evaluating; the evaluator turns it into a
     * {@code ConditionEvaluationException}.
     */
    static final class Failure extends RuntimeException {

        private static final long serialVersionUID = 1L;

        private final String reason;

        Failure(String reason, String message) {
            super(message);
            this.reason = reason;
        }

        String reason() {
            return reason;
        }
    }
}
