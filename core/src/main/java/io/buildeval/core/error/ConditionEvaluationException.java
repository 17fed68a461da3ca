package io.buildeval.core.error;

import io.buildeval.core.construction.ElementLocation;

/**
 * Thrown when a condition cannot be parsed or evaluated. Carries the offending
 * expression, a reason code such as {@code IllFormedEquals} and the 1-based
 * position of the error within the expression (0 when the error is not
 * positional).
 */
public final class ConditionEvaluationException extends ProjectEvaluationException {

    private static final long serialVersionUID = 1L;

    public static final String ERROR_CODE = "MSB4092";

    private final String expression;
    private final String reason;
    private final int position;

    public ConditionEvaluationException(
            String message, String expression, String reason, int position, ElementLocation location) {
        super(message, ERROR_CODE, location, Kind.CONDITION);
        this.expression = expression;
        this.reason = reason;
        this.position = position;
    }

    public ConditionEvaluationException(
            String message, Throwable cause, String expression, String reason, ElementLocation location) {
        super(message, cause, ERROR_CODE, location, Kind.CONDITION);
        this.expression = expression;
        this.reason = reason;
        this.position = 0;
    }

    /** The full condition text. */
    public String expression() {
        return expression;
    }

    /** Reason code, e.g. {@code IllFormedQuotedString}. */
    public String reason() {
        return reason;
    }

    /** 1-based position of the offending character, or 0. */
    public int position() {
        return position;
    }

    /** Returns a copy of this error bound to the given element location. */
    public ConditionEvaluationException at(ElementLocation newLocation) {
        ConditionEvaluationException copy =
                new ConditionEvaluationException(getMessage(), expression, reason, position, newLocation);
        copy.initCause(getCause());
        return copy;
    }
}
