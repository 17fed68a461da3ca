package io.buildeval.core.error;

import io.buildeval.core.construction.ElementLocation;

/**
 * Abstract base for all evaluation failures. Never thrown directly, use one of
 * the concrete subclasses. Carries a stable error code and the source location
 * of the offending construct.
 */
public abstract class ProjectEvaluationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Error category. */
    public enum Kind {
        SYNTAX,
        CONDITION,
        IMPORT,
        CIRCULAR_IMPORT,
        SDK,
        CONFIGURATION
    }

    private final String errorCode;
    private final ElementLocation location;
    private final Kind kind;

    protected ProjectEvaluationException(String message, String errorCode, ElementLocation location, Kind kind) {
        super(message);
        this.errorCode = errorCode;
        this.location = location;
        this.kind = kind;
    }

    protected ProjectEvaluationException(
            String message, Throwable cause, String errorCode, ElementLocation location, Kind kind) {
        super(message, cause);
        this.errorCode = errorCode;
        this.location = location;
        this.kind = kind;
    }

    /** Stable short code, e.g. {@code MSB4019}. */
    public String errorCode() {
        return errorCode;
    }

    /** Location of the offending construct, or {@code null} when unknown. */
    public ElementLocation location() {
        return location;
    }

    /** File the error was raised in, or {@code null}. */
    public String file() {
        return location != null ? location.file() : null;
    }

    /** 1-based line, or 0 when unknown. */
    public int line() {
        return location != null ? location.line() : 0;
    }

    /** 1-based column, or 0 when unknown. */
    public int column() {
        return location != null ? location.column() : 0;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The category of this error. */
    public Kind kind() {
        return kind;
    }

    @Override
    public String toString() {
        String where = location != null ? location.toString() + ": " : "";
        return where + "error " + errorCode + ": " + getMessage();
    }
}
