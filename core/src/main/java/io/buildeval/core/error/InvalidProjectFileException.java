package io.buildeval.core.error;

import io.buildeval.core.construction.ElementLocation;

/**
 * Thrown when a project file is malformed or contains an unrecognised
 * construct.
 */
public final class InvalidProjectFileException extends ProjectEvaluationException {

    private static final long serialVersionUID = 1L;

    public InvalidProjectFileException(String message, String errorCode, ElementLocation location) {
        super(message, errorCode, location, Kind.SYNTAX);
    }

    public InvalidProjectFileException(String message, Throwable cause, String errorCode, ElementLocation location) {
        super(message, cause, errorCode, location, Kind.SYNTAX);
    }
}
