package io.buildeval.core.error;

import io.buildeval.core.construction.ElementLocation;

/**
 * Thrown when an import would re-enter a file that is still being evaluated.
 */
public final class CircularImportException extends ProjectEvaluationException {

    private static final long serialVersionUID = 1L;

    public CircularImportException(String message, String errorCode, ElementLocation location) {
        super(message, errorCode, location, Kind.CIRCULAR_IMPORT);
    }

    public CircularImportException(String message, Throwable cause, String errorCode, ElementLocation location) {
        super(message, cause, errorCode, location, Kind.CIRCULAR_IMPORT);
    }
}
