package io.buildeval.core.error;

import io.buildeval.core.construction.ElementLocation;

/**
 * Thrown when a required import cannot be found, directly or through fallback
 * search paths.
 */
public final class ImportNotFoundException extends ProjectEvaluationException {

    private static final long serialVersionUID = 1L;

    public ImportNotFoundException(String message, String errorCode, ElementLocation location) {
        super(message, errorCode, location, Kind.IMPORT);
    }

    public ImportNotFoundException(String message, Throwable cause, String errorCode, ElementLocation location) {
        super(message, cause, errorCode, location, Kind.IMPORT);
    }
}
