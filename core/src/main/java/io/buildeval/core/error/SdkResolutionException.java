package io.buildeval.core.error;

import io.buildeval.core.construction.ElementLocation;

/**
 * Thrown when no SDK resolver could resolve a referenced SDK, or a resolver
 * failed.
 */
public final class SdkResolutionException extends ProjectEvaluationException {

    private static final long serialVersionUID = 1L;

    public SdkResolutionException(String message, String errorCode, ElementLocation location) {
        super(message, errorCode, location, Kind.SDK);
    }

    public SdkResolutionException(String message, Throwable cause, String errorCode, ElementLocation location) {
        super(message, cause, errorCode, location, Kind.SDK);
    }
}
