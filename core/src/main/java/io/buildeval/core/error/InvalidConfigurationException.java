package io.buildeval.core.error;

import io.buildeval.core.construction.ElementLocation;

/**
 * Thrown for invalid configuration: bad treat-as-local names, SDK reference
 * format, toolset files.
 */
public final class InvalidConfigurationException extends ProjectEvaluationException {

    private static final long serialVersionUID = 1L;

    public InvalidConfigurationException(String message, String errorCode, ElementLocation location) {
        super(message, errorCode, location, Kind.CONFIGURATION);
    }

    public InvalidConfigurationException(String message, Throwable cause, String errorCode, ElementLocation location) {
        super(message, cause, errorCode, location, Kind.CONFIGURATION);
    }
}
