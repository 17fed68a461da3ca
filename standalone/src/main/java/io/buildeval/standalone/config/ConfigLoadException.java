package io.buildeval.standalone.config;

/**
 * Thrown when the command-line configuration cannot be loaded: unreadable file,
 * invalid YAML, malformed argument or missing project.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
