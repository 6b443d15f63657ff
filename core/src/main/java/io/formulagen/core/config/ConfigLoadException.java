package io.formulagen.core.config;

/**
 * Thrown when generator options cannot be loaded: missing file, invalid YAML or an invalid
 * value. The message is suitable for direct output to the user.
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
