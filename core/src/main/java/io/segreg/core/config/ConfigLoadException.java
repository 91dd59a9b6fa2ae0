package io.segreg.core.config;

/**
 * Thrown when compiler options cannot be loaded: missing file, invalid YAML, unknown keys or
 * malformed values.
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
