package io.quyaml.core.config;

/**
 * Thrown when compiler configuration cannot be loaded: missing file, invalid
 * YAML, or a value outside its allowed range.
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
