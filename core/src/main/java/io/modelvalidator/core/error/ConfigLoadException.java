package io.modelvalidator.core.error;

/**
 * Thrown when a validation config file cannot be loaded: missing file, invalid YAML, or a
 * document that violates the config schema. Carries the {@code source} path.
 */
public final class ConfigLoadException extends ModelValidatorException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public ConfigLoadException(String message, String source) {
        super(Stage.CONFIG_LOAD, null, message, null);
        this.source = source;
    }

    public ConfigLoadException(String message, Throwable cause, String source) {
        super(Stage.CONFIG_LOAD, null, message, cause);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
