package io.elementschema.core.error;

/**
 * Thrown when a message catalog cannot be read or parsed. Carries the file path or classpath
 * resource that caused the error.
 */
public final class ConfigLoadException extends ElementSchemaException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public ConfigLoadException(String message, String source) {
        super(message, Operation.LOAD_CONFIG);
        this.source = source;
    }

    public ConfigLoadException(String message, Throwable cause, String source) {
        super(message, cause, Operation.LOAD_CONFIG);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
