package io.elementschema.core.error;

/**
 * Thrown when a call receives arguments it cannot accept, e.g. more than one positional source
 * passed to {@code update}, or a source entry that is not a key/value pair.
 */
public final class InvalidArgumentException extends ElementSchemaException {

    private static final long serialVersionUID = 1L;

    public InvalidArgumentException(String message, Operation operation) {
        super(message, operation);
    }

    public InvalidArgumentException(String message, Throwable cause, Operation operation) {
        super(message, cause, operation);
    }
}
