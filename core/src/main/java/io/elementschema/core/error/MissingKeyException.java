package io.elementschema.core.error;

/** Thrown when a key or field is looked up without a fallback and is not present. */
public final class MissingKeyException extends ElementSchemaException {

    private static final long serialVersionUID = 1L;

    private final transient Object key;

    public MissingKeyException(Object key, Operation operation) {
        super("No entry for key: " + key, operation);
        this.key = key;
    }

    /** The key that was not found, as passed by the caller. */
    public Object key() {
        return key;
    }
}
