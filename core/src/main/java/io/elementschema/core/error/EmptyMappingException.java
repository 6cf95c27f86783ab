package io.elementschema.core.error;

/** Thrown when an entry is removed from a mapping that has none. */
public final class EmptyMappingException extends ElementSchemaException {

    private static final long serialVersionUID = 1L;

    public EmptyMappingException(Operation operation) {
        super("mapping is empty", operation);
    }
}
