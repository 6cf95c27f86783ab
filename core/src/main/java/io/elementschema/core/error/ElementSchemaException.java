package io.elementschema.core.error;

/**
 * Abstract base for all element-schema exceptions. Never thrown directly; use the concrete
 * subclasses.
 *
 * <p>Exceptions in this hierarchy signal programmer or contract errors (indexing a missing key,
 * popping from an empty mapping, malformed arguments). Bad input data is never reported through
 * an exception: it ends up in {@code Element.errors()} and the element's sentinel value.
 */
public abstract class ElementSchemaException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** The call that failed. */
    public enum Operation {
        GET_ITEM,
        DELETE,
        POP,
        POP_ITEM,
        UPDATE,
        FIELD,
        VALIDATE,
        LOAD_CONFIG
    }

    private final Operation operation;

    protected ElementSchemaException(String message, Operation operation) {
        super(message);
        this.operation = operation;
    }

    protected ElementSchemaException(String message, Throwable cause, Operation operation) {
        super(message, cause);
        this.operation = operation;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The operation that raised this exception. */
    public Operation operation() {
        return operation;
    }
}
