package io.elementschema.core.validation;

import java.util.Objects;

/**
 * One side of an equality check: {@code selector} picks the item or child to compare and
 * {@code label} names it in the error message.
 */
public record Operand(String label, Object selector) {

    public Operand {
        Objects.requireNonNull(label, "label must not be null");
    }

    public static Operand of(String label, Object selector) {
        return new Operand(label, selector);
    }
}
