package io.elementschema.core.validation;

import io.elementschema.core.element.Element;
import io.elementschema.core.element.NamedChildren;
import io.elementschema.core.error.ElementSchemaException.Operation;
import io.elementschema.core.error.InvalidArgumentException;
import java.util.Map;
import java.util.Objects;

/**
 * Fails if two named child elements have unequal values, e.g. a password and its confirmation in a
 * {@code Form}. Operand selectors are child names. The placeholders {@code {a}} and {@code {b}} are
 * substituted with the operand labels.
 */
public final class AttributesEqual extends Validator {

    public static final String KEY = "attributes-equal";
    public static final String MESSAGE = "{a} and {b} must be equal.";

    private final Operand a;
    private final Operand b;

    public AttributesEqual(Operand a, Operand b) {
        this(a, b, MESSAGE);
    }

    public AttributesEqual(Operand a, Operand b, String message) {
        super(KEY, message);
        this.a = Objects.requireNonNull(a, "a must not be null");
        this.b = Objects.requireNonNull(b, "b must not be null");
    }

    @Override
    public boolean validate(Element<?> element, ValidationContext context) {
        if (!isUnusable(element) && child(element, a).value().equals(child(element, b).value())) {
            return true;
        }
        noteError(element, message(), context, Map.of("a", a.label(), "b", b.label()));
        return false;
    }

    private static Element<?> child(Element<?> element, Operand operand) {
        if (!(element instanceof NamedChildren named)) {
            throw new InvalidArgumentException(
                    element.typeName() + " has no named children", Operation.VALIDATE);
        }
        String name = String.valueOf(operand.selector());
        return named.child(name)
                .orElseThrow(() -> new InvalidArgumentException(
                        element.typeName() + " has no child named '" + name + "'", Operation.VALIDATE));
    }
}
