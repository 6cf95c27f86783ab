package io.elementschema.core.element;

import io.elementschema.core.validation.Validator;
import java.util.List;

/**
 * Type-level handle for an element schema: creates fresh, independent element instances.
 *
 * <p>A type is declared once (e.g. {@code UnicodeElement.TYPE}, {@code Dict.of(k, v)}) and shared
 * by every instance created from it. Types are immutable; {@link #validatedBy} returns a new type.
 *
 * @param <E> the element class produced
 */
@FunctionalInterface
public interface ElementType<E extends Element<?>> {

    /** Creates an element with no raw value. */
    E create();

    /** Creates an element and sets the given raw value. */
    default E create(Object raw) {
        E element = create();
        element.set(raw);
        return element;
    }

    /**
     * Returns a type whose instances additionally carry the given validators, run in order by
     * {@link Element#validate}.
     */
    default ElementType<E> validatedBy(Validator... validators) {
        List<Validator> attached = List.of(validators);
        ElementType<E> base = this;
        return () -> {
            E element = base.create();
            element.attachValidators(attached);
            return element;
        };
    }
}
