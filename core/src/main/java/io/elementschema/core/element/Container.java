package io.elementschema.core.element;

import io.elementschema.core.validation.ValidationContext;
import java.util.Iterator;
import java.util.stream.Stream;

/**
 * An element that owns child elements. Validation recurses into every child before running the
 * container's own validators.
 *
 * @param <T> the type of the coerced value
 */
public abstract class Container<T> extends Element<T> {

    protected Container() {}

    public abstract int size();

    public boolean isEmpty() {
        return size() == 0;
    }

    /** Removes every child. */
    public abstract void clear();

    /** Every child element, in the container's iteration order. */
    protected abstract Stream<Element<?>> children();

    @Override
    public boolean validate(ValidationContext context) {
        ValidationContext effective = context != null ? context : ValidationContext.empty();
        boolean result = true;
        Iterator<Element<?>> it = children().iterator();
        while (it.hasNext()) {
            result &= it.next().validate(effective);
        }
        result &= runValidators(effective);
        setValid(result);
        return result;
    }
}
