package io.elementschema.core.element;

/**
 * Base for single-value elements. The coerced value is recomputed from the raw value by
 * {@link #unserialize(Object)} on every {@link #value()} call.
 *
 * @param <T> the type of the coerced value
 */
public abstract class Scalar<T> extends Element<T> {

    protected Scalar() {}

    @Override
    public ElementValue<T> value() {
        ElementValue<Object> raw = rawValue();
        if (raw.isUnspecified()) {
            return ElementValue.unspecified();
        }
        return unserialize(raw.get());
    }

    /**
     * Converts present raw input into this element's type.
     *
     * @return the converted value, or {@link ElementValue#notUnserializable()}; never throws for
     *         bad input
     */
    protected abstract ElementValue<T> unserialize(Object raw);
}
