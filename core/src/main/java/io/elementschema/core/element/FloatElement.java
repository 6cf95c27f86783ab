package io.elementschema.core.element;

/** A floating-point element coerced to {@link Double}. Accepts any number and numeric strings. */
public final class FloatElement extends Scalar<Double> {

    public static final ElementType<FloatElement> TYPE = FloatElement::new;

    public FloatElement() {}

    public FloatElement(Object raw) {
        set(raw);
    }

    @Override
    protected ElementValue<Double> unserialize(Object raw) {
        if (raw instanceof Number number) {
            return ElementValue.of(number.doubleValue());
        }
        if (raw instanceof CharSequence text) {
            try {
                return ElementValue.of(Double.parseDouble(text.toString().trim()));
            } catch (NumberFormatException e) {
                return ElementValue.notUnserializable();
            }
        }
        return ElementValue.notUnserializable();
    }
}
