package io.elementschema.core.element;

/** A boolean element. Accepts {@link Boolean} and the strings {@code true}/{@code false}. */
public final class BooleanElement extends Scalar<Boolean> {

    public static final ElementType<BooleanElement> TYPE = BooleanElement::new;

    public BooleanElement() {}

    public BooleanElement(Object raw) {
        set(raw);
    }

    @Override
    protected ElementValue<Boolean> unserialize(Object raw) {
        if (raw instanceof Boolean flag) {
            return ElementValue.of(flag);
        }
        if (raw instanceof CharSequence text) {
            String s = text.toString().trim();
            if (s.equalsIgnoreCase("true")) {
                return ElementValue.of(Boolean.TRUE);
            }
            if (s.equalsIgnoreCase("false")) {
                return ElementValue.of(Boolean.FALSE);
            }
        }
        return ElementValue.notUnserializable();
    }
}
