package io.elementschema.core.element;

/** A text element. Accepts any {@link CharSequence}; numbers and booleans are not text. */
public final class UnicodeElement extends Scalar<String> {

    public static final ElementType<UnicodeElement> TYPE = UnicodeElement::new;

    public UnicodeElement() {}

    public UnicodeElement(Object raw) {
        set(raw);
    }

    @Override
    protected ElementValue<String> unserialize(Object raw) {
        if (raw instanceof CharSequence text) {
            return ElementValue.of(text.toString());
        }
        return ElementValue.notUnserializable();
    }
}
