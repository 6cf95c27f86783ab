package io.elementschema.core.element;

import java.nio.charset.StandardCharsets;

/** A binary element. Accepts {@code byte[]} (copied) and text, encoded as UTF-8. */
public final class BytesElement extends Scalar<byte[]> {

    public static final ElementType<BytesElement> TYPE = BytesElement::new;

    public BytesElement() {}

    public BytesElement(Object raw) {
        set(raw);
    }

    @Override
    protected ElementValue<byte[]> unserialize(Object raw) {
        if (raw instanceof byte[] bytes) {
            return ElementValue.of(bytes.clone());
        }
        if (raw instanceof CharSequence text) {
            return ElementValue.of(text.toString().getBytes(StandardCharsets.UTF_8));
        }
        return ElementValue.notUnserializable();
    }
}
