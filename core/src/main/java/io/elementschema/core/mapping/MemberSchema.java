package io.elementschema.core.mapping;

import io.elementschema.core.element.Element;
import io.elementschema.core.element.ElementType;
import java.util.Objects;

/**
 * The (key type, value type) pair a mapping type is declared over. Shared by every instance of
 * that mapping type.
 *
 * @param keyType   creates key elements
 * @param valueType creates value elements
 */
public record MemberSchema<K, V>(
        ElementType<? extends Element<K>> keyType, ElementType<? extends Element<V>> valueType) {

    public MemberSchema {
        Objects.requireNonNull(keyType, "keyType must not be null");
        Objects.requireNonNull(valueType, "valueType must not be null");
    }

    /** Coerces a raw key through the key type. */
    public Element<K> key(Object raw) {
        return keyType.create(raw);
    }

    /** Coerces a raw value through the value type. */
    public Element<V> value(Object raw) {
        return valueType.create(raw);
    }
}
