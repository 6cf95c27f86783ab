package io.elementschema.core.mapping;

import io.elementschema.core.element.Element;
import io.elementschema.core.element.ElementType;
import io.elementschema.core.element.ElementValue;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A mapping without ordering guarantees, whose value is a {@link HashMap}.
 *
 * <p>Declare the key and value types with {@link #of}:
 *
 * <pre>{@code
 * ElementType<Dict<String, Long>> scores = Dict.of(UnicodeElement.TYPE, IntegerElement.TYPE);
 * Dict<String, Long> dict = scores.create(Map.of("alice", "3", "bob", 5));
 * dict.value(); // ElementValue[{alice=3, bob=5}]
 * }</pre>
 *
 * <p>Anything {@link #unserialize} accepts is accepted as raw input.
 *
 * @param <K> coerced key type
 * @param <V> coerced value type
 */
public final class Dict<K, V> extends MutableMapping<K, V> {

    public Dict(MemberSchema<K, V> memberSchema) {
        super(memberSchema, new HashMap<>());
    }

    /**
     * Declares a dict type over the given key and value types. Every instance created from the
     * returned type shares the same member schema.
     */
    public static <K, V> ElementType<Dict<K, V>> of(
            ElementType<? extends Element<K>> keyType, ElementType<? extends Element<V>> valueType) {
        MemberSchema<K, V> schema = new MemberSchema<>(keyType, valueType);
        return () -> new Dict<>(schema);
    }

    /**
     * Reads raw input as a map of raw keys to raw values: a {@link Map}, a {@link Mapping}, or an
     * iterable or array of pairs.
     *
     * @return the map, or {@code NOT_UNSERIALIZABLE}; never throws
     */
    public static ElementValue<Map<Object, Object>> unserialize(Object raw) {
        Optional<List<Map.Entry<Object, Object>>> pairs = RawPairs.read(raw);
        if (pairs.isEmpty()) {
            return ElementValue.notUnserializable();
        }
        Map<Object, Object> result = new HashMap<>();
        pairs.get().forEach(entry -> result.put(entry.getKey(), entry.getValue()));
        return ElementValue.of(result);
    }

    @Override
    protected ElementValue<Map<Object, Object>> toIntermediate(Object raw) {
        return unserialize(raw);
    }

    /**
     * A fresh {@link HashMap} of every coerced key to its coerced value; {@code UNSPECIFIED} if no
     * input was given; {@code NOT_UNSERIALIZABLE} if the input was not mapping-shaped or any key or
     * value did not coerce.
     */
    @Override
    public ElementValue<Map<K, V>> value() {
        return project(HashMap::new);
    }
}
