package io.elementschema.core.mapping;

import io.elementschema.core.element.Element;
import io.elementschema.core.element.ElementType;
import io.elementschema.core.element.ElementValue;
import io.elementschema.core.error.ElementSchemaException.Operation;
import io.elementschema.core.error.EmptyMappingException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * A mapping that iterates in insertion order, whose value is a {@link LinkedHashMap}.
 *
 * <p>Replacing the value of an existing key keeps its position; deleting a key and inserting it
 * again moves it to the end. Traversal paths follow the same order.
 *
 * @param <K> coerced key type
 * @param <V> coerced value type
 * @see Dict
 */
public final class OrderedDict<K, V> extends MutableMapping<K, V> {

    public OrderedDict(MemberSchema<K, V> memberSchema) {
        super(memberSchema, new LinkedHashMap<>());
    }

    /** Declares an ordered dict type over the given key and value types. */
    public static <K, V> ElementType<OrderedDict<K, V>> of(
            ElementType<? extends Element<K>> keyType, ElementType<? extends Element<V>> valueType) {
        MemberSchema<K, V> schema = new MemberSchema<>(keyType, valueType);
        return () -> new OrderedDict<>(schema);
    }

    /**
     * Reads raw input as an insertion-ordered map of raw keys to raw values; see
     * {@link Dict#unserialize}.
     */
    public static ElementValue<Map<Object, Object>> unserialize(Object raw) {
        Optional<List<Map.Entry<Object, Object>>> pairs = RawPairs.read(raw);
        if (pairs.isEmpty()) {
            return ElementValue.notUnserializable();
        }
        Map<Object, Object> result = new LinkedHashMap<>();
        pairs.get().forEach(entry -> result.put(entry.getKey(), entry.getValue()));
        return ElementValue.of(result);
    }

    @Override
    protected ElementValue<Map<Object, Object>> toIntermediate(Object raw) {
        return unserialize(raw);
    }

    /** Like {@link Dict#value()}, as a {@link LinkedHashMap} in insertion order. */
    @Override
    public ElementValue<Map<K, V>> value() {
        return project(LinkedHashMap::new);
    }

    /** Key elements, newest first. */
    public Stream<Element<K>> reversedKeys() {
        List<Element<K>> keys = new ArrayList<>(size());
        keys().forEach(keys::add);
        Collections.reverse(keys);
        return keys.stream();
    }

    /** Removes the most recently inserted entry. */
    @Override
    public Item<K, V> popItem() {
        return popItem(true);
    }

    /**
     * Removes the newest ({@code last}) or the oldest entry.
     *
     * @throws EmptyMappingException if there are no entries
     */
    public Item<K, V> popItem(boolean last) {
        if (isEmpty()) {
            throw new EmptyMappingException(Operation.POP_ITEM);
        }
        List<Pair<K, V>> pairs = new ArrayList<>(entries().values());
        Pair<K, V> pair = pairs.get(last ? pairs.size() - 1 : 0);
        entries().remove(pair.identity());
        setPopulated(true);
        return new Item<>(pair.key(), pair.value().value());
    }
}
