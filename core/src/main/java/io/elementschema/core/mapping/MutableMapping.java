package io.elementschema.core.mapping;

import io.elementschema.core.element.Element;
import io.elementschema.core.element.ElementValue;
import io.elementschema.core.error.ElementSchemaException.Operation;
import io.elementschema.core.error.EmptyMappingException;
import io.elementschema.core.error.InvalidArgumentException;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Write side of a mapping. Every key and value passes through the member schema; a value that
 * does not coerce is stored anyway and surfaces through {@code value()} and {@code validate()},
 * never as an exception.
 *
 * @param <K> coerced key type
 * @param <V> coerced value type
 */
public abstract class MutableMapping<K, V> extends Mapping<K, V> {

    private static final Logger LOG = LoggerFactory.getLogger(MutableMapping.class);

    protected MutableMapping(MemberSchema<K, V> memberSchema, Map<Object, Pair<K, V>> backing) {
        super(memberSchema, backing);
    }

    /**
     * Converts raw input into raw key/value pairs.
     *
     * @return the intermediate map, or {@code NOT_UNSERIALIZABLE}; never throws
     */
    protected abstract ElementValue<Map<Object, Object>> toIntermediate(Object raw);

    /**
     * Rebuilds the entries from {@code raw}. Unless {@code raw} is unspecified it is read with
     * {@link #toIntermediate}; input that is not mapping-shaped leaves the mapping empty with a
     * {@code NOT_UNSERIALIZABLE} value and is kept as-is in {@link #rawValue()}. Once the entries
     * are populated, {@code rawValue()} is derived from them instead, e.g. a list of pairs comes
     * back as a map.
     */
    @Override
    public void set(Object raw) {
        super.set(raw);
        entries().clear();
        setPopulated(false);
        ElementValue<Object> stored = rawValue();
        if (stored.isUnspecified()) {
            return;
        }
        ElementValue<Map<Object, Object>> intermediate = toIntermediate(stored.get());
        if (intermediate.isPresent()) {
            update(intermediate.get());
        } else {
            LOG.debug("Raw value is not mapping-shaped: element={}, type={}", typeName(), typeOf(stored.get()));
        }
    }

    /**
     * Stores an entry, coercing both sides through the member schema. An existing entry for an
     * equal key is replaced in place.
     */
    public void set(Object key, Object value) {
        Element<K> keyElement = memberSchema().key(key);
        Element<V> valueElement = memberSchema().value(value);
        if (LOG.isDebugEnabled()
                && (keyElement.value().isNotUnserializable() || valueElement.value().isNotUnserializable())) {
            LOG.debug("Entry did not coerce: element={}, key={}, value={}", typeName(), key, value);
        }
        Object id = identity(keyElement);
        entries().put(id, new Pair<>(id, keyElement, valueElement));
        setPopulated(true);
    }

    /** The coerced value for {@code key}; if absent, {@code defaultRaw} is stored first. */
    public ElementValue<V> setDefault(Object key, Object defaultRaw) {
        if (!containsKey(key)) {
            set(key, defaultRaw);
        }
        return getItem(key);
    }

    /**
     * Removes the entry for {@code key}.
     *
     * @return the removed coerced value
     * @throws io.elementschema.core.error.MissingKeyException if there is no such entry
     */
    public ElementValue<V> delete(Object key) {
        return remove(key, Operation.DELETE);
    }

    /**
     * Removes the entry for {@code key}.
     *
     * @return the removed coerced value
     * @throws io.elementschema.core.error.MissingKeyException if there is no such entry
     */
    public ElementValue<V> pop(Object key) {
        return remove(key, Operation.POP);
    }

    /**
     * Removes the entry for {@code key}, or coerces {@code fallback} through the value type if
     * there is none.
     */
    public ElementValue<V> pop(Object key, Object fallback) {
        if (!containsKey(key)) {
            return memberSchema().value(fallback).value();
        }
        return remove(key, Operation.POP);
    }

    /**
     * Removes some entry.
     *
     * @throws EmptyMappingException if there are no entries
     */
    public Item<K, V> popItem() {
        Iterator<Pair<K, V>> it = entries().values().iterator();
        if (!it.hasNext()) {
            throw new EmptyMappingException(Operation.POP_ITEM);
        }
        Pair<K, V> pair = it.next();
        it.remove();
        setPopulated(true);
        return new Item<>(pair.key(), pair.value().value());
    }

    /**
     * Stores every entry of at most one source, in the source's order.
     *
     * @throws InvalidArgumentException if more than one source is given or a source is not
     *                                  mapping-shaped
     * @see #updateWith(Object[], Map)
     */
    public void update(Object... sources) {
        updateWith(sources, Map.of());
    }

    /**
     * Stores every entry of at most one source, then every override. Later entries win.
     *
     * @param sources   zero or one {@link Map}, {@link Mapping}, or iterable/array of pairs
     * @param overrides entries applied after the source
     * @throws InvalidArgumentException if more than one source is given or a source is not
     *                                  mapping-shaped
     */
    public void updateWith(Object[] sources, Map<?, ?> overrides) {
        int count = sources == null ? 0 : sources.length;
        if (count > 1) {
            throw new InvalidArgumentException(
                    "update expected at most 1 argument, got " + count, Operation.UPDATE);
        }
        if (count == 1) {
            Optional<List<Map.Entry<Object, Object>>> pairs = RawPairs.read(sources[0]);
            if (pairs.isEmpty()) {
                throw new InvalidArgumentException(
                        "update source is not a mapping or an iterable of pairs: " + typeOf(sources[0]),
                        Operation.UPDATE);
            }
            pairs.get().forEach(entry -> set(entry.getKey(), entry.getValue()));
        }
        if (overrides != null) {
            overrides.forEach(this::set);
        }
        setPopulated(true);
    }

    private ElementValue<V> remove(Object key, Operation operation) {
        Pair<K, V> pair = require(key, operation);
        entries().remove(pair.identity());
        setPopulated(true);
        return pair.value().value();
    }

    static String typeOf(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
