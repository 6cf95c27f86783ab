package io.elementschema.core.mapping;

import io.elementschema.core.element.Container;
import io.elementschema.core.element.Element;
import io.elementschema.core.element.ElementValue;
import io.elementschema.core.element.NamedChildren;
import io.elementschema.core.element.PathedElement;
import io.elementschema.core.element.Sentinel;
import io.elementschema.core.error.ElementSchemaException.Operation;
import io.elementschema.core.error.MissingKeyException;
import java.nio.ByteBuffer;
import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Read side of a key/value container whose keys and values are both elements.
 *
 * <p>Entries live in a map owned by the mapping, from entry identity to {@link Pair}. The identity
 * of an entry is the coerced key value when the key coerces, otherwise the raw key; lookups coerce
 * the probe key through the key type the same way. The backing map decides the iteration order.
 *
 * <p>Validation (inherited from {@link Container}) visits the key and the value of every entry and
 * then the mapping's own validators; every check runs, nothing short-circuits.
 *
 * @param <K> coerced key type
 * @param <V> coerced value type
 */
public abstract class Mapping<K, V> extends Container<Map<K, V>> implements NamedChildren {

    private final MemberSchema<K, V> memberSchema;
    private final Map<Object, Pair<K, V>> entries;
    private boolean populated;

    /**
     * @param memberSchema key and value types
     * @param backing      empty map that stores the entries; its iteration order becomes the
     *                     mapping's
     */
    protected Mapping(MemberSchema<K, V> memberSchema, Map<Object, Pair<K, V>> backing) {
        this.memberSchema = Objects.requireNonNull(memberSchema, "memberSchema must not be null");
        this.entries = backing;
    }

    public MemberSchema<K, V> memberSchema() {
        return memberSchema;
    }

    /** The backing map, for subclasses that implement mutation. */
    protected final Map<Object, Pair<K, V>> entries() {
        return entries;
    }

    /**
     * True once the entries define this mapping's value: after raw input was read successfully,
     * or after any mutation.
     */
    protected final boolean isPopulated() {
        return populated;
    }

    protected final void setPopulated(boolean populated) {
        this.populated = populated;
    }

    /**
     * The raw input last passed to {@code set}; once the mapping is populated, a map of every
     * entry's raw key to its raw value instead.
     */
    @Override
    public ElementValue<Object> rawValue() {
        if (!populated) {
            return super.rawValue();
        }
        Map<Object, Object> raw = new LinkedHashMap<>();
        for (Pair<K, V> pair : entries.values()) {
            raw.put(unwrap(pair.key().rawValue()), unwrap(pair.value().rawValue()));
        }
        return ElementValue.<Object>of(raw);
    }

    // ── Read access ──

    /** The coerced value for {@code key}, or the value type's unspecified value if absent. */
    public ElementValue<V> get(Object key) {
        return get(key, Sentinel.UNSPECIFIED);
    }

    /**
     * The coerced value for {@code key}, or {@code defaultRaw} coerced through the value type if
     * absent. Never throws.
     */
    public ElementValue<V> get(Object key, Object defaultRaw) {
        Pair<K, V> pair = entries.get(probe(key));
        if (pair == null) {
            return memberSchema.value(defaultRaw).value();
        }
        return pair.value().value();
    }

    /**
     * The coerced value for {@code key}.
     *
     * @throws MissingKeyException if there is no such entry
     */
    public ElementValue<V> getItem(Object key) {
        return require(key, Operation.GET_ITEM).value().value();
    }

    /** The key element of the entry for {@code key}. */
    public Element<K> keyElement(Object key) {
        return require(key, Operation.GET_ITEM).key();
    }

    /** The value element of the entry for {@code key}. */
    public Element<V> valueElement(Object key) {
        return require(key, Operation.GET_ITEM).value();
    }

    /** The value element stored under the text key {@code name}, if any. */
    @Override
    public Optional<Element<?>> child(String name) {
        Pair<K, V> pair = entries.get(probe(name));
        return pair == null ? Optional.empty() : Optional.of(pair.value());
    }

    public boolean containsKey(Object key) {
        return entries.containsKey(probe(key));
    }

    /** Alias for {@link #containsKey(Object)}. */
    public boolean hasKey(Object key) {
        return containsKey(key);
    }

    @Override
    public int size() {
        return entries.size();
    }

    /**
     * Key elements, in iteration order. Setting a key element in place changes the coerced key
     * the mapping reports but not the slot its entry is stored under.
     */
    public Stream<Element<K>> keys() {
        return snapshot().stream().map(Pair::key);
    }

    /** Coerced values, in iteration order. */
    public Stream<ElementValue<V>> values() {
        return snapshot().stream().map(pair -> pair.value().value());
    }

    /** Key elements with their coerced values, in iteration order. */
    public Stream<Item<K, V>> items() {
        return snapshot().stream().map(pair -> new Item<>(pair.key(), pair.value().value()));
    }

    /** Removes every entry. The mapping then holds an empty value. */
    @Override
    public void clear() {
        entries.clear();
        populated = true;
    }

    @Override
    protected Stream<Element<?>> children() {
        return snapshot().stream().flatMap(pair -> Stream.of(pair.key(), pair.value()));
    }

    /**
     * Lazily yields every leaf below this mapping. The i-th entry's key is visited under
     * {@code prefix + [i, 0]} and its value under {@code prefix + [i, 1]}; nested containers extend
     * the path further. Entries are numbered in iteration order as of this call.
     */
    @Override
    public Stream<PathedElement> traverse(List<Integer> prefix) {
        List<Pair<K, V>> pairs = snapshot();
        return IntStream.range(0, pairs.size()).boxed().flatMap(i -> {
            List<Integer> entryPath = append(prefix, i);
            Pair<K, V> pair = pairs.get(i);
            return Stream.concat(
                    pair.key().traverse(append(entryPath, 0)), pair.value().traverse(append(entryPath, 1)));
        });
    }

    // ── Helpers for subclasses ──

    /**
     * Builds the plain-map projection of this mapping.
     *
     * @param factory creates the result map; its ordering is the result's ordering
     * @return {@code UNSPECIFIED} if no input was given, {@code NOT_UNSERIALIZABLE} if the input
     *         was not mapping-shaped or any key or value did not coerce, otherwise a fresh map
     */
    protected final ElementValue<Map<K, V>> project(Supplier<? extends Map<K, V>> factory) {
        if (!populated) {
            return super.rawValue().isUnspecified() ? ElementValue.unspecified() : ElementValue.notUnserializable();
        }
        Map<K, V> result = factory.get();
        for (Pair<K, V> pair : entries.values()) {
            ElementValue<K> key = pair.key().value();
            ElementValue<V> value = pair.value().value();
            if (key.isNotUnserializable() || value.isNotUnserializable()) {
                return ElementValue.notUnserializable();
            }
            // an unspecified member can only come from explicitly passing the sentinel
            result.put(key.orElse(null), value.orElse(null));
        }
        return ElementValue.of(result);
    }

    /** Identity under which the entry for {@code keyElement} is stored. */
    protected final Object identity(Element<K> keyElement) {
        ElementValue<K> value = keyElement.value();
        Object id = value.isPresent() ? value.get() : unwrap(keyElement.rawValue());
        return id instanceof byte[] bytes ? ByteBuffer.wrap(bytes.clone()) : id;
    }

    /** Identity of the entry a caller-supplied raw key refers to. */
    protected final Object probe(Object rawKey) {
        return identity(memberSchema.key(rawKey));
    }

    protected final Pair<K, V> require(Object key, Operation operation) {
        Pair<K, V> pair = entries.get(probe(key));
        if (pair == null) {
            throw new MissingKeyException(key, operation);
        }
        return pair;
    }

    /** Raw key/value pairs of every entry, in iteration order. */
    final List<Map.Entry<Object, Object>> rawPairs() {
        List<Map.Entry<Object, Object>> pairs = new ArrayList<>(entries.size());
        for (Pair<K, V> pair : entries.values()) {
            pairs.add(new SimpleImmutableEntry<>(unwrap(pair.key().rawValue()), unwrap(pair.value().rawValue())));
        }
        return pairs;
    }

    private List<Pair<K, V>> snapshot() {
        return new ArrayList<>(entries.values());
    }

    private static Object unwrap(ElementValue<Object> raw) {
        return raw.isPresent() ? raw.get() : Sentinel.UNSPECIFIED;
    }

    private static List<Integer> append(List<Integer> prefix, int index) {
        List<Integer> path = new ArrayList<>(prefix.size() + 1);
        path.addAll(prefix);
        path.add(index);
        return path;
    }
}
