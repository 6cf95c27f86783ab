package io.elementschema.core.mapping;

import io.elementschema.core.element.Element;
import io.elementschema.core.element.ElementValue;

/**
 * A (key, value) pair as returned by {@link Mapping#items()} and {@code popItem}.
 *
 * @param key   the key element
 * @param value the coerced value
 */
public record Item<K, V>(Element<K> key, ElementValue<V> value) {}
