package io.elementschema.core.mapping;

import io.elementschema.core.element.Element;

/**
 * One mapping entry. Keys are elements too, so they can fail coercion and validation.
 *
 * @param identity the backing-map key the entry was stored under; fixed at insertion, so setting
 *                 a new raw value on {@code key} afterwards does not orphan the entry
 */
record Pair<K, V>(Object identity, Element<K> key, Element<V> value) {}
