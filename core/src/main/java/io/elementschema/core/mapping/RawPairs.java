package io.elementschema.core.mapping;

import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Reads raw input shaped like a mapping into an ordered list of raw key/value pairs. */
final class RawPairs {

    private RawPairs() {}

    /**
     * Accepts a {@link Map}, a {@link Mapping} (its raw keys and values), or an iterable or array
     * whose items are pairs. A pair is a {@link Map.Entry}, a two-element {@link List} or a
     * two-element array.
     *
     * @return the pairs in source order, or empty if {@code raw} is not mapping-shaped
     */
    static Optional<List<Map.Entry<Object, Object>>> read(Object raw) {
        if (raw instanceof Map<?, ?> map) {
            List<Map.Entry<Object, Object>> pairs = new ArrayList<>(map.size());
            map.forEach((k, v) -> pairs.add(new SimpleImmutableEntry<>(k, v)));
            return Optional.of(pairs);
        }
        if (raw instanceof Mapping<?, ?> mapping) {
            return Optional.of(mapping.rawPairs());
        }
        Iterable<?> items;
        if (raw instanceof Object[] array) {
            items = Arrays.asList(array);
        } else if (raw instanceof Iterable<?> iterable && !(raw instanceof CharSequence)) {
            items = iterable;
        } else {
            return Optional.empty();
        }
        List<Map.Entry<Object, Object>> pairs = new ArrayList<>();
        for (Object item : items) {
            Optional<Map.Entry<Object, Object>> pair = pair(item);
            if (pair.isEmpty()) {
                return Optional.empty();
            }
            pairs.add(pair.get());
        }
        return Optional.of(pairs);
    }

    private static Optional<Map.Entry<Object, Object>> pair(Object item) {
        if (item instanceof Map.Entry<?, ?> entry) {
            return Optional.of(new SimpleImmutableEntry<>(entry.getKey(), entry.getValue()));
        }
        if (item instanceof List<?> list && list.size() == 2) {
            return Optional.of(new SimpleImmutableEntry<>(list.get(0), list.get(1)));
        }
        if (item instanceof Object[] array && array.length == 2) {
            return Optional.of(new SimpleImmutableEntry<>(array[0], array[1]));
        }
        return Optional.empty();
    }
}
