package io.elementschema.core.element;

import java.util.Arrays;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * The value held by an element: either a present value (which may be {@code null}, e.g. a JSON
 * null) or one of the two {@link Sentinel}s.
 *
 * <p>Instances are immutable. Equality compares the state and, for present values, the value
 * itself (arrays by content).
 *
 * @param <T> the type of a present value
 */
public final class ElementValue<T> {

    private static final ElementValue<?> UNSPECIFIED = new ElementValue<>(Sentinel.UNSPECIFIED, null);
    private static final ElementValue<?> NOT_UNSERIALIZABLE =
            new ElementValue<>(Sentinel.NOT_UNSERIALIZABLE, null);

    private final Sentinel sentinel; // null when present
    private final T value;

    private ElementValue(Sentinel sentinel, T value) {
        this.sentinel = sentinel;
        this.value = value;
    }

    /** A present value. {@code null} is a legal present value. */
    public static <T> ElementValue<T> of(T value) {
        return new ElementValue<>(null, value);
    }

    @SuppressWarnings("unchecked")
    public static <T> ElementValue<T> unspecified() {
        return (ElementValue<T>) UNSPECIFIED;
    }

    @SuppressWarnings("unchecked")
    public static <T> ElementValue<T> notUnserializable() {
        return (ElementValue<T>) NOT_UNSERIALIZABLE;
    }

    /** Returns the value for the given sentinel. */
    public static <T> ElementValue<T> ofSentinel(Sentinel sentinel) {
        Objects.requireNonNull(sentinel, "sentinel must not be null");
        return sentinel == Sentinel.UNSPECIFIED ? unspecified() : notUnserializable();
    }

    public boolean isPresent() {
        return sentinel == null;
    }

    public boolean isUnspecified() {
        return sentinel == Sentinel.UNSPECIFIED;
    }

    public boolean isNotUnserializable() {
        return sentinel == Sentinel.NOT_UNSERIALIZABLE;
    }

    /** True for either sentinel: there is nothing a business rule could check. */
    public boolean isUnusable() {
        return sentinel != null;
    }

    /** The sentinel, or empty if a value is present. */
    public Optional<Sentinel> sentinel() {
        return Optional.ofNullable(sentinel);
    }

    /**
     * Returns the present value.
     *
     * @throws NoSuchElementException if this is a sentinel
     */
    public T get() {
        if (sentinel != null) {
            throw new NoSuchElementException("No value present: " + sentinel);
        }
        return value;
    }

    public T orElse(T other) {
        return sentinel == null ? value : other;
    }

    /** Maps a present value; sentinels pass through unchanged. */
    public <R> ElementValue<R> map(Function<? super T, ? extends R> mapper) {
        if (sentinel != null) {
            return ofSentinel(sentinel);
        }
        return of(mapper.apply(value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ElementValue<?> that)) return false;
        return sentinel == that.sentinel && Objects.deepEquals(value, that.value);
    }

    @Override
    public int hashCode() {
        if (value instanceof byte[] bytes) {
            return Objects.hash(sentinel, Arrays.hashCode(bytes));
        }
        return Objects.hash(sentinel, value);
    }

    @Override
    public String toString() {
        if (sentinel != null) {
            return "ElementValue[" + sentinel + "]";
        }
        return "ElementValue[" + (value instanceof byte[] bytes ? Arrays.toString(bytes) : value) + "]";
    }
}
