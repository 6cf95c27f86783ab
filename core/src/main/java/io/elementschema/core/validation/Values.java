package io.elementschema.core.validation;

import io.elementschema.core.error.ElementSchemaException.Operation;
import io.elementschema.core.error.InvalidArgumentException;
import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Map;

/**
 * Value helpers shared by the validator library.
 *
 * <p>Thread-safe: stateless utility class.
 */
public final class Values {

    private Values() {}

    /**
     * Determines if a coerced value is truthy.
     *
     * <ul>
     * <li>{@code null} → falsy</li>
     * <li>{@code Boolean} → its own value</li>
     * <li>numbers → falsy when zero</li>
     * <li>text, collections, maps and arrays → falsy when empty</li>
     * <li>Any other non-null value → truthy</li>
     * </ul>
     */
    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof Number number) {
            return toBigDecimal(number).signum() != 0;
        }
        if (value instanceof CharSequence text) {
            return text.length() > 0;
        }
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value) > 0;
        }
        return true;
    }

    /**
     * The length of a text (in code points), collection, map or array.
     *
     * @throws InvalidArgumentException if the value has no length
     */
    public static int length(Object value) {
        if (value instanceof CharSequence text) {
            return Character.codePointCount(text, 0, text.length());
        }
        if (value instanceof Collection<?> collection) {
            return collection.size();
        }
        if (value instanceof Map<?, ?> map) {
            return map.size();
        }
        if (value != null && value.getClass().isArray()) {
            return Array.getLength(value);
        }
        throw new InvalidArgumentException(
                "Value of type " + typeOf(value) + " has no length", Operation.VALIDATE);
    }

    /**
     * Compares two values. Numbers of different classes compare numerically; anything else must be
     * mutually {@link Comparable}.
     *
     * @throws InvalidArgumentException if the values cannot be compared
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static int compare(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            if (isFloating(x) || isFloating(y)) {
                return Double.compare(x.doubleValue(), y.doubleValue());
            }
            return toBigDecimal(x).compareTo(toBigDecimal(y));
        }
        if (a instanceof Comparable comparable && b != null) {
            try {
                return comparable.compareTo(b);
            } catch (ClassCastException e) {
                throw new InvalidArgumentException(
                        "Cannot compare " + typeOf(a) + " with " + typeOf(b), e, Operation.VALIDATE);
            }
        }
        throw new InvalidArgumentException("Cannot compare " + typeOf(a) + " with " + typeOf(b), Operation.VALIDATE);
    }

    private static boolean isFloating(Number n) {
        return n instanceof Double || n instanceof Float;
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal decimal) {
            return decimal;
        }
        if (n instanceof BigInteger big) {
            return new BigDecimal(big);
        }
        if (isFloating(n)) {
            double d = n.doubleValue();
            return Double.isFinite(d) ? BigDecimal.valueOf(d) : BigDecimal.ONE;
        }
        return BigDecimal.valueOf(n.longValue());
    }

    private static String typeOf(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
