package io.elementschema.core.element;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * A whole-number element coerced to {@link Long}.
 *
 * <p>Accepts integral numbers within {@code long} range, floating-point numbers without a
 * fractional part, and decimal strings (surrounding whitespace ignored). Booleans are rejected.
 */
public final class IntegerElement extends Scalar<Long> {

    public static final ElementType<IntegerElement> TYPE = IntegerElement::new;

    public IntegerElement() {}

    public IntegerElement(Object raw) {
        set(raw);
    }

    @Override
    protected ElementValue<Long> unserialize(Object raw) {
        if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            return ElementValue.of(((Number) raw).longValue());
        }
        if (raw instanceof BigInteger big) {
            return big.bitLength() < Long.SIZE ? ElementValue.of(big.longValue()) : ElementValue.notUnserializable();
        }
        if (raw instanceof BigDecimal decimal) {
            return exact(decimal);
        }
        if (raw instanceof Double || raw instanceof Float) {
            double d = ((Number) raw).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return ElementValue.notUnserializable();
            }
            return exact(BigDecimal.valueOf(d));
        }
        if (raw instanceof CharSequence text) {
            try {
                return ElementValue.of(Long.parseLong(text.toString().trim()));
            } catch (NumberFormatException e) {
                return ElementValue.notUnserializable();
            }
        }
        return ElementValue.notUnserializable();
    }

    private static ElementValue<Long> exact(BigDecimal decimal) {
        try {
            return ElementValue.of(decimal.longValueExact());
        } catch (ArithmeticException e) {
            return ElementValue.notUnserializable();
        }
    }
}
