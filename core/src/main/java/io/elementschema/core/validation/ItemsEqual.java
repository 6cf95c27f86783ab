package io.elementschema.core.validation;

import io.elementschema.core.element.Element;
import io.elementschema.core.error.ElementSchemaException.Operation;
import io.elementschema.core.error.InvalidArgumentException;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fails if two items of the value are unequal. For a map value the selectors are keys; for a
 * list value they are {@link Integer} indices. A missing item never equals anything. The
 * placeholders {@code {a}} and {@code {b}} are substituted with the operand labels.
 */
public final class ItemsEqual extends Validator {

    public static final String KEY = "items-equal";
    public static final String MESSAGE = "{a} and {b} must be equal.";

    private static final Object MISSING = new Object();

    private final Operand a;
    private final Operand b;

    public ItemsEqual(Operand a, Operand b) {
        this(a, b, MESSAGE);
    }

    public ItemsEqual(Operand a, Operand b, String message) {
        super(KEY, message);
        this.a = Objects.requireNonNull(a, "a must not be null");
        this.b = Objects.requireNonNull(b, "b must not be null");
    }

    @Override
    public boolean validate(Element<?> element, ValidationContext context) {
        if (!isUnusable(element)) {
            Object value = element.value().get();
            Object left = item(value, a.selector());
            Object right = item(value, b.selector());
            if (left != MISSING && right != MISSING && Objects.deepEquals(left, right)) {
                return true;
            }
        }
        noteError(element, message(), context, Map.of("a", a.label(), "b", b.label()));
        return false;
    }

    private static Object item(Object value, Object selector) {
        if (value instanceof Map<?, ?> map) {
            return map.containsKey(selector) ? map.get(selector) : MISSING;
        }
        if (value instanceof List<?> list) {
            if (!(selector instanceof Integer index)) {
                throw new InvalidArgumentException("List items are selected by Integer index", Operation.VALIDATE);
            }
            return index >= 0 && index < list.size() ? list.get(index) : MISSING;
        }
        throw new InvalidArgumentException(
                "Cannot select items from " + (value == null ? "null" : value.getClass().getSimpleName()),
                Operation.VALIDATE);
    }
}
