package io.elementschema.core.validation;

import io.elementschema.core.element.Element;
import io.elementschema.core.element.ElementValue;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Objects;

/**
 * Fails if the value is not one of {@code options}.
 *
 * <p>Numbers match numerically across types, so {@code 2L} is among {@code List.of(1, 2, 3)}; any
 * other value matches by equality.
 *
 * <p>There is no unusable-value guard here: an unspecified or unconvertible value is simply not
 * among the options and reported with this validator's message.
 */
public final class ContainedIn extends Validator {

    public static final String KEY = "contained-in";
    public static final String MESSAGE = "Not a valid value.";

    private final Collection<?> options;

    public ContainedIn(Collection<?> options) {
        this(options, MESSAGE);
    }

    public ContainedIn(Collection<?> options, String message) {
        super(KEY, message);
        this.options = Collections.unmodifiableList(new ArrayList<>(options));
    }

    public Collection<?> options() {
        return options;
    }

    @Override
    public boolean validate(Element<?> element, ValidationContext context) {
        ElementValue<?> value = element.value();
        if (!value.isPresent() || !contains(value.get())) {
            noteError(element, context);
            return false;
        }
        return true;
    }

    private boolean contains(Object value) {
        for (Object option : options) {
            boolean match = option instanceof Number && value instanceof Number
                    ? Values.compare(option, value) == 0
                    : Objects.deepEquals(option, value);
            if (match) {
                return true;
            }
        }
        return false;
    }
}
