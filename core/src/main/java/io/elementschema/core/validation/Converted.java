package io.elementschema.core.validation;

import io.elementschema.core.element.Element;

/**
 * Fails if the element has no usable value. Put it first in a validator list so that a type
 * problem is reported once instead of by every rule after it.
 */
public final class Converted extends Validator {

    public static final String KEY = "converted";
    public static final String MESSAGE = "Not a valid value.";

    public Converted() {
        this(MESSAGE);
    }

    public Converted(String message) {
        super(KEY, message);
    }

    @Override
    public boolean validate(Element<?> element, ValidationContext context) {
        if (isUnusable(element)) {
            noteError(element, context);
            return false;
        }
        return true;
    }
}
