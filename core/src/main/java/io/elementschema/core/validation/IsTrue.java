package io.elementschema.core.validation;

import io.elementschema.core.element.Element;

/** Fails if the value is unusable or falsy (see {@link Values#isTruthy}). */
public final class IsTrue extends Validator {

    public static final String KEY = "is-true";
    public static final String MESSAGE = "Must be true.";

    public IsTrue() {
        this(MESSAGE);
    }

    public IsTrue(String message) {
        super(KEY, message);
    }

    @Override
    public boolean validate(Element<?> element, ValidationContext context) {
        if (isUnusable(element) || !Values.isTruthy(element.value().get())) {
            noteError(element, context);
            return false;
        }
        return true;
    }
}
