package io.elementschema.core.validation;

import io.elementschema.core.element.Element;

/** Fails if the value is unusable or truthy (see {@link Values#isTruthy}). */
public final class IsFalse extends Validator {

    public static final String KEY = "is-false";
    public static final String MESSAGE = "Must be false.";

    public IsFalse() {
        this(MESSAGE);
    }

    public IsFalse(String message) {
        super(KEY, message);
    }

    @Override
    public boolean validate(Element<?> element, ValidationContext context) {
        if (isUnusable(element) || Values.isTruthy(element.value().get())) {
            noteError(element, context);
            return false;
        }
        return true;
    }
}
