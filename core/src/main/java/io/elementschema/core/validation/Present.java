package io.elementschema.core.validation;

import io.elementschema.core.element.Element;

/** Fails if no raw input was ever supplied. */
public final class Present extends Validator {

    public static final String KEY = "present";
    public static final String MESSAGE = "May not be blank.";

    public Present() {
        this(MESSAGE);
    }

    public Present(String message) {
        super(KEY, message);
    }

    @Override
    public boolean validate(Element<?> element, ValidationContext context) {
        if (element.value().isUnspecified()) {
            noteError(element, context);
            return false;
        }
        return true;
    }
}
