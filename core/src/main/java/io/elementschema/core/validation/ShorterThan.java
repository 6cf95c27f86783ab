package io.elementschema.core.validation;

import io.elementschema.core.element.Element;
import java.util.Map;

/**
 * Fails if the length of the value is equal to or greater than {@code upperbound}. The message
 * placeholder {@code {upperbound}} is substituted.
 */
public final class ShorterThan extends Validator {

    public static final String KEY = "shorter-than";
    public static final String MESSAGE = "Must be shorter than {upperbound}.";

    private final int upperbound;

    public ShorterThan(int upperbound) {
        this(upperbound, MESSAGE);
    }

    public ShorterThan(int upperbound, String message) {
        super(KEY, message);
        this.upperbound = upperbound;
    }

    public int upperbound() {
        return upperbound;
    }

    @Override
    public boolean validate(Element<?> element, ValidationContext context) {
        if (isUnusable(element) || Values.length(element.value().get()) >= upperbound) {
            noteError(element, message(), context, Map.of("upperbound", upperbound));
            return false;
        }
        return true;
    }
}
