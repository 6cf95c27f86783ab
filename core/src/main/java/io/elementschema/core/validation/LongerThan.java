package io.elementschema.core.validation;

import io.elementschema.core.element.Element;
import java.util.Map;

/**
 * Fails if the length of the value is equal to or less than {@code lowerbound}. The message
 * placeholder {@code {lowerbound}} is substituted.
 */
public final class LongerThan extends Validator {

    public static final String KEY = "longer-than";
    public static final String MESSAGE = "Must be longer than {lowerbound}.";

    private final int lowerbound;

    public LongerThan(int lowerbound) {
        this(lowerbound, MESSAGE);
    }

    public LongerThan(int lowerbound, String message) {
        super(KEY, message);
        this.lowerbound = lowerbound;
    }

    public int lowerbound() {
        return lowerbound;
    }

    @Override
    public boolean validate(Element<?> element, ValidationContext context) {
        if (isUnusable(element) || Values.length(element.value().get()) <= lowerbound) {
            noteError(element, message(), context, Map.of("lowerbound", lowerbound));
            return false;
        }
        return true;
    }
}
