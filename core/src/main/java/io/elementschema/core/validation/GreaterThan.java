package io.elementschema.core.validation;

import io.elementschema.core.element.Element;
import java.util.Map;

/**
 * Fails if the value is equal to or less than {@code lowerbound}. The message placeholder
 * {@code {lowerbound}} is substituted.
 */
public final class GreaterThan extends Validator {

    public static final String KEY = "greater-than";
    public static final String MESSAGE = "Must be greater than {lowerbound}.";

    private final Comparable<?> lowerbound;

    public GreaterThan(Comparable<?> lowerbound) {
        this(lowerbound, MESSAGE);
    }

    public GreaterThan(Comparable<?> lowerbound, String message) {
        super(KEY, message);
        this.lowerbound = lowerbound;
    }

    @Override
    public boolean validate(Element<?> element, ValidationContext context) {
        if (isUnusable(element) || Values.compare(element.value().get(), lowerbound) <= 0) {
            noteError(element, message(), context, Map.of("lowerbound", lowerbound));
            return false;
        }
        return true;
    }
}
