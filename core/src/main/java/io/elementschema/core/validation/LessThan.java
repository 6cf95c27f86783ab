package io.elementschema.core.validation;

import io.elementschema.core.element.Element;
import java.util.Map;

/**
 * Fails if the value is equal to or greater than {@code upperbound}. The message placeholder
 * {@code {upperbound}} is substituted.
 */
public final class LessThan extends Validator {

    public static final String KEY = "less-than";
    public static final String MESSAGE = "Must be less than {upperbound}.";

    private final Comparable<?> upperbound;

    public LessThan(Comparable<?> upperbound) {
        this(upperbound, MESSAGE);
    }

    public LessThan(Comparable<?> upperbound, String message) {
        super(KEY, message);
        this.upperbound = upperbound;
    }

    @Override
    public boolean validate(Element<?> element, ValidationContext context) {
        if (isUnusable(element) || Values.compare(element.value().get(), upperbound) >= 0) {
            noteError(element, message(), context, Map.of("upperbound", upperbound));
            return false;
        }
        return true;
    }
}
